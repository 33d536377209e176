package dev.interestmap.model;

/**
 * Which signals produced the combined scores of a mapping.
 */
public enum MappingMethod {
    HYBRID,
    QUESTIONNAIRE_ONLY
}
