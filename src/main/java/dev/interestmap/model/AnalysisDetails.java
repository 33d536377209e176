package dev.interestmap.model;

/**
 * Explains how a mapping result was produced.
 *
 * @param questionnaireWeight weight given to questionnaire scores after renormalization
 * @param textWeight          weight given to text scores after quality adjustment and renormalization
 * @param agreementScore      overlap of the top areas of both sources, in [0,1]
 */
public record AnalysisDetails(
        MappingMethod method,
        double questionnaireWeight,
        double textWeight,
        int areasFromQuestionnaire,
        int areasFromText,
        double agreementScore) {
}
