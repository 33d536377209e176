package dev.interestmap.model;

/**
 * One ranked entry of a mapping result, with the per-source scores that fed it.
 */
public record AreaContribution(
        String area,
        double score,
        double percentage,
        double questionnaireContribution,
        double textContribution) {

    public static AreaContribution of(String area, double score, ScoreMap questionnaire, ScoreMap text) {
        return new AreaContribution(area, score, score * 100.0, questionnaire.get(area), text.get(area));
    }
}
