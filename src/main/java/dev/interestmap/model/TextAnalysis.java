package dev.interestmap.model;

/**
 * Result of analysing free text on its own, without a questionnaire.
 */
public record TextAnalysis(ScoreMap textScores, String topArea, double textQuality, String processedText) {

    public static TextAnalysis none(String processedText) {
        return new TextAnalysis(ScoreMap.empty(), null, 0.0, processedText);
    }
}
