package dev.interestmap.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a single interest mapping. Fully determined by its inputs and
 * the loaded model artifact.
 */
@Value
@Builder
public class MappingResult {
    ScoreMap questionnaireScores;
    ScoreMap textScores;
    ScoreMap combinedScores;
    double textQuality;

    // null when combinedScores is empty
    String recommendedArea;
    double confidence;

    List<AreaContribution> topAreas;
    AnalysisDetails analysisDetails;

    public boolean hasRecommendation() {
        return recommendedArea != null;
    }
}
