package dev.interestmap.service;

import dev.interestmap.config.MappingConfig;
import dev.interestmap.model.ScoreMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Service for fusing questionnaire and text scores, with the text weight
 * scaled by text quality.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScoreCombiner {

    private final MappingConfig mappingConfig;

    /**
     * Weights after quality adjustment, summing to 1 unless both are zero.
     */
    public record Weights(double questionnaire, double text) {
    }

    public Weights effectiveWeights(double textQuality) {
        double quality = Math.max(0.0, Math.min(1.0, textQuality));
        double questionnaire = mappingConfig.getQuestionnaireWeight();
        double text = mappingConfig.getTextWeight() * quality;
        double total = questionnaire + text;
        if (total > 0) {
            questionnaire /= total;
            text /= total;
        }
        return new Weights(questionnaire, text);
    }

    /**
     * Combine both score maps.
     *
     * @return the questionnaire scores unchanged when text scores are empty,
     *         otherwise the max-normalized weighted blend
     */
    public ScoreMap combine(ScoreMap questionnaire, ScoreMap text, double textQuality) {
        if (text.isEmpty()) {
            return questionnaire;
        }
        Weights weights = effectiveWeights(textQuality);

        Set<String> areas = new LinkedHashSet<>(questionnaire.areas());
        areas.addAll(text.areas());

        Map<String, Double> combined = new LinkedHashMap<>();
        for (String area : areas) {
            double questionnaireScore = questionnaire.get(area);
            double textScore = text.get(area);
            double score = questionnaireScore * weights.questionnaire() + textScore * weights.text();
            if (questionnaireScore > mappingConfig.getAgreementThreshold()
                    && textScore > mappingConfig.getAgreementThreshold()) {
                score *= mappingConfig.getAgreementBonus();
            }
            combined.put(area, Math.min(score, 1.0));
        }

        log.debug("Combined scores (weights q={}, t={}): {}", weights.questionnaire(), weights.text(), combined);
        return ScoreMap.normalize(combined);
    }
}
