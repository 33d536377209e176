package dev.interestmap.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Configuration for questionnaire scoring and score combination.
 * Loaded from application.yml under 'mapping' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "mapping")
public class MappingConfig {

    private double questionnaireWeight = 0.6;
    private double textWeight = 0.4;
    private double defaultQuestionWeight = 0.2;
    private Map<Integer, Double> questionWeights = new HashMap<>(Map.of(
            1, 0.15,
            2, 0.20,
            3, 0.30,
            4, 0.35,
            5, 0.40));
    // keyed by number of distinct supporting questions
    private Map<Integer, Double> consistencyBonus = new TreeMap<>(Map.of(
            1, 1.0,
            2, 1.1,
            3, 1.25,
            4, 1.4,
            5, 1.6));
    private int hobbyQuestionId = 1;
    // applied when the hobby question is an area's only support
    private Map<String, Double> hobbyPenalties = new HashMap<>(Map.of(
            "Sports and Physical Activities", 0.3,
            "Arts and Culture", 0.5,
            "Technology and Computing", 0.7,
            "Literature and Language", 0.8));
    private double agreementBonus = 1.2;
    private double agreementThreshold = 0.5;
    private int minTextLength = 10;
    private int topAreas = 3;

    public double getQuestionWeight(int questionId) {
        return questionWeights.getOrDefault(questionId, defaultQuestionWeight);
    }
}
