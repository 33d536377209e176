package dev.interestmap.service;

import dev.interestmap.config.MappingConfig;
import dev.interestmap.model.Question;
import dev.interestmap.model.QuestionCatalog;
import dev.interestmap.model.QuestionOption;
import dev.interestmap.model.QuestionResponse;
import dev.interestmap.model.ScoreMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service for scoring structured questionnaire responses against interest areas.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionnaireScorer {

    private final MappingConfig mappingConfig;

    /**
     * Score responses against the catalog they reference.
     *
     * @param responses answers in submission order
     * @param catalog   questions the answers refer to
     * @return max-normalized area scores, empty if no selected option maps to an area
     * @throws InvalidResponseException if any response is invalid; nothing is scored in that case
     */
    public ScoreMap score(List<QuestionResponse> responses, QuestionCatalog catalog) {
        validate(responses, catalog);

        // area -> (question id -> contribution), both in first-seen order
        Map<String, Map<Integer, Double>> contributions = new LinkedHashMap<>();
        for (QuestionResponse response : responses) {
            Question question = catalog.find(response.questionId()).orElseThrow();
            double questionWeight = mappingConfig.getQuestionWeight(response.questionId());
            int selectedCount = response.selectedOptions().size();

            for (String optionId : response.selectedOptions()) {
                QuestionOption option = question.getOption(optionId);
                if (!option.hasArea()) {
                    continue;
                }
                double contribution = (questionWeight * option.getWeight()) / selectedCount;
                contributions.computeIfAbsent(option.getArea(), a -> new LinkedHashMap<>())
                        .merge(response.questionId(), contribution, Double::sum);
            }
        }

        Map<String, Double> raw = new LinkedHashMap<>();
        for (Map.Entry<String, Map<Integer, Double>> entry : contributions.entrySet()) {
            String area = entry.getKey();
            Set<Integer> appearances = entry.getValue().keySet();

            double base = 0.0;
            for (double contribution : entry.getValue().values()) {
                base += contribution;
            }
            double multiplier = consistencyMultiplier(appearances.size());
            if (isHobbyOnly(appearances) && mappingConfig.getHobbyPenalties().containsKey(area)) {
                multiplier *= mappingConfig.getHobbyPenalties().get(area);
            }
            raw.put(area, base * multiplier);
        }

        log.debug("Questionnaire raw scores: {}", raw);
        return ScoreMap.normalize(raw);
    }

    /**
     * Reject the submission if any response references an unknown question or
     * option, selects nothing, or repeats a question or an option.
     */
    public void validate(List<QuestionResponse> responses, QuestionCatalog catalog) {
        Set<Integer> seen = new HashSet<>();
        for (QuestionResponse response : responses) {
            int questionId = response.questionId();
            Question question = catalog.find(questionId).orElseThrow(() ->
                    new InvalidResponseException(questionId, "Unknown question: " + questionId));
            if (!seen.add(questionId)) {
                throw new InvalidResponseException(questionId, "Duplicate response for question " + questionId);
            }
            if (response.selectedOptions().isEmpty()) {
                throw new InvalidResponseException(questionId, "No option selected for question " + questionId);
            }
            Set<String> selected = new HashSet<>();
            for (String optionId : response.selectedOptions()) {
                if (question.getOption(optionId) == null) {
                    throw new InvalidResponseException(questionId, optionId,
                            "Unknown option '" + optionId + "' for question " + questionId);
                }
                if (!selected.add(optionId)) {
                    throw new InvalidResponseException(questionId, optionId,
                            "Duplicate option '" + optionId + "' for question " + questionId);
                }
            }
        }
    }

    /**
     * Multiplier for an area supported by {@code supportingQuestions} distinct
     * questions. Counts beyond the largest configured key reuse its value.
     */
    double consistencyMultiplier(int supportingQuestions) {
        Map<Integer, Double> bonus = mappingConfig.getConsistencyBonus();
        Double exact = bonus.get(supportingQuestions);
        if (exact != null) {
            return exact;
        }
        int bestKey = Integer.MIN_VALUE;
        double value = 1.0;
        for (Map.Entry<Integer, Double> entry : bonus.entrySet()) {
            if (entry.getKey() <= supportingQuestions && entry.getKey() > bestKey) {
                bestKey = entry.getKey();
                value = entry.getValue();
            }
        }
        return value;
    }

    private boolean isHobbyOnly(Set<Integer> appearances) {
        return appearances.size() == 1 && appearances.contains(mappingConfig.getHobbyQuestionId());
    }
}
