package dev.interestmap.service;

import dev.interestmap.ai.TextClassifier;
import dev.interestmap.config.MappingConfig;
import dev.interestmap.metrics.MappingMetrics;
import dev.interestmap.model.AnalysisDetails;
import dev.interestmap.model.AreaContribution;
import dev.interestmap.model.MappingMethod;
import dev.interestmap.model.MappingResult;
import dev.interestmap.model.QuestionCatalog;
import dev.interestmap.model.QuestionResponse;
import dev.interestmap.model.ScoreMap;
import dev.interestmap.model.TextAnalysis;
import dev.interestmap.service.ScoreCombiner.Weights;
import dev.interestmap.text.TextNormalizer;
import dev.interestmap.text.TextQualityEstimator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Main orchestration service for hybrid interest mapping.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InterestMappingEngine {

    private final QuestionnaireScorer questionnaireScorer;
    private final ScoreCombiner scoreCombiner;
    private final TextNormalizer textNormalizer;
    private final TextQualityEstimator textQualityEstimator;
    private final TextClassifier textClassifier;
    private final MappingConfig mappingConfig;
    private final MappingMetrics metrics;

    /**
     * Map a learner's questionnaire responses and optional self-description to
     * a ranked distribution over interest areas.
     *
     * @param responses answers, at most one per question
     * @param catalog   questions the answers refer to
     * @param freeText  optional free text, may be null
     * @return explainable mapping result
     * @throws InvalidResponseException if the responses are invalid
     */
    public MappingResult mapInterests(List<QuestionResponse> responses, QuestionCatalog catalog, String freeText) {
        ScoreMap questionnaireScores = scoreValidated(responses, catalog);

        TextSignal text = analyseText(freeText);
        ScoreMap combinedScores = scoreCombiner.combine(questionnaireScores, text.scores(), text.quality());

        AreaRanking ranking = AreaRanking.of(catalog.getAreaOrder(), textClassifier.labels());
        List<String> ranked = ranking.rank(combinedScores);
        String recommended = ranked.isEmpty() ? null : ranked.get(0);
        double confidence = recommended == null ? 0.0 : combinedScores.get(recommended);

        List<AreaContribution> topAreas = ranked.stream()
                .limit(mappingConfig.getTopAreas())
                .map(area -> AreaContribution.of(area, combinedScores.get(area), questionnaireScores, text.scores()))
                .toList();

        MappingMethod method = text.scores().isEmpty() ? MappingMethod.QUESTIONNAIRE_ONLY : MappingMethod.HYBRID;
        Weights weights = method == MappingMethod.HYBRID
                ? scoreCombiner.effectiveWeights(text.quality())
                : new Weights(1.0, 0.0);
        AnalysisDetails details = new AnalysisDetails(
                method,
                weights.questionnaire(),
                weights.text(),
                questionnaireScores.size(),
                text.scores().size(),
                agreement(questionnaireScores, text.scores(), ranking));

        metrics.recordMapping(method, confidence);
        log.debug("Mapped interests via {}: recommended={} confidence={} agreement={}",
                method, recommended, confidence, details.agreementScore());

        return MappingResult.builder()
                .questionnaireScores(questionnaireScores)
                .textScores(text.scores())
                .combinedScores(combinedScores)
                .textQuality(text.quality())
                .recommendedArea(recommended)
                .confidence(confidence)
                .topAreas(topAreas)
                .analysisDetails(details)
                .build();
    }

    /**
     * Score the questionnaire alone.
     *
     * @throws InvalidResponseException if the responses are invalid
     */
    public ScoreMap scoreQuestionnaire(List<QuestionResponse> responses, QuestionCatalog catalog) {
        return scoreValidated(responses, catalog);
    }

    /**
     * Classify free text on its own and report how far it can be trusted.
     */
    public TextAnalysis analyzeText(String freeText) {
        TextSignal text = analyseText(freeText);
        if (text.processed().isEmpty()) {
            return TextAnalysis.none(text.processed());
        }
        List<String> ranked = AreaRanking.of(List.of(), textClassifier.labels()).rank(text.scores());
        return new TextAnalysis(text.scores(), ranked.isEmpty() ? null : ranked.get(0),
                text.quality(), text.processed());
    }

    private ScoreMap scoreValidated(List<QuestionResponse> responses, QuestionCatalog catalog) {
        try {
            return questionnaireScorer.score(responses, catalog);
        } catch (InvalidResponseException e) {
            metrics.recordValidationFailure();
            log.debug("Rejected submission: {}", e.getMessage());
            throw e;
        }
    }

    private TextSignal analyseText(String freeText) {
        String processed = textNormalizer.normalize(freeText);
        if (TextNormalizer.length(processed) < mappingConfig.getMinTextLength()) {
            return new TextSignal(processed, ScoreMap.empty(), 0.0);
        }
        double quality = textQualityEstimator.estimate(freeText, processed, textClassifier.keywordTerms());
        ScoreMap scores = textClassifier.classify(processed);
        return new TextSignal(processed, scores, quality);
    }

    /**
     * Share of the top areas both sources agree on, 0 if either is empty.
     */
    private double agreement(ScoreMap questionnaire, ScoreMap text, AreaRanking ranking) {
        if (questionnaire.isEmpty() || text.isEmpty()) {
            return 0.0;
        }
        int size = mappingConfig.getTopAreas();
        Set<String> overlap = new HashSet<>(ranking.top(questionnaire, size));
        overlap.retainAll(ranking.top(text, size));
        return (double) overlap.size() / size;
    }

    private record TextSignal(String processed, ScoreMap scores, double quality) {
    }
}
