package dev.interestmap.ai;

import dev.interestmap.model.ScoreMap;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Set;

/**
 * No-op implementation of TextClassifier.
 * Used when no compatible model is available; mappings run questionnaire-only.
 */
@Slf4j
public class NoOpTextClassifier implements TextClassifier {

    public NoOpTextClassifier() {
        log.info("Text classification disabled - using questionnaire-only scoring");
    }

    @Override
    public ScoreMap classify(String processedText) {
        return ScoreMap.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public Set<String> keywordTerms() {
        return Set.of();
    }

    @Override
    public List<String> labels() {
        return List.of();
    }
}
