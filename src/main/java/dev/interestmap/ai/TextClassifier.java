package dev.interestmap.ai;

import dev.interestmap.model.ScoreMap;

import java.util.List;
import java.util.Set;

/**
 * Interface for free-text classification.
 * Can be implemented by a model-backed or a no-op implementation.
 */
public interface TextClassifier {

    /**
     * Classify processed free text into areas.
     *
     * @param processedText output of the text normalizer
     * @return max-normalized scores, or an empty map when no text signal is available
     */
    ScoreMap classify(String processedText);

    /**
     * Check if model classification is available.
     *
     * @return true if a compatible model artifact and embedder were loaded
     */
    boolean isEnabled();

    /**
     * Terms of the loaded keyword table, empty when disabled.
     */
    Set<String> keywordTerms();

    /**
     * Labels of the loaded model in classifier output order, empty when disabled.
     */
    List<String> labels();
}
