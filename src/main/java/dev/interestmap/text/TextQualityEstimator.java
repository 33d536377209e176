package dev.interestmap.text;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores how far the free-text channel can be trusted, independently of the
 * classifier's own confidence. The result is the mean of four factors:
 * length adequacy, lexical diversity, keyword density and sentence structure.
 */
@Component
public class TextQualityEstimator {

    private static final String SENTENCE_PUNCTUATION = ".,!?;:";

    /**
     * @param rawText       text as typed by the learner, only inspected for punctuation
     * @param processedText normalized text, see {@link TextNormalizer}
     * @param keywordTerms  terms of the artifact's keyword table
     * @return quality in [0,1]; 0.0 for empty text
     */
    public double estimate(String rawText, String processedText, Set<String> keywordTerms) {
        if (processedText == null || processedText.isBlank()) {
            return 0.0;
        }
        List<String> words = List.of(processedText.trim().split("\\s+"));
        int wordCount = words.size();

        double length = lengthFactor(wordCount);
        double diversity = Math.min((double) new HashSet<>(words).size() / wordCount * 2, 1.0);
        long keywordHits = words.stream().filter(keywordTerms::contains).count();
        double density = Math.min((double) keywordHits / wordCount * 10, 1.0);
        double structure = hasSentencePunctuation(rawText) ? 1.0 : 0.7;

        return (length + diversity + density + structure) / 4.0;
    }

    static double lengthFactor(int wordCount) {
        if (wordCount < 10) {
            return 0.3;
        }
        if (wordCount < 20) {
            return 0.6;
        }
        if (wordCount <= 200) {
            return 1.0;
        }
        return 0.8;
    }

    private static boolean hasSentencePunctuation(String rawText) {
        if (rawText == null) {
            return false;
        }
        for (int i = 0; i < rawText.length(); i++) {
            if (SENTENCE_PUNCTUATION.indexOf(rawText.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
