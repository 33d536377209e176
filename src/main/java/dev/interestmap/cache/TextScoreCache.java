package dev.interestmap.cache;

import dev.interestmap.model.ScoreMap;

import java.util.Optional;

/**
 * Memoizes text classification results keyed by processed text. Owned by a
 * single engine instance; never shared through static state.
 */
public interface TextScoreCache {

    Optional<ScoreMap> get(String processedText);

    void put(String processedText, ScoreMap scores);

    void clear();

    CacheStats stats();

    /**
     * Point-in-time counters.
     */
    record CacheStats(int size, int maxSize, long hitCount, long missCount) {

        public double hitRate() {
            long total = hitCount + missCount;
            return total > 0 ? (double) hitCount / total : 0.0;
        }
    }
}
