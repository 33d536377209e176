package dev.interestmap.cache;

import dev.interestmap.model.ScoreMap;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled and in tests.
 */
public class NoOpTextScoreCache implements TextScoreCache {

    @Override
    public Optional<ScoreMap> get(String processedText) {
        return Optional.empty();
    }

    @Override
    public void put(String processedText, ScoreMap scores) {
        // nothing to store
    }

    @Override
    public void clear() {
        // nothing to clear
    }

    @Override
    public CacheStats stats() {
        return new CacheStats(0, 0, 0, 0);
    }
}
