package dev.interestmap.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import dev.interestmap.model.ScoreMap;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Size-bounded cache with a time-to-live per entry, backed by Caffeine.
 */
@Slf4j
public class CaffeineTextScoreCache implements TextScoreCache {

    private final int maxSize;
    private final Cache<String, ScoreMap> cache;

    // Caffeine counters are cumulative; clear() moves the baseline instead.
    private volatile com.github.benmanes.caffeine.cache.stats.CacheStats baseline =
            com.github.benmanes.caffeine.cache.stats.CacheStats.empty();

    public CaffeineTextScoreCache(int maxSize, Duration ttl) {
        this(maxSize, ttl, Ticker.systemTicker(), null);
    }

    CaffeineTextScoreCache(int maxSize, Duration ttl, Ticker ticker, Executor executor) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .recordStats()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker);
        if (executor != null) {
            builder.executor(executor);
        }
        this.cache = builder.build();
    }

    @Override
    public Optional<ScoreMap> get(String processedText) {
        return Optional.ofNullable(cache.getIfPresent(processedText));
    }

    @Override
    public void put(String processedText, ScoreMap scores) {
        cache.put(processedText, scores);
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
        baseline = cache.stats();
        log.debug("Text score cache cleared");
    }

    @Override
    public CacheStats stats() {
        cache.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats current = cache.stats().minus(baseline);
        return new CacheStats((int) cache.estimatedSize(), maxSize, current.hitCount(), current.missCount());
    }
}
