package dev.interestmap.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import dev.interestmap.model.ScoreMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineTextScoreCacheTest {

    private static final ScoreMap TECH = ScoreMap.of(Map.of("Tech", 1.0));
    private static final ScoreMap ARTS = ScoreMap.of(Map.of("Arts", 1.0));

    private ManualTicker ticker;

    @BeforeEach
    void setUp() {
        ticker = new ManualTicker();
    }

    private CaffeineTextScoreCache cache(int maxSize, Duration ttl) {
        return new CaffeineTextScoreCache(maxSize, ttl, ticker, Runnable::run);
    }

    @Test
    @DisplayName("Should return stored scores")
    void shouldReturnStoredScores() {
        CaffeineTextScoreCache cache = cache(10, Duration.ofHours(1));
        cache.put("gosto de programar", TECH);

        assertThat(cache.get("gosto de programar")).contains(TECH);
        assertThat(cache.get("gosto de arte")).isEmpty();
        assertThat(cache.stats()).isEqualTo(new TextScoreCache.CacheStats(1, 10, 1, 1));
    }

    @Test
    @DisplayName("Should never hold more entries than the maximum size")
    void shouldBoundSize() {
        CaffeineTextScoreCache cache = cache(2, Duration.ofHours(1));
        cache.put("a", TECH);
        cache.put("b", ARTS);
        cache.put("c", ARTS);
        cache.put("d", TECH);

        assertThat(cache.stats().size()).isEqualTo(2);
        assertThat(cache.stats().maxSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should expire entries once the ttl has elapsed")
    void shouldExpireEntries() {
        CaffeineTextScoreCache cache = cache(10, Duration.ofMinutes(30));
        cache.put("a", TECH);

        ticker.advance(Duration.ofMinutes(29));
        assertThat(cache.get("a")).isPresent();

        ticker.advance(Duration.ofMinutes(1));
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.stats().size()).isZero();
    }

    @Test
    @DisplayName("Should reset entries and counters on clear")
    void shouldClear() {
        CaffeineTextScoreCache cache = cache(10, Duration.ofHours(1));
        cache.put("a", TECH);
        cache.get("a");
        cache.get("b");

        cache.clear();

        assertThat(cache.stats()).isEqualTo(new TextScoreCache.CacheStats(0, 10, 0, 0));

        cache.get("a");
        assertThat(cache.stats().missCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should compute the hit rate")
    void shouldComputeHitRate() {
        assertThat(new TextScoreCache.CacheStats(1, 10, 3, 1).hitRate()).isEqualTo(0.75);
        assertThat(new TextScoreCache.CacheStats(0, 10, 0, 0).hitRate()).isZero();
    }

    @Test
    @DisplayName("Should reject non-positive sizes")
    void shouldRejectNonPositiveSize() {
        assertThatThrownBy(() -> new CaffeineTextScoreCache(0, Duration.ofHours(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("No-op cache never stores anything")
    void noOpCacheStoresNothing() {
        NoOpTextScoreCache cache = new NoOpTextScoreCache();
        cache.put("a", TECH);

        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.stats().size()).isZero();
    }

    private static final class ManualTicker implements Ticker {

        private final AtomicLong nanos = new AtomicLong();

        void advance(Duration duration) {
            nanos.addAndGet(duration.toNanos());
        }

        @Override
        public long read() {
            return nanos.get();
        }
    }
}
