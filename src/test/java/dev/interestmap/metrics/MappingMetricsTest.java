package dev.interestmap.metrics;

import dev.interestmap.model.MappingMethod;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MappingMetricsTest {

    private MeterRegistry meterRegistry;
    private MappingMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MappingMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Mapping counters")
    class MappingCountersTests {

        @Test
        @DisplayName("Should count mappings by method")
        void shouldCountMappingsByMethod() {
            metrics.recordMapping(MappingMethod.HYBRID, 0.9);
            metrics.recordMapping(MappingMethod.QUESTIONNAIRE_ONLY, 1.0);
            metrics.recordMapping(MappingMethod.HYBRID, 0.8);

            assertThat(meterRegistry.counter("interest_mapper_mappings_total").count()).isEqualTo(3.0);
            assertThat(meterRegistry.counter("interest_mapper_mappings_by_method_total", "method", "hybrid").count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.counter("interest_mapper_mappings_by_method_total",
                    "method", "questionnaire_only").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should expose the last confidence as a gauge")
        void shouldExposeLastConfidence() {
            metrics.recordMapping(MappingMethod.HYBRID, 0.42);

            assertThat(meterRegistry.get("interest_mapper_last_confidence").gauge().value()).isEqualTo(0.42);
        }

        @Test
        @DisplayName("Should record validation failures")
        void shouldRecordValidationFailures() {
            metrics.recordValidationFailure();

            assertThat(meterRegistry.counter("interest_mapper_validation_failures_total").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Classification counters")
    class ClassificationCountersTests {

        @Test
        @DisplayName("Should count timeouts as failures too")
        void shouldCountTimeoutsAsFailures() {
            metrics.recordClassificationTimeout();
            metrics.recordClassificationFailure();

            assertThat(meterRegistry.counter("interest_mapper_text_classification_timeouts_total").count())
                    .isEqualTo(1.0);
            assertThat(meterRegistry.counter("interest_mapper_text_classification_failures_total").count())
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should record cache hits and misses")
        void shouldRecordCacheTraffic() {
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertThat(meterRegistry.counter("interest_mapper_text_cache_hits_total").count()).isEqualTo(1.0);
            assertThat(meterRegistry.counter("interest_mapper_text_cache_misses_total").count()).isEqualTo(2.0);
        }
    }

    @Test
    @DisplayName("Should record inference latency")
    void shouldRecordInferenceLatency() {
        metrics.recordInferenceLatency(Duration.ofMillis(120));

        assertThat(metrics.getInferenceTimer().count()).isEqualTo(1);
        assertThat(metrics.getInferenceTimer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(120.0);
    }
}
