package dev.interestmap.metrics;

import dev.interestmap.model.MappingMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus metrics for interest mapping operations.
 */
@Component
public class MappingMetrics {

    private static final String TAG_METHOD = "method";
    private final MeterRegistry registry;

    // Counters
    private final Counter mappingsCounter;
    private final Counter validationFailuresCounter;
    private final Counter classificationsCounter;
    private final Counter classificationFailuresCounter;
    private final Counter classificationTimeoutsCounter;
    private final Counter cacheHitsCounter;
    private final Counter cacheMissesCounter;

    // Timers
    private final Timer inferenceTimer;

    // Gauges
    private final AtomicLong lastConfidenceBits = new AtomicLong(Double.doubleToLongBits(0.0));

    public MappingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.mappingsCounter = Counter.builder("interest_mapper_mappings_total")
                .description("Total interest mappings produced")
                .register(registry);

        this.validationFailuresCounter = Counter.builder("interest_mapper_validation_failures_total")
                .description("Total submissions rejected by questionnaire validation")
                .register(registry);

        this.classificationsCounter = Counter.builder("interest_mapper_text_classifications_total")
                .description("Total free-text classifications run through the model")
                .register(registry);

        this.classificationFailuresCounter = Counter.builder("interest_mapper_text_classification_failures_total")
                .description("Total free-text classifications degraded to no text signal")
                .register(registry);

        this.classificationTimeoutsCounter = Counter.builder("interest_mapper_text_classification_timeouts_total")
                .description("Total free-text classifications that exceeded the inference timeout")
                .register(registry);

        this.cacheHitsCounter = Counter.builder("interest_mapper_text_cache_hits_total")
                .description("Text score cache hits")
                .register(registry);

        this.cacheMissesCounter = Counter.builder("interest_mapper_text_cache_misses_total")
                .description("Text score cache misses")
                .register(registry);

        this.inferenceTimer = Timer.builder("interest_mapper_inference_duration")
                .description("Time spent embedding and classifying free text")
                .register(registry);

        Gauge.builder("interest_mapper_last_confidence", lastConfidenceBits,
                        bits -> Double.longBitsToDouble(bits.get()))
                .description("Confidence of the most recent recommendation")
                .register(registry);
    }

    /**
     * Record a completed mapping.
     */
    public void recordMapping(MappingMethod method, double confidence) {
        mappingsCounter.increment();
        Counter.builder("interest_mapper_mappings_by_method_total")
                .tag(TAG_METHOD, method.name().toLowerCase())
                .register(registry)
                .increment();
        lastConfidenceBits.set(Double.doubleToLongBits(confidence));
    }

    public void recordValidationFailure() {
        validationFailuresCounter.increment();
    }

    public void recordClassification() {
        classificationsCounter.increment();
    }

    public void recordClassificationFailure() {
        classificationFailuresCounter.increment();
    }

    public void recordClassificationTimeout() {
        classificationTimeoutsCounter.increment();
        classificationFailuresCounter.increment();
    }

    public void recordCacheHit() {
        cacheHitsCounter.increment();
    }

    public void recordCacheMiss() {
        cacheMissesCounter.increment();
    }

    public void recordInferenceLatency(Duration duration) {
        inferenceTimer.record(duration);
    }

    public Timer getInferenceTimer() {
        return inferenceTimer;
    }
}
