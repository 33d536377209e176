package dev.interestmap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-area scores in [0,1] where the largest value, if any, is exactly 1.0.
 * Areas without support are absent rather than present at zero.
 */
@ToString
@EqualsAndHashCode
public final class ScoreMap {

    private static final ScoreMap EMPTY = new ScoreMap(Map.of());

    private final Map<String, Double> scores;

    private ScoreMap(Map<String, Double> scores) {
        this.scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static ScoreMap empty() {
        return EMPTY;
    }

    /**
     * Divides every positive raw value by the largest one. Non-positive and
     * non-finite values are dropped; an all-zero input yields the empty map.
     */
    public static ScoreMap normalize(Map<String, Double> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        double max = 0.0;
        for (double value : raw.values()) {
            if (Double.isFinite(value) && value > max) {
                max = value;
            }
        }
        if (max <= 0.0) {
            return EMPTY;
        }
        Map<String, Double> normalized = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            double value = entry.getValue();
            if (Double.isFinite(value) && value > 0.0) {
                normalized.put(entry.getKey(), value / max);
            }
        }
        return new ScoreMap(normalized);
    }

    /**
     * Wraps values that already satisfy the contract.
     *
     * @throws IllegalArgumentException if a value is outside (0,1] or the
     *                                  maximum is not 1.0
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ScoreMap of(Map<String, Double> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        double max = 0.0;
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            Double value = entry.getValue();
            if (value == null || !(value > 0.0 && value <= 1.0)) {
                throw new IllegalArgumentException("Score for '" + entry.getKey() + "' outside (0,1]: " + value);
            }
            max = Math.max(max, value);
        }
        if (max != 1.0) {
            throw new IllegalArgumentException("Score map is not max-normalized, top value: " + max);
        }
        return new ScoreMap(values);
    }

    public double get(String area) {
        return scores.getOrDefault(area, 0.0);
    }

    public boolean contains(String area) {
        return scores.containsKey(area);
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    public int size() {
        return scores.size();
    }

    public Set<String> areas() {
        return scores.keySet();
    }

    @JsonValue
    public Map<String, Double> asMap() {
        return scores;
    }
}
