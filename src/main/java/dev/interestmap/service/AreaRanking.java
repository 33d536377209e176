package dev.interestmap.service;

import dev.interestmap.model.ScoreMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders areas by descending score. Equal scores fall back to a declared
 * area order (catalog first, then model labels), then to the area name.
 */
public final class AreaRanking {

    private final Map<String, Integer> declaredPosition;

    public AreaRanking(List<String> declaredOrder) {
        this.declaredPosition = new HashMap<>();
        for (String area : declaredOrder) {
            declaredPosition.putIfAbsent(area, declaredPosition.size());
        }
    }

    public static AreaRanking of(List<String> catalogOrder, List<String> labelOrder) {
        List<String> order = new ArrayList<>(catalogOrder);
        order.addAll(labelOrder);
        return new AreaRanking(order);
    }

    public List<String> rank(ScoreMap scores) {
        Comparator<String> byScore = Comparator.comparingDouble(scores::get);
        return scores.areas().stream()
                .sorted(byScore.reversed()
                        .thenComparingInt(area -> declaredPosition.getOrDefault(area, Integer.MAX_VALUE))
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    public List<String> top(ScoreMap scores, int limit) {
        List<String> ranked = rank(scores);
        return ranked.subList(0, Math.min(limit, ranked.size()));
    }
}
