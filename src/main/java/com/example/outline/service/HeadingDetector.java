package com.example.outline.service;

import com.example.outline.model.HeadingMatch;
import com.example.outline.strategy.HeadingStrategy;
import com.example.outline.strategy.impl.AllCapsHeadingStrategy;
import com.example.outline.strategy.impl.MixedCapsHeadingStrategy;
import com.example.outline.strategy.impl.NumberedHeadingStrategy;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs every registered {@link HeadingStrategy} over a line and keeps the most confident one.
 * Ties go to the strategy registered first.
 */
public class HeadingDetector {

    private final List<HeadingStrategy> strategies = new CopyOnWriteArrayList<>();

    public HeadingDetector(List<HeadingStrategy> strategies) {
        this.strategies.addAll(strategies);
    }

    public static HeadingDetector withDefaultStrategies() {
        return new HeadingDetector(Arrays.asList(
                new NumberedHeadingStrategy(),
                new AllCapsHeadingStrategy(),
                new MixedCapsHeadingStrategy()));
    }

    public void addStrategy(HeadingStrategy strategy) {
        strategies.add(strategy);
    }

    public List<HeadingStrategy> getStrategies() {
        return Collections.unmodifiableList(strategies);
    }

    public Optional<String> detect(String line) {
        return detectMatch(line).map(HeadingMatch::getHeading);
    }

    public Optional<HeadingMatch> detectMatch(String line) {
        if (line == null || line.trim().isEmpty()) {
            return Optional.empty();
        }
        String trimmed = line.trim();

        HeadingStrategy best = null;
        double bestConfidence = 0.0;
        for (HeadingStrategy strategy : strategies) {
            double confidence = strategy.evaluate(trimmed);
            // 严格大于：置信度相同时保留先注册的策略
            if (confidence > bestConfidence) {
                best = strategy;
                bestConfidence = confidence;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new HeadingMatch(trimmed, best.getName(), bestConfidence));
    }

    /**
     * Per strategy {@code [matchesFound, totalChecks]}, in registration order.
     */
    public Map<String, long[]> getStrategyStats() {
        Map<String, long[]> stats = new LinkedHashMap<>();
        for (HeadingStrategy strategy : strategies) {
            stats.put(strategy.getName(), new long[]{strategy.getMatchesFound(), strategy.getTotalChecks()});
        }
        return stats;
    }
}
