package com.example.outline.strategy.impl;

import com.example.outline.strategy.HeadingStrategy;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts checks and matches around {@link #score(String)}; subclasses only see trimmed,
 * non-empty lines.
 */
public abstract class AbstractHeadingStrategy implements HeadingStrategy {

    private final String name;
    private final AtomicLong totalChecks = new AtomicLong();
    private final AtomicLong matchesFound = new AtomicLong();

    protected AbstractHeadingStrategy(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public final double evaluate(String line) {
        totalChecks.incrementAndGet();
        if (line == null) {
            return 0.0;
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return 0.0;
        }
        double confidence = score(trimmed);
        if (confidence > 0) {
            matchesFound.incrementAndGet();
            return Math.min(1.0, confidence);
        }
        return 0.0;
    }

    protected abstract double score(String line);

    @Override
    public long getMatchesFound() {
        return matchesFound.get();
    }

    @Override
    public long getTotalChecks() {
        return totalChecks.get();
    }
}
