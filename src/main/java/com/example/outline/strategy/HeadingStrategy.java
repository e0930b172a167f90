package com.example.outline.strategy;

/**
 * Judges whether a single line of text is a section heading.
 */
public interface HeadingStrategy {

    String getName();

    /**
     * Confidence in [0, 1] that the line is a heading; 0 means no match.
     */
    double evaluate(String line);

    long getMatchesFound();

    long getTotalChecks();
}
