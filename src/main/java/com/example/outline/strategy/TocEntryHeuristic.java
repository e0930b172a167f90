package com.example.outline.strategy;

/**
 * Decides whether a title recovered by a loose pattern reads like a real TOC entry rather than
 * a line of body text or table data that happens to end in a number.
 */
public interface TocEntryHeuristic {

    boolean looksGenuine(String title);
}
