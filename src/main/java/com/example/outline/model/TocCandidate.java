package com.example.outline.model;

/**
 * A line that ends in a plausible page number but was not accepted by any structural pattern.
 * Kept for the fallback pass together with a heuristic confidence in [0, 1].
 */
public class TocCandidate {
    private final PageLine line;
    private final String title;
    private final int page;
    private final double confidence;

    public TocCandidate(PageLine line, String title, int page, double confidence) {
        this.line = line;
        this.title = title;
        this.page = page;
        this.confidence = confidence;
    }

    public PageLine getLine() {
        return line;
    }

    public String getTitle() {
        return title;
    }

    public int getPage() {
        return page;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "TocCandidate{'" + title + "' p" + page + " conf=" + confidence + "}";
    }
}
