package com.example.outline.strategy;

public class TocLineMatch {
    private final String patternName;
    private final String sectionId;
    private final String rawTitle;
    private final int page;

    public TocLineMatch(String patternName, String sectionId, String rawTitle, int page) {
        this.patternName = patternName;
        this.sectionId = sectionId;
        this.rawTitle = rawTitle;
        this.page = page;
    }

    public String getPatternName() {
        return patternName;
    }

    public String getSectionId() {
        return sectionId;
    }

    public String getRawTitle() {
        return rawTitle;
    }

    /**
     * Parsed page token, 0 when the token was not a number.
     */
    public int getPage() {
        return page;
    }
}
