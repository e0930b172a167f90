package com.example.outline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TocExtractionResult {
    private final List<TocEntry> entries;
    private final TocExtractionStats stats;

    public TocExtractionResult(List<TocEntry> entries, TocExtractionStats stats) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.stats = stats;
    }

    public static TocExtractionResult empty() {
        return new TocExtractionResult(Collections.emptyList(), new TocExtractionStats());
    }

    @JsonProperty("entries")
    public List<TocEntry> getEntries() {
        return entries;
    }

    @JsonProperty("stats")
    public TocExtractionStats getStats() {
        return stats;
    }
}
