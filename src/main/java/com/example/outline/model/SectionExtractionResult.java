package com.example.outline.model;

import com.example.outline.status.ProcessingStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of one orchestrator run. A failed run has no sections and carries the exception that
 * stopped it.
 */
public class SectionExtractionResult {
    private final List<Section> sections;
    private final List<TocEntry> tocEntries;
    private final TocExtractionStats tocStats;
    private final ProcessingStatus status;
    private final SortedSet<Integer> coveredPages;
    private final List<TocEntry> failedEntries;
    private final List<Integer> failedPages;
    private final int sectionsCreated;
    private final RuntimeException failure;

    public SectionExtractionResult(List<Section> sections,
                                   List<TocEntry> tocEntries,
                                   TocExtractionStats tocStats,
                                   ProcessingStatus status,
                                   Set<Integer> coveredPages,
                                   List<TocEntry> failedEntries,
                                   List<Integer> failedPages,
                                   int sectionsCreated,
                                   RuntimeException failure) {
        this.sections = Collections.unmodifiableList(new ArrayList<>(sections));
        this.tocEntries = Collections.unmodifiableList(new ArrayList<>(tocEntries));
        this.tocStats = tocStats;
        this.status = status;
        this.coveredPages = Collections.unmodifiableSortedSet(new TreeSet<>(coveredPages));
        this.failedEntries = Collections.unmodifiableList(new ArrayList<>(failedEntries));
        this.failedPages = Collections.unmodifiableList(new ArrayList<>(failedPages));
        this.sectionsCreated = sectionsCreated;
        this.failure = failure;
    }

    public static SectionExtractionResult failed(RuntimeException failure) {
        return new SectionExtractionResult(Collections.emptyList(), Collections.emptyList(), null,
                ProcessingStatus.FAILED, Collections.emptySet(), Collections.emptyList(),
                Collections.emptyList(), 0, failure);
    }

    public static SectionExtractionResult empty(List<TocEntry> tocEntries, TocExtractionStats tocStats) {
        return new SectionExtractionResult(Collections.emptyList(), tocEntries, tocStats,
                ProcessingStatus.DONE, Collections.emptySet(), Collections.emptyList(),
                Collections.emptyList(), 0, null);
    }

    @JsonProperty("sections")
    public List<Section> getSections() {
        return sections;
    }

    @JsonProperty("toc_entries")
    public List<TocEntry> getTocEntries() {
        return tocEntries;
    }

    @JsonProperty("toc_stats")
    public TocExtractionStats getTocStats() {
        return tocStats;
    }

    @JsonProperty("status")
    public ProcessingStatus getStatus() {
        return status;
    }

    @JsonProperty("covered_pages")
    public SortedSet<Integer> getCoveredPages() {
        return coveredPages;
    }

    @JsonProperty("failed_entries")
    public List<TocEntry> getFailedEntries() {
        return failedEntries;
    }

    @JsonProperty("failed_pages")
    public List<Integer> getFailedPages() {
        return failedPages;
    }

    @JsonProperty("sections_created")
    public int getSectionsCreated() {
        return sectionsCreated;
    }

    @JsonIgnore
    public RuntimeException getFailure() {
        return failure;
    }

    @JsonProperty("error")
    public String getErrorMessage() {
        return failure == null ? null : failure.getMessage();
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status == ProcessingStatus.DONE;
    }
}
