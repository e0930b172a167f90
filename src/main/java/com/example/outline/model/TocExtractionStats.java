package com.example.outline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters collected during one TOC extraction call. A fresh instance is created per call and
 * handed back with the entries, so the extractor itself keeps no per-call state.
 */
public class TocExtractionStats {
    private int linesScanned;
    private int tocStartIndex = -1;
    private int malformedPagesSkipped;
    private int duplicatePagesSkipped;
    private int primaryEntries;
    private int enhancedEntries;
    private int fallbackEntries;
    private int potentialCandidates;
    private int rejectedByQualityGate;
    private int duplicatesRemoved;
    private int outOfBoundsFiltered;
    private final Map<String, Integer> patternsUsed = new LinkedHashMap<>();

    public void incrementLinesScanned() {
        linesScanned++;
    }

    public void incrementMalformedPagesSkipped() {
        malformedPagesSkipped++;
    }

    public void incrementDuplicatePagesSkipped() {
        duplicatePagesSkipped++;
    }

    public void incrementPrimaryEntries() {
        primaryEntries++;
    }

    public void incrementEnhancedEntries() {
        enhancedEntries++;
    }

    public void incrementFallbackEntries() {
        fallbackEntries++;
    }

    public void incrementPotentialCandidates() {
        potentialCandidates++;
    }

    public void incrementRejectedByQualityGate() {
        rejectedByQualityGate++;
    }

    public void recordPatternUse(String patternName) {
        patternsUsed.merge(patternName, 1, Integer::sum);
    }

    public void setTocStartIndex(int tocStartIndex) {
        this.tocStartIndex = tocStartIndex;
    }

    public void setDuplicatesRemoved(int duplicatesRemoved) {
        this.duplicatesRemoved = duplicatesRemoved;
    }

    public void setOutOfBoundsFiltered(int outOfBoundsFiltered) {
        this.outOfBoundsFiltered = outOfBoundsFiltered;
    }

    @JsonProperty("lines_scanned")
    public int getLinesScanned() {
        return linesScanned;
    }

    @JsonProperty("toc_start_index")
    public int getTocStartIndex() {
        return tocStartIndex;
    }

    @JsonProperty("malformed_pages_skipped")
    public int getMalformedPagesSkipped() {
        return malformedPagesSkipped;
    }

    @JsonProperty("duplicate_pages_skipped")
    public int getDuplicatePagesSkipped() {
        return duplicatePagesSkipped;
    }

    @JsonProperty("primary_entries")
    public int getPrimaryEntries() {
        return primaryEntries;
    }

    @JsonProperty("enhanced_entries")
    public int getEnhancedEntries() {
        return enhancedEntries;
    }

    @JsonProperty("fallback_entries")
    public int getFallbackEntries() {
        return fallbackEntries;
    }

    @JsonProperty("potential_candidates")
    public int getPotentialCandidates() {
        return potentialCandidates;
    }

    @JsonProperty("rejected_by_quality_gate")
    public int getRejectedByQualityGate() {
        return rejectedByQualityGate;
    }

    @JsonProperty("duplicates_removed")
    public int getDuplicatesRemoved() {
        return duplicatesRemoved;
    }

    @JsonProperty("out_of_bounds_filtered")
    public int getOutOfBoundsFiltered() {
        return outOfBoundsFiltered;
    }

    @JsonProperty("patterns_used")
    public Map<String, Integer> getPatternsUsed() {
        return Collections.unmodifiableMap(patternsUsed);
    }

    @Override
    public String toString() {
        return "TocExtractionStats{lines=" + linesScanned
                + ", start=" + tocStartIndex
                + ", primary=" + primaryEntries
                + ", enhanced=" + enhancedEntries
                + ", fallback=" + fallbackEntries
                + ", duplicates=" + duplicatesRemoved
                + ", outOfBounds=" + outOfBoundsFiltered
                + ", malformed=" + malformedPagesSkipped + "}";
    }
}
