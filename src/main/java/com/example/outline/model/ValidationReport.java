package com.example.outline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Coverage and consistency figures for one extraction, written next to the section file.
 */
public class ValidationReport {
    private int totalTocEntries;
    private int sectionsParsed;
    private int tocSections;
    private int standaloneSections;
    private int pagesWithText;
    private int tocCoveredPages;
    private double pageCoverage;
    private double tocCoverage;
    private double sectionCoverage;
    private boolean partitionValid;
    private List<String> entriesWithoutSection = new ArrayList<>();
    private List<Integer> unaccountedPages = new ArrayList<>();
    private List<Integer> doublyClaimedPages = new ArrayList<>();

    @JsonProperty("total_toc_entries")
    public int getTotalTocEntries() {
        return totalTocEntries;
    }

    public void setTotalTocEntries(int totalTocEntries) {
        this.totalTocEntries = totalTocEntries;
    }

    @JsonProperty("sections_parsed")
    public int getSectionsParsed() {
        return sectionsParsed;
    }

    public void setSectionsParsed(int sectionsParsed) {
        this.sectionsParsed = sectionsParsed;
    }

    @JsonProperty("toc_sections")
    public int getTocSections() {
        return tocSections;
    }

    public void setTocSections(int tocSections) {
        this.tocSections = tocSections;
    }

    @JsonProperty("standalone_sections")
    public int getStandaloneSections() {
        return standaloneSections;
    }

    public void setStandaloneSections(int standaloneSections) {
        this.standaloneSections = standaloneSections;
    }

    @JsonProperty("pages_with_text")
    public int getPagesWithText() {
        return pagesWithText;
    }

    public void setPagesWithText(int pagesWithText) {
        this.pagesWithText = pagesWithText;
    }

    @JsonProperty("toc_covered_pages")
    public int getTocCoveredPages() {
        return tocCoveredPages;
    }

    public void setTocCoveredPages(int tocCoveredPages) {
        this.tocCoveredPages = tocCoveredPages;
    }

    @JsonProperty("page_coverage_pct")
    public double getPageCoverage() {
        return pageCoverage;
    }

    public void setPageCoverage(double pageCoverage) {
        this.pageCoverage = pageCoverage;
    }

    @JsonProperty("toc_coverage_pct")
    public double getTocCoverage() {
        return tocCoverage;
    }

    public void setTocCoverage(double tocCoverage) {
        this.tocCoverage = tocCoverage;
    }

    @JsonProperty("section_coverage_pct")
    public double getSectionCoverage() {
        return sectionCoverage;
    }

    public void setSectionCoverage(double sectionCoverage) {
        this.sectionCoverage = sectionCoverage;
    }

    @JsonProperty("partition_valid")
    public boolean isPartitionValid() {
        return partitionValid;
    }

    public void setPartitionValid(boolean partitionValid) {
        this.partitionValid = partitionValid;
    }

    @JsonProperty("entries_without_section")
    public List<String> getEntriesWithoutSection() {
        return entriesWithoutSection;
    }

    public void setEntriesWithoutSection(List<String> entriesWithoutSection) {
        this.entriesWithoutSection = entriesWithoutSection;
    }

    @JsonProperty("unaccounted_pages")
    public List<Integer> getUnaccountedPages() {
        return unaccountedPages;
    }

    public void setUnaccountedPages(List<Integer> unaccountedPages) {
        this.unaccountedPages = unaccountedPages;
    }

    @JsonProperty("doubly_claimed_pages")
    public List<Integer> getDoublyClaimedPages() {
        return doublyClaimedPages;
    }

    public void setDoublyClaimedPages(List<Integer> doublyClaimedPages) {
        this.doublyClaimedPages = doublyClaimedPages;
    }
}
