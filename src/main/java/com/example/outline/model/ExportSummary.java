package com.example.outline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;

/**
 * Record counts of one export run, plus where the files went.
 */
public class ExportSummary {
    private final Path outputDir;
    private final int pagesWritten;
    private final int tocEntriesWritten;
    private final int sectionsWritten;
    private final ValidationReport report;

    public ExportSummary(Path outputDir, int pagesWritten, int tocEntriesWritten, int sectionsWritten,
                         ValidationReport report) {
        this.outputDir = outputDir;
        this.pagesWritten = pagesWritten;
        this.tocEntriesWritten = tocEntriesWritten;
        this.sectionsWritten = sectionsWritten;
        this.report = report;
    }

    @JsonProperty("output_dir")
    public String getOutputDirName() {
        return outputDir.toString();
    }

    public Path outputDir() {
        return outputDir;
    }

    @JsonProperty("pages_written")
    public int getPagesWritten() {
        return pagesWritten;
    }

    @JsonProperty("toc_entries_written")
    public int getTocEntriesWritten() {
        return tocEntriesWritten;
    }

    @JsonProperty("sections_written")
    public int getSectionsWritten() {
        return sectionsWritten;
    }

    @JsonProperty("report")
    public ValidationReport getReport() {
        return report;
    }

    @Override
    public String toString() {
        return "ExportSummary{dir=" + outputDir + ", pages=" + pagesWritten + ", toc=" + tocEntriesWritten
                + ", sections=" + sectionsWritten + "}";
    }
}
