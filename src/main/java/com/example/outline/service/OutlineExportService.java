package com.example.outline.service;

import com.example.outline.model.DocumentMetadata;
import com.example.outline.model.ExportSummary;
import com.example.outline.model.PageRecord;
import com.example.outline.model.SectionExtractionResult;
import com.example.outline.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * File based pipeline: pages, TOC and sections as JSONL plus the validation report, all in one
 * output directory.
 */
@Service
public class OutlineExportService {

    private static final Logger logger = LoggerFactory.getLogger(OutlineExportService.class);

    public static final String PAGES_FILE = "pages.jsonl";
    public static final String TOC_FILE = "toc.jsonl";
    public static final String SECTIONS_FILE = "sections.jsonl";
    public static final String REPORT_FILE = "validation_report.json";

    private final SectionExtractionOrchestrator orchestrator;
    private final DocumentMetadataService metadataService;
    private final ValidationReportService reportService;
    private final JsonlRecordStore recordStore;

    public OutlineExportService(SectionExtractionOrchestrator orchestrator,
                                DocumentMetadataService metadataService,
                                ValidationReportService reportService,
                                JsonlRecordStore recordStore) {
        this.orchestrator = orchestrator;
        this.metadataService = metadataService;
        this.reportService = reportService;
        this.recordStore = recordStore;
    }

    /**
     * @throws com.example.outline.exception.InputValidationException if the pages are rejected
     */
    public ExportSummary export(List<PageRecord> pages, Path outputDir) {
        // 1. Metadata and sections; nothing is written for rejected input
        DocumentMetadata metadata = metadataService.extract(pages == null ? Collections.emptyList() : pages);
        SectionExtractionResult result = orchestrator.extractSections(
                pages, null, metadataService.resolveTitle(metadata));
        if (!result.isSuccessful()) {
            logger.warn("Export to {} aborted: {}", outputDir, result.getErrorMessage());
            throw result.getFailure();
        }

        // 2. Pages, TOC, sections, report
        int pagesWritten = recordStore.writePages(outputDir.resolve(PAGES_FILE), pages);
        int tocWritten = recordStore.writeTocEntries(outputDir.resolve(TOC_FILE), result.getTocEntries());
        int sectionsWritten = recordStore.writeSections(outputDir.resolve(SECTIONS_FILE), result.getSections());
        ValidationReport report = reportService.generate(pages, result.getTocEntries(), result.getSections());
        recordStore.writeReport(outputDir.resolve(REPORT_FILE), report);

        for (String error : metadataService.validate(metadata)) {
            logger.warn("Metadata: {}", error);
        }
        ExportSummary summary = new ExportSummary(outputDir, pagesWritten, tocWritten, sectionsWritten, report);
        logger.info("Export finished: {}", summary);
        return summary;
    }
}
