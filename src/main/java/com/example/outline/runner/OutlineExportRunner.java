package com.example.outline.runner;

import com.example.outline.exception.DocumentReadException;
import com.example.outline.model.ExportSummary;
import com.example.outline.model.PageRecord;
import com.example.outline.service.JsonlRecordStore;
import com.example.outline.service.OutlineExportService;
import com.example.outline.service.PdfPageTextService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Runs the file export once at startup when {@code outline.output-dir} is set. The input is a PDF,
 * or a pages {@code .jsonl} file written by an earlier run.
 */
@Component
@ConditionalOnProperty(name = "outline.output-dir")
public class OutlineExportRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(OutlineExportRunner.class);

    private final OutlineExportService exportService;
    private final PdfPageTextService pdfPageTextService;
    private final JsonlRecordStore recordStore;
    private final String input;
    private final String outputDir;

    public OutlineExportRunner(OutlineExportService exportService,
                               PdfPageTextService pdfPageTextService,
                               JsonlRecordStore recordStore,
                               @Value("${outline.input:}") String input,
                               @Value("${outline.output-dir}") String outputDir) {
        this.exportService = exportService;
        this.pdfPageTextService = pdfPageTextService;
        this.recordStore = recordStore;
        this.input = input;
        this.outputDir = outputDir;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (input == null || input.trim().isEmpty()) {
            logger.warn("outline.output-dir is set but outline.input is not, nothing to export");
            return;
        }
        Path source = Paths.get(input.trim());
        logger.info("Exporting outline of {} to {}", source, outputDir);

        ExportSummary summary = exportService.export(readPages(source), Paths.get(outputDir.trim()));
        logger.info("Wrote {} pages, {} TOC entries, {} sections",
                summary.getPagesWritten(), summary.getTocEntriesWritten(), summary.getSectionsWritten());
    }

    List<PageRecord> readPages(Path source) {
        if (source.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".jsonl")) {
            return recordStore.readPages(source);
        }
        try (InputStream in = Files.newInputStream(source)) {
            return pdfPageTextService.extractPages(in);
        } catch (IOException e) {
            throw new DocumentReadException("Failed to open " + source + ": " + e.getMessage(), e);
        }
    }
}
