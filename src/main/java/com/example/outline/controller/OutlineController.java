package com.example.outline.controller;

import com.example.outline.config.OutlineSettings;
import com.example.outline.exception.DocumentReadException;
import com.example.outline.model.DocumentMetadata;
import com.example.outline.model.PageRecord;
import com.example.outline.model.SectionExtractionResult;
import com.example.outline.model.TocEntry;
import com.example.outline.model.TocExtractionResult;
import com.example.outline.model.ValidationReport;
import com.example.outline.service.DocumentMetadataService;
import com.example.outline.service.PdfPageTextService;
import com.example.outline.service.SectionExtractionOrchestrator;
import com.example.outline.service.TocDiscoveryService;
import com.example.outline.service.TocEntryExtractor;
import com.example.outline.service.ValidationReportService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outline extraction over uploaded PDFs.
 */
@RestController
@RequestMapping("/api/outline")
@CrossOrigin(origins = "*")
public class OutlineController {

    private static final Logger logger = LoggerFactory.getLogger(OutlineController.class);

    // 文件大小限制 (500MB)
    static final long MAX_FILE_SIZE = 500L * 1024 * 1024;

    private final PdfPageTextService pdfPageTextService;
    private final TocEntryExtractor tocEntryExtractor;
    private final TocDiscoveryService tocDiscoveryService;
    private final SectionExtractionOrchestrator orchestrator;
    private final DocumentMetadataService metadataService;
    private final ValidationReportService reportService;
    private final OutlineSettings settings;
    private final ObjectMapper objectMapper;

    public OutlineController(PdfPageTextService pdfPageTextService,
                             TocEntryExtractor tocEntryExtractor,
                             TocDiscoveryService tocDiscoveryService,
                             SectionExtractionOrchestrator orchestrator,
                             DocumentMetadataService metadataService,
                             ValidationReportService reportService,
                             OutlineSettings settings,
                             ObjectMapper objectMapper) {
        this.pdfPageTextService = pdfPageTextService;
        this.tocEntryExtractor = tocEntryExtractor;
        this.tocDiscoveryService = tocDiscoveryService;
        this.orchestrator = orchestrator;
        this.metadataService = metadataService;
        this.reportService = reportService;
        this.settings = settings;
        this.objectMapper = objectMapper;
    }

    /**
     * Extracts the full section list of an uploaded PDF.
     * @param file the PDF
     * @param tocJson optional TOC (array of entries, or an object with a {@code tableOfContents}
     *                array); when present TOC recognition is skipped
     */
    @PostMapping(value = "/sections", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> extractSections(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "tocJson", required = false) String tocJson) {
        long startTime = System.currentTimeMillis();

        try {
            // 文件验证
            ValidationResult validation = validateFile(file);
            if (!validation.isValid()) {
                logger.warn("File validation failed: {}", validation.getMessage());
                return errorResponse(HttpStatus.BAD_REQUEST, validation.getMessage());
            }

            logger.info("Processing PDF: {}, size: {} bytes", file.getOriginalFilename(), file.getSize());

            List<PageRecord> pages = readPages(file);
            DocumentMetadata metadata = metadataService.extract(pages);
            List<TocEntry> providedToc = parseProvidedToc(tocJson);

            SectionExtractionResult result = orchestrator.extractSections(
                    pages, providedToc, metadataService.resolveTitle(metadata));
            if (!result.isSuccessful()) {
                return errorResponse(HttpStatus.BAD_REQUEST, result.getErrorMessage());
            }

            long duration = System.currentTimeMillis() - startTime;

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("filename", file.getOriginalFilename());
            response.put("metadata", metadata);
            response.put("totalSections", result.getSections().size());
            response.put("totalTocEntries", result.getTocEntries().size());
            response.put("processingTimeMs", duration);
            response.put("result", result);

            logger.info("Sections extracted: {} in {} ms", result.getSections().size(), duration);
            return jsonResponse(response);

        } catch (IOException | DocumentReadException e) {
            logger.error("IO error processing PDF: {}", e.getMessage(), e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "File processing failed: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error processing PDF: {}", e.getMessage(), e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "System error: " + e.getMessage());
        }
    }

    /**
     * Recognizes the TOC from the leading pages only (no sections).
     * @param includeStats adds extraction counters and the pages that look like TOC pages
     */
    @PostMapping(value = "/preview-toc", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> previewTableOfContents(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "includeStats", defaultValue = "false") boolean includeStats) {
        long startTime = System.currentTimeMillis();

        try {
            ValidationResult validation = validateFile(file);
            if (!validation.isValid()) {
                logger.warn("File validation failed: {}", validation.getMessage());
                return errorResponse(HttpStatus.BAD_REQUEST, validation.getMessage());
            }

            logger.info("Extracting TOC from: {}", file.getOriginalFilename());

            List<PageRecord> pages;
            try (InputStream in = file.getInputStream()) {
                pages = pdfPageTextService.extractPages(in, 1, settings.getTocScanPages());
            }
            TocExtractionResult toc = tocEntryExtractor.extract(pages);

            long duration = System.currentTimeMillis() - startTime;

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("filename", file.getOriginalFilename());
            response.put("totalItems", toc.getEntries().size());
            response.put("processingTimeMs", duration);
            response.put("tableOfContents", toc.getEntries());
            if (includeStats) {
                response.put("stats", toc.getStats());
                response.put("tocPages", tocDiscoveryService.findTocPages(pages));
            }

            logger.info("TOC extracted successfully: {} items in {} ms", toc.getEntries().size(), duration);
            return jsonResponse(response);

        } catch (IOException | DocumentReadException e) {
            logger.error("IO error extracting TOC: {}", e.getMessage(), e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "File read failed: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error extracting TOC: {}", e.getMessage(), e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "System error: " + e.getMessage());
        }
    }

    /**
     * Runs the whole extraction and returns only the coverage report.
     */
    @PostMapping(value = "/report", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> validationReport(@RequestParam("file") MultipartFile file) {
        try {
            ValidationResult validation = validateFile(file);
            if (!validation.isValid()) {
                logger.warn("File validation failed: {}", validation.getMessage());
                return errorResponse(HttpStatus.BAD_REQUEST, validation.getMessage());
            }

            List<PageRecord> pages = readPages(file);
            DocumentMetadata metadata = metadataService.extract(pages);
            SectionExtractionResult result = orchestrator.extractSections(
                    pages, null, metadataService.resolveTitle(metadata));
            if (!result.isSuccessful()) {
                return errorResponse(HttpStatus.BAD_REQUEST, result.getErrorMessage());
            }
            ValidationReport report = reportService.generate(pages, result.getTocEntries(), result.getSections());

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", true);
            response.put("filename", file.getOriginalFilename());
            response.put("metadataErrors", metadataService.validate(metadata));
            response.put("report", report);
            return jsonResponse(response);

        } catch (IOException | DocumentReadException e) {
            logger.error("IO error building report: {}", e.getMessage(), e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "File processing failed: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error building report: {}", e.getMessage(), e);
            return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "System error: " + e.getMessage());
        }
    }

    /**
     * 健康检查接口
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("service", "Specification Outline Service");
        health.put("extractorStatus", orchestrator.getStatus());
        health.put("processed", orchestrator.getProcessedCount());
        health.put("errors", orchestrator.getErrorCount());
        health.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(health);
    }

    /**
     * 获取服务信息
     */
    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("serviceName", "Specification Outline Service");
        info.put("version", "1.0");
        info.put("supportedFormats", new String[]{"PDF"});
        info.put("maxFileSize", MAX_FILE_SIZE);
        info.put("maxFileSizeMB", MAX_FILE_SIZE / (1024 * 1024));
        info.put("defaultDocTitle", settings.getDocTitle());
        info.put("maxPageNumber", settings.getMaxPageNumber());
        info.put("tocKeywords", settings.getTocKeywords());
        info.put("features", new String[]{
                "Numbered, lettered and appendix TOC entries",
                "Fallback recovery of unformatted TOC lines",
                "Complete page partition into sections",
                "Coverage validation report"
        });
        return ResponseEntity.ok(info);
    }

    // ========== 辅助方法 ==========

    private List<PageRecord> readPages(MultipartFile file) throws IOException {
        try (InputStream in = file.getInputStream()) {
            return pdfPageTextService.extractPages(in);
        }
    }

    /**
     * null when no TOC was supplied or it cannot be parsed; extraction then recognizes the TOC
     * itself.
     */
    private List<TocEntry> parseProvidedToc(String tocJson) {
        if (tocJson == null || tocJson.trim().isEmpty()) {
            return null;
        }
        try {
            // 兼容处理：支持直接的 List<TocEntry> 或包含 tableOfContents 字段的包装对象
            JsonNode rootNode = objectMapper.readTree(tocJson);
            JsonNode entries = rootNode.isArray() ? rootNode : rootNode.get("tableOfContents");
            if (entries == null || !entries.isArray()) {
                logger.warn("Unknown TOC JSON structure, falling back to extraction");
                return null;
            }
            List<TocEntry> toc = objectMapper.convertValue(entries, new TypeReference<List<TocEntry>>() {});
            logger.info("Using provided TOC with {} items", toc.size());
            return toc;
        } catch (Exception e) {
            logger.warn("Failed to parse provided TOC JSON, falling back to extraction. Error: {}", e.getMessage());
            logger.debug("Received JSON snippet: {}", tocJson.length() > 200 ? tocJson.substring(0, 200) : tocJson);
            return null;
        }
    }

    /**
     * 验证上传的文件
     */
    private ValidationResult validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return ValidationResult.invalid("File is empty");
        }

        if (file.getSize() > MAX_FILE_SIZE) {
            return ValidationResult.invalid(
                    String.format("File too large, maximum is %d MB", MAX_FILE_SIZE / (1024 * 1024)));
        }

        String contentType = file.getContentType();
        if (contentType == null || !contentType.equals(MediaType.APPLICATION_PDF_VALUE)) {
            return ValidationResult.invalid("Only PDF files are supported");
        }

        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase().endsWith(".pdf")) {
            return ValidationResult.invalid("File extension must be .pdf");
        }

        return ValidationResult.valid();
    }

    private ResponseEntity<String> jsonResponse(Map<String, Object> body) throws IOException {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(objectMapper.writeValueAsString(body));
    }

    /**
     * 创建错误响应
     */
    private ResponseEntity<String> errorResponse(HttpStatus status, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("success", false);
        error.put("error", message);
        error.put("timestamp", System.currentTimeMillis());

        String body;
        try {
            body = objectMapper.writeValueAsString(error);
        } catch (Exception e) {
            body = "{\"success\":false,\"error\":\"" + message + "\"}";
        }
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    // ========== 内部类 ==========

    /**
     * 文件验证结果
     */
    private static class ValidationResult {
        private final boolean valid;
        private final String message;

        private ValidationResult(boolean valid, String message) {
            this.valid = valid;
            this.message = message;
        }

        public static ValidationResult valid() {
            return new ValidationResult(true, null);
        }

        public static ValidationResult invalid(String message) {
            return new ValidationResult(false, message);
        }

        public boolean isValid() {
            return valid;
        }

        public String getMessage() {
            return message;
        }
    }
}
