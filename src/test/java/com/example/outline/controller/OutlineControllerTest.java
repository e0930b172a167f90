package com.example.outline.controller;

import com.example.outline.config.OutlineSettings;
import com.example.outline.exception.DocumentReadException;
import com.example.outline.exception.InputValidationException;
import com.example.outline.model.DocumentMetadata;
import com.example.outline.model.PageRecord;
import com.example.outline.model.Section;
import com.example.outline.model.SectionExtractionResult;
import com.example.outline.model.TocEntry;
import com.example.outline.model.TocExtractionResult;
import com.example.outline.model.TocExtractionStats;
import com.example.outline.model.ValidationReport;
import com.example.outline.service.DocumentMetadataService;
import com.example.outline.service.PdfPageTextService;
import com.example.outline.service.SectionAssembler;
import com.example.outline.service.SectionExtractionOrchestrator;
import com.example.outline.service.TocDiscoveryService;
import com.example.outline.service.TocEntryExtractor;
import com.example.outline.service.ValidationReportService;
import com.example.outline.status.ProcessingStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutlineController Tests")
class OutlineControllerTest {

    @Mock
    private PdfPageTextService pdfPageTextService;

    @Mock
    private TocEntryExtractor tocEntryExtractor;

    @Mock
    private TocDiscoveryService tocDiscoveryService;

    @Mock
    private SectionExtractionOrchestrator orchestrator;

    @Mock
    private DocumentMetadataService metadataService;

    @Mock
    private ValidationReportService reportService;

    @Captor
    private ArgumentCaptor<List<TocEntry>> tocCaptor;

    private MockMvc mockMvc;
    private List<PageRecord> pages;
    private DocumentMetadata metadata;

    @BeforeEach
    void setUp() {
        OutlineController controller = new OutlineController(pdfPageTextService, tocEntryExtractor,
                tocDiscoveryService, orchestrator, metadataService, reportService,
                OutlineSettings.defaults(), new ObjectMapper());
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
        pages = Arrays.asList(new PageRecord(1, "Table of Contents"), new PageRecord(2, "1 Scope"));
        metadata = new DocumentMetadata();
    }

    private static MockMultipartFile pdfFile() {
        return new MockMultipartFile("file", "spec.pdf", "application/pdf",
                "%PDF-1.4 fake".getBytes(StandardCharsets.UTF_8));
    }

    private static SectionExtractionResult successfulResult() {
        TocEntry entry = new TocEntry("1", "Scope", 2, "1 Scope .... 2", null);
        Section section = new SectionAssembler("Doc").buildFromTocEntry(entry, "1 Scope");
        return new SectionExtractionResult(Collections.singletonList(section), Collections.singletonList(entry),
                new TocExtractionStats(), ProcessingStatus.DONE, new TreeSet<>(Collections.singleton(2)),
                Collections.emptyList(), Collections.emptyList(), 1, null);
    }

    @Test
    @DisplayName("Should report health with extractor status")
    void shouldReturnHealth() throws Exception {
        when(orchestrator.getStatus()).thenReturn(ProcessingStatus.IDLE);

        mockMvc.perform(get("/api/outline/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.extractorStatus").value("IDLE"))
                .andExpect(jsonPath("$.errors").value(0));
    }

    @Test
    @DisplayName("Should describe the service")
    void shouldReturnInfo() throws Exception {
        mockMvc.perform(get("/api/outline/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxFileSizeMB").value(500))
                .andExpect(jsonPath("$.defaultDocTitle").value(OutlineSettings.DEFAULT_DOC_TITLE))
                .andExpect(jsonPath("$.supportedFormats[0]").value("PDF"));
    }

    @Test
    @DisplayName("Should reject files that are not PDFs")
    void shouldRejectNonPdf() throws Exception {
        MockMultipartFile text = new MockMultipartFile("file", "notes.txt", "text/plain",
                "hello".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/outline/sections").file(text))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Only PDF files are supported"));

        verify(pdfPageTextService, never()).extractPages(any(InputStream.class));
    }

    @Test
    @DisplayName("Should reject empty uploads")
    void shouldRejectEmptyFile() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("file", "spec.pdf", "application/pdf", new byte[0]);

        mockMvc.perform(multipart("/api/outline/sections").file(empty))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("File is empty"));
    }

    @Test
    @DisplayName("Should return sections for a valid PDF")
    void shouldExtractSections_whenPdfValid() throws Exception {
        when(pdfPageTextService.extractPages(any(InputStream.class))).thenReturn(pages);
        when(metadataService.extract(pages)).thenReturn(metadata);
        when(metadataService.resolveTitle(metadata)).thenReturn("Doc");
        when(orchestrator.extractSections(eq(pages), isNull(), eq("Doc"))).thenReturn(successfulResult());

        mockMvc.perform(multipart("/api/outline/sections").file(pdfFile()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.filename").value("spec.pdf"))
                .andExpect(jsonPath("$.totalSections").value(1))
                .andExpect(jsonPath("$.totalTocEntries").value(1))
                .andExpect(jsonPath("$.metadata.revision").value("Unknown"))
                .andExpect(jsonPath("$.result.status").value("DONE"))
                .andExpect(jsonPath("$.result.sections[0].section_id").value("1"))
                .andExpect(jsonPath("$.result.sections[0].doc_title").value("Doc"))
                .andExpect(jsonPath("$.result.covered_pages[0]").value(2));
    }

    @Test
    @DisplayName("Should pass a supplied TOC through to extraction")
    void shouldUseSuppliedToc() throws Exception {
        when(pdfPageTextService.extractPages(any(InputStream.class))).thenReturn(pages);
        when(metadataService.extract(pages)).thenReturn(metadata);
        when(metadataService.resolveTitle(metadata)).thenReturn("Doc");
        when(orchestrator.extractSections(eq(pages), anyList(), eq("Doc"))).thenReturn(successfulResult());
        String tocJson = "{\"tableOfContents\": [{\"section_id\": \"4.1\", \"title\": \"Messages\", \"page\": 2}]}";

        mockMvc.perform(multipart("/api/outline/sections").file(pdfFile()).param("tocJson", tocJson))
                .andExpect(status().isOk());

        verify(orchestrator).extractSections(eq(pages), tocCaptor.capture(), eq("Doc"));
        assertThat(tocCaptor.getValue()).hasSize(1);
        assertThat(tocCaptor.getValue().get(0).getSectionId()).isEqualTo("4.1");
        assertThat(tocCaptor.getValue().get(0).getParentId()).isEqualTo("4");
    }

    @Test
    @DisplayName("Should fall back to extraction when the supplied TOC is not JSON")
    void shouldIgnoreBrokenToc() throws Exception {
        when(pdfPageTextService.extractPages(any(InputStream.class))).thenReturn(pages);
        when(metadataService.extract(pages)).thenReturn(metadata);
        when(metadataService.resolveTitle(metadata)).thenReturn("Doc");
        when(orchestrator.extractSections(eq(pages), isNull(), eq("Doc"))).thenReturn(successfulResult());

        mockMvc.perform(multipart("/api/outline/sections").file(pdfFile()).param("tocJson", "[not json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSections").value(1));
    }

    @Test
    @DisplayName("Should return 400 when extraction rejects the input")
    void shouldReturnBadRequest_whenExtractionFails() throws Exception {
        when(pdfPageTextService.extractPages(any(InputStream.class))).thenReturn(pages);
        when(metadataService.extract(pages)).thenReturn(metadata);
        when(metadataService.resolveTitle(metadata)).thenReturn("Doc");
        when(orchestrator.extractSections(eq(pages), isNull(), eq("Doc")))
                .thenReturn(SectionExtractionResult.failed(new InputValidationException("Page record at index 0 is null")));

        mockMvc.perform(multipart("/api/outline/sections").file(pdfFile()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Page record at index 0 is null"));
    }

    @Test
    @DisplayName("Should return 500 when the PDF cannot be read")
    void shouldReturnServerError_whenPdfUnreadable() throws Exception {
        when(pdfPageTextService.extractPages(any(InputStream.class)))
                .thenThrow(new DocumentReadException("Failed to read PDF: bad header"));

        mockMvc.perform(multipart("/api/outline/sections").file(pdfFile()))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("File processing failed: Failed to read PDF: bad header"));
    }

    @Test
    @DisplayName("Should preview the TOC with statistics")
    void shouldPreviewToc() throws Exception {
        List<TocEntry> entries = Collections.singletonList(new TocEntry("1", "Scope", 2, "1 Scope .... 2", null));
        when(pdfPageTextService.extractPages(any(InputStream.class), eq(1), eq(60))).thenReturn(pages);
        when(tocEntryExtractor.extract(pages)).thenReturn(new TocExtractionResult(entries, new TocExtractionStats()));
        when(tocDiscoveryService.findTocPages(pages)).thenReturn(Collections.singletonList(1));

        mockMvc.perform(multipart("/api/outline/preview-toc").file(pdfFile()).param("includeStats", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalItems").value(1))
                .andExpect(jsonPath("$.tableOfContents[0].title").value("Scope"))
                .andExpect(jsonPath("$.tableOfContents[0].level").value(1))
                .andExpect(jsonPath("$.stats.toc_start_index").value(-1))
                .andExpect(jsonPath("$.tocPages[0]").value(1));
    }

    @Test
    @DisplayName("Should return the validation report")
    void shouldReturnReport() throws Exception {
        SectionExtractionResult result = successfulResult();
        ValidationReport report = new ValidationReport();
        report.setPageCoverage(100.0);
        report.setPartitionValid(true);
        when(pdfPageTextService.extractPages(any(InputStream.class))).thenReturn(pages);
        when(metadataService.extract(pages)).thenReturn(metadata);
        when(metadataService.resolveTitle(metadata)).thenReturn("Doc");
        when(orchestrator.extractSections(eq(pages), isNull(), eq("Doc"))).thenReturn(result);
        when(reportService.generate(pages, result.getTocEntries(), result.getSections())).thenReturn(report);
        when(metadataService.validate(metadata)).thenReturn(Collections.singletonList("Missing required field: revision"));

        mockMvc.perform(multipart("/api/outline/report").file(pdfFile()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.page_coverage_pct").value(100.0))
                .andExpect(jsonPath("$.report.partition_valid").value(true))
                .andExpect(jsonPath("$.metadataErrors[0]").value("Missing required field: revision"));
    }
}
