package com.example.outline.service;

import com.example.outline.exception.DocumentReadException;
import com.example.outline.model.PageRecord;
import com.example.outline.model.Section;
import com.example.outline.model.TocEntry;
import com.example.outline.model.ValidationReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonlRecordStore")
class JsonlRecordStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonlRecordStore store = new JsonlRecordStore(objectMapper);

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should write one snake case object per TOC entry")
    void shouldWriteTocEntriesAsJsonl() throws IOException {
        Path file = tempDir.resolve("out/toc.jsonl");
        List<TocEntry> entries = Arrays.asList(
                new TocEntry("1.2", "Scope", 4, "1.2 Scope .... 4", Collections.singleton("introductory")),
                new TocEntry(null, "Glossary", 90, "Glossary 90", null));

        int written = store.writeTocEntries(file, entries);

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertThat(written).isEqualTo(2);
        assertThat(lines).hasSize(2);
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertThat(first.get("section_id").asText()).isEqualTo("1.2");
        assertThat(first.get("parent_id").asText()).isEqualTo("1");
        assertThat(first.get("level").asInt()).isEqualTo(2);
        assertThat(first.get("full_path").asText()).isEqualTo("1.2 Scope .... 4");
        assertThat(store.readTocEntries(file)).isEqualTo(entries);
    }

    @Test
    @DisplayName("Should read page records with either page key and skip bad lines")
    void shouldReadPagesLeniently() throws IOException {
        Path file = tempDir.resolve("pages.jsonl");
        Files.write(file, Arrays.asList(
                "{\"page\": 1, \"text\": \"Cover\"}",
                "",
                "{not json",
                "{\"page_number\": 2, \"text\": \"Contents\"}"), StandardCharsets.UTF_8);

        List<PageRecord> pages = store.readPages(file);

        assertThat(pages).extracting(PageRecord::getPage).containsExactly(1, 2);
        assertThat(pages.get(1).getText()).isEqualTo("Contents");
    }

    @Test
    @DisplayName("Should read back written sections")
    void shouldReadBackSections() {
        Path file = tempDir.resolve("sections.jsonl");
        SectionAssembler assembler = new SectionAssembler("Doc");
        List<Section> sections = Arrays.asList(
                assembler.buildPageSection(1, "Cover page", "Cover"),
                assembler.buildFromTocEntry(new TocEntry("2", "Overview", 3, "2 Overview", null), "body"));

        store.writeSections(file, sections);

        assertThat(store.readSections(file)).isEqualTo(sections);
    }

    @Test
    @DisplayName("Should write the report as pretty printed JSON")
    void shouldWriteReport() throws IOException {
        Path file = tempDir.resolve("reports/report.json");
        ValidationReport report = new ValidationReport();
        report.setPageCoverage(75.0);
        report.setPartitionValid(true);

        store.writeReport(file, report);

        JsonNode node = objectMapper.readTree(file.toFile());
        assertThat(node.get("page_coverage_pct").asDouble()).isEqualTo(75.0);
        assertThat(node.get("partition_valid").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("Should wrap IO failures")
    void shouldWrapMissingFile() {
        assertThatThrownBy(() -> store.readPages(tempDir.resolve("missing.jsonl")))
                .isInstanceOf(DocumentReadException.class)
                .hasMessageContaining("missing.jsonl");
    }
}
