package com.example.outline.service;

import com.example.outline.exception.DocumentReadException;
import com.example.outline.model.PageRecord;
import com.example.outline.model.Section;
import com.example.outline.model.TocEntry;
import com.example.outline.model.ValidationReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One JSON object per line files for pages, TOC entries and sections.
 */
@Service
public class JsonlRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonlRecordStore.class);

    private final ObjectMapper objectMapper;

    public JsonlRecordStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public int writePages(Path file, List<PageRecord> pages) {
        return write(file, pages);
    }

    public int writeTocEntries(Path file, List<TocEntry> entries) {
        return write(file, entries);
    }

    public int writeSections(Path file, List<Section> sections) {
        return write(file, sections);
    }

    public List<PageRecord> readPages(Path file) {
        return read(file, PageRecord.class);
    }

    public List<TocEntry> readTocEntries(Path file) {
        return read(file, TocEntry.class);
    }

    public List<Section> readSections(Path file) {
        return read(file, Section.class);
    }

    public void writeReport(Path file, ValidationReport report) {
        try {
            createParent(file);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
            logger.info("Validation report written to {}", file);
        } catch (IOException e) {
            throw new DocumentReadException("Failed to write report " + file + ": " + e.getMessage(), e);
        }
    }

    private <T> int write(Path file, List<T> records) {
        int written = 0;
        try {
            createParent(file);
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (T record : records) {
                    writer.write(objectMapper.writeValueAsString(record));
                    writer.newLine();
                    written++;
                }
            }
        } catch (IOException e) {
            throw new DocumentReadException("Failed to write " + file + ": " + e.getMessage(), e);
        }
        logger.info("Wrote {} records to {}", written, file);
        return written;
    }

    private <T> List<T> read(Path file, Class<T> type) {
        List<T> records = new ArrayList<>();
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.trim().isEmpty()) {
                    continue;
                }
                try {
                    records.add(objectMapper.readValue(line, type));
                } catch (JsonProcessingException e) {
                    logger.warn("Skipping malformed line {} in {}: {}", lineNumber, file, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new DocumentReadException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        logger.debug("Read {} {} records from {}", records.size(), type.getSimpleName(), file);
        return records;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
