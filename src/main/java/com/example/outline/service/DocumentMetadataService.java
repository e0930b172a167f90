package com.example.outline.service;

import com.example.outline.config.OutlineSettings;
import com.example.outline.model.DocumentMetadata;
import com.example.outline.model.PageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Title, revision, version and release date from the cover pages.
 */
@Service
public class DocumentMetadataService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentMetadataService.class);

    static final int METADATA_PAGES = 5;

    private static final Pattern REVISION = Pattern.compile("(?:Revision|Rev\\.?)[: ]+\\s*([0-9.]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern VERSION = Pattern.compile("(?:Version|V)\\s*[:]?\\s*([0-9.]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RELEASE_DATE = Pattern.compile(
            "(?:Release Date|Published:?)\\s*[:]?\\s*([0-9]{4}(?:-[0-9]{1,2})?)", Pattern.CASE_INSENSITIVE);

    private final OutlineSettings settings;
    private final Pattern titlePattern;

    public DocumentMetadataService(OutlineSettings settings) {
        this.settings = settings;
        String configured = settings.getMetadataTitlePattern();
        this.titlePattern = configured == null || configured.trim().isEmpty()
                ? null
                : Pattern.compile(configured, Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    }

    public DocumentMetadata extract(List<PageRecord> pages) {
        StringBuilder sb = new StringBuilder();
        int used = 0;
        for (PageRecord record : pages) {
            if (record == null || record.isMalformed() || record.getPage() > METADATA_PAGES) {
                continue;
            }
            if (used++ > 0) {
                sb.append('\n');
            }
            sb.append(record.getText());
        }
        String text = sb.toString();

        DocumentMetadata metadata = new DocumentMetadata();
        if (titlePattern != null) {
            metadata.setDocTitle(firstGroup(titlePattern, text));
        }
        metadata.setRevision(firstGroup(REVISION, text));
        metadata.setVersion(firstGroup(VERSION, text));
        metadata.setReleaseDate(firstGroup(RELEASE_DATE, text));
        logger.info("Document metadata: {}", metadata);
        return metadata;
    }

    /**
     * Detected title, or the configured default when none was found.
     */
    public String resolveTitle(DocumentMetadata metadata) {
        if (metadata != null && metadata.hasTitle()) {
            return metadata.getDocTitle();
        }
        return settings.getDocTitle();
    }

    /**
     * Messages for every required field that is missing; empty when the metadata is complete.
     */
    public List<String> validate(DocumentMetadata metadata) {
        List<String> errors = new ArrayList<>();
        if (metadata == null) {
            errors.add("Metadata is missing");
            return errors;
        }
        checkField(errors, "doc_title", metadata.getDocTitle());
        checkField(errors, "revision", metadata.getRevision());
        checkField(errors, "version", metadata.getVersion());
        checkField(errors, "release_date", metadata.getReleaseDate());
        return errors;
    }

    private static void checkField(List<String> errors, String name, String value) {
        if (value == null || value.trim().isEmpty() || DocumentMetadata.UNKNOWN.equals(value)) {
            errors.add("Missing required field: " + name);
        }
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (m.find()) {
            String value = m.groupCount() >= 1 ? m.group(1) : m.group();
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return DocumentMetadata.UNKNOWN;
    }
}
