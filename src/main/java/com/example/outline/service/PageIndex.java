package com.example.outline.service;

import com.example.outline.model.PageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Page text by page number. Built once per extraction; lookups of pages that were never
 * supplied return an empty string.
 */
public class PageIndex {

    private static final Logger logger = LoggerFactory.getLogger(PageIndex.class);

    private final Map<Integer, String> texts = new TreeMap<>();
    private final int totalPages;

    public PageIndex(List<PageRecord> pages) {
        int max = 0;
        if (pages != null) {
            for (PageRecord record : pages) {
                if (record == null || record.isMalformed()) {
                    continue;
                }
                if (texts.putIfAbsent(record.getPage(), record.getText()) != null) {
                    logger.debug("Duplicate record for page {}, keeping the first", record.getPage());
                    continue;
                }
                max = Math.max(max, record.getPage());
            }
        }
        this.totalPages = max;
    }

    /**
     * Highest page number present in the input.
     */
    public int getTotalPages() {
        return totalPages;
    }

    public boolean isEmpty() {
        return texts.isEmpty();
    }

    public String getPageText(int page) {
        return texts.getOrDefault(page, "");
    }

    /**
     * Text of pages {@code start..end} inclusive, newline joined and trimmed. The range is clamped
     * to the document.
     */
    public String getContentRange(int start, int end) {
        int from = Math.max(1, start);
        int to = Math.min(end, totalPages);
        if (from > to) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int page = from; page <= to; page++) {
            if (page > from) {
                sb.append('\n');
            }
            sb.append(getPageText(page));
        }
        return sb.toString().trim();
    }

    public int getPagesWithText() {
        int count = 0;
        for (String text : texts.values()) {
            if (!text.trim().isEmpty()) {
                count++;
            }
        }
        return count;
    }

    public Map<Integer, String> asMap() {
        return Collections.unmodifiableMap(texts);
    }
}
