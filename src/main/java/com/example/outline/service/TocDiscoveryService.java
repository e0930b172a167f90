package com.example.outline.service;

import com.example.outline.config.OutlineSettings;
import com.example.outline.model.PageLine;
import com.example.outline.model.PageRecord;
import com.example.outline.model.TocExtractionStats;
import com.example.outline.util.TocTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Locates the table of contents inside the page text.
 */
@Service
public class TocDiscoveryService {

    private static final Logger logger = LoggerFactory.getLogger(TocDiscoveryService.class);

    private static final Pattern TOC_LIKE_LINE = Pattern.compile(".+[….\\s]{2,}\\d+$");
    private static final Pattern TRAILING_NUMBER = Pattern.compile(".*\\s\\d+$");
    private static final Pattern PAGE_NUMBER_ONLY = Pattern.compile("^\\d+$");

    private final OutlineSettings settings;

    public TocDiscoveryService(OutlineSettings settings) {
        this.settings = settings;
    }

    /**
     * Expands pages into lines in page order. Malformed records are skipped and counted; of
     * several records for one page only the first is used, as in {@link PageIndex}.
     */
    public List<PageLine> flattenPages(List<PageRecord> pages, TocExtractionStats stats) {
        List<PageRecord> ordered = new ArrayList<>();
        Set<Integer> seenPages = new HashSet<>();
        for (PageRecord record : pages) {
            if (record == null || record.isMalformed()) {
                stats.incrementMalformedPagesSkipped();
                logger.warn("Skipping malformed page record: {}", record);
                continue;
            }
            if (!seenPages.add(record.getPage())) {
                stats.incrementDuplicatePagesSkipped();
                logger.debug("Duplicate record for page {}, keeping the first", record.getPage());
                continue;
            }
            ordered.add(record);
        }
        ordered.sort(Comparator.comparingInt(PageRecord::getPage)); // 稳定排序

        List<PageLine> lines = new ArrayList<>();
        for (PageRecord record : ordered) {
            for (String text : TocTextUtils.splitLines(record.getText())) {
                lines.add(new PageLine(record.getPage(), text, lines.size()));
            }
        }
        return lines;
    }

    /**
     * Index of the first line after the TOC heading, or 0 when no line mentions a TOC keyword.
     */
    public int findTocStart(List<PageLine> lines) {
        List<String> keywords = settings.getTocKeywords();
        for (int i = 0; i < lines.size(); i++) {
            String lower = lines.get(i).getText().toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (lower.contains(keyword)) {
                    logger.debug("TOC marker '{}' found on page {} at line {}", keyword, lines.get(i).getPage(), i);
                    return i + 1;
                }
            }
        }
        logger.debug("No TOC marker found, scanning the whole document");
        return 0;
    }

    /**
     * Pages that look like TOC pages: the first one must mention a TOC keyword, following ones
     * only need to be dense with "Title ..... 12" lines. Stops at the first page that is not.
     */
    public List<Integer> findTocPages(List<PageRecord> pages) {
        List<Integer> tocPages = new ArrayList<>();
        int scanned = 0;
        for (PageRecord record : pages) {
            if (record == null || record.isMalformed()) {
                continue;
            }
            if (++scanned > settings.getTocScanPages()) {
                break;
            }
            String text = record.getText();
            int score = countTocLikeLines(text);

            if (tocPages.isEmpty()) {
                // 首页：必须有关键字且至少一行目录格式
                if (containsTocKeyword(text) && score >= 1) {
                    tocPages.add(record.getPage());
                }
            } else if (score >= 3) {
                tocPages.add(record.getPage());
            } else {
                break;
            }
        }
        return tocPages;
    }

    /**
     * Count how many lines in a page text look like "Title......Page".
     */
    public int countTocLikeLines(String pageText) {
        int count = 0;
        for (String raw : TocTextUtils.splitLines(pageText)) {
            String line = raw.trim();
            if (line.isEmpty() || PAGE_NUMBER_ONLY.matcher(line).matches()) continue;
            if (line.length() > settings.getMaxLineLength()) continue;

            if (TOC_LIKE_LINE.matcher(line).find()) {
                count++;
            } else if (line.length() > 5 && TRAILING_NUMBER.matcher(line).matches()) {
                // "1.1 Title 5" without a leader
                count++;
            }
        }
        return count;
    }

    private boolean containsTocKeyword(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : settings.getTocKeywords()) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
