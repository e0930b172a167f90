package com.example.outline.service;

import com.example.outline.model.PageRange;
import com.example.outline.model.PageRecord;
import com.example.outline.model.Section;
import com.example.outline.model.TocEntry;
import com.example.outline.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Coverage figures and partition checks over the pages, the TOC and the produced sections.
 */
@Service
public class ValidationReportService {

    private static final Logger logger = LoggerFactory.getLogger(ValidationReportService.class);

    private final CoverageMapper coverageMapper;

    public ValidationReportService(CoverageMapper coverageMapper) {
        this.coverageMapper = coverageMapper;
    }

    public ValidationReport generate(List<PageRecord> pages, List<TocEntry> tocEntries, List<Section> sections) {
        PageIndex pageIndex = new PageIndex(pages);
        int totalPages = pageIndex.getTotalPages();
        int pagesWithText = pageIndex.getPagesWithText();

        ValidationReport report = new ValidationReport();
        report.setTotalTocEntries(tocEntries.size());
        report.setSectionsParsed(sections.size());
        report.setPagesWithText(pagesWithText);

        // 1. TOC coverage over entries that point inside the document
        List<TocEntry> inRange = new ArrayList<>();
        for (TocEntry entry : tocEntries) {
            if (entry.getPage() >= 1 && entry.getPage() <= totalPages) {
                inRange.add(entry);
            }
        }
        int tocCovered = coverageMapper.coveredPages(inRange, totalPages).size();
        report.setTocCoveredPages(tocCovered);
        report.setPageCoverage(percentage(pagesWithText, totalPages));
        report.setTocCoverage(percentage(tocCovered, totalPages));
        report.setSectionCoverage(percentage(sections.size(), pagesWithText));

        // 2. Which pages the sections account for
        List<Integer> tocStarts = new ArrayList<>();
        Set<Integer> standalonePages = new TreeSet<>();
        Set<String> sectionKeys = new HashSet<>();
        for (Section section : sections) {
            if (section.isTocDerived()) {
                tocStarts.add(section.getPage());
                sectionKeys.add(key(section.getPage(), section.getTitle()));
            } else {
                standalonePages.add(section.getPage());
            }
        }
        report.setTocSections(tocStarts.size());
        report.setStandaloneSections(standalonePages.size());

        List<PageRange> sectionRanges = coverageMapper.rangesFromStartPages(tocStarts, totalPages);
        Set<Integer> tocSectionPages = coverageMapper.coveredPages(sectionRanges);

        List<Integer> unaccounted = new ArrayList<>();
        List<Integer> doublyClaimed = new ArrayList<>();
        for (int page = 1; page <= totalPages; page++) {
            boolean toc = tocSectionPages.contains(page);
            boolean standalone = standalonePages.contains(page);
            if (toc && standalone) {
                doublyClaimed.add(page);
            } else if (!toc && !standalone && !pageIndex.getPageText(page).trim().isEmpty()) {
                unaccounted.add(page);
            }
        }
        report.setUnaccountedPages(unaccounted);
        report.setDoublyClaimedPages(doublyClaimed);
        report.setPartitionValid(unaccounted.isEmpty() && doublyClaimed.isEmpty());

        List<String> withoutSection = new ArrayList<>();
        for (TocEntry entry : tocEntries) {
            if (!sectionKeys.contains(key(entry.getPage(), entry.getTitle()))) {
                String id = entry.getSectionId() == null ? "" : entry.getSectionId() + " ";
                withoutSection.add(id + entry.getTitle() + " (p" + entry.getPage() + ")");
            }
        }
        report.setEntriesWithoutSection(withoutSection);

        logger.info("Validation: {} TOC entries, {} sections, page coverage {}%, TOC coverage {}%, partition valid: {}",
                report.getTotalTocEntries(), report.getSectionsParsed(), report.getPageCoverage(),
                report.getTocCoverage(), report.isPartitionValid());
        return report;
    }

    static double percentage(int numerator, int denominator) {
        if (denominator == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(numerator * 100.0 / denominator)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private static String key(int page, String title) {
        return page + "|" + (title == null ? "" : title.trim().toLowerCase(Locale.ROOT));
    }
}
