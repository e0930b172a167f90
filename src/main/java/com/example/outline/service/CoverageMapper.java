package com.example.outline.service;

import com.example.outline.model.PageRange;
import com.example.outline.model.TocEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Page ranges owned by TOC entries: each entry runs from its page to the page before the next
 * entry, the last one to the end of the document.
 */
@Component
public class CoverageMapper {

    /**
     * One range per entry, in page order. Entries sharing a start page each get that single page.
     */
    public List<PageRange> computeRanges(List<TocEntry> entries, int totalPages) {
        List<Integer> starts = new ArrayList<>(entries.size());
        for (TocEntry entry : sortByPage(entries)) {
            starts.add(entry.getPage());
        }
        return rangesFromStartPages(starts, totalPages);
    }

    /**
     * Same rule applied to bare start pages, e.g. those of already built sections.
     */
    public List<PageRange> rangesFromStartPages(List<Integer> startPages, int totalPages) {
        List<Integer> sorted = new ArrayList<>(startPages);
        Collections.sort(sorted);
        List<PageRange> ranges = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            int start = sorted.get(i);
            int end = i + 1 < sorted.size() ? sorted.get(i + 1) - 1 : totalPages;
            ranges.add(new PageRange(start, end));
        }
        return ranges;
    }

    public Set<Integer> coveredPages(List<PageRange> ranges) {
        Set<Integer> covered = new TreeSet<>();
        for (PageRange range : ranges) {
            for (int page = range.getStart(); page <= range.getEnd(); page++) {
                covered.add(page);
            }
        }
        return covered;
    }

    public Set<Integer> coveredPages(List<TocEntry> entries, int totalPages) {
        return coveredPages(computeRanges(entries, totalPages));
    }

    static List<TocEntry> sortByPage(List<TocEntry> entries) {
        List<TocEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingInt(TocEntry::getPage));
        return sorted;
    }
}
