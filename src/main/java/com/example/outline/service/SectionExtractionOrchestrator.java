package com.example.outline.service;

import com.example.outline.config.OutlineSettings;
import com.example.outline.exception.EntryProcessingException;
import com.example.outline.exception.InputValidationException;
import com.example.outline.exception.PageProcessingException;
import com.example.outline.model.PageRange;
import com.example.outline.model.PageRecord;
import com.example.outline.model.Section;
import com.example.outline.model.SectionExtractionResult;
import com.example.outline.model.TocEntry;
import com.example.outline.model.TocExtractionResult;
import com.example.outline.model.TocExtractionStats;
import com.example.outline.status.PageInputValidator;
import com.example.outline.status.ProcessingStatus;
import com.example.outline.status.StatusTracker;
import com.example.outline.status.Statusful;
import com.example.outline.status.Validatable;
import com.example.outline.util.TocTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Produces the complete section list for a document: one section per TOC entry covering the
 * pages up to the next entry, plus one standalone section for every other page that has text.
 */
@Service
public class SectionExtractionOrchestrator implements Statusful {

    private static final Logger logger = LoggerFactory.getLogger(SectionExtractionOrchestrator.class);

    private final OutlineSettings settings;
    private final TocEntryExtractor tocEntryExtractor;
    private final CoverageMapper coverageMapper;
    private final HeadingDetector headingDetector;
    private final Validatable<List<PageRecord>> validator;
    private final StatusTracker statusTracker = new StatusTracker();

    @Autowired
    public SectionExtractionOrchestrator(OutlineSettings settings,
                                         TocEntryExtractor tocEntryExtractor,
                                         CoverageMapper coverageMapper,
                                         HeadingDetector headingDetector) {
        this(settings, tocEntryExtractor, coverageMapper, headingDetector,
                new PageInputValidator(settings.isValidationEnabled(), settings.getValidationSampleSize()));
    }

    public SectionExtractionOrchestrator(OutlineSettings settings,
                                         TocEntryExtractor tocEntryExtractor,
                                         CoverageMapper coverageMapper,
                                         HeadingDetector headingDetector,
                                         Validatable<List<PageRecord>> validator) {
        this.settings = settings;
        this.tocEntryExtractor = tocEntryExtractor;
        this.coverageMapper = coverageMapper;
        this.headingDetector = headingDetector;
        this.validator = validator;
    }

    public SectionExtractionResult extractSections(List<PageRecord> pages) {
        return extractSections(pages, null, null);
    }

    /**
     * @param tocEntries precomputed TOC; when non-null TOC extraction is skipped
     */
    public SectionExtractionResult extractSections(List<PageRecord> pages, List<TocEntry> tocEntries) {
        return extractSections(pages, tocEntries, null);
    }

    public SectionExtractionResult extractSections(List<PageRecord> pages, List<TocEntry> tocEntries, String docTitle) {
        long startTime = System.currentTimeMillis();

        // 1. Validate
        statusTracker.transition(ProcessingStatus.VALIDATING);
        try {
            if (validator.isEnabled()) {
                validator.validate(pages);
            }
        } catch (InputValidationException e) {
            logger.warn("Section extraction aborted, invalid input: {}", e.getMessage());
            statusTracker.markFailed();
            return SectionExtractionResult.failed(e);
        }

        List<PageRecord> input = pages == null ? Collections.emptyList() : pages;
        PageIndex pageIndex = new PageIndex(input);
        int totalPages = pageIndex.getTotalPages();

        List<TocEntry> entries;
        TocExtractionStats tocStats = null;
        if (tocEntries != null) {
            entries = tocEntries;
            logger.info("Using provided TOC with {} entries", entries.size());
        } else {
            TocExtractionResult tocResult = tocEntryExtractor.extract(input, totalPages);
            entries = tocResult.getEntries();
            tocStats = tocResult.getStats();
        }

        if (pageIndex.isEmpty()) {
            logger.info("No pages with a valid page number, nothing to extract");
            statusTracker.markDone();
            return SectionExtractionResult.empty(entries, tocStats);
        }

        String title = docTitle == null || docTitle.trim().isEmpty() ? settings.getDocTitle() : docTitle.trim();
        SectionAssembler assembler = new SectionAssembler(title);

        // 2. TOC-derived sections
        statusTracker.transition(ProcessingStatus.EXTRACTING_TOC_SECTIONS);
        List<TocEntry> sortedEntries = usableEntries(entries, totalPages);
        List<PageRange> ranges = coverageMapper.computeRanges(sortedEntries, totalPages);
        List<Section> tocSections = new ArrayList<>();
        List<PageRange> builtRanges = new ArrayList<>();
        List<TocEntry> failedEntries = new ArrayList<>();
        for (int i = 0; i < sortedEntries.size(); i++) {
            TocEntry entry = sortedEntries.get(i);
            PageRange range = ranges.get(i);
            try {
                String content = pageIndex.getContentRange(range.getStart(), range.getEnd());
                tocSections.add(assembler.buildFromTocEntry(entry, content));
                builtRanges.add(range);
            } catch (EntryProcessingException e) {
                logger.warn("Skipping TOC entry {}: {}", entry, e.getMessage());
                failedEntries.add(entry);
            } catch (RuntimeException e) {
                EntryProcessingException wrapped = new EntryProcessingException(entry, e.getMessage(), e);
                logger.warn("Skipping TOC entry {}: {}", entry, wrapped.getMessage(), e);
                failedEntries.add(entry);
            }
        }

        // 3. Coverage of the sections that were actually built
        statusTracker.transition(ProcessingStatus.MAPPING_COVERAGE);
        Set<Integer> covered = coverageMapper.coveredPages(builtRanges);

        // 4. Standalone sections for the rest
        statusTracker.transition(ProcessingStatus.EXTRACTING_STANDALONE_SECTIONS);
        List<Section> standalone = new ArrayList<>();
        List<Integer> failedPages = new ArrayList<>();
        for (int page = 1; page <= totalPages; page++) {
            if (covered.contains(page)) {
                continue;
            }
            String text = pageIndex.getPageText(page).trim();
            if (text.isEmpty()) {
                continue;
            }
            try {
                standalone.add(assembler.buildPageSection(page, text, findHeading(text, page)));
            } catch (RuntimeException e) {
                PageProcessingException wrapped = new PageProcessingException(page, e.getMessage(), e);
                logger.warn("Skipping page {}: {}", wrapped.getPage(), wrapped.getMessage(), e);
                failedPages.add(page);
            }
        }

        // 5. Sort
        statusTracker.transition(ProcessingStatus.SORTING);
        List<Section> sections = new ArrayList<>(tocSections.size() + standalone.size());
        sections.addAll(tocSections);
        sections.addAll(standalone);
        sections.sort(Comparator.comparingInt(Section::getPage)
                .thenComparing(s -> s.getSectionId() == null ? "" : s.getSectionId()));

        statusTracker.markDone();
        logger.info("Extracted {} sections ({} from TOC, {} standalone) over {} pages in {} ms",
                sections.size(), tocSections.size(), standalone.size(), totalPages,
                System.currentTimeMillis() - startTime);
        if (!failedEntries.isEmpty() || !failedPages.isEmpty()) {
            logger.warn("{} TOC entries and {} pages were skipped", failedEntries.size(), failedPages.size());
        }

        return new SectionExtractionResult(sections, entries, tocStats, ProcessingStatus.DONE, covered,
                failedEntries, failedPages, assembler.getSectionsCreated(), null);
    }

    /**
     * Entries that can anchor a section in this document, stably sorted by page.
     */
    private List<TocEntry> usableEntries(List<TocEntry> entries, int totalPages) {
        List<TocEntry> usable = new ArrayList<>();
        for (TocEntry entry : entries) {
            if (entry == null) {
                logger.warn("Ignoring null TOC entry");
                continue;
            }
            if (entry.getPage() > totalPages) {
                logger.debug("Ignoring TOC entry {} past the last page {}", entry, totalPages);
                continue;
            }
            usable.add(entry);
        }
        usable.sort(Comparator.comparingInt(TocEntry::getPage));
        return usable;
    }

    /**
     * Heading for a standalone page: the first detected heading among the leading lines, else the
     * first line short enough to be a title, else a synthetic label.
     */
    String findHeading(String text, int page) {
        List<String> candidates = new ArrayList<>();
        for (String raw : TocTextUtils.splitLines(text)) {
            String line = raw.trim();
            if (!line.isEmpty()) {
                candidates.add(line);
                if (candidates.size() >= settings.getHeadingScanDepth()) {
                    break;
                }
            }
        }

        for (String line : candidates) {
            if (line.length() > settings.getMaxHeadingLength()) {
                continue;
            }
            Optional<String> heading = headingDetector.detect(line);
            if (heading.isPresent()) {
                return heading.get();
            }
        }
        for (String line : candidates) {
            if (line.length() <= settings.getMaxHeadingLength()) {
                return line;
            }
        }
        return "Content from Page " + page;
    }

    @Override
    public ProcessingStatus getStatus() {
        return statusTracker.getStatus();
    }

    @Override
    public long getProcessedCount() {
        return statusTracker.getProcessedCount();
    }

    @Override
    public long getErrorCount() {
        return statusTracker.getErrorCount();
    }
}
