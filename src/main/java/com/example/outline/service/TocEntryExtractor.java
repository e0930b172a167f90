package com.example.outline.service;

import com.example.outline.config.OutlineSettings;
import com.example.outline.model.PageLine;
import com.example.outline.model.PageRecord;
import com.example.outline.model.TocCandidate;
import com.example.outline.model.TocEntry;
import com.example.outline.model.TocExtractionResult;
import com.example.outline.model.TocExtractionStats;
import com.example.outline.strategy.TocEntryHeuristic;
import com.example.outline.strategy.TocLineMatch;
import com.example.outline.strategy.TocLineMatcher;
import com.example.outline.util.TocTextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Turns page text into TOC entries.
 * <p>
 * Lines after the TOC marker go through four passes: the primary pattern set with a quality gate,
 * scoring of leftover lines that end in a number, a looser pattern set for lines nobody claimed,
 * and a fallback that promotes high scoring leftovers. The union is sorted, deduplicated and
 * bounded.
 * <p>
 * Holds no per-call state; counters come back in {@link TocExtractionStats}.
 */
@Service
public class TocEntryExtractor {

    private static final Logger logger = LoggerFactory.getLogger(TocEntryExtractor.class);

    public static final String TAG_ENHANCED = "enhanced_extraction";
    public static final String TAG_FALLBACK = "fallback_extraction";

    private static final List<String> CONFIDENCE_KEYWORDS = Arrays.asList(
            "introduction", "overview", "summary", "conclusion", "references",
            "appendix", "index", "glossary", "abstract");
    private static final List<String> FALLBACK_REJECT_PREFIXES = Arrays.asList(
            "error", "data object", "byte", "bit");

    private static final int POTENTIAL_MIN_LENGTH = 5;
    private static final int POTENTIAL_MAX_LENGTH = 200;

    private final OutlineSettings settings;
    private final TocDiscoveryService discoveryService;
    private final TocEntryHeuristic heuristic;
    private final TocLineMatcher primaryMatcher;
    private final TocLineMatcher enhancedMatcher;

    @Autowired
    public TocEntryExtractor(OutlineSettings settings,
                             TocDiscoveryService discoveryService,
                             TocEntryHeuristic heuristic) {
        this(settings, discoveryService, heuristic, TocLineMatcher.primary(), TocLineMatcher.enhanced());
    }

    public TocEntryExtractor(OutlineSettings settings,
                             TocDiscoveryService discoveryService,
                             TocEntryHeuristic heuristic,
                             TocLineMatcher primaryMatcher,
                             TocLineMatcher enhancedMatcher) {
        this.settings = settings;
        this.discoveryService = discoveryService;
        this.heuristic = heuristic;
        this.primaryMatcher = primaryMatcher;
        this.enhancedMatcher = enhancedMatcher;
    }

    /**
     * Extracts entries bounded only by the configured page range.
     */
    public TocExtractionResult extract(List<PageRecord> pages) {
        return extract(pages, 0);
    }

    /**
     * Extracts entries; a positive {@code documentPageCount} also drops entries pointing past the
     * end of the document.
     */
    public TocExtractionResult extract(List<PageRecord> pages, int documentPageCount) {
        if (pages == null || pages.isEmpty()) {
            return TocExtractionResult.empty();
        }
        TocExtractionStats stats = new TocExtractionStats();

        // 1. Flatten and locate the TOC
        List<PageLine> lines = discoveryService.flattenPages(pages, stats);
        int start = discoveryService.findTocStart(lines);
        stats.setTocStartIndex(start);
        List<PageLine> scope = lines.subList(start, lines.size());

        // 2. Primary pass, collecting potential entries from everything rejected
        List<TocEntry> entries = new ArrayList<>();
        List<TocCandidate> candidates = new ArrayList<>();
        for (PageLine line : scope) {
            stats.incrementLinesScanned();
            String text = line.trimmed();
            if (text.isEmpty() || text.length() > settings.getMaxLineLength()) {
                continue;
            }

            Optional<TocLineMatch> match = primaryMatcher.firstMatch(text);
            if (match.isPresent()) {
                stats.recordPatternUse(match.get().getPatternName());
                String title = TocTextUtils.cleanTitle(match.get().getRawTitle(), settings.getMaxTitleLength());
                int page = match.get().getPage();
                if (passesQualityGate(title, page)) {
                    entries.add(new TocEntry(match.get().getSectionId(), title, page, text,
                            TocTextUtils.generateTags(title)));
                    stats.incrementPrimaryEntries();
                    continue;
                }
                stats.incrementRejectedByQualityGate();
                logger.debug("Quality gate rejected '{}' (page {})", title, page);
            }

            analyzePotentialEntry(line).ifPresent(candidate -> {
                candidates.add(candidate);
                stats.incrementPotentialCandidates();
            });
        }

        // 3. Enhanced recovery
        Set<Integer> claimedLines = new HashSet<>();
        List<TocEntry> enhanced = applyEnhancedPatterns(entries, scope, claimedLines, stats);
        entries.addAll(enhanced);

        // 4. Fallback from potential entries
        entries.addAll(applyFallback(candidates, claimedLines, stats));

        // 5. Merge and clean
        List<TocEntry> cleaned = deduplicateAndBound(entries, documentPageCount, stats);
        logger.info("TOC extraction: {} entries from {} lines ({} primary, {} enhanced, {} fallback, {} duplicates removed)",
                cleaned.size(), stats.getLinesScanned(), stats.getPrimaryEntries(),
                stats.getEnhancedEntries(), stats.getFallbackEntries(), stats.getDuplicatesRemoved());
        return new TocExtractionResult(cleaned, stats);
    }

    boolean passesQualityGate(String title, int page) {
        if (title == null) {
            return false;
        }
        String trimmed = title.trim();
        if (trimmed.length() < settings.getMinTitleLength() || title.length() > settings.getMaxTitleLength()) {
            return false;
        }
        if (!settings.isPlausiblePage(page)) {
            return false;
        }
        if (TocTextUtils.countChar(title, '.') > settings.getMaxTitlePeriods()) {
            return false;
        }
        if (TocTextUtils.looksLikeTechnicalData(title)) {
            return false;
        }
        return TocTextUtils.digitRatio(title) < settings.getMaxDigitRatio();
    }

    /**
     * A line ending in a page-like number after at least two words of non-numeric title.
     */
    Optional<TocCandidate> analyzePotentialEntry(PageLine line) {
        String text = line.trimmed();
        if (text.length() < POTENTIAL_MIN_LENGTH || text.length() > POTENTIAL_MAX_LENGTH) {
            return Optional.empty();
        }
        String[] words = TocTextUtils.words(text);
        if (words.length < 3) {
            return Optional.empty();
        }
        String last = words[words.length - 1];
        if (!TocTextUtils.isAllDigits(last) || last.length() > 4) {
            return Optional.empty();
        }
        int page = Integer.parseInt(last);
        if (!settings.isPlausiblePage(page)) {
            return Optional.empty();
        }
        String title = String.join(" ", Arrays.copyOf(words, words.length - 1)).trim();
        if (TocTextUtils.isAllDigits(title.replace(" ", ""))) {
            return Optional.empty();
        }
        return Optional.of(new TocCandidate(line, title, page, scoreConfidence(text)));
    }

    double scoreConfidence(String line) {
        double score = 0.0;
        String lower = line.toLowerCase(Locale.ROOT);
        for (String keyword : CONFIDENCE_KEYWORDS) {
            if (lower.contains(keyword)) {
                score += 0.3;
                break;
            }
        }
        if (line.contains("..") || line.contains("  ")) {
            score += 0.2;
        }
        String[] words = TocTextUtils.words(line);
        if (words.length >= 2 && words.length <= 15) {
            score += 0.2;
        }
        for (String word : words) {
            if (Character.isUpperCase(word.charAt(0))) {
                score += 0.1;
                break;
            }
        }
        return Math.min(1.0, score);
    }

    private List<TocEntry> applyEnhancedPatterns(List<TocEntry> existing, List<PageLine> scope,
                                                 Set<Integer> claimedLines, TocExtractionStats stats) {
        Set<String> claimedSources = new HashSet<>();
        Set<String> existingTitles = new HashSet<>();
        for (TocEntry entry : existing) {
            claimedSources.add(entry.getFullPath());
            existingTitles.add(entry.getTitle().toLowerCase(Locale.ROOT));
        }

        List<TocEntry> recovered = new ArrayList<>();
        for (PageLine line : scope) {
            String text = line.trimmed();
            if (text.isEmpty() || text.length() > settings.getMaxLineLength() || claimedSources.contains(text)) {
                continue;
            }

            Optional<TocLineMatch> match = enhancedMatcher.firstAccepted(text,
                    m -> acceptsEnhanced(m, existingTitles));
            if (!match.isPresent()) {
                continue;
            }

            TocLineMatch m = match.get();
            String title = TocTextUtils.cleanTitle(m.getRawTitle(), settings.getMaxTitleLength());
            Set<String> tags = new LinkedHashSet<>(TocTextUtils.generateTags(title));
            tags.add(TAG_ENHANCED);
            recovered.add(new TocEntry(m.getSectionId(), title, m.getPage(), text, tags));

            stats.recordPatternUse(m.getPatternName());
            stats.incrementEnhancedEntries();
            existingTitles.add(title.toLowerCase(Locale.ROOT));
            claimedSources.add(text);
            claimedLines.add(line.getIndex());
        }
        return recovered;
    }

    private boolean acceptsEnhanced(TocLineMatch match, Set<String> existingTitles) {
        String title = TocTextUtils.cleanTitle(match.getRawTitle(), settings.getMaxTitleLength());
        String lower = title.toLowerCase(Locale.ROOT);
        return settings.isPlausiblePage(match.getPage())
                && title.trim().length() >= settings.getMinTitleLength()
                && !existingTitles.contains(lower)
                && !lower.startsWith("page ")
                && !TocTextUtils.looksLikeTechnicalData(title)
                && heuristic.looksGenuine(title);
    }

    private List<TocEntry> applyFallback(List<TocCandidate> candidates, Set<Integer> claimedLines,
                                         TocExtractionStats stats) {
        List<TocEntry> fallback = new ArrayList<>();
        for (TocCandidate candidate : candidates) {
            if (claimedLines.contains(candidate.getLine().getIndex())) {
                continue;
            }
            if (candidate.getConfidence() < settings.getFallbackMinConfidence()) {
                continue;
            }
            String title = TocTextUtils.cleanTitle(candidate.getTitle(), settings.getMaxTitleLength());
            if (TocTextUtils.looksLikeTechnicalData(title) || !heuristic.looksGenuine(title)) {
                continue;
            }
            if (title.length() < settings.getFallbackMinTitleLength() || TocTextUtils.words(title).length < 2) {
                continue;
            }
            if (startsWithRejectedPrefix(title)) {
                continue;
            }

            Set<String> tags = new LinkedHashSet<>(TocTextUtils.generateTags(title));
            tags.add(TAG_FALLBACK);
            fallback.add(new TocEntry(null, title, candidate.getPage(), candidate.getLine().trimmed(), tags));
            stats.incrementFallbackEntries();
            logger.debug("Fallback entry '{}' -> page {} (confidence {})",
                    title, candidate.getPage(), candidate.getConfidence());
        }
        return fallback;
    }

    private static boolean startsWithRejectedPrefix(String title) {
        String lower = title.toLowerCase(Locale.ROOT);
        for (String prefix : FALLBACK_REJECT_PREFIXES) {
            if (lower.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private List<TocEntry> deduplicateAndBound(List<TocEntry> entries, int documentPageCount,
                                               TocExtractionStats stats) {
        List<TocEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingInt(TocEntry::getPage).thenComparing(TocEntry::getTitle));

        Set<String> seen = new HashSet<>();
        List<TocEntry> unique = new ArrayList<>();
        int duplicates = 0;
        for (TocEntry entry : sorted) {
            if (seen.add(TocTextUtils.dedupKey(entry.getPage(), entry.getTitle()))) {
                unique.add(entry);
            } else {
                duplicates++;
            }
        }
        stats.setDuplicatesRemoved(duplicates);

        int upper = documentPageCount > 0
                ? Math.min(settings.getMaxPageNumber(), documentPageCount)
                : settings.getMaxPageNumber();
        List<TocEntry> bounded = new ArrayList<>();
        int outOfBounds = 0;
        for (TocEntry entry : unique) {
            if (entry.getPage() >= settings.getMinPageNumber() && entry.getPage() <= upper) {
                bounded.add(entry);
            } else {
                outOfBounds++;
            }
        }
        stats.setOutOfBoundsFiltered(outOfBounds);
        return Collections.unmodifiableList(bounded);
    }
}
