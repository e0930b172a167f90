package com.example.outline.strategy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered list of {@link TocLinePattern}s, most specific first. Evaluation always follows list
 * order.
 */
public class TocLineMatcher {

    private final List<TocLinePattern> patterns;

    public TocLineMatcher(List<TocLinePattern> patterns) {
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
    }

    /**
     * Shapes of a well formed TOC line: an id or keyword, a title, a leader and a page number.
     */
    public static TocLineMatcher primary() {
        return new TocLineMatcher(Arrays.asList(
                new TocLinePattern("numbered_dot_leader",
                        "^\\s*(?<id>\\d+(?:\\.\\d+)*)\\s+(?<title>[^.]+?)\\s*\\.{3,}\\s*(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NUMERIC),
                new TocLinePattern("numbered_wide_gap",
                        "^\\s*(?<id>\\d+(?:\\.\\d+)*)\\s+(?<title>.{5,80}?)\\s{3,}(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NUMERIC),
                new TocLinePattern("table_figure",
                        "^\\s*(?<prefix>Table|Figure)\\s*(?<id>\\d+(?:\\.\\d+)*)\\s+(?<title>.{5,100}?)\\s*\\.{3,}\\s*(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.PREFIXED),
                new TocLinePattern("appendix_annex",
                        "^\\s*(?<prefix>Appendix|Annex)\\s+(?<id>[A-Z])\\s+(?<title>.{5,80}?)\\s*\\.{3,}\\s*(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.PREFIXED),
                new TocLinePattern("chapter",
                        "^\\s*(?<prefix>Chapter)\\s+(?<id>\\d+)\\s+(?<title>.{5,80}?)\\s*\\.{3,}\\s*(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.PREFIXED),
                new TocLinePattern("titled_dot_leader",
                        "^(?<title>[A-Z][^.]{10,80}?)\\s*\\.{4,}\\s*(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NONE),
                new TocLinePattern("lettered",
                        "^\\s*(?<id>[A-Z]\\.\\d+(?:\\.\\d+)*)\\s+(?<title>.{5,80}?)\\s*\\.{3,}\\s*(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NUMERIC)
        ));
    }

    /**
     * Looser shapes used to recover entries the primary set missed. Matches here are only kept
     * when the title also passes the genuineness check.
     */
    public static TocLineMatcher enhanced() {
        return new TocLineMatcher(Arrays.asList(
                new TocLinePattern("flexible_numbered",
                        "^\\s*(?<id>\\d+(?:\\.\\d+)*)\\s*(?<title>.{3,100}?)\\s+(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NUMERIC),
                new TocLinePattern("table_figure_equation",
                        "^\\s*(?<prefix>Table|Figure|Equation)\\s*(?<id>\\d+(?:\\.\\d+)*)\\s*(?<title>.{3,80}?)\\s+(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.PREFIXED),
                new TocLinePattern("bullet",
                        "^\\s*[•\\-*]\\s*(?<title>.{5,80}?)\\s+(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NONE),
                new TocLinePattern("subsection",
                        "^\\s*(?<id>\\d+\\.\\d+\\.\\d+)\\s+(?<title>.{5,60}?)\\s+(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NUMERIC),
                new TocLinePattern("back_matter",
                        "^\\s*(?<title>References?|Bibliography|Index|Glossary)\\s+(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NONE),
                new TocLinePattern("roman",
                        "^\\s*(?<id>[IVX]+(?:\\.[IVX]+)*)\\s+(?<title>.{5,80}?)\\s*\\.{3,}\\s*(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NUMERIC),
                new TocLinePattern("lettered_loose",
                        "^\\s*(?<id>[A-Z](?:\\.[A-Z])*(?:\\.\\d+)*)\\s+(?<title>.{5,80}?)\\s*\\.{3,}\\s*(?<page>\\d{1,4})\\s*$",
                        SectionIdStyle.NUMERIC)
        ));
    }

    public List<TocLinePattern> getPatterns() {
        return patterns;
    }

    public Optional<TocLineMatch> firstMatch(String line) {
        for (TocLinePattern pattern : patterns) {
            Optional<TocLineMatch> match = pattern.match(line);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    /**
     * First match that the validator accepts; a rejected match hands the line to the next pattern.
     */
    public Optional<TocLineMatch> firstAccepted(String line, Predicate<TocLineMatch> validator) {
        for (TocLinePattern pattern : patterns) {
            Optional<TocLineMatch> match = pattern.match(line);
            if (match.isPresent() && validator.test(match.get())) {
                return match;
            }
        }
        return Optional.empty();
    }
}
