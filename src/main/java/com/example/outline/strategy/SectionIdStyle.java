package com.example.outline.strategy;

/**
 * Which capture groups a {@link TocLinePattern} defines and how they combine into a section id.
 */
public enum SectionIdStyle {
    /** {@code id} group used as captured: "4.2.1", "A.3", "IV". */
    NUMERIC,
    /** {@code prefix} and {@code id} groups joined: "Table 5.1", "Appendix A", "Chapter 3". */
    PREFIXED,
    /** No id group; the entry is identified by its title only. */
    NONE
}
