package com.example.outline.model;

/**
 * How a {@link Section} came to exist. Standalone ids ("Page-n") are not guaranteed to differ
 * from TOC ids, so consumers should branch on the origin rather than on the id format.
 */
public enum SectionOrigin {
    /** Built from a TOC entry and the pages up to the next entry. */
    TOC,
    /** Built from a single page that no TOC entry covers. */
    PAGE
}
