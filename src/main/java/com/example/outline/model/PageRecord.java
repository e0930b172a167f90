package com.example.outline.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Text of one physical page, as produced by the PDF text extraction step.
 * Page numbers are 1-based.
 */
public class PageRecord {
    private final int page;
    private final String text;

    @JsonCreator
    public PageRecord(@JsonProperty("page") @JsonAlias("page_number") int page,
                      @JsonProperty("text") String text) {
        this.page = page;
        this.text = text;
    }

    public int getPage() {
        return page;
    }

    public String getText() {
        return text;
    }

    /**
     * A record with a non-positive page number or missing text cannot be placed in the document.
     */
    @JsonIgnore
    public boolean isMalformed() {
        return page < 1 || text == null;
    }

    @Override
    public String toString() {
        return "PageRecord{page=" + page + ", chars=" + (text == null ? "null" : text.length()) + "}";
    }
}
