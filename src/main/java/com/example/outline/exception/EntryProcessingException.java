package com.example.outline.exception;

import com.example.outline.model.TocEntry;

/** Thrown when one TOC entry cannot be turned into a section. */
public class EntryProcessingException extends RuntimeException {

    private final transient TocEntry entry;

    public EntryProcessingException(TocEntry entry, String message) {
        super(message);
        this.entry = entry;
    }

    public EntryProcessingException(TocEntry entry, String message, Throwable cause) {
        super(message, cause);
        this.entry = entry;
    }

    public TocEntry getEntry() {
        return entry;
    }
}
