package com.example.outline.exception;

/** Thrown when a standalone section cannot be built for one page. */
public class PageProcessingException extends RuntimeException {

    private final int page;

    public PageProcessingException(int page, String message, Throwable cause) {
        super(message, cause);
        this.page = page;
    }

    public int getPage() {
        return page;
    }
}
