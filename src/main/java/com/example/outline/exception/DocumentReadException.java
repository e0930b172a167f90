package com.example.outline.exception;

/** Exception thrown when a PDF or a record file cannot be read or written. */
public class DocumentReadException extends RuntimeException {

    public DocumentReadException(String message) {
        super(message);
    }

    public DocumentReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
