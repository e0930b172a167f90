package com.example.outline.exception;

/** Thrown when the page input as a whole does not have the expected shape. */
public class InputValidationException extends RuntimeException {

    public InputValidationException(String message) {
        super(message);
    }
}
