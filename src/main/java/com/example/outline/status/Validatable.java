package com.example.outline.status;

/**
 * Checks the shape of an input before a component commits to processing it.
 *
 * @param <T> the validated input type
 */
public interface Validatable<T> {

    /**
     * @throws com.example.outline.exception.InputValidationException if the input cannot be processed
     */
    void validate(T input);

    boolean isEnabled();
}
