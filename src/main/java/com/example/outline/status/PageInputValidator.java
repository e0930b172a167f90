package com.example.outline.status;

import com.example.outline.exception.InputValidationException;
import com.example.outline.model.PageRecord;

import java.util.List;

/**
 * Sampled structural check of a page list: the first {@code sampleSize} records must be present,
 * numbered from 1 and carry text.
 */
public class PageInputValidator implements Validatable<List<PageRecord>> {

    private final boolean enabled;
    private final int sampleSize;

    public PageInputValidator(boolean enabled, int sampleSize) {
        this.enabled = enabled;
        this.sampleSize = Math.max(1, sampleSize);
    }

    @Override
    public void validate(List<PageRecord> pages) {
        if (pages == null) {
            throw new InputValidationException("Pages must be a list of page records, got null");
        }
        int limit = Math.min(sampleSize, pages.size());
        for (int i = 0; i < limit; i++) {
            PageRecord record = pages.get(i);
            if (record == null) {
                throw new InputValidationException("Page record at index " + i + " is null");
            }
            if (record.getPage() < 1) {
                throw new InputValidationException(
                        "Page record at index " + i + " has invalid page number " + record.getPage());
            }
            if (record.getText() == null) {
                throw new InputValidationException(
                        "Page record at index " + i + " (page " + record.getPage() + ") has no text");
            }
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }
}
