package com.example.outline.model;

import java.util.Objects;

/**
 * Inclusive page interval owned by one TOC entry. {@code end} is never below {@code start}.
 */
public class PageRange {
    private final int start;
    private final int end;

    public PageRange(int start, int end) {
        this.start = start;
        this.end = Math.max(start, end);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int size() {
        return end - start + 1;
    }

    public boolean contains(int page) {
        return page >= start && page <= end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageRange)) return false;
        PageRange that = (PageRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
