package com.example.outline.status;

public enum ProcessingStatus {
    IDLE,
    VALIDATING,
    EXTRACTING_TOC_SECTIONS,
    MAPPING_COVERAGE,
    EXTRACTING_STANDALONE_SECTIONS,
    SORTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
