package com.example.outline.status;

/**
 * A component that reports where it is in its processing cycle and how many runs it has
 * completed or failed.
 */
public interface Statusful {

    ProcessingStatus getStatus();

    long getProcessedCount();

    long getErrorCount();
}
