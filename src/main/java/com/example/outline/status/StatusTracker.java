package com.example.outline.status;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Thread-safe {@link Statusful} implementation meant to be held by a component rather than
 * inherited from.
 */
public class StatusTracker implements Statusful {

    private final AtomicReference<ProcessingStatus> status = new AtomicReference<>(ProcessingStatus.IDLE);
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public void transition(ProcessingStatus next) {
        status.set(next);
    }

    public void markDone() {
        status.set(ProcessingStatus.DONE);
        processed.incrementAndGet();
    }

    public void markFailed() {
        status.set(ProcessingStatus.FAILED);
        errors.incrementAndGet();
    }

    @Override
    public ProcessingStatus getStatus() {
        return status.get();
    }

    @Override
    public long getProcessedCount() {
        return processed.get();
    }

    @Override
    public long getErrorCount() {
        return errors.get();
    }
}
