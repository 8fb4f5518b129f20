package com.binauditor.core.check;

/**
 * Cooperative cancellation flag for a compliance run.
 *
 * <p>Once cancelled, the runner starts no further checks. Checks already running finish
 * and their results are kept; the report is marked partial.
 */
public final class CancellationSignal {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
