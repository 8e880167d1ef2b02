package io.vulnscan.analysis.run;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation signal checked between stages and inside per-item loops.
 */
public final class CancellationToken {

    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public void cancel() {
        if (this != NONE) {
            cancelled = true;
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Cancelled");
        }
    }
}
