package com.myorg.ebus.eventing;

/**
 * Cooperative cancellation flag handed to handlers.
 *
 * <p>Set when the handler policy stops waiting for the call (timeout). The
 * handler thread is never interrupted; long-running handlers should poll
 * {@link #isCancellationRequested()}.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public static CancellationToken none() {
        return NONE;
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public void cancel() {
        if (this != NONE) {
            cancelled = true;
        }
    }
}
