package io.looming.narrative;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation, observed by the executor before each act.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
