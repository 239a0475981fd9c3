package com.specsim.infrastructure.sim;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one document run. Stages poll it between pages and rows.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Shared token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new PipelineCancelledException("Document run cancelled");
        }
    }
}
