package com.di.scorenova.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag handed from the scheduler / orchestrator down
 * into the scoring loop. Cancelling is one-way.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationToken() {
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /** A shared token that is never cancelled. */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared NONE token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
