package com.zaruka.agent;

import java.util.concurrent.CancellationException;

/**
 * Lets a caller abort a running request. Checked before every attempt and every round.
 */
public final class CancellationToken {

    public static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;

    public void cancel() {
        if (this == NONE) throw new UnsupportedOperationException("NONE cannot be cancelled");
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled() {
        if (isCancelled()) throw new CancellationException("Request cancelled");
    }
}
