package com.mqparser.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag. Any thread may cancel; the parser checks it at every production.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
