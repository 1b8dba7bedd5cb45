package com.example.zipcatalog.scan;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global stop signal. Workers check it between archives and the merge loop between sources.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
