package com.example.zipcatalog.progress;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Time-based gate for progress updates. Not thread-safe; each worker or transfer owns its own.
 */
public final class Heartbeat {
    private final long intervalNanos;
    private final LongSupplier clock;
    private long last;

    public Heartbeat(Duration interval) {
        this(interval, System::nanoTime);
    }

    public Heartbeat(Duration interval, LongSupplier clock) {
        this.intervalNanos = interval.toNanos();
        this.clock = clock;
        this.last = clock.getAsLong();
    }

    /**
     * Returns true at most once per interval.
     */
    public boolean due() {
        long now = clock.getAsLong();
        if (now - last >= intervalNanos) {
            last = now;
            return true;
        }
        return false;
    }
}
