package com.example.zipcatalog.progress;

import java.time.Duration;

/**
 * Throughput sample for one entry being streamed out of its archive.
 */
public record TransferProgress(
        String entryPath,
        long bytesWritten,
        long totalBytes,
        Duration elapsed,
        boolean finished
) {
    public double bytesPerSecond() {
        long millis = elapsed.toMillis();
        return millis <= 0 ? 0.0 : bytesWritten * 1000.0 / millis;
    }
}
