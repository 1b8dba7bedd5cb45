package com.example.zipcatalog.progress;

import java.time.Duration;

/**
 * Periodic status of a running scan job. {@code currentFile} is null between archives and
 * {@code currentFileSize} is -1 when unknown.
 */
public record ProgressEvent(
        String jobId,
        long archivesProcessed,
        long entriesIndexed,
        Duration elapsed,
        String currentFile,
        long currentFileSize
) {
    public static ProgressEvent between(String jobId, long archivesProcessed, long entriesIndexed, Duration elapsed) {
        return new ProgressEvent(jobId, archivesProcessed, entriesIndexed, elapsed, null, -1L);
    }
}
