package com.example.zipcatalog.scan;

import com.example.zipcatalog.store.MergeSummary;

import java.time.Duration;
import java.util.List;

/**
 * Per-volume line of the scan summary. {@code merge} is null when the volume was never merged.
 */
public record VolumeResult(
        String volume,
        String root,
        JobStatus status,
        long archives,
        long entries,
        String error,
        List<FailureRecord> failures,
        MergeSummary merge,
        Duration duration
) {
    public VolumeResult {
        failures = List.copyOf(failures);
    }
}
