package com.example.zipcatalog.scan;

import java.time.Duration;
import java.util.List;

/**
 * Machine-readable outcome of a scan. Totals count what was merged into the final catalog.
 */
public record ScanSummary(
        CoordinatorState state,
        long totalArchives,
        long totalEntries,
        List<VolumeResult> perVolume,
        Duration duration
) {
    public ScanSummary {
        perVolume = List.copyOf(perVolume);
    }

    public List<VolumeResult> failedVolumes() {
        return perVolume.stream().filter(result -> result.status() != JobStatus.SUCCEEDED).toList();
    }

    public List<FailureRecord> allFailures() {
        return perVolume.stream().flatMap(result -> result.failures().stream()).toList();
    }
}
