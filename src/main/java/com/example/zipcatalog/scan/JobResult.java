package com.example.zipcatalog.scan;

import java.time.Duration;
import java.util.List;

/**
 * Terminal state of one scan job. {@code error} explains a FAILED or CANCELLED job;
 * {@code failures} lists the individual paths that could not be indexed.
 */
public record JobResult(
        String jobId,
        String volume,
        JobStatus status,
        long archives,
        long entries,
        String error,
        List<FailureRecord> failures,
        Duration duration
) {
    public JobResult {
        failures = List.copyOf(failures);
    }

    public static JobResult failed(ScanJob job, String error, List<FailureRecord> failures, Duration duration) {
        return new JobResult(job.jobId(), job.volume().id(), JobStatus.FAILED, 0, 0, error, failures, duration);
    }
}
