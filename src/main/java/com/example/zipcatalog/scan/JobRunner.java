package com.example.zipcatalog.scan;

/**
 * How a single scan job is executed. The coordinator calls it once per job, possibly from several
 * threads at once; each call only touches its own job's store.
 */
@FunctionalInterface
public interface JobRunner {
    JobResult run(ScanJob job, ScanContext context) throws Exception;
}
