package com.example.zipcatalog.scan;

import com.example.zipcatalog.progress.ProgressReporter;

/**
 * What a running job may observe besides its own state.
 */
public record ScanContext(ProgressReporter reporter, CancellationToken cancellation) {
}
