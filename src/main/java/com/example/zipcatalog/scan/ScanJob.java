package com.example.zipcatalog.scan;

import com.example.zipcatalog.store.CatalogStore;

/**
 * Per-volume unit of work. The job owns {@code store} until the coordinator merges and disposes it.
 */
public record ScanJob(String jobId, VolumeSpec volume, CatalogStore store) {
}
