package com.example.zipcatalog;

import com.example.zipcatalog.model.FileCategory;
import com.example.zipcatalog.scan.VolumeSpec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable runtime settings for scanning, searching and extraction.
 */
public record CatalogConfig(
        Path catalogFile,
        Path workDirectory,
        List<VolumeSpec> volumes,
        Set<FileCategory> categories,
        int maxConcurrency,
        int fileRetryAttempts,
        boolean computeHashes,
        Duration heartbeatInterval,
        int extractionBufferSize,
        int extractionThreads,
        Optional<Path> summaryFile
) {
}
