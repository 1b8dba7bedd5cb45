package com.example.zipcatalog.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Default reporter: renders progress as log lines.
 */
public final class LoggingProgressReporter implements ProgressReporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingProgressReporter.class);
    private static final double MIB = 1024.0 * 1024.0;

    @Override
    public void scanProgress(ProgressEvent event) {
        if (event.currentFile() == null) {
            LOGGER.info("[{}] {} archives, {} entries ({}s)",
                    event.jobId(), event.archivesProcessed(), event.entriesIndexed(), event.elapsed().toSeconds());
        } else {
            LOGGER.info("[{}] {} archives, {} entries ({}s) - processing {} ({})",
                    event.jobId(), event.archivesProcessed(), event.entriesIndexed(), event.elapsed().toSeconds(),
                    event.currentFile(), formatSize(event.currentFileSize()));
        }
    }

    @Override
    public void jobFinished(String jobId, String status, long archives, long entries) {
        LOGGER.info("[{}] {}: {} archives, {} entries", jobId, status, archives, entries);
    }

    @Override
    public void transferProgress(TransferProgress progress) {
        String rate = String.format(Locale.ROOT, "%.1f MB/s", progress.bytesPerSecond() / MIB);
        if (progress.finished()) {
            LOGGER.info("Extracted {} ({} in {}s, {})", progress.entryPath(),
                    formatSize(progress.bytesWritten()), progress.elapsed().toSeconds(), rate);
        } else {
            LOGGER.info("Extracting {}: {} of {} @ {}", progress.entryPath(),
                    formatSize(progress.bytesWritten()), formatSize(progress.totalBytes()), rate);
        }
    }

    static String formatSize(long bytes) {
        if (bytes < 0) {
            return "size unknown";
        }
        return String.format(Locale.ROOT, "%.1f MB", bytes / MIB);
    }
}
