package com.example.zipcatalog.extract;

import com.example.zipcatalog.model.ErrorKind;

import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

/**
 * Outcome for one (archive, entry) pair. {@code output} is null when nothing was written.
 */
public record ExtractionResult(
        String entryPath,
        UUID archiveId,
        Path output,
        ExtractionStatus status,
        ErrorKind errorKind,
        String error,
        long bytesWritten,
        Duration duration
) {
    public static ExtractionResult success(String entryPath, UUID archiveId, Path output, long bytesWritten, Duration duration) {
        return new ExtractionResult(entryPath, archiveId, output, ExtractionStatus.SUCCESS, null, null, bytesWritten, duration);
    }

    public static ExtractionResult failed(String entryPath, UUID archiveId, ErrorKind kind, String error, Duration duration) {
        return new ExtractionResult(entryPath, archiveId, null, ExtractionStatus.FAILED, kind, error, 0L, duration);
    }

    public boolean isSuccess() {
        return status == ExtractionStatus.SUCCESS;
    }
}
