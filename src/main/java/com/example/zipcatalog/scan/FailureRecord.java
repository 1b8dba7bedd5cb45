package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ErrorKind;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * A path that could not be indexed, with enough context to retry it.
 */
public class FailureRecord {
    private final String path;
    private final ErrorKind kind;
    private final int attempts;
    private final int maxAttempts;
    private final Instant lastAttemptTime;
    private final String lastError;
    private final List<RetryAttempt> retryAttempts;

    public FailureRecord(String path,
                         ErrorKind kind,
                         int attempts,
                         int maxAttempts,
                         Instant lastAttemptTime,
                         String lastError,
                         List<RetryAttempt> retryAttempts) {
        this.path = path;
        this.kind = kind;
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;
        this.lastAttemptTime = lastAttemptTime;
        this.lastError = lastError;
        this.retryAttempts = List.copyOf(retryAttempts);
    }

    /**
     * Single-shot failure that was not retried.
     */
    public static FailureRecord of(Path path, ErrorKind kind, String error) {
        Instant now = Instant.now();
        return new FailureRecord(path.toString(), kind, 1, 1, now, error,
                List.of(new RetryAttempt(1, now, kind, error)));
    }

    public String getPath() {
        return path;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public String getLastError() {
        return lastError;
    }

    public List<RetryAttempt> getRetryAttempts() {
        return retryAttempts;
    }

    @Override
    public String toString() {
        return kind + " " + path + ": " + lastError;
    }
}
