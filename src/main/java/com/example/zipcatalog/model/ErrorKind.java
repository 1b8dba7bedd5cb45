package com.example.zipcatalog.model;

/**
 * Failure categories reported in scan summaries and extraction results.
 */
public enum ErrorKind {
    CORRUPT_ARCHIVE(false),
    UNSUPPORTED_ARCHIVE(false),
    IO_FAILURE(true),
    PERMISSION_DENIED(false),
    MERGE_CONFLICT(false),
    CONFIRMATION_REQUIRED(false),
    AMBIGUOUS_SELECTION(false),
    DESTINATION_UNWRITABLE(false),
    CANCELLED(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
