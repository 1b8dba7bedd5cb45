package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ErrorKind;

import java.time.Instant;

public class RetryAttempt {
    private final int attempt;
    private final Instant timestamp;
    private final ErrorKind kind;
    private final String error;

    public RetryAttempt(int attempt, Instant timestamp, ErrorKind kind, String error) {
        this.attempt = attempt;
        this.timestamp = timestamp;
        this.kind = kind;
        this.error = error;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getError() {
        return error;
    }
}
