package com.example.zipcatalog.extract;

import com.example.zipcatalog.model.ErrorKind;

/**
 * Request-level extraction failure: nothing has been extracted when it is thrown.
 */
public class ExtractionException extends Exception {
    private final ErrorKind kind;

    public ExtractionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
