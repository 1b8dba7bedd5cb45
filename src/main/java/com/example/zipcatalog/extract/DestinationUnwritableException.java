package com.example.zipcatalog.extract;

import com.example.zipcatalog.model.ErrorKind;

import java.nio.file.Path;

public class DestinationUnwritableException extends ExtractionException {
    private final Path destination;

    public DestinationUnwritableException(Path destination, String message, Throwable cause) {
        super(ErrorKind.DESTINATION_UNWRITABLE, message, cause);
        this.destination = destination;
    }

    public Path getDestination() {
        return destination;
    }
}
