package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ErrorKind;

import java.nio.file.Path;

/**
 * Receives paths the walker could not enter. The walk always continues afterwards.
 */
@FunctionalInterface
public interface WalkListener {
    void skipped(Path path, ErrorKind kind, String reason);

    WalkListener IGNORE = (path, kind, reason) -> {
    };
}
