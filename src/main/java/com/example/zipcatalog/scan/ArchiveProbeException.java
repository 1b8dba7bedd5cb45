package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ErrorKind;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Path;

/**
 * Base class of the archive failures that retrying will not fix.
 */
public class ArchiveProbeException extends IOException {
    private final ErrorKind kind;
    private final Path archive;

    public ArchiveProbeException(ErrorKind kind, Path archive, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.archive = archive;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Path getArchive() {
        return archive;
    }

    /**
     * Maps any I/O failure raised while probing or reading an archive onto the error taxonomy.
     */
    public static ErrorKind classify(IOException ex) {
        if (ex instanceof ArchiveProbeException probe) {
            return probe.getKind();
        }
        if (ex instanceof AccessDeniedException) {
            return ErrorKind.PERMISSION_DENIED;
        }
        return ErrorKind.IO_FAILURE;
    }
}
