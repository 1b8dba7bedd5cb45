package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ErrorKind;

import java.nio.file.Path;

/**
 * The file looks like a ZIP archive but its directory cannot be read.
 */
public class CorruptArchiveException extends ArchiveProbeException {

    public CorruptArchiveException(Path archive, String message, Throwable cause) {
        super(ErrorKind.CORRUPT_ARCHIVE, archive, message, cause);
    }
}
