package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ErrorKind;

import java.nio.file.Path;

/**
 * The file is not a ZIP container at all.
 */
public class UnsupportedArchiveException extends ArchiveProbeException {

    public UnsupportedArchiveException(Path archive, String message) {
        super(ErrorKind.UNSUPPORTED_ARCHIVE, archive, message, null);
    }
}
