package com.example.zipcatalog.extract;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.EntryRecord;

import java.io.IOException;
import java.io.InputStream;

/**
 * Opens the uncompressed bytes of a catalogued entry. Closing the stream releases the archive.
 */
@FunctionalInterface
public interface EntrySource {

    InputStream open(ArchiveRecord archive, EntryRecord entry) throws IOException;
}
