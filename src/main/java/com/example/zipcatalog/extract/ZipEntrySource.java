package com.example.zipcatalog.extract;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.EntryRecord;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.input.ProxyInputStream;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Reads entries straight from their source ZIP file. Every call opens its own handle, so
 * concurrent extractions never share one.
 */
public final class ZipEntrySource implements EntrySource {

    @Override
    public InputStream open(ArchiveRecord archive, EntryRecord entry) throws IOException {
        ZipFile zipFile = ZipFile.builder().setPath(Path.of(archive.sourcePath())).get();
        try {
            ZipArchiveEntry zipEntry = zipFile.getEntry(entry.entryPath());
            if (zipEntry == null) {
                throw new FileNotFoundException(entry.entryPath() + " is no longer in " + archive.sourcePath());
            }
            return new EntryStream(zipFile.getInputStream(zipEntry), zipFile);
        } catch (IOException | RuntimeException ex) {
            zipFile.close();
            throw ex;
        }
    }

    private static final class EntryStream extends ProxyInputStream {
        private final ZipFile zipFile;

        private EntryStream(InputStream delegate, ZipFile zipFile) {
            super(delegate);
            this.zipFile = zipFile;
        }

        @Override
        public void close() throws IOException {
            try {
                super.close();
            } finally {
                zipFile.close();
            }
        }
    }
}
