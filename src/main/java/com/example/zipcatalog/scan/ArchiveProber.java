package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.EntryRecord;
import com.example.zipcatalog.model.FileCategory;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.zip.ZipException;

/**
 * Lists the entries of a ZIP archive without extracting them. Directory and zero-byte entries are
 * left out. Hashing is a separate pass that has to be asked for explicitly.
 */
public class ArchiveProber {
    private static final byte[][] ZIP_SIGNATURES = {
            {'P', 'K', 3, 4},
            {'P', 'K', 5, 6},
            {'P', 'K', 7, 8},
            {'P', 'K', '0', '0'}
    };

    private final Tika tika;

    public ArchiveProber(Tika tika) {
        this.tika = tika;
    }

    /**
     * Reads the central directory of {@code archive} and mints a fresh identifier for it.
     *
     * @throws UnsupportedArchiveException if the file is not a ZIP container
     * @throws CorruptArchiveException     if the ZIP structure cannot be read
     * @throws IOException                 for any other (possibly transient) I/O failure
     */
    public ProbeResult probe(Path archive, String volume) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(archive, BasicFileAttributes.class);
        checkSignature(archive);
        UUID id = UUID.randomUUID();
        List<EntryRecord> entries = new ArrayList<>();
        try (ZipFile zipFile = ZipFile.builder().setPath(archive).get()) {
            Enumeration<ZipArchiveEntry> en = zipFile.getEntries();
            while (en.hasMoreElements()) {
                ZipArchiveEntry entry = en.nextElement();
                if (entry.isDirectory() || entry.getSize() == 0) {
                    continue;
                }
                MediaType mediaType = detect(entry.getName());
                entries.add(new EntryRecord(
                        id,
                        entry.getName(),
                        entry.getSize(),
                        entry.getCompressedSize(),
                        toInstant(entry.getLastModifiedTime()),
                        null,
                        mediaType.toString(),
                        FileCategory.fromMediaType(mediaType)
                ));
            }
        } catch (ZipException | EOFException ex) {
            throw new CorruptArchiveException(archive, "Unreadable ZIP structure in " + archive + ": " + ex.getMessage(), ex);
        }
        ArchiveRecord record = new ArchiveRecord(
                id,
                archive.toAbsolutePath().normalize().toString(),
                volume,
                attributes.size(),
                null,
                toInstant(attributes.lastModifiedTime())
        );
        return new ProbeResult(record, entries);
    }

    /**
     * SHA-256 over the raw bytes of the archive file.
     */
    public String hashArchive(Path archive) throws IOException {
        try (InputStream inputStream = Files.newInputStream(archive)) {
            return sha256(inputStream);
        }
    }

    /**
     * SHA-256 of every non-empty file entry, keyed by entry path.
     */
    public Map<String, String> hashEntries(Path archive) throws IOException {
        checkSignature(archive);
        Map<String, String> hashes = new LinkedHashMap<>();
        try (ZipFile zipFile = ZipFile.builder().setPath(archive).get()) {
            Enumeration<ZipArchiveEntry> en = zipFile.getEntries();
            while (en.hasMoreElements()) {
                ZipArchiveEntry entry = en.nextElement();
                if (entry.isDirectory() || entry.getSize() == 0) {
                    continue;
                }
                try (InputStream inputStream = zipFile.getInputStream(entry)) {
                    hashes.put(entry.getName(), sha256(inputStream));
                }
            }
        } catch (ZipException | EOFException ex) {
            throw new CorruptArchiveException(archive, "Unreadable ZIP structure in " + archive + ": " + ex.getMessage(), ex);
        }
        return hashes;
    }

    public MediaType detect(String entryName) {
        MediaType mediaType = MediaType.parse(tika.detect(entryName));
        return mediaType == null ? MediaType.OCTET_STREAM : mediaType;
    }

    private void checkSignature(Path archive) throws IOException {
        byte[] header = new byte[4];
        int read;
        try (InputStream inputStream = Files.newInputStream(archive)) {
            read = inputStream.readNBytes(header, 0, header.length);
        }
        if (read == header.length) {
            for (byte[] signature : ZIP_SIGNATURES) {
                if (Arrays.equals(signature, header)) {
                    return;
                }
            }
        }
        throw new UnsupportedArchiveException(archive, archive + " is not a ZIP archive");
    }

    private static Instant toInstant(FileTime time) {
        return time == null ? null : time.toInstant().truncatedTo(ChronoUnit.MILLIS);
    }

    static String sha256(InputStream inputStream) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] buffer = new byte[8192];
        int read;
        while ((read = inputStream.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        byte[] hash = digest.digest();
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
