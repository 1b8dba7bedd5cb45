package com.example.zipcatalog.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One file stored inside an archive. Keyed by (archiveId, entryPath).
 */
public record EntryRecord(
        UUID archiveId,
        String entryPath,
        long size,
        long compressedSize,
        Instant lastModified,
        String contentHash,
        String mediaType,
        FileCategory category
) {
    public EntryRecord {
        Objects.requireNonNull(archiveId, "archiveId");
        Objects.requireNonNull(entryPath, "entryPath");
        category = category == null ? FileCategory.OTHER : category;
    }

    /**
     * Last path segment of the entry, used as the default extraction file name.
     */
    public String fileName() {
        String trimmed = entryPath.endsWith("/") ? entryPath.substring(0, entryPath.length() - 1) : entryPath;
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }

    public EntryRecord withContentHash(String hash) {
        return new EntryRecord(archiveId, entryPath, size, compressedSize, lastModified, hash, mediaType, category);
    }
}
