package com.example.zipcatalog.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One catalogued archive file. The identifier is minted once at probe time and never changes,
 * which is what lets isolated stores be merged without translating keys.
 */
public record ArchiveRecord(
        UUID id,
        String sourcePath,
        String volume,
        long size,
        String contentHash,
        Instant lastModified
) {
    public ArchiveRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(volume, "volume");
    }

    public String fileName() {
        int slash = Math.max(sourcePath.lastIndexOf('/'), sourcePath.lastIndexOf('\\'));
        return slash < 0 ? sourcePath : sourcePath.substring(slash + 1);
    }

    public ArchiveRecord withContentHash(String hash) {
        return new ArchiveRecord(id, sourcePath, volume, size, hash, lastModified);
    }
}
