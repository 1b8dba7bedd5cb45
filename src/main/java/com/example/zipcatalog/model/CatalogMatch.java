package com.example.zipcatalog.model;

import java.util.UUID;

/**
 * A resolved (archive, entry) pair as returned by catalog queries.
 */
public record CatalogMatch(ArchiveRecord archive, EntryRecord entry) {

    public String archivePath() {
        return archive.sourcePath();
    }

    public UUID archiveId() {
        return archive.id();
    }

    public String entryPath() {
        return entry.entryPath();
    }

    public long entrySize() {
        return entry.size();
    }
}
