package com.example.zipcatalog.store;

import java.util.UUID;

/**
 * An incoming archive identifier is already catalogued under a different (source path, volume).
 */
public class MergeConflictException extends CatalogStoreException {
    private final UUID archiveId;

    public MergeConflictException(UUID archiveId, String message) {
        super(message);
        this.archiveId = archiveId;
    }

    public UUID getArchiveId() {
        return archiveId;
    }
}
