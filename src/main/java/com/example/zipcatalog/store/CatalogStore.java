package com.example.zipcatalog.store;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.model.EntryRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Persistent catalog of archives and the entries inside them.
 *
 * <p>Inserts are idempotent by natural key: an archive is identified by (source path, volume)
 * and an entry by (archive id, entry path). Re-inserting an existing key updates the stored row.
 */
public interface CatalogStore extends AutoCloseable {

    /**
     * Allocates a new, empty store with its own backing file. The new store shares nothing with
     * this one and is removed from disk by {@link #dispose()}.
     */
    CatalogStore createIsolated(String label);

    void insertArchive(ArchiveRecord record);

    /**
     * Inserts or updates the given entries in one transaction. Returns the number of rows written.
     */
    int insertEntries(List<EntryRecord> records);

    /**
     * Copies every archive and entry of {@code other} into this store as one transaction.
     * On failure nothing from {@code other} remains and previously merged sources are untouched.
     *
     * @throws MergeConflictException if an incoming archive id is stored under another natural key
     */
    MergeSummary mergeFrom(CatalogStore other);

    /**
     * Matching (archive, entry) pairs ordered by archive source path, volume and entry path.
     */
    List<CatalogMatch> query(CatalogQuery filter);

    Optional<ArchiveRecord> findArchive(UUID id);

    List<ArchiveSummary> listArchives();

    void forEachArchive(Consumer<ArchiveRecord> action);

    void forEachEntry(Consumer<EntryRecord> action);

    void updateArchiveHash(UUID archiveId, String contentHash);

    void updateEntryHash(UUID archiveId, String entryPath, String contentHash);

    CatalogStats stats();

    List<VolumeStats> volumeStats();

    /**
     * Entries sharing a content hash. Only entries whose hash has been computed take part.
     */
    List<DuplicateGroup> findDuplicates();

    /**
     * Human-readable integrity issues: archives missing from disk, entries without an archive.
     */
    List<String> validate();

    /**
     * Releases the backing resources. Isolated stores also delete their backing file.
     */
    void dispose();

    @Override
    default void close() {
        dispose();
    }
}
