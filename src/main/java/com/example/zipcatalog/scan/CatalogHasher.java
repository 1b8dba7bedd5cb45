package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.store.ArchiveSummary;
import com.example.zipcatalog.store.CatalogQuery;
import com.example.zipcatalog.store.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Explicit hash pass over an existing catalog. Fills in SHA-256 fingerprints for archives and
 * entries that have none yet, so that duplicate detection has something to compare.
 */
public class CatalogHasher {
    private static final Logger LOGGER = LoggerFactory.getLogger(CatalogHasher.class);

    private final CatalogStore catalog;
    private final ArchiveProber prober;

    public CatalogHasher(CatalogStore catalog, ArchiveProber prober) {
        this.catalog = catalog;
        this.prober = prober;
    }

    /**
     * @param rehash also recompute fingerprints that are already stored
     */
    public Result hashMissing(boolean rehash) {
        long archivesHashed = 0;
        long entriesHashed = 0;
        List<FailureRecord> failures = new ArrayList<>();
        for (ArchiveSummary summary : catalog.listArchives()) {
            ArchiveRecord archive = summary.archive();
            Path path = Path.of(archive.sourcePath());
            List<CatalogMatch> pending = catalog.query(CatalogQuery.all().withArchiveId(archive.id())).stream()
                    .filter(match -> rehash || match.entry().contentHash() == null)
                    .toList();
            boolean archivePending = rehash || archive.contentHash() == null;
            if (!archivePending && pending.isEmpty()) {
                continue;
            }
            try {
                if (archivePending) {
                    catalog.updateArchiveHash(archive.id(), prober.hashArchive(path));
                    archivesHashed++;
                }
                if (!pending.isEmpty()) {
                    Map<String, String> hashes = prober.hashEntries(path);
                    for (CatalogMatch match : pending) {
                        String hash = hashes.get(match.entryPath());
                        if (hash != null) {
                            catalog.updateEntryHash(archive.id(), match.entryPath(), hash);
                            entriesHashed++;
                        }
                    }
                }
            } catch (IOException ex) {
                LOGGER.warn("Failed to hash {}", path, ex);
                failures.add(FailureRecord.of(path, ArchiveProbeException.classify(ex), ex.getMessage()));
            }
        }
        LOGGER.info("Hashed {} archives and {} entries, {} failures", archivesHashed, entriesHashed, failures.size());
        return new Result(archivesHashed, entriesHashed, failures);
    }

    public record Result(long archivesHashed, long entriesHashed, List<FailureRecord> failures) {
        public Result {
            failures = List.copyOf(failures);
        }
    }
}
