package com.example.zipcatalog.scan;

import com.example.zipcatalog.ZipFixtures;
import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.store.CatalogQuery;
import com.example.zipcatalog.store.DuplicateGroup;
import com.example.zipcatalog.store.SqliteCatalogStore;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogHasherTest {
    private final ArchiveProber prober = new ArchiveProber(new Tika());

    @Test
    void fillsMissingHashesAndEnablesDuplicateDetection() throws Exception {
        Path dir = Files.createTempDirectory("hasher");
        Path first = ZipFixtures.zip(dir.resolve("first.zip"), "trip/clip.mp4", "same bytes", "trip/other.mp4", "different");
        Path second = ZipFixtures.zip(dir.resolve("second.zip"), "backup/clip.mp4", "same bytes");

        try (SqliteCatalogStore catalog = SqliteCatalogStore.open(dir.resolve("catalog.db"))) {
            for (Path zip : List.of(first, second)) {
                ProbeResult result = prober.probe(zip, "v");
                catalog.insertArchive(result.archive());
                catalog.insertEntries(result.entries());
            }
            assertTrue(catalog.findDuplicates().isEmpty());

            CatalogHasher.Result result = new CatalogHasher(catalog, prober).hashMissing(false);

            assertEquals(2, result.archivesHashed());
            assertEquals(3, result.entriesHashed());
            assertTrue(result.failures().isEmpty());
            catalog.listArchives().forEach(summary -> assertNotNull(summary.archive().contentHash()));
            List<DuplicateGroup> duplicates = catalog.findDuplicates();
            assertEquals(1, duplicates.size());
            assertEquals(List.of("trip/clip.mp4", "backup/clip.mp4").stream().sorted().toList(),
                    duplicates.get(0).copies().stream().map(CatalogMatch::entryPath).sorted().toList());

            CatalogHasher.Result again = new CatalogHasher(catalog, prober).hashMissing(false);
            assertEquals(0, again.archivesHashed());
            assertEquals(0, again.entriesHashed());
        }
    }

    @Test
    void missingArchiveIsReportedAsFailure() throws Exception {
        Path dir = Files.createTempDirectory("hasher-missing");
        Path zip = ZipFixtures.zip(dir.resolve("gone.zip"), "clip.mp4", "x");

        try (SqliteCatalogStore catalog = SqliteCatalogStore.open(dir.resolve("catalog.db"))) {
            ProbeResult result = prober.probe(zip, "v");
            catalog.insertArchive(result.archive());
            catalog.insertEntries(result.entries());
            Files.delete(zip);

            CatalogHasher.Result hashed = new CatalogHasher(catalog, prober).hashMissing(false);

            assertEquals(1, hashed.failures().size());
            assertEquals(0, hashed.archivesHashed());
            assertTrue(catalog.query(CatalogQuery.all()).stream().allMatch(match -> match.entry().contentHash() == null));
        }
    }
}
