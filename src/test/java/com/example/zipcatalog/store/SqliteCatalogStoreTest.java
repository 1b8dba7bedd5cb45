package com.example.zipcatalog.store;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.model.EntryRecord;
import com.example.zipcatalog.model.FileCategory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteCatalogStoreTest {
    private static final Instant MODIFIED = Instant.parse("2023-04-01T10:15:30.123Z");

    private Path workDir;
    private SqliteCatalogStore catalog;

    @BeforeEach
    void setUp() throws Exception {
        workDir = Files.createTempDirectory("catalog-store");
        catalog = SqliteCatalogStore.open(workDir.resolve("catalog.db"));
    }

    @AfterEach
    void tearDown() {
        catalog.dispose();
    }

    @Test
    void mergingDisjointStoresAddsUpTheirRecords() {
        List<CatalogStore> sources = new ArrayList<>();
        List<ArchiveRecord> archives = new ArrayList<>();
        for (int store = 0; store < 3; store++) {
            CatalogStore source = catalog.createIsolated("vol" + store);
            for (int i = 0; i <= store; i++) {
                ArchiveRecord archive = archive("/vol" + store + "/takeout-" + i + ".zip", "vol" + store);
                source.insertArchive(archive);
                source.insertEntries(List.of(
                        entry(archive.id(), "clip-" + i + ".mp4", 100 + i, FileCategory.VIDEO),
                        entry(archive.id(), "photo-" + i + ".jpg", 10 + i, FileCategory.IMAGE)));
                archives.add(archive);
            }
            sources.add(source);
        }

        long mergedArchives = 0;
        for (CatalogStore source : sources) {
            mergedArchives += catalog.mergeFrom(source).archivesMerged();
            source.dispose();
        }

        assertEquals(6, mergedArchives);
        CatalogStats stats = catalog.stats();
        assertEquals(3, stats.volumes());
        assertEquals(6, stats.archives());
        assertEquals(12, stats.entries());
        for (ArchiveRecord archive : archives) {
            assertEquals(archive, catalog.findArchive(archive.id()).orElseThrow());
            List<CatalogMatch> entries = catalog.query(CatalogQuery.all().withArchiveId(archive.id()));
            assertEquals(2, entries.size());
        }
    }

    @Test
    void mergingTheSameSourceTwiceChangesNothing() {
        CatalogStore source = catalog.createIsolated("twice");
        ArchiveRecord archive = archive("/v/a.zip", "v");
        source.insertArchive(archive);
        source.insertEntries(List.of(entry(archive.id(), "a.mp4", 5, FileCategory.VIDEO)));

        MergeSummary first = catalog.mergeFrom(source);
        MergeSummary second = catalog.mergeFrom(source);
        source.dispose();

        assertEquals(1, first.archivesMerged());
        assertEquals(1, first.entriesMerged());
        assertEquals(0, second.recordsMerged());
        assertEquals(2, second.recordsSkipped());
        assertEquals(1, catalog.stats().archives());
        assertEquals(1, catalog.stats().entries());
    }

    @Test
    void conflictingIdentifierRollsBackOnlyThatSource() {
        UUID sharedId = UUID.randomUUID();
        CatalogStore first = catalog.createIsolated("first");
        first.insertArchive(new ArchiveRecord(sharedId, "/v1/a.zip", "v1", 10, null, MODIFIED));
        first.insertEntries(List.of(entry(sharedId, "a.mp4", 1, FileCategory.VIDEO)));
        catalog.mergeFrom(first);
        first.dispose();

        CatalogStore second = catalog.createIsolated("second");
        ArchiveRecord innocent = archive("/v2/b.zip", "v2");
        second.insertArchive(innocent);
        second.insertEntries(List.of(entry(innocent.id(), "b.mp4", 2, FileCategory.VIDEO)));
        second.insertArchive(new ArchiveRecord(sharedId, "/v2/other.zip", "v2", 10, null, MODIFIED));

        MergeConflictException ex = assertThrows(MergeConflictException.class, () -> catalog.mergeFrom(second));
        second.dispose();

        assertEquals(sharedId, ex.getArchiveId());
        assertTrue(catalog.findArchive(innocent.id()).isEmpty());
        assertEquals("/v1/a.zip", catalog.findArchive(sharedId).orElseThrow().sourcePath());
        assertEquals(1, catalog.stats().entries());
    }

    @Test
    void sameFileNameOnTwoVolumesGivesTwoArchives() {
        catalog.insertArchive(archive("/mnt/a/photos.zip", "a"));
        catalog.insertArchive(archive("/mnt/b/photos.zip", "b"));
        catalog.insertArchive(archive("/mnt/a/photos.zip", "b"));

        assertEquals(3, catalog.listArchives().size());
    }

    @Test
    void rescanOfTheSameArchiveReplacesTheEarlierRecord() {
        ArchiveRecord old = archive("/v/a.zip", "v");
        catalog.insertArchive(old);
        catalog.insertEntries(List.of(entry(old.id(), "old.mp4", 1, FileCategory.VIDEO)));

        ArchiveRecord rescanned = archive("/v/a.zip", "v");
        catalog.insertArchive(rescanned);
        catalog.insertEntries(List.of(entry(rescanned.id(), "new.mp4", 1, FileCategory.VIDEO)));

        List<ArchiveSummary> archives = catalog.listArchives();
        assertEquals(1, archives.size());
        assertEquals(rescanned.id(), archives.get(0).archive().id());
        assertEquals(List.of("new.mp4"), paths(catalog.query(CatalogQuery.all())));
    }

    @Test
    void queryCombinesFiltersAndOrdersByArchiveThenEntry() {
        ArchiveRecord second = archive("/v/b.zip", "v");
        ArchiveRecord first = archive("/v/a.zip", "v");
        catalog.insertArchive(second);
        catalog.insertArchive(first);
        catalog.insertEntries(List.of(
                entry(second.id(), "trip/IMG_0002.mp4", 2_000, FileCategory.VIDEO),
                entry(second.id(), "trip/IMG_0001.jpg", 50, FileCategory.IMAGE),
                entry(first.id(), "trip/img_0003.MP4", 3_000, FileCategory.VIDEO),
                entry(first.id(), "docs/readme.txt", 10, FileCategory.DOCUMENT)));

        assertEquals(List.of("trip/img_0003.MP4", "trip/IMG_0001.jpg", "trip/IMG_0002.mp4"),
                paths(catalog.query(CatalogQuery.substring("img_"))));
        assertEquals(List.of("trip/img_0003.MP4", "trip/IMG_0002.mp4"),
                paths(catalog.query(CatalogQuery.regex("\\.mp4$"))));
        assertEquals(List.of("trip/IMG_0002.mp4"),
                paths(catalog.query(CatalogQuery.substring("img").withSizeRange(1_000L, 2_500L))));
        assertEquals(List.of("trip/IMG_0001.jpg"),
                paths(catalog.query(CatalogQuery.all().withCategories(FileCategory.IMAGE))));
        assertEquals(List.of("docs/readme.txt"),
                paths(catalog.query(CatalogQuery.all().withLimit(1))));
        assertEquals(List.of("trip/img_0003.MP4"),
                paths(catalog.query(CatalogQuery.regex("mp4").withLimit(1))));
    }

    @Test
    void textAndRegexIgnoreCaseBeyondAscii() {
        ArchiveRecord archive = archive("/v/docs.zip", "v");
        catalog.insertArchive(archive);
        catalog.insertEntries(List.of(
                entry(archive.id(), "Été/Ökonomie.pdf", 10, FileCategory.DOCUMENT),
                entry(archive.id(), "winter/notes.pdf", 10, FileCategory.DOCUMENT)));

        assertEquals(List.of("Été/Ökonomie.pdf"), paths(catalog.query(CatalogQuery.substring("été"))));
        assertEquals(List.of("Été/Ökonomie.pdf"), paths(catalog.query(CatalogQuery.regex("^été/ök"))));
        assertEquals(List.of("Été/Ökonomie.pdf"), paths(catalog.query(CatalogQuery.substring("ÖKONOMIE").withLimit(1))));
    }

    @Test
    void rejectsInvertedSizeRange() {
        assertThrows(IllegalArgumentException.class, () -> CatalogQuery.all().withSizeRange(10L, 5L));
    }

    @Test
    void disposingAnIsolatedStoreRemovesItsFile() throws Exception {
        SqliteCatalogStore isolated = (SqliteCatalogStore) catalog.createIsolated("temp");
        ArchiveRecord archive = archive("/v/a.zip", "v");
        isolated.insertArchive(archive);
        Path file = isolated.databaseFile();
        assertTrue(Files.exists(file));

        isolated.dispose();

        assertFalse(Files.exists(file));
        try (Stream<Path> files = Files.list(workDir)) {
            assertEquals(List.of("catalog.db"), files.map(path -> path.getFileName().toString()).toList());
        }
    }

    @Test
    void groupsEntriesWithTheSameContentHash() {
        ArchiveRecord a = archive("/v/a.zip", "v");
        ArchiveRecord b = archive("/w/b.zip", "w");
        catalog.insertArchive(a);
        catalog.insertArchive(b);
        catalog.insertEntries(List.of(
                entry(a.id(), "clip.mp4", 5, FileCategory.VIDEO).withContentHash("abc"),
                entry(a.id(), "other.mp4", 5, FileCategory.VIDEO),
                entry(b.id(), "copy/clip.mp4", 5, FileCategory.VIDEO).withContentHash("abc")));
        catalog.updateEntryHash(b.id(), "unique.mp4", "never-stored");

        List<DuplicateGroup> duplicates = catalog.findDuplicates();

        assertEquals(1, duplicates.size());
        assertEquals("abc", duplicates.get(0).contentHash());
        assertEquals(List.of("clip.mp4", "copy/clip.mp4"), paths(duplicates.get(0).copies()));
    }

    @Test
    void validationReportsArchivesMissingFromDisk() throws Exception {
        Path present = Files.createFile(workDir.resolve("present.zip"));
        catalog.insertArchive(archive(present.toString(), "v"));
        assertTrue(catalog.validate().isEmpty());

        catalog.insertArchive(archive(workDir.resolve("gone.zip").toString(), "v"));

        List<String> issues = catalog.validate();
        assertEquals(1, issues.size());
        assertTrue(issues.get(0).startsWith("1 archives"));
    }

    @Test
    void perVolumeStatisticsCountArchivesAndEntries() {
        ArchiveRecord a = archive("/v/a.zip", "v");
        catalog.insertArchive(a);
        catalog.insertArchive(archive("/w/empty.zip", "w"));
        catalog.insertEntries(List.of(
                entry(a.id(), "1.mp4", 100, FileCategory.VIDEO),
                entry(a.id(), "2.mp4", 200, FileCategory.VIDEO)));

        assertEquals(List.of(new VolumeStats("v", 1, 2, 300), new VolumeStats("w", 1, 0, 0)), catalog.volumeStats());
        assertEquals(new CatalogStats(2, 2, 2, 300), catalog.stats());
    }

    private static ArchiveRecord archive(String path, String volume) {
        return new ArchiveRecord(UUID.randomUUID(), path, volume, 1_000, null, MODIFIED);
    }

    private static EntryRecord entry(UUID archiveId, String path, long size, FileCategory category) {
        return new EntryRecord(archiveId, path, size, size / 2, MODIFIED, null, "application/octet-stream", category);
    }

    private static List<String> paths(List<CatalogMatch> matches) {
        return matches.stream().map(CatalogMatch::entryPath).toList();
    }
}
