package com.example.zipcatalog.scan;

import com.example.zipcatalog.ZipFixtures;
import com.example.zipcatalog.model.EntryRecord;
import com.example.zipcatalog.model.ErrorKind;
import com.example.zipcatalog.model.FileCategory;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveProberTest {
    private final ArchiveProber prober = new ArchiveProber(new Tika());

    @Test
    void listsFileEntriesWithoutDirectoriesOrEmptyFiles() throws Exception {
        Path dir = Files.createTempDirectory("prober");
        Path zip = ZipFixtures.zip(dir.resolve("trip.zip"),
                "trip/", "",
                "trip/clip.mp4", "moving pictures",
                "trip/photo.jpg", "still",
                "trip/empty.txt", "");

        ProbeResult result = prober.probe(zip, "vol1");

        assertEquals("vol1", result.archive().volume());
        assertEquals(Files.size(zip), result.archive().size());
        assertEquals(zip.toAbsolutePath().normalize().toString(), result.archive().sourcePath());
        assertNull(result.archive().contentHash());
        Map<String, EntryRecord> entries = result.entries().stream()
                .collect(Collectors.toMap(EntryRecord::entryPath, entry -> entry));
        assertEquals(2, entries.size());
        assertEquals(FileCategory.VIDEO, entries.get("trip/clip.mp4").category());
        assertEquals("video/mp4", entries.get("trip/clip.mp4").mediaType());
        assertEquals(15L, entries.get("trip/clip.mp4").size());
        assertEquals(FileCategory.IMAGE, entries.get("trip/photo.jpg").category());
        assertTrue(result.entries().stream().allMatch(entry -> entry.archiveId().equals(result.archive().id())));
    }

    @Test
    void mintsAFreshIdentifierPerProbe() throws Exception {
        Path zip = ZipFixtures.zip(Files.createTempDirectory("prober-ids").resolve("a.zip"), "a.txt", "a");

        assertNotEquals(prober.probe(zip, "v").archive().id(), prober.probe(zip, "v").archive().id());
    }

    @Test
    void rejectsFilesThatAreNotZipContainers() throws Exception {
        Path fake = Files.createTempDirectory("prober-fake").resolve("fake.zip");
        Files.writeString(fake, "just some text pretending to be an archive");

        UnsupportedArchiveException ex = assertThrows(UnsupportedArchiveException.class, () -> prober.probe(fake, "v"));
        assertEquals(fake, ex.getArchive());
    }

    @Test
    void reportsUnreadableZipStructureAsCorrupt() throws Exception {
        Path broken = Files.createTempDirectory("prober-broken").resolve("broken.zip");
        byte[] bytes = new byte[200];
        bytes[0] = 'P';
        bytes[1] = 'K';
        bytes[2] = 3;
        bytes[3] = 4;
        Files.write(broken, bytes);

        CorruptArchiveException ex = assertThrows(CorruptArchiveException.class, () -> prober.probe(broken, "v"));
        assertEquals(ErrorKind.CORRUPT_ARCHIVE, ex.getKind());
    }

    @Test
    void hashesEntriesOnRequest() throws Exception {
        Path zip = ZipFixtures.zip(Files.createTempDirectory("prober-hash").resolve("h.zip"),
                "one.txt", "first",
                "two.txt", "second");

        Map<String, String> hashes = prober.hashEntries(zip);

        assertEquals(ArchiveProber.sha256(new ByteArrayInputStream("first".getBytes(StandardCharsets.UTF_8))),
                hashes.get("one.txt"));
        assertEquals(2, hashes.size());
        assertEquals(64, prober.hashArchive(zip).length());
    }
}
