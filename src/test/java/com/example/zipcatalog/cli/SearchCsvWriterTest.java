package com.example.zipcatalog.cli;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.model.EntryRecord;
import com.example.zipcatalog.model.FileCategory;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SearchCsvWriterTest {

    @Test
    void writesHeaderAndOneRowPerMatch() throws Exception {
        UUID id = UUID.fromString("00000000-0000-0000-0000-000000000001");
        ArchiveRecord archive = new ArchiveRecord(id, "/mnt/a/takeout, part 1.zip", "a", 10, null, Instant.EPOCH);
        CatalogMatch match = new CatalogMatch(archive, new EntryRecord(id, "trip/IMG_0001.mp4", 42_000_000, 41_000_000,
                Instant.EPOCH, null, "video/mp4", FileCategory.VIDEO));
        Path file = Files.createTempDirectory("csv").resolve("results.csv");

        new SearchCsvWriter().write(List.of(match), file);

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());
        assertEquals("volume,zipFile,zipPath,archiveId,fileName,sizeMb,pathInZip", lines.get(0));
        assertEquals("a,\"takeout, part 1.zip\",\"/mnt/a/takeout, part 1.zip\",00000000-0000-0000-0000-000000000001,"
                + "IMG_0001.mp4,40.1,trip/IMG_0001.mp4", lines.get(1));
    }
}
