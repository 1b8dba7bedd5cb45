package com.example.zipcatalog.store;

import java.time.Duration;

public record MergeSummary(
        long archivesMerged,
        long archivesSkipped,
        long entriesMerged,
        long entriesSkipped,
        Duration elapsed
) {
    public long recordsMerged() {
        return archivesMerged + entriesMerged;
    }

    public long recordsSkipped() {
        return archivesSkipped + entriesSkipped;
    }
}
