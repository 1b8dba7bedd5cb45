package com.example.zipcatalog.store;

import com.example.zipcatalog.model.ArchiveRecord;

public record ArchiveSummary(ArchiveRecord archive, long entryCount) {
}
