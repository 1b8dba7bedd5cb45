package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.EntryRecord;

import java.util.List;

public record ProbeResult(ArchiveRecord archive, List<EntryRecord> entries) {
    public ProbeResult {
        entries = List.copyOf(entries);
    }
}
