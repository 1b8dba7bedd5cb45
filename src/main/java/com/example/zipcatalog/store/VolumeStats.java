package com.example.zipcatalog.store;

public record VolumeStats(String volume, long archives, long entries, long totalBytes) {
}
