package com.example.zipcatalog.store;

public record CatalogStats(long volumes, long archives, long entries, long totalBytes) {
}
