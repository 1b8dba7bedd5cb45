package com.example.zipcatalog.store;

import com.example.zipcatalog.model.CatalogMatch;

import java.util.List;

/**
 * Entries in different places that share a content hash.
 */
public record DuplicateGroup(String contentHash, List<CatalogMatch> copies) {
}
