package com.example.zipcatalog.extract;

import java.nio.file.Path;
import java.util.Objects;

/**
 * @param secondaryFilter optional case-insensitive substring the entry path must also contain
 * @param confirmAll      required for {@link SelectorKind#ALL}
 */
public record ExtractionRequest(Selector selector, Path destination, String secondaryFilter, boolean confirmAll) {

    public ExtractionRequest {
        Objects.requireNonNull(selector, "selector");
        Objects.requireNonNull(destination, "destination");
    }

    public static ExtractionRequest of(Selector selector, Path destination) {
        return new ExtractionRequest(selector, destination, null, false);
    }

    public ExtractionRequest withSecondaryFilter(String filter) {
        return new ExtractionRequest(selector, destination, filter, confirmAll);
    }

    public ExtractionRequest confirmed() {
        return new ExtractionRequest(selector, destination, secondaryFilter, true);
    }

    public boolean hasSecondaryFilter() {
        return secondaryFilter != null && !secondaryFilter.isBlank();
    }
}
