package com.example.zipcatalog.extract;

import java.util.List;

/**
 * Per-pair results in the order the pairs were given.
 */
public record ExtractionReport(List<ExtractionResult> results) {

    public ExtractionReport {
        results = List.copyOf(results);
    }

    public static ExtractionReport empty() {
        return new ExtractionReport(List.of());
    }

    public List<ExtractionResult> succeeded() {
        return results.stream().filter(ExtractionResult::isSuccess).toList();
    }

    public List<ExtractionResult> failed() {
        return results.stream().filter(result -> !result.isSuccess()).toList();
    }

    public long bytesWritten() {
        return results.stream().mapToLong(ExtractionResult::bytesWritten).sum();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
