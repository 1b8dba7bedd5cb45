package com.example.zipcatalog.extract;

import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.model.ErrorKind;

import java.util.List;

/**
 * A name pattern matched several entries and no choice was made among them.
 */
public class AmbiguousSelectionException extends ExtractionException {
    private final List<CatalogMatch> candidates;

    public AmbiguousSelectionException(List<CatalogMatch> candidates) {
        super(ErrorKind.AMBIGUOUS_SELECTION, candidates.size() + " entries match; choose one or more of them");
        this.candidates = List.copyOf(candidates);
    }

    public List<CatalogMatch> getCandidates() {
        return candidates;
    }
}
