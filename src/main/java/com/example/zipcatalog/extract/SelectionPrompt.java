package com.example.zipcatalog.extract;

import com.example.zipcatalog.model.CatalogMatch;

import java.util.List;

/**
 * Lets a user narrow an ambiguous name match. Returning an empty list extracts nothing.
 */
@FunctionalInterface
public interface SelectionPrompt {

    List<CatalogMatch> choose(List<CatalogMatch> candidates) throws ExtractionException;

    /**
     * Used when nobody can answer: every ambiguous match is an error.
     */
    SelectionPrompt NON_INTERACTIVE = candidates -> {
        throw new AmbiguousSelectionException(candidates);
    };
}
