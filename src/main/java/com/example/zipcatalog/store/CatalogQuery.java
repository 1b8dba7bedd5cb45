package com.example.zipcatalog.store;

import com.example.zipcatalog.model.FileCategory;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Filter over catalogued entries. Every populated criterion must hold (AND semantics);
 * null or empty criteria are ignored. {@code text} is a case-insensitive substring of the entry path,
 * {@code regex} is searched (not fully matched) against the entry path. Case folding covers
 * non-ASCII letters too.
 */
public record CatalogQuery(
        String text,
        Pattern regex,
        Long minSize,
        Long maxSize,
        Set<FileCategory> categories,
        UUID archiveId,
        String volume,
        int limit
) {
    public CatalogQuery {
        categories = categories == null || categories.isEmpty() ? Set.of() : Set.copyOf(categories);
        if (minSize != null && maxSize != null && minSize > maxSize) {
            throw new IllegalArgumentException("minSize must not exceed maxSize");
        }
    }

    public static CatalogQuery all() {
        return new CatalogQuery(null, null, null, null, Set.of(), null, null, 0);
    }

    public static CatalogQuery substring(String text) {
        return all().withText(text);
    }

    public static CatalogQuery regex(String expression) {
        return all().withRegex(Pattern.compile(expression, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    /**
     * Either a substring or a regular-expression query, as selected by {@code regex}.
     */
    public static CatalogQuery of(String textOrRegex, boolean regex) {
        return regex ? regex(textOrRegex) : substring(textOrRegex);
    }

    public CatalogQuery withText(String value) {
        return new CatalogQuery(value, regex, minSize, maxSize, categories, archiveId, volume, limit);
    }

    public CatalogQuery withRegex(Pattern value) {
        return new CatalogQuery(text, value, minSize, maxSize, categories, archiveId, volume, limit);
    }

    public CatalogQuery withSizeRange(Long min, Long max) {
        return new CatalogQuery(text, regex, min, max, categories, archiveId, volume, limit);
    }

    public CatalogQuery withCategories(Set<FileCategory> value) {
        return new CatalogQuery(text, regex, minSize, maxSize, value, archiveId, volume, limit);
    }

    public CatalogQuery withCategories(FileCategory first, FileCategory... rest) {
        return withCategories(EnumSet.of(first, rest));
    }

    public CatalogQuery withArchiveId(UUID value) {
        return new CatalogQuery(text, regex, minSize, maxSize, categories, value, volume, limit);
    }

    public CatalogQuery withVolume(String value) {
        return new CatalogQuery(text, regex, minSize, maxSize, categories, archiveId, value, limit);
    }

    public CatalogQuery withLimit(int value) {
        return new CatalogQuery(text, regex, minSize, maxSize, categories, archiveId, volume, value);
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    /**
     * Applies the text and regex criteria to an entry path.
     */
    public boolean matchesPath(String entryPath) {
        if (hasText() && !entryPath.toLowerCase(Locale.ROOT).contains(text.toLowerCase(Locale.ROOT))) {
            return false;
        }
        return regex == null || regex.matcher(entryPath).find();
    }
}
