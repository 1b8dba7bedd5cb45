package com.example.zipcatalog.extract;

import java.util.Objects;
import java.util.UUID;

/**
 * What to extract: entries whose path matches a pattern, every entry of one archive, or everything.
 * For {@link SelectorKind#NAME_PATTERN} the value is a case-insensitive substring unless {@code regex} is set.
 */
public record Selector(SelectorKind kind, String value, boolean regex) {

    public Selector {
        Objects.requireNonNull(kind, "kind");
        if (kind != SelectorKind.ALL && (value == null || value.isBlank())) {
            throw new IllegalArgumentException(kind + " selector needs a value");
        }
        if (kind == SelectorKind.ARCHIVE_ID) {
            UUID.fromString(value);
        }
    }

    public static Selector name(String pattern) {
        return new Selector(SelectorKind.NAME_PATTERN, pattern, false);
    }

    public static Selector nameRegex(String pattern) {
        return new Selector(SelectorKind.NAME_PATTERN, pattern, true);
    }

    public static Selector archive(UUID archiveId) {
        return new Selector(SelectorKind.ARCHIVE_ID, archiveId.toString(), false);
    }

    public static Selector all() {
        return new Selector(SelectorKind.ALL, null, false);
    }

    public UUID archiveId() {
        return kind == SelectorKind.ARCHIVE_ID ? UUID.fromString(value) : null;
    }
}
