package com.example.zipcatalog.extract;

public enum SelectorKind {
    NAME_PATTERN,
    ARCHIVE_ID,
    ALL
}
