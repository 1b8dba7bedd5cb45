package com.example.zipcatalog.cli;

import java.util.Locale;

final class Formats {
    private static final double MIB = 1024.0 * 1024.0;

    private Formats() {
    }

    static String size(long bytes) {
        return String.format(Locale.ROOT, "%.1f MB", bytes / MIB);
    }

    static String megabytes(long bytes) {
        return String.format(Locale.ROOT, "%.1f", bytes / MIB);
    }
}
