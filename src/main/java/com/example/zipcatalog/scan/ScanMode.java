package com.example.zipcatalog.scan;

public enum ScanMode {
    /**
     * Only directories directly under the volume root whose name is a configured marker
     * (e.g. {@code GoogleTakeout}) are searched, recursively.
     */
    MARKER_FOLDERS,
    /**
     * The whole tree under the volume root is searched, minus excluded directory names.
     */
    FULL_VOLUME
}
