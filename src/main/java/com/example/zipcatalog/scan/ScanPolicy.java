package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.FileCategory;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Inclusion policy for one volume: where to look for archives and which entries to keep.
 * An empty category set keeps every entry.
 */
public record ScanPolicy(
        ScanMode mode,
        Set<String> markerFolders,
        Set<String> excludedDirectories,
        Set<FileCategory> categories,
        boolean followLinks
) {
    public ScanPolicy {
        markerFolders = lowerCase(markerFolders);
        excludedDirectories = lowerCase(excludedDirectories);
        categories = categories == null ? Set.of() : Set.copyOf(categories);
    }

    public static ScanPolicy fullVolume(Set<String> excludedDirectories) {
        return new ScanPolicy(ScanMode.FULL_VOLUME, Set.of(), excludedDirectories, Set.of(), false);
    }

    public static ScanPolicy markerFolders(Set<String> markers) {
        return new ScanPolicy(ScanMode.MARKER_FOLDERS, markers, Set.of(), Set.of(), false);
    }

    public ScanPolicy withCategories(Set<FileCategory> value) {
        return new ScanPolicy(mode, markerFolders, excludedDirectories, value, followLinks);
    }

    public boolean isMarker(String directoryName) {
        return markerFolders.contains(directoryName.toLowerCase(Locale.ROOT));
    }

    public boolean isExcluded(String directoryName) {
        return excludedDirectories.contains(directoryName.toLowerCase(Locale.ROOT));
    }

    public boolean accepts(FileCategory category) {
        return categories.isEmpty() || categories.contains(category);
    }

    private static Set<String> lowerCase(Set<String> names) {
        if (names == null) {
            return Set.of();
        }
        return names.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }
}
