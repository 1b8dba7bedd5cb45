package com.example.zipcatalog.scan;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An independently scanned storage root and the policy to scan it with. The id becomes the
 * volume label of every archive found beneath the root.
 */
public record VolumeSpec(String id, Path root, ScanPolicy policy) {
    public VolumeSpec {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(policy, "policy");
    }
}
