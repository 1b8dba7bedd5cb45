package com.example.zipcatalog;

import com.example.zipcatalog.model.FileCategory;
import com.example.zipcatalog.scan.ScanMode;
import com.example.zipcatalog.scan.ScanPolicy;
import com.example.zipcatalog.scan.VolumeSpec;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public class ConfigLoader {
    private static final String DEFAULT_CATALOG_FILE = "zip_catalog.db";
    private static final int DEFAULT_FILE_RETRY_ATTEMPTS = 2;
    private static final long DEFAULT_HEARTBEAT_MILLIS = 2000;
    private static final int DEFAULT_EXTRACTION_BUFFER = 1024 * 1024;
    private static final List<String> DEFAULT_MARKER_FOLDERS = List.of("GoogleTakeout");
    private static final List<String> DEFAULT_EXCLUDED_DIRECTORIES = List.of(
            "System Volume Information",
            "$RECYCLE.BIN",
            "Windows",
            "Program Files",
            "Program Files (x86)",
            ".git",
            "__pycache__",
            "node_modules"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public CatalogConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);

        if (raw.volumes == null || raw.volumes.isEmpty()) {
            throw new IllegalArgumentException("Config must include at least one volume.");
        }

        Path catalogFile = Path.of(optionalString(raw.catalogFile, DEFAULT_CATALOG_FILE)).toAbsolutePath().normalize();
        Path workDirectory = raw.workDirectory == null || raw.workDirectory.isBlank()
                ? catalogFile.getParent()
                : Path.of(raw.workDirectory).toAbsolutePath().normalize();
        int maxConcurrency = raw.maxConcurrency != null && raw.maxConcurrency > 0
                ? raw.maxConcurrency
                : Math.max(1, Runtime.getRuntime().availableProcessors());
        int fileRetryAttempts = raw.fileRetryAttempts != null && raw.fileRetryAttempts >= 0
                ? raw.fileRetryAttempts
                : DEFAULT_FILE_RETRY_ATTEMPTS;
        long heartbeatMillis = raw.heartbeatIntervalMillis != null && raw.heartbeatIntervalMillis > 0
                ? raw.heartbeatIntervalMillis
                : DEFAULT_HEARTBEAT_MILLIS;
        int extractionBufferSize = raw.extractionBufferSize != null && raw.extractionBufferSize > 0
                ? raw.extractionBufferSize
                : DEFAULT_EXTRACTION_BUFFER;
        int extractionThreads = raw.extractionThreads != null && raw.extractionThreads > 0
                ? raw.extractionThreads
                : 1;
        boolean googleTakeoutMode = raw.googleTakeoutMode == null || raw.googleTakeoutMode;
        boolean followLinks = raw.followLinks != null && raw.followLinks;
        boolean computeHashes = raw.computeHashes != null && raw.computeHashes;
        Optional<Path> summaryFile = Optional.ofNullable(raw.summaryFile)
                .filter(value -> !value.isBlank())
                .map(Path::of);

        Set<FileCategory> categories = categories(raw);
        List<String> markerFolders = raw.markerFolders == null || raw.markerFolders.isEmpty()
                ? DEFAULT_MARKER_FOLDERS
                : raw.markerFolders;
        List<String> excludedDirectories = mergePatterns(DEFAULT_EXCLUDED_DIRECTORIES, raw.excludedDirectories);
        ScanMode defaultMode = googleTakeoutMode ? ScanMode.MARKER_FOLDERS : ScanMode.FULL_VOLUME;

        List<VolumeSpec> volumes = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (RawVolume volume : raw.volumes) {
            if (volume == null || volume.root == null || volume.root.isBlank()) {
                throw new IllegalArgumentException("Every volume needs a root path.");
            }
            Path root = Path.of(volume.root);
            String id = optionalString(volume.id, defaultId(root));
            if (!ids.add(id)) {
                throw new IllegalArgumentException("Duplicate volume id: " + id);
            }
            ScanMode mode = volume.mode == null || volume.mode.isBlank()
                    ? defaultMode
                    : ScanMode.valueOf(volume.mode.trim().toUpperCase(Locale.ROOT));
            ScanPolicy policy = new ScanPolicy(mode, Set.copyOf(markerFolders), Set.copyOf(excludedDirectories),
                    categories, followLinks);
            volumes.add(new VolumeSpec(id, root, policy));
        }

        return new CatalogConfig(
                catalogFile,
                workDirectory,
                List.copyOf(volumes),
                categories,
                maxConcurrency,
                fileRetryAttempts,
                computeHashes,
                Duration.ofMillis(heartbeatMillis),
                extractionBufferSize,
                extractionThreads,
                summaryFile
        );
    }

    /**
     * Explicit categories win; otherwise everything when scanAllFiles is set, else videos only.
     */
    private Set<FileCategory> categories(RawConfig raw) {
        if (raw.categories != null && !raw.categories.isEmpty()) {
            Set<FileCategory> parsed = EnumSet.noneOf(FileCategory.class);
            for (String category : raw.categories) {
                parsed.add(FileCategory.parse(category));
            }
            return Set.copyOf(parsed);
        }
        if (raw.scanAllFiles != null && raw.scanAllFiles) {
            return Set.of();
        }
        return Set.of(FileCategory.VIDEO);
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        Set<String> merged = new LinkedHashSet<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern != null && !pattern.isBlank()) {
                    merged.add(pattern);
                }
            }
        }
        return List.copyOf(merged);
    }

    private static String defaultId(Path root) {
        Path name = root.getFileName();
        return name == null ? root.toString() : name.toString();
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String catalogFile;
        public String workDirectory;
        public List<RawVolume> volumes = new ArrayList<>();
        public Boolean googleTakeoutMode;
        public List<String> markerFolders;
        public List<String> excludedDirectories;
        public Boolean scanAllFiles;
        public List<String> categories;
        public Integer maxConcurrency;
        public Integer fileRetryAttempts;
        public Boolean followLinks;
        public Boolean computeHashes;
        public Long heartbeatIntervalMillis;
        public Integer extractionBufferSize;
        public Integer extractionThreads;
        public String summaryFile;
    }

    private static class RawVolume {
        public String id;
        public String root;
        public String mode;
    }
}
