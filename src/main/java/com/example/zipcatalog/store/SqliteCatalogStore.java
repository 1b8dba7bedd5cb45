package com.example.zipcatalog.store;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.model.EntryRecord;
import com.example.zipcatalog.model.FileCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * SQLite-backed catalog. Each instance owns one connection to one database file; all public
 * methods are synchronized so readers never observe a merge that is only partly applied.
 */
public final class SqliteCatalogStore implements CatalogStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteCatalogStore.class);

    private static final String ARCHIVE_COLUMNS =
            "a.id, a.source_path, a.volume, a.size, a.content_hash, a.last_modified";
    private static final String ENTRY_COLUMNS =
            "e.archive_id, e.entry_path, e.size, e.compressed_size, e.modified, e.content_hash, e.media_type, e.category";

    private static final String UPSERT_ENTRY = """
            INSERT INTO entries (archive_id, entry_path, size, compressed_size, modified, content_hash, media_type, category)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (archive_id, entry_path) DO UPDATE SET
                size = excluded.size,
                compressed_size = excluded.compressed_size,
                modified = excluded.modified,
                content_hash = COALESCE(excluded.content_hash, entries.content_hash),
                media_type = excluded.media_type,
                category = excluded.category
            WHERE entries.size IS NOT excluded.size
               OR entries.compressed_size IS NOT excluded.compressed_size
               OR entries.modified IS NOT excluded.modified
               OR (excluded.content_hash IS NOT NULL AND entries.content_hash IS NOT excluded.content_hash)
               OR entries.media_type IS NOT excluded.media_type
               OR entries.category IS NOT excluded.category
            """;

    private final Path databaseFile;
    private final Path workDirectory;
    private final boolean isolated;
    private final Connection connection;
    private boolean disposed;

    private SqliteCatalogStore(Path databaseFile, Path workDirectory, boolean isolated) {
        this.databaseFile = databaseFile.toAbsolutePath().normalize();
        this.workDirectory = workDirectory.toAbsolutePath().normalize();
        this.isolated = isolated;
        this.connection = connect(this.databaseFile);
        initSchema();
    }

    /**
     * Opens (creating if needed) the catalog stored in {@code databaseFile}. Isolated stores are
     * created next to it.
     */
    public static SqliteCatalogStore open(Path databaseFile) {
        Path parent = databaseFile.toAbsolutePath().normalize().getParent();
        return open(databaseFile, parent);
    }

    public static SqliteCatalogStore open(Path databaseFile, Path workDirectory) {
        createParent(databaseFile);
        return new SqliteCatalogStore(databaseFile, workDirectory, false);
    }

    public Path databaseFile() {
        return databaseFile;
    }

    @Override
    public synchronized CatalogStore createIsolated(String label) {
        ensureOpen();
        String base = databaseFile.getFileName().toString();
        String name = String.format("%s.job-%s-%s.tmp", base, sanitize(label), UUID.randomUUID().toString().substring(0, 8));
        Path file = workDirectory.resolve(name);
        createParent(file);
        deleteBackingFiles(file);
        LOGGER.debug("Creating isolated store {}", file);
        return new SqliteCatalogStore(file, workDirectory, true);
    }

    @Override
    public synchronized void insertArchive(ArchiveRecord record) {
        ensureOpen();
        try {
            upsertArchive(record);
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to insert archive " + record.sourcePath(), ex);
        }
    }

    @Override
    public synchronized int insertEntries(List<EntryRecord> records) {
        ensureOpen();
        if (records.isEmpty()) {
            return 0;
        }
        return inTransaction("insert entries", () -> {
            int written = 0;
            try (PreparedStatement ps = connection.prepareStatement(UPSERT_ENTRY)) {
                for (EntryRecord record : records) {
                    bindEntry(ps, record);
                    written += ps.executeUpdate();
                }
            }
            return written;
        });
    }

    @Override
    public synchronized MergeSummary mergeFrom(CatalogStore other) {
        ensureOpen();
        if (other == this) {
            throw new IllegalArgumentException("A store cannot be merged into itself");
        }
        long start = System.nanoTime();
        long[] counts = new long[4];
        inTransaction("merge", () -> {
            // Archives first so every incoming entry finds its owner.
            other.forEachArchive(archive -> {
                if (mergeArchive(archive)) {
                    counts[0]++;
                } else {
                    counts[1]++;
                }
            });
            try (PreparedStatement ps = connection.prepareStatement(UPSERT_ENTRY)) {
                other.forEachEntry(entry -> {
                    try {
                        bindEntry(ps, entry);
                        if (ps.executeUpdate() > 0) {
                            counts[2]++;
                        } else {
                            counts[3]++;
                        }
                    } catch (SQLException ex) {
                        throw new CatalogStoreException("Failed to merge entry " + entry.entryPath(), ex);
                    }
                });
            }
            return null;
        });
        MergeSummary summary = new MergeSummary(counts[0], counts[1], counts[2], counts[3],
                Duration.ofNanos(System.nanoTime() - start));
        LOGGER.debug("Merged into {}: {}", databaseFile.getFileName(), summary);
        return summary;
    }

    @Override
    public synchronized List<CatalogMatch> query(CatalogQuery filter) {
        ensureOpen();
        StringBuilder sql = new StringBuilder("SELECT ").append(ARCHIVE_COLUMNS).append(", ").append(ENTRY_COLUMNS)
                .append(" FROM entries e JOIN archives a ON a.id = e.archive_id WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (filter.minSize() != null) {
            sql.append(" AND e.size >= ?");
            params.add(filter.minSize());
        }
        if (filter.maxSize() != null) {
            sql.append(" AND e.size <= ?");
            params.add(filter.maxSize());
        }
        if (!filter.categories().isEmpty()) {
            sql.append(" AND e.category IN (");
            String separator = "";
            for (FileCategory category : filter.categories()) {
                sql.append(separator).append('?');
                params.add(category.name());
                separator = ", ";
            }
            sql.append(')');
        }
        if (filter.archiveId() != null) {
            sql.append(" AND a.id = ?");
            params.add(filter.archiveId().toString());
        }
        if (filter.volume() != null) {
            sql.append(" AND a.volume = ?");
            params.add(filter.volume());
        }
        sql.append(" ORDER BY a.source_path, a.volume, a.id, e.entry_path");
        // Path matching happens in Java, so the limit can only be pushed down without it.
        boolean matchesInJava = filter.hasText() || filter.regex() != null;
        if (filter.limit() > 0 && !matchesInJava) {
            sql.append(" LIMIT ").append(filter.limit());
        }

        List<CatalogMatch> matches = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql.toString())) {
            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    EntryRecord entry = readEntry(rs, 7);
                    if (matchesInJava && !filter.matchesPath(entry.entryPath())) {
                        continue;
                    }
                    matches.add(new CatalogMatch(readArchive(rs, 1), entry));
                    if (filter.limit() > 0 && matches.size() >= filter.limit()) {
                        break;
                    }
                }
            }
        } catch (SQLException ex) {
            throw new CatalogStoreException("Query failed", ex);
        }
        return matches;
    }

    @Override
    public synchronized Optional<ArchiveRecord> findArchive(UUID id) {
        ensureOpen();
        try {
            return selectArchive(id);
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to look up archive " + id, ex);
        }
    }

    @Override
    public synchronized List<ArchiveSummary> listArchives() {
        ensureOpen();
        String sql = "SELECT " + ARCHIVE_COLUMNS
                + ", (SELECT COUNT(*) FROM entries e WHERE e.archive_id = a.id)"
                + " FROM archives a ORDER BY a.source_path, a.volume, a.id";
        List<ArchiveSummary> archives = new ArrayList<>();
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                archives.add(new ArchiveSummary(readArchive(rs, 1), rs.getLong(7)));
            }
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to list archives", ex);
        }
        return archives;
    }

    @Override
    public synchronized void forEachArchive(Consumer<ArchiveRecord> action) {
        ensureOpen();
        String sql = "SELECT " + ARCHIVE_COLUMNS + " FROM archives a ORDER BY a.source_path, a.volume, a.id";
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                action.accept(readArchive(rs, 1));
            }
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to read archives from " + databaseFile, ex);
        }
    }

    @Override
    public synchronized void forEachEntry(Consumer<EntryRecord> action) {
        ensureOpen();
        String sql = "SELECT " + ENTRY_COLUMNS + " FROM entries e ORDER BY e.archive_id, e.entry_path";
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                action.accept(readEntry(rs, 1));
            }
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to read entries from " + databaseFile, ex);
        }
    }

    @Override
    public synchronized void updateArchiveHash(UUID archiveId, String contentHash) {
        ensureOpen();
        try (PreparedStatement ps = connection.prepareStatement("UPDATE archives SET content_hash = ? WHERE id = ?")) {
            ps.setString(1, contentHash);
            ps.setString(2, archiveId.toString());
            ps.executeUpdate();
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to update hash of archive " + archiveId, ex);
        }
    }

    @Override
    public synchronized void updateEntryHash(UUID archiveId, String entryPath, String contentHash) {
        ensureOpen();
        try (PreparedStatement ps = connection.prepareStatement(
                "UPDATE entries SET content_hash = ? WHERE archive_id = ? AND entry_path = ?")) {
            ps.setString(1, contentHash);
            ps.setString(2, archiveId.toString());
            ps.setString(3, entryPath);
            ps.executeUpdate();
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to update hash of " + entryPath, ex);
        }
    }

    @Override
    public synchronized CatalogStats stats() {
        ensureOpen();
        String sql = """
                SELECT (SELECT COUNT(DISTINCT volume) FROM archives),
                       (SELECT COUNT(*) FROM archives),
                       (SELECT COUNT(*) FROM entries),
                       (SELECT COALESCE(SUM(size), 0) FROM entries)
                """;
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return new CatalogStats(rs.getLong(1), rs.getLong(2), rs.getLong(3), rs.getLong(4));
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to compute catalog statistics", ex);
        }
    }

    @Override
    public synchronized List<VolumeStats> volumeStats() {
        ensureOpen();
        String sql = """
                SELECT a.volume, COUNT(DISTINCT a.id), COUNT(e.entry_path), COALESCE(SUM(e.size), 0)
                FROM archives a LEFT JOIN entries e ON e.archive_id = a.id
                GROUP BY a.volume ORDER BY a.volume
                """;
        List<VolumeStats> result = new ArrayList<>();
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                result.add(new VolumeStats(rs.getString(1), rs.getLong(2), rs.getLong(3), rs.getLong(4)));
            }
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to compute volume statistics", ex);
        }
        return result;
    }

    @Override
    public synchronized List<DuplicateGroup> findDuplicates() {
        ensureOpen();
        String sql = "SELECT " + ARCHIVE_COLUMNS + ", " + ENTRY_COLUMNS
                + " FROM entries e JOIN archives a ON a.id = e.archive_id"
                + " WHERE e.content_hash IN ("
                + "   SELECT content_hash FROM entries WHERE content_hash IS NOT NULL"
                + "   GROUP BY content_hash HAVING COUNT(*) > 1)"
                + " ORDER BY e.content_hash, a.source_path, a.volume, e.entry_path";
        Map<String, List<CatalogMatch>> groups = new LinkedHashMap<>();
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                CatalogMatch match = new CatalogMatch(readArchive(rs, 1), readEntry(rs, 7));
                groups.computeIfAbsent(match.entry().contentHash(), ignored -> new ArrayList<>()).add(match);
            }
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to search for duplicates", ex);
        }
        List<DuplicateGroup> result = new ArrayList<>();
        groups.forEach((hash, copies) -> result.add(new DuplicateGroup(hash, List.copyOf(copies))));
        return result;
    }

    @Override
    public synchronized List<String> validate() {
        ensureOpen();
        List<String> issues = new ArrayList<>();
        long missing = 0;
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT source_path FROM archives")) {
            while (rs.next()) {
                if (!Files.exists(Path.of(rs.getString(1)))) {
                    missing++;
                }
            }
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to validate archives", ex);
        }
        if (missing > 0) {
            issues.add(missing + " archives in the catalog no longer exist on disk");
        }
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT COUNT(*) FROM entries e LEFT JOIN archives a ON a.id = e.archive_id WHERE a.id IS NULL")) {
            rs.next();
            long orphaned = rs.getLong(1);
            if (orphaned > 0) {
                issues.add(orphaned + " entries reference an archive that is not catalogued");
            }
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to validate entries", ex);
        }
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery("PRAGMA integrity_check")) {
            rs.next();
            String result = rs.getString(1);
            if (!"ok".equalsIgnoreCase(result)) {
                issues.add("Database integrity check failed: " + result);
            }
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to run integrity check", ex);
        }
        return issues;
    }

    @Override
    public synchronized void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        try {
            connection.close();
        } catch (SQLException ex) {
            LOGGER.warn("Failed to close catalog connection for {}", databaseFile, ex);
        }
        if (isolated) {
            deleteBackingFiles(databaseFile);
        }
    }

    private boolean mergeArchive(ArchiveRecord incoming) {
        try {
            Optional<ArchiveRecord> existing = selectArchive(incoming.id());
            ArchiveRecord merged = incoming;
            if (existing.isPresent()) {
                ArchiveRecord stored = existing.get();
                if (!stored.sourcePath().equals(incoming.sourcePath()) || !stored.volume().equals(incoming.volume())) {
                    throw new MergeConflictException(incoming.id(), String.format(
                            "Archive %s is catalogued as %s on %s but arrives as %s on %s",
                            incoming.id(), stored.sourcePath(), stored.volume(), incoming.sourcePath(), incoming.volume()));
                }
                if (incoming.contentHash() == null) {
                    merged = incoming.withContentHash(stored.contentHash());
                }
                if (merged.equals(stored)) {
                    return false;
                }
            }
            upsertArchive(merged);
            return true;
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to merge archive " + incoming.sourcePath(), ex);
        }
    }

    private void upsertArchive(ArchiveRecord record) throws SQLException {
        // A newer scan of the same (path, volume) supersedes the stored archive and its entries.
        try (PreparedStatement ps = connection.prepareStatement(
                "DELETE FROM archives WHERE source_path = ? AND volume = ? AND id <> ?")) {
            ps.setString(1, record.sourcePath());
            ps.setString(2, record.volume());
            ps.setString(3, record.id().toString());
            int replaced = ps.executeUpdate();
            if (replaced > 0) {
                LOGGER.debug("Replaced {} earlier record(s) of {} on {}", replaced, record.sourcePath(), record.volume());
            }
        }
        try (PreparedStatement ps = connection.prepareStatement("""
                INSERT INTO archives (id, source_path, volume, size, content_hash, last_modified, scanned_at)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    source_path = excluded.source_path,
                    volume = excluded.volume,
                    size = excluded.size,
                    content_hash = COALESCE(excluded.content_hash, archives.content_hash),
                    last_modified = excluded.last_modified
                """)) {
            ps.setString(1, record.id().toString());
            ps.setString(2, record.sourcePath());
            ps.setString(3, record.volume());
            ps.setLong(4, record.size());
            ps.setString(5, record.contentHash());
            setInstant(ps, 6, record.lastModified());
            ps.setLong(7, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private Optional<ArchiveRecord> selectArchive(UUID id) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT " + ARCHIVE_COLUMNS + " FROM archives a WHERE a.id = ?")) {
            ps.setString(1, id.toString());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readArchive(rs, 1)) : Optional.empty();
            }
        }
    }

    private void bindEntry(PreparedStatement ps, EntryRecord record) throws SQLException {
        ps.setString(1, record.archiveId().toString());
        ps.setString(2, record.entryPath());
        ps.setLong(3, record.size());
        ps.setLong(4, record.compressedSize());
        setInstant(ps, 5, record.lastModified());
        ps.setString(6, record.contentHash());
        ps.setString(7, record.mediaType());
        ps.setString(8, record.category().name());
    }

    private static ArchiveRecord readArchive(ResultSet rs, int offset) throws SQLException {
        return new ArchiveRecord(
                UUID.fromString(rs.getString(offset)),
                rs.getString(offset + 1),
                rs.getString(offset + 2),
                rs.getLong(offset + 3),
                rs.getString(offset + 4),
                getInstant(rs, offset + 5)
        );
    }

    private static EntryRecord readEntry(ResultSet rs, int offset) throws SQLException {
        return new EntryRecord(
                UUID.fromString(rs.getString(offset)),
                rs.getString(offset + 1),
                rs.getLong(offset + 2),
                rs.getLong(offset + 3),
                getInstant(rs, offset + 4),
                rs.getString(offset + 5),
                rs.getString(offset + 6),
                FileCategory.valueOf(rs.getString(offset + 7))
        );
    }

    private static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    private static Instant getInstant(ResultSet rs, int index) throws SQLException {
        long millis = rs.getLong(index);
        return rs.wasNull() ? null : Instant.ofEpochMilli(millis);
    }

    private <T> T inTransaction(String operation, SqlWork<T> work) {
        try {
            connection.setAutoCommit(false);
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to begin " + operation + " on " + databaseFile, ex);
        }
        try {
            T result = work.run();
            connection.commit();
            return result;
        } catch (SQLException | RuntimeException ex) {
            rollback(operation);
            if (ex instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CatalogStoreException(operation + " failed on " + databaseFile, ex);
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException ex) {
                LOGGER.warn("Failed to restore auto-commit on {}", databaseFile, ex);
            }
        }
    }

    private void rollback(String operation) {
        try {
            connection.rollback();
        } catch (SQLException ex) {
            LOGGER.error("Rollback of {} on {} failed", operation, databaseFile, ex);
        }
    }

    private void initSchema() {
        try (Statement st = connection.createStatement()) {
            st.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS archives (
                        id TEXT PRIMARY KEY,
                        source_path TEXT NOT NULL,
                        volume TEXT NOT NULL,
                        size INTEGER NOT NULL,
                        content_hash TEXT,
                        last_modified INTEGER,
                        scanned_at INTEGER NOT NULL,
                        UNIQUE (source_path, volume)
                    )
                    """);
            st.executeUpdate("""
                    CREATE TABLE IF NOT EXISTS entries (
                        archive_id TEXT NOT NULL REFERENCES archives (id) ON DELETE CASCADE,
                        entry_path TEXT NOT NULL,
                        size INTEGER NOT NULL,
                        compressed_size INTEGER NOT NULL,
                        modified INTEGER,
                        content_hash TEXT,
                        media_type TEXT,
                        category TEXT NOT NULL,
                        PRIMARY KEY (archive_id, entry_path)
                    )
                    """);
            st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_archives_volume ON archives (volume)");
            st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_entries_path ON entries (entry_path)");
            st.executeUpdate("CREATE INDEX IF NOT EXISTS idx_entries_hash ON entries (content_hash)");
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to initialise catalog schema in " + databaseFile, ex);
        }
    }

    private void ensureOpen() {
        if (disposed) {
            throw new IllegalStateException("Catalog store " + databaseFile + " has been disposed");
        }
    }

    private static Connection connect(Path file) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        try {
            return DriverManager.getConnection("jdbc:sqlite:" + file, config.toProperties());
        } catch (SQLException ex) {
            throw new CatalogStoreException("Failed to open catalog database " + file, ex);
        }
    }

    private static void createParent(Path file) {
        Path parent = file.toAbsolutePath().normalize().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException ex) {
            throw new CatalogStoreException("Cannot create directory " + parent, ex);
        }
    }

    private static void deleteBackingFiles(Path file) {
        for (String suffix : new String[]{"", "-journal", "-wal", "-shm"}) {
            Path candidate = file.resolveSibling(file.getFileName() + suffix);
            try {
                Files.deleteIfExists(candidate);
            } catch (IOException ex) {
                LOGGER.warn("Could not remove {}", candidate, ex);
            }
        }
    }

    private static String sanitize(String label) {
        String cleaned = label == null ? "" : label.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isEmpty() ? "store" : cleaned;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }
}
