package com.example.zipcatalog.extract;

import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.model.ErrorKind;
import com.example.zipcatalog.progress.Heartbeat;
import com.example.zipcatalog.progress.ProgressReporter;
import com.example.zipcatalog.progress.TransferProgress;
import com.example.zipcatalog.scan.ArchiveProbeException;
import com.example.zipcatalog.store.CatalogQuery;
import com.example.zipcatalog.store.CatalogStore;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Resolves selectors against the catalog and copies the selected entries out of their archives.
 *
 * <p>The catalog is only read. Each entry is streamed in chunks of {@code bufferSize} bytes to a
 * file named after the entry's base name; an existing file is never overwritten, the new one gets
 * a numeric suffix instead ({@code clip.mp4}, {@code clip_1.mp4}, ...). A failure while copying
 * deletes the partial output and is reported for that entry only.
 */
public class Extractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(Extractor.class);

    public static final int DEFAULT_BUFFER_SIZE = 1024 * 1024;

    private final CatalogStore catalog;
    private final EntrySource source;
    private final ProgressReporter reporter;
    private final int bufferSize;
    private final int threads;
    private final Duration heartbeatInterval;

    public Extractor(CatalogStore catalog, EntrySource source) {
        this(catalog, source, ProgressReporter.NONE, DEFAULT_BUFFER_SIZE, 1, Duration.ofSeconds(2));
    }

    public Extractor(CatalogStore catalog,
                     EntrySource source,
                     ProgressReporter reporter,
                     int bufferSize,
                     int threads,
                     Duration heartbeatInterval) {
        if (bufferSize < 1) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        this.catalog = catalog;
        this.source = source;
        this.reporter = reporter == null ? ProgressReporter.NONE : reporter;
        this.bufferSize = bufferSize;
        this.threads = Math.max(1, threads);
        this.heartbeatInterval = heartbeatInterval;
    }

    /**
     * Looks the request up in the catalog without touching the filesystem. Ambiguity is not
     * checked here: a name pattern may resolve to any number of pairs.
     */
    public List<CatalogMatch> resolve(ExtractionRequest request) {
        Selector selector = request.selector();
        CatalogQuery query = switch (selector.kind()) {
            case NAME_PATTERN -> CatalogQuery.of(selector.value(), selector.regex());
            case ARCHIVE_ID -> CatalogQuery.all().withArchiveId(selector.archiveId());
            case ALL -> CatalogQuery.all();
        };
        if (selector.kind() == SelectorKind.ARCHIVE_ID && catalog.findArchive(selector.archiveId()).isEmpty()) {
            LOGGER.warn("No archive with id {} in the catalog", selector.archiveId());
            return List.of();
        }
        List<CatalogMatch> matches = catalog.query(query);
        if (!request.hasSecondaryFilter()) {
            return matches;
        }
        String filter = request.secondaryFilter().toLowerCase(Locale.ROOT);
        return matches.stream()
                .filter(match -> match.entryPath().toLowerCase(Locale.ROOT).contains(filter))
                .toList();
    }

    public ExtractionReport extract(ExtractionRequest request) throws ExtractionException {
        return extract(request, SelectionPrompt.NON_INTERACTIVE);
    }

    /**
     * Resolves and extracts. An ambiguous name match is handed to {@code prompt}.
     *
     * @throws ConfirmationRequiredException   for an unconfirmed "all" selector, before anything is read or written
     * @throws AmbiguousSelectionException     if the prompt cannot choose
     * @throws DestinationUnwritableException  if the destination directory cannot be created or written
     */
    public ExtractionReport extract(ExtractionRequest request, SelectionPrompt prompt) throws ExtractionException {
        if (request.selector().kind() == SelectorKind.ALL && !request.confirmAll()) {
            throw new ConfirmationRequiredException("Extracting the whole catalog needs explicit confirmation");
        }
        List<CatalogMatch> matches = resolve(request);
        if (request.selector().kind() == SelectorKind.NAME_PATTERN && matches.size() > 1) {
            List<CatalogMatch> chosen = prompt.choose(matches);
            if (!matches.containsAll(chosen)) {
                throw new IllegalArgumentException("Selection contains entries that were not offered");
            }
            matches = chosen;
        }
        if (matches.isEmpty()) {
            LOGGER.info("Nothing to extract for {}", request.selector());
            return ExtractionReport.empty();
        }
        return extract(matches, request.destination());
    }

    /**
     * Extracts every pair into {@code destination}. Per-pair failures are reported in the result
     * list, which keeps the order of {@code pairs}.
     */
    public ExtractionReport extract(List<CatalogMatch> pairs, Path destination) throws DestinationUnwritableException {
        if (pairs.isEmpty()) {
            return ExtractionReport.empty();
        }
        prepareDestination(destination);
        LOGGER.info("Extracting {} entries to {}", pairs.size(), destination);
        List<ExtractionResult> results = threads == 1 || pairs.size() == 1
                ? extractSequentially(pairs, destination)
                : extractInParallel(pairs, destination);
        ExtractionReport report = new ExtractionReport(results);
        LOGGER.info("Extraction finished: {} succeeded, {} failed", report.succeeded().size(), report.failed().size());
        return report;
    }

    private List<ExtractionResult> extractSequentially(List<CatalogMatch> pairs, Path destination) {
        List<ExtractionResult> results = new ArrayList<>(pairs.size());
        for (CatalogMatch pair : pairs) {
            results.add(extractOne(pair, destination));
        }
        return results;
    }

    private List<ExtractionResult> extractInParallel(List<CatalogMatch> pairs, Path destination) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, pairs.size()));
        List<Future<ExtractionResult>> futures = new ArrayList<>(pairs.size());
        for (CatalogMatch pair : pairs) {
            futures.add(executor.submit(() -> extractOne(pair, destination)));
        }
        executor.shutdown();
        List<ExtractionResult> results = new ArrayList<>(pairs.size());
        boolean interrupted = false;
        for (int i = 0; i < pairs.size(); i++) {
            CatalogMatch pair = pairs.get(i);
            try {
                results.add(interrupted ? cancelled(futures.get(i), pair) : futures.get(i).get());
            } catch (InterruptedException ex) {
                interrupted = true;
                executor.shutdownNow();
                results.add(cancelled(futures.get(i), pair));
            } catch (ExecutionException ex) {
                results.add(ExtractionResult.failed(pair.entryPath(), pair.archiveId(), ErrorKind.IO_FAILURE,
                        String.valueOf(ex.getCause()), Duration.ZERO));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return results;
    }

    private static ExtractionResult cancelled(Future<ExtractionResult> future, CatalogMatch pair) {
        if (future.isDone() && !future.isCancelled()) {
            try {
                return future.get();
            } catch (ExecutionException ex) {
                return ExtractionResult.failed(pair.entryPath(), pair.archiveId(), ErrorKind.IO_FAILURE,
                        String.valueOf(ex.getCause()), Duration.ZERO);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        return ExtractionResult.failed(pair.entryPath(), pair.archiveId(), ErrorKind.CANCELLED,
                "extraction interrupted", Duration.ZERO);
    }

    private ExtractionResult extractOne(CatalogMatch pair, Path destination) {
        long start = System.nanoTime();
        String entryPath = pair.entryPath();
        UUID archiveId = pair.archiveId();
        Path target;
        try {
            target = reserveOutput(destination, outputName(entryPath));
        } catch (IOException ex) {
            LOGGER.warn("Cannot create an output file for {} in {}", entryPath, destination, ex);
            return ExtractionResult.failed(entryPath, archiveId, ErrorKind.DESTINATION_UNWRITABLE,
                    ex.getMessage(), elapsed(start));
        }

        long written = 0;
        try (InputStream in = source.open(pair.archive(), pair.entry());
             OutputStream out = Files.newOutputStream(target, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            Heartbeat heartbeat = new Heartbeat(heartbeatInterval);
            byte[] buffer = new byte[(int) Math.min(bufferSize, Math.max(8192L, pair.entrySize()))];
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                written += read;
                if (heartbeat.due()) {
                    reporter.transferProgress(new TransferProgress(entryPath, written, pair.entrySize(), elapsed(start), false));
                }
            }
        } catch (IOException ex) {
            deletePartial(target);
            ErrorKind kind = ArchiveProbeException.classify(ex);
            LOGGER.warn("Failed to extract {} from {} after {} bytes ({})",
                    entryPath, pair.archivePath(), written, kind, ex);
            return ExtractionResult.failed(entryPath, archiveId, kind, ex.getMessage(), elapsed(start));
        }
        Duration duration = elapsed(start);
        reporter.transferProgress(new TransferProgress(entryPath, written, pair.entrySize(), duration, true));
        return ExtractionResult.success(entryPath, archiveId, target, written, duration);
    }

    /**
     * Atomically creates the first free name among {@code name}, {@code base_1.ext}, {@code base_2.ext}, ...
     */
    static Path reserveOutput(Path destination, String name) throws IOException {
        String baseName = FilenameUtils.getBaseName(name);
        String extension = FilenameUtils.getExtension(name);
        String suffix = extension.isEmpty() ? "" : "." + extension;
        Path candidate = destination.resolve(name);
        for (int counter = 1; ; counter++) {
            try {
                return Files.createFile(candidate);
            } catch (FileAlreadyExistsException ex) {
                candidate = destination.resolve(baseName + "_" + counter + suffix);
            }
        }
    }

    static String outputName(String entryPath) {
        String name = FilenameUtils.getName(entryPath.replace('\\', '/'));
        return name.isEmpty() || name.equals(".") || name.equals("..") ? "entry" : name;
    }

    private static void prepareDestination(Path destination) throws DestinationUnwritableException {
        try {
            Files.createDirectories(destination);
        } catch (IOException ex) {
            throw new DestinationUnwritableException(destination, "Cannot create " + destination + ": " + ex.getMessage(), ex);
        }
        if (!Files.isWritable(destination)) {
            throw new DestinationUnwritableException(destination, destination + " is not writable", null);
        }
    }

    private static void deletePartial(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException ex) {
            LOGGER.error("Could not remove partial output {}", target, ex);
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
