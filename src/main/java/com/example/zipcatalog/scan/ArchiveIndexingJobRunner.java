package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.EntryRecord;
import com.example.zipcatalog.model.ErrorKind;
import com.example.zipcatalog.progress.Heartbeat;
import com.example.zipcatalog.progress.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Default job: walk the volume, probe every candidate archive, write the results to the job's
 * private store.
 */
public final class ArchiveIndexingJobRunner implements JobRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ArchiveIndexingJobRunner.class);

    private final VolumeWalker walker;
    private final ArchiveProber prober;
    private final int fileRetryAttempts;
    private final boolean computeHashes;
    private final Duration heartbeatInterval;

    public ArchiveIndexingJobRunner(VolumeWalker walker,
                                    ArchiveProber prober,
                                    int fileRetryAttempts,
                                    boolean computeHashes,
                                    Duration heartbeatInterval) {
        this.walker = walker;
        this.prober = prober;
        this.fileRetryAttempts = Math.max(0, fileRetryAttempts);
        this.computeHashes = computeHashes;
        this.heartbeatInterval = heartbeatInterval;
    }

    @Override
    public JobResult run(ScanJob job, ScanContext context) {
        long start = System.nanoTime();
        VolumeSpec volume = job.volume();
        Path root = volume.root().toAbsolutePath().normalize();
        List<FailureRecord> failures = new ArrayList<>();
        List<FailureRecord> rootFailures = new ArrayList<>();
        WalkListener listener = (path, kind, reason) -> {
            FailureRecord failure = FailureRecord.of(path, kind, reason);
            if (path.equals(root)) {
                rootFailures.add(failure);
            } else {
                failures.add(failure);
            }
        };

        Heartbeat heartbeat = new Heartbeat(heartbeatInterval);
        long archives = 0;
        long entries = 0;
        try (Stream<Path> candidates = walker.discover(root, volume.policy(), listener)) {
            Iterator<Path> iterator = candidates.iterator();
            while (iterator.hasNext()) {
                if (context.cancellation().isCancelled()) {
                    LOGGER.info("[{}] cancelled after {} archives", job.jobId(), archives);
                    return new JobResult(job.jobId(), volume.id(), JobStatus.CANCELLED, archives, entries,
                            "scan cancelled", failures, elapsed(start));
                }
                Path archive = iterator.next();
                if (heartbeat.due()) {
                    context.reporter().scanProgress(new ProgressEvent(job.jobId(), archives, entries,
                            elapsed(start), archive.toString(), sizeOf(archive)));
                }
                ProbeResult result = probeWithRetry(archive, volume.id(), failures);
                if (result == null) {
                    continue;
                }
                List<EntryRecord> kept = result.entries().stream()
                        .filter(entry -> volume.policy().accepts(entry.category()))
                        .toList();
                ArchiveRecord record = result.archive();
                if (computeHashes) {
                    record = record.withContentHash(hashArchive(archive, failures));
                    kept = withEntryHashes(archive, kept, failures);
                }
                job.store().insertArchive(record);
                entries += job.store().insertEntries(kept);
                archives++;
            }
        }

        if (!rootFailures.isEmpty()) {
            FailureRecord rootFailure = rootFailures.get(0);
            return new JobResult(job.jobId(), volume.id(), JobStatus.FAILED, archives, entries,
                    rootFailure.getKind() + ": " + rootFailure.getLastError(), rootFailures, elapsed(start));
        }
        context.reporter().scanProgress(ProgressEvent.between(job.jobId(), archives, entries, elapsed(start)));
        return new JobResult(job.jobId(), volume.id(), JobStatus.SUCCEEDED, archives, entries,
                null, failures, elapsed(start));
    }

    private ProbeResult probeWithRetry(Path archive, String volume, List<FailureRecord> failures) {
        int maxAttempts = fileRetryAttempts + 1;
        List<RetryAttempt> attempts = new ArrayList<>();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return prober.probe(archive, volume);
            } catch (IOException ex) {
                ErrorKind kind = ArchiveProbeException.classify(ex);
                attempts.add(new RetryAttempt(attempt, Instant.now(), kind, ex.getMessage()));
                if (!kind.retryable() || attempt == maxAttempts) {
                    LOGGER.warn("Failed to index {} ({}, attempt {}/{})", archive, kind, attempt, maxAttempts, ex);
                    failures.add(new FailureRecord(archive.toString(), kind, attempt, maxAttempts,
                            Instant.now(), ex.getMessage(), attempts));
                    return null;
                }
                LOGGER.debug("Retrying {} after {}", archive, ex.getMessage());
            }
        }
        return null;
    }

    private String hashArchive(Path archive, List<FailureRecord> failures) {
        try {
            return prober.hashArchive(archive);
        } catch (IOException ex) {
            LOGGER.warn("Failed to hash {}", archive, ex);
            failures.add(FailureRecord.of(archive, ArchiveProbeException.classify(ex), "hashing failed: " + ex.getMessage()));
            return null;
        }
    }

    private List<EntryRecord> withEntryHashes(Path archive, List<EntryRecord> entries, List<FailureRecord> failures) {
        Map<String, String> hashes;
        try {
            hashes = prober.hashEntries(archive);
        } catch (IOException ex) {
            LOGGER.warn("Failed to hash entries of {}", archive, ex);
            failures.add(FailureRecord.of(archive, ArchiveProbeException.classify(ex), "entry hashing failed: " + ex.getMessage()));
            return entries;
        }
        return entries.stream()
                .map(entry -> entry.withContentHash(hashes.get(entry.entryPath())))
                .toList();
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            return -1L;
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
