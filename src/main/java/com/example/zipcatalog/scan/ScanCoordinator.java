package com.example.zipcatalog.scan;

import com.example.zipcatalog.model.ErrorKind;
import com.example.zipcatalog.progress.ProgressReporter;
import com.example.zipcatalog.store.CatalogStore;
import com.example.zipcatalog.store.CatalogStoreException;
import com.example.zipcatalog.store.MergeConflictException;
import com.example.zipcatalog.store.MergeSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scans several volumes in parallel and consolidates the results into one catalog.
 *
 * <p>Every volume becomes a {@link ScanJob} with its own isolated store, so workers share no
 * mutable state. At most {@code maxConcurrency} jobs run at once; the rest wait in the pool's
 * queue, and a bound of 1 scans the volumes one after another. A failed job never stops its
 * siblings. Once every job has finished, the private stores of the successful jobs are merged into
 * the target catalog one at a time, ordered by volume id, each in its own transaction, and disposed.
 *
 * <p>The target catalog must not be written by anyone else while a scan is running.
 * A coordinator performs a single scan.
 */
public final class ScanCoordinator {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanCoordinator.class);

    private final CatalogStore catalog;
    private final JobRunner runner;
    private final int maxConcurrency;
    private final ProgressReporter reporter;
    private volatile CoordinatorState state = CoordinatorState.IDLE;

    public ScanCoordinator(CatalogStore catalog, JobRunner runner, int maxConcurrency) {
        this(catalog, runner, maxConcurrency, ProgressReporter.NONE);
    }

    public ScanCoordinator(CatalogStore catalog, JobRunner runner, int maxConcurrency, ProgressReporter reporter) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1");
        }
        this.catalog = catalog;
        this.runner = runner;
        this.maxConcurrency = maxConcurrency;
        this.reporter = reporter == null ? ProgressReporter.NONE : reporter;
    }

    public CoordinatorState state() {
        return state;
    }

    public ScanSummary scan(List<VolumeSpec> volumes) {
        return scan(volumes, new CancellationToken());
    }

    public synchronized ScanSummary scan(List<VolumeSpec> volumes, CancellationToken cancellation) {
        if (state != CoordinatorState.IDLE) {
            throw new IllegalStateException("Coordinator already used; state is " + state);
        }
        requireDistinctIds(volumes);
        long start = System.nanoTime();

        transition(CoordinatorState.PARTITIONING);
        List<JobSlot> slots = partition(volumes);

        transition(CoordinatorState.RUNNING);
        runJobs(slots, cancellation);

        boolean anySucceeded = slots.stream().anyMatch(slot -> slot.status == JobStatus.SUCCEEDED);
        if (cancellation.isCancelled()) {
            LOGGER.warn("Scan cancelled before merging; discarding all private stores");
            slots.stream()
                    .filter(slot -> slot.status == JobStatus.SUCCEEDED)
                    .forEach(slot -> slot.cancel("scan cancelled before merge"));
            disposeAll(slots);
            transition(CoordinatorState.ABORTED);
        } else if (!slots.isEmpty() && !anySucceeded) {
            LOGGER.error("None of the {} volumes could be scanned", slots.size());
            disposeAll(slots);
            transition(CoordinatorState.ABORTED);
        } else {
            transition(CoordinatorState.MERGING);
            boolean cancelledDuringMerge = mergeAll(slots, cancellation);
            disposeAll(slots);
            boolean anyMerged = slots.stream().anyMatch(slot -> slot.status == JobStatus.SUCCEEDED);
            transition(cancelledDuringMerge || (!slots.isEmpty() && !anyMerged)
                    ? CoordinatorState.ABORTED
                    : CoordinatorState.DONE);
        }
        return summarize(slots, start);
    }

    private List<JobSlot> partition(List<VolumeSpec> volumes) {
        List<JobSlot> slots = new ArrayList<>(volumes.size());
        for (VolumeSpec volume : volumes) {
            JobSlot slot = new JobSlot(volume);
            try {
                slot.job = new ScanJob(volume.id(), volume, catalog.createIsolated(volume.id()));
            } catch (CatalogStoreException ex) {
                LOGGER.error("Cannot create private store for volume {}", volume.id(), ex);
                slot.fail("cannot create private store: " + ex.getMessage(),
                        FailureRecord.of(volume.root(), ErrorKind.IO_FAILURE, ex.getMessage()));
            }
            slots.add(slot);
        }
        return slots;
    }

    private void runJobs(List<JobSlot> slots, CancellationToken cancellation) {
        List<JobSlot> runnable = slots.stream().filter(slot -> slot.job != null).toList();
        if (runnable.isEmpty()) {
            return;
        }
        int threads = Math.min(maxConcurrency, runnable.size());
        LOGGER.info("Scanning {} volumes with {} worker(s)", runnable.size(), threads);
        ScanContext context = new ScanContext(reporter, cancellation);
        ExecutorService executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
        List<Future<JobResult>> futures = new ArrayList<>(runnable.size());
        for (JobSlot slot : runnable) {
            ScanJob job = slot.job;
            futures.add(executor.submit(() -> execute(job, context)));
        }
        executor.shutdown();

        boolean interrupted = false;
        for (int i = 0; i < runnable.size(); i++) {
            JobSlot slot = runnable.get(i);
            while (true) {
                try {
                    slot.complete(futures.get(i).get());
                    break;
                } catch (InterruptedException ex) {
                    // Workers stop at the next archive boundary; keep waiting for them.
                    interrupted = true;
                    cancellation.cancel();
                } catch (ExecutionException ex) {
                    slot.complete(JobResult.failed(slot.job, describe(ex.getCause()), List.of(), Duration.ZERO));
                    break;
                }
            }
            reporter.jobFinished(slot.job.jobId(), slot.status.name(), slot.archives, slot.entries);
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private JobResult execute(ScanJob job, ScanContext context) {
        long start = System.nanoTime();
        LOGGER.info("[{}] scanning {} ({})", job.jobId(), job.volume().root(), job.volume().policy().mode());
        try {
            JobResult result = runner.run(job, context);
            if (result == null) {
                return JobResult.failed(job, "job runner returned no result", List.of(), elapsed(start));
            }
            LOGGER.info("[{}] {}: {} archives, {} entries, {} failures",
                    job.jobId(), result.status(), result.archives(), result.entries(), result.failures().size());
            return result;
        } catch (Exception ex) {
            LOGGER.error("[{}] scan failed", job.jobId(), ex);
            return JobResult.failed(job, describe(ex), List.of(), elapsed(start));
        }
    }

    /**
     * Returns true if cancellation stopped the loop before every source was merged.
     */
    private boolean mergeAll(List<JobSlot> slots, CancellationToken cancellation) {
        List<JobSlot> ordered = slots.stream()
                .filter(slot -> slot.status == JobStatus.SUCCEEDED)
                .sorted(Comparator.comparing(slot -> slot.volume.id()))
                .toList();
        boolean cancelled = false;
        for (JobSlot slot : ordered) {
            if (cancellation.isCancelled()) {
                slot.cancel("scan cancelled before this volume was merged");
                cancelled = true;
                continue;
            }
            try {
                MergeSummary merge = catalog.mergeFrom(slot.job.store());
                slot.merge = merge;
                LOGGER.info("[{}] merged {} archives and {} entries ({} duplicates skipped) in {} ms",
                        slot.volume.id(), merge.archivesMerged(), merge.entriesMerged(),
                        merge.recordsSkipped(), merge.elapsed().toMillis());
            } catch (MergeConflictException ex) {
                LOGGER.error("[{}] merge rejected", slot.volume.id(), ex);
                slot.fail("merge failed: " + ex.getMessage(),
                        FailureRecord.of(slot.volume.root(), ErrorKind.MERGE_CONFLICT, ex.getMessage()));
            } catch (CatalogStoreException ex) {
                LOGGER.error("[{}] merge failed", slot.volume.id(), ex);
                slot.fail("merge failed: " + ex.getMessage(),
                        FailureRecord.of(slot.volume.root(), ErrorKind.IO_FAILURE, ex.getMessage()));
            } finally {
                slot.disposeStore();
            }
        }
        return cancelled;
    }

    private ScanSummary summarize(List<JobSlot> slots, long startNanos) {
        long totalArchives = 0;
        long totalEntries = 0;
        List<VolumeResult> perVolume = new ArrayList<>(slots.size());
        for (JobSlot slot : slots) {
            if (slot.status == JobStatus.SUCCEEDED) {
                totalArchives += slot.archives;
                totalEntries += slot.entries;
            }
            perVolume.add(new VolumeResult(
                    slot.volume.id(),
                    slot.volume.root().toString(),
                    slot.status,
                    slot.archives,
                    slot.entries,
                    slot.error,
                    slot.failures,
                    slot.merge,
                    slot.duration
            ));
        }
        ScanSummary summary = new ScanSummary(state, totalArchives, totalEntries, perVolume, elapsed(startNanos));
        LOGGER.info("Scan {}: {} archives, {} entries, {} volume(s) not merged",
                state, totalArchives, totalEntries, summary.failedVolumes().size());
        return summary;
    }

    private void disposeAll(List<JobSlot> slots) {
        slots.forEach(JobSlot::disposeStore);
    }

    private void transition(CoordinatorState next) {
        LOGGER.info("Scan coordinator {} -> {}", state, next);
        state = next;
    }

    private static void requireDistinctIds(List<VolumeSpec> volumes) {
        Set<String> ids = new HashSet<>();
        for (VolumeSpec volume : volumes) {
            if (!ids.add(volume.id())) {
                throw new IllegalArgumentException("Duplicate volume id: " + volume.id());
            }
        }
    }

    private static String describe(Throwable ex) {
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Coordinator-side bookkeeping for one job. Only the coordinator thread touches it.
     */
    private static final class JobSlot {
        private final VolumeSpec volume;
        private ScanJob job;
        private JobStatus status = JobStatus.FAILED;
        private long archives;
        private long entries;
        private String error;
        private final List<FailureRecord> failures = new ArrayList<>();
        private MergeSummary merge;
        private Duration duration = Duration.ZERO;
        private boolean disposed;

        private JobSlot(VolumeSpec volume) {
            this.volume = volume;
        }

        private void complete(JobResult result) {
            status = result.status();
            archives = result.archives();
            entries = result.entries();
            error = result.error();
            failures.addAll(result.failures());
            duration = result.duration();
        }

        private void fail(String reason, FailureRecord failure) {
            status = JobStatus.FAILED;
            error = reason;
            failures.add(failure);
        }

        private void cancel(String reason) {
            status = JobStatus.CANCELLED;
            error = reason;
        }

        private void disposeStore() {
            if (job == null || disposed) {
                return;
            }
            disposed = true;
            try {
                job.store().dispose();
            } catch (RuntimeException ex) {
                LOGGER.warn("[{}] failed to dispose private store", volume.id(), ex);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "scan-worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
