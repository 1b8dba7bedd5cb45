package com.example.zipcatalog.cli;

import com.example.zipcatalog.App;
import com.example.zipcatalog.CatalogConfig;
import com.example.zipcatalog.ScanReportWriter;
import com.example.zipcatalog.progress.LoggingProgressReporter;
import com.example.zipcatalog.scan.ArchiveIndexingJobRunner;
import com.example.zipcatalog.scan.ArchiveProber;
import com.example.zipcatalog.scan.CancellationToken;
import com.example.zipcatalog.scan.CoordinatorState;
import com.example.zipcatalog.scan.FailureRecord;
import com.example.zipcatalog.scan.ScanCoordinator;
import com.example.zipcatalog.scan.ScanSummary;
import com.example.zipcatalog.scan.VolumeResult;
import com.example.zipcatalog.scan.VolumeWalker;
import com.example.zipcatalog.store.SqliteCatalogStore;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@CommandLine.Command(name = "scan", mixinStandardHelpOptions = true,
        description = "Scans the configured volumes in parallel and merges the results into the catalog.")
public class ScanCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanCommand.class);

    @CommandLine.ParentCommand
    private App app;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--sequential", description = "Scan one volume at a time.")
    private boolean sequential;

    @CommandLine.Option(names = {"-j", "--max-concurrency"}, description = "Override the configured worker count.")
    private Integer maxConcurrency;

    @CommandLine.Option(names = "--summary", description = "Write the JSON scan summary to this file.")
    private Path summaryFile;

    @Override
    public Integer call() throws Exception {
        CatalogConfig config = app.config();
        int bound = sequential ? 1 : Optional.ofNullable(maxConcurrency).orElse(config.maxConcurrency());
        PrintWriter out = spec.commandLine().getOut();

        CancellationToken cancellation = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancellation.cancel();
            try {
                finished.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "scan-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        ScanSummary summary;
        try (SqliteCatalogStore catalog = app.openCatalog()) {
            ArchiveIndexingJobRunner runner = new ArchiveIndexingJobRunner(
                    new VolumeWalker(),
                    new ArchiveProber(new Tika()),
                    config.fileRetryAttempts(),
                    config.computeHashes(),
                    config.heartbeatInterval());
            ScanCoordinator coordinator = new ScanCoordinator(catalog, runner, bound, new LoggingProgressReporter());
            summary = coordinator.scan(config.volumes(), cancellation);
        } finally {
            finished.countDown();
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("Shutdown already in progress");
        }

        print(summary, out);
        Optional<Path> report = Optional.ofNullable(summaryFile).or(config::summaryFile);
        if (report.isPresent()) {
            new ScanReportWriter().write(summary, report.get());
        }
        if (summary.state() != CoordinatorState.DONE) {
            return 1;
        }
        return summary.failedVolumes().isEmpty() ? 0 : 2;
    }

    private static void print(ScanSummary summary, PrintWriter out) {
        out.printf("Scan %s in %ds: %d archives, %d entries%n",
                summary.state(), summary.duration().toSeconds(), summary.totalArchives(), summary.totalEntries());
        for (VolumeResult volume : summary.perVolume()) {
            out.printf("  %-20s %-9s %6d archives %8d entries%s%n",
                    volume.volume(), volume.status(), volume.archives(), volume.entries(),
                    volume.error() == null ? "" : "  (" + volume.error() + ")");
        }
        if (!summary.allFailures().isEmpty()) {
            out.printf("%d failures:%n", summary.allFailures().size());
            for (FailureRecord failure : summary.allFailures()) {
                out.printf("  %s%n", failure);
            }
        }
        out.flush();
    }
}
