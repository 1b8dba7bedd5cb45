package com.example.zipcatalog.cli;

import com.example.zipcatalog.App;
import com.example.zipcatalog.CatalogConfig;
import com.example.zipcatalog.extract.ExtractionException;
import com.example.zipcatalog.extract.ExtractionReport;
import com.example.zipcatalog.extract.ExtractionRequest;
import com.example.zipcatalog.extract.ExtractionResult;
import com.example.zipcatalog.extract.Extractor;
import com.example.zipcatalog.extract.SelectionPrompt;
import com.example.zipcatalog.extract.Selector;
import com.example.zipcatalog.extract.ZipEntrySource;
import com.example.zipcatalog.progress.LoggingProgressReporter;
import com.example.zipcatalog.store.SqliteCatalogStore;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "extract", mixinStandardHelpOptions = true,
        description = "Extracts catalogued entries out of their source archives.")
public class ExtractCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    private App app;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "Name pattern of the entries to extract.")
    private String pattern;

    @CommandLine.Option(names = "--archive", description = "Extract every entry of the archive with this id.")
    private UUID archiveId;

    @CommandLine.Option(names = "--all", description = "Extract every entry in the catalog.")
    private boolean all;

    @CommandLine.Option(names = "--regex", description = "Treat the pattern as a regular expression.")
    private boolean regex;

    @CommandLine.Option(names = "--filter", description = "Only entries whose path also contains this text.")
    private String filter;

    @CommandLine.Option(names = {"-y", "--yes"}, description = "Confirm --all without asking.")
    private boolean yes;

    @CommandLine.Option(names = "--non-interactive", description = "Fail instead of asking when a pattern is ambiguous.")
    private boolean nonInteractive;

    @CommandLine.Option(names = {"-o", "--output-dir"}, defaultValue = "extracted", description = "Destination directory.")
    private Path outputDir;

    @CommandLine.Option(names = "--threads", description = "Entries extracted in parallel.")
    private Integer threads;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        BufferedReader console = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        boolean interactive = !nonInteractive && System.console() != null;

        int targets = (pattern == null ? 0 : 1) + (archiveId == null ? 0 : 1) + (all ? 1 : 0);
        if (targets != 1) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Give exactly one of: a name pattern, --archive <id>, --all");
        }
        Selector selector;
        if (all) {
            selector = Selector.all();
        } else if (archiveId != null) {
            selector = Selector.archive(archiveId);
        } else {
            selector = regex ? Selector.nameRegex(pattern) : Selector.name(pattern);
        }
        ExtractionRequest request = ExtractionRequest.of(selector, outputDir).withSecondaryFilter(filter);
        if (all && (yes || interactive && confirm(console, out))) {
            request = request.confirmed();
        }

        int bufferSize = Extractor.DEFAULT_BUFFER_SIZE;
        int threadCount = threads == null ? 1 : threads;
        Duration heartbeat = Duration.ofSeconds(2);
        if (app.hasConfig()) {
            CatalogConfig config = app.config();
            bufferSize = config.extractionBufferSize();
            threadCount = threads == null ? config.extractionThreads() : threads;
            heartbeat = config.heartbeatInterval();
        }

        ExtractionReport report;
        try (SqliteCatalogStore catalog = app.openCatalog()) {
            Extractor extractor = new Extractor(catalog, new ZipEntrySource(), new LoggingProgressReporter(),
                    bufferSize, threadCount, heartbeat);
            SelectionPrompt prompt = interactive ? new ConsoleSelectionPrompt(console, out) : SelectionPrompt.NON_INTERACTIVE;
            report = extractor.extract(request, prompt);
        } catch (ExtractionException ex) {
            spec.commandLine().getErr().printf("%s: %s%n", ex.getKind(), ex.getMessage());
            return 1;
        }

        for (ExtractionResult result : report.results()) {
            if (result.isSuccess()) {
                out.printf("  OK     %s -> %s (%s)%n", result.entryPath(), result.output(), Formats.size(result.bytesWritten()));
            } else {
                out.printf("  FAILED %s: %s %s%n", result.entryPath(), result.errorKind(), result.error());
            }
        }
        out.printf("%d extracted, %d failed%n", report.succeeded().size(), report.failed().size());
        out.flush();
        return report.failed().isEmpty() ? 0 : 2;
    }

    private static boolean confirm(BufferedReader console, PrintWriter out) throws IOException {
        out.print("This will extract ALL files from ALL archives. Continue? (y/N): ");
        out.flush();
        String answer = console.readLine();
        return answer != null && answer.trim().toLowerCase(Locale.ROOT).startsWith("y");
    }
}
