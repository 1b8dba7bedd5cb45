package com.example.zipcatalog.cli;

import com.example.zipcatalog.App;
import com.example.zipcatalog.scan.ArchiveProber;
import com.example.zipcatalog.scan.CatalogHasher;
import com.example.zipcatalog.scan.FailureRecord;
import com.example.zipcatalog.store.SqliteCatalogStore;
import org.apache.tika.Tika;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "hash", mixinStandardHelpOptions = true,
        description = "Computes SHA-256 fingerprints for catalogued archives and entries.")
public class HashCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    private App app;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--rehash", description = "Recompute fingerprints that are already stored.")
    private boolean rehash;

    @Override
    public Integer call() throws Exception {
        CatalogHasher.Result result;
        try (SqliteCatalogStore catalog = app.openCatalog()) {
            result = new CatalogHasher(catalog, new ArchiveProber(new Tika())).hashMissing(rehash);
        }
        PrintWriter out = spec.commandLine().getOut();
        out.printf("Hashed %d archives and %d entries%n", result.archivesHashed(), result.entriesHashed());
        for (FailureRecord failure : result.failures()) {
            out.printf("  %s%n", failure);
        }
        out.flush();
        return result.failures().isEmpty() ? 0 : 2;
    }
}
