package com.example.zipcatalog.cli;

import com.example.zipcatalog.App;
import com.example.zipcatalog.store.ArchiveSummary;
import com.example.zipcatalog.store.SqliteCatalogStore;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "archives", mixinStandardHelpOptions = true,
        description = "Lists catalogued archives with their identifiers.")
public class ArchivesCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    private App app;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--volume", description = "Only archives found on this volume.")
    private String volume;

    @Override
    public Integer call() throws Exception {
        List<ArchiveSummary> archives;
        try (SqliteCatalogStore catalog = app.openCatalog()) {
            archives = catalog.listArchives();
        }
        PrintWriter out = spec.commandLine().getOut();
        int shown = 0;
        for (ArchiveSummary summary : archives) {
            if (volume != null && !volume.equals(summary.archive().volume())) {
                continue;
            }
            out.printf("%s  %-12s %6d entries %10s  %s%n",
                    summary.archive().id(),
                    summary.archive().volume(),
                    summary.entryCount(),
                    Formats.size(summary.archive().size()),
                    summary.archive().sourcePath());
            shown++;
        }
        out.printf("%d archives%n", shown);
        out.flush();
        return 0;
    }
}
