package com.example.zipcatalog.cli;

import com.example.zipcatalog.App;
import com.example.zipcatalog.store.CatalogStats;
import com.example.zipcatalog.store.SqliteCatalogStore;
import com.example.zipcatalog.store.VolumeStats;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "stats", mixinStandardHelpOptions = true,
        description = "Prints catalog totals and a per-volume breakdown.")
public class StatsCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    private App app;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        CatalogStats stats;
        List<VolumeStats> volumes;
        try (SqliteCatalogStore catalog = app.openCatalog()) {
            stats = catalog.stats();
            volumes = catalog.volumeStats();
        }
        PrintWriter out = spec.commandLine().getOut();
        out.printf("Volumes:  %d%nArchives: %d%nEntries:  %d%nSize:     %s%n",
                stats.volumes(), stats.archives(), stats.entries(), Formats.size(stats.totalBytes()));
        for (VolumeStats volume : volumes) {
            out.printf("  %-20s %6d archives %8d entries %12s%n",
                    volume.volume(), volume.archives(), volume.entries(), Formats.size(volume.totalBytes()));
        }
        out.flush();
        return 0;
    }
}
