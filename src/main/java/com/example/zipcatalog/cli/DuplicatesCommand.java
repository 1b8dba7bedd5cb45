package com.example.zipcatalog.cli;

import com.example.zipcatalog.App;
import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.store.DuplicateGroup;
import com.example.zipcatalog.store.SqliteCatalogStore;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "duplicates", mixinStandardHelpOptions = true,
        description = "Lists entries stored more than once. Needs content hashes (see 'hash').")
public class DuplicatesCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    private App app;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        List<DuplicateGroup> groups;
        try (SqliteCatalogStore catalog = app.openCatalog()) {
            groups = catalog.findDuplicates();
        }
        PrintWriter out = spec.commandLine().getOut();
        for (DuplicateGroup group : groups) {
            out.printf("%s (%d copies)%n", group.contentHash(), group.copies().size());
            for (CatalogMatch copy : group.copies()) {
                out.printf("  %s  in %s%n", copy.entryPath(), copy.archivePath());
            }
        }
        out.printf("%d duplicate groups%n", groups.size());
        out.flush();
        return 0;
    }
}
