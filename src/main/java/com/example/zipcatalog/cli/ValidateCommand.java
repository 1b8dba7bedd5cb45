package com.example.zipcatalog.cli;

import com.example.zipcatalog.App;
import com.example.zipcatalog.store.SqliteCatalogStore;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Checks that catalogued archives still exist and that no entry is orphaned.")
public class ValidateCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    private App app;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        List<String> issues;
        try (SqliteCatalogStore catalog = app.openCatalog()) {
            issues = catalog.validate();
        }
        PrintWriter out = spec.commandLine().getOut();
        issues.forEach(issue -> out.printf("  %s%n", issue));
        out.printf(issues.isEmpty() ? "Catalog is consistent%n" : "%d issues found%n", issues.size());
        out.flush();
        return issues.isEmpty() ? 0 : 2;
    }
}
