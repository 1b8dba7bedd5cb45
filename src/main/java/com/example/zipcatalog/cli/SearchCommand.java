package com.example.zipcatalog.cli;

import com.example.zipcatalog.App;
import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.model.FileCategory;
import com.example.zipcatalog.store.CatalogQuery;
import com.example.zipcatalog.store.SqliteCatalogStore;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "search", mixinStandardHelpOptions = true,
        description = "Searches catalogued entries by path.")
public class SearchCommand implements Callable<Integer> {

    @CommandLine.ParentCommand
    private App app;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Substring (or regular expression with --regex) of the entry path.")
    private String pattern;

    @CommandLine.Option(names = "--regex", description = "Treat the pattern as a regular expression.")
    private boolean regex;

    @CommandLine.Option(names = "--min-size", description = "Minimum entry size in bytes.")
    private Long minSize;

    @CommandLine.Option(names = "--max-size", description = "Maximum entry size in bytes.")
    private Long maxSize;

    @CommandLine.Option(names = "--category", split = ",", description = "Restrict to categories: ${COMPLETION-CANDIDATES}.")
    private List<FileCategory> categories;

    @CommandLine.Option(names = "--volume", description = "Restrict to one volume.")
    private String volume;

    @CommandLine.Option(names = "--limit", defaultValue = "0", description = "Maximum number of results (0 = no limit).")
    private int limit;

    @CommandLine.Option(names = "--csv", description = "Also export the results to this CSV file.")
    private Path csvFile;

    @Override
    public Integer call() throws Exception {
        Set<FileCategory> categorySet = categories == null || categories.isEmpty()
                ? Set.of()
                : EnumSet.copyOf(categories);
        CatalogQuery query = CatalogQuery.of(pattern, regex)
                .withSizeRange(minSize, maxSize)
                .withCategories(categorySet)
                .withVolume(volume)
                .withLimit(limit);
        List<CatalogMatch> matches;
        try (SqliteCatalogStore catalog = app.openCatalog()) {
            matches = catalog.query(query);
        }

        PrintWriter out = spec.commandLine().getOut();
        out.printf("%d matches for '%s'%n", matches.size(), pattern);
        for (CatalogMatch match : matches) {
            out.printf("  %-12s %10s  %s  [%s] %s%n",
                    match.archive().volume(),
                    Formats.size(match.entrySize()),
                    match.entryPath(),
                    match.archiveId(),
                    match.archivePath());
        }
        out.flush();
        if (csvFile != null) {
            new SearchCsvWriter().write(matches, csvFile);
            out.printf("Exported %d results to %s%n", matches.size(), csvFile);
            out.flush();
        }
        return 0;
    }
}
