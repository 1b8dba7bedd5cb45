package com.example.zipcatalog;

import com.example.zipcatalog.cli.ArchivesCommand;
import com.example.zipcatalog.cli.DuplicatesCommand;
import com.example.zipcatalog.cli.ExtractCommand;
import com.example.zipcatalog.cli.HashCommand;
import com.example.zipcatalog.cli.ScanCommand;
import com.example.zipcatalog.cli.SearchCommand;
import com.example.zipcatalog.cli.StatsCommand;
import com.example.zipcatalog.cli.ValidateCommand;
import com.example.zipcatalog.store.SqliteCatalogStore;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "zip-catalog",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "Catalogs the files inside ZIP archives across several volumes, then searches and extracts them.",
        subcommands = {
                ScanCommand.class,
                SearchCommand.class,
                ArchivesCommand.class,
                StatsCommand.class,
                ExtractCommand.class,
                DuplicatesCommand.class,
                ValidateCommand.class,
                HashCommand.class
        })
public final class App implements Callable<Integer> {
    static final Path DEFAULT_CATALOG = Path.of("zip_catalog.db");

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"-c", "--config"}, description = "JSON configuration file.")
    private Path configFile;

    @CommandLine.Option(names = {"-db", "--catalog"}, description = "Catalog database (overrides the configured one).")
    private Path catalogFile;

    private CatalogConfig config;

    public static void main(String[] args) {
        System.exit(new CommandLine(new App()).execute(args));
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * The loaded configuration. Only commands that scan need one.
     */
    public CatalogConfig config() throws IOException {
        if (config == null) {
            if (configFile == null) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: --config");
            }
            config = new ConfigLoader().load(configFile);
        }
        return config;
    }

    public boolean hasConfig() {
        return configFile != null;
    }

    public Path catalogFile() throws IOException {
        if (catalogFile != null) {
            return catalogFile;
        }
        return configFile == null ? DEFAULT_CATALOG : config().catalogFile();
    }

    public SqliteCatalogStore openCatalog() throws IOException {
        if (configFile != null) {
            return SqliteCatalogStore.open(catalogFile(), config().workDirectory());
        }
        return SqliteCatalogStore.open(catalogFile());
    }
}
