package com.example.zipcatalog.cli;

import com.example.zipcatalog.model.CatalogMatch;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exports search results as CSV with a header row.
 */
public class SearchCsvWriter {
    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private final CsvSchema schema = mapper.schemaFor(Row.class).withHeader();

    public void write(List<CatalogMatch> matches, Path file) throws IOException {
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             SequenceWriter rows = mapper.writer(schema).writeValues(writer)) {
            for (CatalogMatch match : matches) {
                rows.write(Row.of(match));
            }
        }
    }

    @JsonPropertyOrder({"volume", "zipFile", "zipPath", "archiveId", "fileName", "sizeMb", "pathInZip"})
    record Row(
            @JsonProperty("volume") String volume,
            @JsonProperty("zipFile") String zipFile,
            @JsonProperty("zipPath") String zipPath,
            @JsonProperty("archiveId") String archiveId,
            @JsonProperty("fileName") String fileName,
            @JsonProperty("sizeMb") String sizeMb,
            @JsonProperty("pathInZip") String pathInZip
    ) {
        static Row of(CatalogMatch match) {
            return new Row(
                    match.archive().volume(),
                    match.archive().fileName(),
                    match.archivePath(),
                    match.archiveId().toString(),
                    match.entry().fileName(),
                    Formats.megabytes(match.entrySize()),
                    match.entryPath()
            );
        }
    }
}
