package com.example.zipcatalog.cli;

import com.example.zipcatalog.extract.AmbiguousSelectionException;
import com.example.zipcatalog.model.ArchiveRecord;
import com.example.zipcatalog.model.CatalogMatch;
import com.example.zipcatalog.model.EntryRecord;
import com.example.zipcatalog.model.FileCategory;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConsoleSelectionPromptTest {
    private final List<CatalogMatch> candidates = List.of(match("a/clip.mp4"), match("b/clip.mp4"), match("c/clip.mp4"));

    @Test
    void picksTheNumberedCandidate() throws Exception {
        StringWriter output = new StringWriter();

        List<CatalogMatch> chosen = prompt("2\n", output).choose(candidates);

        assertEquals(List.of(candidates.get(1)), chosen);
        assertTrue(output.toString().contains("Multiple files found (3 matches)"));
    }

    @Test
    void acceptsListsAndAll() throws Exception {
        assertEquals(List.of(candidates.get(2), candidates.get(0)), prompt("3, 1\n", new StringWriter()).choose(candidates));
        assertEquals(candidates, prompt("ALL\n", new StringWriter()).choose(candidates));
    }

    @Test
    void asksAgainAfterAnInvalidAnswer() throws Exception {
        StringWriter output = new StringWriter();

        List<CatalogMatch> chosen = prompt("7\nabc\n1\n", output).choose(candidates);

        assertEquals(List.of(candidates.get(0)), chosen);
        assertTrue(output.toString().contains("Invalid selection"));
    }

    @Test
    void emptyAnswerCancels() throws Exception {
        assertTrue(prompt("\n", new StringWriter()).choose(candidates).isEmpty());
    }

    @Test
    void endOfInputLeavesTheSelectionAmbiguous() {
        AmbiguousSelectionException ex = assertThrows(AmbiguousSelectionException.class,
                () -> prompt("", new StringWriter()).choose(candidates));
        assertEquals(3, ex.getCandidates().size());
    }

    private static ConsoleSelectionPrompt prompt(String input, StringWriter output) {
        return new ConsoleSelectionPrompt(new BufferedReader(new StringReader(input)), new PrintWriter(output));
    }

    private static CatalogMatch match(String path) {
        ArchiveRecord archive = new ArchiveRecord(UUID.randomUUID(), "/v/takeout.zip", "v", 10, null, Instant.EPOCH);
        return new CatalogMatch(archive, new EntryRecord(archive.id(), path, 1024, 512, Instant.EPOCH, null,
                "video/mp4", FileCategory.VIDEO));
    }
}
