package com.example.zipcatalog.cli;

import com.example.zipcatalog.extract.AmbiguousSelectionException;
import com.example.zipcatalog.extract.SelectionPrompt;
import com.example.zipcatalog.model.CatalogMatch;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Numbered menu on the terminal. Accepts a number, a comma-separated list of numbers or
 * {@code all}; an empty answer cancels.
 */
public class ConsoleSelectionPrompt implements SelectionPrompt {
    private static final int MAX_TRIES = 3;

    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleSelectionPrompt(BufferedReader in, PrintWriter out) {
        this.in = in;
        this.out = out;
    }

    @Override
    public List<CatalogMatch> choose(List<CatalogMatch> candidates) throws AmbiguousSelectionException {
        out.printf("%nMultiple files found (%d matches)%n", candidates.size());
        out.printf("%-4s %-50s %10s  %s%n", "#", "File", "Size", "Archive");
        for (int i = 0; i < candidates.size(); i++) {
            CatalogMatch match = candidates.get(i);
            out.printf("%-4d %-50s %10s  %s%n", i + 1, truncate(match.entryPath(), 50),
                    Formats.size(match.entrySize()), match.archive().fileName());
        }
        for (int attempt = 0; attempt < MAX_TRIES; attempt++) {
            out.printf("Select file number to extract (1-%d, comma-separated, or 'all'): ", candidates.size());
            out.flush();
            String answer;
            try {
                answer = in.readLine();
            } catch (IOException ex) {
                throw new AmbiguousSelectionException(candidates);
            }
            if (answer == null) {
                throw new AmbiguousSelectionException(candidates);
            }
            answer = answer.trim().toLowerCase(Locale.ROOT);
            if (answer.isEmpty()) {
                out.println("Extraction cancelled");
                return List.of();
            }
            if (answer.equals("all")) {
                return candidates;
            }
            List<CatalogMatch> chosen = parse(answer, candidates);
            if (chosen != null) {
                return chosen;
            }
            out.printf("Invalid selection. Please choose 1-%d%n", candidates.size());
        }
        throw new AmbiguousSelectionException(candidates);
    }

    private static List<CatalogMatch> parse(String answer, List<CatalogMatch> candidates) {
        Set<Integer> indexes = new LinkedHashSet<>();
        for (String part : answer.split(",")) {
            try {
                int index = Integer.parseInt(part.trim());
                if (index < 1 || index > candidates.size()) {
                    return null;
                }
                indexes.add(index - 1);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        List<CatalogMatch> chosen = new ArrayList<>(indexes.size());
        indexes.forEach(index -> chosen.add(candidates.get(index)));
        return chosen;
    }

    private static String truncate(String value, int width) {
        return value.length() <= width ? value : "..." + value.substring(value.length() - width + 3);
    }
}
