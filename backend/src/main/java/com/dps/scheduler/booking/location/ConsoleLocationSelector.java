package com.dps.scheduler.booking.location;

import com.dps.scheduler.booking.model.SiteLocation;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Prints the numbered candidates and reads a comma separated list of numbers from standard input.
 */
@Component
public class ConsoleLocationSelector implements LocationSelector {
    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleLocationSelector() {
        this(System.in, System.out);
    }

    ConsoleLocationSelector(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public List<SiteLocation> select(List<SiteLocation> candidates) {
        out.println("Choose DPS Location (comma separated numbers):");
        for (int i = 0; i < candidates.size(); i++) {
            SiteLocation location = candidates.get(i);
            out.printf(
                "  %d) %s - %s - %s miles away from %s!%n",
                i + 1,
                location.name(),
                location.address(),
                location.distance(),
                location.zipCode()
            );
        }
        out.print("> ");
        out.flush();
        String line;
        try {
            line = in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read location selection", e);
        }
        return parseSelection(line, candidates);
    }

    static List<SiteLocation> parseSelection(String line, List<SiteLocation> candidates) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        Set<Integer> indexes = new LinkedHashSet<>();
        for (String token : line.split(",")) {
            String trimmed = token.trim();
            if (!trimmed.matches("\\d{1,6}")) {
                continue;
            }
            int index = Integer.parseInt(trimmed) - 1;
            if (index >= 0 && index < candidates.size()) {
                indexes.add(index);
            }
        }
        List<SiteLocation> selected = new ArrayList<>();
        for (Integer index : indexes) {
            selected.add(candidates.get(index));
        }
        return selected;
    }
}
