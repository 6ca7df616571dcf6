package termbase.flat;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import termbase.flat.FieldDiscovery.Discovery;

/**
 * Interactive field selection and renaming on a console.
 */
final class FieldPrompt {
    private final BufferedReader in;
    private final PrintStream out;

    FieldPrompt(final BufferedReader in, final PrintStream out) {
        this.in = in;
        this.out = out;
    }

    /**
     * List the discovered fields and read the user's choice: numbers separated by commas, or "all"
     */
    List<String> selectFields(final Discovery discovery) throws IOException {
        final List<String> fields = discovery.sorted();

        out.printf("%nFound %d available data fields in your TBX file:%n", fields.size());
        out.println("=".repeat(60));
        for (int i = 0; i < fields.size(); i++)
            out.printf("%2d. %s%n", i + 1, fields.get(i));
        if (discovery.isFallback()) {
            out.println("(the file could not be scanned; showing default fields)");
        } else if (!discovery.isComplete()) {
            out.printf("(scanned the first %d of %d entries; fields used only by later entries are not listed)%n",
                    discovery.sampledEntries(), discovery.totalEntries());
        }

        out.println("\nWhich fields would you like to include in the output?");
        out.println("Enter the numbers separated by commas (e.g., 1,3,5,7) or type 'all' for all fields:");

        List<String> selected;
        while (true) {
            final String input = readLine();
            if (input.equalsIgnoreCase("all")) {
                selected = new ArrayList<>(fields);
                break;
            }
            try {
                final List<Integer> numbers = new ArrayList<>();
                for (String s : input.split(","))
                    numbers.add(Integer.parseInt(s.trim()));

                final List<Integer> invalid = new ArrayList<>();
                for (int n : numbers) {
                    if (n < 1 || n > fields.size())
                        invalid.add(n);
                }
                if (!invalid.isEmpty()) {
                    out.printf("Invalid numbers: %s. Please enter numbers between 1 and %d%n", invalid, fields.size());
                    continue;
                }

                selected = new ArrayList<>();
                for (int n : numbers)
                    selected.add(fields.get(n - 1));
                break;
            } catch (NumberFormatException ex) {
                out.println("Invalid input. Please enter numbers separated by commas or type 'all'");
            }
        }

        out.printf("%nSelected %d fields:%n", selected.size());
        for (String field : selected)
            out.println("  - " + field);
        return selected;
    }

    /**
     * Ask whether to keep or rename the selected fields, and read the new names
     */
    FieldMapping renameFields(final List<String> selected) throws IOException {
        out.println("\nWould you like to keep the original field names or rename them? (keep/rename)");
        final String choice = choose(List.of("keep", "rename"), "Please enter 'keep' or 'rename'");
        if (choice.equals("keep")) {
            out.println("Using original field names.");
            return FieldMapping.identity(selected);
        }

        out.println("\nWould you like to rename each field individually? (y/n)");
        final String individual = choose(List.of("y", "n", "yes", "no"), "Please enter 'y' or 'n'");
        if (individual.startsWith("n")) {
            out.println("Using original field names.");
            return FieldMapping.identity(selected);
        }

        out.println("\nRenaming fields individually:");
        out.println("Press Enter to keep the original name for any field.");
        final Map<String, String> names = new LinkedHashMap<>();
        for (String field : selected) {
            out.printf("%nCurrent name: '%s'%n", field);
            out.printf("New name (or press Enter to keep '%s'): ", field);
            final String name = readLine();
            if (!name.isEmpty()) {
                names.put(field, name);
                out.printf("  Renamed '%s' -> '%s'%n", field, name);
            } else {
                names.put(field, field);
                out.printf("  Keeping '%s'%n", field);
            }
        }

        out.println("\nFinal column mappings:");
        for (var e : names.entrySet()) {
            if (!e.getKey().equals(e.getValue()))
                out.printf("  '%s' -> '%s'%n", e.getKey(), e.getValue());
            else
                out.printf("  '%s' (unchanged)%n", e.getKey());
        }
        return FieldMapping.of(names);
    }

    private String choose(final List<String> allowed, final String retry) throws IOException {
        while (true) {
            final String answer = readLine().toLowerCase(Locale.ROOT);
            if (allowed.contains(answer))
                return answer;
            out.println(retry);
        }
    }

    private String readLine() throws IOException {
        out.print("> ");
        out.flush();
        final String line = in.readLine();
        if (line == null)
            throw new EOFException("input closed before the configuration was complete");
        return line.trim();
    }
}
