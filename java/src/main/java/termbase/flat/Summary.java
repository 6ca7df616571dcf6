package termbase.flat;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Conversion summary: entry count, languages detected from the column headers, final columns.
 */
public final class Summary {
    private final int totalEntries;
    private final List<String> languagesDetected;
    private final List<String> columns;

    private Summary(final int totalEntries, final List<String> languagesDetected, final List<String> columns) {
        this.totalEntries = totalEntries;
        this.languagesDetected = languagesDetected;
        this.columns = columns;
    }

    public static Summary of(final OutputTable table) {
        final List<String> languages = new ArrayList<>();
        for (String header : table.headers()) {
            if (header.indexOf('_') > -1 && !header.startsWith(FieldKey.ENTRY_PREFIX)) {
                final String language = header.substring(0, header.indexOf('_'));
                if (!languages.contains(language))
                    languages.add(language);
            }
        }
        return new Summary(table.size(), List.copyOf(languages), List.copyOf(table.headers()));
    }

    public int totalEntries() {
        return totalEntries;
    }

    public List<String> languagesDetected() {
        return languagesDetected;
    }

    public List<String> columns() {
        return columns;
    }

    public String toJson() {
        final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(this);
    }

    public void print(final PrintStream out) {
        out.println();
        out.println("=".repeat(60));
        out.println("CONVERSION SUMMARY");
        out.println("=".repeat(60));
        out.println("Total entries: " + totalEntries);
        out.println("Languages detected: " + String.join(", ", languagesDetected));
        out.println("Final columns: " + columns.size());
        if (!columns.isEmpty()) {
            out.println("Column names:");
            for (String column : columns)
                out.println("  - " + column);
        }
    }
}
