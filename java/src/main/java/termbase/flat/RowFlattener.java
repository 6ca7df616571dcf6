package termbase.flat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens term entries into one row per entry.
 *
 * <pre>
 * entry_id | entry_descrip_* | en_term | en_termNote_x | en_term_2 | ... | de_term | ...
 * </pre>
 * The first record of a language fills {lang}_{field}, the i-th (1-based, i &gt; 1)
 * fills {lang}_{field}_{i}. Language and record order follow the document.
 */
public final class RowFlattener {
    private final List<String> selected;
    private final Logger logger;

    public RowFlattener(final List<String> selectedFields, final Logger logger) {
        this.selected = List.copyOf(selectedFields);
        this.logger = (logger != null ? logger : new Logger.NullLogger());
    }

    public OutputTable flatten(final List<TermEntry> entries) {
        logger.log("Flattening %d entries into rows", entries.size());
        final List<Map<String, String>> rows = new ArrayList<>(entries.size());
        for (TermEntry entry : entries)
            rows.add(flatten(entry));
        final OutputTable table = OutputTable.of(rows);
        logger.log("Total rows created: %d, columns: %d", table.size(), table.columns().size());
        return table;
    }

    public Map<String, String> flatten(final TermEntry entry) {
        final Map<String, String> row = new LinkedHashMap<>();
        if (selected.contains(FieldKey.ENTRY_ID))
            row.put(FieldKey.ENTRY_ID, entry.id());

        for (String field : selected) {
            if (FieldKey.isEntryLevel(field) && !FieldKey.ENTRY_ID.equals(field))
                row.put(field, entry.fields().getOrDefault(field, ""));
        }

        if (!entry.hasTerms())
            return row;

        for (var e : entry.languages().entrySet()) {
            final String language = e.getKey();
            final List<TermRecord> records = e.getValue();
            for (int i = 0; i < records.size(); i++) {
                final TermRecord record = records.get(i);
                for (String field : selected) {
                    if (FieldKey.isEntryLevel(field))
                        continue;
                    row.put(column(language, field, i), record.get(field));
                }
            }
        }
        logger.log("  Created row for %s with %d columns", entry.id(), row.size());
        return row;
    }

    /**
     * Column name of a field of the record at position (0-based) within its language
     */
    static String column(final String language, final String field, final int position) {
        return (position == 0)
                ? language + "_" + field
                : language + "_" + field + "_" + (position + 1);
    }
}
