package termbase.flat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flattened conversion result: one row per entry.
 *
 * Columns are the union of all row keys in first-seen order. Each column also has a
 * display header, equal to the column key until the table is renamed; renaming only
 * changes headers, so two columns renamed to the same header stay distinct.
 * A column missing from a row reads as "".
 */
public final class OutputTable {
    private final List<Map<String, String>> rows;
    private final List<String> columns;
    private final List<String> headers;

    private OutputTable(final List<Map<String, String>> rows, final List<String> columns, final List<String> headers) {
        this.rows = rows;
        this.columns = columns;
        this.headers = headers;
    }

    public static OutputTable of(final List<Map<String, String>> rows) {
        final Set<String> union = new LinkedHashSet<>();
        final List<Map<String, String>> copy = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            union.addAll(row.keySet());
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        final List<String> columns = List.copyOf(union);
        return new OutputTable(Collections.unmodifiableList(copy), columns, columns);
    }

    /**
     * Same rows and columns under new headers
     * @param headers One header per column, in column order
     */
    public OutputTable withHeaders(final List<String> headers) {
        if (headers.size() != columns.size())
            throw new IllegalArgumentException("expected " + columns.size() + " headers, got " + headers.size());
        return new OutputTable(rows, columns, List.copyOf(headers));
    }

    public int size() {
        return rows.size();
    }

    /** No rows; a table of entries that produced no values still has its rows. */
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Rows as extracted, keyed by column; sparse. */
    public List<Map<String, String>> rows() {
        return rows;
    }

    /** Column keys, first-seen order. */
    public List<String> columns() {
        return columns;
    }

    /** Display headers, parallel to {@link #columns()}. */
    public List<String> headers() {
        return headers;
    }

    public String value(final int row, final String column) {
        return rows.get(row).getOrDefault(column, "");
    }

    /**
     * One row with every column, blanks filled in
     */
    public List<String> cells(final int row) {
        final Map<String, String> r = rows.get(row);
        final List<String> cells = new ArrayList<>(columns.size());
        for (String column : columns)
            cells.add(r.getOrDefault(column, ""));
        return cells;
    }

    @Override
    public String toString() {
        return "OutputTable{rows=" + rows.size() + ", columns=" + headers + "}";
    }
}
