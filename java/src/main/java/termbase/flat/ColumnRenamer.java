package termbase.flat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Applies a field mapping to flattened column names.
 *
 * A column {lang}_{field} or {lang}_{field}_{n} keeps its language prefix and index
 * suffix; only the field part is replaced. Columns whose field part has no mapping
 * may still be mapped by their full name (entry_id, entry-level fields).
 *
 * The split is positional: a field key that itself contains underscores and ends in a
 * numeric segment, e.g. descrip_2 in en_descrip_2, reads as field "descrip" with index 2.
 * This is relied upon by existing outputs and kept as is.
 */
public final class ColumnRenamer {

    private ColumnRenamer() {
    }

    public static OutputTable rename(final OutputTable table, final FieldMapping mapping) {
        return table.withHeaders(rename(table.columns(), mapping));
    }

    public static List<String> rename(final List<String> columns, final FieldMapping mapping) {
        final List<String> renamed = new ArrayList<>(columns.size());
        for (String column : columns)
            renamed.add(rename(column, mapping));
        return renamed;
    }

    public static String rename(final String column, final FieldMapping mapping) {
        if (column.indexOf('_') > -1) {
            final String[] parts = column.split("_", -1);
            final String language = parts[0];
            String suffix = "";
            String base;
            if (parts.length >= 3 && isDigits(parts[parts.length - 1])) {
                suffix = "_" + parts[parts.length - 1];
                base = String.join("_", Arrays.asList(parts).subList(1, parts.length - 1));
            } else {
                base = String.join("_", Arrays.asList(parts).subList(1, parts.length));
            }

            if (mapping.contains(base))
                return language + "_" + mapping.get(base) + suffix;
        }

        final String direct = mapping.get(column);
        if (direct != null && !direct.isEmpty())
            return direct;
        return column;
    }

    private static boolean isDigits(final String s) {
        if (s.isEmpty())
            return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i)))
                return false;
        }
        return true;
    }
}
