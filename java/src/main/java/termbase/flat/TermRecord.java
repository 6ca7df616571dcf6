package termbase.flat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One term occurrence within a language group: field key to extracted text.
 */
public final class TermRecord {
    private final Map<String, String> values = new LinkedHashMap<>();

    /**
     * Record with every selected field blank except entry_id, and the language set
     */
    TermRecord(final List<String> selectedFields, final String language) {
        for (String field : selectedFields) {
            if (!FieldKey.ENTRY_ID.equals(field))
                values.put(field, "");
        }
        values.put(FieldKey.LANGUAGE, language);
    }

    void put(final String field, final String value) {
        values.put(field, value);
    }

    /**
     * Value of a field, "" when never populated
     */
    public String get(final String field) {
        return values.getOrDefault(field, "");
    }

    public String language() {
        return values.get(FieldKey.LANGUAGE);
    }

    public String term() {
        return get(FieldKey.TERM);
    }

    public Map<String, String> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
