package termbase.flat;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Original field key (or, exceptionally, a full column name) to display name.
 */
public final class FieldMapping {
    private final Map<String, String> names;

    private FieldMapping(final Map<String, String> names) {
        this.names = Collections.unmodifiableMap(names);
    }

    /**
     * Every field mapped to itself
     */
    public static FieldMapping identity(final Collection<String> fields) {
        final Map<String, String> m = new LinkedHashMap<>();
        for (String field : fields)
            m.put(field, field);
        return new FieldMapping(m);
    }

    public static FieldMapping of(final Map<String, String> names) {
        for (var e : names.entrySet()) {
            if (e.getKey() == null || e.getValue() == null)
                throw new IllegalArgumentException("null field mapping: " + e);
        }
        return new FieldMapping(new LinkedHashMap<>(names));
    }

    /**
     * Copy with one field renamed
     */
    public FieldMapping with(final String field, final String name) {
        final Map<String, String> m = new LinkedHashMap<>(names);
        m.put(field, name);
        return of(m);
    }

    public boolean contains(final String field) {
        return names.containsKey(field);
    }

    /**
     * Mapped name, or null if the field has no entry
     */
    public String get(final String field) {
        return names.get(field);
    }

    public boolean isIdentity() {
        for (var e : names.entrySet()) {
            if (!e.getKey().equals(e.getValue()))
                return false;
        }
        return true;
    }

    public Map<String, String> asMap() {
        return names;
    }

    /**
     * @throws ConversionException MISSING_FIELD_MAPPING naming the first selected field without an entry
     */
    public void validate(final List<String> selectedFields) throws ConversionException {
        for (String field : selectedFields) {
            if (!names.containsKey(field))
                throw new ConversionException(ErrorCode.MISSING_FIELD_MAPPING, field);
        }
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
