package termbase.flat;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One terminology concept: its identifier, entry-level fields, and the term records
 * of each language in first-encounter order.
 */
public final class TermEntry {
    private final int index;
    private final String id;
    private final Map<String, String> fields;
    private final Map<String, List<TermRecord>> languages;

    TermEntry(final int index, final String id, final Map<String, String> fields, final Map<String, List<TermRecord>> languages) {
        this.index = index;
        this.id = id;
        this.fields = Collections.unmodifiableMap(fields);
        this.languages = Collections.unmodifiableMap(languages);
    }

    /** 1-based position in document order. */
    public int index() {
        return index;
    }

    public String id() {
        return id;
    }

    /** Entry-level field values, keyed by field key (entry_descrip_*, entry_subject). */
    public Map<String, String> fields() {
        return fields;
    }

    public Map<String, List<TermRecord>> languages() {
        return languages;
    }

    public boolean hasTerms() {
        return !languages.isEmpty();
    }

    @Override
    public String toString() {
        return id + languages.keySet();
    }
}
