package termbase.flat;

import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.w3c.dom.Element;

/**
 * Field keys and the classification of TBX element tags into them.
 *
 * A field key names one column category: the fixed keys {@link #ENTRY_ID},
 * {@link #LANGUAGE} and {@link #TERM}, or a key built from the element's category
 * and its type attribute, e.g. termNote_partOfSpeech, descrip_definition or
 * entry_descrip_subjectField.
 *
 * Tags are matched on their local name, case-insensitively, against a closed set of
 * known variants. A tag outside that set falls back to the generic note or description
 * category when its name contains "note" or "descrip"; anything else is not a field.
 */
public final class FieldKey {
    public static final String ENTRY_ID = "entry_id";
    public static final String LANGUAGE = "language";
    public static final String TERM = "term";
    public static final String ENTRY_SUBJECT = "entry_subject";

    static final String ENTRY_PREFIX = "entry_";
    static final String TERM_NOTE_PREFIX = "termNote_";
    static final String DESCRIP_PREFIX = "descrip_";
    static final String ENTRY_DESCRIP_PREFIX = "entry_descrip_";

    static final String DEFAULT_NOTE_TYPE = "note";
    static final String DEFAULT_DESCRIP_TYPE = "description";

    /** Always offered by discovery. */
    public static final List<String> BASELINE = List.of(ENTRY_ID, LANGUAGE, TERM);

    /** Offered when discovery fails. */
    public static final List<String> FALLBACK = List.of(ENTRY_ID, LANGUAGE, TERM,
            "termNote_status", "termNote_forbidden", "termNote_preferred");

    enum Category {
        TERM, NOTE, DESCRIPTION, PLAIN, SUBJECT, NONE
    }

    static final Set<String> NOTE_TAGS = Set.of("termnote", "note");
    static final Set<String> DESCRIPTION_TAGS = Set.of("descrip");
    static final Set<String> PLAIN_TAGS = Set.of("definition", "context", "example");
    static final Set<String> SUBJECT_TAGS = Set.of("subjectfield", "subject");

    private FieldKey() {
    }

    static Category categorize(final String localName) {
        final String tag = localName.toLowerCase(Locale.ROOT);
        if (TERM.equals(tag))
            return Category.TERM;
        if (NOTE_TAGS.contains(tag))
            return Category.NOTE;
        if (DESCRIPTION_TAGS.contains(tag))
            return Category.DESCRIPTION;
        if (PLAIN_TAGS.contains(tag))
            return Category.PLAIN;
        if (SUBJECT_TAGS.contains(tag))
            return Category.SUBJECT;

        // generic fallback, e.g. adminNote, transacNote, descripGrp
        if (tag.contains("note"))
            return Category.NOTE;
        if (tag.contains("descrip"))
            return Category.DESCRIPTION;
        if (tag.contains("subject"))
            return Category.SUBJECT;
        return Category.NONE;
    }

    /**
     * Field key of an element inside a term group, or null if it is not a field
     */
    public static String termField(final Element e) {
        final String local = Namespaces.localName(e);
        switch (categorize(local)) {
            case TERM -> {
                return TERM;
            }
            case NOTE -> {
                return TERM_NOTE_PREFIX + type(e, DEFAULT_NOTE_TYPE);
            }
            case DESCRIPTION -> {
                return DESCRIP_PREFIX + type(e, DEFAULT_DESCRIP_TYPE);
            }
            case PLAIN -> {
                return local.toLowerCase(Locale.ROOT);
            }
            default -> {
                return null;
            }
        }
    }

    /**
     * Field key of an element at entry level, or null if it is not an entry field
     */
    public static String entryField(final Element e) {
        switch (categorize(Namespaces.localName(e))) {
            case DESCRIPTION -> {
                return ENTRY_DESCRIP_PREFIX + type(e, DEFAULT_DESCRIP_TYPE);
            }
            case SUBJECT -> {
                return ENTRY_SUBJECT;
            }
            default -> {
                return null;
            }
        }
    }

    /**
     * Entry-level fields fill one value per entry; entry_id is the entry's identifier.
     */
    public static boolean isEntryLevel(final String field) {
        return field.startsWith(ENTRY_PREFIX);
    }

    private static String type(final Element e, final String dfl) {
        return e.hasAttribute("type") ? e.getAttribute("type") : dfl;
    }
}
