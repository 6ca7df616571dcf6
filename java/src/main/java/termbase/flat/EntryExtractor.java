package termbase.flat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.w3c.dom.Element;

/**
 * Extracts the selected fields of term entries.
 *
 * Within one language group a term text is kept once: later term groups with the same
 * trimmed text are dropped. Entries are independent of each other.
 */
public final class EntryExtractor {
    private final Namespaces namespaces;
    private final List<String> selected;
    private final Set<String> selectedSet;
    private final Logger logger;

    public EntryExtractor(final Namespaces namespaces, final List<String> selectedFields, final Logger logger) {
        if (selectedFields == null || selectedFields.isEmpty())
            throw new IllegalArgumentException("selectedFields");
        this.namespaces = namespaces;
        this.selected = List.copyOf(selectedFields);
        this.selectedSet = new LinkedHashSet<>(selectedFields);
        this.logger = (logger != null ? logger : new Logger.NullLogger());
    }

    /**
     * Language code and term records of one language group
     */
    public static final class LanguageGroup {
        private final String language;
        private final List<TermRecord> terms;

        LanguageGroup(final String language, final List<TermRecord> terms) {
            this.language = language;
            this.terms = Collections.unmodifiableList(terms);
        }

        public String language() {
            return language;
        }

        public List<TermRecord> terms() {
            return terms;
        }
    }

    /**
     * Extract one entry
     * @param entry The entry element
     * @param index 1-based position of the entry in document order
     */
    public TermEntry extract(final Element entry, final int index) {
        final String id = entry.hasAttribute("id") ? entry.getAttribute("id") : "entry_" + index;
        logger.log("Processing entry %d: %s", index, id);

        final Map<String, String> fields = entryFields(entry);

        final List<Element> groups = TermbaseDocument.languageGroups(namespaces, entry);
        logger.log("  Found %d language groups", groups.size());

        final Map<String, List<TermRecord>> languages = new LinkedHashMap<>();
        for (Element group : groups) {
            final LanguageGroup lg = languageGroup(group);
            if (!lg.language().isEmpty() && !lg.terms().isEmpty())
                languages.put(lg.language(), lg.terms());
        }

        if (languages.isEmpty())
            logger.log("  Warning: No terms found for entry %s", id);
        else
            logger.log("  Languages with terms: %s", languages.keySet());
        return new TermEntry(index, id, fields, languages);
    }

    /**
     * Extract the term records of one language group
     */
    public LanguageGroup languageGroup(final Element group) {
        final String language = languageCode(group);
        final List<Element> termGroups = TermbaseDocument.termGroups(namespaces, group);
        logger.log("  Processing language group: %s, %d term groups", language, termGroups.size());

        final List<TermRecord> records = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (Element termGroup : termGroups) {
            final Element termElement = termElement(termGroup);
            if (termElement == null) {
                logger.log("    Warning: No term element found in term group");
                continue;
            }

            final String text = TermbaseDocument.text(termElement).trim();
            if (text.isEmpty() || !seen.add(text))
                continue;

            final TermRecord record = new TermRecord(selected, language);
            if (selectedSet.contains(FieldKey.TERM))
                record.put(FieldKey.TERM, text);

            for (Element e : TermbaseDocument.selfAndDescendants(termGroup)) {
                final String field = FieldKey.termField(e);
                if (field == null || FieldKey.TERM.equals(field) || !selectedSet.contains(field))
                    continue;
                final String value = TermbaseDocument.text(e).trim();
                if (!value.isEmpty())
                    record.put(field, value);
            }
            records.add(record);
        }
        return new LanguageGroup(language, records);
    }

    /**
     * Selected entry-level fields found outside term groups; the last occurrence wins
     */
    Map<String, String> entryFields(final Element entry) {
        final Map<String, String> fields = new LinkedHashMap<>();
        for (Element e : TermbaseDocument.entryLevelElements(entry)) {
            final String field = FieldKey.entryField(e);
            if (field == null || !selectedSet.contains(field))
                continue;
            final String value = TermbaseDocument.text(e).trim();
            if (!value.isEmpty())
                fields.put(field, value);
        }
        return fields;
    }

    /**
     * xml:lang, then lang, then the namespace-qualified xml lang attribute, else ""
     */
    static String languageCode(final Element group) {
        if (group.hasAttribute("xml:lang"))
            return group.getAttribute("xml:lang");
        if (group.hasAttribute("lang"))
            return group.getAttribute("lang");
        if (group.hasAttributeNS(Namespaces.XML_NS, "lang"))
            return group.getAttributeNS(Namespaces.XML_NS, "lang");
        return "";
    }

    /**
     * Unqualified term, then namespace-qualified term, then any descendant whose name contains "term"
     */
    Element termElement(final Element termGroup) {
        final List<Element> terms = TermbaseDocument.find(namespaces, termGroup, FieldKey.TERM);
        for (Element e : terms) {
            if (namespaces.isUnqualified(e))
                return e;
        }
        if (!terms.isEmpty())
            return terms.get(0);

        for (Element e : TermbaseDocument.descendants(termGroup)) {
            if (Namespaces.localName(e).toLowerCase(Locale.ROOT).contains(FieldKey.TERM))
                return e;
        }
        return null;
    }
}
