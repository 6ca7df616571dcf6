package termbase.flat;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.w3c.dom.Element;

/**
 * Discovers the field keys present in a TBX document.
 *
 * Only the first few entries are examined, so a large file whose later entries carry
 * other annotations may offer an incomplete list; {@link Discovery#isComplete()} tells.
 * Discovery is advisory: any failure yields {@link FieldKey#FALLBACK} instead of an error.
 */
public final class FieldDiscovery {
    public static final int DEFAULT_SAMPLE_ENTRIES = 3;

    private final int sampleEntries;
    private final Logger logger;

    public FieldDiscovery() {
        this(DEFAULT_SAMPLE_ENTRIES, new Logger.NullLogger());
    }

    public FieldDiscovery(final int sampleEntries, final Logger logger) {
        if (sampleEntries < 1)
            throw new IllegalArgumentException("sampleEntries must be positive: " + sampleEntries);
        this.sampleEntries = sampleEntries;
        this.logger = (logger != null ? logger : new Logger.NullLogger());
    }

    /**
     * Result of a discovery pass
     */
    public static final class Discovery {
        private final SortedSet<String> fields;
        private final int sampled;
        private final int total;
        private final boolean fallback;

        Discovery(final SortedSet<String> fields, final int sampled, final int total, final boolean fallback) {
            this.fields = Collections.unmodifiableSortedSet(fields);
            this.sampled = sampled;
            this.total = total;
            this.fallback = fallback;
        }

        static Discovery fallback() {
            return new Discovery(new TreeSet<>(FieldKey.FALLBACK), 0, 0, true);
        }

        /** Field keys in alphabetical order. */
        public SortedSet<String> fields() {
            return fields;
        }

        public List<String> sorted() {
            return new ArrayList<>(fields);
        }

        public int sampledEntries() {
            return sampled;
        }

        public int totalEntries() {
            return total;
        }

        /** True when the fixed fallback set was returned after a failure. */
        public boolean isFallback() {
            return fallback;
        }

        /** False when entries beyond the sample were not examined, or discovery failed. */
        public boolean isComplete() {
            return !fallback && sampled >= total;
        }

        @Override
        public String toString() {
            return fields + " (" + sampled + "/" + total + " entries" + (fallback ? ", fallback" : "") + ")";
        }
    }

    /**
     * Discover fields of a TBX file, falling back on any read or parse failure
     */
    public Discovery discover(final File file) {
        try {
            return discover(TermbaseDocument.open(file));
        } catch (ConversionException ex) {
            logger.error("Error scanning file: %s", ex.getMessage());
            return Discovery.fallback();
        }
    }

    public Discovery discover(final TermbaseDocument document) {
        logger.log("Scanning %s to identify available data fields", document.name());
        try {
            return scan(document);
        } catch (RuntimeException ex) {
            logger.error("Error scanning file %s: %s", document.name(), ex);
            return Discovery.fallback();
        }
    }

    private Discovery scan(final TermbaseDocument document) {
        final Namespaces ns = document.namespaces();
        final List<Element> entries = document.entries();
        final List<Element> sample = entries.subList(0, Math.min(sampleEntries, entries.size()));

        final SortedSet<String> fields = new TreeSet<>();
        for (Element entry : sample) {
            for (Element group : TermbaseDocument.allLanguageGroups(ns, entry)) {
                for (Element termGroup : TermbaseDocument.termGroups(ns, group)) {
                    for (Element e : TermbaseDocument.selfAndDescendants(termGroup)) {
                        final String field = FieldKey.termField(e);
                        if (field != null)
                            fields.add(field);
                    }
                }
            }

            for (Element e : TermbaseDocument.entryLevelElements(entry)) {
                final String field = FieldKey.entryField(e);
                if (field != null)
                    fields.add(field);
            }
        }
        fields.addAll(FieldKey.BASELINE);

        if (sample.size() < entries.size())
            logger.log("Sampled %d of %d entries; fields used only by later entries are not listed", sample.size(), entries.size());
        return new Discovery(fields, sample.size(), entries.size(), false);
    }
}
