package termbase.flat;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import termbase.flat.FieldDiscovery.Discovery;

/**
 * One TBX conversion run
 *
 * <pre>
 * Converter converter = Converter.open(new File("glossary.tbx"), ConverterConfig.load(), logger);
 * Discovery discovery = converter.discover();
 * OutputTable table = converter.convert(selectedFields, FieldMapping.identity(selectedFields));
 * SheetWriter.write(table, new File("glossary.xlsx"), config, logger);
 * </pre>
 *
 * {@link #convertAll()} is the auto path: every discovered field under its own name.
 */
public final class Converter {
    private static final int DUMP_ELEMENTS = 20;
    private static final int DUMP_TEXT = 50;

    private final TermbaseDocument document;
    private final ConverterConfig config;
    private final Logger logger;

    Converter(final TermbaseDocument document, final ConverterConfig config, final Logger logger) {
        this.document = document;
        this.config = (config != null ? config : ConverterConfig.defaults());
        this.logger = (logger != null ? logger : new Logger.NullLogger());
    }

    /**
     * @throws ConversionException FILE_NOT_FOUND, XML_PARSE_ERROR or INPUT_READ_ERROR
     */
    public static Converter open(final File file, final ConverterConfig config, final Logger logger) throws ConversionException {
        final TermbaseDocument document = TermbaseDocument.open(file);
        final Converter converter = new Converter(document, config, logger);
        converter.logger.log("Root element: %s", Namespaces.qualified(document.root()));
        converter.logger.log("Registered namespaces: %s", document.namespaces().qualifiers().keySet());
        return converter;
    }

    public static Converter of(final TermbaseDocument document, final ConverterConfig config, final Logger logger) {
        return new Converter(document, config, logger);
    }

    public TermbaseDocument document() {
        return document;
    }

    /**
     * Fields available for selection; never fails
     */
    public Discovery discover() {
        return new FieldDiscovery(config.sampleEntries(), logger).discover(document);
    }

    /**
     * Extract every entry in document order
     * @throws ConversionException NO_FIELDS_SELECTED or NO_ENTRIES
     */
    public List<TermEntry> extract(final List<String> selectedFields) throws ConversionException {
        if (selectedFields == null || selectedFields.isEmpty())
            throw new ConversionException(ErrorCode.NO_FIELDS_SELECTED);

        final List<Element> elements = document.entries();
        logger.log("Found %d term entries", elements.size());
        if (elements.isEmpty()) {
            dumpStructure();
            throw new ConversionException(ErrorCode.NO_ENTRIES, document.name());
        }

        final EntryExtractor extractor = new EntryExtractor(document.namespaces(), selectedFields, logger);
        final List<TermEntry> entries = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++)
            entries.add(extractor.extract(elements.get(i), i + 1));
        logger.log("Total entries processed: %d", entries.size());
        return entries;
    }

    /**
     * Extract, flatten and rename
     * @throws ConversionException NO_FIELDS_SELECTED, MISSING_FIELD_MAPPING, NO_ENTRIES or NO_ROWS
     */
    public OutputTable convert(final List<String> selectedFields, final FieldMapping mapping) throws ConversionException {
        if (selectedFields == null || selectedFields.isEmpty())
            throw new ConversionException(ErrorCode.NO_FIELDS_SELECTED);
        mapping.validate(selectedFields);

        final OutputTable table = new RowFlattener(selectedFields, logger).flatten(extract(selectedFields));
        if (table.isEmpty()) {
            dumpStructure();
            throw new ConversionException(ErrorCode.NO_ROWS, document.name());
        }

        if (mapping.isIdentity())
            return table;
        logger.log("Applying field mappings: %s", mapping);
        final OutputTable renamed = ColumnRenamer.rename(table, mapping);
        logger.log("Final columns after renaming: %s", renamed.headers());
        return renamed;
    }

    /**
     * Log the first elements of the document, for files whose layout nothing matched
     */
    void dumpStructure() {
        logger.log("No data extracted; first %d elements of %s:", DUMP_ELEMENTS, document.name());
        final List<Element> elements = TermbaseDocument.selfAndDescendants(document.root());
        for (Element e : elements.subList(0, Math.min(DUMP_ELEMENTS, elements.size()))) {
            final Map<String, String> attrs = new LinkedHashMap<>();
            final NamedNodeMap nodes = e.getAttributes();
            for (int i = 0; i < nodes.getLength(); i++)
                attrs.put(nodes.item(i).getNodeName(), nodes.item(i).getNodeValue());

            String text = TermbaseDocument.text(e).trim();
            if (text.length() > DUMP_TEXT)
                text = text.substring(0, DUMP_TEXT) + "...";
            logger.log("  %s: %s -> '%s'", Namespaces.qualified(e), attrs, text);
        }
    }

    /**
     * Every discovered field, original names
     */
    public OutputTable convertAll() throws ConversionException {
        final List<String> fields = discover().sorted();
        logger.log("Auto mode: using all %d available fields with original names", fields.size());
        return convert(fields, FieldMapping.identity(fields));
    }
}
