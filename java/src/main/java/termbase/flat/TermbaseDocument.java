package termbase.flat;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Parsed TBX document
 *
 * Holds the DOM tree and its namespace table for one conversion run, and knows the
 * structural shape entry, language group, term group shared by the TBX dialects:
 * <pre>
 * termEntry | conceptEntry
 *   langSet | langGrp | langSec
 *     tig | termGrp | termSec
 *       term, termNote, descrip, ...
 * </pre>
 */
public final class TermbaseDocument {
    static final List<String> ENTRY_TAGS = List.of("termEntry", "conceptEntry");
    static final List<String> LANGUAGE_GROUP_TAGS = List.of("langSet", "langGrp", "langSec");
    static final List<String> TERM_GROUP_TAGS = List.of("tig", "termGrp", "termSec");

    private final String name;
    private final Document document;
    private final Namespaces namespaces;

    private TermbaseDocument(final String name, final Document document) {
        this.name = name;
        this.document = document;
        this.namespaces = Namespaces.resolve(document.getDocumentElement());
    }

    /**
     * Parse a TBX file
     * @throws ConversionException FILE_NOT_FOUND or XML_PARSE_ERROR
     */
    public static TermbaseDocument open(final File file) throws ConversionException {
        if (!file.isFile())
            throw new ConversionException(ErrorCode.FILE_NOT_FOUND, file.getPath());
        try {
            return new TermbaseDocument(file.getPath(), builder().parse(file));
        } catch (FileNotFoundException | NoSuchFileException ex) {
            throw new ConversionException(ErrorCode.FILE_NOT_FOUND, file.getPath(), ex);
        } catch (SAXException ex) {
            throw new ConversionException(ErrorCode.XML_PARSE_ERROR, file.getPath() + ": " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new ConversionException(ErrorCode.INPUT_READ_ERROR, file.getPath(), ex);
        }
    }

    /**
     * Parse TBX content held in memory
     * @param name Name used in messages
     */
    public static TermbaseDocument parse(final String name, final String xml) throws ConversionException {
        try {
            return new TermbaseDocument(name, builder().parse(new InputSource(new StringReader(xml))));
        } catch (SAXException ex) {
            throw new ConversionException(ErrorCode.XML_PARSE_ERROR, name + ": " + ex.getMessage(), ex);
        } catch (IOException ex) {
            throw new ConversionException(ErrorCode.INPUT_READ_ERROR, name, ex);
        }
    }

    private static DocumentBuilder builder() throws ConversionException {
        try {
            final DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
            dbf.setNamespaceAware(true);
            dbf.setExpandEntityReferences(false);
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            // TBX files commonly reference a DTD; it is not needed for flattening
            dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            return dbf.newDocumentBuilder();
        } catch (ParserConfigurationException ex) {
            throw new ConversionException(ErrorCode.INTERNAL_ERROR, "XML parser configuration", ex);
        }
    }

    public String name() {
        return name;
    }

    public Element root() {
        return document.getDocumentElement();
    }

    public Namespaces namespaces() {
        return namespaces;
    }

    /**
     * Entry elements in document order: termEntry, else conceptEntry, else any element
     * whose name contains "termentry".
     */
    public List<Element> entries() {
        final Element root = root();
        for (String tag : ENTRY_TAGS) {
            final List<Element> found = find(namespaces, root, tag);
            if (!found.isEmpty())
                return found;
        }
        final List<Element> found = new ArrayList<>();
        for (Element e : selfAndDescendants(root)) {
            if (Namespaces.localName(e).toLowerCase(Locale.ROOT).contains("termentry"))
                found.add(e);
        }
        return found;
    }

    // ------------------------------------------------------------------
    // structure

    /**
     * Language groups of an entry: langSet, else langGrp, else langSec, else any element
     * whose name contains "lang" and one of "grp", "set", "sec".
     */
    static List<Element> languageGroups(final Namespaces ns, final Element entry) {
        for (String tag : LANGUAGE_GROUP_TAGS) {
            final List<Element> found = find(ns, entry, tag);
            if (!found.isEmpty())
                return found;
        }
        final List<Element> found = new ArrayList<>();
        for (Element e : descendants(entry)) {
            final String tag = Namespaces.localName(e).toLowerCase(Locale.ROOT);
            if (tag.contains("lang") && (tag.contains("grp") || tag.contains("set") || tag.contains("sec")))
                found.add(e);
        }
        return found;
    }

    /**
     * Every language group of an entry regardless of variant, in variant order
     */
    static List<Element> allLanguageGroups(final Namespaces ns, final Element entry) {
        return findDistinct(ns, entry, LANGUAGE_GROUP_TAGS);
    }

    /**
     * Term groups of a language group, in variant order, each element once
     */
    static List<Element> termGroups(final Namespaces ns, final Element languageGroup) {
        return findDistinct(ns, languageGroup, TERM_GROUP_TAGS);
    }

    /**
     * The entry and its descendants that are not inside a term group
     */
    static List<Element> entryLevelElements(final Element entry) {
        final List<Element> list = new ArrayList<>();
        for (Element e : selfAndDescendants(entry)) {
            if (!insideTermGroup(e, entry))
                list.add(e);
        }
        return list;
    }

    static boolean isTermGroup(final Element e) {
        final String local = Namespaces.localName(e);
        for (String tag : TERM_GROUP_TAGS)
            if (tag.equals(local))
                return true;
        return false;
    }

    private static boolean insideTermGroup(final Element e, final Element stop) {
        for (Node n = e.getParentNode(); n != null && n != stop; n = n.getParentNode()) {
            if (n.getNodeType() == Node.ELEMENT_NODE && isTermGroup((Element) n))
                return true;
        }
        return false;
    }

    // ------------------------------------------------------------------
    // DOM helpers

    static List<Element> find(final Namespaces ns, final Element scope, final String local) {
        final List<Element> list = new ArrayList<>();
        for (Element e : descendants(scope)) {
            if (ns.matches(e, local))
                list.add(e);
        }
        return list;
    }

    private static List<Element> findDistinct(final Namespaces ns, final Element scope, final List<String> tags) {
        final Set<Element> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        final List<Element> list = new ArrayList<>();
        for (String tag : tags) {
            for (Element e : find(ns, scope, tag)) {
                if (seen.add(e))
                    list.add(e);
            }
        }
        return list;
    }

    static List<Element> descendants(final Element scope) {
        final NodeList nodes = scope.getElementsByTagName("*");
        final List<Element> list = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++)
            list.add((Element) nodes.item(i));
        return list;
    }

    static List<Element> selfAndDescendants(final Element scope) {
        final List<Element> list = new ArrayList<>();
        list.add(scope);
        list.addAll(descendants(scope));
        return list;
    }

    /**
     * Character data of an element up to its first child element, untrimmed
     */
    static String text(final Element e) {
        final StringBuilder sb = new StringBuilder();
        for (Node n = e.getFirstChild(); n != null && n.getNodeType() != Node.ELEMENT_NODE; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.TEXT_NODE || n.getNodeType() == Node.CDATA_SECTION_NODE)
                sb.append(n.getNodeValue());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return name;
    }
}
