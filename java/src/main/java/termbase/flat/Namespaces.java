package termbase.flat;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import javax.xml.XMLConstants;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

/**
 * Namespace table of a TBX document
 *
 * Maps each prefix ("" for the default namespace) to its URI in {uri} form.
 * Conventional TBX namespaces are seeded first, then overridden by the xmlns
 * declarations of the root element. Element lookups accept both the unqualified
 * name and the name qualified by any namespace in this table, so documents that
 * declare nothing still resolve.
 */
public final class Namespaces {
	public static final String TBX_NS = "http://www.lisa.org/TBX-Specification.33.0.html";
	public static final String XML_NS = XMLConstants.XML_NS_URI;
	public static final String XLINK_NS = "http://www.w3.org/1999/xlink";

	private final Map<String, String> uris; // prefix -> uri
	private final Set<String> known;

	private Namespaces(final Map<String, String> uris) {
		this.uris = Collections.unmodifiableMap(uris);
		this.known = new HashSet<>(uris.values());
	}

	/**
	 * Resolve the namespace table from a document root. A null root yields the seeded table.
	 */
	public static Namespaces resolve(final Element root) {
		final Map<String, String> m = new LinkedHashMap<>();
		m.put("", TBX_NS);
		m.put("xml", XML_NS);
		m.put("xlink", XLINK_NS);

		if (root != null) {
			final NamedNodeMap attrs = root.getAttributes();
			for (int i = 0; i < attrs.getLength(); i++) {
				final Attr a = (Attr) attrs.item(i);
				final String name = a.getName();
				if ("xmlns".equals(name)) {
					m.put("", a.getValue());
				} else if (name.startsWith("xmlns:")) {
					m.put(name.substring(6), a.getValue());
				}
			}
		}
		return new Namespaces(m);
	}

	/**
	 * Prefix to {uri} qualifier, e.g. "" to "{urn:iso:std:iso:30042:ed-2}"
	 */
	public Map<String, String> qualifiers() {
		final Map<String, String> m = new LinkedHashMap<>();
		for (var e : uris.entrySet())
			m.put(e.getKey(), "{" + e.getValue() + "}");
		return m;
	}

	public String uri(final String prefix) {
		return uris.get(prefix);
	}

	public String qualify(final String prefix, final String local) {
		final String uri = uris.get(prefix);
		return (uri == null || uri.isEmpty()) ? local : "{" + uri + "}" + local;
	}

	/**
	 * True if the element is named local, unqualified or in a namespace of this table
	 */
	public boolean matches(final Element e, final String local) {
		if (!local.equals(localName(e)))
			return false;
		final String ns = e.getNamespaceURI();
		return ns == null || known.contains(ns);
	}

	public boolean isUnqualified(final Element e) {
		return e.getNamespaceURI() == null;
	}

	/**
	 * {uri}local form of an element name, or the bare local name when unqualified
	 */
	public static String qualified(final Element e) {
		final String ns = e.getNamespaceURI();
		return (ns == null) ? localName(e) : "{" + ns + "}" + localName(e);
	}

	static String localName(final Node n) {
		final String local = n.getLocalName();
		if (local != null)
			return local;
		final String name = n.getNodeName();
		final int colon = name.indexOf(':');
		return (colon > -1) ? name.substring(colon + 1) : name;
	}

	@Override
	public String toString() {
		return qualifiers().toString();
	}
}
