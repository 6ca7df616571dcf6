package termbase.flat;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

class TestcaseNamespaces {

    @Test
    void resolve_shouldSeedConventionalNamespaces() throws Exception {
        TermbaseDocument doc = Fixtures.parse(Fixtures.martif("<termEntry/>"));
        Namespaces ns = doc.namespaces();

        assertThat(ns.qualifiers())
                .containsEntry("", "{" + Namespaces.TBX_NS + "}")
                .containsEntry("xml", "{http://www.w3.org/XML/1998/namespace}")
                .containsEntry("xlink", "{http://www.w3.org/1999/xlink}");
    }

    @Test
    void resolve_shouldOverrideDefaultNamespaceFromRoot() throws Exception {
        TermbaseDocument doc = Fixtures.parse("<tbx xmlns=\"urn:iso:std:iso:30042:ed-2\" xmlns:basic=\"http://www.tbxinfo.net/ns/basic\">"
                + "<text><body><conceptEntry id=\"1\"/></body></text></tbx>");
        Namespaces ns = doc.namespaces();

        assertThat(ns.uri("")).isEqualTo("urn:iso:std:iso:30042:ed-2");
        assertThat(ns.uri("basic")).isEqualTo("http://www.tbxinfo.net/ns/basic");
        assertThat(ns.qualify("", "term")).isEqualTo("{urn:iso:std:iso:30042:ed-2}term");
        assertThat(ns.qualify("unknown", "term")).isEqualTo("term");
        assertThat(Namespaces.qualified(doc.root())).isEqualTo("{urn:iso:std:iso:30042:ed-2}tbx");
    }

    @Test
    void matches_shouldAcceptUnqualifiedAndKnownNamespaces() throws Exception {
        TermbaseDocument doc = Fixtures.parse("<tbx xmlns:a=\"urn:a\"><body>"
                + "<term>plain</term>"
                + "<a:term>declared</a:term>"
                + "<b:term xmlns:b=\"urn:b\">undeclared</b:term>"
                + "</body></tbx>");
        Namespaces ns = doc.namespaces();
        List<Element> terms = TermbaseDocument.find(ns, doc.root(), "term");

        // urn:b is declared below the root, so it is not part of the table
        assertThat(terms).extracting(TermbaseDocument::text).containsExactly("plain", "declared");
        assertThat(ns.isUnqualified(terms.get(0))).isTrue();
        assertThat(ns.isUnqualified(terms.get(1))).isFalse();
    }

    @Test
    void resolve_shouldTolerateNullRoot() {
        Namespaces ns = Namespaces.resolve(null);

        assertThat(ns.qualifiers()).containsOnlyKeys("", "xml", "xlink");
    }
}
