package termbase.flat;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Sample termbases shared by the test cases.
 */
final class Fixtures {
    /** TBX 2 martif: four termEntry elements, a duplicate term, an entry without id, an entry without terms. */
    static final String GLOSSARY = "glossary.tbx";
    /** TBX-Basic v3 in the ISO namespace: conceptEntry, langSec, termSec. */
    static final String BASIC_V3 = "basic-v3.tbx";

    private Fixtures() {
    }

    /**
     * Copy a bundled sample into dir
     */
    static File copy(final String name, final Path dir) throws IOException {
        final Path target = dir.resolve(name);
        try (InputStream in = Fixtures.class.getResourceAsStream(name)) {
            if (in == null)
                throw new IOException("missing test resource " + name);
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target.toFile();
    }

    static File write(final Path dir, final String name, final String content) throws IOException {
        final Path target = dir.resolve(name);
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return target.toFile();
    }

    static TermbaseDocument parse(final String xml) throws ConversionException {
        return TermbaseDocument.parse("inline.tbx", xml);
    }

    /**
     * Wrap termEntry markup into a minimal martif document
     */
    static String martif(final String body) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<martif type=\"TBX\"><text><body>\n" + body + "\n</body></text></martif>";
    }
}
