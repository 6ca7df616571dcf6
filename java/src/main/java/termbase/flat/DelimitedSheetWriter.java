/**
 * TSV/CSV sheet writer
 */
package termbase.flat;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

/**
 * Delimited text writer: a header line, then one line per row.
 *
 * TSV escapes backslash, tab and line breaks with a backslash; CSV wraps a value in
 * quotes when it holds the delimiter, a quote or a line break, doubling inner quotes.
 * Blank cells are written empty.
 */
final class DelimitedSheetWriter implements SheetWriter {

    /**
     * Delimiter and quoting rules
     */
    static final class Format {
        private final String name;
        private final char delimiter;
        private final char quote;

        static final Format TSV = new Format("TSV", '\t', (char) 0);
        static final Format CSV = new Format("CSV", ',', '"');

        private Format(final String name, final char delimiter, final char quote) {
            this.name = name;
            this.delimiter = delimiter;
            this.quote = quote;
        }

        static Format forFile(final File file) {
            return ".csv".equals(IO.extension(file)) ? CSV : TSV;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private final Format format;
    private final Logger logger;

    DelimitedSheetWriter(final Format format, final Logger logger) {
        this.format = format;
        this.logger = (logger != null ? logger : new Logger.NullLogger());
    }

    @Override
    public void write(final OutputTable table, final File file) throws IOException {
        final Format fmt = (format != null) ? format : Format.forFile(file);
        logger.log("Writing %d rows as %s to %s", table.size(), fmt, file);
        try (BufferedWriter w = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            w.write(line(table.headers(), fmt));
            for (int r = 0; r < table.size(); r++)
                w.write(line(table.cells(r), fmt));
        }
    }

    static String line(final List<String> cells, final Format fmt) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0)
                sb.append(fmt.delimiter);
            appendEscaped(sb, cells.get(i), fmt);
        }
        sb.append('\n');
        return sb.toString();
    }

    private static void appendEscaped(final StringBuilder sb, final String s, final Format fmt) {
        final char DELIM = fmt.delimiter;
        final char QUOTE = fmt.quote;
        if (QUOTE == 0) {
            for (int i = 0, n = s.length(); i < n; i++) {
                char ch = s.charAt(i);
                if (ch == '\\') {
                    sb.append("\\\\");
                } else if (ch == '\t') {
                    sb.append("\\t");
                } else if (ch == '\n') {
                    sb.append("\\n");
                } else if (ch == '\r') {
                    sb.append("\\r");
                } else if (ch == DELIM) {
                    sb.append('\\').append(DELIM);
                } else {
                    sb.append(ch);
                }
            }
            return;
        }

        boolean needsQuote = false;
        for (int i = 0, n = s.length(); i < n && !needsQuote; i++) {
            char ch = s.charAt(i);
            if (ch == QUOTE || ch == '\n' || ch == '\r' || ch == DELIM)
                needsQuote = true;
        }
        if (!needsQuote) {
            sb.append(s);
            return;
        }
        sb.append(QUOTE);
        for (int i = 0, n = s.length(); i < n; i++) {
            char ch = s.charAt(i);
            if (ch == QUOTE) {
                sb.append(QUOTE).append(QUOTE);
            } else {
                sb.append(ch);
            }
        }
        sb.append(QUOTE);
    }
}
