package termbase.flat;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * JSONL writer (using Gson): one object per row, keyed by header, every column present.
 * A header repeated by renaming gets a {@code _dupN} suffix so no cell is overwritten.
 */
final class JsonlSheetWriter implements SheetWriter {
	private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();
	private final Logger logger;

	JsonlSheetWriter(final Logger logger) {
		this.logger = (logger != null ? logger : new Logger.NullLogger());
	}

	@Override
	public void write(final OutputTable table, final File file) throws IOException {
		logger.log("Writing %d rows as JSONL to %s", table.size(), file);
		final List<String> headers = keys(table.headers());
		try (BufferedWriter w = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
			for (int r = 0; r < table.size(); r++) {
				final List<String> cells = table.cells(r);
				final JsonObject o = new JsonObject();
				for (int c = 0; c < headers.size(); c++)
					o.addProperty(headers.get(c), cells.get(c));
				w.write(gson.toJson(o));
				w.write('\n');
			}
		}
	}

	/**
	 * Unique object keys: the first use of a header keeps it, later ones become header_dup2, header_dup3...
	 */
	static List<String> keys(final List<String> headers) {
		final Set<String> reserved = new HashSet<>(headers);
		final Set<String> taken = new HashSet<>();
		final List<String> keys = new ArrayList<>(headers.size());
		for (String header : headers) {
			String key = header;
			int n = 2;
			while (taken.contains(key)) {
				key = header + "_dup" + n++;
				// a generated key must not shadow a header that is still to come
				if (reserved.contains(key))
					key = header;
			}
			taken.add(key);
			keys.add(key);
		}
		return keys;
	}
}
