package termbase.flat;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Properties;

/**
 * Converter settings
 *
 * Built-in defaults come from the classpath resource termbase-flat-default.properties.
 * A user file overrides them, searched in this order:
 * 1. System property: -Dtermbase-flat.config=/path/to/termbase-flat.properties
 * 2. ./termbase-flat.properties (current directory)
 * 3. ~/.termbase-flat/termbase-flat.properties (user home)
 *
 * <pre>
 * discovery.sample.entries = 3
 * sheet.name = Terminology
 * sheet.column.width.max = 50
 * sheet.column.width.padding = 2
 * output.extension = .xlsx
 * </pre>
 */
public final class ConverterConfig {
    public static final String PRODUCT_NAME = "termbase-flat";

    static final String DEFAULTS_RESOURCE = "/" + PRODUCT_NAME + "-default.properties";
    static final String CONFIG_FILE = PRODUCT_NAME + ".properties";

    static final String SAMPLE_ENTRIES = "discovery.sample.entries";
    static final String SHEET_NAME = "sheet.name";
    static final String COLUMN_WIDTH_MAX = "sheet.column.width.max";
    static final String COLUMN_WIDTH_PADDING = "sheet.column.width.padding";
    static final String OUTPUT_EXTENSION = "output.extension";

    private final Properties props;

    ConverterConfig(final Properties props) {
        this.props = props;
    }

    /**
     * Built-in defaults only
     */
    public static ConverterConfig defaults() {
        final Properties props = new Properties();
        try (InputStream in = ConverterConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
        return new ConverterConfig(props);
    }

    /**
     * Defaults overridden by the first user configuration file found
     */
    public static ConverterConfig load() throws IOException {
        final ConverterConfig config = defaults();
        final File file = findConfigFile();
        if (file != null) {
            config.loadFromFile(file);
        }
        return config;
    }

    private static File findConfigFile() {
        // 1. System property
        final String configPath = System.getProperty(PRODUCT_NAME + ".config");
        if (configPath != null && !configPath.isEmpty()) {
            final File f = IO.path(configPath);
            if (f.exists()) return f;
        }

        // 2. Current directory
        final File localConfig = new File(CONFIG_FILE);
        if (localConfig.exists()) {
            return localConfig;
        }

        // 3. User home directory
        final String home = System.getProperty("user.home");
        if (home != null) {
            final File homeConfig = new File(home, "." + PRODUCT_NAME + "/" + CONFIG_FILE);
            if (homeConfig.exists()) {
                return homeConfig;
            }
        }
        return null;
    }

    void loadFromFile(final File file) throws IOException {
        final Properties loaded = new Properties();
        try (BufferedReader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            loaded.load(reader);
        }
        for (String key : loaded.stringPropertyNames()) {
            final String value = loaded.getProperty(key);
            if (value != null && !value.trim().isEmpty()) {
                props.setProperty(key.trim(), value.trim());
            }
        }
    }

    /**
     * Copy with one setting replaced
     */
    public ConverterConfig with(final String key, final String value) {
        final Properties copy = new Properties();
        copy.putAll(props);
        copy.setProperty(key, value);
        return new ConverterConfig(copy);
    }

    /** Number of entries examined by field discovery. */
    public int sampleEntries() {
        return Math.max(1, intValue(SAMPLE_ENTRIES, FieldDiscovery.DEFAULT_SAMPLE_ENTRIES));
    }

    public String sheetName() {
        return props.getProperty(SHEET_NAME, "Terminology");
    }

    public int maxColumnWidth() {
        return intValue(COLUMN_WIDTH_MAX, 50);
    }

    public int columnWidthPadding() {
        return intValue(COLUMN_WIDTH_PADDING, 2);
    }

    public String outputExtension() {
        final String ext = props.getProperty(OUTPUT_EXTENSION, ".xlsx");
        return ext.startsWith(".") ? ext : "." + ext;
    }

    private int intValue(final String key, final int dfl) {
        final String v = props.getProperty(key);
        if (v == null || v.isEmpty())
            return dfl;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v, ex);
        }
    }
}
