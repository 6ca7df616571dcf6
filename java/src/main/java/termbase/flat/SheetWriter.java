/**
 *
 */
package termbase.flat;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Renders an {@link OutputTable} into a file. Every value is written as plain text.
 */
public interface SheetWriter {

    /**
     * Plugin registry for output formats.
     * Plugins are loaded dynamically via ServiceLoader.
     */
    class PluginRegistry {
        private static final List<SheetWriterPlugin> plugins = new ArrayList<>();
        private static volatile boolean initialized = false;

        static {
            loadPlugins();
        }

        private static synchronized void loadPlugins() {
            if (initialized) return;

            final ServiceLoader<SheetWriterPlugin> loader = ServiceLoader.load(SheetWriterPlugin.class);
            for (SheetWriterPlugin plugin : loader) {
                plugins.add(plugin);
            }

            // built-in formats are available even without ServiceLoader config
            addIfAbsent(new XlsxSheetWriterPlugin());
            addIfAbsent(new DelimitedSheetWriterPlugin());
            addIfAbsent(new JsonlSheetWriterPlugin());

            // Sort by priority (descending)
            plugins.sort(Comparator.comparingInt(SheetWriterPlugin::priority).reversed());

            initialized = true;
        }

        private static void addIfAbsent(final SheetWriterPlugin builtin) {
            for (SheetWriterPlugin p : plugins) {
                if (p.getClass() == builtin.getClass())
                    return;
            }
            plugins.add(builtin);
        }

        static SheetWriterPlugin findPlugin(final File file) {
            for (SheetWriterPlugin plugin : plugins) {
                if (plugin.supports(file)) {
                    return plugin;
                }
            }
            return null;
        }

        static List<SheetWriterPlugin> getPlugins() {
            return new ArrayList<>(plugins);
        }
    }

    /**
     * Write the table to the file, replacing it if present.
     * @param table The table to write
     * @param file The output file
     * @throws IOException
     */
    void write(OutputTable table, File file) throws IOException;

    /**
     * Check if some plugin writes this file's format.
     */
    static boolean supports(final File file) {
        return PluginRegistry.findPlugin(file) != null;
    }

    /**
     * Writer for the file's format
     * @throws ConversionException UNSUPPORTED_OUTPUT
     */
    static SheetWriter forFile(final File file, final ConverterConfig config, final Logger logger) throws ConversionException {
        final SheetWriterPlugin plugin = PluginRegistry.findPlugin(file);
        if (plugin == null)
            throw new ConversionException(ErrorCode.UNSUPPORTED_OUTPUT, file.getName());
        return plugin.create(config, logger);
    }

    /**
     * Write the table with the writer for the file's format, creating parent directories.
     * @return The written file
     * @throws ConversionException UNSUPPORTED_OUTPUT or OUTPUT_WRITE_ERROR
     */
    static File write(final OutputTable table, final File file, final ConverterConfig config, final Logger logger) throws ConversionException {
        final SheetWriter writer = forFile(file, config, logger);
        IO.mkdirs(file);
        try {
            writer.write(table, file);
        } catch (ConversionException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw new ConversionException(ErrorCode.OUTPUT_WRITE_ERROR, file.getPath(), ex);
        }
        if (!file.exists())
            throw new ConversionException(ErrorCode.OUTPUT_WRITE_ERROR, file.getPath() + " was not created");
        return file;
    }
}
