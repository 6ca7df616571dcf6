package termbase.flat;

import java.io.File;

/**
 * Plugin interface for output formats.
 * Implementations should be registered via ServiceLoader.
 */
public interface SheetWriterPlugin {

    /**
     * Get the priority of this plugin. Higher priority plugins are checked first.
     * Default implementations should return 0.
     * @return Priority value (higher = checked first)
     */
    default int priority() {
        return 0;
    }

    /**
     * Check if this plugin writes the given file.
     * @param file The output file
     * @return true if this plugin can write the file
     */
    boolean supports(File file);

    /**
     * Create a writer.
     * @param config Converter settings (sheet name, column widths)
     * @param logger The logger to use
     * @return The writer
     */
    SheetWriter create(ConverterConfig config, Logger logger);
}
