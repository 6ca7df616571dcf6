package termbase.flat;

import java.io.File;

/**
 * Plugin for TSV/CSV output.
 * This plugin has the lowest priority.
 */
public class DelimitedSheetWriterPlugin implements SheetWriterPlugin {

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public boolean supports(File file) {
        final String ext = IO.extension(file);
        return ext.equals(".tsv") || ext.equals(".csv");
    }

    @Override
    public SheetWriter create(ConverterConfig config, Logger logger) {
        return new DelimitedSheetWriter(null, logger);
    }
}
