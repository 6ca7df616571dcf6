package termbase.flat;

import java.io.File;

/**
 * Default plugin for Excel workbooks.
 */
public class XlsxSheetWriterPlugin implements SheetWriterPlugin {

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean supports(File file) {
        return IO.extension(file).equals(".xlsx");
    }

    @Override
    public SheetWriter create(ConverterConfig config, Logger logger) {
        return new XlsxSheetWriter(config, logger);
    }
}
