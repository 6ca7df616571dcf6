package termbase.flat;

import java.io.File;

/**
 * Plugin for JSON lines output.
 */
public class JsonlSheetWriterPlugin implements SheetWriterPlugin {

    @Override
    public boolean supports(File file) {
        return IO.extension(file).equals(".jsonl");
    }

    @Override
    public SheetWriter create(ConverterConfig config, Logger logger) {
        return new JsonlSheetWriter(logger);
    }
}
