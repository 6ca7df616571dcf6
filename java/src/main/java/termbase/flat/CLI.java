/**
 * termbase-flat Command Line Interface
 * Converts a TBX termbase into a spreadsheet, interactively or with every field (-auto)
 */
package termbase.flat;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.logging.LogManager;

import termbase.flat.FieldDiscovery.Discovery;

public final class CLI {
    private static final String VERSION = "0.0.1";

    static boolean LOG = false;

    public static void main(String[] args) {
        configureLogging();
        try {
            final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            int result = executeCLI(System.out, in, args);
            if (result != 0) {
                System.exit(1);
            }
        } catch (ConversionException e) {
            System.err.println("Conversion Error (" + e.getErrorCode().getCode() + "): " + e.getMessage());
            if (e.isNoData())
                System.err.println("Check that the file is a TBX termbase and that the selected fields occur in it.");
            if (LOG) {
                e.printStackTrace();
            }
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (LOG) {
                e.printStackTrace();
            }
            System.exit(1);
        }
    }

    /**
     * Run one command line
     * @return 0 on success, non-zero when the arguments were invalid
     */
    static int executeCLI(PrintStream out, BufferedReader in, String[] args) throws Exception {
        String input = null;
        String output = null;
        boolean auto = false;
        boolean summary = false;
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            String s = args[i];
            // accept both -option and --option
            if (s.startsWith("--"))
                s = s.substring(1);

            if ("-help".equals(s) || "-h".equals(s)) {
                usage(out);
                return 0;
            } else if ("-version".equals(s)) {
                out.println(ConverterConfig.PRODUCT_NAME + " version " + VERSION);
                return 0;
            } else if ("-auto".equals(s)) {
                auto = true;
            } else if ("-summary".equals(s)) {
                summary = true;
            } else if ("-json".equals(s)) {
                json = true;
            } else if ("-log".equals(s)) {
                LOG = true;
            } else if ("-o".equals(s) || "-output".equals(s)) {
                if (i + 1 < args.length) {
                    output = args[++i];
                } else {
                    throw new IllegalArgumentException(s + " requires a file path");
                }
            } else if (s.startsWith("-")) {
                throw new IllegalArgumentException("Unknown option: " + args[i]);
            } else {
                if (input != null)
                    throw new IllegalArgumentException("Only one input file can be converted at a time");
                input = s;
            }
        }

        if (input == null) {
            usage(out);
            return 1;
        }

        final Logger logger = LOG ? new Logger.ConsoleLogger(System.err) : new Logger.DefaultLogger("termbase.flat");
        final ConverterConfig config = ConverterConfig.load();
        final File inputFile = IO.path(input);
        final File outputFile = output != null ? IO.path(output) : IO.withExtension(inputFile, config.outputExtension());

        final IO.StopWatch watch = new IO.StopWatch();
        out.println("Loading TBX file: " + inputFile.getPath());
        final Converter converter = Converter.open(inputFile, config, logger);

        final OutputTable table;
        if (auto) {
            out.println("Auto mode: using all available fields with original names");
            table = converter.convertAll();
        } else {
            final Discovery discovery = converter.discover();
            if (!discovery.isFallback() && !discovery.isComplete()) {
                logger.error("Field discovery sampled %d of %d entries; fields used only by later entries are not listed",
                        discovery.sampledEntries(), discovery.totalEntries());
            }
            final FieldPrompt prompt = new FieldPrompt(in, out);
            final List<String> selected = prompt.selectFields(discovery);
            final FieldMapping mapping = prompt.renameFields(selected);
            table = converter.convert(selected, mapping);
        }

        SheetWriter.write(table, outputFile, config, logger);
        out.println("Successfully converted to: " + outputFile.getPath()
                + " (" + IO.readableBytesSize(outputFile.length()) + ", " + watch.humanReadableTime() + ")");

        final Summary result = Summary.of(table);
        if (json) {
            out.println(result.toJson());
        } else if (summary || !auto) {
            result.print(out);
        }
        return 0;
    }

    /**
     * Use the bundled logging.properties unless a JUL configuration was given on the command line
     */
    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null
                || System.getProperty("java.util.logging.config.class") != null)
            return;
        try (InputStream is = CLI.class.getResourceAsStream("/logging.properties")) {
            if (is != null)
                LogManager.getLogManager().readConfiguration(is);
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }

    private static void usage(PrintStream out) {
        String CMD = ConverterConfig.PRODUCT_NAME;

        out.println("Usage: \"" + CMD + "\" [options] <input.tbx>\n");
        out.println(" options:");
        out.println(" \t-o <file>  \toutput file (.xlsx, .csv, .tsv, .jsonl); defaults to the input name with " + ConverterConfig.defaults().outputExtension());
        out.println(" \t-auto      \tinclude every discovered field with its original name, no prompts");
        out.println(" \t-summary   \tprint the conversion summary (always printed in interactive mode)");
        out.println(" \t-json      \tprint the conversion summary as JSON");
        out.println(" \t-log       \tenable detailed logging");
        out.println(" \t-version   \tshow version information");
        out.println(" \t-help      \tshow this help\n");
        out.println(" examples:");
        out.println("\t" + CMD + " glossary.tbx");
        out.println("\t" + CMD + " glossary.tbx -auto -o out/glossary.xlsx");
        out.println("\t" + CMD + " glossary.tbx -auto -json -o glossary.jsonl");
        out.println();
    }
}
