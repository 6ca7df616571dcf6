package termbase.flat;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Excel (.xlsx) writer
 *
 * The primary backend streams rows through SXSSF, bolds the header and sizes each column to
 * its longest value plus padding, capped. If it fails, the alternate backend writes the same
 * cells through a plain in-memory workbook without cosmetics before giving up.
 */
final class XlsxSheetWriter implements SheetWriter {
    private static final int ROW_WINDOW = 100;

    /**
     * One way of producing the workbook
     */
    interface Backend {
        void write(OutputTable table, File file) throws IOException;
    }

    private final ConverterConfig config;
    private final Logger logger;
    private final Backend primary;
    private final Backend alternate;

    XlsxSheetWriter(final ConverterConfig config, final Logger logger) {
        this.config = config;
        this.logger = (logger != null ? logger : new Logger.NullLogger());
        this.primary = this::writeStreaming;
        this.alternate = this::writePlain;
    }

    XlsxSheetWriter(final ConverterConfig config, final Logger logger, final Backend primary, final Backend alternate) {
        this.config = config;
        this.logger = (logger != null ? logger : new Logger.NullLogger());
        this.primary = primary;
        this.alternate = alternate;
    }

    @Override
    public void write(final OutputTable table, final File file) throws IOException {
        logger.log("Writing %d rows to Excel file: %s", table.size(), file);
        try {
            primary.write(table, file);
            return;
        } catch (IOException | RuntimeException ex) {
            logger.error("Error writing Excel file: %s (%s)", ex.getMessage(), ex.getClass().getSimpleName());
            logger.log("Trying alternative Excel writer");
            try {
                alternate.write(table, file);
                logger.log("Created Excel file with alternative writer: %s", file);
            } catch (IOException | RuntimeException ex2) {
                logger.error("Alternative Excel writer also failed: %s", ex2.getMessage());
                ex2.addSuppressed(ex);
                throw new ConversionException(ErrorCode.OUTPUT_WRITE_ERROR, file.getPath(), ex2);
            }
        }
    }

    void writeStreaming(final OutputTable table, final File file) throws IOException {
        final SXSSFWorkbook wb = new SXSSFWorkbook(ROW_WINDOW);
        try {
            final Sheet sheet = wb.createSheet(config.sheetName());
            final CellStyle bold = wb.createCellStyle();
            final Font font = wb.createFont();
            font.setBold(true);
            bold.setFont(font);

            fill(sheet, table, bold);

            final int[] widths = columnWidths(table, config.columnWidthPadding(), config.maxColumnWidth());
            for (int i = 0; i < widths.length; i++)
                sheet.setColumnWidth(i, widths[i] * 256);

            save(wb, file);
        } finally {
            wb.dispose();
            wb.close();
        }
    }

    void writePlain(final OutputTable table, final File file) throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {
            fill(wb.createSheet(config.sheetName()), table, null);
            save(wb, file);
        }
    }

    private static void fill(final Sheet sheet, final OutputTable table, final CellStyle headerStyle) {
        final List<String> headers = table.headers();
        final Row head = sheet.createRow(0);
        for (int c = 0; c < headers.size(); c++) {
            final Cell cell = head.createCell(c);
            cell.setCellValue(headers.get(c));
            if (headerStyle != null)
                cell.setCellStyle(headerStyle);
        }

        for (int r = 0; r < table.size(); r++) {
            final Row row = sheet.createRow(r + 1);
            final List<String> cells = table.cells(r);
            for (int c = 0; c < cells.size(); c++)
                row.createCell(c).setCellValue(cells.get(c));
        }
    }

    private static void save(final Workbook wb, final File file) throws IOException {
        try (OutputStream out = Files.newOutputStream(file.toPath())) {
            wb.write(out);
        }
    }

    /**
     * Character width per column: longest of header and values, plus padding, at most max
     */
    static int[] columnWidths(final OutputTable table, final int padding, final int max) {
        final List<String> headers = table.headers();
        final int[] widths = new int[headers.size()];
        for (int c = 0; c < widths.length; c++)
            widths[c] = headers.get(c).length();
        for (int r = 0; r < table.size(); r++) {
            final List<String> cells = table.cells(r);
            for (int c = 0; c < widths.length; c++)
                widths[c] = Math.max(widths[c], cells.get(c).length());
        }
        for (int c = 0; c < widths.length; c++)
            widths[c] = Math.min(widths[c] + padding, max);
        return widths;
    }
}
