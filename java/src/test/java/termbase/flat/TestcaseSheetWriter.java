package termbase.flat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

class TestcaseSheetWriter {

    @TempDir
    Path tmp;

    private static OutputTable sample() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("entry_id", "c1");
        first.put("en_term", "cat");
        first.put("en_term_2", "feline");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("entry_id", "c2");
        second.put("en_term", "dog, \"good\"\tboy");
        return OutputTable.of(List.of(first, second));
    }

    @Test
    void xlsx_shouldWriteHeaderAndTextCells() throws Exception {
        File file = tmp.resolve("out/glossary.xlsx").toFile();

        SheetWriter.write(sample(), file, ConverterConfig.defaults(), null);

        try (InputStream in = new FileInputStream(file); Workbook wb = new XSSFWorkbook(in)) {
            Sheet sheet = wb.getSheet("Terminology");
            assertThat(sheet).isNotNull();
            Row head = sheet.getRow(0);
            assertThat(head.getCell(0).getStringCellValue()).isEqualTo("entry_id");
            assertThat(head.getCell(2).getStringCellValue()).isEqualTo("en_term_2");
            assertThat(((XSSFCellStyle) head.getCell(0).getCellStyle()).getFont().getBold()).isTrue();
            assertThat(sheet.getRow(1).getCell(2).getStringCellValue()).isEqualTo("feline");
            assertThat(sheet.getRow(2).getCell(2).getStringCellValue()).isEmpty();
            assertThat(sheet.getLastRowNum()).isEqualTo(2);
        }
    }

    @Test
    void xlsx_shouldUseConfiguredSheetName() throws Exception {
        File file = tmp.resolve("named.xlsx").toFile();

        SheetWriter.write(sample(), file, ConverterConfig.defaults().with("sheet.name", "Glossary"), null);

        try (InputStream in = new FileInputStream(file); Workbook wb = new XSSFWorkbook(in)) {
            assertThat(wb.getSheetName(0)).isEqualTo("Glossary");
        }
    }

    @Test
    void xlsx_shouldFallBackToAlternateBackend() throws Exception {
        File file = tmp.resolve("fallback.xlsx").toFile();
        AtomicInteger alternateCalls = new AtomicInteger();
        XlsxSheetWriter plain = new XlsxSheetWriter(ConverterConfig.defaults(), null);
        XlsxSheetWriter writer = new XlsxSheetWriter(ConverterConfig.defaults(), null,
                (table, f) -> {
                    throw new IllegalStateException("streaming failed");
                },
                (table, f) -> {
                    alternateCalls.incrementAndGet();
                    plain.writePlain(table, f);
                });

        writer.write(sample(), file);

        assertThat(alternateCalls).hasValue(1);
        try (InputStream in = new FileInputStream(file); Workbook wb = new XSSFWorkbook(in)) {
            assertThat(wb.getSheetAt(0).getRow(1).getCell(1).getStringCellValue()).isEqualTo("cat");
        }
    }

    @Test
    void xlsx_shouldFailWhenBothBackendsFail() {
        File file = tmp.resolve("never.xlsx").toFile();
        XlsxSheetWriter writer = new XlsxSheetWriter(ConverterConfig.defaults(), null,
                (table, f) -> {
                    throw new IllegalStateException("first");
                },
                (table, f) -> {
                    throw new java.io.IOException("second");
                });

        assertThatThrownBy(() -> writer.write(sample(), file))
                .isInstanceOf(ConversionException.class)
                .satisfies(ex -> assertThat(((ConversionException) ex).getErrorCode()).isEqualTo(ErrorCode.OUTPUT_WRITE_ERROR))
                .satisfies(ex -> assertThat(ex.getCause().getSuppressed()).hasSize(1));
    }

    @Test
    void columnWidths_shouldPadAndCap() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("a", "x".repeat(80));
        row.put("bb", "y");
        OutputTable table = OutputTable.of(List.of(row));

        assertThat(XlsxSheetWriter.columnWidths(table, 2, 50)).containsExactly(50, 4);
    }

    @Test
    void tsv_shouldEscapeSeparators() throws Exception {
        File file = tmp.resolve("glossary.tsv").toFile();

        SheetWriter.write(sample(), file, ConverterConfig.defaults(), null);

        assertThat(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8)).containsExactly(
                "entry_id\ten_term\ten_term_2",
                "c1\tcat\tfeline",
                "c2\tdog, \"good\"\\tboy\t");
    }

    @Test
    void csv_shouldQuoteSeparators() throws Exception {
        File file = tmp.resolve("glossary.csv").toFile();

        SheetWriter.write(sample(), file, ConverterConfig.defaults(), null);

        assertThat(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8)).containsExactly(
                "entry_id,en_term,en_term_2",
                "c1,cat,feline",
                "c2,\"dog, \"\"good\"\"\tboy\",");
    }

    @Test
    void jsonl_shouldWriteOneObjectPerRow() throws Exception {
        File file = tmp.resolve("glossary.jsonl").toFile();
        OutputTable renamed = ColumnRenamer.rename(sample(), FieldMapping.of(Map.of("term", "Headword")));

        SheetWriter.write(renamed, file, ConverterConfig.defaults(), null);

        List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(2);
        JsonObject second = JsonParser.parseString(lines.get(1)).getAsJsonObject();
        assertThat(second.keySet()).containsExactly("entry_id", "en_Headword", "en_Headword_2");
        assertThat(second.get("en_Headword").getAsString()).isEqualTo("dog, \"good\"\tboy");
        assertThat(second.get("en_Headword_2").getAsString()).isEmpty();
    }

    @Test
    void jsonl_shouldKeepColumnsRenamedToTheSameHeader() throws Exception {
        File file = tmp.resolve("collide.jsonl").toFile();
        Map<String, String> row = new LinkedHashMap<>();
        row.put("en_term", "a");
        row.put("en_definition", "b");
        OutputTable table = OutputTable.of(List.of(row)).withHeaders(List.of("en_Text", "en_Text"));

        SheetWriter.write(table, file, ConverterConfig.defaults(), null);

        JsonObject o = JsonParser.parseString(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8).get(0)).getAsJsonObject();
        assertThat(o.keySet()).containsExactly("en_Text", "en_Text_dup2");
        assertThat(o.get("en_Text").getAsString()).isEqualTo("a");
        assertThat(o.get("en_Text_dup2").getAsString()).isEqualTo("b");
    }

    @Test
    void jsonlKeys_shouldNotShadowLaterHeaders() {
        assertThat(JsonlSheetWriter.keys(List.of("x", "x", "x_dup2", "x")))
                .containsExactly("x", "x_dup3", "x_dup2", "x_dup4");
        assertThat(JsonlSheetWriter.keys(List.of("a", "b"))).containsExactly("a", "b");
    }

    @Test
    void forFile_shouldRejectUnknownExtension() {
        assertThat(SheetWriter.supports(new File("a.xlsx"))).isTrue();
        assertThat(SheetWriter.supports(new File("a.CSV"))).isTrue();
        assertThat(SheetWriter.supports(new File("a.ods"))).isFalse();
        assertThatThrownBy(() -> SheetWriter.write(sample(), tmp.resolve("a.ods").toFile(), ConverterConfig.defaults(), null))
                .isInstanceOf(ConversionException.class)
                .satisfies(ex -> assertThat(((ConversionException) ex).isErrorCode(ErrorCode.UNSUPPORTED_OUTPUT)).isTrue());
    }

    @Test
    void registry_shouldOrderPluginsByPriority() {
        List<SheetWriterPlugin> plugins = SheetWriter.PluginRegistry.getPlugins();

        assertThat(plugins).hasSize(3);
        assertThat(plugins.get(0)).isInstanceOf(XlsxSheetWriterPlugin.class);
    }
}
