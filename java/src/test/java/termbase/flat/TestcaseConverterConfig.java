package termbase.flat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestcaseConverterConfig {

    @TempDir
    Path tmp;

    @Test
    void defaults_shouldComeFromBundledProperties() {
        ConverterConfig config = ConverterConfig.defaults();

        assertThat(config.sampleEntries()).isEqualTo(3);
        assertThat(config.sheetName()).isEqualTo("Terminology");
        assertThat(config.maxColumnWidth()).isEqualTo(50);
        assertThat(config.columnWidthPadding()).isEqualTo(2);
        assertThat(config.outputExtension()).isEqualTo(".xlsx");
    }

    @Test
    void with_shouldNotChangeOriginal() {
        ConverterConfig config = ConverterConfig.defaults();
        ConverterConfig csv = config.with("output.extension", "csv");

        assertThat(csv.outputExtension()).isEqualTo(".csv");
        assertThat(config.outputExtension()).isEqualTo(".xlsx");
    }

    @Test
    void sampleEntries_shouldBeAtLeastOne() {
        assertThat(ConverterConfig.defaults().with("discovery.sample.entries", "0").sampleEntries()).isEqualTo(1);
        assertThatThrownBy(() -> ConverterConfig.defaults().with("discovery.sample.entries", "many").sampleEntries())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("discovery.sample.entries");
    }

    @Test
    void load_shouldApplyFileNamedBySystemProperty() throws Exception {
        File file = Fixtures.write(tmp, "termbase-flat.properties",
                "sheet.name = Glossary\nsheet.column.width.max = 80\nsheet.column.width.padding =\n");
        String key = ConverterConfig.PRODUCT_NAME + ".config";
        String previous = System.getProperty(key);
        System.setProperty(key, file.getPath());
        try {
            ConverterConfig config = ConverterConfig.load();

            assertThat(config.sheetName()).isEqualTo("Glossary");
            assertThat(config.maxColumnWidth()).isEqualTo(80);
            // blank values keep the default
            assertThat(config.columnWidthPadding()).isEqualTo(2);
        } finally {
            if (previous == null)
                System.clearProperty(key);
            else
                System.setProperty(key, previous);
        }
    }
}
