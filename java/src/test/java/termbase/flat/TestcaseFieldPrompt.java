package termbase.flat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;

import termbase.flat.FieldDiscovery.Discovery;

class TestcaseFieldPrompt {

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    private FieldPrompt prompt(String input) {
        return new FieldPrompt(new BufferedReader(new StringReader(input)), new PrintStream(bytes, true, StandardCharsets.UTF_8));
    }

    private static Discovery discovery() {
        return new Discovery(new TreeSet<>(List.of("entry_id", "language", "term", "termNote_status")), 1, 1, false);
    }

    private String output() {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void selectFields_shouldFollowNumbersInInputOrder() throws Exception {
        List<String> selected = prompt("4, 1\n").selectFields(discovery());

        assertThat(selected).containsExactly("termNote_status", "entry_id");
        assertThat(output()).contains(" 3. term", "Selected 2 fields");
    }

    @Test
    void selectFields_shouldAcceptAll() throws Exception {
        assertThat(prompt("ALL\n").selectFields(discovery()))
                .containsExactly("entry_id", "language", "term", "termNote_status");
    }

    @Test
    void selectFields_shouldRepromptOnInvalidInput() throws Exception {
        List<String> selected = prompt("one\n0,5\n3\n").selectFields(discovery());

        assertThat(selected).containsExactly("term");
        assertThat(output())
                .contains("Invalid input")
                .contains("Invalid numbers: [0, 5]");
    }

    @Test
    void selectFields_shouldWarnAboutIncompleteDiscovery() throws Exception {
        Discovery partial = new Discovery(new TreeSet<>(List.of("term")), 3, 10, false);

        prompt("all\n").selectFields(partial);

        assertThat(output()).contains("scanned the first 3 of 10 entries");
    }

    @Test
    void renameFields_shouldKeepOriginalNames() throws Exception {
        FieldMapping mapping = prompt("keep\n").renameFields(List.of("term", "entry_id"));

        assertThat(mapping.isIdentity()).isTrue();
        assertThat(mapping.asMap()).containsOnlyKeys("term", "entry_id");
    }

    @Test
    void renameFields_shouldReadNewNames() throws Exception {
        FieldMapping mapping = prompt("maybe\nrename\ny\nHeadword\n\n").renameFields(List.of("term", "entry_id"));

        assertThat(mapping.get("term")).isEqualTo("Headword");
        assertThat(mapping.get("entry_id")).isEqualTo("entry_id");
        assertThat(output()).contains("Please enter 'keep' or 'rename'", "'term' -> 'Headword'", "'entry_id' (unchanged)");
    }

    @Test
    void renameFields_shouldKeepNamesWhenDeclined() throws Exception {
        assertThat(prompt("rename\nno\n").renameFields(List.of("term")).isIdentity()).isTrue();
    }

    @Test
    void prompt_shouldFailWhenInputEnds() {
        assertThatThrownBy(() -> prompt("").selectFields(discovery())).isInstanceOf(EOFException.class);
        assertThatThrownBy(() -> prompt("rename\n").renameFields(List.of("term"))).isInstanceOf(EOFException.class);
    }
}
