package com.a2dd.core.document;

import com.a2dd.core.conversion.UnsupportedConstructException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnakeYamlDocumentParserTest {

    private final SnakeYamlDocumentParser parser = new SnakeYamlDocumentParser();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("keeps key order and YAML 1.1 scalars")
    void parsesFile() throws Exception {
        Path file = tempDir.resolve("tasks.yml");
        Files.writeString(file, """
                - name: one
                  copy: {src: a, dest: b, mode: 0644, force: no}
                """);

        Map<?, ?> task = (Map<?, ?>) ((List<?>) parser.parse(file)).get(0);
        Map<?, ?> copy = (Map<?, ?>) task.get("copy");

        assertEquals(List.of("name", "copy"), List.copyOf(task.keySet()));
        assertEquals(420, copy.get("mode"));
        assertEquals(false, copy.get("force"));
    }

    @Test
    @DisplayName("empty document is null")
    void empty() {
        assertNull(parser.parse(""));
    }

    @Test
    @DisplayName("missing file is reported as a conversion error")
    void missingFile() {
        assertThrows(UnsupportedConstructException.class, () -> parser.parse(tempDir.resolve("nope.yml")));
    }

    @Test
    @DisplayName("malformed YAML is reported as a conversion error")
    void malformed() {
        assertThrows(UnsupportedConstructException.class, () -> parser.parse("- a: [unclosed"));
    }

    @Test
    @DisplayName("duplicate keys are rejected")
    void duplicateKeys() {
        assertThrows(UnsupportedConstructException.class, () -> parser.parse("a: 1\na: 2\n"));
    }

    @Test
    @DisplayName("arbitrary tags are refused")
    void unsafeTag() {
        assertThrows(UnsupportedConstructException.class,
                () -> parser.parse("!!java.io.File [\"/etc/passwd\"]"));
    }
}
