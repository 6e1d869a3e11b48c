/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.tsfmt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private static final String UNSORTED = "// b\nfunction b(){}\n// a\nfunction a(){}\n";
    private static final String SORTED = "// a\nfunction a(){}\n\n// b\nfunction b(){}\n";

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return Main.run(args, out, err);
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    private Path source(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void usageErrors() {
        assertEquals(1, run());
        assertTrue(err().contains("Usage: tsfmt"));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"--check", "--stdout", "a.ts"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"--bogus", "a.ts"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"a.ts", "--config"}));
    }

    @Test
    void parsesOptions() {
        Main.Options options = Main.parseArgs(new String[]{"--check", "--json", "--config", "cfg.json", "src", "b.ts"});
        assertTrue(options.check());
        assertTrue(options.json());
        assertFalse(options.stdout());
        assertEquals(Path.of("cfg.json"), options.config());
        assertEquals(2, options.paths().size());
    }

    @Test
    void stdoutPrintsFormattedText() throws IOException {
        Path file = source("x.ts", UNSORTED);
        assertEquals(0, run("--stdout", file.toString()));
        assertEquals(SORTED, out());
        assertEquals(UNSORTED, Files.readString(file));
    }

    @Test
    void checkFailsWhenFilesWouldChange() throws IOException {
        Path file = source("x.ts", UNSORTED);
        assertEquals(1, run("--check", file.toString()));
        assertTrue(err().contains("would change"));
        assertEquals(UNSORTED, Files.readString(file));

        Path clean = source("clean.ts", SORTED);
        assertEquals(0, run("--check", clean.toString()));
    }

    @Test
    void writesFilesAndReportsJson() throws IOException {
        Path file = source("x.ts", UNSORTED);
        assertEquals(0, run("--json", "--no-backup", tempDir.toString()));

        JsonNode report = new ObjectMapper().readTree(out());
        assertEquals(1, report.path("summary").path("total").asInt());
        assertEquals(1, report.path("summary").path("changed").asInt());
        assertEquals(0, report.path("summary").path("failed").asInt());
        assertEquals("FORMATTED", report.path("files").get(0).path("status").asText());
        assertEquals(2, report.path("files").get(0).path("attachedComments").asInt());

        assertEquals(SORTED, Files.readString(file));
        assertFalse(Files.exists(tempDir.resolve("x.ts.bak")));
    }

    @Test
    void configFileDisablesRules() throws IOException {
        Path config = source("tsfmt.json", "{\"backup\": false, \"rules\": {\"declarations\": false}}");
        Path file = source("x.ts", UNSORTED);

        assertEquals(0, run("--config", config.toString(), file.toString()));
        // Без сортировки объявлений комментарии остаются на местах, меняется только пустая строка
        assertEquals("// b\nfunction b(){}\n\n// a\nfunction a(){}\n", Files.readString(file));
        assertFalse(Files.exists(tempDir.resolve("x.ts.bak")));
    }

    @Test
    void failuresSetExitCode() throws IOException {
        Path broken = source("broken.ts", "const = ;\n");
        assertEquals(1, run("--json", broken.toString()));
        JsonNode report = new ObjectMapper().readTree(out());
        assertEquals("PARSE_FAILED", report.path("files").get(0).path("code").asText());
        assertEquals(1, report.path("summary").path("failed").asInt());
    }

    @Test
    void missingConfigIsAnError() {
        assertEquals(1, run("--config", tempDir.resolve("none.json").toString(), tempDir.toString()));
        assertFalse(err().isEmpty());
    }
}
