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
package ru.nts.tools.tsfmt.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormatterConfigTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void defaults() {
        FormatterConfig config = FormatterConfig.defaults();
        assertEquals("  ", config.indent());
        assertTrue(config.backup());
        assertTrue(config.exclude().contains("node_modules"));
        assertEquals(List.of("ts", "tsx", "mts", "cts"), config.extensions());
        assertEquals(FormatterConfig.Rules.all(), config.rules());
    }

    @Test
    void missingFileMeansDefaults() throws IOException {
        assertEquals(FormatterConfig.defaults(), FormatterConfig.load(tempDir.resolve("tsfmt.json")));
        assertEquals(FormatterConfig.defaults(), FormatterConfig.load(null));
    }

    @Test
    void overridesAndUnknownKeys() throws IOException {
        Path file = tempDir.resolve("tsfmt.json");
        Files.writeString(file, """
                {
                  "indent": "    ",
                  "backup": false,
                  "exclude": ["dist"],
                  "extensions": ["ts", "js"],
                  "somethingElse": 42,
                  "rules": { "imports": false, "enums": false, "future": true }
                }
                """);

        FormatterConfig config = FormatterConfig.load(file);
        assertEquals("    ", config.indent());
        assertFalse(config.backup());
        assertEquals(List.of("dist"), config.exclude());
        assertEquals(List.of("ts", "js"), config.extensions());
        assertFalse(config.rules().imports());
        assertFalse(config.rules().enums());
        assertTrue(config.rules().declarations());
        assertTrue(config.rules().objectKeys());
    }

    @Test
    void wrongTypeIsRejected() throws IOException {
        TsfmtException e = assertThrows(TsfmtException.class,
                () -> FormatterConfig.fromJson(mapper.readTree("{\"backup\": \"yes\"}"), "tsfmt.json"));
        assertEquals(TsfmtErrorCode.CONFIG_INVALID, e.getCode());
        assertEquals("backup", e.getContext().get("key"));

        TsfmtException rules = assertThrows(TsfmtException.class,
                () -> FormatterConfig.fromJson(mapper.readTree("{\"rules\": {\"imports\": 1}}"), "tsfmt.json"));
        assertEquals("imports", rules.getContext().get("key"));
    }

    @Test
    void invalidJsonIsRejected() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{ \"indent\": ");
        TsfmtException e = assertThrows(TsfmtException.class, () -> FormatterConfig.load(file));
        assertEquals(TsfmtErrorCode.CONFIG_INVALID, e.getCode());
    }
}
