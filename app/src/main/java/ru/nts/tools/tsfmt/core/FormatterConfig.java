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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Настройки форматтера из файла {@code tsfmt.json}.
 * Неизвестные ключи игнорируются, отсутствующие берутся из {@link #defaults()}.
 *
 * @param indent     отступ одного уровня вложенности (используется при раскладке тела класса)
 * @param backup     создавать ли {@code <file>.bak} перед перезаписью
 * @param exclude    имена директорий, которые пропускаются при обходе
 * @param extensions расширения файлов, подлежащих форматированию
 * @param rules      включенные правила реорганизации
 */
public record FormatterConfig(String indent, boolean backup, List<String> exclude,
                              List<String> extensions, Rules rules) {

    public static final String FILE_NAME = "tsfmt.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    /**
     * Набор переключателей правил реорганизации.
     */
    public record Rules(boolean imports, boolean declarations, boolean classMembers, boolean objectKeys,
                        boolean jsxAttributes, boolean unionTypes, boolean enums, boolean parameterPatterns) {

        public static Rules all() {
            return new Rules(true, true, true, true, true, true, true, true);
        }
    }

    public static FormatterConfig defaults() {
        return new FormatterConfig("  ", true, List.of("node_modules"),
                List.of("ts", "tsx", "mts", "cts"), Rules.all());
    }

    /**
     * Загружает конфигурацию из файла. Отсутствующий файл означает настройки по умолчанию.
     *
     * @param path путь к tsfmt.json
     * @throws TsfmtException CONFIG_INVALID при синтаксической ошибке JSON или неверном типе значения
     */
    public static FormatterConfig load(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            return defaults();
        }
        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(path));
        } catch (JsonProcessingException e) {
            throw new TsfmtException(TsfmtErrorCode.CONFIG_INVALID,
                    Map.of("path", path.toString(), "key", "<root>", "expected", "valid JSON"), e);
        }
        return fromJson(root, path.toString());
    }

    /**
     * Строит конфигурацию из уже разобранного JSON.
     *
     * @param root   корневой узел (null или не-объект означает пустую конфигурацию)
     * @param origin имя источника для сообщений об ошибках
     */
    public static FormatterConfig fromJson(JsonNode root, String origin) {
        FormatterConfig defaults = defaults();
        if (root == null || root.isNull() || root.isMissingNode()) {
            return defaults;
        }
        if (!root.isObject()) {
            throw invalid(origin, "<root>", "an object");
        }

        String indent = readString(root, "indent", defaults.indent(), origin);
        boolean backup = readBoolean(root, "backup", defaults.backup(), origin);
        List<String> exclude = readStringList(root, "exclude", defaults.exclude(), origin);
        List<String> extensions = readStringList(root, "extensions", defaults.extensions(), origin);

        Rules rules = defaults.rules();
        JsonNode rulesNode = root.path("rules");
        if (!rulesNode.isMissingNode()) {
            if (!rulesNode.isObject()) {
                throw invalid(origin, "rules", "an object");
            }
            rules = new Rules(
                    readBoolean(rulesNode, "imports", true, origin),
                    readBoolean(rulesNode, "declarations", true, origin),
                    readBoolean(rulesNode, "classMembers", true, origin),
                    readBoolean(rulesNode, "objectKeys", true, origin),
                    readBoolean(rulesNode, "jsxAttributes", true, origin),
                    readBoolean(rulesNode, "unionTypes", true, origin),
                    readBoolean(rulesNode, "enums", true, origin),
                    readBoolean(rulesNode, "parameterPatterns", true, origin));
        }
        return new FormatterConfig(indent, backup, exclude, extensions, rules);
    }

    private static String readString(JsonNode node, String key, String fallback, String origin) {
        JsonNode value = node.path(key);
        if (value.isMissingNode() || value.isNull()) return fallback;
        if (!value.isTextual()) throw invalid(origin, key, "a string");
        return value.asText();
    }

    private static boolean readBoolean(JsonNode node, String key, boolean fallback, String origin) {
        JsonNode value = node.path(key);
        if (value.isMissingNode() || value.isNull()) return fallback;
        if (!value.isBoolean()) throw invalid(origin, key, "true or false");
        return value.asBoolean();
    }

    private static List<String> readStringList(JsonNode node, String key, List<String> fallback, String origin) {
        JsonNode value = node.path(key);
        if (value.isMissingNode() || value.isNull()) return fallback;
        if (!value.isArray()) throw invalid(origin, key, "an array of strings");
        List<String> result = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) throw invalid(origin, key, "an array of strings");
            result.add(item.asText());
        }
        return List.copyOf(result);
    }

    private static TsfmtException invalid(String origin, String key, String expected) {
        return new TsfmtException(TsfmtErrorCode.CONFIG_INVALID,
                Map.of("path", origin, "key", key, "expected", expected));
    }
}
