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
package ru.nts.tools.tsfmt.core.treesitter;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Определяет грамматику по расширению файла.
 * Поддерживаемые языки: typescript, tsx, javascript (включая JSX).
 */
public final class LanguageDetector {

    private LanguageDetector() {}

    /**
     * Отображение расширений файлов на идентификаторы языков.
     */
    private static final Map<String, String> EXTENSION_MAP = Map.ofEntries(
            // TypeScript
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "tsx"),
            Map.entry("mts", "typescript"),
            Map.entry("cts", "typescript"),

            // JavaScript
            Map.entry("js", "javascript"),
            Map.entry("mjs", "javascript"),
            Map.entry("cjs", "javascript"),
            Map.entry("jsx", "javascript")
    );

    /**
     * Список поддерживаемых языков.
     */
    private static final List<String> SUPPORTED_LANGUAGES = List.of("typescript", "tsx", "javascript");

    /**
     * Определяет язык по пути к файлу.
     *
     * @param path путь к файлу
     * @return идентификатор языка или empty если язык не поддерживается
     */
    public static Optional<String> detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        return extensionOf(path).map(EXTENSION_MAP::get);
    }

    /**
     * Возвращает расширение файла в нижнем регистре.
     *
     * @param path путь к файлу
     * @return расширение без точки или empty, если его нет
     */
    public static Optional<String> extensionOf(Path path) {
        String fileName = path.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');

        if (dotIndex <= 0 || dotIndex == fileName.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(fileName.substring(dotIndex + 1).toLowerCase());
    }

    /**
     * Проверяет, поддерживается ли указанный язык.
     *
     * @param langId идентификатор языка
     * @return true если язык поддерживается
     */
    public static boolean isSupported(String langId) {
        return langId != null && SUPPORTED_LANGUAGES.contains(langId.toLowerCase());
    }

    /**
     * Возвращает список всех поддерживаемых языков.
     *
     * @return неизменяемый список идентификаторов языков
     */
    public static List<String> getSupportedLanguages() {
        return SUPPORTED_LANGUAGES;
    }
}
