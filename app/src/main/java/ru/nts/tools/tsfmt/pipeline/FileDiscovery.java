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
package ru.nts.tools.tsfmt.pipeline;

import ru.nts.tools.tsfmt.core.FormatterConfig;
import ru.nts.tools.tsfmt.core.treesitter.LanguageDetector;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Собирает файлы для форматирования из путей командной строки.
 *
 * <p>Файл, указанный явно, берётся как есть (даже если не существует: ошибка попадёт в отчёт
 * по этому файлу). Каталоги обходятся рекурсивно; пропускаются {@code node_modules}, скрытые
 * каталоги и каталоги из {@code exclude}, берутся файлы с расширениями из {@code extensions}.
 */
public final class FileDiscovery {

    private FileDiscovery() {}

    public static List<Path> discover(List<Path> roots, FormatterConfig config) throws IOException {
        Set<Path> files = new LinkedHashSet<>();
        for (Path root : roots) {
            Path normalized = root.toAbsolutePath().normalize();
            if (Files.isDirectory(normalized)) {
                walk(normalized, config, files);
            } else {
                files.add(normalized);
            }
        }
        return new ArrayList<>(files);
    }

    private static void walk(Path root, FormatterConfig config, Set<Path> files) throws IOException {
        List<Path> found = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isExcluded(dir, config)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && hasFormattableExtension(file, config)) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        found.sort(null);
        files.addAll(found);
    }

    static boolean isExcluded(Path dir, FormatterConfig config) {
        Path fileName = dir.getFileName();
        if (fileName == null) return false;
        String name = fileName.toString();
        return name.startsWith(".") || name.equals("node_modules") || config.exclude().contains(name);
    }

    static boolean hasFormattableExtension(Path file, FormatterConfig config) {
        return LanguageDetector.extensionOf(file)
                .filter(ext -> config.extensions().contains(ext))
                .flatMap(ext -> LanguageDetector.detect(file))
                .isPresent();
    }
}
