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

import org.mozilla.universalchardet.UniversalDetector;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Утилиты для определения кодировки и чтения исходников перед форматированием.
 * Использует UniversalDetector (juniversalchardet) для автоматического определения Charset.
 * Переводы строк нормализуются в LF, исходный стиль запоминается для записи обратно.
 */
public class EncodingUtils {

    private static final Charset WINDOWS_1251 = Charset.forName("windows-1251");

    /**
     * Результат чтения исходного файла.
     *
     * @param content Содержимое файла с переводами строк LF и без BOM.
     * @param charset Кодировка, использованная для декодирования байтов.
     * @param crlf    true, если в файле преобладали переводы строк CRLF.
     * @param bom     true, если файл начинался с BOM.
     */
    public record TextFileContent(String content, Charset charset, boolean crlf, boolean bom) {

        /**
         * Восстанавливает исходный стиль файла (CRLF, BOM) для отформатированного текста.
         */
        public String restoreStyle(String formatted) {
            String result = crlf ? formatted.replace("\n", "\r\n") : formatted;
            return bom ? "\uFEFF" + result : result;
        }
    }

    /**
     * Считывает файл с принудительно указанной кодировкой.
     *
     * @param path    Путь к целевому файлу.
     * @param charset Кодировка для декодирования.
     * @return Объект {@link TextFileContent}.
     * @throws IOException Если файл недоступен.
     */
    public static TextFileContent readTextFile(Path path, Charset charset) throws IOException {
        byte[] allBytes = FileUtils.safeReadAllBytes(path);
        int bomLength = bomLength(allBytes, charset);
        return decode(allBytes, bomLength, charset);
    }

    /**
     * Считывает файл за один проход с автоопределением кодировки.
     *
     * @param path Путь к целевому файлу.
     * @return Объект {@link TextFileContent} с текстом файла.
     * @throws IOException Если файл недоступен.
     * @throws TsfmtException FILE_IS_BINARY, если файл содержит NULL байты.
     */
    public static TextFileContent readTextFile(Path path) throws IOException {
        byte[] allBytes = FileUtils.safeReadAllBytes(path);

        UniversalDetector detector = new UniversalDetector(null);
        detector.handleData(allBytes, 0, allBytes.length);
        detector.dataEnd();

        String encoding = detector.getDetectedCharset();
        Charset charset = StandardCharsets.UTF_8;

        if (encoding != null && Charset.isSupported(encoding)) {
            charset = Charset.forName(encoding);
        }

        // Детектор часто молчит на коротких файлах в windows-1251: проверяем UTF-8 явно
        if (encoding == null || charset.equals(StandardCharsets.UTF_8)) {
            if (!isValidUtf8(allBytes)) {
                charset = WINDOWS_1251;
            }
        }

        int bomLength = bomLength(allBytes, charset);

        // Проверка на бинарный файл (наличие NULL-байтов), кроме многобайтовых кодировок UTF
        if (!charset.name().startsWith("UTF-16") && !charset.name().startsWith("UTF-32")) {
            int checkLimit = Math.min(allBytes.length, 8192);
            for (int i = bomLength; i < checkLimit; i++) {
                if (allBytes[i] == 0) {
                    throw new TsfmtException(TsfmtErrorCode.FILE_IS_BINARY, Map.of("path", path.toString()));
                }
            }
        }

        return decode(allBytes, bomLength, charset);
    }

    private static TextFileContent decode(byte[] allBytes, int bomLength, Charset charset) {
        String raw = new String(allBytes, bomLength, allBytes.length - bomLength, charset);
        int crlfCount = countOccurrences(raw, "\r\n");
        int lfCount = countOccurrences(raw, "\n");
        boolean crlf = crlfCount > 0 && crlfCount * 2 >= lfCount;
        String normalized = raw.replace("\r\n", "\n").replace('\r', '\n');
        return new TextFileContent(normalized, charset, crlf, bomLength > 0);
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int idx = text.indexOf(needle);
        while (idx >= 0) {
            count++;
            idx = text.indexOf(needle, idx + needle.length());
        }
        return count;
    }

    /**
     * Возвращает длину BOM в начале массива для указанной кодировки (0, если BOM нет).
     */
    static int bomLength(byte[] allBytes, Charset charset) {
        if (allBytes.length < 2) return 0;

        String name = charset.name().toUpperCase();
        if (!name.startsWith("UTF-")) return 0; // BOM только для UTF

        int b0 = allBytes[0] & 0xFF;
        int b1 = allBytes[1] & 0xFF;
        switch (name) {
            case "UTF-8":
                if (allBytes.length >= 3 && b0 == 0xEF && b1 == 0xBB && (allBytes[2] & 0xFF) == 0xBF) return 3;
                return 0;
            case "UTF-16BE":
                return b0 == 0xFE && b1 == 0xFF ? 2 : 0;
            case "UTF-16LE":
                return b0 == 0xFF && b1 == 0xFE ? 2 : 0;
            case "UTF-16":
                return (b0 == 0xFE && b1 == 0xFF) || (b0 == 0xFF && b1 == 0xFE) ? 2 : 0;
            default:
                return 0;
        }
    }

    /**
     * Проверяет, является ли массив байтов валидной последовательностью UTF-8.
     */
    private static boolean isValidUtf8(byte[] bytes) {
        int i = 0;
        while (i < bytes.length) {
            int b = bytes[i++] & 0xFF;
            if (b <= 0x7F) continue; // ASCII

            int count;
            if (b >= 0xC2 && b <= 0xDF) count = 1;
            else if (b >= 0xE0 && b <= 0xEF) count = 2;
            else if (b >= 0xF0 && b <= 0xF4) count = 3;
            else return false;

            if (i + count > bytes.length) return false;

            for (int j = 0; j < count; j++) {
                int next = bytes[i++] & 0xFF;
                if (next < 0x80 || next > 0xBF) return false;
            }
        }
        return true;
    }
}
