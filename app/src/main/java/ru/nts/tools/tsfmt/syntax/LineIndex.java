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
package ru.nts.tools.tsfmt.syntax;

import java.util.Arrays;

/**
 * Индекс начал строк текста (0-based строки и колонки).
 * Строится одним линейным проходом, запросы - бинарным поиском.
 */
public final class LineIndex {

    private final String text;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.text = text;
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        int[] starts = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts[line++] = i + 1;
            }
        }
        this.lineStarts = starts;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Номер строки, содержащей смещение.
     */
    public int lineOf(int offset) {
        int idx = Arrays.binarySearch(lineStarts, offset);
        return idx >= 0 ? idx : -idx - 2;
    }

    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset)];
    }

    public int lineStart(int line) {
        return lineStarts[line];
    }

    /**
     * Смещение конца строки (позиция символа '\n' или длина текста).
     */
    public int lineEnd(int line) {
        return line + 1 < lineStarts.length ? lineStarts[line + 1] - 1 : text.length();
    }

    public String lineText(int line) {
        return text.substring(lineStart(line), lineEnd(line));
    }

    /**
     * Пустая или состоящая только из пробелов строка. Строки за границами файла считаются пустыми.
     */
    public boolean isBlank(int line) {
        if (line < 0 || line >= lineStarts.length) return true;
        return lineText(line).isBlank();
    }

    /**
     * Ведущие пробелы строки.
     */
    public String indentation(int line) {
        String lineText = lineText(line);
        int i = 0;
        while (i < lineText.length() && (lineText.charAt(i) == ' ' || lineText.charAt(i) == '\t')) i++;
        return lineText.substring(0, i);
    }

    /**
     * Есть ли перевод строки в диапазоне [from, to).
     */
    public boolean hasLineBreak(int from, int to) {
        int limit = Math.min(to, text.length());
        for (int i = Math.max(from, 0); i < limit; i++) {
            if (text.charAt(i) == '\n') return true;
        }
        return false;
    }

    /**
     * Есть ли пустая строка строго между строками смещений from и to.
     */
    public boolean hasBlankLineBetween(int from, int to) {
        int first = lineOf(from);
        int last = lineOf(to);
        for (int line = first + 1; line < last; line++) {
            if (isBlank(line)) return true;
        }
        return false;
    }
}
