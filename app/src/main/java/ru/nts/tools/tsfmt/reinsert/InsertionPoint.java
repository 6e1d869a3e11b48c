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
package ru.nts.tools.tsfmt.reinsert;

import java.util.Comparator;

/**
 * Точка вставки комментария в строки скелета.
 *
 * <p>Для {@link Kind#LEADING} и {@link Kind#STANDALONE} {@code line} - строка, после которой
 * вставляются новые строки ({@code -1} означает начало текста); для {@link Kind#TRAILING} - строка,
 * к которой комментарий дописывается с колонки {@code column}.
 *
 * @param kind           вид вставки
 * @param line           целевая строка скелета
 * @param column         колонка (только для завершающих)
 * @param comment        текст комментария или блока отдельно стоящих комментариев
 * @param indentation    отступ, с которым комментарий выводится
 * @param ordinal        порядковый номер среди вставок одного владельца
 * @param originalIndent отступ комментария в исходнике, снимается с продолжений многострочного текста
 */
public record InsertionPoint(Kind kind, int line, int column, String comment, String indentation, int ordinal,
                             String originalIndent) {

    public enum Kind { LEADING, TRAILING, STANDALONE }

    /**
     * Порядок применения: снизу вверх, чтобы вставки не сдвигали ещё не обработанные строки.
     * На одной строке ведущие раньше завершающих, отдельно стоящие последними (и оказываются выше),
     * внутри вида по убыванию порядкового номера.
     */
    public static final Comparator<InsertionPoint> APPLY_ORDER = Comparator
            .comparingInt(InsertionPoint::line).reversed()
            .thenComparing(InsertionPoint::kind)
            .thenComparing(Comparator.comparingInt(InsertionPoint::ordinal).reversed());

    /**
     * Текст вставки с учётом отступов.
     */
    public String render() {
        return switch (kind) {
            case LEADING -> reindent(comment, originalIndent, indentation, true);
            case TRAILING -> " " + reindent(comment, originalIndent, indentation, false);
            case STANDALONE -> "\n" + reindent(comment, originalIndent, indentation, true) + "\n";
        };
    }

    /**
     * Переносит многострочный текст на новый отступ: с каждой строки продолжения снимается
     * исходный отступ и добавляется новый.
     */
    static String reindent(String text, String originalIndent, String indentation, boolean indentFirst) {
        String[] parts = text.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        if (indentFirst) sb.append(indentation);
        sb.append(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            String part = parts[i];
            sb.append('\n');
            if (part.isBlank()) continue;
            if (part.startsWith(originalIndent)) {
                part = part.substring(originalIndent.length());
            }
            sb.append(indentation).append(part);
        }
        return sb.toString();
    }
}
