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

/**
 * Комментарий исходного текста. Неизменяем: этапы конвейера только копируют и переразмечают его.
 *
 * @param kind  строчный ({@code //}) или блочный ({@code /* *&#47;})
 * @param text  полный текст комментария вместе с маркерами
 * @param start смещение начала в исходнике
 * @param end   смещение конца (исключительно)
 */
public record Comment(Kind kind, String text, int start, int end) {

    public enum Kind { LINE, BLOCK }

    public static Comment of(String text, int start) {
        Kind kind = text.startsWith("//") ? Kind.LINE : Kind.BLOCK;
        return new Comment(kind, text, start, start + text.length());
    }

    public boolean isMultiline() {
        return text.indexOf('\n') >= 0;
    }
}
