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

/**
 * Результат форматирования одного текста.
 *
 * @param original           исходный текст
 * @param formatted          отформатированный текст (без финального перевода строки)
 * @param attachedComments   число комментариев, перенесённых вместе с владельцами
 * @param standaloneComments число отдельно стоящих комментариев
 */
public record FormatResult(String original, String formatted, int attachedComments, int standaloneComments) {

    /**
     * Текст файла после форматирования: с одним переводом строки в конце (если он не пуст).
     */
    public String fileText() {
        return formatted.isEmpty() ? "" : formatted + "\n";
    }

    public boolean changed() {
        return !fileText().equals(original);
    }
}
