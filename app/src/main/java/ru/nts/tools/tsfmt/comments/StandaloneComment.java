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
package ru.nts.tools.tsfmt.comments;

import ru.nts.tools.tsfmt.syntax.Comment;

/**
 * Комментарий без владельца, отделённый пустыми строками. Не прикрепляется к узлу:
 * выводится на своём относительном месте в группе соседей.
 *
 * @param comment        сам комментарий
 * @param originalLine   строка в исходном тексте (0-based)
 * @param depth          глубина вложенности группы
 * @param group          группа соседей, в которой стоял комментарий
 * @param slot           число идентифицированных соседей перед комментарием
 * @param originalIndent отступ исходной строки
 */
public record StandaloneComment(Comment comment, int originalLine, int depth, String group, int slot,
                                String originalIndent) {
}
