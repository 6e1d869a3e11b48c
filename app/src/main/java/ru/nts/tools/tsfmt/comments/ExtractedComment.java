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

import ru.nts.tools.tsfmt.identity.NodeIdentity;
import ru.nts.tools.tsfmt.syntax.Comment;

/**
 * Комментарий, привязанный к идентичности узла.
 *
 * @param identity          идентичность узла-владельца
 * @param role              ведущий или завершающий
 * @param comment           сам комментарий
 * @param ordinal           порядковый номер среди комментариев той же роли у того же узла
 * @param originalIndent    отступ строки, на которой комментарий стоял в исходнике
 */
public record ExtractedComment(NodeIdentity identity, CommentRole role, Comment comment, int ordinal,
                               String originalIndent) {

    public ExtractedComment withOrdinal(int newOrdinal) {
        return new ExtractedComment(identity, role, comment, newOrdinal, originalIndent);
    }
}
