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
import ru.nts.tools.tsfmt.syntax.LineIndex;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Классифицирует комментарии только по исходному тексту и смещениям.
 *
 * <table>
 *   <tr><th>код до</th><th>код после</th><th>роль</th></tr>
 *   <tr><td>да</td><td>да</td><td>INLINE</td></tr>
 *   <tr><td>да</td><td>нет</td><td>TRAILING</td></tr>
 *   <tr><td>нет</td><td>да</td><td>INLINE</td></tr>
 *   <tr><td>нет</td><td>нет</td><td>STANDALONE, если пустые строки сверху и снизу, иначе LEADING</td></tr>
 * </table>
 */
public final class CommentClassifier {

    private final String source;
    private final LineIndex lines;

    public CommentClassifier(String source) {
        this(source, new LineIndex(source));
    }

    public CommentClassifier(String source, LineIndex lines) {
        this.source = source;
        this.lines = lines;
    }

    /**
     * Классифицирует все комментарии, сохраняя их порядок.
     */
    public Map<Comment, Classification> classifyAll(List<Comment> comments) {
        Map<Comment, Classification> result = new LinkedHashMap<>();
        for (Comment comment : comments) {
            result.put(comment, classify(comment));
        }
        return result;
    }

    public Classification classify(Comment comment) {
        int startLine = lines.lineOf(comment.start());
        int endLine = lines.lineOf(comment.end());

        String before = source.substring(lines.lineStart(startLine), comment.start());
        String after = source.substring(comment.end(), lines.lineEnd(endLine));

        boolean codeBefore = hasCodeBefore(before);
        boolean codeAfter = hasCodeAfter(after);

        if (codeBefore) {
            return codeAfter ? Classification.INLINE : Classification.TRAILING;
        }
        if (codeAfter) {
            return Classification.INLINE;
        }
        boolean isolated = lines.isBlank(startLine - 1) && lines.isBlank(endLine + 1);
        return isolated ? Classification.STANDALONE : Classification.LEADING;
    }

    /**
     * Код до комментария: буквы, цифры, {@code _ $} и закрывающие скобки или {@code ;}.
     * Открывающая скобка или запятая кодом не считаются.
     */
    static boolean hasCodeBefore(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '$'
                    || c == ')' || c == '}' || c == ']' || c == ';') {
                return true;
            }
        }
        return false;
    }

    /**
     * Код после комментария: всё, кроме пробелов и {@code ; ) ,}.
     */
    static boolean hasCodeAfter(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c) && c != ';' && c != ')' && c != ',') {
                return true;
            }
        }
        return false;
    }
}
