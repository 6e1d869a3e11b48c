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

import org.treesitter.TSNode;
import org.treesitter.TSTree;
import ru.nts.tools.tsfmt.core.treesitter.SyntaxChecker;
import ru.nts.tools.tsfmt.core.treesitter.TreeSitterManager;

import java.util.ArrayList;
import java.util.List;

/**
 * Разбирает исходник через tree-sitter и копирует результат в {@link SyntaxTree}.
 *
 * <p>КРИТИЧНО: tree-sitter возвращает байтовые смещения UTF-8, а не символьные!
 * Перевод в индексы Java-строки делается один раз здесь, дальше весь конвейер
 * работает только с символьными смещениями.
 */
public final class SyntaxParser {

    private SyntaxParser() {}

    /**
     * Разбирает исходный текст.
     *
     * @param source исходный текст (переводы строк LF)
     * @param langId идентификатор языка (typescript, tsx, javascript)
     * @return дерево с комментариями и результатом проверки синтаксиса
     */
    public static SyntaxTree parse(String source, String langId) {
        TSTree tsTree = TreeSitterManager.getInstance().parse(source, langId);
        int[] byteToChar = byteToCharMap(source);

        TSNode tsRoot = tsTree.getRootNode();
        SyntaxNode root = new SyntaxNode(tsRoot.getType(), true, 0, source.length());
        List<Comment> comments = new ArrayList<>();
        copyChildren(tsRoot, root, byteToChar, source, comments);

        return new SyntaxTree(source, langId, root, List.copyOf(comments), new LineIndex(source),
                SyntaxChecker.check(tsTree, source));
    }

    private static void copyChildren(TSNode tsNode, SyntaxNode target, int[] byteToChar,
                                     String source, List<Comment> comments) {
        int childCount = tsNode.getChildCount();
        for (int i = 0; i < childCount; i++) {
            TSNode tsChild = tsNode.getChild(i);
            if (tsChild == null || tsChild.isNull()) continue;

            int start = toChar(byteToChar, tsChild.getStartByte());
            int end = toChar(byteToChar, tsChild.getEndByte());
            // Пустые узлы (MISSING, автоматические ';') не несут текста
            if (start >= end) continue;

            SyntaxNode child = new SyntaxNode(tsChild.getType(), tsNode.getFieldNameForChild(i),
                    tsChild.isNamed(), start, end);
            target.addChild(child);
            if (child.isComment()) {
                comments.add(Comment.of(source.substring(start, end), start));
            } else {
                copyChildren(tsChild, child, byteToChar, source, comments);
            }
        }
        if (target.is("class_body")) {
            groupDecorators(target);
        }
    }

    /**
     * В грамматике TypeScript декораторы метода лежат в теле класса соседями метода, а не его
     * детьми. Декораторы (и комментарии между ними) собираются вместе со следующим членом в
     * один узел члена, который начинается с первого декоратора.
     */
    static void groupDecorators(SyntaxNode body) {
        List<SyntaxNode> grouped = new ArrayList<>(body.childCount());
        List<SyntaxNode> pending = new ArrayList<>();
        boolean changed = false;
        for (SyntaxNode child : body.originalChildren()) {
            if (child.is("decorator") || (!pending.isEmpty() && child.isComment())) {
                pending.add(child);
                continue;
            }
            if (!pending.isEmpty() && child.isNamed()) {
                SyntaxNode member = new SyntaxNode(child.type(), child.field(), true,
                        pending.get(0).start(), child.end());
                pending.forEach(member::addChild);
                child.originalChildren().forEach(member::addChild);
                grouped.add(member);
                pending.clear();
                changed = true;
                continue;
            }
            grouped.addAll(pending);
            pending.clear();
            grouped.add(child);
        }
        grouped.addAll(pending);
        if (changed) {
            body.replaceChildren(grouped);
        }
    }

    private static int toChar(int[] byteToChar, int byteOffset) {
        if (byteOffset < 0) return 0;
        return byteToChar[Math.min(byteOffset, byteToChar.length - 1)];
    }

    /**
     * Строит таблицу "байтовое смещение UTF-8 -> индекс символа".
     * Для байтов внутри многобайтовой последовательности хранится индекс её символа.
     */
    static int[] byteToCharMap(String source) {
        int[] map = new int[utf8Length(source) + 1];
        int bytePos = 0;
        int i = 0;
        while (i < source.length()) {
            int cp = source.codePointAt(i);
            int charCount = Character.charCount(cp);
            int byteCount = cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
            for (int b = 0; b < byteCount; b++) {
                map[bytePos + b] = i;
            }
            bytePos += byteCount;
            i += charCount;
        }
        map[bytePos] = source.length();
        return map;
    }

    private static int utf8Length(String source) {
        int length = 0;
        int i = 0;
        while (i < source.length()) {
            int cp = source.codePointAt(i);
            length += cp < 0x80 ? 1 : cp < 0x800 ? 2 : cp < 0x10000 ? 3 : 4;
            i += Character.charCount(cp);
        }
        return length;
    }
}
