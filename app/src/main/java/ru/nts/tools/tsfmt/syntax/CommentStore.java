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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Хранилище комментариев, привязанных к позициям токенов.
 *
 * <p>Правило привязки: комментарий, начинающийся на той же строке, где закончился предыдущий
 * токен, считается завершающим (trailing) и привязан к концу этого токена. Остальные
 * комментарии ведущие (leading) и привязаны к началу следующего токена, либо к концу файла.
 *
 * <p>Привязка к смещениям делает хранилище непригодным после перестановки узлов: его
 * читают только до реорганизации.
 */
public final class CommentStore {

    private final Map<Integer, List<Comment>> leading = new HashMap<>();
    private final Map<Integer, List<Comment>> trailing = new HashMap<>();

    /**
     * Строит хранилище по разобранному дереву.
     */
    public static CommentStore build(SyntaxTree tree) {
        List<SyntaxNode> tokens = new ArrayList<>();
        collectTokens(tree.root(), tokens);
        tokens.sort(Comparator.comparingInt(SyntaxNode::start));

        CommentStore store = new CommentStore();
        LineIndex lines = tree.lines();
        int eof = tree.source().length();
        int cursor = 0;
        for (Comment comment : tree.comments()) {
            // cursor - первый токен, начинающийся после комментария
            while (cursor < tokens.size() && tokens.get(cursor).start() < comment.end()) {
                cursor++;
            }
            SyntaxNode prev = null;
            for (int i = cursor - 1; i >= 0; i--) {
                if (tokens.get(i).end() <= comment.start()) {
                    prev = tokens.get(i);
                    break;
                }
            }
            if (prev != null && lines.lineOf(prev.end()) == lines.lineOf(comment.start())) {
                store.addTrailing(prev.end(), comment);
            } else if (cursor < tokens.size()) {
                store.addLeading(tokens.get(cursor).start(), comment);
            } else {
                store.addLeading(eof, comment);
            }
        }
        return store;
    }

    private static void collectTokens(SyntaxNode node, List<SyntaxNode> tokens) {
        for (SyntaxNode child : node.originalChildren()) {
            if (child.isComment()) continue;
            if (child.isLeaf()) {
                tokens.add(child);
            } else {
                collectTokens(child, tokens);
            }
        }
    }

    public List<Comment> leading(int pos) {
        return List.copyOf(leading.getOrDefault(pos, List.of()));
    }

    public List<Comment> trailing(int pos) {
        return List.copyOf(trailing.getOrDefault(pos, List.of()));
    }

    public void addLeading(int pos, Comment comment) {
        leading.computeIfAbsent(pos, k -> new ArrayList<>()).add(comment);
    }

    public void addTrailing(int pos, Comment comment) {
        trailing.computeIfAbsent(pos, k -> new ArrayList<>()).add(comment);
    }

    /**
     * Все комментарии хранилища в порядке исходного текста.
     */
    public List<Comment> all() {
        List<Comment> result = new ArrayList<>();
        leading.values().forEach(result::addAll);
        trailing.values().forEach(result::addAll);
        result.sort(Comparator.comparingInt(Comment::start));
        return result;
    }
}
