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

import ru.nts.tools.tsfmt.identity.IdentifiedNode;
import ru.nts.tools.tsfmt.identity.IdentityWalker;
import ru.nts.tools.tsfmt.identity.NodeIdentity;
import ru.nts.tools.tsfmt.syntax.Comment;
import ru.nts.tools.tsfmt.syntax.CommentStore;
import ru.nts.tools.tsfmt.syntax.LineIndex;
import ru.nts.tools.tsfmt.syntax.SyntaxNode;
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Связывает комментарии исходного дерева с идентичностями узлов-владельцев.
 *
 * <p>Шаги:
 * <ol>
 *   <li>для каждого идентифицированного узла забираются комментарии, привязанные хранилищем
 *       к его началу (ведущие) и к его концу (завершающие); роль задаёт точка привязки;</li>
 *   <li>комментарии, классифицированные как STANDALONE, уходят в отдельный список с группой
 *       соседей и слотом;</li>
 *   <li>проход переназначения: завершающий комментарий узла A, отделённый от A переводом
 *       строки и стоящий вплотную к следующему соседу B, становится ведущим комментарием B;</li>
 *   <li>не забранные комментарии верхнего уровня в конце файла и заголовок файла становятся
 *       отдельно стоящими.</li>
 * </ol>
 * INLINE-комментарии и всё, что не удалось привязать, не извлекаются и остаются в скелете как есть.
 * Компонент никогда не бросает исключений.
 */
public final class CommentExtractor {

    private final SyntaxTree tree;
    private final CommentStore store;
    private final LineIndex lines;
    private final Map<Comment, Classification> classes;
    private final Set<Comment> consumed = new HashSet<>();
    private final List<StandaloneComment> standalone = new ArrayList<>();

    private CommentExtractor(SyntaxTree tree, CommentStore store, Map<Comment, Classification> classes) {
        this.tree = tree;
        this.store = store;
        this.lines = tree.lines();
        this.classes = classes;
    }

    /**
     * Извлекает комментарии, классифицируя их заново.
     */
    public static ExtractionResult extract(SyntaxTree tree, CommentStore store) {
        CommentClassifier classifier = new CommentClassifier(tree.source(), tree.lines());
        return extract(tree, store, classifier.classifyAll(store.all()));
    }

    /**
     * Извлекает комментарии по готовой классификации.
     */
    public static ExtractionResult extract(SyntaxTree tree, CommentStore store,
                                           Map<Comment, Classification> classes) {
        return new CommentExtractor(tree, store, classes).run();
    }

    private ExtractionResult run() {
        List<IdentifiedNode> nodes = IdentityWalker.walk(tree);
        List<List<Comment>> leading = new ArrayList<>();
        List<List<Comment>> trailing = new ArrayList<>();

        markFileHeader();

        Map<String, Integer> slots = new HashMap<>();
        for (IdentifiedNode node : nodes) {
            int slot = slots.merge(node.group(), 1, Integer::sum) - 1;
            List<Comment> lead = new ArrayList<>();
            List<Comment> trail = new ArrayList<>();

            for (Comment comment : store.leading(node.start())) {
                if (consumed.contains(comment)) continue;
                Classification cls = classification(comment);
                if (cls == Classification.STANDALONE) {
                    divert(comment, node, slot);
                } else if (cls != Classification.INLINE) {
                    lead.add(comment);
                    consumed.add(comment);
                }
            }
            for (Comment comment : trailingAt(node)) {
                if (consumed.contains(comment)) continue;
                Classification cls = classification(comment);
                if (cls == Classification.STANDALONE) {
                    divert(comment, node, slot + 1);
                } else if (cls != Classification.INLINE) {
                    trail.add(comment);
                    consumed.add(comment);
                }
            }
            leading.add(lead);
            trailing.add(trail);
        }

        reassignTrailing(nodes, leading, trailing);
        collectTopLevelLeftovers(nodes);

        Map<NodeIdentity, List<ExtractedComment>> byIdentity = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            NodeIdentity identity = nodes.get(i).identity();
            if (leading.get(i).isEmpty() && trailing.get(i).isEmpty()) continue;
            List<ExtractedComment> list = byIdentity.computeIfAbsent(identity, k -> new ArrayList<>());
            append(list, identity, CommentRole.LEADING, leading.get(i));
            append(list, identity, CommentRole.TRAILING, trailing.get(i));
        }
        return new ExtractionResult(byIdentity, List.copyOf(standalone));
    }

    private List<Comment> trailingAt(IdentifiedNode node) {
        List<Comment> result = new ArrayList<>(store.trailing(node.node().end()));
        if (node.effectiveEnd() != node.node().end()) {
            result.addAll(store.trailing(node.effectiveEnd()));
        }
        return result;
    }

    private void append(List<ExtractedComment> list, NodeIdentity identity, CommentRole role, List<Comment> comments) {
        // При коллизии идентичностей порядковые номера продолжаются
        int ordinal = (int) list.stream().filter(e -> e.role() == role).count();
        for (Comment comment : comments) {
            list.add(new ExtractedComment(identity, role, comment, ordinal++, indentOf(comment)));
        }
    }

    /**
     * Завершающий комментарий, оказавшийся на следующей строке после узла A и стоящий вплотную
     * к следующему соседу B той же группы, переходит в ведущие комментарии B.
     */
    private void reassignTrailing(List<IdentifiedNode> nodes, List<List<Comment>> leading,
                                  List<List<Comment>> trailing) {
        Map<String, Integer> lastInGroup = new HashMap<>();
        int[] nextInGroup = new int[nodes.size()];
        for (int i = nodes.size() - 1; i >= 0; i--) {
            String group = nodes.get(i).group();
            nextInGroup[i] = lastInGroup.getOrDefault(group, -1);
            lastInGroup.put(group, i);
        }

        for (int i = 0; i < nodes.size(); i++) {
            int next = nextInGroup[i];
            if (next < 0 || trailing.get(i).isEmpty()) continue;
            IdentifiedNode a = nodes.get(i);
            IdentifiedNode b = nodes.get(next);

            List<Comment> moved = new ArrayList<>();
            for (Comment comment : trailing.get(i)) {
                boolean detached = lines.hasLineBreak(a.effectiveEnd(), comment.start());
                boolean adjacentToNext = comment.end() <= b.start()
                        && !lines.hasBlankLineBetween(comment.end(), b.start());
                if (detached && adjacentToNext) {
                    moved.add(comment);
                }
            }
            if (moved.isEmpty()) continue;
            trailing.get(i).removeAll(moved);
            List<Comment> target = leading.get(next);
            target.addAll(moved);
            target.sort(Comparator.comparingInt(Comment::start));
        }
    }

    /**
     * Не забранные комментарии верхнего уровня после последнего элемента программы.
     */
    private void collectTopLevelLeftovers(List<IdentifiedNode> nodes) {
        int eof = tree.source().length();
        int topLevelCount = (int) nodes.stream().filter(n -> n.depth() == 0).count();
        for (Comment comment : store.leading(eof)) {
            if (consumed.contains(comment)) continue;
            Classification cls = classification(comment);
            if (cls == Classification.LEADING || cls == Classification.STANDALONE) {
                addStandalone(comment, 0, IdentityWalker.PROGRAM_GROUP, topLevelCount);
            }
        }
    }

    /**
     * Заголовок файла: непрерывная серия комментариев с первой строки, после которой идёт
     * пустая строка. Он не должен уезжать вместе с первым объявлением.
     */
    private void markFileHeader() {
        List<Comment> header = new ArrayList<>();
        int expectedLine = 0;
        for (SyntaxNode child : tree.root().originalChildren()) {
            if (!child.isComment()) break;
            if (lines.lineOf(child.start()) != expectedLine) break;
            Comment comment = commentAt(child.start());
            if (comment == null) break;
            Classification cls = classification(comment);
            if (cls != Classification.LEADING && cls != Classification.STANDALONE) break;
            header.add(comment);
            expectedLine = lines.lineOf(comment.end()) + 1;
        }
        if (header.size() < 2 || !lines.isBlank(expectedLine)) return;
        for (Comment comment : header) {
            addStandalone(comment, 0, IdentityWalker.PROGRAM_GROUP, 0);
        }
    }

    private Comment commentAt(int start) {
        for (Comment comment : tree.comments()) {
            if (comment.start() == start) return comment;
        }
        return null;
    }

    private void divert(Comment comment, IdentifiedNode node, int slot) {
        addStandalone(comment, node.depth(), node.group(), slot);
    }

    private void addStandalone(Comment comment, int depth, String group, int slot) {
        consumed.add(comment);
        standalone.add(new StandaloneComment(comment, lines.lineOf(comment.start()), depth, group, slot,
                indentOf(comment)));
    }

    private Classification classification(Comment comment) {
        Classification cls = classes.get(comment);
        return cls != null ? cls : Classification.INLINE;
    }

    private String indentOf(Comment comment) {
        return lines.indentation(lines.lineOf(comment.start()));
    }
}
