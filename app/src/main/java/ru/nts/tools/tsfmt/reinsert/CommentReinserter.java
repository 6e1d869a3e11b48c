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

import ru.nts.tools.tsfmt.comments.CommentRole;
import ru.nts.tools.tsfmt.comments.ExtractedComment;
import ru.nts.tools.tsfmt.comments.ExtractionResult;
import ru.nts.tools.tsfmt.comments.StandaloneComment;
import ru.nts.tools.tsfmt.identity.NodeIdentity;
import ru.nts.tools.tsfmt.position.NodePosition;
import ru.nts.tools.tsfmt.position.PositionIndex;
import ru.nts.tools.tsfmt.syntax.Comment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Возвращает извлечённые комментарии в скелет.
 *
 * <p>Алгоритм:
 * <ol>
 *   <li>у каждой идентичности с комментариями должно быть положение в скелете, иначе
 *       {@link MissingPositionException} со списком всех недостающих;</li>
 *   <li>ведущий комментарий встаёт отдельной строкой прямо над узлом, с отступом узла; если строка
 *       над узлом не пуста, а строка над ней пуста, вставка поднимается ещё на одну строку;</li>
 *   <li>завершающий дописывается через пробел за эффективным концом узла;</li>
 *   <li>отдельно стоящие комментарии выводятся блоками перед узлом, занявшим их слот в группе,
 *       с пустыми строками вокруг;</li>
 *   <li>все вставки применяются снизу вверх ({@link InsertionPoint#APPLY_ORDER}).</li>
 * </ol>
 */
public final class CommentReinserter {

    private CommentReinserter() {}

    /**
     * @param extraction результат извлечения из исходного дерева
     * @param skeleton   текст скелета
     * @param positions  положения узлов в скелете
     * @return текст с комментариями
     * @throws MissingPositionException если владелец хотя бы одного комментария не найден
     */
    public static String reinsert(ExtractionResult extraction, String skeleton, PositionIndex positions) {
        List<NodeIdentity> missing = new ArrayList<>();
        for (NodeIdentity identity : extraction.byIdentity().keySet()) {
            if (!positions.contains(identity)) {
                missing.add(identity);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingPositionException(missing);
        }

        List<String> lines = new ArrayList<>(Arrays.asList(skeleton.split("\n", -1)));
        List<InsertionPoint> points = new ArrayList<>();
        for (List<ExtractedComment> comments : extraction.byIdentity().values()) {
            for (ExtractedComment extracted : comments) {
                NodePosition position = positions.positions().get(extracted.identity());
                points.add(extracted.role() == CommentRole.LEADING
                        ? leadingPoint(extracted, position, lines)
                        : trailingPoint(extracted, position));
            }
        }
        points.addAll(standalonePoints(extraction.standalone(), positions, lines.size()));

        points.sort(InsertionPoint.APPLY_ORDER);
        for (InsertionPoint point : points) {
            apply(point, lines);
        }
        return String.join("\n", lines);
    }

    private static InsertionPoint leadingPoint(ExtractedComment extracted, NodePosition position, List<String> lines) {
        int target = position.startLine() - 1;
        // Строка над узлом не пуста, а над ней пустая: вставка поднимается ещё на строку
        if (target >= 1 && target < lines.size() && !lines.get(target).isBlank()
                && lines.get(target - 1).isBlank()) {
            target--;
        }
        return new InsertionPoint(InsertionPoint.Kind.LEADING, target, 0, extracted.comment().text(),
                position.indentation(), extracted.ordinal(), extracted.originalIndent());
    }

    private static InsertionPoint trailingPoint(ExtractedComment extracted, NodePosition position) {
        return new InsertionPoint(InsertionPoint.Kind.TRAILING, position.endLine(), position.endColumn(),
                extracted.comment().text(), position.indentation(), extracted.ordinal(), extracted.originalIndent());
    }

    /**
     * Отдельно стоящие комментарии одной группы и одного слота выводятся одним блоком; соседние
     * в исходнике строки остаются соседними, остальные разделяются пустой строкой.
     */
    private static List<InsertionPoint> standalonePoints(List<StandaloneComment> standalone, PositionIndex positions,
                                                         int lineCount) {
        Map<String, List<StandaloneComment>> blocks = new LinkedHashMap<>();
        standalone.stream()
                .sorted(Comparator.comparingInt(s -> s.comment().start()))
                .forEach(s -> blocks.computeIfAbsent(s.group() + "@" + s.slot(), k -> new ArrayList<>()).add(s));

        List<InsertionPoint> points = new ArrayList<>();
        int ordinal = 0;
        for (List<StandaloneComment> block : blocks.values()) {
            StandaloneComment first = block.get(0);
            StringBuilder text = new StringBuilder(first.comment().text());
            int previousEnd = endLine(first);
            for (StandaloneComment next : block.subList(1, block.size())) {
                text.append(next.originalLine() == previousEnd + 1 ? "\n" : "\n\n");
                text.append(next.originalIndent()).append(next.comment().text());
                previousEnd = endLine(next);
            }

            List<NodePosition> group = positions.group(first.group());
            int line;
            String indentation;
            if (first.slot() < group.size()) {
                NodePosition anchor = group.get(first.slot());
                line = anchor.startLine() - 1;
                indentation = anchor.indentation();
            } else if (!group.isEmpty()) {
                NodePosition last = group.get(group.size() - 1);
                line = last.endLine();
                indentation = last.indentation();
            } else {
                // Группа исчезла из скелета: исходная строка как приближение
                line = Math.min(first.originalLine(), lineCount) - 1;
                indentation = first.originalIndent();
            }
            points.add(new InsertionPoint(InsertionPoint.Kind.STANDALONE, line, 0, text.toString(), indentation,
                    ordinal++, first.originalIndent()));
        }
        return points;
    }

    private static int endLine(StandaloneComment standalone) {
        Comment comment = standalone.comment();
        return standalone.originalLine() + (int) comment.text().chars().filter(c -> c == '\n').count();
    }

    private static void apply(InsertionPoint point, List<String> lines) {
        if (point.kind() != InsertionPoint.Kind.TRAILING) {
            lines.add(point.line() + 1, point.render());
            return;
        }
        String line = lines.get(point.line());
        int column = Math.min(point.column(), line.length());
        String rest = line.substring(column);
        if (point.comment().startsWith("//") && !rest.isBlank()) {
            // Строчный комментарий не может стоять перед кодом: уходит в конец строки
            lines.set(point.line(), line.stripTrailing() + point.render());
        } else {
            lines.set(point.line(), line.substring(0, column) + point.render() + rest);
        }
    }
}
