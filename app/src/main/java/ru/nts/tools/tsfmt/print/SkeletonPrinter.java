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
package ru.nts.tools.tsfmt.print;

import ru.nts.tools.tsfmt.organize.ImportCategory;
import ru.nts.tools.tsfmt.organize.MemberCategory;
import ru.nts.tools.tsfmt.organize.TypeScriptReorganizer;
import ru.nts.tools.tsfmt.syntax.Comment;
import ru.nts.tools.tsfmt.syntax.LineIndex;
import ru.nts.tools.tsfmt.syntax.SyntaxKinds;
import ru.nts.tools.tsfmt.syntax.SyntaxNode;
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Печатает переупорядоченное дерево обратно в текст (скелет).
 *
 * <p>Каждый дочерний узел печатается в "слоте" исходного ребёнка с тем же индексом: текст
 * между детьми (пробелы, разделители) берётся из исходных позиций, поэтому двигаются только
 * переставленные элементы. Комментарии из {@code removed} вырезаются (вместе со строкой, если
 * комментарий стоял на ней один); остальные комментарии печатаются как есть.
 *
 * <p>Тело программы и помеченные тела классов печатаются блочно: один элемент на строку,
 * пустая строка между элементами разных видов.
 */
public final class SkeletonPrinter {

    private final String source;
    private final LineIndex lines;
    private final String indentUnit;
    private final List<int[]> drops;
    private final Set<Integer> removedStarts = new HashSet<>();

    /**
     * @param tree       исходное дерево (после реорганизации)
     * @param removed    комментарии, которые вставляются заново и не должны попасть в скелет
     * @param indentUnit единица отступа для членов класса, чей отступ нельзя взять из исходника
     */
    public SkeletonPrinter(SyntaxTree tree, Collection<Comment> removed, String indentUnit) {
        this.source = tree.source();
        this.lines = tree.lines();
        this.indentUnit = indentUnit;
        List<int[]> ranges = new ArrayList<>();
        for (Comment comment : removed) {
            removedStarts.add(comment.start());
            ranges.add(dropRange(comment));
        }
        this.drops = merge(ranges);
    }

    public String print(SyntaxNode root) {
        StringBuilder out = new StringBuilder();
        emit(root, out);
        return out.toString();
    }

    // ==================== Вырезание комментариев ====================

    private int[] dropRange(Comment comment) {
        int startLine = lines.lineOf(comment.start());
        int endLine = lines.lineOf(comment.end());
        int lineStart = lines.lineStart(startLine);
        int lineEnd = lines.lineEnd(endLine);
        boolean aloneBefore = source.substring(lineStart, comment.start()).isBlank();
        boolean aloneAfter = source.substring(comment.end(), lineEnd).isBlank();
        if (aloneBefore && aloneAfter) {
            if (lineEnd < source.length()) {
                return new int[]{lineStart, lineEnd + 1};
            }
            return new int[]{Math.max(0, lineStart - 1), lineEnd};
        }
        int from = comment.start();
        while (from > lineStart && (source.charAt(from - 1) == ' ' || source.charAt(from - 1) == '\t')) {
            from--;
        }
        return new int[]{from, comment.end()};
    }

    private static List<int[]> merge(List<int[]> ranges) {
        ranges.sort((a, b) -> Integer.compare(a[0], b[0]));
        List<int[]> merged = new ArrayList<>();
        for (int[] range : ranges) {
            if (!merged.isEmpty() && merged.get(merged.size() - 1)[1] >= range[0]) {
                int[] last = merged.get(merged.size() - 1);
                last[1] = Math.max(last[1], range[1]);
            } else {
                merged.add(new int[]{range[0], range[1]});
            }
        }
        return merged;
    }

    /**
     * Копирует исходный текст [from, to) за вычетом вырезанных диапазонов.
     */
    private void copy(int from, int to, StringBuilder out) {
        int pos = from;
        for (int[] drop : drops) {
            if (drop[1] <= pos) continue;
            if (drop[0] >= to) break;
            if (drop[0] > pos) {
                out.append(source, pos, drop[0]);
            }
            pos = Math.max(pos, drop[1]);
        }
        if (pos < to) {
            out.append(source, pos, to);
        }
    }

    private String copy(int from, int to) {
        StringBuilder out = new StringBuilder();
        copy(from, to, out);
        return out.toString();
    }

    // ==================== Слоты ====================

    private void emit(SyntaxNode node, StringBuilder out) {
        if (node.isBlockLayout()) {
            if (node.parent() == null) {
                emitProgram(node, out);
            } else {
                emitClassBody(node, out);
            }
            return;
        }
        if (node.isLeaf()) {
            copy(node.start(), node.end(), out);
            return;
        }
        List<SyntaxNode> original = node.originalChildren();
        List<SyntaxNode> current = node.children();
        int pos = node.start();
        for (int i = 0; i < original.size(); i++) {
            copy(pos, original.get(i).start(), out);
            emit(current.get(i), out);
            pos = original.get(i).end();
        }
        copy(pos, node.end(), out);
    }

    private String emit(SyntaxNode node) {
        StringBuilder out = new StringBuilder();
        emit(node, out);
        return out.toString();
    }

    // ==================== Блочная раскладка ====================

    /**
     * Сохранённые комментарии между элементами блока: на строке предыдущего элемента они
     * становятся его хвостом, иначе префиксом следующего элемента, а без следующего - концовкой блока.
     */
    private static final class Attachments {
        final Map<SyntaxNode, Integer> prefixStart = new HashMap<>();
        final Map<SyntaxNode, Integer> suffixEnd = new HashMap<>();
        int headEnd = -1;
        int tailStart = -1;
        int tailEnd = -1;
    }

    private Attachments attach(SyntaxNode block, List<SyntaxNode> items, Map<SyntaxNode, Integer> itemEnds,
                               int headLine) {
        Attachments attachments = new Attachments();
        for (SyntaxNode child : block.originalChildren()) {
            if (!child.isComment() || removedStarts.contains(child.start())) continue;

            SyntaxNode prev = null;
            SyntaxNode next = null;
            for (SyntaxNode item : items) {
                if (itemEnds.get(item) <= child.start()) prev = item;
                if (next == null && item.start() >= child.end()) next = item;
            }

            int commentLine = lines.lineOf(child.start());
            if (prev != null && lines.lineOf(itemEnds.get(prev)) == commentLine) {
                attachments.suffixEnd.merge(prev, child.end(), Math::max);
            } else if (prev == null && headLine >= 0 && commentLine == headLine) {
                attachments.headEnd = Math.max(attachments.headEnd, child.end());
            } else if (next != null) {
                attachments.prefixStart.merge(next, child.start(), Math::min);
            } else {
                if (attachments.tailStart < 0) attachments.tailStart = child.start();
                attachments.tailEnd = Math.max(attachments.tailEnd, child.end());
            }
        }
        return attachments;
    }

    private void emitProgram(SyntaxNode program, StringBuilder out) {
        List<SyntaxNode> original = new ArrayList<>();
        for (SyntaxNode child : program.originalChildren()) {
            if (!child.isComment() && child.isNamed()) original.add(child);
        }
        List<SyntaxNode> current = new ArrayList<>();
        for (SyntaxNode child : program.children()) {
            if (!child.isComment() && child.isNamed()) current.add(child);
        }
        Map<SyntaxNode, Integer> ends = new HashMap<>();
        original.forEach(item -> ends.put(item, item.end()));
        Attachments attachments = attach(program, original, ends, -1);

        String previousText = null;
        SyntaxNode previous = null;
        for (SyntaxNode item : current) {
            String text = emit(item);
            if (previous != null) {
                boolean compact = compactProgramItems(previous, previousText, item, text)
                        && !blankLineKept(original, ends, previous, item);
                out.append(compact ? "\n" : "\n\n");
            }
            Integer prefix = attachments.prefixStart.get(item);
            if (prefix != null) {
                out.append(copy(prefix, item.start()));
            }
            out.append(text);
            Integer suffix = attachments.suffixEnd.get(item);
            if (suffix != null) {
                out.append(copy(item.end(), suffix));
            }
            previous = item;
            previousText = text;
        }
        if (attachments.tailStart >= 0) {
            if (previous != null) out.append('\n');
            out.append(copy(attachments.tailStart, attachments.tailEnd));
        }
    }

    /**
     * Элементы стояли подряд и в исходнике, и между ними была пустая строка: она сохраняется.
     */
    private boolean blankLineKept(List<SyntaxNode> original, Map<SyntaxNode, Integer> ends,
                                  SyntaxNode previous, SyntaxNode item) {
        int index = original.indexOf(previous);
        if (index < 0 || index + 1 >= original.size() || original.get(index + 1) != item) {
            return false;
        }
        String[] gapLines = copy(ends.get(previous), item.start()).split("\n", -1);
        for (int i = 1; i < gapLines.length - 1; i++) {
            if (gapLines[i].isBlank()) return true;
        }
        return false;
    }

    private boolean compactProgramItems(SyntaxNode a, String aText, SyntaxNode b, String bText) {
        if (aText.indexOf('\n') >= 0 || bText.indexOf('\n') >= 0) return false;
        String kind = compactKind(a);
        return kind != null && kind.equals(compactKind(b));
    }

    /**
     * Вид элемента программы, однострочные элементы которого идут подряд без пустой строки.
     */
    private String compactKind(SyntaxNode item) {
        if (SyntaxKinds.isImport(item)) {
            return "import:" + ImportCategory.of(TypeScriptReorganizer.moduleSource(item, source));
        }
        if (SyntaxKinds.isReExport(item)) return "reexport";
        SyntaxNode declaration = SyntaxKinds.unwrapDeclaration(item);
        if (declaration == null) return null;
        return switch (declaration.type()) {
            case "lexical_declaration", "variable_declaration" -> "var";
            case "expression_statement" -> "expression";
            case "type_alias_declaration" -> "type";
            default -> null;
        };
    }

    private void emitClassBody(SyntaxNode body, StringBuilder out) {
        List<SyntaxNode> original = new ArrayList<>();
        for (SyntaxNode child : body.originalChildren()) {
            if (!child.isComment() && child.isNamed()) original.add(child);
        }
        if (original.isEmpty()) {
            copy(body.start(), body.end(), out);
            return;
        }
        List<SyntaxNode> current = new ArrayList<>();
        for (SyntaxNode child : body.children()) {
            if (!child.isComment() && child.isNamed()) current.add(child);
        }

        // Разделитель ';' после члена принадлежит члену и едет вместе с ним
        Map<SyntaxNode, Integer> ends = new HashMap<>();
        Set<SyntaxNode> withSemicolon = new HashSet<>();
        List<SyntaxNode> all = body.originalChildren();
        for (int i = 0; i < all.size(); i++) {
            SyntaxNode child = all.get(i);
            if (!original.contains(child)) continue;
            SyntaxNode next = i + 1 < all.size() ? all.get(i + 1) : null;
            if (next != null && next.is(";")) {
                withSemicolon.add(child);
                ends.put(child, next.end());
            } else {
                ends.put(child, child.end());
            }
        }

        int openLine = lines.lineOf(body.start());
        String classIndent = lines.indentation(openLine);
        Attachments attachments = attach(body, original, ends, openLine);

        out.append('{');
        if (attachments.headEnd >= 0) {
            out.append(copy(body.start() + 1, attachments.headEnd));
        }

        SyntaxNode previous = null;
        String previousText = null;
        for (SyntaxNode member : current) {
            String text = emit(member);
            if (previous == null) {
                out.append('\n');
            } else {
                boolean compact = compactMembers(previous, previousText, member, text)
                        && !blankLineKept(original, ends, previous, member);
                out.append(compact ? "\n" : "\n\n");
            }
            out.append(memberIndent(member, classIndent));
            Integer prefix = attachments.prefixStart.get(member);
            if (prefix != null) {
                out.append(copy(prefix, member.start()));
            }
            out.append(text);
            if (withSemicolon.contains(member)) out.append(';');
            Integer suffix = attachments.suffixEnd.get(member);
            if (suffix != null) {
                out.append(copy(ends.get(member), suffix));
            }
            previous = member;
            previousText = text;
        }
        if (attachments.tailStart >= 0) {
            out.append('\n').append(classIndent).append(indentUnit)
                    .append(copy(attachments.tailStart, attachments.tailEnd));
        }

        SyntaxNode close = all.get(all.size() - 1);
        int closeLine = lines.lineOf(close.start());
        boolean closeStartsLine = source.substring(lines.lineStart(closeLine), close.start()).isBlank();
        out.append('\n').append(closeStartsLine ? lines.indentation(closeLine) : classIndent).append('}');
    }

    private String memberIndent(SyntaxNode member, String classIndent) {
        int line = lines.lineOf(member.start());
        if (source.substring(lines.lineStart(line), member.start()).isBlank()) {
            return lines.indentation(line);
        }
        return classIndent + indentUnit;
    }

    private boolean compactMembers(SyntaxNode a, String aText, SyntaxNode b, String bText) {
        if (aText.indexOf('\n') >= 0 || bText.indexOf('\n') >= 0) return false;
        return isCompactMember(a) && isCompactMember(b);
    }

    private boolean isCompactMember(SyntaxNode member) {
        return MemberCategory.of(member, source).isField()
                || member.is("method_signature") || member.is("abstract_method_signature")
                || member.is("index_signature");
    }
}
