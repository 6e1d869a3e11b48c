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

import ru.nts.tools.tsfmt.syntax.LineIndex;
import ru.nts.tools.tsfmt.syntax.SyntaxNode;
import ru.nts.tools.tsfmt.syntax.SyntaxParser;
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Косметический проход по готовому тексту.
 *
 * <p>Убирает пробелы в конце строк, схлопывает серии пустых строк в одну, удаляет пустые строки
 * в начале и в конце текста. Финальный перевод строки не добавляется (это делает запись файла).
 * Строки внутри многострочных шаблонных строк не трогаются: их содержимое значимо.
 */
public final class StylePass {

    private StylePass() {}

    public static String apply(String text, String langId) {
        Set<Integer> keepWhitespace = new HashSet<>();
        Set<Integer> keepBlank = new HashSet<>();
        protectTemplates(text, langId, keepWhitespace, keepBlank);

        String[] lines = text.split("\n", -1);
        List<String> result = new ArrayList<>(lines.length);
        boolean previousBlank = false;
        for (int i = 0; i < lines.length; i++) {
            String line = keepWhitespace.contains(i) ? lines[i] : stripTrailing(lines[i]);
            boolean blank = line.isEmpty() && !keepBlank.contains(i);
            if (blank && (previousBlank || result.isEmpty())) {
                continue;
            }
            result.add(line);
            previousBlank = blank;
        }
        while (!result.isEmpty() && result.get(result.size() - 1).isEmpty()) {
            result.remove(result.size() - 1);
        }
        return String.join("\n", result);
    }

    private static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(0, end);
    }

    /**
     * Строки с начала шаблонной строки до предпоследней хранят значимые хвостовые пробелы,
     * внутренние строки шаблона хранят значимые пустые строки.
     */
    private static void protectTemplates(String text, String langId, Set<Integer> keepWhitespace,
                                         Set<Integer> keepBlank) {
        if (text.indexOf('`') < 0) return;
        SyntaxTree tree = SyntaxParser.parse(text, langId);
        List<SyntaxNode> templates = new ArrayList<>();
        collectTemplates(tree.root(), templates);
        LineIndex lines = tree.lines();
        for (SyntaxNode template : templates) {
            int startLine = lines.lineOf(template.start());
            int endLine = lines.lineOf(template.end());
            for (int line = startLine; line < endLine; line++) {
                keepWhitespace.add(line);
                if (line > startLine) keepBlank.add(line);
            }
        }
    }

    private static void collectTemplates(SyntaxNode node, List<SyntaxNode> templates) {
        if (node.is("template_string")) {
            templates.add(node);
            return;
        }
        for (SyntaxNode child : node.originalChildren()) {
            collectTemplates(child, templates);
        }
    }
}
