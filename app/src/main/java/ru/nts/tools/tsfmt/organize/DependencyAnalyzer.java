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
package ru.nts.tools.tsfmt.organize;

import ru.nts.tools.tsfmt.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Порядок объявлений с учётом зависимостей: объявление выводится после тех, на которые ссылается.
 */
final class DependencyAnalyzer {

    private DependencyAnalyzer() {}

    /**
     * Имена, на которые ссылается узел: идентификаторы значений и типов.
     * Приближение сверху: имена свойств не учитываются, локальные переменные учитываются.
     */
    static Set<String> references(SyntaxNode node, String source) {
        Set<String> names = new HashSet<>();
        collect(node, source, names);
        return names;
    }

    private static void collect(SyntaxNode node, String source, Set<String> names) {
        if (node.isComment()) return;
        switch (node.type()) {
            case "identifier", "type_identifier", "shorthand_property_identifier" -> {
                names.add(node.text(source));
                return;
            }
            default -> {
            }
        }
        for (SyntaxNode child : node.originalChildren()) {
            collect(child, source, names);
        }
    }

    /**
     * Обход в глубину: для каждого элемента в порядке {@code preferred} сначала выводятся его
     * зависимости (в исходном порядке), затем он сам. Циклы разрываются по первому посещению.
     *
     * @param preferred    желаемый порядок
     * @param sourceOrder  исходный порядок тех же элементов
     * @param dependencies зависимости каждого элемента
     */
    static <T> List<T> order(List<T> preferred, List<T> sourceOrder, Map<T, Set<T>> dependencies) {
        Set<T> visited = new LinkedHashSet<>();
        List<T> result = new ArrayList<>();
        for (T unit : preferred) {
            visit(unit, sourceOrder, dependencies, visited, result);
        }
        return result;
    }

    private static <T> void visit(T unit, List<T> sourceOrder, Map<T, Set<T>> dependencies,
                                  Set<T> visited, List<T> result) {
        if (!visited.add(unit)) return;
        Set<T> deps = dependencies.getOrDefault(unit, Set.of());
        for (T candidate : sourceOrder) {
            if (candidate != unit && deps.contains(candidate)) {
                visit(candidate, sourceOrder, dependencies, visited, result);
            }
        }
        result.add(unit);
    }
}
