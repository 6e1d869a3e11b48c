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
package ru.nts.tools.tsfmt.identity;

import ru.nts.tools.tsfmt.syntax.SyntaxNode;

/**
 * Узел, получивший идентичность при обходе дерева.
 *
 * @param node         сам узел
 * @param identity     его идентичность
 * @param group        группа соседей (программа, тело класса, объектный литерал, JSX-тег)
 * @param depth        глубина вложенности (0 - верхний уровень)
 * @param effectiveEnd конец узла вместе с непосредственно следующим {@code ;} или {@code ,}
 */
public record IdentifiedNode(SyntaxNode node, NodeIdentity identity, String group, int depth, int effectiveEnd) {

    public int start() {
        return node.start();
    }
}
