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
package ru.nts.tools.tsfmt.position;

import ru.nts.tools.tsfmt.identity.IdentifiedNode;
import ru.nts.tools.tsfmt.identity.IdentityWalker;
import ru.nts.tools.tsfmt.identity.NodeIdentity;
import ru.nts.tools.tsfmt.syntax.LineIndex;
import ru.nts.tools.tsfmt.syntax.SyntaxParser;
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Находит положения узлов в скелете: скелет разбирается заново той же грамматикой, и по нему
 * проходит тот же обход идентичностей, что и при извлечении комментариев.
 */
public final class PositionRecoverer {

    private PositionRecoverer() {}

    public static PositionIndex recover(String skeleton, String langId) {
        SyntaxTree tree = SyntaxParser.parse(skeleton, langId);
        LineIndex lines = tree.lines();

        Map<NodeIdentity, NodePosition> positions = new LinkedHashMap<>();
        Map<String, List<NodePosition>> groups = new HashMap<>();
        for (IdentifiedNode node : IdentityWalker.walk(tree)) {
            int startLine = lines.lineOf(node.start());
            int end = node.effectiveEnd();
            NodePosition position = new NodePosition(startLine, lines.lineOf(end), lines.columnOf(end),
                    lines.indentation(startLine));
            positions.putIfAbsent(node.identity(), position);
            groups.computeIfAbsent(node.group(), k -> new ArrayList<>()).add(position);
        }
        return new PositionIndex(positions, groups, lines.lineCount());
    }
}
