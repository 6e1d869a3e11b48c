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

import ru.nts.tools.tsfmt.identity.NodeIdentity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Положения идентифицированных узлов скелета.
 *
 * @param positions положение по идентичности (первое вхождение при коллизии)
 * @param groups    положения узлов каждой группы соседей в порядке текста, включая повторы
 * @param lineCount число строк скелета
 */
public record PositionIndex(Map<NodeIdentity, NodePosition> positions, Map<String, List<NodePosition>> groups,
                            int lineCount) {

    public Optional<NodePosition> find(NodeIdentity identity) {
        return Optional.ofNullable(positions.get(identity));
    }

    public boolean contains(NodeIdentity identity) {
        return positions.containsKey(identity);
    }

    /**
     * Узлы группы в порядке скелета; пустой список, если группа исчезла.
     */
    public List<NodePosition> group(String name) {
        return groups.getOrDefault(name, List.of());
    }
}
