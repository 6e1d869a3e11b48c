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

import ru.nts.tools.tsfmt.syntax.SyntaxTree;

/**
 * Переупорядочивает дерево на месте.
 *
 * <p>Контракт: только перестановки детей ({@link ru.nts.tools.tsfmt.syntax.SyntaxNode#reorder}).
 * Узлы не создаются, не переименовываются и не удаляются, поэтому каждая идентичность
 * исходного дерева находится и в результате.
 */
public interface Reorganizer {

    void reorganize(SyntaxTree tree);
}
