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

import ru.nts.tools.tsfmt.core.treesitter.SyntaxChecker.SyntaxCheckResult;

import java.util.List;

/**
 * Результат разбора одного исходника: корень дерева, исходный текст, все комментарии
 * в порядке текста и найденные синтаксические ошибки.
 */
public record SyntaxTree(String source, String langId, SyntaxNode root, List<Comment> comments,
                         LineIndex lines, SyntaxCheckResult syntax) {

    public boolean hasErrors() {
        return syntax.hasErrors();
    }
}
