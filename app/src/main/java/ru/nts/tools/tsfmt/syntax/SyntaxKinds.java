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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Типы узлов грамматик tree-sitter-typescript / tree-sitter-javascript и утилиты над ними.
 */
public final class SyntaxKinds {

    private SyntaxKinds() {}

    /**
     * Объявления, которые можно переставлять внутри сегмента программы.
     */
    public static final Set<String> DECLARATIONS = Set.of(
            "function_declaration",
            "generator_function_declaration",
            "function_signature",
            "class_declaration",
            "abstract_class_declaration",
            "interface_declaration",
            "type_alias_declaration",
            "enum_declaration",
            "lexical_declaration",
            "variable_declaration",
            "internal_module",
            "module"
    );

    public static final Set<String> CLASSES = Set.of("class_declaration", "abstract_class_declaration", "class");

    public static final Set<String> FUNCTIONS = Set.of(
            "function_declaration", "generator_function_declaration", "function_signature");

    public static final Set<String> OBJECT_PROPERTIES = Set.of(
            "pair", "shorthand_property_identifier", "method_definition", "spread_element");

    public static final Set<String> JSX_TAGS = Set.of("jsx_opening_element", "jsx_self_closing_element");

    public static boolean isImport(SyntaxNode node) {
        return node.is("import_statement");
    }

    /**
     * {@code export ... from '...'} и {@code export * from '...'}.
     */
    public static boolean isReExport(SyntaxNode node) {
        return node.is("export_statement") && node.childByField("source") != null;
    }

    public static boolean isDefaultExport(SyntaxNode node) {
        return node.is("export_statement") && node.hasChild("default");
    }

    /**
     * Объявление под {@code export}, {@code export default} или {@code declare}; сам узел, если обёртки нет.
     * Для экспорта без объявления возвращает null.
     */
    public static SyntaxNode unwrapDeclaration(SyntaxNode node) {
        SyntaxNode current = node;
        if (current.is("export_statement")) {
            current = current.childByField("declaration");
            if (current == null) return null;
        }
        if (current.is("ambient_declaration")) {
            List<SyntaxNode> named = current.namedChildren();
            if (named.isEmpty()) return null;
            current = named.get(0);
        }
        return current;
    }

    /**
     * Класс, члены которого обходятся и сортируются: объявление верхнего уровня
     * или объявление под {@code export}. Иначе null.
     */
    public static SyntaxNode reorganizableClass(SyntaxNode item) {
        SyntaxNode target = item;
        if (item.is("export_statement")) {
            target = item.childByField("declaration");
            if (target == null) {
                target = item.firstChild("class");
            }
        }
        if (target == null || !CLASSES.contains(target.type())) return null;
        return classBody(target);
    }

    public static SyntaxNode classBody(SyntaxNode classNode) {
        SyntaxNode body = classNode.childByField("body");
        return body != null ? body : classNode.firstChild("class_body");
    }

    public static boolean isSeparator(SyntaxNode node) {
        return !node.isNamed() && (node.is(";") || node.is(","));
    }

    /**
     * Имя объявления (поле {@code name}) или null.
     */
    public static String declaredName(SyntaxNode declaration, String source) {
        SyntaxNode name = declaration.childByField("name");
        return name != null ? unquote(name.text(source)) : null;
    }

    /**
     * Имена, объявляемые узлом: имя функции/класса/типа или все имена деклараторов переменной.
     */
    public static List<String> declaredNames(SyntaxNode declaration, String source) {
        List<String> names = new ArrayList<>();
        if (declaration.is("lexical_declaration") || declaration.is("variable_declaration")) {
            for (SyntaxNode declarator : declaration.namedChildren()) {
                if (!declarator.is("variable_declarator")) continue;
                SyntaxNode name = declarator.childByField("name");
                if (name != null) {
                    collectBindingNames(name, source, names);
                }
            }
        } else {
            String name = declaredName(declaration, source);
            if (name != null) names.add(name);
        }
        return names;
    }

    /**
     * Имена, связываемые образцом ({@code a}, {@code {a, b: c}}, {@code [x, ...rest]}).
     */
    public static void collectBindingNames(SyntaxNode pattern, String source, List<String> names) {
        switch (pattern.type()) {
            case "identifier", "shorthand_property_identifier_pattern" -> names.add(pattern.text(source));
            case "pair_pattern" -> {
                SyntaxNode value = pattern.childByField("value");
                if (value != null) collectBindingNames(value, source, names);
            }
            case "assignment_pattern", "object_assignment_pattern" -> {
                SyntaxNode left = pattern.childByField("left");
                if (left != null) collectBindingNames(left, source, names);
            }
            default -> {
                for (SyntaxNode child : pattern.namedChildren()) {
                    collectBindingNames(child, source, names);
                }
            }
        }
    }

    /**
     * Текст строкового литерала без кавычек; прочий текст без изменений.
     */
    public static String unquote(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last = text.charAt(text.length() - 1);
            if ((first == '\'' || first == '"' || first == '`') && first == last) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    /**
     * Есть ли комментарий где-либо внутри узла-списка, включая комментарий перед первым
     * элементом и после последнего. Такие списки не сортируются: комментарий без владельца
     * оказался бы рядом с чужим элементом.
     */
    public static boolean hasComment(SyntaxNode list) {
        return containsComment(list, list.start(), list.end());
    }

    /**
     * Стоит ли комментарий у родителя непосредственно перед узлом.
     */
    public static boolean hasCommentBefore(SyntaxNode node) {
        SyntaxNode parent = node.parent();
        if (parent == null) return false;
        List<SyntaxNode> siblings = parent.originalChildren();
        int index = siblings.indexOf(node);
        return index > 0 && siblings.get(index - 1).isComment();
    }

    private static boolean containsComment(SyntaxNode node, int from, int to) {
        for (SyntaxNode child : node.originalChildren()) {
            if (child.end() <= from || child.start() >= to) continue;
            if (child.isComment()) return true;
            if (containsComment(child, from, to)) return true;
        }
        return false;
    }
}
