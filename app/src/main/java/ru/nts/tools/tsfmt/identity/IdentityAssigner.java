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

import ru.nts.tools.tsfmt.syntax.SyntaxKinds;
import ru.nts.tools.tsfmt.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Вычисляет идентичность узла по его содержимому.
 *
 * <p>Чистая функция: результат зависит только от текста узла, но не от его позиции. Поэтому
 * идентичности, посчитанные до реорганизации и после повторного разбора, сравнимы.
 * Порядок имён в наборах спецификаторов импорта и в деструктуризации не влияет на результат.
 */
public final class IdentityAssigner {

    private final String source;

    public IdentityAssigner(String source) {
        this.source = source;
    }

    /**
     * Идентичность элемента верхнего уровня (объявление, импорт, реэкспорт).
     *
     * @param node элемент программы
     * @return идентичность или пусто для нераспознанных видов узлов
     */
    public Optional<NodeIdentity> identify(SyntaxNode node) {
        return switch (node.type()) {
            case "function_declaration", "generator_function_declaration", "function_signature" ->
                    Optional.of(NodeIdentity.of("fn", functionKey(node)));
            case "class_declaration", "abstract_class_declaration", "class" ->
                    Optional.of(NodeIdentity.of("class", classKey(node)));
            case "lexical_declaration", "variable_declaration" ->
                    Optional.of(NodeIdentity.of("var", variableKey(node)));
            case "interface_declaration" -> Optional.of(NodeIdentity.of("interface", interfaceKey(node)));
            case "type_alias_declaration" -> named("type", node);
            case "enum_declaration" -> named("enum", node);
            case "internal_module", "module" -> named("namespace", node);
            case "import_statement" -> Optional.of(NodeIdentity.of("import", importKey(node)));
            case "export_statement" -> identifyExport(node);
            case "ambient_declaration" -> identifyAmbient(node);
            case "hash_bang_line" -> Optional.of(NodeIdentity.of("hashbang", ""));
            default -> Optional.empty();
        };
    }

    /**
     * Идентичность члена класса; имя класса входит в ключ.
     *
     * @param member    член тела класса
     * @param classLabel метка идентичности класса-владельца
     * @return идентичность или пусто для нераспознанных членов
     */
    public Optional<NodeIdentity> identifyMember(SyntaxNode member, String classLabel) {
        String kind;
        String signature;
        switch (member.type()) {
            case "method_definition", "method_signature", "abstract_method_signature" -> {
                String name = memberName(member);
                if ("constructor".equals(name)) {
                    kind = "constructor";
                    signature = "/" + parameterCount(member);
                } else {
                    kind = member.is("method_definition") ? "method" : "signature";
                    signature = signatureKey(member);
                }
            }
            case "public_field_definition", "field_definition" -> {
                kind = "field";
                SyntaxNode type = member.childByField("type");
                signature = ":" + (type != null ? typeTag(type) : "");
            }
            case "index_signature" -> {
                kind = "index";
                signature = digest(member);
            }
            case "class_static_block" -> {
                kind = "static_block";
                signature = digest(member);
            }
            default -> {
                return Optional.empty();
            }
        }

        StringBuilder key = new StringBuilder(classLabel).append('.').append(kind);
        if (member.hasChild("static")) key.append(" static");
        SyntaxNode accessibility = member.firstChild("accessibility_modifier");
        if (accessibility != null) key.append(' ').append(accessibility.text(source));
        if (member.hasChild("get")) key.append(" get");
        if (member.hasChild("set")) key.append(" set");
        String name = memberName(member);
        if (name != null) key.append(' ').append(name);
        key.append(signature);
        return Optional.of(NodeIdentity.of("member", key.toString()));
    }

    /**
     * Идентичность свойства объекта или JSX-атрибута внутри группы соседей.
     */
    public NodeIdentity identifyProperty(String group, String key) {
        return NodeIdentity.of("prop", group + "." + key);
    }

    /**
     * Ключ свойства объектного литерала.
     */
    public String propertyKey(SyntaxNode property) {
        return switch (property.type()) {
            case "pair" -> {
                SyntaxNode key = property.childByField("key");
                yield key != null ? SyntaxKinds.unquote(key.text(source)) : digest(property);
            }
            case "shorthand_property_identifier" -> property.text(source);
            case "method_definition" -> {
                String prefix = property.hasChild("get") ? "get " : property.hasChild("set") ? "set " : "";
                String name = memberName(property);
                yield prefix + (name != null ? name : digest(property));
            }
            default -> "..." + digest(property);
        };
    }

    /**
     * Имя JSX-атрибута; для spread-атрибутов - дайджест.
     */
    public String attributeName(SyntaxNode attribute) {
        if (attribute.is("jsx_attribute")) {
            List<SyntaxNode> named = attribute.namedChildren();
            if (!named.isEmpty()) {
                return named.get(0).text(source);
            }
        }
        return "..." + digest(attribute);
    }

    /**
     * Дайджест узла: хеш отсортированного набора его токенов без комментариев, {@code ;} и {@code ,}.
     * Не зависит от перестановок внутри узла.
     */
    public String digest(SyntaxNode node) {
        List<String> tokens = new ArrayList<>();
        collectTokens(node, tokens);
        Collections.sort(tokens);
        return Long.toHexString(NodeIdentity.hash(String.join("\u0001", tokens)));
    }

    private void collectTokens(SyntaxNode node, List<String> tokens) {
        if (node.isComment()) return;
        if (node.isLeaf()) {
            if (!SyntaxKinds.isSeparator(node)) {
                tokens.add(node.text(source));
            }
            return;
        }
        for (SyntaxNode child : node.originalChildren()) {
            collectTokens(child, tokens);
        }
    }

    private Optional<NodeIdentity> named(String kind, SyntaxNode node) {
        String name = SyntaxKinds.declaredName(node, source);
        return name != null ? Optional.of(NodeIdentity.of(kind, name)) : Optional.empty();
    }

    private Optional<NodeIdentity> identifyExport(SyntaxNode node) {
        SyntaxNode declaration = node.childByField("declaration");
        if (declaration != null) {
            Optional<NodeIdentity> inner = identify(declaration);
            if (SyntaxKinds.isDefaultExport(node)) {
                return inner.map(id -> NodeIdentity.of("default", id.label()));
            }
            return inner;
        }
        if (SyntaxKinds.isReExport(node)) {
            return Optional.of(NodeIdentity.of("reexport", reExportKey(node)));
        }
        return Optional.empty();
    }

    private Optional<NodeIdentity> identifyAmbient(SyntaxNode node) {
        List<SyntaxNode> named = node.namedChildren();
        if (named.isEmpty()) return Optional.empty();
        return identify(named.get(0)).map(id -> NodeIdentity.of("declare", id.label()));
    }

    private String functionKey(SyntaxNode node) {
        String name = SyntaxKinds.declaredName(node, source);
        return (name != null ? name : "") + signatureKey(node);
    }

    /**
     * Форма сигнатуры: параметры (имя или вид образца, признак необязательности, тег типа)
     * и тег возвращаемого типа.
     */
    private String signatureKey(SyntaxNode node) {
        List<String> params = new ArrayList<>();
        SyntaxNode parameters = node.childByField("parameters");
        if (parameters != null) {
            for (SyntaxNode param : parameters.namedChildren()) {
                params.add(parameterKey(param));
            }
        }
        SyntaxNode returnType = node.childByField("return_type");
        return "(" + String.join(",", params) + "):" + (returnType != null ? typeTag(returnType) : "");
    }

    private int parameterCount(SyntaxNode node) {
        SyntaxNode parameters = node.childByField("parameters");
        return parameters != null ? parameters.namedChildren().size() : 0;
    }

    private String parameterKey(SyntaxNode param) {
        if (param.is("required_parameter") || param.is("optional_parameter")) {
            SyntaxNode pattern = param.childByField("pattern");
            String name = pattern != null ? patternKind(pattern) : "";
            String optional = param.is("optional_parameter") ? "?" : "";
            SyntaxNode type = param.childByField("type");
            return name + optional + ":" + (type != null ? typeTag(type) : "");
        }
        return patternKind(param) + ":";
    }

    private String patternKind(SyntaxNode pattern) {
        return switch (pattern.type()) {
            case "object_pattern" -> "{}";
            case "array_pattern" -> "[]";
            case "rest_pattern" -> {
                List<SyntaxNode> named = pattern.namedChildren();
                yield "..." + (named.isEmpty() ? "" : patternKind(named.get(0)));
            }
            case "assignment_pattern" -> {
                SyntaxNode left = pattern.childByField("left");
                yield left != null ? patternKind(left) : "=";
            }
            default -> pattern.text(source);
        };
    }

    /**
     * Грубый тег типа: встроенный тип, имя типа, база generic-типа, {@code T[]}, {@code literal};
     * всё остальное - {@code complex_type}.
     */
    String typeTag(SyntaxNode type) {
        SyntaxNode node = type;
        if (node.is("type_annotation")) {
            List<SyntaxNode> named = node.namedChildren();
            if (named.isEmpty()) return "";
            node = named.get(0);
        }
        return switch (node.type()) {
            case "predefined_type", "type_identifier", "nested_type_identifier" -> node.text(source);
            case "generic_type" -> {
                SyntaxNode name = node.childByField("name");
                yield name != null ? name.text(source) : node.namedChildren().get(0).text(source);
            }
            case "array_type" -> {
                List<SyntaxNode> named = node.namedChildren();
                String element = named.isEmpty() ? "complex_type" : typeTag(named.get(0));
                yield "complex_type".equals(element) ? element : element + "[]";
            }
            case "literal_type" -> "literal";
            case "type_predicate_annotation" -> "predicate";
            case "asserts_annotation" -> "asserts";
            default -> "complex_type";
        };
    }

    private String classKey(SyntaxNode node) {
        String name = SyntaxKinds.declaredName(node, source);
        String superclass = superclassName(node);
        return (name != null ? name : "")
                + (superclass != null ? " extends " + superclass : "");
    }

    private String superclassName(SyntaxNode classNode) {
        SyntaxNode heritage = classNode.firstChild("class_heritage");
        if (heritage == null) return null;
        SyntaxNode extendsClause = heritage.firstChild("extends_clause");
        if (extendsClause != null) {
            SyntaxNode value = extendsClause.childByField("value");
            if (value == null && !extendsClause.namedChildren().isEmpty()) {
                value = extendsClause.namedChildren().get(0);
            }
            return value != null ? value.text(source) : null;
        }
        // JavaScript: class_heritage -> 'extends' expression
        for (SyntaxNode child : heritage.namedChildren()) {
            if (!child.is("implements_clause")) {
                return child.text(source);
            }
        }
        return null;
    }

    private String interfaceKey(SyntaxNode node) {
        String name = SyntaxKinds.declaredName(node, source);
        SyntaxNode clause = node.firstChild("extends_type_clause");
        if (clause == null) return name;
        List<String> bases = new ArrayList<>();
        for (SyntaxNode base : clause.namedChildren()) {
            bases.add(base.text(source));
        }
        return name + " extends " + String.join(",", bases);
    }

    private String variableKey(SyntaxNode node) {
        String kind = node.childCount() > 0 ? node.child(0).type() : "var";
        List<String> names = new ArrayList<>();
        for (SyntaxNode declarator : node.namedChildren()) {
            if (!declarator.is("variable_declarator")) continue;
            SyntaxNode name = declarator.childByField("name");
            if (name != null) {
                names.add(bindingKey(name));
            }
        }
        Collections.sort(names);
        return kind + " " + String.join(",", names);
    }

    private String bindingKey(SyntaxNode pattern) {
        if (pattern.is("object_pattern") || pattern.is("array_pattern")) {
            List<String> names = new ArrayList<>();
            SyntaxKinds.collectBindingNames(pattern, source, names);
            if (pattern.is("object_pattern")) {
                Collections.sort(names);
                return "{" + String.join(",", names) + "}";
            }
            return "[" + String.join(",", names) + "]";
        }
        return pattern.text(source);
    }

    private String importKey(SyntaxNode node) {
        SyntaxNode sourceNode = moduleSource(node);
        String from = sourceNode != null ? SyntaxKinds.unquote(sourceNode.text(source)) : "";
        boolean typeOnly = node.hasChild("type");

        List<String> specifiers = new ArrayList<>();
        SyntaxNode clause = node.firstChild("import_clause");
        if (clause != null) {
            for (SyntaxNode part : clause.namedChildren()) {
                switch (part.type()) {
                    case "identifier" -> specifiers.add("default=" + part.text(source));
                    case "namespace_import" -> specifiers.add("*=" + lastNamedText(part));
                    case "named_imports" -> {
                        for (SyntaxNode specifier : part.namedChildren()) {
                            if (specifier.is("import_specifier")) specifiers.add(specifierKey(specifier));
                        }
                    }
                    default -> specifiers.add(part.text(source));
                }
            }
        }
        SyntaxNode require = node.firstChild("import_require_clause");
        if (require != null) {
            specifiers.add("=" + require.namedChildren().get(0).text(source));
        }
        Collections.sort(specifiers);
        return from + (typeOnly ? " type" : "") + " {" + String.join(",", specifiers) + "}";
    }

    private String reExportKey(SyntaxNode node) {
        SyntaxNode sourceNode = node.childByField("source");
        String from = SyntaxKinds.unquote(sourceNode.text(source));
        List<String> specifiers = new ArrayList<>();
        SyntaxNode clause = node.firstChild("export_clause");
        if (clause != null) {
            for (SyntaxNode specifier : clause.namedChildren()) {
                if (specifier.is("export_specifier")) specifiers.add(specifierKey(specifier));
            }
        } else {
            SyntaxNode namespace = node.firstChild("namespace_export");
            specifiers.add(namespace != null ? "*=" + lastNamedText(namespace) : "*");
        }
        Collections.sort(specifiers);
        return from + (node.hasChild("type") ? " type" : "") + " {" + String.join(",", specifiers) + "}";
    }

    private String specifierKey(SyntaxNode specifier) {
        SyntaxNode name = specifier.childByField("name");
        SyntaxNode alias = specifier.childByField("alias");
        String base = name != null ? name.text(source) : specifier.text(source);
        String typePrefix = specifier.hasChild("type") ? "type " : "";
        return typePrefix + base + (alias != null ? " as " + alias.text(source) : "");
    }

    /**
     * Строка-источник модуля: поле {@code source} у import или у {@code import x = require(...)}.
     */
    public SyntaxNode moduleSource(SyntaxNode node) {
        SyntaxNode sourceNode = node.childByField("source");
        if (sourceNode != null) return sourceNode;
        SyntaxNode require = node.firstChild("import_require_clause");
        if (require != null) {
            SyntaxNode nested = require.childByField("source");
            if (nested != null) return nested;
            return require.firstChild("string");
        }
        return null;
    }

    private String lastNamedText(SyntaxNode node) {
        List<SyntaxNode> named = node.namedChildren();
        return named.isEmpty() ? "" : named.get(named.size() - 1).text(source);
    }

    private String memberName(SyntaxNode member) {
        SyntaxNode name = member.childByField("name");
        if (name == null) name = member.childByField("property");
        return name != null ? SyntaxKinds.unquote(name.text(source)) : null;
    }
}
