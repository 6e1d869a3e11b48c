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

import ru.nts.tools.tsfmt.comments.Classification;
import ru.nts.tools.tsfmt.comments.CommentClassifier;
import ru.nts.tools.tsfmt.core.FormatterConfig;
import ru.nts.tools.tsfmt.syntax.Comment;
import ru.nts.tools.tsfmt.syntax.SyntaxKinds;
import ru.nts.tools.tsfmt.syntax.SyntaxNode;
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Реорганизатор TypeScript/JavaScript.
 *
 * <p>Правила:
 * <ul>
 *   <li>импорты наверх, по группам {@link ImportCategory}, внутри группы по пути модуля;</li>
 *   <li>реэкспорты сразу после импортов;</li>
 *   <li>объявления сортируются внутри сегментов между прочими операторами: сначала
 *       экспортируемые, по алфавиту, с выводом зависимостей раньше зависящих;</li>
 *   <li>члены классов по {@link MemberCategory}, внутри категории по алфавиту; декораторы
 *       члена едут вместе с ним;</li>
 *   <li>свойства объектов, образцы параметров, JSX-атрибуты, члены объединений и
 *       пересечений, строковые enum и спецификаторы импорта по алфавиту.</li>
 * </ul>
 * Спецификаторы, enum, образцы параметров и объединения с комментарием внутри не сортируются:
 * их элементы не имеют идентичностей. Объекты и JSX-теги не сортируются,
 * если между их элементами стоит INLINE-комментарий: он не извлекается и остался бы на месте.
 * Каждое правило отключается в {@link FormatterConfig.Rules}.
 */
public final class TypeScriptReorganizer implements Reorganizer {

    private static final Comparator<String> ALPHABETICAL = String.CASE_INSENSITIVE_ORDER;

    private final FormatterConfig.Rules rules;

    public TypeScriptReorganizer(FormatterConfig.Rules rules) {
        this.rules = rules;
    }

    @Override
    public void reorganize(SyntaxTree tree) {
        String source = tree.source();
        SyntaxNode program = tree.root();
        organizeProgram(program, source);
        program.markBlockLayout();
        organizeNested(program, source, new CommentClassifier(source, tree.lines()));
    }

    // ==================== Программа ====================

    private void organizeProgram(SyntaxNode program, String source) {
        List<SyntaxNode> items = new ArrayList<>();
        for (SyntaxNode child : program.children()) {
            if (!child.isComment() && child.isNamed()) items.add(child);
        }

        List<SyntaxNode> head = new ArrayList<>();
        List<SyntaxNode> imports = new ArrayList<>();
        List<SyntaxNode> reExports = new ArrayList<>();
        List<SyntaxNode> rest = new ArrayList<>();
        for (SyntaxNode item : items) {
            if (item.is("hash_bang_line")) {
                head.add(item);
            } else if (rules.imports() && SyntaxKinds.isImport(item)) {
                imports.add(item);
            } else if (rules.imports() && SyntaxKinds.isReExport(item)) {
                reExports.add(item);
            } else {
                rest.add(item);
            }

            SyntaxNode body = SyntaxKinds.reorganizableClass(item);
            if (body != null && rules.classMembers()) {
                organizeClassBody(body, source);
            }
        }

        List<SyntaxNode> ordered = new ArrayList<>(head);
        ordered.addAll(sortModuleStatements(imports, source));
        ordered.addAll(sortModuleStatements(reExports, source));
        ordered.addAll(rules.declarations() ? sortDeclarations(rest, source) : rest);
        permute(program, items, ordered);
    }

    /**
     * Импорты или реэкспорты: группы по виду пути, в группе сначала импорты без спецификаторов
     * (в исходном порядке), затем остальные по пути модуля.
     */
    private List<SyntaxNode> sortModuleStatements(List<SyntaxNode> statements, String source) {
        Map<ImportCategory, List<SyntaxNode>> sideEffects = new EnumMap<>(ImportCategory.class);
        Map<ImportCategory, List<SyntaxNode>> regular = new EnumMap<>(ImportCategory.class);
        for (SyntaxNode statement : statements) {
            ImportCategory category = ImportCategory.of(moduleSource(statement, source));
            boolean sideEffect = statement.is("import_statement")
                    && !statement.hasChild("import_clause") && !statement.hasChild("import_require_clause");
            (sideEffect ? sideEffects : regular).computeIfAbsent(category, k -> new ArrayList<>()).add(statement);
        }

        List<SyntaxNode> result = new ArrayList<>();
        for (ImportCategory category : ImportCategory.values()) {
            result.addAll(sideEffects.getOrDefault(category, List.of()));
            List<SyntaxNode> group = new ArrayList<>(regular.getOrDefault(category, List.of()));
            group.sort(Comparator.comparing(s -> moduleSource(s, source), ALPHABETICAL));
            result.addAll(group);
        }
        return result;
    }

    /**
     * Путь модуля импорта или реэкспорта без кавычек.
     */
    public static String moduleSource(SyntaxNode statement, String source) {
        SyntaxNode sourceNode = statement.childByField("source");
        if (sourceNode == null) {
            SyntaxNode require = statement.firstChild("import_require_clause");
            if (require != null) {
                sourceNode = require.childByField("source");
                if (sourceNode == null) sourceNode = require.firstChild("string");
            }
        }
        return sourceNode != null ? SyntaxKinds.unquote(sourceNode.text(source)) : "";
    }

    private record DeclarationUnit(List<SyntaxNode> items, String name, Set<String> names, boolean exported) {
    }

    /**
     * Сортирует объявления внутри сегментов; прочие операторы остаются на месте и делят сегменты.
     */
    private List<SyntaxNode> sortDeclarations(List<SyntaxNode> items, String source) {
        List<SyntaxNode> result = new ArrayList<>();
        List<SyntaxNode> segment = new ArrayList<>();
        for (SyntaxNode item : items) {
            if (isSortableDeclaration(item)) {
                segment.add(item);
            } else {
                result.addAll(sortSegment(segment, source));
                segment.clear();
                result.add(item);
            }
        }
        result.addAll(sortSegment(segment, source));
        return result;
    }

    private static boolean isSortableDeclaration(SyntaxNode item) {
        if (SyntaxKinds.isDefaultExport(item)) return false;
        SyntaxNode declaration = SyntaxKinds.unwrapDeclaration(item);
        return declaration != null && SyntaxKinds.DECLARATIONS.contains(declaration.type());
    }

    private List<SyntaxNode> sortSegment(List<SyntaxNode> segment, String source) {
        if (segment.size() < 2) return new ArrayList<>(segment);

        // Перегрузки и слияния одноимённых объявлений, идущие подряд, остаются вместе
        List<DeclarationUnit> units = new ArrayList<>();
        for (SyntaxNode item : segment) {
            SyntaxNode declaration = SyntaxKinds.unwrapDeclaration(item);
            List<String> names = SyntaxKinds.declaredNames(declaration, source);
            String name = names.isEmpty() ? "" : names.get(0);
            boolean exported = item.is("export_statement");
            DeclarationUnit last = units.isEmpty() ? null : units.get(units.size() - 1);
            if (last != null && !name.isEmpty() && last.name().equals(name)) {
                last.items().add(item);
                units.set(units.size() - 1, new DeclarationUnit(last.items(), name, last.names(),
                        last.exported() || exported));
            } else {
                units.add(new DeclarationUnit(new ArrayList<>(List.of(item)), name,
                        new LinkedHashSet<>(names), exported));
            }
        }

        List<DeclarationUnit> preferred = new ArrayList<>(units);
        preferred.sort(Comparator.comparing((DeclarationUnit u) -> !u.exported())
                .thenComparing(DeclarationUnit::name, ALPHABETICAL));

        Map<DeclarationUnit, Set<DeclarationUnit>> dependencies = new HashMap<>();
        for (DeclarationUnit unit : units) {
            Set<String> references = new HashSet<>();
            for (SyntaxNode item : unit.items()) {
                references.addAll(DependencyAnalyzer.references(item, source));
            }
            Set<DeclarationUnit> deps = new HashSet<>();
            for (DeclarationUnit other : units) {
                if (other == unit) continue;
                for (String name : other.names()) {
                    if (references.contains(name)) {
                        deps.add(other);
                        break;
                    }
                }
            }
            dependencies.put(unit, deps);
        }

        List<SyntaxNode> result = new ArrayList<>();
        for (DeclarationUnit unit : DependencyAnalyzer.order(preferred, units, dependencies)) {
            result.addAll(unit.items());
        }
        return result;
    }

    // ==================== Классы ====================

    private void organizeClassBody(SyntaxNode body, String source) {
        if (body.text(source).indexOf('\n') < 0) {
            // Однострочное тело не перестраивается: разделители ';' остались бы на своих местах
            return;
        }
        List<SyntaxNode> members = new ArrayList<>();
        for (SyntaxNode child : body.children()) {
            if (!child.isComment() && child.isNamed()) members.add(child);
        }
        if (members.isEmpty()) return;

        List<SyntaxNode> sorted = new ArrayList<>(members);
        sorted.sort(Comparator.comparing((SyntaxNode m) -> MemberCategory.of(m, source))
                .thenComparing(m -> MemberCategory.of(m, source) == MemberCategory.OTHER ? "" : memberName(m, source),
                        ALPHABETICAL));
        permute(body, members, sorted);
        body.markBlockLayout();
    }

    private static String memberName(SyntaxNode member, String source) {
        SyntaxNode name = member.childByField("name");
        if (name == null) name = member.childByField("property");
        return name != null ? SyntaxKinds.unquote(name.text(source)) : "";
    }

    // ==================== Вложенные конструкции ====================

    private void organizeNested(SyntaxNode node, String source, CommentClassifier classifier) {
        switch (node.type()) {
            case "object" -> {
                if (rules.objectKeys()) sortObject(node, source, classifier);
            }
            case "object_pattern" -> {
                if (rules.parameterPatterns() && isParameterPattern(node)) sortParameterPattern(node, source);
            }
            case "jsx_opening_element", "jsx_self_closing_element" -> {
                if (rules.jsxAttributes()) sortJsxAttributes(node, source, classifier);
            }
            case "union_type", "intersection_type" -> {
                if (rules.unionTypes() && (node.parent() == null || !node.parent().is(node.type()))) {
                    sortTypeMembers(node, source);
                }
            }
            case "enum_body" -> {
                if (rules.enums()) sortStringEnum(node, source);
            }
            case "named_imports", "export_clause" -> {
                if (rules.imports()) sortSpecifiers(node, source);
            }
            default -> {
            }
        }
        for (SyntaxNode child : node.originalChildren()) {
            organizeNested(child, source, classifier);
        }
    }

    /**
     * Свойства объекта по алфавиту между барьерами (spread и вычисляемые ключи).
     */
    private void sortObject(SyntaxNode object, String source, CommentClassifier classifier) {
        List<SyntaxNode> properties = new ArrayList<>();
        for (SyntaxNode child : object.children()) {
            if (isInlineComment(child, source, classifier)) return;
            if (SyntaxKinds.OBJECT_PROPERTIES.contains(child.type())) properties.add(child);
        }
        List<SyntaxNode> sorted = sortRuns(properties, p -> isObjectBarrier(p),
                Comparator.comparing(p -> propertyName(p, source), ALPHABETICAL));
        permute(object, properties, sorted);
    }

    /**
     * Комментарий, за которым на той же строке идёт код: он не извлекается и остаётся в скелете
     * на своём месте.
     */
    private static boolean isInlineComment(SyntaxNode child, String source, CommentClassifier classifier) {
        return child.isComment()
                && classifier.classify(Comment.of(child.text(source), child.start())) == Classification.INLINE;
    }

    private static boolean isObjectBarrier(SyntaxNode property) {
        if (property.is("spread_element")) return true;
        SyntaxNode key = property.childByField(property.is("pair") ? "key" : "name");
        return key != null && key.is("computed_property_name");
    }

    private static String propertyName(SyntaxNode property, String source) {
        SyntaxNode key = property.childByField(property.is("pair") ? "key" : "name");
        return key != null ? SyntaxKinds.unquote(key.text(source)) : property.text(source);
    }

    private static boolean isParameterPattern(SyntaxNode pattern) {
        SyntaxNode parent = pattern.parent();
        while (parent != null && (parent.is("required_parameter") || parent.is("optional_parameter")
                || parent.is("assignment_pattern"))) {
            parent = parent.parent();
        }
        return parent != null && parent.is("formal_parameters");
    }

    /**
     * Деструктуризация объекта в параметрах: по алфавиту, rest-элемент остаётся последним.
     */
    private void sortParameterPattern(SyntaxNode pattern, String source) {
        List<SyntaxNode> entries = new ArrayList<>();
        for (SyntaxNode child : pattern.children()) {
            switch (child.type()) {
                case "shorthand_property_identifier_pattern", "pair_pattern", "object_assignment_pattern" ->
                        entries.add(child);
                default -> {
                }
            }
        }
        if (entries.size() < 2 || SyntaxKinds.hasComment(pattern)) return;
        for (SyntaxNode entry : entries) {
            SyntaxNode key = entry.childByField("key");
            if (key != null && key.is("computed_property_name")) return;
        }
        List<SyntaxNode> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(e -> patternKey(e, source), ALPHABETICAL));
        permute(pattern, entries, sorted);
    }

    private static String patternKey(SyntaxNode entry, String source) {
        SyntaxNode key = switch (entry.type()) {
            case "pair_pattern" -> entry.childByField("key");
            case "object_assignment_pattern" -> entry.childByField("left");
            default -> entry;
        };
        return key != null ? SyntaxKinds.unquote(key.text(source)) : entry.text(source);
    }

    /**
     * JSX-атрибуты: key, ref, обычные по алфавиту, обработчики onX; spread-атрибуты - барьеры.
     */
    private void sortJsxAttributes(SyntaxNode tag, String source, CommentClassifier classifier) {
        List<SyntaxNode> attributes = new ArrayList<>();
        for (SyntaxNode child : tag.children()) {
            if (isInlineComment(child, source, classifier)) return;
            if (child.is("jsx_attribute") || child.is("jsx_expression")) attributes.add(child);
        }
        Comparator<SyntaxNode> order = Comparator.comparingInt((SyntaxNode a) -> attributeRank(attributeName(a, source)))
                .thenComparing(a -> attributeName(a, source), ALPHABETICAL);
        List<SyntaxNode> sorted = sortRuns(attributes, a -> a.is("jsx_expression"), order);
        permute(tag, attributes, sorted);
    }

    private static String attributeName(SyntaxNode attribute, String source) {
        List<SyntaxNode> named = attribute.namedChildren();
        return named.isEmpty() ? "" : named.get(0).text(source);
    }

    static int attributeRank(String name) {
        if (name.equals("key")) return 0;
        if (name.equals("ref")) return 1;
        if (name.length() > 2 && name.startsWith("on") && Character.isUpperCase(name.charAt(2))) return 3;
        return 2;
    }

    /**
     * Члены объединения или пересечения: ссылки на типы и литералы по тексту, затем ключевые
     * слова, затем прочие типы. Вложенные узлы цепочки {@code A | B | C} сплющиваются в один список.
     */
    private void sortTypeMembers(SyntaxNode node, String source) {
        // Комментарий перед цепочкой (например, после '=' в type_alias) лежит у родителя
        if (SyntaxKinds.hasCommentBefore(node)) return;
        List<SyntaxNode> flat = new ArrayList<>();
        flattenChain(node, node.type(), flat);
        List<SyntaxNode> members = new ArrayList<>();
        for (SyntaxNode part : flat) {
            if (part.isComment()) return;
            if (part.isNamed()) members.add(part);
        }
        if (members.size() < 2) return;

        List<SyntaxNode> sorted = new ArrayList<>(members);
        sorted.sort(Comparator.comparingInt((SyntaxNode m) -> typeRank(m, source))
                .thenComparing(m -> m.text(source)));
        if (sorted.equals(members)) return;

        node.flatten(flat);
        permute(node, members, sorted);
    }

    private static void flattenChain(SyntaxNode node, String chainType, List<SyntaxNode> out) {
        for (SyntaxNode child : node.originalChildren()) {
            if (child.is(chainType)) {
                flattenChain(child, chainType, out);
            } else {
                out.add(child);
            }
        }
    }

    static int typeRank(SyntaxNode type, String source) {
        return switch (type.type()) {
            case "type_identifier", "generic_type", "nested_type_identifier" -> 0;
            case "literal_type" -> {
                String text = type.text(source);
                yield text.equals("null") || text.equals("undefined") ? 1 : 0;
            }
            case "predefined_type" -> 1;
            default -> 2;
        };
    }

    /**
     * Enum, все члены которого инициализированы строками, сортируется по именам членов.
     */
    private void sortStringEnum(SyntaxNode body, String source) {
        List<SyntaxNode> members = body.namedChildren();
        if (members.size() < 2 || SyntaxKinds.hasComment(body)) return;
        for (SyntaxNode member : members) {
            if (!member.is("enum_assignment")) return;
            SyntaxNode value = member.childByField("value");
            if (value == null || !value.is("string")) return;
        }
        List<SyntaxNode> sorted = new ArrayList<>(members);
        sorted.sort(Comparator.comparing(m -> memberName(m, source), ALPHABETICAL));
        permute(body, members, sorted);
    }

    private void sortSpecifiers(SyntaxNode list, String source) {
        List<SyntaxNode> specifiers = new ArrayList<>();
        for (SyntaxNode child : list.children()) {
            if (child.is("import_specifier") || child.is("export_specifier")) specifiers.add(child);
        }
        if (specifiers.size() < 2 || SyntaxKinds.hasComment(list)) return;
        List<SyntaxNode> sorted = new ArrayList<>(specifiers);
        sorted.sort(Comparator.comparing(s -> memberName(s, source), ALPHABETICAL));
        permute(list, specifiers, sorted);
    }

    // ==================== Общее ====================

    /**
     * Сортирует элементы внутри отрезков между барьерами; барьеры остаются на своих местах.
     */
    private static List<SyntaxNode> sortRuns(List<SyntaxNode> elements, Function<SyntaxNode, Boolean> isBarrier,
                                             Comparator<SyntaxNode> order) {
        List<SyntaxNode> result = new ArrayList<>();
        List<SyntaxNode> run = new ArrayList<>();
        for (SyntaxNode element : elements) {
            if (isBarrier.apply(element)) {
                run.sort(order);
                result.addAll(run);
                run.clear();
                result.add(element);
            } else {
                run.add(element);
            }
        }
        run.sort(order);
        result.addAll(run);
        return result;
    }

    /**
     * Ставит {@code sorted} на места {@code elements} среди детей родителя; прочие дети не двигаются.
     */
    static void permute(SyntaxNode parent, List<SyntaxNode> elements, List<SyntaxNode> sorted) {
        if (elements.equals(sorted)) return;
        Set<SyntaxNode> slots = new HashSet<>(elements);
        List<SyntaxNode> next = new ArrayList<>(parent.childCount());
        int k = 0;
        for (SyntaxNode child : parent.children()) {
            next.add(slots.contains(child) ? sorted.get(k++) : child);
        }
        parent.reorder(next);
    }
}
