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
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Обходит дерево в текущем порядке детей и выдаёт все узлы, способные нести комментарии,
 * вместе с их идентичностями.
 *
 * <p>Один и тот же обход используется и для исходного дерева (извлечение комментариев),
 * и для заново разобранного скелета (восстановление позиций), поэтому идентичности сравнимы.
 * Обходятся: элементы программы, члены классов верхнего уровня и экспортируемых классов,
 * свойства объектных литералов и JSX-атрибуты на любой глубине.
 */
public final class IdentityWalker {

    public static final String PROGRAM_GROUP = "program";

    private final String source;
    private final IdentityAssigner assigner;
    private final Map<String, Integer> occurrences = new HashMap<>();
    private final List<IdentifiedNode> result = new ArrayList<>();

    private IdentityWalker(String source) {
        this.source = source;
        this.assigner = new IdentityAssigner(source);
    }

    /**
     * Идентифицированные узлы дерева в порядке обхода.
     */
    public static List<IdentifiedNode> walk(SyntaxTree tree) {
        IdentityWalker walker = new IdentityWalker(tree.source());
        walker.walkProgram(tree.root());
        return List.copyOf(walker.result);
    }

    private void walkProgram(SyntaxNode program) {
        for (SyntaxNode item : program.children()) {
            if (item.isComment() || !item.isNamed()) continue;

            NodeIdentity identity = assigner.identify(item)
                    .orElseGet(() -> occurrence("stmt", item.type() + "@" + assigner.digest(item)));
            add(item, identity, PROGRAM_GROUP, 0);

            SyntaxNode body = SyntaxKinds.reorganizableClass(item);
            if (body != null) {
                walkClass(item, body, identity.label());
            } else {
                walkNested(item, identity.label(), "", 1);
            }
        }
    }

    private void walkClass(SyntaxNode item, SyntaxNode body, String classLabel) {
        // Декораторы и extends-выражение тоже могут содержать объектные литералы
        walkNestedExcept(item, body, classLabel);

        for (SyntaxNode member : body.children()) {
            if (member.isComment() || !member.isNamed()) continue;
            Optional<NodeIdentity> identity = assigner.identifyMember(member, classLabel);
            String owner = classLabel;
            if (identity.isPresent()) {
                add(member, identity.get(), classLabel, 1);
                owner = identity.get().label();
            }
            walkNested(member, owner, "", 2);
        }
    }

    private void walkNestedExcept(SyntaxNode node, SyntaxNode skip, String owner) {
        for (SyntaxNode child : node.children()) {
            if (child == skip) continue;
            if (child.children().contains(skip)) {
                walkNestedExcept(child, skip, owner);
            } else {
                visit(child, owner, "", 1);
            }
        }
    }

    private void walkNested(SyntaxNode node, String owner, String chain, int depth) {
        for (SyntaxNode child : node.children()) {
            visit(child, owner, chain, depth);
        }
    }

    private void visit(SyntaxNode node, String owner, String chain, int depth) {
        if (node.isComment() || node.isLeaf()) return;

        if (node.is("object")) {
            String group = group(owner, chain);
            for (SyntaxNode property : node.children()) {
                if (!SyntaxKinds.OBJECT_PROPERTIES.contains(property.type())) continue;
                String key = assigner.propertyKey(property);
                add(property, assigner.identifyProperty(group, key), group, depth);
                walkNested(property, owner, chain + "." + key, depth + 1);
            }
            return;
        }

        if (SyntaxKinds.JSX_TAGS.contains(node.type())) {
            SyntaxNode name = node.childByField("name");
            String tag = name != null ? name.text(source) : "";
            String tagChain = chain + "<" + tag + ">";
            String group = group(owner, tagChain);
            for (SyntaxNode attribute : node.children()) {
                if (!attribute.is("jsx_attribute") && !attribute.is("jsx_expression")) continue;
                String attrName = assigner.attributeName(attribute);
                add(attribute, assigner.identifyProperty(group, attrName), group, depth);
                walkNested(attribute, owner, tagChain + "." + attrName, depth + 1);
            }
            return;
        }

        if (node.is("jsx_element")) {
            SyntaxNode open = node.childByField("open_tag");
            String tag = open != null && open.childByField("name") != null
                    ? open.childByField("name").text(source) : "";
            for (SyntaxNode child : node.children()) {
                visit(child, owner, child == open ? chain : chain + "<" + tag + ">", depth + 1);
            }
            return;
        }

        walkNested(node, owner, chain, depth);
    }

    private String group(String owner, String chain) {
        String base = owner + "|" + chain;
        int n = occurrences.merge("group:" + base, 1, Integer::sum) - 1;
        return base + "#" + n;
    }

    private NodeIdentity occurrence(String kind, String key) {
        int n = occurrences.merge(kind + ":" + key, 1, Integer::sum) - 1;
        return NodeIdentity.of(kind, key + "#" + n);
    }

    private void add(SyntaxNode node, NodeIdentity identity, String group, int depth) {
        result.add(new IdentifiedNode(node, identity, group, depth, effectiveEnd(node)));
    }

    /**
     * Конец узла с учётом непосредственно следующего разделителя {@code ;} или {@code ,}.
     */
    static int effectiveEnd(SyntaxNode node) {
        SyntaxNode next = node.nextSibling();
        if (next != null && SyntaxKinds.isSeparator(next)) {
            return next.end();
        }
        return node.end();
    }
}
