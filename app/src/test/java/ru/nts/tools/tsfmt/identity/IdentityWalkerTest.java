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

import org.junit.jupiter.api.Test;
import ru.nts.tools.tsfmt.syntax.SyntaxParser;
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentityWalkerTest {

    private static List<IdentifiedNode> walk(String source, String langId) {
        SyntaxTree tree = SyntaxParser.parse(source, langId);
        assertFalse(tree.hasErrors());
        return IdentityWalker.walk(tree);
    }

    private static List<String> labels(List<IdentifiedNode> nodes) {
        return nodes.stream().map(n -> n.identity().label()).toList();
    }

    @Test
    void programItemsAndClassMembers() {
        String source = """
                import { a } from './a';
                class A {
                  b() {}
                  a() {}
                }
                """;
        List<IdentifiedNode> nodes = walk(source, "typescript");

        assertEquals(List.of("import:./a {a}", "class:A", "member:class:A.method b():", "member:class:A.method a():"),
                labels(nodes));
        assertEquals(IdentityWalker.PROGRAM_GROUP, nodes.get(0).group());
        assertEquals(0, nodes.get(1).depth());
        assertEquals("class:A", nodes.get(2).group());
        assertEquals(1, nodes.get(2).depth());
    }

    @Test
    void repeatedStatementsGetOrdinals() {
        List<IdentifiedNode> nodes = walk("foo();\nfoo();\n", "typescript");
        assertEquals(2, nodes.size());
        assertTrue(nodes.get(0).identity().label().endsWith("#0"));
        assertTrue(nodes.get(1).identity().label().endsWith("#1"));
        assertNotEquals(nodes.get(0).identity(), nodes.get(1).identity());
    }

    @Test
    void objectPropertiesFormGroups() {
        String source = "const o = { b: 1, inner: { x: 1 } };";
        List<IdentifiedNode> nodes = walk(source, "typescript");

        assertEquals(List.of(
                "var:const o",
                "prop:var:const o|#0.b",
                "prop:var:const o|#0.inner",
                "prop:var:const o|.inner#0.x"), labels(nodes));
        assertEquals("var:const o|#0", nodes.get(1).group());
        assertEquals(1, nodes.get(1).depth());
        assertEquals(2, nodes.get(3).depth());
    }

    @Test
    void effectiveEndIncludesSeparator() {
        String source = "const o = { a: 1, b: 2 };";
        List<IdentifiedNode> nodes = walk(source, "typescript");
        IdentifiedNode a = nodes.get(1);
        assertEquals(source.indexOf(',') + 1, a.effectiveEnd());
        assertEquals(source.indexOf(','), a.node().end());
        IdentifiedNode b = nodes.get(2);
        assertEquals(b.node().end(), b.effectiveEnd());
    }

    @Test
    void jsxAttributesAreIdentified() {
        String source = "const el = <div id=\"a\" title=\"t\" />;";
        List<IdentifiedNode> nodes = walk(source, "javascript");

        assertEquals(List.of(
                "var:const el",
                "prop:var:const el|<div>#0.id",
                "prop:var:const el|<div>#0.title"), labels(nodes));
    }

    @Test
    void walkIsStableAcrossReparse() {
        String source = "function f() {}\nconst o = { a: 1 };\n";
        List<IdentifiedNode> first = walk(source, "typescript");
        List<IdentifiedNode> second = walk("\n\n" + source, "typescript");
        assertEquals(labels(first), labels(second));
    }
}
