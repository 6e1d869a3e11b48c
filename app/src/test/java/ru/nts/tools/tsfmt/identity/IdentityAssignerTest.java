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
import ru.nts.tools.tsfmt.syntax.SyntaxKinds;
import ru.nts.tools.tsfmt.syntax.SyntaxNode;
import ru.nts.tools.tsfmt.syntax.SyntaxParser;
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentityAssignerTest {

    private static NodeIdentity identifyFirst(String source) {
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        SyntaxNode item = tree.root().namedChildren().get(0);
        return new IdentityAssigner(source).identify(item).orElseThrow();
    }

    private static NodeIdentity identifyLast(String source) {
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        List<SyntaxNode> items = tree.root().namedChildren();
        return new IdentityAssigner(source).identify(items.get(items.size() - 1)).orElseThrow();
    }

    @Test
    void identityDoesNotDependOnPositionOrBody() {
        NodeIdentity a = identifyFirst("function foo(a: string) {}");
        NodeIdentity b = identifyLast("const x = 1;\n\n\nfunction foo(a: string) { return a.length; }");
        assertEquals(a, b);
        assertEquals(a.hash(), b.hash());
    }

    @Test
    void signatureShapeIsPartOfIdentity() {
        NodeIdentity text = identifyFirst("function foo(a: string) {}");
        NodeIdentity number = identifyFirst("function foo(a: number) {}");
        NodeIdentity optional = identifyFirst("function foo(a?: string) {}");
        assertNotEquals(text, number);
        assertNotEquals(text, optional);
    }

    @Test
    void functionLabelDescribesSignature() {
        NodeIdentity identity = identifyFirst("function foo(a: string, b?: number): void {}");
        assertEquals("fn:foo(a:string,b?:number):void", identity.label());
    }

    @Test
    void classLabelIncludesSuperclass() {
        assertEquals("class:Foo extends Bar", identifyFirst("class Foo extends Bar {}").label());
        assertEquals("class:Foo", identifyFirst("class Foo {}").label());
    }

    @Test
    void importSpecifierOrderIsIgnored() {
        NodeIdentity ab = identifyFirst("import { a, b } from './x';");
        NodeIdentity ba = identifyFirst("import { b, a } from './x';");
        NodeIdentity typeOnly = identifyFirst("import type { a, b } from './x';");
        NodeIdentity other = identifyFirst("import { a, b } from './y';");
        assertEquals(ab, ba);
        assertNotEquals(ab, typeOnly);
        assertNotEquals(ab, other);
    }

    @Test
    void destructuringOrderIsIgnored() {
        assertEquals(identifyFirst("const { a, b } = o;"), identifyFirst("const { b, a } = o;"));
        assertNotEquals(identifyFirst("const [a, b] = o;"), identifyFirst("const [b, a] = o;"));
    }

    @Test
    void exportKeepsIdentityOfDeclaration() {
        NodeIdentity plain = identifyFirst("function f() {}");
        NodeIdentity exported = identifyFirst("export function f() {}");
        NodeIdentity byDefault = identifyFirst("export default function f() {}");
        assertEquals(plain, exported);
        assertNotEquals(plain, byDefault);
        assertTrue(byDefault.label().startsWith("default:"));
    }

    @Test
    void memberIdentityContainsClassAndModifiers() {
        String source = """
                class A {
                  static x: number = 1;
                  private foo(a: string): void {}
                  constructor(a, b) {}
                }
                """;
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        SyntaxNode body = SyntaxKinds.classBody(tree.root().namedChildren().get(0));
        IdentityAssigner assigner = new IdentityAssigner(source);
        List<SyntaxNode> members = body.namedChildren();

        assertEquals("member:A.field static x:number", assigner.identifyMember(members.get(0), "A").orElseThrow().label());
        assertEquals("member:A.method private foo(a:string):void",
                assigner.identifyMember(members.get(1), "A").orElseThrow().label());
        assertEquals("member:A.constructor constructor/2",
                assigner.identifyMember(members.get(2), "A").orElseThrow().label());
    }

    @Test
    void unknownStatementsHaveNoIdentity() {
        String source = "foo();";
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        assertTrue(new IdentityAssigner(source).identify(tree.root().namedChildren().get(0)).isEmpty());
    }

    @Test
    void digestIgnoresTokenOrder() {
        String source = "a + b;\nb + a;\na - b;";
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        IdentityAssigner assigner = new IdentityAssigner(source);
        List<SyntaxNode> items = tree.root().namedChildren();
        assertEquals(assigner.digest(items.get(0)), assigner.digest(items.get(1)));
        assertNotEquals(assigner.digest(items.get(0)), assigner.digest(items.get(2)));
    }

    @Test
    void hashIsFnv1a() {
        assertEquals(0xcbf29ce484222325L, NodeIdentity.hash(""));
        assertEquals(NodeIdentity.of("fn", "x"), new NodeIdentity(NodeIdentity.of("fn", "x").hash(), "other"));
    }
}
