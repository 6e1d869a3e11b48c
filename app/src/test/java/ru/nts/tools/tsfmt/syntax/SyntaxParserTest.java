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

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxParserTest {

    @Test
    void offsetsAreCharactersNotBytes() {
        String source = "const s = 'Привет'; // комментарий\nlet x = 1;";
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");

        assertFalse(tree.hasErrors());
        assertEquals(1, tree.comments().size());
        Comment comment = tree.comments().get(0);
        assertEquals("// комментарий", comment.text());
        assertEquals(source.indexOf("//"), comment.start());
        assertEquals(Comment.Kind.LINE, comment.kind());

        List<SyntaxNode> items = tree.root().namedChildren();
        assertEquals(2, items.size());
        assertEquals("let x = 1;", items.get(1).text(source));
    }

    @Test
    void commentsStayInTheTree() {
        String source = """
                /** Doc */
                function f() {}
                """;
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        SyntaxNode first = tree.root().children().get(0);
        assertTrue(first.isComment());
        assertEquals(Comment.Kind.BLOCK, tree.comments().get(0).kind());
        assertEquals(1, tree.root().namedChildren().size(), "Comments are not named children");
    }

    @Test
    void fieldNamesAreKept() {
        String source = "function greet(name: string) { return name; }";
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        SyntaxNode function = tree.root().namedChildren().get(0);

        assertEquals("function_declaration", function.type());
        assertEquals("greet", function.childByField("name").text(source));
        assertEquals("formal_parameters", function.childByField("parameters").type());
        assertEquals("body", function.childByField("body").field());
    }

    @Test
    void syntaxErrorsAreReported() {
        SyntaxTree tree = SyntaxParser.parse("const = ;", "typescript");
        assertTrue(tree.hasErrors());
    }

    @Test
    void byteToCharMapHandlesSurrogates() {
        int[] map = SyntaxParser.byteToCharMap("a😀b");
        // a(1 байт) + 😀(4 байта) + b(1 байт) + конец
        assertEquals(7, map.length);
        assertEquals(0, map[0]);
        assertEquals(1, map[1]);
        assertEquals(1, map[4]);
        assertEquals(3, map[5]);
        assertEquals(4, map[6]);
    }

    @Test
    void reorderKeepsOriginalOrder() {
        String source = "const o = { b: 1, a: 2 };";
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        SyntaxNode object = find(tree.root(), "object");
        assertNotNull(object);

        List<SyntaxNode> pairs = object.namedChildren();
        SyntaxNode b = pairs.get(0);
        SyntaxNode a = pairs.get(1);
        List<SyntaxNode> order = new java.util.ArrayList<>(object.children());
        int ib = order.indexOf(b);
        int ia = order.indexOf(a);
        order.set(ib, a);
        order.set(ia, b);
        object.reorder(order);

        assertTrue(object.isReordered());
        assertEquals("a: 2", object.namedChildren().get(0).text(source));
        assertSame(b, object.originalChildren().get(1), "Original order is kept");
        assertThrows(IllegalArgumentException.class, () -> object.reorder(List.of(a)));
    }

    @Test
    void memberDecoratorsJoinTheirMember() {
        String source = """
                class C {
                  @Get('x')
                  // route
                  load() {}
                  plain() {}
                }
                """;
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        assertFalse(tree.hasErrors());
        SyntaxNode body = find(tree.root(), "class_body");
        List<SyntaxNode> members = body.namedChildren();

        assertEquals(2, members.size(), "Decorator is not a separate member");
        SyntaxNode decorated = members.get(0);
        assertEquals("method_definition", decorated.type());
        assertEquals(source.indexOf("@Get"), decorated.start());
        assertTrue(decorated.text(source).endsWith("load() {}"));
        assertEquals("decorator", decorated.children().get(0).type());
        assertEquals("load", decorated.childByField("name").text(source));
        assertSame(body, decorated.parent());
        assertEquals(source.indexOf("plain"), members.get(1).start());
    }

    private static SyntaxNode find(SyntaxNode node, String type) {
        if (node.is(type)) return node;
        for (SyntaxNode child : node.children()) {
            SyntaxNode found = find(child, type);
            if (found != null) return found;
        }
        return null;
    }
}
