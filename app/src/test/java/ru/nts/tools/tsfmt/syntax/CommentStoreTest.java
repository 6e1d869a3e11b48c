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

class CommentStoreTest {

    private static final String SOURCE = """
            const a = 1; // tail
            // lead
            function f() {}
            /* eof */""";

    @Test
    void anchorsByLineOfPreviousToken() {
        SyntaxTree tree = SyntaxParser.parse(SOURCE, "typescript");
        CommentStore store = CommentStore.build(tree);

        int semicolonEnd = SOURCE.indexOf(';') + 1;
        assertEquals(List.of("// tail"), texts(store.trailing(semicolonEnd)));
        assertEquals(List.of("// lead"), texts(store.leading(SOURCE.indexOf("function"))));
        assertEquals(List.of("/* eof */"), texts(store.leading(SOURCE.length())));
        assertTrue(store.leading(0).isEmpty());
    }

    @Test
    void allIsInSourceOrder() {
        SyntaxTree tree = SyntaxParser.parse(SOURCE, "typescript");
        CommentStore store = CommentStore.build(tree);
        assertEquals(List.of("// tail", "// lead", "/* eof */"), texts(store.all()));
    }

    @Test
    void consecutiveCommentsShareAnchor() {
        String source = "// one\n// two\nlet x = 1;";
        CommentStore store = CommentStore.build(SyntaxParser.parse(source, "typescript"));
        assertEquals(List.of("// one", "// two"), texts(store.leading(source.indexOf("let"))));
    }

    @Test
    void manualAnchors() {
        CommentStore store = new CommentStore();
        Comment comment = Comment.of("// x", 0);
        store.addTrailing(5, comment);
        assertEquals(List.of(comment), store.trailing(5));
        assertThrows(UnsupportedOperationException.class, () -> store.trailing(5).clear(),
                "Returned lists are copies");
    }

    private static List<String> texts(List<Comment> comments) {
        return comments.stream().map(Comment::text).toList();
    }
}
