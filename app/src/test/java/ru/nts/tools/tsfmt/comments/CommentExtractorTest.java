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
package ru.nts.tools.tsfmt.comments;

import org.junit.jupiter.api.Test;
import ru.nts.tools.tsfmt.identity.IdentifiedNode;
import ru.nts.tools.tsfmt.identity.IdentityWalker;
import ru.nts.tools.tsfmt.identity.NodeIdentity;
import ru.nts.tools.tsfmt.syntax.Comment;
import ru.nts.tools.tsfmt.syntax.CommentStore;
import ru.nts.tools.tsfmt.syntax.SyntaxParser;
import ru.nts.tools.tsfmt.syntax.SyntaxTree;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommentExtractorTest {

    private static SyntaxTree parse(String source) {
        SyntaxTree tree = SyntaxParser.parse(source, "typescript");
        assertFalse(tree.hasErrors());
        return tree;
    }

    private static ExtractionResult extract(String source) {
        SyntaxTree tree = parse(source);
        return CommentExtractor.extract(tree, CommentStore.build(tree));
    }

    private static NodeIdentity identityAt(SyntaxTree tree, int index) {
        return IdentityWalker.walk(tree).get(index).identity();
    }

    @Test
    void leadingCommentBelongsToNextDeclaration() {
        String source = "// lead\nfunction foo() {}";
        SyntaxTree tree = parse(source);
        ExtractionResult result = CommentExtractor.extract(tree, CommentStore.build(tree));

        List<ExtractedComment> comments = result.byIdentity().get(identityAt(tree, 0));
        assertEquals(1, comments.size());
        assertEquals(CommentRole.LEADING, comments.get(0).role());
        assertEquals("// lead", comments.get(0).comment().text());
        assertEquals(0, comments.get(0).ordinal());
        assertTrue(result.standalone().isEmpty());
    }

    @Test
    void trailingCommentOnSameLine() {
        String source = "const x = 1; // answer\nconst y = 2;";
        SyntaxTree tree = parse(source);
        ExtractionResult result = CommentExtractor.extract(tree, CommentStore.build(tree));

        List<ExtractedComment> comments = result.byIdentity().get(identityAt(tree, 0));
        assertEquals(CommentRole.TRAILING, comments.get(0).role());
        assertNull(result.byIdentity().get(identityAt(tree, 1)));
    }

    @Test
    void consecutiveLeadingCommentsGetOrdinals() {
        String source = "// one\n// two\nfunction f() {}";
        SyntaxTree tree = parse(source);
        ExtractionResult result = CommentExtractor.extract(tree, CommentStore.build(tree));

        List<ExtractedComment> comments = result.byIdentity().get(identityAt(tree, 0));
        assertEquals(List.of("// one", "// two"), comments.stream().map(c -> c.comment().text()).toList());
        assertEquals(List.of(0, 1), comments.stream().map(ExtractedComment::ordinal).toList());
        assertEquals(2, result.extractedCount());
    }

    @Test
    void detachedTrailingCommentMovesToNextSibling() {
        String source = "a();\n// about b\nb();";
        SyntaxTree tree = parse(source);
        List<IdentifiedNode> nodes = IdentityWalker.walk(tree);
        Comment comment = tree.comments().get(0);

        // Хранилище, привязавшее комментарий к концу a()
        CommentStore store = new CommentStore();
        store.addTrailing(nodes.get(0).effectiveEnd(), comment);

        ExtractionResult result = CommentExtractor.extract(tree, store);
        assertNull(result.byIdentity().get(nodes.get(0).identity()));
        List<ExtractedComment> onB = result.byIdentity().get(nodes.get(1).identity());
        assertEquals(1, onB.size());
        assertEquals(CommentRole.LEADING, onB.get(0).role());
        assertEquals("// about b", onB.get(0).comment().text());
    }

    @Test
    void lineSeparatedCommentIsLeadingOfNextStatement() {
        String source = "a();\n\n// note\nb();";
        SyntaxTree tree = parse(source);
        List<IdentifiedNode> nodes = IdentityWalker.walk(tree);
        CommentStore store = CommentStore.build(tree);

        // Хранилище не привязывает комментарий с другой строки к концу a()
        assertTrue(store.trailing(nodes.get(0).node().end()).isEmpty());
        assertTrue(store.trailing(nodes.get(0).effectiveEnd()).isEmpty());

        ExtractionResult result = CommentExtractor.extract(tree, store);
        assertNull(result.byIdentity().get(nodes.get(0).identity()));
        List<ExtractedComment> onB = result.byIdentity().get(nodes.get(1).identity());
        assertEquals(1, onB.size());
        assertEquals(CommentRole.LEADING, onB.get(0).role());
        assertEquals("// note", onB.get(0).comment().text());
    }

    @Test
    void isolatedCommentIsStandalone() {
        ExtractionResult result = extract("a();\n\n// alone\n\nb();");

        assertTrue(result.byIdentity().isEmpty());
        assertEquals(1, result.standalone().size());
        StandaloneComment standalone = result.standalone().get(0);
        assertEquals("// alone", standalone.comment().text());
        assertEquals(IdentityWalker.PROGRAM_GROUP, standalone.group());
        assertEquals(1, standalone.slot());
        assertEquals(2, standalone.originalLine());
        assertEquals(0, standalone.depth());
    }

    @Test
    void fileHeaderStaysAtTop() {
        ExtractionResult result = extract("// Copyright\n// License\n\nfunction f() {}");

        assertTrue(result.byIdentity().isEmpty());
        assertEquals(2, result.standalone().size());
        for (StandaloneComment comment : result.standalone()) {
            assertEquals(0, comment.slot());
            assertEquals(IdentityWalker.PROGRAM_GROUP, comment.group());
        }
    }

    @Test
    void commentsAtEndOfFileAreStandalone() {
        ExtractionResult result = extract("f();\n// end\n");

        assertEquals(1, result.standalone().size());
        assertEquals(1, result.standalone().get(0).slot());
        assertEquals(1, result.standalone().get(0).originalLine());
    }

    @Test
    void inlineCommentsAreNotExtracted() {
        ExtractionResult result = extract("foo(/* a */ 1);");
        assertTrue(result.byIdentity().isEmpty());
        assertTrue(result.standalone().isEmpty());
        assertTrue(result.movedComments().isEmpty());
    }

    @Test
    void memberCommentsKeepTheirIndent() {
        String source = """
                class A {
                  // about m
                  m() {}
                }
                """;
        SyntaxTree tree = parse(source);
        ExtractionResult result = CommentExtractor.extract(tree, CommentStore.build(tree));

        NodeIdentity member = identityAt(tree, 1);
        assertEquals("member:class:A.method m():", member.label());
        ExtractedComment comment = result.byIdentity().get(member).get(0);
        assertEquals("  ", comment.originalIndent());
        assertEquals(1, result.movedComments().size());
    }
}
