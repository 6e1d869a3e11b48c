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
package ru.nts.tools.tsfmt.reinsert;

import org.junit.jupiter.api.Test;
import ru.nts.tools.tsfmt.comments.CommentRole;
import ru.nts.tools.tsfmt.comments.ExtractedComment;
import ru.nts.tools.tsfmt.comments.ExtractionResult;
import ru.nts.tools.tsfmt.comments.StandaloneComment;
import ru.nts.tools.tsfmt.core.TsfmtErrorCode;
import ru.nts.tools.tsfmt.identity.IdentityWalker;
import ru.nts.tools.tsfmt.identity.NodeIdentity;
import ru.nts.tools.tsfmt.position.PositionRecoverer;
import ru.nts.tools.tsfmt.syntax.Comment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommentReinserterTest {

    private static final NodeIdentity FOO = NodeIdentity.of("fn", "foo():");

    private static ExtractedComment comment(NodeIdentity owner, CommentRole role, String text, int ordinal) {
        return new ExtractedComment(owner, role, Comment.of(text, 0), ordinal, "");
    }

    private static StandaloneComment standalone(String text, int line, int slot) {
        return new StandaloneComment(Comment.of(text, line * 10), line, 0, IdentityWalker.PROGRAM_GROUP, slot, "");
    }

    private static String reinsert(String skeleton, Map<NodeIdentity, List<ExtractedComment>> attached,
                                   List<StandaloneComment> standalone) {
        ExtractionResult extraction = new ExtractionResult(attached, standalone);
        return CommentReinserter.reinsert(extraction, skeleton, PositionRecoverer.recover(skeleton, "typescript"));
    }

    @Test
    void leadingCommentGoesAboveOwner() {
        String result = reinsert("function foo() {}",
                Map.of(FOO, List.of(comment(FOO, CommentRole.LEADING, "// lead", 0))), List.of());
        assertEquals("// lead\nfunction foo() {}", result);
    }

    @Test
    void leadingCommentsKeepOrdinalOrder() {
        String result = reinsert("function foo() {}", Map.of(FOO, List.of(
                comment(FOO, CommentRole.LEADING, "// one", 0),
                comment(FOO, CommentRole.LEADING, "// two", 1))), List.of());
        assertEquals("// one\n// two\nfunction foo() {}", result);
    }

    @Test
    void leadingCommentShiftsUpWhenTwoLinesAboveIsBlank() {
        String result = reinsert("a();\n\nb();\nfunction foo() {}",
                Map.of(FOO, List.of(comment(FOO, CommentRole.LEADING, "// lead", 0))), List.of());
        assertEquals("a();\n\n// lead\nb();\nfunction foo() {}", result);
    }

    @Test
    void leadingCommentStaysBelowBlankLine() {
        String result = reinsert("a();\n\nfunction foo() {}",
                Map.of(FOO, List.of(comment(FOO, CommentRole.LEADING, "// lead", 0))), List.of());
        assertEquals("a();\n\n// lead\nfunction foo() {}", result);
    }

    @Test
    void noShiftWithoutBlankLineTwoAbove() {
        String result = reinsert("// keep\nfunction foo() {}",
                Map.of(FOO, List.of(comment(FOO, CommentRole.LEADING, "// lead", 0))), List.of());
        assertEquals("// keep\n// lead\nfunction foo() {}", result);

        String chained = reinsert("a();\nb();\nfunction foo() {}",
                Map.of(FOO, List.of(comment(FOO, CommentRole.LEADING, "// lead", 0))), List.of());
        assertEquals("a();\nb();\n// lead\nfunction foo() {}", chained);
    }

    @Test
    void trailingCommentFollowsEffectiveEnd() {
        NodeIdentity x = NodeIdentity.of("var", "const x");
        String result = reinsert("const x = 1;\nconst y = 2;",
                Map.of(x, List.of(comment(x, CommentRole.TRAILING, "// answer", 0))), List.of());
        assertEquals("const x = 1; // answer\nconst y = 2;", result);
    }

    @Test
    void lineCommentNeverPrecedesCode() {
        NodeIdentity a = NodeIdentity.of("prop", "var:const o|#0.a");
        String skeleton = "const o = { a: 1, b: 2 };";

        String line = reinsert(skeleton, Map.of(a, List.of(comment(a, CommentRole.TRAILING, "// about a", 0))), List.of());
        assertEquals("const o = { a: 1, b: 2 }; // about a", line);

        String block = reinsert(skeleton, Map.of(a, List.of(comment(a, CommentRole.TRAILING, "/* a */", 0))), List.of());
        assertEquals("const o = { a: 1, /* a */ b: 2 };", block);
    }

    @Test
    void leadingCommentTakesMemberIndent() {
        NodeIdentity m = NodeIdentity.of("member", "class:A.method m():");
        String result = reinsert("class A {\n  m() {}\n}",
                Map.of(m, List.of(comment(m, CommentRole.LEADING, "/**\n * doc\n */", 0))), List.of());
        assertEquals("class A {\n  /**\n   * doc\n   */\n  m() {}\n}", result);
    }

    @Test
    void standaloneCommentBeforeSlotNode() {
        String result = reinsert("a();\nb();", Map.of(), List.of(standalone("// note", 2, 1)));
        assertEquals("a();\n\n// note\n\nb();", result);
    }

    @Test
    void standaloneCommentAfterLastNode() {
        String result = reinsert("a();\nb();", Map.of(), List.of(standalone("// end", 5, 2)));
        assertEquals("a();\nb();\n\n// end\n", result);
    }

    @Test
    void standaloneBlockKeepsAdjacency() {
        String adjacent = reinsert("a();", Map.of(), List.of(standalone("// one", 2, 0), standalone("// two", 3, 0)));
        assertEquals("\n// one\n// two\n\na();", adjacent);

        String apart = reinsert("a();", Map.of(), List.of(standalone("// one", 2, 0), standalone("// two", 5, 0)));
        assertEquals("\n// one\n\n// two\n\na();", apart);
    }

    @Test
    void allMissingOwnersAreReported() {
        NodeIdentity gone = NodeIdentity.of("fn", "gone():");
        NodeIdentity lost = NodeIdentity.of("class", "Lost");
        Map<NodeIdentity, List<ExtractedComment>> attached = new LinkedHashMap<>();
        attached.put(gone, List.of(comment(gone, CommentRole.LEADING, "// a", 0)));
        attached.put(lost, List.of(comment(lost, CommentRole.TRAILING, "// b", 0)));

        MissingPositionException e = assertThrows(MissingPositionException.class,
                () -> reinsert("x();", attached, List.of()));
        assertEquals(TsfmtErrorCode.MISSING_POSITION, e.getCode());
        assertEquals(List.of(gone, lost), e.getMissing());
        assertEquals(2, e.getContext().get("count"));
        assertEquals("fn:gone():, class:Lost", e.getContext().get("missing"));
    }
}
