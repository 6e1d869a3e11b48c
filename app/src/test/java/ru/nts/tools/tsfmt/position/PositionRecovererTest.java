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
package ru.nts.tools.tsfmt.position;

import org.junit.jupiter.api.Test;
import ru.nts.tools.tsfmt.identity.IdentityWalker;
import ru.nts.tools.tsfmt.identity.NodeIdentity;

import static org.junit.jupiter.api.Assertions.*;

class PositionRecovererTest {

    @Test
    void findsDeclarationsAndMembers() {
        String skeleton = "const a = 1;\n\nclass A {\n  m() {}\n}";
        PositionIndex index = PositionRecoverer.recover(skeleton, "typescript");

        NodePosition a = index.find(NodeIdentity.of("var", "const a")).orElseThrow();
        assertEquals(0, a.startLine());
        assertEquals(0, a.endLine());
        assertEquals(12, a.endColumn());

        NodePosition cls = index.find(NodeIdentity.of("class", "A")).orElseThrow();
        assertEquals(2, cls.startLine());
        assertEquals(4, cls.endLine());

        NodePosition m = index.find(NodeIdentity.of("member", "class:A.method m():")).orElseThrow();
        assertEquals(3, m.startLine());
        assertEquals("  ", m.indentation());
        assertEquals(8, m.endColumn());

        assertEquals(2, index.group(IdentityWalker.PROGRAM_GROUP).size());
        assertEquals(1, index.group("class:A").size());
        assertEquals(5, index.lineCount());
    }

    @Test
    void propertyEndIncludesComma() {
        String skeleton = "const o = {\n  a: 1,\n  b: 2\n};";
        PositionIndex index = PositionRecoverer.recover(skeleton, "typescript");

        NodePosition a = index.find(NodeIdentity.of("prop", "var:const o|#0.a")).orElseThrow();
        assertEquals(1, a.startLine());
        assertEquals(7, a.endColumn());
    }

    @Test
    void firstOccurrenceWins() {
        String skeleton = "function f(): void;\nfunction f(): void;\nfunction f(): void {}";
        PositionIndex index = PositionRecoverer.recover(skeleton, "typescript");

        NodePosition f = index.find(NodeIdentity.of("fn", "f():void")).orElseThrow();
        assertEquals(0, f.startLine());
        assertEquals(3, index.group(IdentityWalker.PROGRAM_GROUP).size());
    }

    @Test
    void unknownIdentityIsMissing() {
        PositionIndex index = PositionRecoverer.recover("x();", "typescript");
        assertFalse(index.contains(NodeIdentity.of("fn", "gone():")));
        assertTrue(index.find(NodeIdentity.of("fn", "gone():")).isEmpty());
        assertTrue(index.group("nope").isEmpty());
    }
}
