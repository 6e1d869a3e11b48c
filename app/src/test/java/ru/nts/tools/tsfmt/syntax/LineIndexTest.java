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

import static org.junit.jupiter.api.Assertions.*;

class LineIndexTest {

    private final String text = "const a = 1;\n\n  // note\nb();";
    private final LineIndex lines = new LineIndex(text);

    @Test
    void linesAndColumns() {
        assertEquals(4, lines.lineCount());
        assertEquals(0, lines.lineOf(0));
        assertEquals(0, lines.lineOf(12), "Newline belongs to its line");
        assertEquals(1, lines.lineOf(13));
        assertEquals(2, lines.lineOf(text.indexOf("//")));
        assertEquals(2, lines.columnOf(text.indexOf("//")));
        assertEquals(3, lines.lineOf(text.length()));
    }

    @Test
    void lineBoundaries() {
        assertEquals(0, lines.lineStart(0));
        assertEquals(12, lines.lineEnd(0));
        assertEquals("  // note", lines.lineText(2));
        assertEquals("b();", lines.lineText(3));
        assertEquals(text.length(), lines.lineEnd(3));
    }

    @Test
    void blankLines() {
        assertTrue(lines.isBlank(1));
        assertFalse(lines.isBlank(2));
        assertTrue(lines.isBlank(-1), "Before the first line counts as blank");
        assertTrue(lines.isBlank(4), "After the last line counts as blank");
        assertTrue(lines.hasBlankLineBetween(0, text.indexOf("//")));
        assertFalse(lines.hasBlankLineBetween(text.indexOf("//"), text.indexOf("b();")));
    }

    @Test
    void indentationAndBreaks() {
        assertEquals("  ", lines.indentation(2));
        assertEquals("", lines.indentation(0));
        assertTrue(lines.hasLineBreak(0, 14));
        assertFalse(lines.hasLineBreak(0, 12));
    }

    @Test
    void emptyText() {
        LineIndex empty = new LineIndex("");
        assertEquals(1, empty.lineCount());
        assertEquals("", empty.lineText(0));
        assertTrue(empty.isBlank(0));
    }
}
