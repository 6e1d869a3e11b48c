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

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InsertionPointTest {

    @Test
    void reindentMovesContinuationLines() {
        String text = "/*\n      a\n\n      */";
        assertEquals("  /*\n  a\n\n  */", InsertionPoint.reindent(text, "      ", "  ", true));
    }

    @Test
    void reindentKeepsForeignIndent() {
        assertEquals("/*\n x */", InsertionPoint.reindent("/*\n x */", "    ", "", false));
    }

    @Test
    void renderByKind() {
        assertEquals(" // t", new InsertionPoint(InsertionPoint.Kind.TRAILING, 0, 0, "// t", "    ", 0, "").render());
        assertEquals("  // l", new InsertionPoint(InsertionPoint.Kind.LEADING, 0, 0, "// l", "  ", 0, "").render());
        assertEquals("\n// s\n", new InsertionPoint(InsertionPoint.Kind.STANDALONE, 0, 0, "// s", "", 0, "").render());
    }

    @Test
    void applyOrderIsBottomUp() {
        InsertionPoint top = new InsertionPoint(InsertionPoint.Kind.LEADING, 0, 0, "a", "", 0, "");
        InsertionPoint bottom = new InsertionPoint(InsertionPoint.Kind.LEADING, 5, 0, "b", "", 0, "");
        InsertionPoint standalone = new InsertionPoint(InsertionPoint.Kind.STANDALONE, 5, 0, "c", "", 0, "");
        InsertionPoint second = new InsertionPoint(InsertionPoint.Kind.LEADING, 5, 0, "d", "", 1, "");

        List<InsertionPoint> points = new ArrayList<>(List.of(top, standalone, bottom, second));
        points.sort(InsertionPoint.APPLY_ORDER);
        assertEquals(List.of(second, bottom, standalone, top), points);
    }
}
