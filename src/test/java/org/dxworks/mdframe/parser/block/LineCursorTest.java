package org.dxworks.mdframe.parser.block;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LineCursorTest {

    @Test
    void findNextNonspace_ExpandsTabsToNextStop() {
        LineCursor cursor = new LineCursor(" \tfoo");

        assertEquals(4, cursor.indent());
        assertTrue(cursor.isIndented());
        assertEquals('f', cursor.peekNonspace());
        assertEquals("foo", cursor.restFromNonspace());
    }

    @Test
    void advanceOffset_PartiallyConsumedTabLeavesSpaces() {
        LineCursor cursor = new LineCursor(">\t\tfoo");
        cursor.advanceOffset(1, false);
        cursor.advanceOffset(1, true);

        assertEquals(2, cursor.column());
        assertEquals("  \tfoo", cursor.remainder());
    }

    @Test
    void blankLine() {
        LineCursor cursor = new LineCursor("  \t ");

        assertTrue(cursor.isBlank());
        assertEquals('\0', cursor.peekNonspace());
    }

    @Test
    void copy_IsIndependent() {
        LineCursor cursor = new LineCursor("  abc");
        LineCursor copy = cursor.copy();
        copy.advanceNextNonspace();
        copy.advanceOffset(1, false);

        assertEquals(0, cursor.offset());
        assertEquals("bc", copy.remainder());
    }
}
