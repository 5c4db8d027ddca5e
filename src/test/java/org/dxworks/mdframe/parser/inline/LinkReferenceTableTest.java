package org.dxworks.mdframe.parser.inline;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LinkReferenceTableTest {

    @Test
    void normalizeLabel_CollapsesWhitespaceAndFoldsCase() {
        assertEquals("FOO BAR", LinkReferenceTable.normalizeLabel("  Foo \n\t bar "));
        assertEquals(LinkReferenceTable.normalizeLabel("SS"), LinkReferenceTable.normalizeLabel("\u00DF"));
    }

    @Test
    void define_FirstDefinitionWins() {
        LinkReferenceTable table = new LinkReferenceTable();

        assertTrue(table.define("Foo", "/first", null));
        assertFalse(table.define("FOO", "/second", "ignored"));
        assertEquals(1, table.size());
        assertEquals("/first", table.lookup("foo").orElseThrow().destination());
    }

    @Test
    void define_RejectsBlankLabel() {
        LinkReferenceTable table = new LinkReferenceTable();

        assertFalse(table.define("  ", "/x", null));
        assertEquals(0, table.size());
        assertTrue(table.lookup("missing").isEmpty());
    }
}
