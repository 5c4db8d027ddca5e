package org.dxworks.mdframe.parser.block;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HtmlBlockClassifierTest {

    @Test
    void classifyStart_RulesInOrder() {
        assertEquals(HtmlBlockRule.RAW_TEXT, HtmlBlockClassifier.classifyStart("<script>", false));
        assertEquals(HtmlBlockRule.RAW_TEXT, HtmlBlockClassifier.classifyStart("<PRE class='x'>", false));
        assertEquals(HtmlBlockRule.COMMENT, HtmlBlockClassifier.classifyStart("<!-- note", false));
        assertEquals(HtmlBlockRule.PROCESSING_INSTRUCTION, HtmlBlockClassifier.classifyStart("<?php echo 1;", false));
        assertEquals(HtmlBlockRule.DECLARATION, HtmlBlockClassifier.classifyStart("<!DOCTYPE html>", false));
        assertEquals(HtmlBlockRule.CDATA, HtmlBlockClassifier.classifyStart("<![CDATA[", false));
        assertEquals(HtmlBlockRule.BLOCK_TAG, HtmlBlockClassifier.classifyStart("<div>", false));
        assertEquals(HtmlBlockRule.BLOCK_TAG, HtmlBlockClassifier.classifyStart("</table>", false));
        assertEquals(HtmlBlockRule.GENERIC_TAG, HtmlBlockClassifier.classifyStart("<custom-tag attr=\"1\">", false));
        assertEquals(HtmlBlockRule.GENERIC_TAG, HtmlBlockClassifier.classifyStart("</span>  ", false));
    }

    @Test
    void classifyStart_NotHtml() {
        assertNull(HtmlBlockClassifier.classifyStart("plain", false));
        assertNull(HtmlBlockClassifier.classifyStart("<a href=\"x\">text", false));
        assertNull(HtmlBlockClassifier.classifyStart("<divider", false));
    }

    @Test
    void classifyStart_GenericTagCannotInterruptParagraph() {
        assertNull(HtmlBlockClassifier.classifyStart("<span>", true));
        assertEquals(HtmlBlockRule.BLOCK_TAG, HtmlBlockClassifier.classifyStart("<div>", true));
        assertEquals(HtmlBlockRule.COMMENT, HtmlBlockClassifier.classifyStart("<!-- c -->", true));
    }

    @Test
    void endsOnLine() {
        assertTrue(HtmlBlockClassifier.endsOnLine(HtmlBlockRule.RAW_TEXT, "x = 1;</script>"));
        assertTrue(HtmlBlockClassifier.endsOnLine(HtmlBlockRule.COMMENT, "end -->"));
        assertTrue(HtmlBlockClassifier.endsOnLine(HtmlBlockRule.CDATA, "]]>"));
        assertFalse(HtmlBlockClassifier.endsOnLine(HtmlBlockRule.COMMENT, "still open"));
        assertFalse(HtmlBlockClassifier.endsOnLine(HtmlBlockRule.BLOCK_TAG, "</div>"));
        assertTrue(HtmlBlockRule.BLOCK_TAG.endsAtBlankLine());
        assertFalse(HtmlBlockRule.RAW_TEXT.endsAtBlankLine());
    }
}
