package org.dxworks.mdframe.export;

import org.dxworks.mdframe.MarkdownParser;
import org.dxworks.mdframe.MdframeConfig;
import org.dxworks.mdframe.TestUtils;
import org.dxworks.mdframe.model.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkdownSerializerTest {

    private final MarkdownSerializer serializer = new MarkdownSerializer();
    private final TreeJsonExporter exporter = new TreeJsonExporter();
    private final MarkdownParser withoutBlankLines = MarkdownParser.withConfig(MdframeConfig.with(true, false, 64, 1));

    private String roundTrip(String markdown) {
        return serializer.serialize(TestUtils.parse(markdown));
    }

    @Test
    void serialize_EmptyDocument() {
        assertEquals("", roundTrip(""));
    }

    @Test
    void serialize_HeadingAndParagraph() {
        assertEquals("# Title\n\nSome *text* here.\n", roundTrip("# Title\n\nSome *text* here.\n"));
    }

    @Test
    void serialize_TightAndLooseLists() {
        assertEquals("- a\n- b\n", roundTrip("- a\n- b\n"));
        assertEquals("1. a\n\n2. b\n", roundTrip("1. a\n\n2. b\n"));
    }

    @Test
    void serialize_FencedCode() {
        assertEquals("```java\nint x;\n```\n", roundTrip("```java\nint x;\n```\n"));
        assertEquals("~~~~\nopen\n", roundTrip("~~~~\nopen\n"));
    }

    @Test
    void serialize_SetextAndThematicBreak() {
        assertEquals("Title\n---\n\n* * *\n", roundTrip("Title\n-----\n\n***\n"));
    }

    @Test
    void serialize_TableEscapesPipes() {
        String table = "| a | b |\n| --- | :-: |\n| x \\| y | z |\n";

        assertEquals(table, roundTrip(table));
    }

    @Test
    void serialize_SeparatesBlocksWhenBlankLinesAreExcluded() {
        assertEquals("a\n\nb\n", serializer.serialize(withoutBlankLines.parse("a\n\nb\n")));
        assertEquals("> q\n\np\n", serializer.serialize(withoutBlankLines.parse("> q\n\np\n")));
        assertEquals("- a\n\n      code\n", serializer.serialize(withoutBlankLines.parse("- a\n\n      code\n")));
    }

    @Test
    void serialize_KeepsLinkForms() {
        String markdown = "[a](/u \"t\") [b][ref] [ref][] [ref] ![i](<x y>)\n\n[ref]: /r\n";

        assertEquals(markdown, roundTrip(markdown));
    }

    @Test
    void renderCodeSpan_ChoosesFenceAndPadding() {
        assertEquals("`plain`", MarkdownSerializer.renderCodeSpan("plain"));
        assertEquals("``a`b``", MarkdownSerializer.renderCodeSpan("a`b"));
        assertEquals("`` `x ``", MarkdownSerializer.renderCodeSpan("`x"));
        assertEquals("`  a  `", MarkdownSerializer.renderCodeSpan(" a "));
        assertEquals("`  `", MarkdownSerializer.renderCodeSpan("  "));
    }

    @Test
    void renderDestination_BracketsWhenNeeded() {
        assertEquals("/a(b)", MarkdownSerializer.renderDestination("/a(b)"));
        assertEquals("</a((b))>", MarkdownSerializer.renderDestination("/a((b))"));
        assertEquals("<>", MarkdownSerializer.renderDestination(""));
        assertEquals("<a b>", MarkdownSerializer.renderDestination("a b"));
        assertEquals("a\\\\b\\&c", MarkdownSerializer.renderDestination("a\\b&c"));
    }

    @Test
    void renderTitle_EscapesQuotes() {
        assertEquals("\"say \\\"hi\\\"\"", MarkdownSerializer.renderTitle("say \"hi\""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Basic.md", "Nested.md"})
    void serialize_ReparsesToSameStructure(String sample) throws IOException {
        Document original = TestUtils.parse(TestUtils.readSample(sample));
        Document reparsed = TestUtils.parse(serializer.serialize(original));

        assertEquals(exporter.toStructuralJson(original), exporter.toStructuralJson(reparsed));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "> foo\n-\n",
            "foo\n    # bar\n",
            "foo\n    1. bar\n",
            "a|b\n    |---|\n",
            "foo\n    ```\nbar\n",
            "~~~ ~~~\nx\n~~~\n",
            "a\\ \nb\n",
            "- ```\n]\n",
            "> - ~~~\n> x\n\ny\n",
            "# a # #\n",
            "# ## #\n",
            "*\n  ***\n",
            "[a]: /u\nfoo\n"
    })
    void serialize_EdgeCasesReparseToSameStructure(String markdown) {
        Document original = TestUtils.parse(markdown);
        Document reparsed = TestUtils.parse(serializer.serialize(original));

        assertEquals(exporter.toStructuralJson(original), exporter.toStructuralJson(reparsed));
    }

    @Test
    void serialize_IndentsContinuationLinesThatCouldOpenBlocks() {
        assertEquals("foo\n    # bar\n", roundTrip("foo\n    # bar\n"));
        assertEquals("foo\nbar\n", roundTrip("foo\n  bar\n"));
    }

    @Test
    void serialize_SpacesInfoThatStartsWithFenceChar() {
        assertEquals("~~~ ~~~\nx\n~~~\n", roundTrip("~~~ ~~~\nx\n~~~\n"));
        assertEquals("```java\n```\n", roundTrip("``` java\n```\n"));
    }

    @Test
    void serialize_NoSeparatorAfterUnclosedFence() {
        String markdown = serializer.serialize(withoutBlankLines.parse("- ```\n]\n"));

        assertEquals("- ```\n]\n", markdown);
    }

    @Test
    void serialize_SeparatesDefinitionFromQuotedParagraph() {
        Document original = withoutBlankLines.parse("[a]: /u\n\n\"t\"\n");
        String markdown = serializer.serialize(original);

        assertTrue(markdown.startsWith("[a]: /u\n\n"));
        assertEquals(exporter.toStructuralJson(original), exporter.toStructuralJson(withoutBlankLines.parse(markdown)));
    }
}
