package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.MdframeConfig;
import org.dxworks.mdframe.model.*;
import org.dxworks.mdframe.model.inline.*;
import org.dxworks.mdframe.parser.inline.JsoupEntityTable;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BlockParserTest {

    private static Document parse(String markdown) {
        return parse(markdown, MdframeConfig.defaults());
    }

    private static Document parse(String markdown, MdframeConfig config) {
        return new BlockParser(config, JsoupEntityTable.INSTANCE).parse(markdown);
    }

    private static <T extends Block> T child(List<Block> blocks, int index, Class<T> type) {
        Block block = blocks.get(index);
        assertInstanceOf(type, block, "unexpected block at " + index + ": " + block);
        return type.cast(block);
    }

    @Test
    void parse_EmptyInput() {
        Document document = parse("");
        assertTrue(document.children().isEmpty());
    }

    @Test
    void parse_LazyParagraphContinuationInBlockQuote() {
        Document document = parse("> foo\nbar\n");

        assertEquals(1, document.children().size());
        BlockQuote quote = child(document.children(), 0, BlockQuote.class);
        assertEquals(1, quote.startLine());
        assertEquals(2, quote.endLine());
        assertEquals(1, quote.children().size());
        Paragraph paragraph = child(quote.children(), 0, Paragraph.class);
        assertEquals(1, paragraph.startLine());
        assertEquals(2, paragraph.endLine());
        assertEquals(List.of(new Text("foo"), new SoftLineBreak(), new Text("bar")), paragraph.content());
    }

    @Test
    void parse_HeadingInterruptsLazyContinuation() {
        Document document = parse("> foo\n# bar\n");

        assertEquals(2, document.children().size());
        BlockQuote quote = child(document.children(), 0, BlockQuote.class);
        assertEquals(1, quote.endLine());
        AtxHeading heading = child(document.children(), 1, AtxHeading.class);
        assertEquals(1, heading.level());
        assertEquals(2, heading.startLine());
        assertEquals(List.of(new Text("bar")), heading.content());
    }

    @Test
    void parse_ChangingBulletStartsNewList() {
        Document document = parse("- a\n* b\n");

        assertEquals(2, document.children().size());
        assertEquals(ListMarkerKind.MINUS, child(document.children(), 0, ListBlock.class).markerKind());
        assertEquals(ListMarkerKind.STAR, child(document.children(), 1, ListBlock.class).markerKind());
    }

    @Test
    void parse_SetextUnderlineVersusThematicBreak() {
        Document heading = parse("foo\n---\n");
        assertEquals(1, heading.children().size());
        SetextHeading setext = child(heading.children(), 0, SetextHeading.class);
        assertEquals(2, setext.level());
        assertEquals(1, setext.startLine());
        assertEquals(2, setext.endLine());

        Document spaced = parse("foo\n- - -\n");
        assertEquals(2, spaced.children().size());
        child(spaced.children(), 0, Paragraph.class);
        ThematicBreak thematicBreak = child(spaced.children(), 1, ThematicBreak.class);
        assertEquals('-', thematicBreak.marker());
    }

    @Test
    void parse_SetextHeadingLevelOne() {
        Document document = parse("Title\nspans lines\n===\n");

        SetextHeading heading = child(document.children(), 0, SetextHeading.class);
        assertEquals(1, heading.level());
        assertEquals(List.of(new Text("Title"), new SoftLineBreak(), new Text("spans lines")), heading.content());
    }

    @Test
    void parse_AtxHeadings() {
        Document document = parse("# Title #\n###### six\n####### seven\n#5 bolt\n#\n");

        AtxHeading first = child(document.children(), 0, AtxHeading.class);
        assertEquals(1, first.level());
        assertEquals(List.of(new Text("Title")), first.content());
        assertEquals(6, child(document.children(), 1, AtxHeading.class).level());
        Paragraph paragraph = child(document.children(), 2, Paragraph.class);
        assertEquals(List.of(new Text("####### seven"), new SoftLineBreak(), new Text("#5 bolt")), paragraph.content());
        AtxHeading empty = child(document.children(), 3, AtxHeading.class);
        assertTrue(empty.content().isEmpty());
    }

    @Test
    void parse_TightAndLooseLists() {
        ListBlock tight = child(parse("- a\n- b\n").children(), 0, ListBlock.class);
        assertTrue(tight.tight());
        assertEquals(2, tight.items().size());
        assertNull(tight.start());

        ListBlock loose = child(parse("- a\n\n- b\n").children(), 0, ListBlock.class);
        assertFalse(loose.tight());
        assertEquals(2, loose.items().size());

        ListBlock trailingBlank = child(parse("- a\n- b\n\n").children(), 0, ListBlock.class);
        assertTrue(trailingBlank.tight());
    }

    @Test
    void parse_OrderedList() {
        ListBlock list = child(parse("1. one\n2. two\n").children(), 0, ListBlock.class);

        assertEquals(ListMarkerKind.DOT, list.markerKind());
        assertEquals(1, list.start());
        assertEquals(1, list.items().get(0).number());
        assertEquals(2, list.items().get(1).number());
        assertEquals(3, list.items().get(0).contentIndent());
        assertEquals(0, list.items().get(0).markerIndent());
    }

    @Test
    void parse_OrderedListNotStartingAtOneDoesNotInterruptParagraph() {
        Document document = parse("foo\n2. bar\n");

        assertEquals(1, document.children().size());
        Paragraph paragraph = child(document.children(), 0, Paragraph.class);
        assertEquals(2, paragraph.endLine());
    }

    @Test
    void parse_ListItemWithLazyContinuationAndNestedBlocks() {
        Document document = parse("- a\nb\n\n  > quoted\n");

        ListBlock list = child(document.children(), 0, ListBlock.class);
        ListItem item = list.items().get(0);
        Paragraph paragraph = child(item.children(), 0, Paragraph.class);
        assertEquals(List.of(new Text("a"), new SoftLineBreak(), new Text("b")), paragraph.content());
        child(item.children(), 1, BlankLine.class);
        child(item.children(), 2, BlockQuote.class);
        assertEquals(4, item.endLine());
    }

    @Test
    void parse_EmptyListItemEndsAtBlankLine() {
        Document document = parse("-\n\n  foo\n");

        assertEquals(3, document.children().size());
        ListBlock list = child(document.children(), 0, ListBlock.class);
        assertTrue(list.items().get(0).children().isEmpty());
        child(document.children(), 1, BlankLine.class);
        child(document.children(), 2, Paragraph.class);
    }

    @Test
    void parse_FencedCode() {
        Document document = parse("```java extra\nint x;\n\n```\nafter\n");

        FencedCodeBlock code = child(document.children(), 0, FencedCodeBlock.class);
        assertEquals('`', code.fenceChar());
        assertEquals(3, code.fenceLength());
        assertEquals("java extra", code.info());
        assertEquals("int x;\n\n", code.literal());
        assertTrue(code.closed());
        assertEquals(1, code.startLine());
        assertEquals(4, code.endLine());
        child(document.children(), 1, Paragraph.class);
    }

    @Test
    void parse_UnclosedFenceRunsToEndOfContainer() {
        Document document = parse("> ~~~~\n> code\n\nafter\n");

        BlockQuote quote = child(document.children(), 0, BlockQuote.class);
        FencedCodeBlock code = child(quote.children(), 0, FencedCodeBlock.class);
        assertFalse(code.closed());
        assertEquals("code\n", code.literal());
        assertEquals('~', code.fenceChar());
        assertEquals(4, code.fenceLength());
    }

    @Test
    void parse_FencedCodeKeepsIndentRelativeToFence() {
        FencedCodeBlock code = child(parse("  ```\n    x\n y\n  ```\n").children(), 0, FencedCodeBlock.class);

        assertEquals(2, code.fenceIndent());
        assertEquals("  x\ny\n", code.literal());
    }

    @Test
    void parse_IndentedCodeGivesTrailingBlankLinesBack() {
        Document document = parse("    a\n    b\n\nfoo\n");

        assertEquals(3, document.children().size());
        IndentedCodeBlock code = child(document.children(), 0, IndentedCodeBlock.class);
        assertEquals("a\nb\n", code.literal());
        assertEquals(2, code.endLine());
        BlankLine blank = child(document.children(), 1, BlankLine.class);
        assertEquals(3, blank.startLine());
        assertEquals(4, child(document.children(), 2, Paragraph.class).startLine());
    }

    @Test
    void parse_TabIndentedCode() {
        IndentedCodeBlock code = child(parse("\tcode\n").children(), 0, IndentedCodeBlock.class);
        assertEquals("code\n", code.literal());
    }

    @Test
    void parse_IndentedLineDoesNotInterruptParagraph() {
        Document document = parse("foo\n    bar\n");

        assertEquals(1, document.children().size());
        child(document.children(), 0, Paragraph.class);
    }

    @Test
    void parse_HtmlBlockEndingAtBlankLine() {
        Document document = parse("<div>\nhi\n</div>\n\nafter\n");

        HtmlBlock html = child(document.children(), 0, HtmlBlock.class);
        assertEquals(6, html.rule());
        assertEquals("<div>\nhi\n</div>", html.literal());
        assertEquals(3, html.endLine());
        child(document.children(), 1, BlankLine.class);
        child(document.children(), 2, Paragraph.class);
    }

    @Test
    void parse_HtmlCommentEndsOnItsLine() {
        Document document = parse("<!-- note -->\npara\n");

        HtmlBlock html = child(document.children(), 0, HtmlBlock.class);
        assertEquals(2, html.rule());
        assertEquals(1, html.endLine());
        child(document.children(), 1, Paragraph.class);
    }

    @Test
    void parse_GenericTagCannotInterruptParagraph() {
        Document document = parse("foo\n<span>\n");

        assertEquals(1, document.children().size());
        Paragraph paragraph = child(document.children(), 0, Paragraph.class);
        assertEquals(List.of(new Text("foo"), new SoftLineBreak(), new HtmlInline("<span>")), paragraph.content());
    }

    @Test
    void parse_Table() {
        Document document = parse("| a | b |\n| :-- | --: |\n| 1 | 2 |\n");

        assertEquals(1, document.children().size());
        Table table = child(document.children(), 0, Table.class);
        assertEquals(List.of(TableAlignment.LEFT, TableAlignment.RIGHT), table.alignments());
        assertEquals(1, table.startLine());
        assertEquals(3, table.endLine());
        assertEquals(1, table.header().line());
        assertEquals(List.of(new Text("a")), table.header().cells().get(0).content());
        assertEquals(1, table.rows().size());
        assertEquals(3, table.rows().get(0).line());
        assertEquals(List.of(new Text("2")), table.rows().get(0).cells().get(1).content());
    }

    @Test
    void parse_TableAfterParagraphTakesItsLastLine() {
        Document document = parse("intro\n| a |\n|---|\nplain\n");

        Paragraph intro = child(document.children(), 0, Paragraph.class);
        assertEquals(1, intro.endLine());
        Table table = child(document.children(), 1, Table.class);
        assertEquals(2, table.startLine());
        assertTrue(table.rows().isEmpty());
        child(document.children(), 2, Paragraph.class);
    }

    @Test
    void parse_TableRowsAreCutOrPaddedToHeader() {
        Table table = child(parse("| a | b |\n|---|---|\n| 1 |\n| 1 | 2 | 3 |\n").children(), 0, Table.class);

        assertEquals(2, table.rows().get(0).cells().size());
        assertTrue(table.rows().get(0).cells().get(1).content().isEmpty());
        assertEquals(2, table.rows().get(1).cells().size());
    }

    @Test
    void parse_TableCellWithEscapedPipe() {
        Table table = child(parse("| a \\| b |\n|---|\n").children(), 0, Table.class);

        assertEquals(1, table.alignments().size());
        assertEquals(List.of(new Text("a | b")), table.header().cells().get(0).content());
    }

    @Test
    void parse_TablesDisabled() {
        Document document = parse("| a |\n|---|\n", MdframeConfig.with(false, true, 64, 1));

        assertEquals(1, document.children().size());
        child(document.children(), 0, Paragraph.class);
    }

    @Test
    void parse_LinkReferenceDefinitionResolvesShortcut() {
        Document document = parse("[foo]: /url \"title\"\n\n[foo]\n");

        LinkReferenceDefinition definition = child(document.children(), 0, LinkReferenceDefinition.class);
        assertEquals("foo", definition.label());
        assertEquals("/url", definition.destination());
        assertEquals("title", definition.title());
        child(document.children(), 1, BlankLine.class);
        Paragraph paragraph = child(document.children(), 2, Paragraph.class);
        assertEquals(List.of(new Link(List.of(new Text("foo")), "/url", "title", LinkForm.SHORTCUT_REFERENCE, "foo")),
                paragraph.content());
    }

    @Test
    void parse_ForwardReference() {
        Paragraph paragraph = child(parse("[foo]\n\n[foo]: /later\n").children(), 0, Paragraph.class);

        Link link = assertInstanceOf(Link.class, paragraph.content().get(0));
        assertEquals("/later", link.destination());
    }

    @Test
    void parse_FirstDefinitionWins() {
        Document document = parse("[a]: /one\n[A]: /two\n\n[a]\n");

        assertEquals(2, child(document.children(), 1, LinkReferenceDefinition.class).startLine());
        Paragraph paragraph = child(document.children(), 3, Paragraph.class);
        Link link = assertInstanceOf(Link.class, paragraph.content().get(0));
        assertEquals("/one", link.destination());
    }

    @Test
    void parse_DefinitionFollowedByParagraphText() {
        Document document = parse("[a]: /u\ntext\n");

        child(document.children(), 0, LinkReferenceDefinition.class);
        Paragraph paragraph = child(document.children(), 1, Paragraph.class);
        assertEquals(2, paragraph.startLine());
        assertEquals(List.of(new Text("text")), paragraph.content());
    }

    @Test
    void parse_SetextHeadingAfterDefinition() {
        Document document = parse("[a]: /u\nFoo\n===\n");

        assertEquals(2, document.children().size());
        child(document.children(), 0, LinkReferenceDefinition.class);
        SetextHeading heading = child(document.children(), 1, SetextHeading.class);
        assertEquals(2, heading.startLine());
        assertEquals(3, heading.endLine());
    }

    @Test
    void parse_BlankLinesCanBeExcluded() {
        Document document = parse("a\n\nb\n", MdframeConfig.with(true, false, 64, 1));

        assertEquals(2, document.children().size());
        child(document.children(), 0, Paragraph.class);
        child(document.children(), 1, Paragraph.class);
    }

    @Test
    void parse_ContainerNestingIsBounded() {
        Document document = parse("> > > > deep\n", MdframeConfig.with(true, true, 3, 1));

        BlockQuote outer = child(document.children(), 0, BlockQuote.class);
        BlockQuote inner = child(outer.children(), 0, BlockQuote.class);
        Paragraph paragraph = child(inner.children(), 0, Paragraph.class);
        assertEquals(List.of(new Text("> > deep")), paragraph.content());
    }

    @Test
    void splitLines_HandlesAllLineEndings() {
        assertEquals(List.of("a", "b", "c"), BlockParser.splitLines("a\r\nb\rc"));
        assertEquals(List.of("a", ""), BlockParser.splitLines("a\n\n"));
        assertEquals(List.of("a\uFFFDb"), BlockParser.splitLines("a\0b"));
        assertTrue(BlockParser.splitLines("").isEmpty());
    }

    @Test
    void parse_VeryLongThematicBreakLines() {
        child(parse("-".repeat(10_000)).children(), 0, ThematicBreak.class);
        child(parse("_ ".repeat(5_000)).children(), 0, ThematicBreak.class);

        Paragraph paragraph = child(parse("*".repeat(10_000) + "a").children(), 0, Paragraph.class);
        assertEquals(1, paragraph.startLine());
        child(parse("- ".repeat(2_000) + "a").children(), 0, ListBlock.class);
    }

    @Test
    void isThematicBreak_ScansMarkersAndWhitespace() {
        assertTrue(BlockOpener.isThematicBreak("***"));
        assertTrue(BlockOpener.isThematicBreak("- -\t-  "));
        assertFalse(BlockOpener.isThematicBreak("--"));
        assertFalse(BlockOpener.isThematicBreak("-*-"));
        assertFalse(BlockOpener.isThematicBreak("---a"));
        assertFalse(BlockOpener.isThematicBreak(""));
    }

    @Test
    void parse_LongParagraphStaysLinear() {
        String lines = "a | b\n".repeat(100_000);

        Document document = assertTimeout(Duration.ofSeconds(10), () -> parse(lines));

        Paragraph paragraph = child(document.children(), 0, Paragraph.class);
        assertEquals(100_000, paragraph.endLine());
    }

    @Test
    void parse_DefinitionsBeforeDelimiterRowAreNotTableHeaders() {
        Document document = parse("[a]: /u\n|---|\n");

        child(document.children(), 0, LinkReferenceDefinition.class);
        Paragraph paragraph = child(document.children(), 1, Paragraph.class);
        assertEquals(2, paragraph.startLine());
    }
}
