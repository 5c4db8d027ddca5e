package org.dxworks.mdframe.parser;

import org.dxworks.mdframe.TestUtils;
import org.dxworks.mdframe.model.*;
import org.dxworks.mdframe.model.inline.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * The visible text of every paragraph, heading and table cell must survive parsing, with markup removed and
 * escapes and references resolved.
 */
public class TextPreservationTest {

    static Stream<Arguments> documents() {
        return Stream.of(
                Arguments.of("Some *emphasis* and a [link][docs].\n\n[docs]: /d\n",
                        List.of("Some emphasis and a link.")),
                Arguments.of("a\\*b &amp; &#65; `c d`\n", List.of("a*b & A c d")),
                Arguments.of("**a _b_ c**\nnext  \nline\n", List.of("a b c\nnext\nline")),
                Arguments.of("*a **b\n", List.of("*a **b")),
                Arguments.of("snake_case_name and 2 * 3\n", List.of("snake_case_name and 2 * 3")),
                Arguments.of("  lead and trail  \n", List.of("lead and trail")),
                Arguments.of("# Title #\nSetext\n===\n", List.of("Title", "Setext")),
                Arguments.of("[not a link] ![alt](x.png) <https://e.com>\n",
                        List.of("[not a link] alt https://e.com")),
                Arguments.of("> - nested *text*\n>   more\n", List.of("nested text\nmore")),
                Arguments.of("| a | b\\|c |\n| --- | --- |\n| 1 | 2 |\n", List.of("a", "b|c", "1", "2")),
                Arguments.of("<span>raw</span> text\n", List.of("<span>raw</span> text"))
        );
    }

    @ParameterizedTest
    @MethodSource("documents")
    void parse_KeepsVisibleText(String markdown, List<String> expected) {
        assertEquals(expected, visibleText(TestUtils.parse(markdown).children()));
    }

    @Test
    void parse_KeepsVisibleTextOfSample() throws IOException {
        Document document = TestUtils.parse(TestUtils.readSample("Basic.md"));

        assertEquals(List.of("Intro paragraph before any heading.", "Project Title", "Some emphasis and a link.",
                "Install", "first", "second", "Usage", "run", "check", "quoted text",
                "Option", "Default", "tables", "true", "Logo", "Details"), visibleText(document.children()));
    }

    private static List<String> visibleText(List<Block> blocks) {
        List<String> texts = new ArrayList<>();
        for (Block block : blocks) {
            if (block instanceof Paragraph paragraph) {
                texts.add(leafText(paragraph.content()));
            } else if (block instanceof AtxHeading heading) {
                texts.add(leafText(heading.content()));
            } else if (block instanceof SetextHeading heading) {
                texts.add(leafText(heading.content()));
            } else if (block instanceof Table table) {
                addCells(texts, table.header());
                table.rows().forEach(row -> addCells(texts, row));
            } else if (block instanceof ListBlock list) {
                list.items().forEach(item -> texts.addAll(visibleText(item.children())));
            } else if (block instanceof ContainerBlock container) {
                texts.addAll(visibleText(container.children()));
            }
        }
        return texts;
    }

    private static void addCells(List<String> texts, TableRow row) {
        row.cells().forEach(cell -> texts.add(leafText(cell.content())));
    }

    private static String leafText(List<Inline> inlines) {
        StringBuilder text = new StringBuilder();
        for (Inline inline : inlines) {
            if (inline instanceof Text leaf) {
                text.append(leaf.literal());
            } else if (inline instanceof CodeSpan code) {
                text.append(code.literal());
            } else if (inline instanceof BackslashEscape escape) {
                text.append(escape.escaped());
            } else if (inline instanceof EntityReference entity) {
                text.append(entity.resolved());
            } else if (inline instanceof NumericCharacterReference reference) {
                text.append(reference.resolved());
            } else if (inline instanceof Autolink autolink) {
                text.append(autolink.literal());
            } else if (inline instanceof HtmlInline html) {
                text.append(html.literal());
            } else if (inline instanceof SoftLineBreak || inline instanceof HardLineBreak) {
                text.append('\n');
            } else if (inline instanceof Emphasis emphasis) {
                text.append(leafText(emphasis.children()));
            } else if (inline instanceof StrongEmphasis strong) {
                text.append(leafText(strong.children()));
            } else if (inline instanceof Link link) {
                text.append(leafText(link.children()));
            } else if (inline instanceof Image image) {
                text.append(leafText(image.description()));
            }
        }
        return text.toString();
    }
}
