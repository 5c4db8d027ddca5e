package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.MdframeConfig;
import org.dxworks.mdframe.model.*;
import org.dxworks.mdframe.model.inline.Inline;
import org.dxworks.mdframe.parser.GrammarInvariantException;
import org.dxworks.mdframe.parser.inline.EntityTable;
import org.dxworks.mdframe.parser.inline.InlineEscapes;
import org.dxworks.mdframe.parser.inline.InlineScanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the closed builder tree into immutable records, running the inline scanner over every block that holds
 * inline content.
 */
final class TreeMaterializer {

    private final MdframeConfig config;
    private final InlineScanner inlines;
    private final EntityTable entities;

    TreeMaterializer(MdframeConfig config, InlineScanner inlines, EntityTable entities) {
        this.config = config;
        this.inlines = inlines;
        this.entities = entities;
    }

    Document materialize(BlockBuilder document) {
        if (document.isOpen()) {
            throw new GrammarInvariantException("Document materialized while still open");
        }
        return new Document(document.startLine, document.endLine, blocks(document.children));
    }

    private List<Block> blocks(List<BlockBuilder> builders) {
        List<Block> result = new ArrayList<>(builders.size());
        for (BlockBuilder builder : builders) {
            if (builder.kind == BlockKind.BLANK_LINE && !config.isIncludeBlankLines()) {
                continue;
            }
            result.add(block(builder));
        }
        return result;
    }

    private Block block(BlockBuilder b) {
        if (b.isOpen()) {
            throw new GrammarInvariantException(b + " was never closed");
        }
        return switch (b.kind) {
            case PARAGRAPH -> new Paragraph(b.startLine, b.endLine, inlines.parse(String.join("\n", b.lines)));
            case ATX_HEADING -> new AtxHeading(b.startLine, b.endLine, b.level, inlines.parse(b.headingText));
            case SETEXT_HEADING -> new SetextHeading(b.startLine, b.endLine, b.level,
                    inlines.parse(String.join("\n", b.lines)));
            case INDENTED_CODE -> new IndentedCodeBlock(b.startLine, b.endLine, codeLiteral(b.lines));
            case FENCED_CODE -> new FencedCodeBlock(b.startLine, b.endLine, b.fenceChar, b.fenceLength,
                    b.fenceIndent, InlineEscapes.unescape(b.info, entities), codeLiteral(b.lines), b.fenceClosed);
            case BLOCK_QUOTE -> new BlockQuote(b.startLine, b.endLine, blocks(b.children));
            case LIST -> list(b);
            case LIST_ITEM -> item(b);
            case THEMATIC_BREAK -> new ThematicBreak(b.startLine, b.endLine, b.breakMarker);
            case HTML_BLOCK -> new HtmlBlock(b.startLine, b.endLine, b.htmlRule.number(), String.join("\n", b.lines));
            case LINK_REFERENCE_DEFINITION -> new LinkReferenceDefinition(b.startLine, b.endLine, b.label,
                    b.destination, b.title);
            case BLANK_LINE -> new BlankLine(b.startLine, b.endLine);
            case TABLE -> table(b);
            case DOCUMENT -> throw new GrammarInvariantException("Document nested inside " + b.parent);
        };
    }

    // every content line keeps its own line terminator
    private static String codeLiteral(List<String> lines) {
        StringBuilder literal = new StringBuilder();
        for (String line : lines) {
            literal.append(line).append('\n');
        }
        return literal.toString();
    }

    private ListBlock list(BlockBuilder list) {
        List<ListItem> items = new ArrayList<>(list.children.size());
        for (BlockBuilder child : list.children) {
            items.add(item(child));
        }
        return new ListBlock(list.startLine, list.endLine, list.marker.kind(), list.marker.number(),
                ListItemTracker.isTight(list), items);
    }

    private ListItem item(BlockBuilder item) {
        if (item.kind != BlockKind.LIST_ITEM) {
            throw new GrammarInvariantException("List holds " + item);
        }
        ListMarker marker = item.marker;
        return new ListItem(item.startLine, item.endLine, marker.kind(), marker.number(), marker.markerOffset(),
                marker.contentIndent(), blocks(item.children));
    }

    private Table table(BlockBuilder table) {
        TableSupport.TableHeader header = table.tableHeader;
        int columns = header.alignments().size();
        TableRow headerRow = new TableRow(header.line(), cells(header.cells(), columns));
        List<TableRow> rows = new ArrayList<>(table.lines.size());
        for (int i = 0; i < table.lines.size(); i++) {
            rows.add(new TableRow(table.rowLines.get(i), cells(TableSupport.splitRow(table.lines.get(i)), columns)));
        }
        return new Table(table.startLine, table.endLine, header.alignments(), headerRow, rows);
    }

    // body rows are cut or padded to the header's column count
    private List<TableCell> cells(List<String> texts, int columns) {
        List<TableCell> cells = new ArrayList<>(columns);
        for (int i = 0; i < columns; i++) {
            List<Inline> content = i < texts.size() ? inlines.parse(texts.get(i)) : List.of();
            cells.add(new TableCell(content));
        }
        return cells;
    }
}
