package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.MdframeConfig;
import org.dxworks.mdframe.parser.GrammarInvariantException;
import org.dxworks.mdframe.parser.inline.LinkReferenceResolver;
import org.dxworks.mdframe.parser.inline.LinkReferenceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-at-a-time block structure recognition.
 *
 * <p>For each line the open blocks are matched outermost first, each consuming its continuation prefix. An open
 * paragraph then goes through {@link ParagraphContinuationResolver}; otherwise new blocks are opened from the
 * {@link BlockOpener} table at the innermost matched container, unmatched blocks are closed, and whatever text
 * remains goes to the innermost leaf or into a new paragraph.</p>
 *
 * <p>Closing a paragraph extracts its leading link reference definitions into the shared
 * {@link LinkReferenceTable}. Inline content is not touched here; it is parsed once the whole document has been
 * read, when every definition is known.</p>
 */
final class BlockMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(BlockMatcher.class);

    private static final Pattern CLOSING_FENCE = Pattern.compile("(`{3,}|~{3,})[ \\t]*");

    private enum Continuation {
        MATCHED,
        NOT_MATCHED,
        // the line closed the block and nothing is left of it
        FINISHED
    }

    private final MdframeConfig config;
    private final LinkReferenceTable references;
    private final LinkReferenceResolver definitions;
    private final BlockBuilder document;
    private final OpenBlockStack stack;

    private int lineNumber;
    private boolean finished;

    BlockMatcher(MdframeConfig config, LinkReferenceTable references, LinkReferenceResolver definitions) {
        this.config = config;
        this.references = references;
        this.definitions = definitions;
        this.document = new BlockBuilder(BlockKind.DOCUMENT, 1);
        this.stack = new OpenBlockStack(document);
    }

    int lineCount() {
        return lineNumber;
    }

    void incorporateLine(String line) {
        if (finished) {
            throw new GrammarInvariantException("Line received after the document was finished");
        }
        lineNumber++;
        LineCursor cursor = new LineCursor(line);

        int matched = 1;
        boolean allMatched = true;
        for (int i = 1; i < stack.size(); i++) {
            BlockBuilder block = stack.get(i);
            cursor.findNextNonspace();
            Continuation continuation = continueBlock(block, cursor);
            if (continuation == Continuation.FINISHED) {
                block.fenceClosed = true;
                touchOpenBlocks();
                stack.closeFrom(i, this::finalizeAt);
                return;
            }
            if (continuation == Continuation.NOT_MATCHED) {
                allMatched = false;
                break;
            }
            matched = i + 1;
        }

        cursor.findNextNonspace();
        BlockBuilder container = stack.get(matched - 1);
        BlockBuilder tip = stack.tip();

        if (tip.kind == BlockKind.PARAGRAPH) {
            ParagraphContinuationResolver.Branch branch = ParagraphContinuationResolver.resolve(cursor, contextFor(container));
            if (branch == ParagraphContinuationResolver.Branch.CONTINUATION) {
                cursor.advanceNextNonspace();
                tip.addLine(cursor.remainder(), lineNumber);
                touchOpenBlocks();
                return;
            }
        }

        boolean leafMatched = allMatched && tip.kind.acceptsLines() && tip.kind != BlockKind.PARAGRAPH;
        openBlocksAndAddLine(cursor, container, matched, leafMatched);
        touchOpenBlocks();
    }

    /**
     * Closes every open block and returns the document root. No lines are accepted afterwards.
     */
    BlockBuilder finish() {
        if (!finished) {
            finished = true;
            stack.closeAll(this::finalizeAt);
        }
        return document;
    }

    private Continuation continueBlock(BlockBuilder block, LineCursor cursor) {
        switch (block.kind) {
            case BLOCK_QUOTE:
                if (!cursor.isIndented() && cursor.peekNonspace() == '>') {
                    cursor.advanceNextNonspace();
                    cursor.advanceOffset(1, false);
                    if (LineCursor.isSpaceOrTab(cursor.peek())) {
                        cursor.advanceOffset(1, true);
                    }
                    return Continuation.MATCHED;
                }
                return Continuation.NOT_MATCHED;
            case LIST:
                return Continuation.MATCHED;
            case LIST_ITEM:
                return ListItemTracker.continueItem(block, cursor) ? Continuation.MATCHED : Continuation.NOT_MATCHED;
            case PARAGRAPH:
                return cursor.isBlank() ? Continuation.NOT_MATCHED : Continuation.MATCHED;
            case INDENTED_CODE:
                if (cursor.isIndented()) {
                    cursor.advanceOffset(LineCursor.CODE_INDENT, true);
                    return Continuation.MATCHED;
                }
                if (cursor.isBlank()) {
                    cursor.advanceNextNonspace();
                    return Continuation.MATCHED;
                }
                return Continuation.NOT_MATCHED;
            case FENCED_CODE:
                if (!cursor.isIndented() && cursor.peekNonspace() == block.fenceChar) {
                    Matcher closing = CLOSING_FENCE.matcher(cursor.restFromNonspace());
                    if (closing.matches() && closing.group(1).length() >= block.fenceLength) {
                        return Continuation.FINISHED;
                    }
                }
                for (int i = block.fenceIndent; i > 0 && LineCursor.isSpaceOrTab(cursor.peek()); i--) {
                    cursor.advanceOffset(1, true);
                }
                return Continuation.MATCHED;
            case HTML_BLOCK:
                return cursor.isBlank() && block.htmlRule.endsAtBlankLine()
                        ? Continuation.NOT_MATCHED
                        : Continuation.MATCHED;
            case TABLE:
                return !cursor.isBlank() && cursor.restFromNonspace().indexOf('|') >= 0
                        ? Continuation.MATCHED
                        : Continuation.NOT_MATCHED;
            default:
                throw new GrammarInvariantException(block.kind + " can not be open at line " + lineNumber);
        }
    }

    private void openBlocksAndAddLine(LineCursor cursor, BlockBuilder container, int matched, boolean leafMatched) {
        int unmatchedFrom = matched;
        if (!leafMatched) {
            while (true) {
                cursor.findNextNonspace();
                BlockStart start = BlockOpener.firstMatch(cursor, contextFor(container));
                if (start == null) {
                    cursor.advanceNextNonspace();
                    break;
                }
                closeUnmatched(unmatchedFrom);
                apply(start);
                cursor = start.cursor();
                container = stack.tip();
                unmatchedFrom = stack.size();
                if (start.consumesLine()) {
                    return;
                }
                if (container.kind.acceptsLines()) {
                    break;
                }
            }
        }
        closeUnmatched(unmatchedFrom);
        addRemainder(cursor);
    }

    private void addRemainder(LineCursor cursor) {
        BlockBuilder tip = stack.tip();
        switch (tip.kind) {
            case INDENTED_CODE:
            case FENCED_CODE:
                tip.addLine(cursor.remainder(), lineNumber);
                break;
            case HTML_BLOCK:
                String text = cursor.remainder();
                tip.addLine(text, lineNumber);
                if (HtmlBlockClassifier.endsOnLine(tip.htmlRule, text)) {
                    stack.closeFrom(stack.size() - 1, this::finalizeAt);
                }
                break;
            case TABLE:
                tip.addLine(cursor.remainder(), lineNumber);
                tip.rowLines.add(lineNumber);
                break;
            case PARAGRAPH:
                throw new GrammarInvariantException("Paragraph left open without a continuation decision at line "
                        + lineNumber);
            default:
                if (cursor.isBlank()) {
                    // an item whose marker line has no content starts empty rather than with a blank line
                    if (!(tip.kind == BlockKind.LIST_ITEM && tip.startLine == lineNumber)) {
                        recordBlankLine(tip);
                    }
                } else {
                    closeUntilCanContain(BlockKind.PARAGRAPH);
                    BlockBuilder paragraph = new BlockBuilder(BlockKind.PARAGRAPH, lineNumber);
                    stack.push(paragraph);
                    paragraph.addLine(cursor.remainder(), lineNumber);
                }
        }
    }

    private void recordBlankLine(BlockBuilder container) {
        if (container.kind == BlockKind.LIST) {
            // remembered on the list until it is known whether another item follows
            container.pendingBlankLines.add(lineNumber);
            return;
        }
        BlockBuilder blank = new BlockBuilder(BlockKind.BLANK_LINE, lineNumber);
        container.appendChild(blank);
        blank.close();
    }

    private void apply(BlockStart start) {
        switch (start.opener()) {
            case SETEXT_HEADING:
                convertToSetextHeading(start.block());
                break;
            case TABLE:
                convertToTable(start.block());
                break;
            case LIST_ITEM:
                openListItem(start.block());
                break;
            default:
                BlockBuilder block = start.block();
                closeUntilCanContain(block.kind);
                if (block.kind.isContainer() || block.kind.acceptsLines()) {
                    stack.push(block);
                } else {
                    stack.tip().appendChild(block);
                    block.close();
                }
        }
    }

    private void openListItem(BlockBuilder item) {
        BlockBuilder tip = stack.tip();
        if (tip.kind == BlockKind.LIST && ListItemTracker.sameList(tip.marker, item.marker)) {
            if (!tip.pendingBlankLines.isEmpty()) {
                tip.blankLineBetweenItems = true;
                tip.pendingBlankLines.clear();
            }
        } else {
            closeUntilCanContain(BlockKind.LIST);
            BlockBuilder list = new BlockBuilder(BlockKind.LIST, lineNumber);
            list.marker = item.marker;
            stack.push(list);
        }
        stack.push(item);
    }

    private void convertToSetextHeading(BlockBuilder template) {
        BlockBuilder paragraph = requireParagraphTip();
        BlockBuilder parent = paragraph.parent;
        stack.closeFrom(stack.size() - 1, this::finalizeAt);

        // definitions may have been split off the front; the rest of the paragraph is the heading text
        BlockBuilder text = parent.lastChild();
        if (text == null || text.kind != BlockKind.PARAGRAPH) {
            throw new GrammarInvariantException("Setext underline at line " + lineNumber + " has no heading text");
        }
        parent.removeLastChild(text);
        BlockBuilder heading = new BlockBuilder(BlockKind.SETEXT_HEADING, text.startLine);
        heading.level = template.level;
        heading.lines.addAll(text.lines);
        heading.endLine = lineNumber;
        parent.appendChild(heading);
        heading.close();
    }

    private void convertToTable(BlockBuilder table) {
        BlockBuilder paragraph = requireParagraphTip();
        paragraph.lines.remove(paragraph.lines.size() - 1);
        if (paragraph.lines.isEmpty()) {
            stack.closeFrom(stack.size() - 1, index -> discard(stack.get(index)));
        } else {
            stack.closeFrom(stack.size() - 1, this::finalizeAt);
        }
        stack.push(table);
    }

    private BlockBuilder requireParagraphTip() {
        BlockBuilder tip = stack.tip();
        if (tip.kind != BlockKind.PARAGRAPH) {
            throw new GrammarInvariantException("Expected an open paragraph at line " + lineNumber + ", found " + tip);
        }
        return tip;
    }

    private void discard(BlockBuilder block) {
        block.parent.removeLastChild(block);
        block.close();
    }

    private void closeUnmatched(int from) {
        if (from < stack.size()) {
            stack.closeFrom(from, this::finalizeAt);
        }
    }

    private void closeUntilCanContain(BlockKind kind) {
        while (!stack.tip().kind.canContain(kind)) {
            stack.closeFrom(stack.size() - 1, this::finalizeAt);
        }
    }

    private OpenerContext contextFor(BlockBuilder container) {
        BlockBuilder tip = stack.tip();
        BlockBuilder matchedParagraph = container.kind == BlockKind.PARAGRAPH ? container : null;
        return new OpenerContext(container, matchedParagraph, tip.kind == BlockKind.PARAGRAPH, stack.depth(),
                lineNumber, config, definitions);
    }

    private void touchOpenBlocks() {
        for (int i = 0; i < stack.size(); i++) {
            stack.get(i).endLine = lineNumber;
        }
    }

    private void finalizeAt(int index) {
        BlockBuilder block = stack.get(index);
        switch (block.kind) {
            case PARAGRAPH:
                finalizeParagraph(block);
                break;
            case INDENTED_CODE:
                finalizeIndentedCode(block);
                break;
            case LIST:
                finalizeList(block);
                break;
            default:
                block.close();
        }
    }

    private void finalizeParagraph(BlockBuilder paragraph) {
        paragraph.endLine = paragraph.startLine + paragraph.lines.size() - 1;
        List<LinkReferenceResolver.ParsedDefinition> parsed = definitions.parseDefinitions(paragraph.lines);
        if (parsed.isEmpty()) {
            paragraph.close();
            return;
        }

        BlockBuilder parent = paragraph.parent;
        parent.removeLastChild(paragraph);
        paragraph.close();

        int line = paragraph.startLine;
        int consumed = 0;
        for (LinkReferenceResolver.ParsedDefinition definition : parsed) {
            if (!references.define(definition.label(), definition.destination(), definition.title())) {
                LOG.debug("Ignoring repeated definition of [{}] at line {}", definition.label(), line);
            }
            BlockBuilder builder = new BlockBuilder(BlockKind.LINK_REFERENCE_DEFINITION, line);
            builder.label = definition.label();
            builder.destination = definition.destination();
            builder.title = definition.title();
            builder.endLine = line + definition.lineCount() - 1;
            parent.appendChild(builder);
            builder.close();
            line += definition.lineCount();
            consumed += definition.lineCount();
        }

        if (consumed < paragraph.lines.size()) {
            BlockBuilder rest = new BlockBuilder(BlockKind.PARAGRAPH, line);
            rest.lines.addAll(paragraph.lines.subList(consumed, paragraph.lines.size()));
            rest.endLine = paragraph.endLine;
            parent.appendChild(rest);
            rest.close();
        }
    }

    private void finalizeList(BlockBuilder list) {
        BlockBuilder lastItem = list.lastChild();
        if (list.pendingBlankLines.isEmpty() || lastItem == null) {
            list.close();
            return;
        }
        list.endLine = lastItem.endLine;
        list.close();

        // blank lines after the last item belong to the enclosing container
        for (int line : list.pendingBlankLines) {
            BlockBuilder blank = new BlockBuilder(BlockKind.BLANK_LINE, line);
            list.parent.appendChild(blank);
            blank.close();
        }
    }

    private void finalizeIndentedCode(BlockBuilder code) {
        int trailingBlank = 0;
        while (trailingBlank < code.lines.size() && LineCursor.isSpacesAndTabs(code.lines.get(code.lines.size() - 1 - trailingBlank))) {
            trailingBlank++;
        }
        int kept = code.lines.size() - trailingBlank;
        code.lines.subList(kept, code.lines.size()).clear();
        code.endLine = code.startLine + kept - 1;
        code.close();

        // blank lines after the last code line belong to the enclosing container
        BlockBuilder parent = code.parent;
        for (int i = 1; i <= trailingBlank; i++) {
            BlockBuilder blank = new BlockBuilder(BlockKind.BLANK_LINE, code.endLine + i);
            parent.appendChild(blank);
            blank.close();
        }
    }
}
