package org.dxworks.mdframe.parser.block;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Block start conditions in precedence order. The first opener whose match succeeds wins the line position;
 * the order is the single place where precedence between constructs is decided.
 *
 * <p>Openers never touch the caller's cursor or the tree. Openers that cannot interrupt a paragraph check
 * {@link OpenerContext#paragraphOpen()} themselves, so the same table serves both the paragraph continuation
 * decision and regular block starts.</p>
 */
enum BlockOpener {

    SETEXT_HEADING(true) {
        @Override
        BlockStart tryOpen(LineCursor cursor, OpenerContext context) {
            BlockBuilder paragraph = context.paragraph();
            if (paragraph == null || cursor.isIndented()) {
                return null;
            }
            String rest = cursor.restFromNonspace();
            if (!SETEXT_UNDERLINE.matcher(rest).matches()) {
                return null;
            }
            // a paragraph made only of link reference definitions has no heading text left
            if (context.definitions().definitionLineCount(paragraph.lines) >= paragraph.lines.size()) {
                return null;
            }
            BlockBuilder heading = new BlockBuilder(BlockKind.SETEXT_HEADING, paragraph.startLine);
            heading.level = rest.charAt(0) == '=' ? 1 : 2;
            LineCursor next = cursor.copy();
            next.advanceToEnd();
            return new BlockStart(this, heading, next, true);
        }
    },

    TABLE(true) {
        @Override
        BlockStart tryOpen(LineCursor cursor, OpenerContext context) {
            BlockBuilder paragraph = context.paragraph();
            if (paragraph == null || !context.config().isTables() || cursor.isIndented()) {
                return null;
            }
            int lastIndex = paragraph.lines.size() - 1;
            TableSupport.TableHeader header = TableSupport.tryStart(paragraph.lines.get(lastIndex),
                    paragraph.startLine + lastIndex, cursor.restFromNonspace());
            // the definition scan covers the whole paragraph, so it only runs under a valid delimiter row
            if (header == null || context.definitions().definitionLineCount(paragraph.lines) > lastIndex) {
                return null;
            }
            BlockBuilder table = new BlockBuilder(BlockKind.TABLE, header.line());
            table.tableHeader = header;
            LineCursor next = cursor.copy();
            next.advanceToEnd();
            return new BlockStart(this, table, next, true);
        }
    },

    THEMATIC_BREAK(true) {
        @Override
        BlockStart tryOpen(LineCursor cursor, OpenerContext context) {
            if (cursor.isIndented() || !isThematicBreak(cursor.restFromNonspace())) {
                return null;
            }
            BlockBuilder thematicBreak = new BlockBuilder(BlockKind.THEMATIC_BREAK, context.lineNumber());
            thematicBreak.breakMarker = cursor.peekNonspace();
            LineCursor next = cursor.copy();
            next.advanceToEnd();
            return new BlockStart(this, thematicBreak, next, true);
        }
    },

    ATX_HEADING(true) {
        @Override
        BlockStart tryOpen(LineCursor cursor, OpenerContext context) {
            if (cursor.isIndented()) {
                return null;
            }
            Matcher matcher = ATX_OPENING.matcher(cursor.restFromNonspace());
            if (!matcher.lookingAt()) {
                return null;
            }
            BlockBuilder heading = new BlockBuilder(BlockKind.ATX_HEADING, context.lineNumber());
            heading.level = matcher.group(1).length();
            String content = cursor.restFromNonspace().substring(matcher.end());
            content = ATX_CLOSING_ONLY.matcher(content).replaceFirst("");
            content = ATX_CLOSING.matcher(content).replaceFirst("");
            heading.headingText = LineCursor.stripSpacesAndTabs(content);
            LineCursor next = cursor.copy();
            next.advanceToEnd();
            return new BlockStart(this, heading, next, true);
        }
    },

    FENCED_CODE(true) {
        @Override
        BlockStart tryOpen(LineCursor cursor, OpenerContext context) {
            if (cursor.isIndented()) {
                return null;
            }
            String rest = cursor.restFromNonspace();
            Matcher matcher = FENCE_OPENING.matcher(rest);
            if (!matcher.lookingAt()) {
                return null;
            }
            BlockBuilder fence = new BlockBuilder(BlockKind.FENCED_CODE, context.lineNumber());
            fence.fenceChar = rest.charAt(0);
            fence.fenceLength = matcher.end();
            fence.fenceIndent = cursor.indent();
            fence.info = LineCursor.stripSpacesAndTabs(rest.substring(matcher.end()));
            LineCursor next = cursor.copy();
            next.advanceToEnd();
            return new BlockStart(this, fence, next, true);
        }
    },

    BLOCK_QUOTE(true) {
        @Override
        BlockStart tryOpen(LineCursor cursor, OpenerContext context) {
            if (cursor.isIndented() || cursor.peekNonspace() != '>' || context.nestingExhausted()) {
                return null;
            }
            LineCursor next = cursor.copy();
            next.advanceNextNonspace();
            next.advanceOffset(1, false);
            if (LineCursor.isSpaceOrTab(next.peek())) {
                next.advanceOffset(1, true);
            }
            return new BlockStart(this, new BlockBuilder(BlockKind.BLOCK_QUOTE, context.lineNumber()), next, false);
        }
    },

    LIST_ITEM(true) {
        @Override
        BlockStart tryOpen(LineCursor cursor, OpenerContext context) {
            if (context.nestingExhausted()) {
                return null;
            }
            LineCursor next = cursor.copy();
            ListMarker marker = ListItemTracker.parseMarker(next, context.container(), context.paragraphOpen());
            if (marker == null) {
                return null;
            }
            BlockBuilder item = new BlockBuilder(BlockKind.LIST_ITEM, context.lineNumber());
            item.marker = marker;
            return new BlockStart(this, item, next, false);
        }
    },

    INDENTED_CODE(false) {
        @Override
        BlockStart tryOpen(LineCursor cursor, OpenerContext context) {
            if (!cursor.isIndented() || cursor.isBlank() || context.paragraphOpen()) {
                return null;
            }
            LineCursor next = cursor.copy();
            next.advanceOffset(LineCursor.CODE_INDENT, true);
            return new BlockStart(this, new BlockBuilder(BlockKind.INDENTED_CODE, context.lineNumber()), next, false);
        }
    },

    HTML_BLOCK(true) {
        @Override
        BlockStart tryOpen(LineCursor cursor, OpenerContext context) {
            if (cursor.isIndented() || cursor.peekNonspace() != '<') {
                return null;
            }
            HtmlBlockRule rule = HtmlBlockClassifier.classifyStart(cursor.restFromNonspace(), context.paragraphOpen());
            if (rule == null) {
                return null;
            }
            BlockBuilder html = new BlockBuilder(BlockKind.HTML_BLOCK, context.lineNumber());
            html.htmlRule = rule;
            // the block keeps its leading spaces, so the cursor stays where it is
            return new BlockStart(this, html, cursor.copy(), false);
        }
    };

    static final Pattern SETEXT_UNDERLINE = Pattern.compile("(?:=+|-+)[ \\t]*");
    static final Pattern ATX_OPENING = Pattern.compile("(#{1,6})(?:[ \\t]+|$)");
    static final Pattern ATX_CLOSING_ONLY = Pattern.compile("^[ \\t]*#+[ \\t]*$");
    static final Pattern ATX_CLOSING = Pattern.compile("[ \\t]+#+[ \\t]*$");
    static final Pattern FENCE_OPENING = Pattern.compile("`{3,}(?!.*`)|~{3,}");

    private final boolean interruptsParagraph;

    BlockOpener(boolean interruptsParagraph) {
        this.interruptsParagraph = interruptsParagraph;
    }

    /**
     * Whether this construct can ever start while a paragraph is open. Finer conditions, such as an ordered
     * list having to start at 1, are decided by the opener itself.
     */
    boolean interruptsParagraph() {
        return interruptsParagraph;
    }

    /**
     * @return the start, or null if this construct does not begin at the cursor
     */
    abstract BlockStart tryOpen(LineCursor cursor, OpenerContext context);

    /**
     * Three or more of the same {@code *}, {@code -} or {@code _} with only spaces and tabs between them.
     * Scanned by hand because a repeated regex group recurses once per marker.
     */
    static boolean isThematicBreak(String rest) {
        if (rest.isEmpty()) {
            return false;
        }
        char marker = rest.charAt(0);
        if (marker != '*' && marker != '-' && marker != '_') {
            return false;
        }
        int count = 0;
        for (int i = 0; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == marker) {
                count++;
            } else if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return count >= 3;
    }

    /** Tries the openers in precedence order and returns the first success. */
    static BlockStart firstMatch(LineCursor cursor, OpenerContext context) {
        for (BlockOpener opener : values()) {
            BlockStart start = opener.tryOpen(cursor, context);
            if (start != null) {
                return start;
            }
        }
        return null;
    }
}
