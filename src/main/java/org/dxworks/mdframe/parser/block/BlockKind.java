package org.dxworks.mdframe.parser.block;

/**
 * Tags of the block builders kept on the open-block stack.
 */
enum BlockKind {
    DOCUMENT(true, false),
    BLOCK_QUOTE(true, false),
    LIST(true, false),
    LIST_ITEM(true, false),
    PARAGRAPH(false, true),
    ATX_HEADING(false, false),
    SETEXT_HEADING(false, false),
    INDENTED_CODE(false, true),
    FENCED_CODE(false, true),
    HTML_BLOCK(false, true),
    THEMATIC_BREAK(false, false),
    LINK_REFERENCE_DEFINITION(false, false),
    TABLE(false, true),
    BLANK_LINE(false, false);

    private final boolean container;
    private final boolean acceptsLines;

    BlockKind(boolean container, boolean acceptsLines) {
        this.container = container;
        this.acceptsLines = acceptsLines;
    }

    boolean isContainer() {
        return container;
    }

    boolean acceptsLines() {
        return acceptsLines;
    }

    /** Whether a block of this kind may directly hold a child of {@code child}. */
    boolean canContain(BlockKind child) {
        return switch (this) {
            case DOCUMENT, BLOCK_QUOTE, LIST_ITEM -> child != LIST_ITEM;
            case LIST -> child == LIST_ITEM;
            default -> false;
        };
    }
}
