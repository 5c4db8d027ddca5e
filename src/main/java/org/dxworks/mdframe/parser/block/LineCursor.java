package org.dxworks.mdframe.parser.block;

/**
 * Position inside one physical line, tracked both as a character offset and as a column with tab stops of 4.
 * A tab may be consumed partially when a container only needs some of its columns.
 *
 * <p>Cursors are cheap to {@link #copy()}; speculative openers work on copies so a failed attempt never
 * disturbs the matcher's position.</p>
 */
final class LineCursor {

    static final int TAB_STOP = 4;
    static final int CODE_INDENT = 4;

    private final String line;
    private int offset;
    private int column;
    private boolean partiallyConsumedTab;

    private int nextNonspace;
    private int nextNonspaceColumn;
    private int indent;
    private boolean blank;

    LineCursor(String line) {
        this.line = line;
        findNextNonspace();
    }

    private LineCursor(LineCursor other) {
        this.line = other.line;
        this.offset = other.offset;
        this.column = other.column;
        this.partiallyConsumedTab = other.partiallyConsumedTab;
        this.nextNonspace = other.nextNonspace;
        this.nextNonspaceColumn = other.nextNonspaceColumn;
        this.indent = other.indent;
        this.blank = other.blank;
    }

    LineCursor copy() {
        return new LineCursor(this);
    }

    String line() {
        return line;
    }

    int offset() {
        return offset;
    }

    int column() {
        return column;
    }

    int indent() {
        return indent;
    }

    boolean isIndented() {
        return indent >= CODE_INDENT;
    }

    boolean isBlank() {
        return blank;
    }

    int nextNonspace() {
        return nextNonspace;
    }

    /** Character at the next non-space position, or {@code '\0'} at end of line. */
    char peekNonspace() {
        return nextNonspace < line.length() ? line.charAt(nextNonspace) : '\0';
    }

    /** Character at the current offset, or {@code '\0'} at end of line. */
    char peek() {
        return offset < line.length() ? line.charAt(offset) : '\0';
    }

    /** The text from the next non-space character to the end of the line. */
    String restFromNonspace() {
        return line.substring(Math.min(nextNonspace, line.length()));
    }

    boolean atEnd() {
        return offset >= line.length();
    }

    void findNextNonspace() {
        int i = offset;
        int cols = column;
        char c = '\0';
        while (i < line.length()) {
            c = line.charAt(i);
            if (c == ' ') {
                i++;
                cols++;
            } else if (c == '\t') {
                i++;
                cols += TAB_STOP - (cols % TAB_STOP);
            } else {
                break;
            }
        }
        blank = i >= line.length();
        nextNonspace = i;
        nextNonspaceColumn = cols;
        indent = nextNonspaceColumn - column;
    }

    void advanceNextNonspace() {
        offset = nextNonspace;
        column = nextNonspaceColumn;
        partiallyConsumedTab = false;
    }

    /**
     * Advances by {@code count} characters, or by {@code count} columns when {@code columns} is set.
     * In column mode a tab wider than the remaining count is only partially consumed.
     */
    void advanceOffset(int count, boolean columns) {
        while (count > 0 && offset < line.length()) {
            char c = line.charAt(offset);
            if (c == '\t') {
                int charsToTab = TAB_STOP - (column % TAB_STOP);
                if (columns) {
                    partiallyConsumedTab = charsToTab > count;
                    int charsToAdvance = Math.min(charsToTab, count);
                    column += charsToAdvance;
                    offset += partiallyConsumedTab ? 0 : 1;
                    count -= charsToAdvance;
                } else {
                    partiallyConsumedTab = false;
                    column += charsToTab;
                    offset += 1;
                    count -= 1;
                }
            } else {
                partiallyConsumedTab = false;
                offset++;
                column++;
                count--;
            }
        }
    }

    void advanceToEnd() {
        advanceOffset(line.length() - offset, false);
    }

    /**
     * Remaining line text from the current offset. A partially consumed tab contributes the spaces it still owes.
     */
    String remainder() {
        if (partiallyConsumedTab && offset < line.length()) {
            int charsToTab = TAB_STOP - (column % TAB_STOP);
            return " ".repeat(charsToTab) + line.substring(offset + 1);
        }
        return line.substring(Math.min(offset, line.length()));
    }

    /** Restores a column position previously read through {@link #column()} and {@link #offset()}. */
    void reset(int offset, int column) {
        this.offset = offset;
        this.column = column;
        this.partiallyConsumedTab = false;
    }

    static boolean isSpaceOrTab(char c) {
        return c == ' ' || c == '\t';
    }

    /** Removes leading and trailing spaces and tabs; other Unicode whitespace is content. */
    static String stripSpacesAndTabs(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isSpaceOrTab(text.charAt(start))) {
            start++;
        }
        while (end > start && isSpaceOrTab(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    static boolean isSpacesAndTabs(String text) {
        return stripSpacesAndTabs(text).isEmpty();
    }
}
