package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.parser.GrammarInvariantException;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable block under construction. Open builders sit on the {@link OpenBlockStack}; once closed a builder is
 * frozen and any further mutation is a grammar invariant violation.
 */
final class BlockBuilder {

    final BlockKind kind;
    final int startLine;
    int endLine;
    BlockBuilder parent;
    final List<BlockBuilder> children = new ArrayList<>();
    final List<String> lines = new ArrayList<>();

    private boolean open = true;

    // headings
    int level;
    String headingText;

    // fenced code
    char fenceChar;
    int fenceLength;
    int fenceIndent;
    String info;
    boolean fenceClosed;

    // html block
    HtmlBlockRule htmlRule;

    // list and list item
    ListMarker marker;
    boolean blankLineBetweenItems;
    // blank lines seen directly on a list, not yet known to separate items
    final List<Integer> pendingBlankLines = new ArrayList<>();

    // thematic break
    char breakMarker;

    // link reference definition
    String label;
    String destination;
    String title;

    // table
    TableSupport.TableHeader tableHeader;
    final List<Integer> rowLines = new ArrayList<>();

    BlockBuilder(BlockKind kind, int startLine) {
        this.kind = kind;
        this.startLine = startLine;
        this.endLine = startLine;
    }

    boolean isOpen() {
        return open;
    }

    void close() {
        if (!open) {
            throw new GrammarInvariantException(kind + " opened at line " + startLine + " closed twice");
        }
        open = false;
    }

    void addLine(String text, int lineNumber) {
        ensureOpen();
        lines.add(text);
        endLine = lineNumber;
    }

    void appendChild(BlockBuilder child) {
        ensureOpen();
        if (!kind.canContain(child.kind)) {
            throw new GrammarInvariantException(kind + " cannot contain " + child.kind + " at line " + child.startLine);
        }
        child.parent = this;
        children.add(child);
    }

    /** Detaches the last child, which must be {@code expected}. */
    void removeLastChild(BlockBuilder expected) {
        ensureOpen();
        if (lastChild() != expected) {
            throw new GrammarInvariantException("Expected " + expected + " to be the last child of " + this);
        }
        children.remove(children.size() - 1);
        expected.parent = null;
    }

    BlockBuilder lastChild() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    boolean hasContentChildren() {
        for (BlockBuilder child : children) {
            if (child.kind != BlockKind.BLANK_LINE) {
                return true;
            }
        }
        return false;
    }

    private void ensureOpen() {
        if (!open) {
            throw new GrammarInvariantException(kind + " opened at line " + startLine + " mutated after close");
        }
    }

    @Override
    public String toString() {
        return kind + "@" + startLine + (open ? "(open)" : "");
    }
}
