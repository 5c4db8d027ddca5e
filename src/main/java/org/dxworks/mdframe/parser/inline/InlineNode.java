package org.dxworks.mdframe.parser.inline;

import org.dxworks.mdframe.model.inline.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mutable doubly linked tree used while delimiters and brackets are still being matched. Matching moves runs of
 * siblings under new emphasis or link nodes, which is cheap on a linked structure; the finished tree is turned
 * into immutable {@link Inline} records by {@link #toInlines()}.
 */
final class InlineNode {

    enum Kind {
        ROOT, TEXT, EMPHASIS, STRONG_EMPHASIS, CODE_SPAN, HTML, AUTOLINK, SOFT_BREAK, HARD_BREAK,
        ENTITY, NUMERIC_REFERENCE, ESCAPE, LINK, IMAGE
    }

    final Kind kind;
    String literal;
    String resolved;
    char delimiter;
    boolean flag;
    String destination;
    String title;
    String label;
    LinkForm form;

    InlineNode parent;
    InlineNode firstChild;
    InlineNode lastChild;
    InlineNode prev;
    InlineNode next;

    InlineNode(Kind kind) {
        this.kind = kind;
    }

    static InlineNode text(String literal) {
        InlineNode node = new InlineNode(Kind.TEXT);
        node.literal = literal;
        return node;
    }

    void appendChild(InlineNode child) {
        child.unlink();
        child.parent = this;
        if (lastChild != null) {
            lastChild.next = child;
            child.prev = lastChild;
            lastChild = child;
        } else {
            firstChild = child;
            lastChild = child;
        }
    }

    void insertAfter(InlineNode sibling) {
        sibling.unlink();
        sibling.next = next;
        if (sibling.next != null) {
            sibling.next.prev = sibling;
        }
        sibling.prev = this;
        next = sibling;
        sibling.parent = parent;
        if (sibling.next == null && parent != null) {
            parent.lastChild = sibling;
        }
    }

    void unlink() {
        if (prev != null) {
            prev.next = next;
        } else if (parent != null) {
            parent.firstChild = next;
        }
        if (next != null) {
            next.prev = prev;
        } else if (parent != null) {
            parent.lastChild = prev;
        }
        parent = null;
        next = null;
        prev = null;
    }

    /** Moves every sibling strictly between {@code from} and {@code to} under this node. */
    void adoptBetween(InlineNode from, InlineNode to) {
        InlineNode current = from.next;
        while (current != null && current != to) {
            InlineNode following = current.next;
            appendChild(current);
            current = following;
        }
    }

    /** Moves every sibling after {@code from} under this node. */
    void adoptAfter(InlineNode from) {
        adoptBetween(from, null);
    }

    /**
     * Converts the children of this node. Works with an explicit stack since emphasis can nest as deep as the
     * delimiter runs are long.
     */
    List<Inline> toInlines() {
        Deque<Conversion> stack = new ArrayDeque<>();
        stack.push(new Conversion(this));
        while (true) {
            Conversion top = stack.peek();
            InlineNode child = top.cursor;
            if (child == null) {
                top.flushText();
                stack.pop();
                if (stack.isEmpty()) {
                    return top.result;
                }
                Conversion parent = stack.peek();
                parent.result.add(top.node.toContainer(top.result));
                parent.cursor = parent.cursor.next;
            } else if (child.kind == Kind.TEXT) {
                top.appendText(child.literal);
                top.cursor = child.next;
            } else {
                top.flushText();
                if (child.isContainer()) {
                    stack.push(new Conversion(child));
                } else {
                    top.result.add(child.toLeaf());
                    top.cursor = child.next;
                }
            }
        }
    }

    private boolean isContainer() {
        return kind == Kind.EMPHASIS || kind == Kind.STRONG_EMPHASIS || kind == Kind.LINK || kind == Kind.IMAGE;
    }

    private Inline toContainer(List<Inline> children) {
        return switch (kind) {
            case EMPHASIS -> new Emphasis(delimiter, children);
            case STRONG_EMPHASIS -> new StrongEmphasis(delimiter, children);
            case LINK -> new Link(children, destination, title, form, label);
            case IMAGE -> new Image(children, destination, title, form, label);
            default -> throw new IllegalStateException(kind + " has no children");
        };
    }

    private Inline toLeaf() {
        return switch (kind) {
            case CODE_SPAN -> new CodeSpan(literal);
            case HTML -> new HtmlInline(literal);
            case AUTOLINK -> new Autolink(literal, destination, flag);
            case SOFT_BREAK -> new SoftLineBreak();
            case HARD_BREAK -> new HardLineBreak(flag);
            case ENTITY -> new EntityReference(literal, resolved);
            case NUMERIC_REFERENCE -> new NumericCharacterReference(literal, resolved);
            case ESCAPE -> new BackslashEscape(delimiter);
            case TEXT -> new Text(literal);
            default -> throw new IllegalStateException(kind + " is not a leaf");
        };
    }

    /** Conversion state of one container: the next child to convert and the inlines made so far. */
    private static final class Conversion {
        final InlineNode node;
        final List<Inline> result = new ArrayList<>();
        InlineNode cursor;
        StringBuilder pendingText;

        Conversion(InlineNode node) {
            this.node = node;
            this.cursor = node.firstChild;
        }

        // adjacent text nodes become one Text
        void appendText(String literal) {
            if (literal.isEmpty()) {
                return;
            }
            if (pendingText == null) {
                pendingText = new StringBuilder();
            }
            pendingText.append(literal);
        }

        void flushText() {
            if (pendingText != null) {
                result.add(new Text(pendingText.toString()));
                pendingText = null;
            }
        }
    }
}
