package org.dxworks.mdframe.parser.inline;

/**
 * Entry of the bracket stack, one per {@code [} or {@code ![} still waiting for its {@code ]}.
 */
final class Bracket {

    final InlineNode node;
    final int index;
    final boolean image;
    final DelimiterRun previousDelimiter;
    final Bracket previous;
    final int depth;
    boolean active = true;
    boolean bracketAfter;

    Bracket(InlineNode node, int index, boolean image, DelimiterRun previousDelimiter, Bracket previous) {
        this.node = node;
        this.index = index;
        this.image = image;
        this.previousDelimiter = previousDelimiter;
        this.previous = previous;
        this.depth = previous == null ? 1 : previous.depth + 1;
    }
}
