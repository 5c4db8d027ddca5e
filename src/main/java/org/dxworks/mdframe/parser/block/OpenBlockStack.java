package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.parser.GrammarInvariantException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * Builders currently accepting continuation lines, outermost (the document) first.
 * Every element except the last is a container; closing an element closes everything above it.
 */
final class OpenBlockStack {

    private final List<BlockBuilder> blocks = new ArrayList<>();

    OpenBlockStack(BlockBuilder document) {
        if (document.kind != BlockKind.DOCUMENT) {
            throw new GrammarInvariantException("Stack root must be the document, got " + document.kind);
        }
        blocks.add(document);
    }

    int size() {
        return blocks.size();
    }

    BlockBuilder get(int index) {
        return blocks.get(index);
    }

    BlockBuilder tip() {
        return blocks.get(blocks.size() - 1);
    }

    BlockBuilder document() {
        return blocks.get(0);
    }

    void push(BlockBuilder block) {
        BlockBuilder tip = tip();
        if (!tip.kind.isContainer()) {
            throw new GrammarInvariantException("Cannot open " + block.kind + " on top of leaf " + tip);
        }
        tip.appendChild(block);
        blocks.add(block);
    }

    /**
     * Closes every element at index {@code from} and above, innermost first.
     *
     * @param closer receives each index just before the element there is popped
     */
    void closeFrom(int from, IntConsumer closer) {
        if (from < 1) {
            throw new GrammarInvariantException("The document cannot be closed while lines remain");
        }
        for (int i = blocks.size() - 1; i >= from; i--) {
            closer.accept(i);
            blocks.remove(i);
        }
    }

    /** Closes everything including the document, innermost first. */
    void closeAll(IntConsumer closer) {
        for (int i = blocks.size() - 1; i >= 0; i--) {
            closer.accept(i);
            blocks.remove(i);
        }
    }

    int depth() {
        return blocks.size();
    }

    @Override
    public String toString() {
        return blocks.toString();
    }
}
