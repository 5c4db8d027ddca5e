package org.dxworks.mdframe.model;

import org.dxworks.mdframe.model.inline.Inline;

import java.util.List;

/**
 * Heading made of paragraph text followed by an {@code =} (level 1) or {@code -} (level 2) underline.
 * The underline is the last line of the run.
 */
public record SetextHeading(int startLine, int endLine, int level, List<Inline> content) implements Block {

    public SetextHeading {
        content = List.copyOf(content);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
