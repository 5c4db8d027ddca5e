package org.dxworks.mdframe.model;

import org.dxworks.mdframe.model.inline.Inline;

import java.util.List;

public record AtxHeading(int startLine, int endLine, int level, List<Inline> content) implements Block {

    public AtxHeading {
        content = List.copyOf(content);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
