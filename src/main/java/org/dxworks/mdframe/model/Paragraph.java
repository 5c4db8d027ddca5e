package org.dxworks.mdframe.model;

import org.dxworks.mdframe.model.inline.Inline;

import java.util.List;

public record Paragraph(int startLine, int endLine, List<Inline> content) implements Block {

    public Paragraph {
        content = List.copyOf(content);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
