package org.dxworks.mdframe.model;

import java.util.List;

public record BlockQuote(int startLine, int endLine, List<Block> children) implements ContainerBlock {

    public BlockQuote {
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
