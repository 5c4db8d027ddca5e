package org.dxworks.mdframe.model;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Root of a parse. Lives for the duration of one parse and owns the top-level blocks.
 */
@JsonTypeName("document")
public record Document(int startLine, int endLine, List<Block> children) implements ContainerBlock {

    public Document {
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.defaultResult(this);
    }
}
