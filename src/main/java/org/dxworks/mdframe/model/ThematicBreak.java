package org.dxworks.mdframe.model;

public record ThematicBreak(int startLine, int endLine, char marker) implements Block {

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
