package org.dxworks.mdframe.model;

public record BlankLine(int startLine, int endLine) implements Block {

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
