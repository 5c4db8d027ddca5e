package org.dxworks.mdframe.model;

public record IndentedCodeBlock(int startLine, int endLine, String literal) implements Block {

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
