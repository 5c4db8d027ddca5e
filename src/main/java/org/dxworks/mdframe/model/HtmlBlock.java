package org.dxworks.mdframe.model;

/**
 * Raw HTML lines. {@code rule} is the start condition (1-7) that opened the block.
 */
public record HtmlBlock(int startLine, int endLine, int rule, String literal) implements Block {

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
