package org.dxworks.mdframe.model;

/**
 * Code between an opening fence and a closing fence of the same character and at least the same length.
 * {@code closed} is false when the enclosing container or the document ended first.
 */
public record FencedCodeBlock(int startLine, int endLine, char fenceChar, int fenceLength, int fenceIndent,
                              String info, String literal, boolean closed) implements Block {

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
