package org.dxworks.mdframe.model;

/**
 * {@code [label]: destination "title"}. {@code label} is the raw label text between the brackets;
 * {@code title} is null when absent.
 */
public record LinkReferenceDefinition(int startLine, int endLine, String label, String destination,
                                      String title) implements Block {

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
