package org.dxworks.mdframe.model;

import java.util.List;

/**
 * A list item. {@code contentIndent} is the column where item content begins, relative to the marker's
 * container; {@code number} is the ordinal written in the marker for ordered items, null otherwise.
 */
public record ListItem(int startLine, int endLine, ListMarkerKind markerKind, Integer number, int markerIndent,
                       int contentIndent, List<Block> children) implements ContainerBlock {

    public ListItem {
        children = List.copyOf(children);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
