package org.dxworks.mdframe.model;

import java.util.List;

/**
 * A list. {@code start} is the number of the first item for ordered lists and null for bullet lists.
 */
public record ListBlock(int startLine, int endLine, ListMarkerKind markerKind, Integer start, boolean tight,
                        List<ListItem> items) implements Block {

    public ListBlock {
        items = List.copyOf(items);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
