package org.dxworks.mdframe.model;

import org.dxworks.mdframe.model.inline.Inline;

import java.util.List;

public record TableCell(List<Inline> content) {

    public TableCell {
        content = List.copyOf(content);
    }
}
