package org.dxworks.mdframe.model.inline;

import java.util.List;

public record Emphasis(char delimiter, List<Inline> children) implements Inline {

    public Emphasis {
        children = List.copyOf(children);
    }
}
