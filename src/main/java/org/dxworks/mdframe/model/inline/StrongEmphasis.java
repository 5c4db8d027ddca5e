package org.dxworks.mdframe.model.inline;

import java.util.List;

public record StrongEmphasis(char delimiter, List<Inline> children) implements Inline {

    public StrongEmphasis {
        children = List.copyOf(children);
    }
}
