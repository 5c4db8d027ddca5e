package org.dxworks.mdframe.model.inline;

public record Text(String literal) implements Inline {
}
