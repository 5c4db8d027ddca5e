package org.dxworks.mdframe.model.inline;

public record EntityReference(String literal, String resolved) implements Inline {
}
