package org.dxworks.mdframe.model.inline;

public record NumericCharacterReference(String literal, String resolved) implements Inline {
}
