package org.dxworks.mdframe.model.inline;

public record BackslashEscape(char escaped) implements Inline {
}
