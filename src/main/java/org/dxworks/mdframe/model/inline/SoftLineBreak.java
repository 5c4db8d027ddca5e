package org.dxworks.mdframe.model.inline;

public record SoftLineBreak() implements Inline {
}
