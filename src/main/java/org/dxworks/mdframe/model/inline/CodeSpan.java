package org.dxworks.mdframe.model.inline;

/**
 * Code span content with line endings turned into spaces and one surrounding space stripped.
 */
public record CodeSpan(String literal) implements Inline {
}
