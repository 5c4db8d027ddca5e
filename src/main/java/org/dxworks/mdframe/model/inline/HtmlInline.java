package org.dxworks.mdframe.model.inline;

/**
 * Raw HTML: open tag, closing tag, comment, processing instruction, declaration or CDATA section.
 */
public record HtmlInline(String literal) implements Inline {
}
