package org.dxworks.mdframe.model.inline;

/**
 * {@code <scheme:...>} or {@code <user@host>}. {@code literal} is the text between the angle brackets.
 */
public record Autolink(String literal, String destination, boolean email) implements Inline {
}
