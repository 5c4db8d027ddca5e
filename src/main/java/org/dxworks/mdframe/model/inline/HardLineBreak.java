package org.dxworks.mdframe.model.inline;

/**
 * Line break forced by a trailing backslash ({@code backslash}) or by two or more trailing spaces.
 */
public record HardLineBreak(boolean backslash) implements Inline {
}
