package org.dxworks.mdframe.parser;

/**
 * Signals an internal-consistency failure of the grammar logic: a required merge point with zero or several
 * surviving branches, or a broken open-block stack. Malformed Markdown never raises this; it degrades to text.
 */
public class GrammarInvariantException extends IllegalStateException {

    /**
     * Creates a grammar invariant exception.
     *
     * @param message what broke, including the line number where it was observed
     */
    public GrammarInvariantException(String message) {
        super(message);
    }
}
