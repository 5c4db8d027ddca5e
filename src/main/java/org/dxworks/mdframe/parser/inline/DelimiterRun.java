package org.dxworks.mdframe.parser.inline;

/**
 * Entry of the delimiter stack: a run of {@code *} or {@code _} with the character classes around it and the
 * derived flanking and opener/closer capabilities. {@code remaining} shrinks as emphasis consumes the run.
 */
final class DelimiterRun {

    final InlineNode node;
    final char character;
    final int originalLength;
    final CharClass before;
    final CharClass after;
    final boolean leftFlanking;
    final boolean rightFlanking;
    final boolean canOpen;
    final boolean canClose;

    int remaining;
    DelimiterRun previous;
    DelimiterRun next;

    DelimiterRun(InlineNode node, char character, int length, CharClass before, CharClass after) {
        this.node = node;
        this.character = character;
        this.originalLength = length;
        this.remaining = length;
        this.before = before;
        this.after = after;

        boolean afterIsWhitespace = after == CharClass.WHITESPACE;
        boolean afterIsPunctuation = after == CharClass.PUNCTUATION;
        boolean beforeIsWhitespace = before == CharClass.WHITESPACE;
        boolean beforeIsPunctuation = before == CharClass.PUNCTUATION;

        this.leftFlanking = !afterIsWhitespace
                && (!afterIsPunctuation || beforeIsWhitespace || beforeIsPunctuation);
        this.rightFlanking = !beforeIsWhitespace
                && (!beforeIsPunctuation || afterIsWhitespace || afterIsPunctuation);

        if (character == '_') {
            this.canOpen = leftFlanking && (!rightFlanking || beforeIsPunctuation);
            this.canClose = rightFlanking && (!leftFlanking || afterIsPunctuation);
        } else {
            this.canOpen = leftFlanking;
            this.canClose = rightFlanking;
        }
    }

    /**
     * The rule of 3: when either run can both open and close, the runs only match if their combined original
     * length is not a multiple of 3, unless both lengths are.
     */
    boolean mayPairWith(DelimiterRun closer) {
        boolean oddMatch = (closer.canOpen || this.canClose)
                && (this.originalLength + closer.originalLength) % 3 == 0
                && !(this.originalLength % 3 == 0 && closer.originalLength % 3 == 0);
        return !oddMatch;
    }
}
