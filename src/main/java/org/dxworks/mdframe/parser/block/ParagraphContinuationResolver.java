package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.parser.GrammarInvariantException;

/**
 * Decides what happens to an open paragraph when a new line arrives, whether or not its containers matched.
 *
 * <p>Two readings are evaluated on separate cursor copies. {@link Branch#CONTINUATION} appends the line to the
 * paragraph, which holds unless the line is blank or some construct that may interrupt a paragraph starts on
 * it. {@link Branch#CLOSE} ends the paragraph, which holds when the line is blank or any block start applies.
 * Exactly one of the two must survive; anything else means the opener table and the interruption rules disagree.
 * Lazy continuation is the continuation branch winning for a paragraph whose containers did not match.</p>
 */
final class ParagraphContinuationResolver {

    enum Branch {
        CONTINUATION,
        CLOSE
    }

    private ParagraphContinuationResolver() {}

    /**
     * @param cursor  line position after the matched containers, with the next non-space already located
     * @param context opener context for the innermost matched container
     */
    static Branch resolve(LineCursor cursor, OpenerContext context) {
        boolean continuationSurvives = !cursor.isBlank() && !interrupted(cursor.copy(), context);
        boolean closeSurvives = cursor.isBlank() || BlockOpener.firstMatch(cursor.copy(), context) != null;

        if (continuationSurvives == closeSurvives) {
            throw new GrammarInvariantException("Paragraph continuation at line " + context.lineNumber() + " has "
                    + (continuationSurvives ? "two" : "no") + " surviving branches");
        }
        return continuationSurvives ? Branch.CONTINUATION : Branch.CLOSE;
    }

    private static boolean interrupted(LineCursor cursor, OpenerContext context) {
        for (BlockOpener opener : BlockOpener.values()) {
            if (opener.interruptsParagraph() && opener.tryOpen(cursor, context) != null) {
                return true;
            }
        }
        return false;
    }
}
