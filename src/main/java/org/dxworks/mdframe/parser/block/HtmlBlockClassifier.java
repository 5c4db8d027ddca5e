package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.parser.inline.HtmlTagPatterns;

/**
 * Decides which of the seven HTML block start conditions a line opens, and when the opened block ends.
 * Rules are tried in number order; the first match wins, so a {@code <pre>} line is rule 1 and never rule 7.
 */
final class HtmlBlockClassifier {

    // rule 7 never applies to the raw text elements of rule 1
    static final String GENERIC_TAG_NAME = "(?!(?i:script|style|pre)(?![A-Za-z0-9-]))" + HtmlTagPatterns.TAG_NAME;
    static final String OPEN_TAG = HtmlTagPatterns.openTag(GENERIC_TAG_NAME);
    static final String CLOSE_TAG = HtmlTagPatterns.closeTag(GENERIC_TAG_NAME);

    private HtmlBlockClassifier() {}

    /**
     * Classifies the text starting at the first non-space character of a line.
     *
     * @param text          line text from the first non-space character, already known to be indented less than 4
     * @param paragraphOpen whether the innermost open block is a paragraph this block would interrupt
     * @return the start condition, or null when no HTML block starts here
     */
    static HtmlBlockRule classifyStart(String text, boolean paragraphOpen) {
        if (text.isEmpty() || text.charAt(0) != '<') {
            return null;
        }
        for (HtmlBlockRule rule : HtmlBlockRule.values()) {
            if (rule.start().matcher(text).find()) {
                if (paragraphOpen && !rule.canInterruptParagraph()) {
                    return null;
                }
                return rule;
            }
        }
        return null;
    }

    /**
     * Whether a line that was just added to a block of {@code rule} ends it. Blank-line terminated rules end
     * before the blank line instead, during continuation matching.
     */
    static boolean endsOnLine(HtmlBlockRule rule, String line) {
        return rule.endsOn(line);
    }
}
