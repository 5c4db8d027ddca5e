package org.dxworks.mdframe.parser.block;

import java.util.regex.Pattern;

/**
 * The seven HTML block start conditions, each with its own end condition. A null end pattern means the block
 * ends at a blank line.
 */
enum HtmlBlockRule {
    RAW_TEXT(1,
            Pattern.compile("^<(?:script|pre|style)(?:[ \\t\\f>]|$)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("</(?:script|pre|style)>", Pattern.CASE_INSENSITIVE)),
    COMMENT(2,
            Pattern.compile("^<!--"),
            Pattern.compile("-->")),
    PROCESSING_INSTRUCTION(3,
            Pattern.compile("^<[?]"),
            Pattern.compile("\\?>")),
    DECLARATION(4,
            Pattern.compile("^<![A-Za-z]"),
            Pattern.compile(">")),
    CDATA(5,
            Pattern.compile("^<!\\[CDATA\\["),
            Pattern.compile("]]>")),
    BLOCK_TAG(6,
            Pattern.compile("^</?(?:" +
                    "address|article|aside|" +
                    "base|basefont|blockquote|body|" +
                    "caption|center|col|colgroup|" +
                    "dd|details|dialog|dir|div|dl|dt|" +
                    "fieldset|figcaption|figure|footer|form|frame|frameset|" +
                    "h1|h2|h3|h4|h5|h6|head|header|hr|html|" +
                    "iframe|" +
                    "legend|li|link|" +
                    "main|menu|menuitem|" +
                    "nav|noframes|" +
                    "ol|optgroup|option|" +
                    "p|param|" +
                    "section|source|summary|" +
                    "table|tbody|td|tfoot|th|thead|title|tr|track|" +
                    "ul" +
                    ")(?:[ \\t\\f]|/?>|$)", Pattern.CASE_INSENSITIVE),
            null),
    GENERIC_TAG(7,
            Pattern.compile("^(?:" + HtmlBlockClassifier.OPEN_TAG + "|" + HtmlBlockClassifier.CLOSE_TAG + ")[ \\t\\f]*$"),
            null);

    private final int number;
    private final Pattern start;
    private final Pattern end;

    HtmlBlockRule(int number, Pattern start, Pattern end) {
        this.number = number;
        this.start = start;
        this.end = end;
    }

    int number() {
        return number;
    }

    Pattern start() {
        return start;
    }

    boolean endsAtBlankLine() {
        return end == null;
    }

    boolean endsOn(String text) {
        return end != null && end.matcher(text).find();
    }

    /** Rule 7 is the only start condition that cannot interrupt a paragraph. */
    boolean canInterruptParagraph() {
        return this != GENERIC_TAG;
    }
}
