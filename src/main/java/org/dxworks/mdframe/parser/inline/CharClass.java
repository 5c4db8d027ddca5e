package org.dxworks.mdframe.parser.inline;

/**
 * Character classes used by the flanking rules. Line boundaries count as whitespace.
 */
enum CharClass {
    WHITESPACE,
    PUNCTUATION,
    OTHER;

    static CharClass of(int codePoint) {
        if (isWhitespace(codePoint)) {
            return WHITESPACE;
        }
        if (isPunctuation(codePoint)) {
            return PUNCTUATION;
        }
        return OTHER;
    }

    static boolean isWhitespace(int codePoint) {
        return codePoint == ' ' || codePoint == '\t' || codePoint == '\n' || codePoint == '\r'
                || codePoint == '\f' || Character.getType(codePoint) == Character.SPACE_SEPARATOR;
    }

    static boolean isAsciiPunctuation(int codePoint) {
        return (codePoint >= '!' && codePoint <= '/')
                || (codePoint >= ':' && codePoint <= '@')
                || (codePoint >= '[' && codePoint <= '`')
                || (codePoint >= '{' && codePoint <= '~');
    }

    static boolean isPunctuation(int codePoint) {
        if (isAsciiPunctuation(codePoint)) {
            return true;
        }
        switch (Character.getType(codePoint)) {
            case Character.CONNECTOR_PUNCTUATION:
            case Character.DASH_PUNCTUATION:
            case Character.START_PUNCTUATION:
            case Character.END_PUNCTUATION:
            case Character.INITIAL_QUOTE_PUNCTUATION:
            case Character.FINAL_QUOTE_PUNCTUATION:
            case Character.OTHER_PUNCTUATION:
            case Character.MATH_SYMBOL:
            case Character.CURRENCY_SYMBOL:
            case Character.MODIFIER_SYMBOL:
            case Character.OTHER_SYMBOL:
                return true;
            default:
                return false;
        }
    }
}
