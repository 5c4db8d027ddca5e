package org.dxworks.mdframe.parser.inline;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Backslash-escape and character-reference decoding for link destinations, titles and info strings.
 */
public final class InlineEscapes {

    static final Pattern ENTITY_OR_NUMERIC = Pattern.compile(
            "&(?:#[xX]([0-9a-fA-F]{1,6})|#([0-9]{1,7})|([A-Za-z][A-Za-z0-9]{1,31}));");

    private static final Pattern ESCAPE_OR_REFERENCE = Pattern.compile(
            "\\\\[!-/:-@\\[-`{-~]|" + ENTITY_OR_NUMERIC.pattern());

    private static final String REPLACEMENT_CHARACTER = "\uFFFD";

    private InlineEscapes() {}

    /**
     * Replaces backslash escapes of ASCII punctuation with the character and resolvable references with their
     * text. Unknown named references stay as written.
     */
    public static String unescape(String text, EntityTable entities) {
        if (text.indexOf('\\') < 0 && text.indexOf('&') < 0) {
            return text;
        }
        Matcher matcher = ESCAPE_OR_REFERENCE.matcher(text);
        StringBuilder out = new StringBuilder(text.length());
        int last = 0;
        while (matcher.find()) {
            out.append(text, last, matcher.start());
            String match = matcher.group();
            if (match.charAt(0) == '\\') {
                out.append(match.charAt(1));
            } else {
                out.append(resolveReference(matcher, entities, match));
            }
            last = matcher.end();
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    private static String resolveReference(Matcher matcher, EntityTable entities, String match) {
        if (matcher.group(1) != null) {
            return codePointText(Integer.parseInt(matcher.group(1), 16));
        }
        if (matcher.group(2) != null) {
            return codePointText(Integer.parseInt(matcher.group(2)));
        }
        String resolved = entities.lookup(matcher.group(3));
        return resolved != null ? resolved : match;
    }

    /**
     * Text for a numeric character reference. Zero, surrogates and values beyond Unicode become U+FFFD.
     */
    static String codePointText(int codePoint) {
        if (codePoint == 0 || codePoint > Character.MAX_CODE_POINT
                || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
            return REPLACEMENT_CHARACTER;
        }
        return new String(Character.toChars(codePoint));
    }
}
