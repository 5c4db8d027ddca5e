package org.dxworks.mdframe.parser.inline;

import java.util.regex.Pattern;

/**
 * Raw HTML grammar shared by inline HTML and the generic-tag HTML block start condition.
 */
public final class HtmlTagPatterns {

    public static final String TAG_NAME = "[A-Za-z][A-Za-z0-9-]*";
    static final String ATTRIBUTE_NAME = "[a-zA-Z_:][a-zA-Z0-9:._-]*";
    static final String UNQUOTED_VALUE = "[^\"'=<>`\\x00-\\x20]+";
    static final String SINGLE_QUOTED_VALUE = "'[^']*'";
    static final String DOUBLE_QUOTED_VALUE = "\"[^\"]*\"";
    static final String ATTRIBUTE_VALUE = "(?:" + UNQUOTED_VALUE + "|" + SINGLE_QUOTED_VALUE + "|"
            + DOUBLE_QUOTED_VALUE + ")";
    static final String ATTRIBUTE_ASSIGNMENT = "(?:[ \\t\\n\\f]*=[ \\t\\n\\f]*" + ATTRIBUTE_VALUE + ")";
    static final String ATTRIBUTE = "(?:[ \\t\\n\\f]+" + ATTRIBUTE_NAME + ATTRIBUTE_ASSIGNMENT + "?)";

    static final String COMMENT = "<!-->|<!--->|<!--(?s:.*?)-->";
    static final String PROCESSING_INSTRUCTION = "<[?](?s:.*?)[?]>";
    static final String DECLARATION = "<![A-Za-z]+[^>]*>";
    static final String CDATA = "<!\\[CDATA\\[(?s:.*?)]]>";

    static final Pattern INLINE_HTML = Pattern.compile(
            openTag(TAG_NAME) + "|" + closeTag(TAG_NAME) + "|" + COMMENT + "|" + PROCESSING_INSTRUCTION + "|"
                    + DECLARATION + "|" + CDATA);

    private HtmlTagPatterns() {}

    public static String openTag(String tagName) {
        return "<" + tagName + ATTRIBUTE + "*[ \\t\\n\\f]*/?>";
    }

    public static String closeTag(String tagName) {
        return "</" + tagName + "[ \\t\\n\\f]*>";
    }
}
