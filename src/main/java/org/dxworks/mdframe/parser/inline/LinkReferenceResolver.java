package org.dxworks.mdframe.parser.inline;

import java.util.ArrayList;
import java.util.List;

/**
 * Scanning of the link pieces shared by inline links and link reference definitions: labels, destinations and
 * titles. Each scan works on a subject string from a start index and reports where it stopped; a failed scan
 * returns null or -1 and consumes nothing.
 */
public final class LinkReferenceResolver {

    static final int MAX_LABEL_LENGTH = 999;

    private final EntityTable entities;
    private final int maxParenDepth;

    public LinkReferenceResolver(EntityTable entities, int maxParenDepth) {
        this.entities = entities;
        this.maxParenDepth = maxParenDepth;
    }

    /** A scanned destination or title: the decoded value and the index just past it. */
    public record Scanned(String value, int end) {
    }

    /** A definition read from the start of a paragraph, spanning {@code lineCount} of its lines. */
    public record ParsedDefinition(String label, String destination, String title, int lineCount) {
    }

    /**
     * Scans a link label starting at the {@code [} at {@code start}.
     *
     * @return the index just past the closing {@code ]}, or -1 when no valid label starts here
     */
    public static int scanLabel(String subject, int start) {
        if (start >= subject.length() || subject.charAt(start) != '[') {
            return -1;
        }
        boolean hasNonWhitespace = false;
        int i = start + 1;
        while (i < subject.length()) {
            char c = subject.charAt(i);
            if (c == ']') {
                return hasNonWhitespace && i - start - 1 <= MAX_LABEL_LENGTH ? i + 1 : -1;
            }
            if (c == '[') {
                return -1;
            }
            if (c == '\\' && i + 1 < subject.length() && CharClass.isAsciiPunctuation(subject.charAt(i + 1))) {
                hasNonWhitespace = true;
                i += 2;
                continue;
            }
            if (!CharClass.isWhitespace(c)) {
                hasNonWhitespace = true;
            }
            i++;
        }
        return -1;
    }

    /**
     * Scans a destination, either {@code <...>} on one line or a bare run without whitespace whose parentheses
     * balance within the configured nesting depth.
     */
    public Scanned scanDestination(String subject, int start) {
        if (start < subject.length() && subject.charAt(start) == '<') {
            int i = start + 1;
            while (i < subject.length()) {
                char c = subject.charAt(i);
                if (c == '>') {
                    return new Scanned(InlineEscapes.unescape(subject.substring(start + 1, i), entities), i + 1);
                }
                if (c == '<' || c == '\n') {
                    return null;
                }
                i += c == '\\' && i + 1 < subject.length() ? 2 : 1;
            }
            return null;
        }

        int depth = 0;
        int i = start;
        while (i < subject.length()) {
            char c = subject.charAt(i);
            if (c == '\\' && i + 1 < subject.length() && CharClass.isAsciiPunctuation(subject.charAt(i + 1))) {
                i += 2;
            } else if (c == '(') {
                depth++;
                if (depth > maxParenDepth) {
                    return null;
                }
                i++;
            } else if (c == ')') {
                if (depth == 0) {
                    break;
                }
                depth--;
                i++;
            } else if (c <= ' ') {
                break;
            } else {
                i++;
            }
        }
        if (depth != 0) {
            return null;
        }
        if (i == start && (i >= subject.length() || subject.charAt(i) != ')')) {
            return null;
        }
        return new Scanned(InlineEscapes.unescape(subject.substring(start, i), entities), i);
    }

    /**
     * Scans a title in double quotes, single quotes or parentheses. A title may span lines but never a blank line.
     */
    public Scanned scanTitle(String subject, int start) {
        if (start >= subject.length()) {
            return null;
        }
        char open = subject.charAt(start);
        char close;
        if (open == '"' || open == '\'') {
            close = open;
        } else if (open == '(') {
            close = ')';
        } else {
            return null;
        }
        int i = start + 1;
        while (i < subject.length()) {
            char c = subject.charAt(i);
            if (c == close) {
                return new Scanned(InlineEscapes.unescape(subject.substring(start + 1, i), entities), i + 1);
            }
            if (c == '\\' && i + 1 < subject.length()) {
                i += 2;
                continue;
            }
            if (open == '(' && c == '(') {
                return null;
            }
            if (c == '\n' && startsBlankLine(subject, i + 1)) {
                return null;
            }
            i++;
        }
        return null;
    }

    /**
     * Reads the link reference definitions at the start of a paragraph. Scanning stops at the first line that
     * does not continue a definition; the remaining lines stay paragraph text.
     */
    public List<ParsedDefinition> parseDefinitions(List<String> lines) {
        if (lines.isEmpty() || !lines.get(0).startsWith("[")) {
            return new ArrayList<>();
        }
        String text = String.join("\n", lines) + "\n";
        List<ParsedDefinition> result = new ArrayList<>();
        int pos = 0;
        while (pos < text.length() && text.charAt(pos) == '[') {
            int end = parseDefinition(text, pos, result);
            if (end < 0) {
                break;
            }
            pos = end;
        }
        return result;
    }

    /** Number of leading lines that {@link #parseDefinitions(List)} would consume. */
    public int definitionLineCount(List<String> lines) {
        return parseDefinitions(lines).stream().mapToInt(ParsedDefinition::lineCount).sum();
    }

    private int parseDefinition(String text, int start, List<ParsedDefinition> into) {
        int labelEnd = scanLabel(text, start);
        if (labelEnd < 0 || labelEnd >= text.length() || text.charAt(labelEnd) != ':') {
            return -1;
        }
        String rawLabel = text.substring(start + 1, labelEnd - 1);
        if (LinkReferenceTable.normalizeLabel(rawLabel).isEmpty()) {
            return -1;
        }

        int pos = skipSpacesAndOneNewline(text, labelEnd + 1);
        Scanned destination = scanDestination(text, pos);
        if (destination == null || (destination.end() == pos)) {
            return -1;
        }

        int beforeTitle = destination.end();
        pos = skipSpacesAndOneNewline(text, beforeTitle);
        Scanned title = pos != beforeTitle ? scanTitle(text, pos) : null;
        int end = -1;
        if (title != null) {
            end = skipToLineEnd(text, title.end());
            if (end < 0) {
                title = null;
            }
        }
        if (title == null) {
            end = skipToLineEnd(text, beforeTitle);
            if (end < 0) {
                return -1;
            }
        }

        int lineCount = 0;
        for (int i = start; i < end; i++) {
            if (text.charAt(i) == '\n') {
                lineCount++;
            }
        }
        into.add(new ParsedDefinition(rawLabel, destination.value(), title == null ? null : title.value(), lineCount));
        return end;
    }

    /** Skips spaces and tabs, at most one newline, then spaces and tabs again. */
    public static int skipSpacesAndOneNewline(String subject, int pos) {
        int i = skipSpaces(subject, pos);
        if (i < subject.length() && subject.charAt(i) == '\n') {
            i = skipSpaces(subject, i + 1);
        }
        return i;
    }

    static int skipSpaces(String subject, int pos) {
        int i = pos;
        while (i < subject.length() && (subject.charAt(i) == ' ' || subject.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    // index just past the end of line, or -1 when anything but spaces follows
    private static int skipToLineEnd(String text, int pos) {
        int i = skipSpaces(text, pos);
        if (i >= text.length()) {
            return i;
        }
        return text.charAt(i) == '\n' ? i + 1 : -1;
    }

    private static boolean startsBlankLine(String subject, int pos) {
        int i = skipSpaces(subject, pos);
        return i >= subject.length() || subject.charAt(i) == '\n';
    }
}
