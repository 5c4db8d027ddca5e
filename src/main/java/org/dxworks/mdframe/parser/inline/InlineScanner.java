package org.dxworks.mdframe.parser.inline;

import org.dxworks.mdframe.model.inline.Inline;
import org.dxworks.mdframe.model.inline.LinkForm;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the raw text of a paragraph, heading or table cell into inline nodes.
 *
 * <p>Code spans, autolinks and raw HTML are recognized as soon as they are reached, so they take precedence over
 * any emphasis or link delimiter inside them. Runs of {@code *} and {@code _} go on a delimiter stack and
 * {@code [} / {@code ![} on a bracket stack; emphasis is resolved when a link closes (for the delimiters inside
 * it) and once more at the end for everything left.</p>
 *
 * <p>An instance keeps the state of the text being scanned and is not safe for concurrent use.</p>
 */
public final class InlineScanner {

    static final int MAX_BRACKET_DEPTH = 64;

    private static final Pattern EMAIL_AUTOLINK = Pattern.compile(
            "<([a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+@[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?"
                    + "(?:\\.[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?)*)>");
    private static final Pattern URI_AUTOLINK = Pattern.compile(
            "<([A-Za-z][A-Za-z0-9.+-]{1,31}:[^<>\\x00-\\x20]*)>");

    private final LinkReferenceTable references;
    private final EntityTable entities;
    private final LinkReferenceResolver resolver;

    private String subject;
    private int pos;
    private InlineNode root;
    private DelimiterRun delimiters;
    private Bracket brackets;

    public InlineScanner(LinkReferenceTable references, EntityTable entities, int maxParenDepth) {
        this.references = references;
        this.entities = entities;
        this.resolver = new LinkReferenceResolver(entities, maxParenDepth);
    }

    public List<Inline> parse(String text) {
        subject = stripSpacesAndTabs(text);
        pos = 0;
        root = new InlineNode(InlineNode.Kind.ROOT);
        delimiters = null;
        brackets = null;

        while (pos < subject.length()) {
            char c = subject.charAt(pos);
            boolean handled = switch (c) {
                case '\n' -> parseNewline();
                case '\\' -> parseBackslash();
                case '`' -> parseBackticks();
                case '*', '_' -> parseDelimiterRun(c);
                case '[' -> parseOpenBracket();
                case '!' -> parseBang();
                case ']' -> parseCloseBracket();
                case '<' -> parseAutolink() || parseHtmlTag();
                case '&' -> parseEntity();
                default -> parseString();
            };
            if (!handled) {
                pos++;
                appendText(String.valueOf(c));
            }
        }
        processEmphasis(null);
        return root.toInlines();
    }

    private void appendText(String literal) {
        root.appendChild(InlineNode.text(literal));
    }

    private char peek() {
        return pos < subject.length() ? subject.charAt(pos) : '\0';
    }

    private boolean parseString() {
        int start = pos;
        while (pos < subject.length() && !isSpecial(subject.charAt(pos))) {
            pos++;
        }
        if (pos == start) {
            return false;
        }
        appendText(subject.substring(start, pos));
        return true;
    }

    private static boolean isSpecial(char c) {
        return switch (c) {
            case '\n', '`', '[', ']', '\\', '!', '<', '&', '*', '_' -> true;
            default -> false;
        };
    }

    private boolean parseNewline() {
        pos++;
        InlineNode last = root.lastChild;
        boolean hard = false;
        if (last != null && last.kind == InlineNode.Kind.TEXT && last.literal.endsWith(" ")) {
            hard = last.literal.endsWith("  ");
            last.literal = stripTrailingSpaces(last.literal);
        }
        InlineNode lineBreak = new InlineNode(hard ? InlineNode.Kind.HARD_BREAK : InlineNode.Kind.SOFT_BREAK);
        root.appendChild(lineBreak);
        while (peek() == ' ') {
            pos++;
        }
        return true;
    }

    private static String stripSpacesAndTabs(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && (text.charAt(start) == ' ' || text.charAt(start) == '\t')) {
            start++;
        }
        while (end > start && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
            end--;
        }
        return text.substring(start, end);
    }

    private static String stripTrailingSpaces(String text) {
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == ' ') {
            end--;
        }
        return text.substring(0, end);
    }

    private boolean parseBackslash() {
        pos++;
        char next = peek();
        if (next == '\n') {
            pos++;
            InlineNode lineBreak = new InlineNode(InlineNode.Kind.HARD_BREAK);
            lineBreak.flag = true;
            root.appendChild(lineBreak);
        } else if (pos < subject.length() && CharClass.isAsciiPunctuation(next)) {
            pos++;
            InlineNode escape = new InlineNode(InlineNode.Kind.ESCAPE);
            escape.delimiter = next;
            root.appendChild(escape);
        } else {
            appendText("\\");
        }
        return true;
    }

    private boolean parseBackticks() {
        int start = pos;
        while (peek() == '`') {
            pos++;
        }
        int ticks = pos - start;
        int contentStart = pos;
        int search = pos;
        while (search < subject.length()) {
            int runStart = subject.indexOf('`', search);
            if (runStart < 0) {
                break;
            }
            int runEnd = runStart;
            while (runEnd < subject.length() && subject.charAt(runEnd) == '`') {
                runEnd++;
            }
            if (runEnd - runStart == ticks) {
                InlineNode code = new InlineNode(InlineNode.Kind.CODE_SPAN);
                code.literal = normalizeCodeSpan(subject.substring(contentStart, runStart));
                root.appendChild(code);
                pos = runEnd;
                return true;
            }
            search = runEnd;
        }
        pos = contentStart;
        appendText(subject.substring(start, contentStart));
        return true;
    }

    private static String normalizeCodeSpan(String raw) {
        String content = raw.replace('\n', ' ');
        if (content.length() >= 2 && content.charAt(0) == ' ' && content.charAt(content.length() - 1) == ' '
                && content.chars().anyMatch(ch -> ch != ' ')) {
            return content.substring(1, content.length() - 1);
        }
        return content;
    }

    private boolean parseDelimiterRun(char c) {
        int start = pos;
        while (peek() == c) {
            pos++;
        }
        int before = start == 0 ? '\n' : subject.codePointBefore(start);
        int after = pos >= subject.length() ? '\n' : subject.codePointAt(pos);

        InlineNode node = InlineNode.text(subject.substring(start, pos));
        root.appendChild(node);
        DelimiterRun run = new DelimiterRun(node, c, pos - start, CharClass.of(before), CharClass.of(after));
        if (run.canOpen || run.canClose) {
            run.previous = delimiters;
            if (delimiters != null) {
                delimiters.next = run;
            }
            delimiters = run;
        }
        return true;
    }

    private boolean parseOpenBracket() {
        int start = pos;
        pos++;
        InlineNode node = InlineNode.text("[");
        root.appendChild(node);
        addBracket(node, start, false);
        return true;
    }

    private boolean parseBang() {
        int start = pos;
        pos++;
        if (peek() == '[') {
            pos++;
            InlineNode node = InlineNode.text("![");
            root.appendChild(node);
            addBracket(node, start + 1, true);
        } else {
            appendText("!");
        }
        return true;
    }

    private void addBracket(InlineNode node, int index, boolean image) {
        if (brackets != null) {
            brackets.bracketAfter = true;
            // deeper openers stay literal text
            if (brackets.depth >= MAX_BRACKET_DEPTH) {
                return;
            }
        }
        brackets = new Bracket(node, index, image, delimiters, brackets);
    }

    private boolean parseCloseBracket() {
        int closeIndex = pos;
        pos++;
        int afterClose = pos;

        Bracket opener = brackets;
        if (opener == null) {
            appendText("]");
            return true;
        }
        if (!opener.active) {
            brackets = opener.previous;
            appendText("]");
            return true;
        }

        String destination = null;
        String title = null;
        String label = null;
        LinkForm form = null;
        boolean matched = false;

        if (peek() == '(') {
            int p = LinkReferenceResolver.skipSpacesAndOneNewline(subject, pos + 1);
            LinkReferenceResolver.Scanned dest = resolver.scanDestination(subject, p);
            if (dest != null) {
                p = dest.end();
                int afterDestination = p;
                p = LinkReferenceResolver.skipSpacesAndOneNewline(subject, p);
                LinkReferenceResolver.Scanned scannedTitle = null;
                if (p != afterDestination) {
                    scannedTitle = resolver.scanTitle(subject, p);
                    if (scannedTitle != null) {
                        p = LinkReferenceResolver.skipSpacesAndOneNewline(subject, scannedTitle.end());
                    }
                }
                if (p < subject.length() && subject.charAt(p) == ')') {
                    pos = p + 1;
                    matched = true;
                    destination = dest.value();
                    title = scannedTitle == null ? null : scannedTitle.value();
                    form = LinkForm.INLINE;
                }
            }
        }

        if (!matched) {
            String rawLabel = null;
            int labelEnd = LinkReferenceResolver.scanLabel(subject, pos);
            if (labelEnd > 0) {
                rawLabel = subject.substring(pos + 1, labelEnd - 1);
                form = LinkForm.FULL_REFERENCE;
                pos = labelEnd;
            } else if (!opener.bracketAfter) {
                rawLabel = subject.substring(opener.index + 1, closeIndex);
                if (subject.startsWith("[]", pos)) {
                    form = LinkForm.COLLAPSED_REFERENCE;
                    pos += 2;
                } else {
                    form = LinkForm.SHORTCUT_REFERENCE;
                }
            }
            if (rawLabel != null) {
                Optional<LinkDefinition> definition = references.lookup(rawLabel);
                if (definition.isPresent()) {
                    matched = true;
                    destination = definition.get().destination();
                    title = definition.get().title();
                    label = rawLabel;
                }
            }
        }

        // links never nest, and a link never forms inside an image description
        if (matched && !opener.image && insideImage(opener)) {
            matched = false;
        }

        if (!matched) {
            brackets = opener.previous;
            pos = afterClose;
            appendText("]");
            return true;
        }

        InlineNode link = new InlineNode(opener.image ? InlineNode.Kind.IMAGE : InlineNode.Kind.LINK);
        link.destination = destination;
        link.title = title;
        link.label = label;
        link.form = form;
        link.adoptAfter(opener.node);
        root.appendChild(link);
        processEmphasis(opener.previousDelimiter);
        brackets = opener.previous;
        opener.node.unlink();

        if (!opener.image) {
            for (Bracket earlier = brackets; earlier != null; earlier = earlier.previous) {
                if (!earlier.image) {
                    earlier.active = false;
                }
            }
        }
        return true;
    }

    private static boolean insideImage(Bracket opener) {
        for (Bracket earlier = opener.previous; earlier != null; earlier = earlier.previous) {
            if (earlier.image) {
                return true;
            }
        }
        return false;
    }

    private boolean parseAutolink() {
        Matcher email = EMAIL_AUTOLINK.matcher(subject).region(pos, subject.length());
        if (email.lookingAt()) {
            appendAutolink(email.group(1), "mailto:" + email.group(1), true);
            pos = email.end();
            return true;
        }
        Matcher uri = URI_AUTOLINK.matcher(subject).region(pos, subject.length());
        if (uri.lookingAt()) {
            appendAutolink(uri.group(1), uri.group(1), false);
            pos = uri.end();
            return true;
        }
        return false;
    }

    private void appendAutolink(String literal, String destination, boolean email) {
        InlineNode autolink = new InlineNode(InlineNode.Kind.AUTOLINK);
        autolink.literal = literal;
        autolink.destination = destination;
        autolink.flag = email;
        root.appendChild(autolink);
    }

    private boolean parseHtmlTag() {
        Matcher html = HtmlTagPatterns.INLINE_HTML.matcher(subject).region(pos, subject.length());
        if (!html.lookingAt()) {
            return false;
        }
        InlineNode node = new InlineNode(InlineNode.Kind.HTML);
        node.literal = html.group();
        root.appendChild(node);
        pos = html.end();
        return true;
    }

    private boolean parseEntity() {
        Matcher reference = InlineEscapes.ENTITY_OR_NUMERIC.matcher(subject).region(pos, subject.length());
        if (!reference.lookingAt()) {
            return false;
        }
        String literal = reference.group();
        InlineNode node;
        if (reference.group(3) != null) {
            String resolved = entities.lookup(reference.group(3));
            if (resolved == null) {
                return false;
            }
            node = new InlineNode(InlineNode.Kind.ENTITY);
            node.resolved = resolved;
        } else {
            int codePoint = reference.group(1) != null
                    ? Integer.parseInt(reference.group(1), 16)
                    : Integer.parseInt(reference.group(2));
            node = new InlineNode(InlineNode.Kind.NUMERIC_REFERENCE);
            node.resolved = InlineEscapes.codePointText(codePoint);
        }
        node.literal = literal;
        root.appendChild(node);
        pos = reference.end();
        return true;
    }

    /**
     * Matches closers against openers above {@code stackBottom}, innermost closer first. Each match consumes the
     * smaller of the two remaining run lengths: one delimiter makes emphasis, two make strong emphasis, three make
     * strong emphasis wrapping emphasis; longer runs are peeled two at a time.
     */
    private void processEmphasis(DelimiterRun stackBottom) {
        DelimiterRun[] openersBottom = new DelimiterRun[12];
        Arrays.fill(openersBottom, stackBottom);

        DelimiterRun closer = delimiters;
        while (closer != null && closer.previous != stackBottom) {
            closer = closer.previous;
        }

        while (closer != null) {
            if (!closer.canClose) {
                closer = closer.next;
                continue;
            }
            int bucket = (closer.character == '_' ? 6 : 0) + (closer.canOpen ? 3 : 0) + closer.originalLength % 3;
            DelimiterRun opener = closer.previous;
            boolean found = false;
            while (opener != null && opener != stackBottom && opener != openersBottom[bucket]) {
                if (opener.character == closer.character && opener.canOpen && opener.mayPairWith(closer)) {
                    found = true;
                    break;
                }
                opener = opener.previous;
            }

            DelimiterRun oldCloser = closer;
            if (found) {
                int available = Math.min(opener.remaining, closer.remaining);
                int use = available > 3 ? 2 : available;
                opener.remaining -= use;
                closer.remaining -= use;
                opener.node.literal = opener.node.literal.substring(0, opener.node.literal.length() - use);
                closer.node.literal = closer.node.literal.substring(use);

                InlineNode emphasis = wrapEmphasis(opener.node, closer.node, closer.character, use);
                opener.node.insertAfter(emphasis);

                DelimiterRun between = closer.previous;
                while (between != null && between != opener) {
                    DelimiterRun previous = between.previous;
                    removeDelimiter(between);
                    between = previous;
                }
                if (opener.remaining == 0) {
                    opener.node.unlink();
                    removeDelimiter(opener);
                }
                if (closer.remaining == 0) {
                    DelimiterRun next = closer.next;
                    closer.node.unlink();
                    removeDelimiter(closer);
                    closer = next;
                }
            } else {
                closer = closer.next;
                openersBottom[bucket] = oldCloser.previous;
                if (!oldCloser.canOpen) {
                    removeDelimiter(oldCloser);
                }
            }
        }

        while (delimiters != null && delimiters != stackBottom) {
            removeDelimiter(delimiters);
        }
    }

    private static InlineNode wrapEmphasis(InlineNode openerNode, InlineNode closerNode, char delimiter, int use) {
        InlineNode outer = new InlineNode(use == 1 ? InlineNode.Kind.EMPHASIS : InlineNode.Kind.STRONG_EMPHASIS);
        outer.delimiter = delimiter;
        if (use == 3) {
            InlineNode inner = new InlineNode(InlineNode.Kind.EMPHASIS);
            inner.delimiter = delimiter;
            inner.adoptBetween(openerNode, closerNode);
            outer.appendChild(inner);
        } else {
            outer.adoptBetween(openerNode, closerNode);
        }
        return outer;
    }

    private void removeDelimiter(DelimiterRun run) {
        if (run.previous != null) {
            run.previous.next = run.next;
        }
        if (run.next != null) {
            run.next.previous = run.previous;
        } else {
            delimiters = run.previous;
        }
        run.previous = null;
        run.next = null;
    }
}
