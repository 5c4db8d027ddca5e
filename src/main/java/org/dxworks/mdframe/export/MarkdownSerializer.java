package org.dxworks.mdframe.export;

import org.dxworks.mdframe.model.*;
import org.dxworks.mdframe.model.inline.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes a parsed tree back to Markdown, keeping the syntactic choices recorded in the tree: heading style,
 * fence characters and lengths, list markers and indentation, link forms and escapes. Parsing the output again
 * yields a structurally equal tree.
 *
 * <p>Blank lines present in the tree are written as they are. Where two adjacent blocks would otherwise merge on
 * re-parse (a paragraph followed by another paragraph, anything after a block quote or list, an HTML block that
 * ends at a blank line) a blank line is inserted.</p>
 */
public class MarkdownSerializer {

    // deep enough that a line can only continue the open paragraph
    private static final String CONTINUATION_INDENT = "    ";

    public String serialize(Document document) {
        List<String> lines = renderBlocks(document.children());
        if (lines.isEmpty()) {
            return "";
        }
        return String.join("\n", lines) + "\n";
    }

    private List<String> renderBlocks(List<Block> blocks) {
        List<String> lines = new ArrayList<>();
        Block previous = null;
        for (Block block : blocks) {
            if (previous != null && needsSeparator(previous, block) && !endsWithBlank(lines)
                    && !endsWithOpenFence(previous)) {
                lines.add("");
            }
            lines.addAll(renderBlock(block));
            previous = block;
        }
        return lines;
    }

    private static boolean endsWithBlank(List<String> lines) {
        return !lines.isEmpty() && lines.get(lines.size() - 1).isEmpty();
    }

    private static boolean needsSeparator(Block previous, Block next) {
        if (previous instanceof BlankLine || next instanceof BlankLine) {
            return false;
        }
        if (previous instanceof Paragraph) {
            return !interruptsParagraph(next);
        }
        if (previous instanceof HtmlBlock html) {
            return html.rule() >= 6;
        }
        if (previous instanceof IndentedCodeBlock) {
            return next instanceof IndentedCodeBlock;
        }
        if (previous instanceof LinkReferenceDefinition) {
            // a following line could otherwise be read as the definition's title
            return next instanceof Paragraph || next instanceof SetextHeading || next instanceof Table;
        }
        return previous instanceof BlockQuote || previous instanceof ListBlock || previous instanceof Table;
    }

    /**
     * An unclosed fence runs to the end of its container, so a blank line written after it would be read back
     * as code.
     */
    private static boolean endsWithOpenFence(Block block) {
        Block last = block;
        while (true) {
            if (last instanceof FencedCodeBlock fence) {
                return !fence.closed();
            } else if (last instanceof ListBlock list) {
                last = list.items().get(list.items().size() - 1);
            } else if (last instanceof ContainerBlock container && !container.children().isEmpty()) {
                last = container.children().get(container.children().size() - 1);
            } else {
                return false;
            }
        }
    }

    private static boolean interruptsParagraph(Block block) {
        if (block instanceof AtxHeading || block instanceof ThematicBreak || block instanceof FencedCodeBlock
                || block instanceof BlockQuote || block instanceof Table) {
            return true;
        }
        if (block instanceof HtmlBlock html) {
            return html.rule() < 7;
        }
        if (block instanceof ListBlock list) {
            ListItem first = list.items().get(0);
            boolean startsAtOne = !list.markerKind().isOrdered() || Integer.valueOf(1).equals(list.start());
            return startsAtOne && !first.children().isEmpty() && first.children().get(0).startLine() == first.startLine();
        }
        return false;
    }

    private List<String> renderBlock(Block block) {
        return block.accept(new BlockVisitor<List<String>>() {
            @Override
            public List<String> visit(Paragraph paragraph) {
                return splitLines(renderInlines(paragraph.content(), false));
            }

            @Override
            public List<String> visit(AtxHeading heading) {
                String content = renderInlines(heading.content(), false);
                String marker = "#".repeat(heading.level());
                if (content.isEmpty()) {
                    return List.of(marker);
                }
                // text ending in # would otherwise lose it as a closing sequence
                return List.of(marker + " " + content + (content.endsWith("#") ? " #" : ""));
            }

            @Override
            public List<String> visit(SetextHeading heading) {
                List<String> lines = new ArrayList<>(splitLines(renderInlines(heading.content(), false)));
                lines.add(heading.level() == 1 ? "===" : "---");
                return lines;
            }

            @Override
            public List<String> visit(IndentedCodeBlock codeBlock) {
                List<String> lines = new ArrayList<>();
                for (String line : literalLines(codeBlock.literal())) {
                    lines.add(line.isEmpty() ? "" : "    " + line);
                }
                return lines;
            }

            @Override
            public List<String> visit(FencedCodeBlock codeBlock) {
                String indent = " ".repeat(codeBlock.fenceIndent());
                String fence = String.valueOf(codeBlock.fenceChar()).repeat(codeBlock.fenceLength());
                List<String> lines = new ArrayList<>();
                String info = escapeInfo(codeBlock.info());
                if (!info.isEmpty() && info.charAt(0) == fence.charAt(0)) {
                    // keeps the info from lengthening the fence
                    info = " " + info;
                }
                lines.add(indent + fence + info);
                for (String line : literalLines(codeBlock.literal())) {
                    lines.add(line.isEmpty() ? "" : indent + line);
                }
                if (codeBlock.closed()) {
                    lines.add(indent + fence);
                }
                return lines;
            }

            @Override
            public List<String> visit(BlockQuote blockQuote) {
                List<String> lines = new ArrayList<>();
                for (String line : renderBlocks(blockQuote.children())) {
                    lines.add(line.isEmpty() ? ">" : "> " + line);
                }
                if (lines.isEmpty()) {
                    lines.add(">");
                }
                return lines;
            }

            @Override
            public List<String> visit(ListBlock list) {
                List<String> lines = new ArrayList<>();
                boolean first = true;
                ListItem previous = null;
                for (ListItem item : list.items()) {
                    if (!first && !list.tight() && !endsWithBlank(lines) && !endsWithOpenFence(previous)) {
                        lines.add("");
                    }
                    lines.addAll(renderItem(item));
                    previous = item;
                    first = false;
                }
                return lines;
            }

            @Override
            public List<String> visit(ThematicBreak thematicBreak) {
                char c = thematicBreak.marker();
                // spaced so that a dash break is never read as a setext underline
                return List.of(c + " " + c + " " + c);
            }

            @Override
            public List<String> visit(HtmlBlock htmlBlock) {
                return splitLines(htmlBlock.literal());
            }

            @Override
            public List<String> visit(LinkReferenceDefinition definition) {
                StringBuilder line = new StringBuilder()
                        .append('[').append(definition.label()).append("]: ")
                        .append(renderDestination(definition.destination()));
                if (definition.title() != null) {
                    line.append(' ').append(renderTitle(definition.title()));
                }
                return List.of(line.toString());
            }

            @Override
            public List<String> visit(BlankLine blankLine) {
                return List.of("");
            }

            @Override
            public List<String> visit(Table table) {
                List<String> lines = new ArrayList<>();
                lines.add(renderRow(table.header()));
                StringBuilder delimiter = new StringBuilder("|");
                for (TableAlignment alignment : table.alignments()) {
                    delimiter.append(' ').append(switch (alignment) {
                        case LEFT -> ":--";
                        case CENTER -> ":-:";
                        case RIGHT -> "--:";
                        case NONE -> "---";
                    }).append(" |");
                }
                lines.add(delimiter.toString());
                for (TableRow row : table.rows()) {
                    lines.add(renderRow(row));
                }
                return lines;
            }

            @Override
            public List<String> defaultResult(Block block) {
                throw new IllegalArgumentException("Cannot serialize " + block.getClass().getSimpleName());
            }
        });
    }

    private List<String> renderItem(ListItem item) {
        String marker = " ".repeat(item.markerIndent())
                + (item.number() != null ? item.number().toString() : "")
                + item.markerKind().getSymbol();
        int padding = Math.max(1, item.contentIndent() - marker.length());
        String continuation = " ".repeat(item.contentIndent());

        List<String> content = renderBlocks(item.children());
        List<String> lines = new ArrayList<>();
        if (content.isEmpty()) {
            lines.add(marker);
            return lines;
        }
        // "* " followed by "* *" would read as one thematic break, so such content starts on the next line
        if (isThematicBreak(marker + " ".repeat(padding) + content.get(0))) {
            lines.add(marker);
            for (String line : content) {
                lines.add(line.isEmpty() ? "" : continuation + line);
            }
            return lines;
        }
        for (int i = 0; i < content.size(); i++) {
            String line = content.get(i);
            if (i == 0) {
                lines.add(line.isEmpty() ? marker : marker + " ".repeat(padding) + line);
            } else {
                lines.add(line.isEmpty() ? "" : continuation + line);
            }
        }
        return lines;
    }

    private String renderRow(TableRow row) {
        StringBuilder line = new StringBuilder("|");
        for (TableCell cell : row.cells()) {
            line.append(' ').append(renderInlines(cell.content(), true)).append(" |");
        }
        return line.toString();
    }

    private String renderInlines(List<Inline> inlines, boolean inTable) {
        StringBuilder out = new StringBuilder();
        boolean lineStart = false;
        for (int i = 0; i < inlines.size(); i++) {
            Inline inline = inlines.get(i);
            String rendered = renderInline(inline, inTable);
            if (lineStart && !rendered.isEmpty() && !Character.isLetter(rendered.charAt(0))) {
                out.append(CONTINUATION_INDENT);
            }
            out.append(rendered);
            if (inline instanceof Text text && text.literal().endsWith("\\")
                    && i + 1 < inlines.size() && inlines.get(i + 1) instanceof SoftLineBreak) {
                // keeps the backslash from escaping the line end into a hard break
                out.append(' ');
            }
            lineStart = inline instanceof SoftLineBreak || inline instanceof HardLineBreak;
        }
        return out.toString();
    }

    private String renderInline(Inline inline, boolean inTable) {
        String rendered;
        if (inline instanceof Text text) {
            rendered = text.literal();
        } else if (inline instanceof Emphasis emphasis) {
            String delimiter = String.valueOf(emphasis.delimiter());
            rendered = delimiter + renderInlines(emphasis.children(), inTable) + delimiter;
        } else if (inline instanceof StrongEmphasis strong) {
            String delimiter = String.valueOf(strong.delimiter()).repeat(2);
            rendered = delimiter + renderInlines(strong.children(), inTable) + delimiter;
        } else if (inline instanceof CodeSpan code) {
            rendered = renderCodeSpan(code.literal());
        } else if (inline instanceof HtmlInline html) {
            rendered = html.literal();
        } else if (inline instanceof Autolink autolink) {
            rendered = "<" + autolink.literal() + ">";
        } else if (inline instanceof SoftLineBreak) {
            rendered = "\n";
        } else if (inline instanceof HardLineBreak hardBreak) {
            rendered = hardBreak.backslash() ? "\\\n" : "  \n";
        } else if (inline instanceof EntityReference entity) {
            rendered = entity.literal();
        } else if (inline instanceof NumericCharacterReference reference) {
            rendered = reference.literal();
        } else if (inline instanceof BackslashEscape escape) {
            rendered = "\\" + escape.escaped();
        } else if (inline instanceof Link link) {
            rendered = "[" + renderInlines(link.children(), inTable) + "]"
                    + renderLinkTail(link.form(), link.destination(), link.title(), link.label());
        } else if (inline instanceof Image image) {
            rendered = "![" + renderInlines(image.description(), inTable) + "]"
                    + renderLinkTail(image.form(), image.destination(), image.title(), image.label());
        } else {
            throw new IllegalArgumentException("Cannot serialize " + inline.getClass().getSimpleName());
        }
        // nested calls already escaped their pipes
        if (inTable && (inline instanceof Text || inline instanceof CodeSpan || inline instanceof BackslashEscape
                || inline instanceof HtmlInline || inline instanceof Autolink)) {
            rendered = rendered.replace("|", "\\|");
        }
        return rendered;
    }

    private static String renderLinkTail(LinkForm form, String destination, String title, String label) {
        return switch (form) {
            case INLINE -> "(" + renderDestination(destination)
                    + (title != null ? " " + renderTitle(title) : "") + ")";
            case FULL_REFERENCE -> "[" + label + "]";
            case COLLAPSED_REFERENCE -> "[]";
            case SHORTCUT_REFERENCE -> "";
        };
    }

    static String renderCodeSpan(String literal) {
        int ticks = 1;
        while (containsRun(literal, ticks)) {
            ticks++;
        }
        String fence = "`".repeat(ticks);
        boolean pad = literal.startsWith("`") || literal.endsWith("`")
                || (literal.length() >= 2 && literal.startsWith(" ") && literal.endsWith(" ") && !literal.isBlank());
        return pad ? fence + " " + literal + " " + fence : fence + literal + fence;
    }

    private static boolean containsRun(String text, int length) {
        int run = 0;
        for (int i = 0; i <= text.length(); i++) {
            if (i < text.length() && text.charAt(i) == '`') {
                run++;
            } else {
                if (run == length) {
                    return true;
                }
                run = 0;
            }
        }
        return false;
    }

    static String renderDestination(String destination) {
        boolean needsBrackets = destination.isEmpty();
        int depth = 0;
        for (int i = 0; i < destination.length() && !needsBrackets; i++) {
            char c = destination.charAt(i);
            if (c <= ' ' || c == '<' || c == '>') {
                needsBrackets = true;
            } else if (c == '(') {
                depth++;
                needsBrackets = depth > 1;
            } else if (c == ')') {
                depth--;
                needsBrackets = depth < 0;
            }
        }
        needsBrackets |= depth != 0;
        if (!needsBrackets) {
            return escape(destination, "\\&");
        }
        return "<" + escape(destination, "\\<>&") + ">";
    }

    static String renderTitle(String title) {
        return "\"" + escape(title, "\\\"&") + "\"";
    }

    static boolean isThematicBreak(String line) {
        String rest = line.stripLeading();
        if (rest.isEmpty() || "*-_".indexOf(rest.charAt(0)) < 0) {
            return false;
        }
        char marker = rest.charAt(0);
        int count = 0;
        for (int i = 0; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == marker) {
                count++;
            } else if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return count >= 3;
    }

    private static String escapeInfo(String info) {
        return escape(info, "\\&`");
    }

    private static String escape(String text, String special) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (special.indexOf(c) >= 0) {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    private static List<String> splitLines(String text) {
        return List.of(text.split("\n", -1));
    }

    // code literals end every line with a newline
    private static List<String> literalLines(String literal) {
        if (literal.isEmpty()) {
            return List.of();
        }
        String body = literal.endsWith("\n") ? literal.substring(0, literal.length() - 1) : literal;
        return List.of(body.split("\n", -1));
    }
}
