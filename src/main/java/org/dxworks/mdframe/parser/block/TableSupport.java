package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.model.TableAlignment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Pipe table recognition: a paragraph's last line becomes the header when the following line is a delimiter row
 * with the same number of cells.
 */
final class TableSupport {

    private static final Pattern DELIMITER_CELL = Pattern.compile("^:?-+:?$");

    private TableSupport() {}

    /** Header row text with its parsed cells and the alignments from the delimiter row. */
    record TableHeader(String text, int line, List<String> cells, List<TableAlignment> alignments) {
        TableHeader {
            cells = List.copyOf(cells);
            alignments = List.copyOf(alignments);
        }
    }

    /**
     * @param headerLine     the candidate header text, a paragraph's last line
     * @param delimiterRow   the current line from its first non-space character
     * @return the header, or null when the two lines do not form a table start
     */
    static TableHeader tryStart(String headerLine, int headerLineNumber, String delimiterRow) {
        if (delimiterRow.indexOf('|') < 0) {
            return null;
        }
        List<TableAlignment> alignments = parseDelimiterRow(delimiterRow);
        if (alignments == null) {
            return null;
        }
        List<String> cells = splitRow(headerLine);
        if (cells.size() != alignments.size()) {
            return null;
        }
        return new TableHeader(headerLine, headerLineNumber, cells, alignments);
    }

    static List<TableAlignment> parseDelimiterRow(String row) {
        List<String> cells = splitRow(row);
        if (cells.isEmpty()) {
            return null;
        }
        List<TableAlignment> alignments = new ArrayList<>(cells.size());
        for (String cell : cells) {
            if (!DELIMITER_CELL.matcher(cell).matches()) {
                return null;
            }
            boolean left = cell.startsWith(":");
            boolean right = cell.endsWith(":");
            if (left && right) {
                alignments.add(TableAlignment.CENTER);
            } else if (left) {
                alignments.add(TableAlignment.LEFT);
            } else if (right) {
                alignments.add(TableAlignment.RIGHT);
            } else {
                alignments.add(TableAlignment.NONE);
            }
        }
        return alignments;
    }

    /**
     * Splits a row on unescaped pipes. One leading and one trailing pipe are optional; {@code \|} stays inside
     * the cell as a literal pipe. Cells are trimmed.
     */
    static List<String> splitRow(String row) {
        String line = LineCursor.stripSpacesAndTabs(row);
        List<String> cells = new ArrayList<>();
        int start = line.startsWith("|") ? 1 : 0;
        StringBuilder cell = new StringBuilder();
        boolean trailingPipe = false;
        for (int i = start; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\' && i + 1 < line.length() && line.charAt(i + 1) == '|') {
                cell.append('|');
                i++;
                trailingPipe = false;
            } else if (c == '|') {
                cells.add(LineCursor.stripSpacesAndTabs(cell.toString()));
                cell.setLength(0);
                trailingPipe = true;
            } else {
                cell.append(c);
                trailingPipe = false;
            }
        }
        if (!trailingPipe) {
            cells.add(LineCursor.stripSpacesAndTabs(cell.toString()));
        }
        return cells;
    }
}
