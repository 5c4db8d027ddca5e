package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.model.ListMarkerKind;

/**
 * List marker classification and list item bookkeeping: where item content starts, whether a marker may
 * interrupt a paragraph, when an item stops matching and whether a finished list is tight.
 */
final class ListItemTracker {

    private static final int MAX_ORDINAL_DIGITS = 9;
    private static final int MAX_SPACES_AFTER_MARKER = 4;

    private ListItemTracker() {}

    /**
     * Tries to read a list marker at the cursor's next non-space position and, on success, advances the cursor
     * to the item content.
     *
     * <p>While a paragraph is open, a marker that would start a new list may only interrupt it when the item
     * is non-empty and, for ordered lists, numbered 1. A marker continuing a list of the same kind is exempt.</p>
     *
     * @param cursor        cursor copy owned by the caller; only advanced when a marker is returned
     * @param container     the innermost matched container
     * @param paragraphOpen whether the innermost open block is a paragraph
     * @return the marker, or null if the line does not start a list item here
     */
    static ListMarker parseMarker(LineCursor cursor, BlockBuilder container, boolean paragraphOpen) {
        if (cursor.isIndented()) {
            return null;
        }
        String rest = cursor.restFromNonspace();
        if (rest.isEmpty()) {
            return null;
        }

        ListMarkerKind kind;
        Integer number = null;
        int markerLength;
        char first = rest.charAt(0);
        if (first == '-' || first == '+' || first == '*') {
            kind = ListMarkerKind.fromSymbol(first);
            markerLength = 1;
        } else {
            int digits = 0;
            while (digits < rest.length() && digits <= MAX_ORDINAL_DIGITS && isAsciiDigit(rest.charAt(digits))) {
                digits++;
            }
            if (digits == 0 || digits > MAX_ORDINAL_DIGITS || digits >= rest.length()) {
                return null;
            }
            char delimiter = rest.charAt(digits);
            if (delimiter != '.' && delimiter != ')') {
                return null;
            }
            kind = ListMarkerKind.fromSymbol(delimiter);
            number = Integer.parseInt(rest.substring(0, digits));
            markerLength = digits + 1;
        }

        if (markerLength < rest.length() && !LineCursor.isSpaceOrTab(rest.charAt(markerLength))) {
            return null;
        }
        boolean emptyLine = LineCursor.isSpacesAndTabs(rest.substring(markerLength));
        boolean continuesList = container.kind == BlockKind.LIST && container.marker.kind() == kind;
        boolean interrupting = paragraphOpen && !continuesList;
        if (interrupting && (emptyLine || (number != null && number != 1))) {
            return null;
        }

        int markerOffset = cursor.indent();
        cursor.advanceNextNonspace();
        cursor.advanceOffset(markerLength, true);
        int spacesStartColumn = cursor.column();
        int spacesStartOffset = cursor.offset();
        do {
            cursor.advanceOffset(1, true);
        } while (cursor.column() - spacesStartColumn <= MAX_SPACES_AFTER_MARKER && LineCursor.isSpaceOrTab(cursor.peek()));

        boolean blankItem = cursor.atEnd();
        int spacesAfterMarker = cursor.column() - spacesStartColumn;
        int padding;
        if (spacesAfterMarker > MAX_SPACES_AFTER_MARKER || spacesAfterMarker < 1 || blankItem) {
            padding = markerLength + 1;
            cursor.reset(spacesStartOffset, spacesStartColumn);
            if (LineCursor.isSpaceOrTab(cursor.peek())) {
                cursor.advanceOffset(1, true);
            }
        } else {
            padding = markerLength + spacesAfterMarker;
        }
        return new ListMarker(kind, number, markerOffset, padding, emptyLine);
    }

    /**
     * A marker extends an open list only if it has the same kind; any change starts a sibling list.
     */
    static boolean sameList(ListMarker listMarker, ListMarker itemMarker) {
        return listMarker.kind() == itemMarker.kind();
    }

    /**
     * Continuation of an open list item on the current line.
     *
     * @return true if the item continues; the cursor is then advanced past the item's indentation
     */
    static boolean continueItem(BlockBuilder item, LineCursor cursor) {
        if (cursor.isBlank()) {
            // an item whose content is still empty ends at its first blank line
            if (!item.hasContentChildren()) {
                return false;
            }
            cursor.advanceNextNonspace();
            return true;
        }
        int required = item.marker.contentIndent();
        if (cursor.indent() >= required) {
            cursor.advanceOffset(required, true);
            return true;
        }
        return false;
    }

    /**
     * A list is loose when two items are separated by a blank line or an item holds a blank line between two of
     * its direct children.
     */
    static boolean isTight(BlockBuilder list) {
        if (list.blankLineBetweenItems) {
            return false;
        }
        for (int i = 0; i < list.children.size(); i++) {
            BlockBuilder item = list.children.get(i);
            boolean lastItem = i == list.children.size() - 1;
            if (!lastItem && endsWithBlankLine(item)) {
                return false;
            }
            if (hasInteriorBlankLine(item)) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasInteriorBlankLine(BlockBuilder item) {
        boolean seenContent = false;
        boolean pendingBlank = false;
        for (BlockBuilder child : item.children) {
            if (child.kind == BlockKind.BLANK_LINE) {
                pendingBlank |= seenContent;
                continue;
            }
            if (pendingBlank) {
                return true;
            }
            seenContent = true;
            // a nested list swallows the blank line that separates it from the next sibling
            pendingBlank = child.kind == BlockKind.LIST && endsWithBlankLine(child);
        }
        return false;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean endsWithBlankLine(BlockBuilder block) {
        BlockBuilder current = block;
        while (current != null) {
            if (current.kind == BlockKind.LIST && !current.pendingBlankLines.isEmpty()) {
                return true;
            }
            BlockBuilder last = current.lastChild();
            if (last == null) {
                return false;
            }
            if (last.kind == BlockKind.BLANK_LINE) {
                return true;
            }
            if (last.kind != BlockKind.LIST && last.kind != BlockKind.LIST_ITEM) {
                return false;
            }
            current = last;
        }
        return false;
    }
}
