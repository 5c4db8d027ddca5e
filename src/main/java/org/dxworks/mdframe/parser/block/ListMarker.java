package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.model.ListMarkerKind;

/**
 * A classified list marker.
 *
 * @param kind         marker kind shared by all items of a list
 * @param number       ordinal of an ordered marker, null for bullets
 * @param markerOffset columns of indentation before the marker
 * @param padding      columns from the marker start to the item content
 * @param emptyLine    whether nothing but whitespace follows the marker on its line
 */
record ListMarker(ListMarkerKind kind, Integer number, int markerOffset, int padding, boolean emptyLine) {

    int contentIndent() {
        return markerOffset + padding;
    }
}
