package org.dxworks.mdframe.parser.block;

/**
 * A successful opener match: the detached builder it would open and the cursor positioned after its marker.
 * Nothing is attached to the tree until the matcher applies the start.
 *
 * @param consumesLine the opener used up the whole line, so no line text is added afterwards
 */
record BlockStart(BlockOpener opener, BlockBuilder block, LineCursor cursor, boolean consumesLine) {
}
