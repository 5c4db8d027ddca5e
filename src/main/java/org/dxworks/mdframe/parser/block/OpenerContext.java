package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.MdframeConfig;
import org.dxworks.mdframe.parser.inline.LinkReferenceResolver;

/**
 * What an opener may look at besides the line itself.
 *
 * @param container      innermost matched container, where a new block would be attached
 * @param paragraph      the open paragraph when every open block matched the line and the paragraph is the tip;
 *                       only then can the line turn it into a setext heading or a table
 * @param paragraphOpen  whether the innermost open block is a paragraph, matched or lazily continued
 * @param containerDepth number of open blocks, used to bound container nesting
 * @param lineNumber     1-based number of the current line
 */
record OpenerContext(BlockBuilder container,
                     BlockBuilder paragraph,
                     boolean paragraphOpen,
                     int containerDepth,
                     int lineNumber,
                     MdframeConfig config,
                     LinkReferenceResolver definitions) {

    boolean nestingExhausted() {
        return containerDepth >= config.getMaxBlockNesting();
    }
}
