package org.dxworks.mdframe.model;

import java.util.List;

/**
 * A block that owns an ordered sequence of child blocks.
 */
public interface ContainerBlock extends Block {
    List<Block> children();
}
