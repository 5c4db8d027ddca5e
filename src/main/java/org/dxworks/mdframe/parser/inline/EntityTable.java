package org.dxworks.mdframe.parser.inline;

/**
 * Read-only lookup of named HTML character entities. Consulted during inline scanning only; it never affects
 * block structure.
 */
public interface EntityTable {

    /**
     * @param name entity name without the surrounding {@code &} and {@code ;}
     * @return the replacement text, or null when the name is not a known entity
     */
    String lookup(String name);
}
