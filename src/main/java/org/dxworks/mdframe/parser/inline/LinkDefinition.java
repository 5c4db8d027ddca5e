package org.dxworks.mdframe.parser.inline;

/**
 * Destination and optional title registered under a link label.
 */
public record LinkDefinition(String label, String destination, String title) {
}
