package org.dxworks.mdframe.parser.inline;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Per-parse mapping from normalized label to link definition. Filled while blocks are parsed, only read while
 * inlines are parsed. The first definition of a label wins.
 */
public final class LinkReferenceTable {

    private final Map<String, LinkDefinition> definitions = new LinkedHashMap<>();

    /**
     * @return true if the label was new and the definition was stored
     */
    public boolean define(String rawLabel, String destination, String title) {
        String key = normalizeLabel(rawLabel);
        if (key.isEmpty() || definitions.containsKey(key)) {
            return false;
        }
        definitions.put(key, new LinkDefinition(rawLabel, destination, title));
        return true;
    }

    public Optional<LinkDefinition> lookup(String rawLabel) {
        return Optional.ofNullable(definitions.get(normalizeLabel(rawLabel)));
    }

    public int size() {
        return definitions.size();
    }

    /**
     * Trims, collapses internal whitespace runs to one space and case-folds.
     */
    public static String normalizeLabel(String rawLabel) {
        String collapsed = rawLabel.replaceAll("[ \\t\\r\\n]+", " ").trim();
        return collapsed.toLowerCase(Locale.ROOT).toUpperCase(Locale.ROOT);
    }
}
