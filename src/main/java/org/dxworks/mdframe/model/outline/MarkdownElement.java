package org.dxworks.mdframe.model.outline;

import java.util.List;
import java.util.Map;

/**
 * Summary of one block inside a section of the outline.
 *
 * <p>{@code type} is one of {@code paragraph}, {@code image}, {@code code_block}, {@code table},
 * {@code bullet_list}, {@code ordered_list}, {@code list_item}, {@code block_quote}, {@code thematic_break}
 * or {@code html_block}.</p>
 */
public class MarkdownElement {
    public String type;
    public int startLine;
    public int endLine;
    public int lines; // endLine - startLine + 1, trailing blank lines of list items included
    public Map<String, Object> properties; // null when the kind has nothing to report
    public List<MarkdownElement> children; // list items and their content, null otherwise
}
