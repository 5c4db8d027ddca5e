package org.dxworks.mdframe.model.outline;

import java.util.ArrayList;
import java.util.List;

/**
 * A heading and everything up to the next heading of the same or a shallower level.
 * The preamble is a section with level 0, no heading and no style.
 */
public class MarkdownSection {
    public String heading;
    public String style; // atx or setext
    public int level;
    public int line;
    public List<MarkdownElement> elements = new ArrayList<>();
    public List<MarkdownSection> subsections = new ArrayList<>();
}
