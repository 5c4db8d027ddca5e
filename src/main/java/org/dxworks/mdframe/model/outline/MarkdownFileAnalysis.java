package org.dxworks.mdframe.model.outline;

import java.util.ArrayList;
import java.util.List;

public class MarkdownFileAnalysis {
    public String filePath;
    public String language = "markdown";
    public int totalLines;
    public int headings;
    public int linkDefinitions;
    public MarkdownSection preamble;
    public List<MarkdownSection> sections = new ArrayList<>();
}
