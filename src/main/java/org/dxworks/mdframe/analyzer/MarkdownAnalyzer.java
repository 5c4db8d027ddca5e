package org.dxworks.mdframe.analyzer;

import org.dxworks.mdframe.MarkdownParser;
import org.dxworks.mdframe.model.*;
import org.dxworks.mdframe.model.inline.*;
import org.dxworks.mdframe.model.outline.MarkdownElement;
import org.dxworks.mdframe.model.outline.MarkdownFileAnalysis;
import org.dxworks.mdframe.model.outline.MarkdownSection;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class MarkdownAnalyzer {

    private final MarkdownParser parser;

    public MarkdownAnalyzer() {
        this(MarkdownParser.create());
    }

    public MarkdownAnalyzer(MarkdownParser parser) {
        this.parser = parser;
    }

    public MarkdownFileAnalysis analyze(String filePath, String sourceCode) {
        return analyze(filePath, parser.parse(sourceCode));
    }

    public MarkdownFileAnalysis analyze(String filePath, Document document) {
        MarkdownFileAnalysis analysis = new MarkdownFileAnalysis();
        analysis.filePath = filePath;
        analysis.totalLines = document.children().isEmpty() ? 0 : document.endLine();

        // Build section hierarchy from headings
        MarkdownSectionVisitor visitor = new MarkdownSectionVisitor();
        for (Block block : document.children()) {
            block.accept(visitor);
        }

        analysis.preamble = visitor.preamble;
        analysis.sections = visitor.sections;
        analysis.headings = visitor.headings;
        analysis.linkDefinitions = visitor.linkDefinitions;
        return analysis;
    }

    static String extractText(List<Inline> inlines) {
        StringBuilder text = new StringBuilder();
        appendText(inlines, text);
        return text.toString().trim();
    }

    private static void appendText(List<Inline> inlines, StringBuilder text) {
        for (Inline inline : inlines) {
            if (inline instanceof Text t) {
                text.append(t.literal());
            } else if (inline instanceof CodeSpan code) {
                text.append(code.literal());
            } else if (inline instanceof Emphasis emphasis) {
                appendText(emphasis.children(), text);
            } else if (inline instanceof StrongEmphasis strong) {
                appendText(strong.children(), text);
            } else if (inline instanceof Link link) {
                appendText(link.children(), text);
            } else if (inline instanceof Image image) {
                appendText(image.description(), text);
            } else if (inline instanceof Autolink autolink) {
                text.append(autolink.literal());
            } else if (inline instanceof EntityReference entity) {
                text.append(entity.resolved());
            } else if (inline instanceof NumericCharacterReference reference) {
                text.append(reference.resolved());
            } else if (inline instanceof BackslashEscape escape) {
                text.append(escape.escaped());
            } else if (inline instanceof SoftLineBreak || inline instanceof HardLineBreak) {
                text.append(' ');
            }
        }
    }

    private static class MarkdownSectionVisitor implements BlockVisitor<Void> {
        private final List<MarkdownSection> sections = new ArrayList<>();
        private final List<MarkdownSection> sectionStack = new ArrayList<>();
        private final List<MarkdownElement> elementStack = new ArrayList<>();
        private MarkdownSection preamble;
        private int headings;
        private int linkDefinitions;

        @Override
        public Void visit(AtxHeading heading) {
            addSectionToHierarchy(createSection(heading.content(), heading.level(), heading.startLine(), "atx"));
            return null;
        }

        @Override
        public Void visit(SetextHeading heading) {
            addSectionToHierarchy(createSection(heading.content(), heading.level(), heading.startLine(), "setext"));
            return null;
        }

        @Override
        public Void visit(Paragraph paragraph) {
            Image standaloneImage = getStandaloneImage(paragraph);
            if (standaloneImage != null) {
                Map<String, Object> properties = new HashMap<>();
                properties.put("altText", extractText(standaloneImage.description()));
                properties.put("destination", standaloneImage.destination());
                addElementToCurrentContext(createElement("image", paragraph, properties));
            } else if (!extractText(paragraph.content()).isEmpty()) {
                addElementToCurrentContext(createElement("paragraph", paragraph, null));
            }
            return null;
        }

        @Override
        public Void visit(FencedCodeBlock codeBlock) {
            Map<String, Object> properties = null;
            if (codeBlock.info() != null && !codeBlock.info().isBlank()) {
                properties = new HashMap<>();
                properties.put("language", codeBlock.info().trim().split("\\s+")[0]);
            }
            addElementToCurrentContext(createElement("code_block", codeBlock, properties));
            return null;
        }

        @Override
        public Void visit(IndentedCodeBlock codeBlock) {
            addElementToCurrentContext(createElement("code_block", codeBlock, null));
            return null;
        }

        @Override
        public Void visit(Table table) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("columns", table.alignments().size());
            properties.put("rows", table.rows().size());
            addElementToCurrentContext(createElement("table", table, properties));
            return null;
        }

        @Override
        public Void visit(ListBlock list) {
            Map<String, Object> properties = new HashMap<>();
            properties.put("tight", list.tight());
            if (list.start() != null) {
                properties.put("start", list.start());
            }
            MarkdownElement element = createElement(list.markerKind().isOrdered() ? "ordered_list" : "bullet_list",
                    list, properties);
            withElementContext(element, () -> list.items().forEach(item -> item.accept(this)));
            return null;
        }

        @Override
        public Void visit(ListItem listItem) {
            MarkdownElement element = createElement("list_item", listItem, null);
            withElementContext(element, () -> visitChildren(listItem.children()));
            return null;
        }

        @Override
        public Void visit(BlockQuote blockQuote) {
            addElementToCurrentContext(createElement("block_quote", blockQuote, null));
            return null;
        }

        @Override
        public Void visit(ThematicBreak thematicBreak) {
            addElementToCurrentContext(createElement("thematic_break", thematicBreak, null));
            return null;
        }

        @Override
        public Void visit(HtmlBlock htmlBlock) {
            addElementToCurrentContext(createElement("html_block", htmlBlock, null));
            return null;
        }

        @Override
        public Void visit(LinkReferenceDefinition definition) {
            linkDefinitions++;
            return null;
        }

        @Override
        public Void defaultResult(Block block) {
            // blank lines carry no outline information
            return null;
        }

        private void visitChildren(List<Block> children) {
            for (Block child : children) {
                child.accept(this);
            }
        }

        private MarkdownSection getCurrentSection() {
            if (sectionStack.isEmpty()) {
                if (preamble == null) {
                    preamble = new MarkdownSection();
                    preamble.heading = null;
                    preamble.level = 0;
                }
                return preamble;
            }
            return sectionStack.get(sectionStack.size() - 1);
        }

        private void addElementToCurrentContext(MarkdownElement element) {
            if (!elementStack.isEmpty()) {
                MarkdownElement parent = elementStack.get(elementStack.size() - 1);
                if (parent.children == null) {
                    parent.children = new ArrayList<>();
                }
                parent.children.add(element);
                return;
            }
            getCurrentSection().elements.add(element);
        }

        private void withElementContext(MarkdownElement element, Runnable visitorAction) {
            addElementToCurrentContext(element);
            elementStack.add(element);
            try {
                visitorAction.run();
            } finally {
                elementStack.remove(elementStack.size() - 1);
            }
        }

        private Image getStandaloneImage(Paragraph paragraph) {
            if (paragraph.content().size() == 1 && paragraph.content().get(0) instanceof Image image) {
                return image;
            }
            return null;
        }

        private MarkdownElement createElement(String type, Block block, Map<String, Object> properties) {
            MarkdownElement element = new MarkdownElement();
            element.type = type;
            element.startLine = block.startLine();
            element.endLine = block.endLine();
            element.lines = block.endLine() - block.startLine() + 1;
            element.properties = properties;
            element.children = null;
            return element;
        }

        private MarkdownSection createSection(List<Inline> content, int level, int line, String style) {
            headings++;
            MarkdownSection section = new MarkdownSection();
            section.heading = extractText(content);
            section.style = style;
            section.level = level;
            section.line = line;
            return section;
        }

        private void addSectionToHierarchy(MarkdownSection section) {
            // Find appropriate parent by level
            while (!sectionStack.isEmpty() && sectionStack.get(sectionStack.size() - 1).level >= section.level) {
                sectionStack.remove(sectionStack.size() - 1);
            }

            if (sectionStack.isEmpty()) {
                sections.add(section); // Top-level section
            } else {
                MarkdownSection parent = sectionStack.get(sectionStack.size() - 1);
                parent.subsections.add(section); // Nested section
            }

            sectionStack.add(section);
        }
    }
}
