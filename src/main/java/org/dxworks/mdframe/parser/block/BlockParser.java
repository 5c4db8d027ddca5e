package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.MdframeConfig;
import org.dxworks.mdframe.model.Document;
import org.dxworks.mdframe.parser.inline.EntityTable;
import org.dxworks.mdframe.parser.inline.InlineScanner;
import org.dxworks.mdframe.parser.inline.LinkReferenceResolver;
import org.dxworks.mdframe.parser.inline.LinkReferenceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Two-phase parse of one document: block structure line by line, then inline content of every closed block.
 * Each call uses its own link reference table, so one parser may serve several threads.
 */
public final class BlockParser {

    private static final Logger LOG = LoggerFactory.getLogger(BlockParser.class);

    private final MdframeConfig config;
    private final EntityTable entities;

    public BlockParser(MdframeConfig config, EntityTable entities) {
        this.config = config;
        this.entities = entities;
    }

    public Document parse(String input) {
        LinkReferenceTable references = new LinkReferenceTable();
        LinkReferenceResolver resolver = new LinkReferenceResolver(entities, config.getLinkDestinationParenDepth());
        BlockMatcher matcher = new BlockMatcher(config, references, resolver);
        for (String line : splitLines(input)) {
            matcher.incorporateLine(line);
        }
        BlockBuilder root = matcher.finish();

        InlineScanner inlines = new InlineScanner(references, entities, config.getLinkDestinationParenDepth());
        Document document = new TreeMaterializer(config, inlines, entities).materialize(root);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Parsed {} lines into {} top-level blocks, {} link definitions",
                    matcher.lineCount(), document.children().size(), references.size());
        }
        return document;
    }

    /**
     * Splits on {@code \n}, {@code \r\n} and lone {@code \r}. A final line terminator does not start another line.
     * NUL characters are replaced with U+FFFD.
     */
    static List<String> splitLines(String input) {
        String text = input.indexOf('\0') >= 0 ? input.replace('\0', '\uFFFD') : input;
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                lines.add(text.substring(start, i));
                i += (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') ? 2 : 1;
                start = i;
            } else {
                i++;
            }
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }
}
