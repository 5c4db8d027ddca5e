package org.dxworks.mdframe;

import org.dxworks.mdframe.model.Document;
import org.dxworks.mdframe.parser.block.BlockParser;
import org.dxworks.mdframe.parser.inline.EntityTable;
import org.dxworks.mdframe.parser.inline.JsoupEntityTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Entry point: Markdown text in, {@link Document} tree out. Instances are immutable and may be shared between
 * threads.
 */
public final class MarkdownParser {

    private static final Logger LOG = LoggerFactory.getLogger(MarkdownParser.class);

    private final MdframeConfig config;
    private final BlockParser blockParser;

    private MarkdownParser(MdframeConfig config, EntityTable entities) {
        this.config = config;
        this.blockParser = new BlockParser(config, entities);
    }

    /** A parser configured from {@code mdframe-config.yml} in the working directory, or defaults. */
    public static MarkdownParser create() {
        return withConfig(MdframeConfig.load());
    }

    public static MarkdownParser withConfig(MdframeConfig config) {
        return withConfig(config, JsoupEntityTable.INSTANCE);
    }

    public static MarkdownParser withConfig(MdframeConfig config, EntityTable entities) {
        if (config == null || entities == null) {
            throw new IllegalArgumentException("config and entity table are required");
        }
        return new MarkdownParser(config, entities);
    }

    public MdframeConfig getConfig() {
        return config;
    }

    public Document parse(String markdown) {
        if (markdown == null) {
            throw new IllegalArgumentException("markdown must not be null");
        }
        return blockParser.parse(markdown);
    }

    public Document parseFile(Path path) throws IOException {
        String markdown = Files.readString(path, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (markdown.startsWith("\uFEFF")) {
            markdown = markdown.substring(1);
        }

        LOG.debug("Parsing {}", path);
        return parse(markdown);
    }
}
