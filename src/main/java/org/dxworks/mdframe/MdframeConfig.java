package org.dxworks.mdframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MdframeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(MdframeConfig.class);

    private static final String CONFIG_FILE_NAME = "mdframe-config.yml";
    private static final boolean DEFAULT_TABLES = true;
    private static final boolean DEFAULT_INCLUDE_BLANK_LINES = true;
    private static final int DEFAULT_MAX_BLOCK_NESTING = 64;
    private static final int DEFAULT_LINK_DESTINATION_PAREN_DEPTH = 1;

    private final boolean tables;
    private final boolean includeBlankLines;
    private final int maxBlockNesting;
    private final int linkDestinationParenDepth;

    private MdframeConfig(boolean tables, boolean includeBlankLines, int maxBlockNesting,
                          int linkDestinationParenDepth) {
        this.tables = tables;
        this.includeBlankLines = includeBlankLines;
        this.maxBlockNesting = maxBlockNesting;
        this.linkDestinationParenDepth = linkDestinationParenDepth;
    }

    public boolean isTables() {
        return tables;
    }

    public boolean isIncludeBlankLines() {
        return includeBlankLines;
    }

    public int getMaxBlockNesting() {
        return maxBlockNesting;
    }

    public int getLinkDestinationParenDepth() {
        return linkDestinationParenDepth;
    }

    public static MdframeConfig defaults() {
        return new MdframeConfig(DEFAULT_TABLES, DEFAULT_INCLUDE_BLANK_LINES, DEFAULT_MAX_BLOCK_NESTING,
                DEFAULT_LINK_DESTINATION_PAREN_DEPTH);
    }

    public static MdframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MdframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectiveTables = yamlConfig.tables != null ? yamlConfig.tables : DEFAULT_TABLES;
                boolean effectiveIncludeBlankLines = yamlConfig.includeBlankLines != null
                        ? yamlConfig.includeBlankLines
                        : DEFAULT_INCLUDE_BLANK_LINES;
                int effectiveMaxBlockNesting = positiveOrDefault(yamlConfig.maxBlockNesting, DEFAULT_MAX_BLOCK_NESTING);
                int effectiveParenDepth = (yamlConfig.linkDestinationParenDepth != null
                        && yamlConfig.linkDestinationParenDepth >= 0)
                        ? yamlConfig.linkDestinationParenDepth
                        : DEFAULT_LINK_DESTINATION_PAREN_DEPTH;

                return new MdframeConfig(effectiveTables, effectiveIncludeBlankLines, effectiveMaxBlockNesting,
                        effectiveParenDepth);
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static MdframeConfig with(boolean tables, boolean includeBlankLines, int maxBlockNesting,
                                     int linkDestinationParenDepth) {
        int effectiveMaxBlockNesting = maxBlockNesting > 0 ? maxBlockNesting : DEFAULT_MAX_BLOCK_NESTING;
        int effectiveParenDepth = linkDestinationParenDepth >= 0
                ? linkDestinationParenDepth
                : DEFAULT_LINK_DESTINATION_PAREN_DEPTH;
        return new MdframeConfig(tables, includeBlankLines, effectiveMaxBlockNesting, effectiveParenDepth);
    }

    private static int positiveOrDefault(Integer value, int fallback) {
        return (value != null && value > 0) ? value : fallback;
    }

    @Override
    public String toString() {
        return "MdframeConfig{tables=" + tables + ", includeBlankLines=" + includeBlankLines
                + ", maxBlockNesting=" + maxBlockNesting + ", linkDestinationParenDepth=" + linkDestinationParenDepth + "}";
    }

    private static class YamlConfig {
        public Boolean tables;
        public Boolean includeBlankLines;
        public Integer maxBlockNesting;
        public Integer linkDestinationParenDepth;
    }
}
