package org.dxworks.mdframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.mdframe.model.Document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TestUtils {
    public static final String SAMPLES_BASE_PATH = "src/test/resources/samples/markdown/";

    public static final ObjectMapper SNAPSHOT_MAPPER = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private static final MarkdownParser DEFAULT_PARSER = MarkdownParser.withConfig(MdframeConfig.defaults());

    public static Document parse(String markdown) {
        return DEFAULT_PARSER.parse(markdown);
    }

    public static Path samplePath(String fileName) {
        return Paths.get(SAMPLES_BASE_PATH + fileName);
    }

    public static String readSample(String fileName) throws IOException {
        return Files.readString(samplePath(fileName), StandardCharsets.UTF_8);
    }
}
