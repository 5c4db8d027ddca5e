package org.dxworks.mdframe.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dxworks.mdframe.model.Document;

import java.util.Set;

/**
 * JSON view of a parsed tree. Every block and inline node carries a {@code type} property.
 *
 * <p>The structural view drops source positions and blank lines, so two parses of differently laid out but
 * equivalent Markdown compare equal.</p>
 */
public class TreeJsonExporter {

    private static final Set<String> POSITION_FIELDS = Set.of("startLine", "endLine", "line");
    private static final String BLANK_LINE_TYPE = "blank_line";

    private final ObjectMapper mapper = new ObjectMapper()
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public String toJson(Document document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize document tree", e);
        }
    }

    public JsonNode toTree(Document document) {
        return mapper.valueToTree(document);
    }

    public JsonNode toStructuralTree(Document document) {
        JsonNode tree = toTree(document);
        strip(tree);
        return tree;
    }

    public String toStructuralJson(Document document) {
        try {
            return mapper.writeValueAsString(toStructuralTree(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize document tree", e);
        }
    }

    private static void strip(JsonNode node) {
        if (node instanceof ObjectNode object) {
            object.remove(POSITION_FIELDS);
            object.elements().forEachRemaining(TreeJsonExporter::strip);
        } else if (node instanceof ArrayNode array) {
            for (int i = array.size() - 1; i >= 0; i--) {
                JsonNode element = array.get(i);
                if (BLANK_LINE_TYPE.equals(element.path("type").asText())) {
                    array.remove(i);
                } else {
                    strip(element);
                }
            }
        }
    }
}
