package org.dxworks.mdframe.model.inline;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * An inline node of paragraph, heading or table cell content.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Text.class, name = "text"),
        @JsonSubTypes.Type(value = Emphasis.class, name = "emphasis"),
        @JsonSubTypes.Type(value = StrongEmphasis.class, name = "strong_emphasis"),
        @JsonSubTypes.Type(value = CodeSpan.class, name = "code_span"),
        @JsonSubTypes.Type(value = HtmlInline.class, name = "html_tag"),
        @JsonSubTypes.Type(value = Autolink.class, name = "autolink"),
        @JsonSubTypes.Type(value = SoftLineBreak.class, name = "soft_line_break"),
        @JsonSubTypes.Type(value = HardLineBreak.class, name = "hard_line_break"),
        @JsonSubTypes.Type(value = EntityReference.class, name = "entity_reference"),
        @JsonSubTypes.Type(value = NumericCharacterReference.class, name = "numeric_character_reference"),
        @JsonSubTypes.Type(value = BackslashEscape.class, name = "backslash_escape"),
        @JsonSubTypes.Type(value = Link.class, name = "link"),
        @JsonSubTypes.Type(value = Image.class, name = "image")
})
public interface Inline {
}
