package org.dxworks.mdframe.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A block-level node of the structural tree.
 * Every block owns the contiguous source line run {@code startLine..endLine} (1-based, inclusive).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Paragraph.class, name = "paragraph"),
        @JsonSubTypes.Type(value = AtxHeading.class, name = "atx_heading"),
        @JsonSubTypes.Type(value = SetextHeading.class, name = "setext_heading"),
        @JsonSubTypes.Type(value = IndentedCodeBlock.class, name = "indented_code_block"),
        @JsonSubTypes.Type(value = FencedCodeBlock.class, name = "fenced_code_block"),
        @JsonSubTypes.Type(value = BlockQuote.class, name = "block_quote"),
        @JsonSubTypes.Type(value = ListBlock.class, name = "list"),
        @JsonSubTypes.Type(value = ListItem.class, name = "list_item"),
        @JsonSubTypes.Type(value = ThematicBreak.class, name = "thematic_break"),
        @JsonSubTypes.Type(value = HtmlBlock.class, name = "html_block"),
        @JsonSubTypes.Type(value = LinkReferenceDefinition.class, name = "link_reference_definition"),
        @JsonSubTypes.Type(value = BlankLine.class, name = "blank_line"),
        @JsonSubTypes.Type(value = Table.class, name = "table")
})
public interface Block {
    int startLine();

    int endLine();

    <R> R accept(BlockVisitor<R> visitor);
}
