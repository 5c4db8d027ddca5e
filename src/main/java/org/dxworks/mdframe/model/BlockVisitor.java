package org.dxworks.mdframe.model;

/**
 * Visitor over block nodes. Every method defaults to {@link #defaultResult(Block)} so implementations
 * only override the kinds they care about.
 */
public interface BlockVisitor<R> {

    default R visit(Paragraph paragraph) { return defaultResult(paragraph); }

    default R visit(AtxHeading heading) { return defaultResult(heading); }

    default R visit(SetextHeading heading) { return defaultResult(heading); }

    default R visit(IndentedCodeBlock codeBlock) { return defaultResult(codeBlock); }

    default R visit(FencedCodeBlock codeBlock) { return defaultResult(codeBlock); }

    default R visit(BlockQuote blockQuote) { return defaultResult(blockQuote); }

    default R visit(ListBlock list) { return defaultResult(list); }

    default R visit(ListItem listItem) { return defaultResult(listItem); }

    default R visit(ThematicBreak thematicBreak) { return defaultResult(thematicBreak); }

    default R visit(HtmlBlock htmlBlock) { return defaultResult(htmlBlock); }

    default R visit(LinkReferenceDefinition definition) { return defaultResult(definition); }

    default R visit(BlankLine blankLine) { return defaultResult(blankLine); }

    default R visit(Table table) { return defaultResult(table); }

    R defaultResult(Block block);
}
