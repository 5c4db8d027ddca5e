package org.dxworks.mdframe.parser.block;

import org.dxworks.mdframe.MdframeConfig;
import org.dxworks.mdframe.parser.inline.JsoupEntityTable;
import org.dxworks.mdframe.parser.inline.LinkReferenceResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.dxworks.mdframe.parser.block.ParagraphContinuationResolver.Branch.CLOSE;
import static org.dxworks.mdframe.parser.block.ParagraphContinuationResolver.Branch.CONTINUATION;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ParagraphContinuationResolverTest {

    private BlockBuilder document;
    private BlockBuilder paragraph;

    @BeforeEach
    void setUp() {
        document = new BlockBuilder(BlockKind.DOCUMENT, 1);
        paragraph = new BlockBuilder(BlockKind.PARAGRAPH, 1);
        document.appendChild(paragraph);
        paragraph.addLine("foo", 1);
    }

    private ParagraphContinuationResolver.Branch matched(String line) {
        OpenerContext context = new OpenerContext(paragraph, paragraph, true, 2, 2, MdframeConfig.defaults(),
                new LinkReferenceResolver(JsoupEntityTable.INSTANCE, 1));
        return ParagraphContinuationResolver.resolve(new LineCursor(line), context);
    }

    // the paragraph's container did not match, as for "> foo" followed by a line without ">"
    private ParagraphContinuationResolver.Branch lazy(String line) {
        OpenerContext context = new OpenerContext(document, null, true, 2, 2, MdframeConfig.defaults(),
                new LinkReferenceResolver(JsoupEntityTable.INSTANCE, 1));
        return ParagraphContinuationResolver.resolve(new LineCursor(line), context);
    }

    @Test
    void resolve_PlainTextContinues() {
        assertEquals(CONTINUATION, matched("bar"));
        assertEquals(CONTINUATION, lazy("bar"));
    }

    @Test
    void resolve_BlankLineCloses() {
        assertEquals(CLOSE, matched(""));
        assertEquals(CLOSE, lazy("  "));
    }

    @Test
    void resolve_InterruptingBlocksClose() {
        assertEquals(CLOSE, matched("# heading"));
        assertEquals(CLOSE, matched("```"));
        assertEquals(CLOSE, matched("> quote"));
        assertEquals(CLOSE, matched("- item"));
        assertEquals(CLOSE, matched("<div>"));
        assertEquals(CLOSE, matched("***"));
    }

    @Test
    void resolve_NonInterruptingStartsContinue() {
        assertEquals(CONTINUATION, matched("    indented"));
        assertEquals(CONTINUATION, matched("2. item"));
        assertEquals(CONTINUATION, matched("<span>"));
        assertEquals(CONTINUATION, matched("+"));
    }

    @Test
    void resolve_SetextUnderlineOnlyForMatchedParagraph() {
        assertEquals(CLOSE, matched("==="));
        assertEquals(CONTINUATION, lazy("==="));
        assertEquals(CLOSE, lazy("---"));
    }
}
