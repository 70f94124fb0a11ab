package com.williamcallahan.notesrender.service.markdown;

import com.williamcallahan.notesrender.domain.render.Block;
import com.williamcallahan.notesrender.domain.render.MathRun;
import com.williamcallahan.notesrender.domain.render.RunStyle;
import com.williamcallahan.notesrender.domain.render.StyledRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BlockParserTest {

    private BlockParser blockParser;

    @BeforeEach
    void setUp() {
        blockParser = RenderEngineFixtures.blockParser();
    }

    @Test
    @DisplayName("Should parse a header, a blank line and two bullets")
    void parseBlocks_headerAndBullets_yieldsBlocksInOrder() {
        List<Block> blocks = blockParser.parseBlocks("# Title\n\n- item1\n- item2");

        assertEquals(List.of(
            new Block.Header(1, List.of(StyledRun.plain("Title"))),
            new Block.Empty(),
            new Block.BulletItem(List.of(StyledRun.plain("item1"))),
            new Block.BulletItem(List.of(StyledRun.plain("item2")))), blocks);
    }

    @Test
    void parseBlocks_headerLevels_countHashes() {
        List<Block> blocks = blockParser.parseBlocks("### Three\n###### Six\n####### Seven");

        assertEquals(3, ((Block.Header) blocks.get(0)).level());
        assertEquals(6, ((Block.Header) blocks.get(1)).level());
        assertInstanceOf(Block.Paragraph.class, blocks.get(2), "Seven hashes is not a header");
    }

    @Test
    void parseBlocks_hashWithoutSpace_isParagraph() {
        assertInstanceOf(Block.Paragraph.class, blockParser.parseBlocks("#hashtag").get(0));
    }

    @Test
    void parseBlocks_numberedItems_keepSourceNumbers() {
        List<Block> blocks = blockParser.parseBlocks("1. first\n7. seventh");

        assertEquals(new Block.NumberedItem(1, List.of(StyledRun.plain("first"))), blocks.get(0));
        assertEquals(7, ((Block.NumberedItem) blocks.get(1)).index());
    }

    @Test
    void parseBlocks_taskItems_readCheckedState() {
        List<Block> blocks = blockParser.parseBlocks("- [ ] todo\n- [x] done\n* [X] also done");

        assertEquals(new Block.TaskItem(false, List.of(StyledRun.plain("todo"))), blocks.get(0));
        assertEquals(new Block.TaskItem(true, List.of(StyledRun.plain("done"))), blocks.get(1));
        assertTrue(((Block.TaskItem) blocks.get(2)).checked());
    }

    @Test
    void parseBlocks_malformedTaskBox_fallsThroughToBullet() {
        Block block = blockParser.parseBlocks("- [y] maybe").get(0);

        assertEquals(new Block.BulletItem(List.of(StyledRun.plain("[y] maybe"))), block);
    }

    @Test
    void parseBlocks_blockquoteAndRules_areRecognized() {
        List<Block> blocks = blockParser.parseBlocks("> quoted *text*\n---\n***\n___");

        assertEquals(new Block.Blockquote(List.of(
            StyledRun.plain("quoted "), new StyledRun("text", RunStyle.ITALIC))), blocks.get(0));
        assertEquals(List.of(new Block.HorizontalRule(), new Block.HorizontalRule(), new Block.HorizontalRule()),
            blocks.subList(1, 4));
    }

    @Test
    void parseBlocks_markerWithoutSpace_isParagraph() {
        List<Block> blocks = blockParser.parseBlocks(">no space\n-no space\n1.no space");

        blocks.forEach(block -> assertInstanceOf(Block.Paragraph.class, block));
    }

    @Test
    @DisplayName("Should keep fenced code verbatim with its language tag")
    void parseBlocks_fencedCode_keepsLinesVerbatim() {
        List<Block> blocks = blockParser.parseBlocks("```java\n  int x = $y$;\n# not a header\n```\nafter");

        Block.CodeBlock code = assertInstanceOf(Block.CodeBlock.class, blocks.get(0));
        assertEquals("java", code.language());
        assertEquals(List.of("  int x = $y$;", "# not a header"), code.lines());
        assertEquals(new Block.Paragraph(List.of(StyledRun.plain("after"))), blocks.get(1));
        assertEquals(2, blocks.size());
    }

    @Test
    void parseBlocks_unterminatedFence_flushesAtEnd() {
        List<Block> blocks = blockParser.parseBlocks("intro\n```\nline one\nline two");

        assertEquals(2, blocks.size());
        assertEquals(new Block.CodeBlock("", List.of("line one", "line two")), blocks.get(1));
    }

    @Test
    void parseBlocks_mathInParagraph_yieldsMathRun() {
        Block block = blockParser.parseBlocks("Energy: $$E=mc^2$$").get(0);

        assertEquals(List.of(StyledRun.plain("Energy: "), new MathRun("E=mc^2", "E=mc²", true)), block.inline());
        assertEquals("Energy: E=mc²", block.plainText());
    }

    @Test
    void parseBlocks_crlfLineEndings_areSplit() {
        List<Block> blocks = blockParser.parseBlocks("one\r\ntwo");

        assertEquals(2, blocks.size());
        assertFalse(blocks.get(0).plainText().endsWith("\r"));
    }

    @Test
    void parseBlocks_nullOrEmpty_returnsNoBlocks() {
        assertEquals(List.of(), blockParser.parseBlocks(null));
        assertEquals(List.of(), blockParser.parseBlocks(""));
    }

    @Test
    void literalBlocks_rendersEachLineAsPlainParagraph() {
        List<Block> blocks = BlockParser.literalBlocks("# raw\n\n**text**");

        assertEquals(List.of(
            new Block.Paragraph(List.of(StyledRun.plain("# raw"))),
            new Block.Empty(),
            new Block.Paragraph(List.of(StyledRun.plain("**text**")))), blocks);
    }
}
