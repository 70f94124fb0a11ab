package com.williamcallahan.notesrender.service.markdown;

import com.williamcallahan.notesrender.domain.render.Block;
import com.williamcallahan.notesrender.domain.render.MathRun;
import com.williamcallahan.notesrender.domain.render.RunStyle;
import com.williamcallahan.notesrender.domain.render.StyledRun;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HtmlRenderTreeWriterTest {

    private final HtmlRenderTreeWriter writer = new HtmlRenderTreeWriter();

    @Test
    @DisplayName("Should group consecutive bullet items into one list")
    void writeBlocks_consecutiveBullets_shareOneList() {
        String html = writer.writeBlocks(List.of(
            new Block.Header(1, List.of(StyledRun.plain("Title"))),
            new Block.BulletItem(List.of(StyledRun.plain("a"))),
            new Block.BulletItem(List.of(StyledRun.plain("b")))));

        assertEquals("<h1>Title</h1><ul><li>a</li><li>b</li></ul>", html);
    }

    @Test
    void writeBlocks_emptyBlockBetweenItems_startsNewList() {
        String html = writer.writeBlocks(List.of(
            new Block.BulletItem(List.of(StyledRun.plain("a"))),
            new Block.Empty(),
            new Block.BulletItem(List.of(StyledRun.plain("b")))));

        assertEquals("<ul><li>a</li></ul><ul><li>b</li></ul>", html);
    }

    @Test
    void writeBlocks_numberedItemsNotStartingAtOne_setStartAttribute() {
        Document document = Jsoup.parseBodyFragment(writer.writeBlocks(List.of(
            new Block.NumberedItem(3, List.of(StyledRun.plain("c"))),
            new Block.NumberedItem(4, List.of(StyledRun.plain("d"))))));

        Element list = document.selectFirst("ol");
        assertNotNull(list);
        assertEquals("3", list.attr("start"));
        assertEquals(2, list.children().size());
    }

    @Test
    void writeBlocks_taskItems_renderDisabledCheckboxes() {
        Document document = Jsoup.parseBodyFragment(writer.writeBlocks(List.of(
            new Block.TaskItem(true, List.of(StyledRun.plain("done"))),
            new Block.TaskItem(false, List.of(StyledRun.plain("todo"))))));

        assertEquals(2, document.select("ul > li." + HtmlRenderTreeWriter.TASK_ITEM_CLASS).size());
        assertTrue(document.select("input").get(0).hasAttr("checked"));
        assertFalse(document.select("input").get(1).hasAttr("checked"));
        assertTrue(document.select("input").get(1).hasAttr("disabled"));
    }

    @Test
    void writeBlocks_codeBlock_escapesContentAndTagsLanguage() {
        Document document = Jsoup.parseBodyFragment(writer.writeBlocks(List.of(
            new Block.CodeBlock("html", List.of("<b>x</b>", "  y")))));

        Element code = document.selectFirst("pre > code");
        assertNotNull(code);
        assertTrue(code.hasClass(HtmlRenderTreeWriter.LANGUAGE_CLASS_PREFIX + "html"));
        assertEquals("<b>x</b>\n  y", code.wholeText());
        assertTrue(document.select("b").isEmpty(), "Code must be escaped, not parsed");
    }

    @Test
    void writeInline_styledRunsAndMath_mapToElements() {
        Document document = Jsoup.parseBodyFragment(writer.writeInline(List.of(
            new StyledRun("bold", RunStyle.BOLD),
            new StyledRun("both", RunStyle.BOLD_ITALIC),
            new StyledRun("gone", RunStyle.STRIKETHROUGH),
            new MathRun("\\pi", "π", false),
            new MathRun("E=mc^2", "E=mc²", true))));

        assertEquals("bold", document.selectFirst("strong").text());
        assertEquals("both", document.selectFirst("strong > em").text());
        assertEquals("gone", document.selectFirst("del").text());

        Element inlineMath = document.selectFirst("span." + HtmlRenderTreeWriter.MATH_INLINE_CLASS);
        assertNotNull(inlineMath);
        assertEquals("\\pi", inlineMath.attr("data-latex"));
        assertEquals("π", inlineMath.text());
        assertNotNull(document.selectFirst("span." + HtmlRenderTreeWriter.MATH_DISPLAY_CLASS));
    }

    @Test
    void writeInline_plainTextWithMarkup_isEscaped() {
        String html = writer.writeInline(List.of(StyledRun.plain("<script>alert(1)</script>")));

        assertFalse(html.contains("<script>"));
        assertTrue(html.contains("&lt;script&gt;"));
    }

    @Test
    void writeBlocks_emptyTree_isEmptyString() {
        assertEquals("", writer.writeBlocks(List.of()));
    }
}
