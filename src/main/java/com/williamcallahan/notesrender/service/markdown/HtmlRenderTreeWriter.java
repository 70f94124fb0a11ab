package com.williamcallahan.notesrender.service.markdown;

import com.williamcallahan.notesrender.domain.render.Block;
import com.williamcallahan.notesrender.domain.render.InlineRun;
import com.williamcallahan.notesrender.domain.render.MathRun;
import com.williamcallahan.notesrender.domain.render.StyledRun;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;

/**
 * Serializes a render tree to an HTML fragment for web hosts.
 *
 * <p>Consecutive bullet and task items share one {@code ul}; consecutive numbered items share
 * one {@code ol}. Empty blocks only end a list and produce no markup. All text goes through
 * jsoup text nodes, so markup in the source is escaped.</p>
 */
public final class HtmlRenderTreeWriter {

    static final String MATH_INLINE_CLASS = "math-inline";
    static final String MATH_DISPLAY_CLASS = "math-display";
    static final String TASK_ITEM_CLASS = "task-list-item";
    static final String LANGUAGE_CLASS_PREFIX = "language-";

    /**
     * Writes block-level HTML.
     *
     * @param blocks render tree from the block parser
     * @return HTML fragment, empty for an empty tree
     */
    public String writeBlocks(List<Block> blocks) {
        Document document = newDocument();
        Element body = document.body();
        Element openList = null;
        for (Block block : blocks) {
            String listTag = listTagFor(block);
            if (listTag == null) {
                openList = null;
                appendBlock(body, block);
                continue;
            }
            if (openList == null || !openList.tagName().equals(listTag)) {
                openList = body.appendElement(listTag);
                if (block instanceof Block.NumberedItem numbered && numbered.index() != 1) {
                    openList.attr("start", Integer.toString(numbered.index()));
                }
            }
            appendListItem(openList, block);
        }
        return body.html();
    }

    /**
     * Writes inline HTML without any block wrapper.
     *
     * @param runs inline runs
     * @return HTML fragment
     */
    public String writeInline(List<InlineRun> runs) {
        Element body = newDocument().body();
        appendRuns(body, runs);
        return body.html();
    }

    private static Document newDocument() {
        Document document = Document.createShell("");
        document.outputSettings().prettyPrint(false);
        return document;
    }

    private static String listTagFor(Block block) {
        if (block instanceof Block.BulletItem || block instanceof Block.TaskItem) {
            return "ul";
        }
        if (block instanceof Block.NumberedItem) {
            return "ol";
        }
        return null;
    }

    private static void appendBlock(Element parent, Block block) {
        if (block instanceof Block.Header header) {
            appendRuns(parent.appendElement("h" + header.level()), header.inline());
        } else if (block instanceof Block.Paragraph paragraph) {
            appendRuns(parent.appendElement("p"), paragraph.inline());
        } else if (block instanceof Block.Blockquote quote) {
            appendRuns(parent.appendElement("blockquote").appendElement("p"), quote.inline());
        } else if (block instanceof Block.CodeBlock codeBlock) {
            Element code = parent.appendElement("pre").appendElement("code");
            if (!codeBlock.language().isEmpty()) {
                code.addClass(LANGUAGE_CLASS_PREFIX + codeBlock.language());
            }
            code.appendText(codeBlock.code());
        } else if (block instanceof Block.HorizontalRule) {
            parent.appendElement("hr");
        }
    }

    private static void appendListItem(Element list, Block block) {
        Element item = list.appendElement("li");
        if (block instanceof Block.TaskItem task) {
            item.addClass(TASK_ITEM_CLASS);
            Element checkbox = item.appendElement("input")
                .attr("type", "checkbox")
                .attr("disabled", true);
            if (task.checked()) {
                checkbox.attr("checked", true);
            }
            item.appendText(" ");
        }
        appendRuns(item, block.inline());
    }

    private static void appendRuns(Element parent, List<InlineRun> runs) {
        for (InlineRun run : runs) {
            if (run instanceof MathRun math) {
                parent.appendElement("span")
                    .addClass(math.display() ? MATH_DISPLAY_CLASS : MATH_INLINE_CLASS)
                    .attr("data-latex", math.latex())
                    .appendText(math.text());
            } else if (run instanceof StyledRun styled) {
                appendStyledRun(parent, styled);
            }
        }
    }

    private static void appendStyledRun(Element parent, StyledRun run) {
        switch (run.style()) {
            case PLAIN -> parent.appendText(run.text());
            case BOLD -> parent.appendElement("strong").appendText(run.text());
            case ITALIC -> parent.appendElement("em").appendText(run.text());
            case BOLD_ITALIC -> parent.appendElement("strong").appendElement("em").appendText(run.text());
            case CODE -> parent.appendElement("code").appendText(run.text());
            case STRIKETHROUGH -> parent.appendElement("del").appendText(run.text());
        }
    }
}
