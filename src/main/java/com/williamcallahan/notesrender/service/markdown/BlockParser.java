package com.williamcallahan.notesrender.service.markdown;

import com.williamcallahan.notesrender.domain.render.Block;
import com.williamcallahan.notesrender.domain.render.StyledRun;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented markdown block parser.
 *
 * <p>Outside fenced code, each line is classified by the first rule that matches: empty,
 * horizontal rule, header, blockquote, numbered item, task item, bullet item, paragraph.
 * Constructs that do not fit their rule exactly fall through to the next one, ending at
 * paragraph. Fenced code lines are kept verbatim and never parsed for inline content.</p>
 */
public final class BlockParser {

    private static final Logger logger = LoggerFactory.getLogger(BlockParser.class);

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern HEADER = Pattern.compile("(#{1,6})\\s+(.*)", Pattern.DOTALL);
    private static final Pattern NUMBERED_ITEM = Pattern.compile("(\\d{1,9})\\.\\s+(.*)", Pattern.DOTALL);
    private static final Pattern TASK_ITEM = Pattern.compile("[-*]\\s+\\[([ xX])\\](?:\\s+(.*))?", Pattern.DOTALL);
    private static final List<String> HORIZONTAL_RULES = List.of("---", "***", "___");
    private static final String BLOCKQUOTE_PREFIX = "> ";
    private static final List<String> BULLET_PREFIXES = List.of("- ", "* ");

    private static final Counter FALLBACK_COUNTER =
        Metrics.counter("notesrender.render.fallbacks", "stage", "blocks");

    private final RenderTreeBuilder treeBuilder;

    public BlockParser(RenderTreeBuilder treeBuilder) {
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "Render tree builder cannot be null");
    }

    /**
     * Parses a markdown document into blocks. Never throws.
     *
     * @param content whole document; may be null
     * @return blocks in document order, empty for null or empty input
     */
    public List<Block> parseBlocks(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        try {
            return parseLines(LINE_BREAK.split(content, -1));
        } catch (RuntimeException | StackOverflowError e) {
            logger.error("Block parsing failed for input of length {}, rendering lines literally", content.length(), e);
            FALLBACK_COUNTER.increment();
            return literalBlocks(content);
        }
    }

    private List<Block> parseLines(String[] lines) {
        List<Block> blocks = new ArrayList<>(lines.length);
        CodeFenceStateTracker fence = new CodeFenceStateTracker();
        for (String line : lines) {
            String trimmed = line.trim();
            if (CodeFenceStateTracker.isFenceLine(trimmed)) {
                Block.CodeBlock codeBlock = fence.toggle(trimmed);
                if (codeBlock != null) {
                    blocks.add(codeBlock);
                }
                continue;
            }
            if (fence.isInsideFence()) {
                fence.append(line);
                continue;
            }
            blocks.add(classify(trimmed));
        }
        Block.CodeBlock unterminated = fence.flush();
        if (unterminated != null) {
            logger.debug("Closing code fence left open at end of input ({} lines)", unterminated.lines().size());
            blocks.add(unterminated);
        }
        logger.debug("Parsed {} lines into {} blocks", lines.length, blocks.size());
        return List.copyOf(blocks);
    }

    private Block classify(String trimmed) {
        if (trimmed.isEmpty()) {
            return new Block.Empty();
        }
        if (HORIZONTAL_RULES.contains(trimmed)) {
            return new Block.HorizontalRule();
        }
        Matcher header = HEADER.matcher(trimmed);
        if (header.matches()) {
            return new Block.Header(header.group(1).length(), treeBuilder.buildInline(header.group(2)));
        }
        if (trimmed.startsWith(BLOCKQUOTE_PREFIX)) {
            return new Block.Blockquote(treeBuilder.buildInline(trimmed.substring(BLOCKQUOTE_PREFIX.length())));
        }
        Matcher numbered = NUMBERED_ITEM.matcher(trimmed);
        if (numbered.matches()) {
            return new Block.NumberedItem(Integer.parseInt(numbered.group(1)), treeBuilder.buildInline(numbered.group(2)));
        }
        Matcher task = TASK_ITEM.matcher(trimmed);
        if (task.matches()) {
            boolean checked = !" ".equals(task.group(1));
            return new Block.TaskItem(checked, treeBuilder.buildInline(task.group(2)));
        }
        for (String prefix : BULLET_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return new Block.BulletItem(treeBuilder.buildInline(trimmed.substring(prefix.length())));
            }
        }
        return new Block.Paragraph(treeBuilder.buildInline(trimmed));
    }

    /**
     * Renders each line as plain text, used when structured parsing fails.
     */
    static List<Block> literalBlocks(String content) {
        List<Block> blocks = new ArrayList<>();
        for (String line : content.split("\n", -1)) {
            String trimmed = line.trim();
            blocks.add(trimmed.isEmpty()
                ? new Block.Empty()
                : new Block.Paragraph(List.of(StyledRun.plain(trimmed))));
        }
        return List.copyOf(blocks);
    }
}
