package com.williamcallahan.notesrender.domain.render;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Structural unit of a rendered document.
 *
 * <p>Blocks that carry prose expose their inline runs through {@link #inline()}; code blocks,
 * rules and empty lines have none.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Block.Header.class, name = "header"),
    @JsonSubTypes.Type(value = Block.Paragraph.class, name = "paragraph"),
    @JsonSubTypes.Type(value = Block.Blockquote.class, name = "blockquote"),
    @JsonSubTypes.Type(value = Block.BulletItem.class, name = "bullet_item"),
    @JsonSubTypes.Type(value = Block.NumberedItem.class, name = "numbered_item"),
    @JsonSubTypes.Type(value = Block.TaskItem.class, name = "task_item"),
    @JsonSubTypes.Type(value = Block.CodeBlock.class, name = "code_block"),
    @JsonSubTypes.Type(value = Block.HorizontalRule.class, name = "horizontal_rule"),
    @JsonSubTypes.Type(value = Block.Empty.class, name = "empty")
})
public sealed interface Block {

    /**
     * Returns the inline children of this block; empty for blocks without prose.
     */
    default List<InlineRun> inline() {
        return List.of();
    }

    /**
     * Concatenates the display text of all inline children.
     */
    default String plainText() {
        StringBuilder text = new StringBuilder();
        for (InlineRun run : inline()) {
            text.append(run.text());
        }
        return text.toString();
    }

    private static List<InlineRun> copyOf(List<InlineRun> inline) {
        return List.copyOf(Objects.requireNonNull(inline, "Inline runs cannot be null"));
    }

    /**
     * ATX header, level 1 to 6.
     */
    record Header(int level, List<InlineRun> inline) implements Block {
        public Header {
            if (level < 1 || level > 6) {
                throw new IllegalArgumentException("Header level must be between 1 and 6: " + level);
            }
            inline = Block.copyOf(inline);
        }
    }

    record Paragraph(List<InlineRun> inline) implements Block {
        public Paragraph {
            inline = Block.copyOf(inline);
        }
    }

    record Blockquote(List<InlineRun> inline) implements Block {
        public Blockquote {
            inline = Block.copyOf(inline);
        }
    }

    record BulletItem(List<InlineRun> inline) implements Block {
        public BulletItem {
            inline = Block.copyOf(inline);
        }
    }

    /**
     * Ordered list item keeping the number written in the source.
     */
    record NumberedItem(int index, List<InlineRun> inline) implements Block {
        public NumberedItem {
            if (index < 0) {
                throw new IllegalArgumentException("List index must be non-negative: " + index);
            }
            inline = Block.copyOf(inline);
        }
    }

    record TaskItem(boolean checked, List<InlineRun> inline) implements Block {
        public TaskItem {
            inline = Block.copyOf(inline);
        }
    }

    /**
     * Fenced code. Lines are kept verbatim; the language tag is empty when the fence has none.
     */
    record CodeBlock(String language, List<String> lines) implements Block {
        public CodeBlock {
            language = language == null ? "" : language;
            lines = List.copyOf(Objects.requireNonNull(lines, "Code lines cannot be null"));
        }

        /**
         * Joins the code lines with newlines.
         */
        public String code() {
            return String.join("\n", lines);
        }
    }

    record HorizontalRule() implements Block {}

    record Empty() implements Block {}
}
