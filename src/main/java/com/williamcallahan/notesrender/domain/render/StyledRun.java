package com.williamcallahan.notesrender.domain.render;

import java.util.Objects;

/**
 * A span of prose tagged with one emphasis style. Delimiters are not part of {@code text}.
 *
 * @param text run text without markdown markers
 * @param style emphasis style
 */
public record StyledRun(String text, RunStyle style) implements InlineRun {

    public StyledRun {
        Objects.requireNonNull(text, "Run text cannot be null");
        Objects.requireNonNull(style, "Run style cannot be null");
    }

    public static StyledRun plain(String text) {
        return new StyledRun(text, RunStyle.PLAIN);
    }

    /**
     * Restores the markdown markers around the run text.
     */
    public String toMarkdown() {
        return style.marker() + text + style.marker();
    }
}
