package com.williamcallahan.notesrender.domain.api;

import java.util.Objects;

/**
 * Pairs a LaTeX fragment with its Unicode rendering.
 */
public record MathRenderOutcome(String latex, String text) implements MathRenderResponse {
    public MathRenderOutcome {
        Objects.requireNonNull(latex, "LaTeX cannot be null");
        Objects.requireNonNull(text, "Rendered text cannot be null");
    }
}
