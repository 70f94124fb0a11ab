package com.williamcallahan.notesrender.domain.render;

import java.util.Objects;

/**
 * A math span rendered to Unicode.
 *
 * @param latex trimmed LaTeX source
 * @param text Unicode approximation of the LaTeX
 * @param display true for display math ({@code $$} or {@code \[}), false for inline math
 */
public record MathRun(String latex, String text, boolean display) implements InlineRun {

    public MathRun {
        Objects.requireNonNull(latex, "Math source cannot be null");
        Objects.requireNonNull(text, "Math text cannot be null");
    }

    /**
     * Creates a run from a math token.
     */
    public static MathRun from(Token token) {
        if (!token.isMath()) {
            throw new IllegalArgumentException("Token is not math: " + token.kind());
        }
        return new MathRun(token.rawContent(), token.processedContent(), token.kind() == TokenKind.BLOCK_MATH);
    }
}
