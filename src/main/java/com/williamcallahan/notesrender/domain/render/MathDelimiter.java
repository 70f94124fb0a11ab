package com.williamcallahan.notesrender.domain.render;

/**
 * LaTeX math delimiter pairs recognized in inline text.
 *
 * <p>Display delimiters ({@code $$...$$}, {@code \[...\]}) produce block math; the others
 * produce inline math.</p>
 */
public enum MathDelimiter {
    DOUBLE_DOLLAR("$$", "$$", TokenKind.BLOCK_MATH),
    BRACKET("\\[", "\\]", TokenKind.BLOCK_MATH),
    DOLLAR("$", "$", TokenKind.INLINE_MATH),
    PARENTHESIS("\\(", "\\)", TokenKind.INLINE_MATH);

    private final String open;
    private final String close;
    private final TokenKind tokenKind;

    MathDelimiter(String open, String close, TokenKind tokenKind) {
        this.open = open;
        this.close = close;
        this.tokenKind = tokenKind;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    public TokenKind tokenKind() {
        return tokenKind;
    }

    /**
     * Strips this delimiter pair from a span.
     */
    public String unwrap(String span) {
        return span.substring(open().length(), span.length() - close().length());
    }
}
