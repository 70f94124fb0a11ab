package com.williamcallahan.notesrender.domain.render;

import java.util.Objects;

/**
 * A classified span of inline text.
 *
 * <p>{@code rawContent} holds the text of a {@link TokenKind#TEXT} token verbatim, or the
 * trimmed inner LaTeX of a math token. {@code source} always holds the exact input span,
 * delimiters included, so concatenating the sources of a token sequence rebuilds the input.</p>
 *
 * @param kind token classification
 * @param rawContent text content or trimmed LaTeX
 * @param processedContent Unicode rendering of the LaTeX; null for text tokens
 * @param delimiter delimiter pair of a math token; null for text tokens
 * @param source exact input span covered by this token
 */
public record Token(
    TokenKind kind,
    String rawContent,
    String processedContent,
    MathDelimiter delimiter,
    String source
) {

    public Token {
        Objects.requireNonNull(kind, "Token kind cannot be null");
        Objects.requireNonNull(rawContent, "Token content cannot be null");
        Objects.requireNonNull(source, "Token source cannot be null");
        if (kind.isMath()) {
            Objects.requireNonNull(processedContent, "Math token must carry processed content");
            Objects.requireNonNull(delimiter, "Math token must carry its delimiter");
        } else if (processedContent != null || delimiter != null) {
            throw new IllegalArgumentException("Text token cannot carry math fields");
        }
    }

    /**
     * Creates a plain text token.
     */
    public static Token text(String content) {
        return new Token(TokenKind.TEXT, content, null, null, content);
    }

    /**
     * Creates a math token from a complete delimited span.
     *
     * @param delimiter delimiter pair wrapping the span
     * @param source the delimited span exactly as it appeared in the input
     * @param processedContent Unicode rendering of the inner LaTeX
     */
    public static Token math(MathDelimiter delimiter, String source, String processedContent) {
        return new Token(delimiter.tokenKind(), delimiter.unwrap(source).trim(), processedContent, delimiter, source);
    }

    public boolean isMath() {
        return kind.isMath();
    }
}
