package com.williamcallahan.notesrender.domain.render;

/**
 * Classification of a span produced by the inline tokenizer.
 */
public enum TokenKind {
    TEXT,
    INLINE_MATH,
    BLOCK_MATH;

    /**
     * Returns whether this kind carries math content.
     */
    public boolean isMath() {
        return this != TEXT;
    }
}
