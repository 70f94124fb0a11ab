package com.williamcallahan.notesrender.domain.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Accepts a bare LaTeX fragment, without math delimiters.
 */
public record MathRequest(String latex) {

    @JsonCreator
    public static MathRequest create(@JsonProperty("latex") String latex) {
        return new MathRequest(latex == null ? "" : latex);
    }

    public MathRequest {
        Objects.requireNonNull(latex, "LaTeX cannot be null");
    }
}
