package com.williamcallahan.notesrender.domain.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Accepts raw markdown-with-math content for server-side rendering.
 *
 * @param content markdown text, never null
 * @param inline true to render without block classification
 */
public record RenderRequest(String content, boolean inline) {

    /**
     * Creates a request while normalizing null content to an empty string.
     *
     * @param content markdown input text
     * @param inline optional inline flag, false when absent
     * @return normalized render request
     */
    @JsonCreator
    public static RenderRequest create(@JsonProperty("content") String content,
                                       @JsonProperty("inline") Boolean inline) {
        return new RenderRequest(content == null ? "" : content, Boolean.TRUE.equals(inline));
    }

    public RenderRequest {
        Objects.requireNonNull(content, "Render content cannot be null");
    }
}
