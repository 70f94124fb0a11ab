package com.williamcallahan.notesrender.domain.api;

import java.util.Objects;

/**
 * Describes content rendered to an HTML fragment.
 */
public record HtmlRenderOutcome(String html, boolean inline) implements HtmlRenderResponse {
    public HtmlRenderOutcome {
        Objects.requireNonNull(html, "Rendered HTML cannot be null");
    }
}
