package com.williamcallahan.notesrender.domain.api;

import java.util.Objects;

/**
 * Describes a rendering endpoint failure.
 */
public record RenderErrorResponse(String error, String details)
    implements BlockRenderResponse, InlineRenderResponse, HtmlRenderResponse, MathRenderResponse,
    CacheStatsResponse, CacheClearResponse {
    public RenderErrorResponse {
        Objects.requireNonNull(error, "Error message cannot be null");
        details = details == null ? "" : details;
    }
}
