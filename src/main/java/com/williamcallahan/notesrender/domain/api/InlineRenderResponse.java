package com.williamcallahan.notesrender.domain.api;

/**
 * Represents the response variants for inline rendering.
 */
public sealed interface InlineRenderResponse permits InlineRenderOutcome, RenderErrorResponse {}
