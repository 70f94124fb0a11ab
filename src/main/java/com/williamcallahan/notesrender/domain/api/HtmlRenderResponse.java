package com.williamcallahan.notesrender.domain.api;

/**
 * Represents the response variants for HTML rendering.
 */
public sealed interface HtmlRenderResponse permits HtmlRenderOutcome, RenderErrorResponse {}
