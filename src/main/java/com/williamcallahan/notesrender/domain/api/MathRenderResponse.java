package com.williamcallahan.notesrender.domain.api;

/**
 * Represents the response variants for bare math conversion.
 */
public sealed interface MathRenderResponse permits MathRenderOutcome, RenderErrorResponse {}
