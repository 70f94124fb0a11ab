package com.williamcallahan.notesrender.domain.api;

/**
 * Represents the response variants for block rendering.
 */
public sealed interface BlockRenderResponse permits BlockRenderOutcome, RenderErrorResponse {}
