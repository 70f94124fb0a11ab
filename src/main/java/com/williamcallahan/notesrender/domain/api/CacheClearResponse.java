package com.williamcallahan.notesrender.domain.api;

/**
 * Represents the response variants for render cache invalidation.
 */
public sealed interface CacheClearResponse permits CacheClearOutcome, RenderErrorResponse {}
