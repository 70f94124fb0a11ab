package com.williamcallahan.notesrender.domain.api;

/**
 * Represents the response variants for render cache statistics requests.
 */
public sealed interface CacheStatsResponse permits CacheStatsSnapshot, RenderErrorResponse {}
