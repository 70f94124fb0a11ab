package com.williamcallahan.notesrender.domain.api;

import java.util.Objects;

/**
 * Captures cache statistics for block rendering.
 */
public record CacheStatsSnapshot(
    long hitCount,
    long missCount,
    long evictionCount,
    long size,
    String hitRate
) implements CacheStatsResponse {
    public CacheStatsSnapshot {
        Objects.requireNonNull(hitRate, "Hit rate string cannot be null");
        if (hitCount < 0 || missCount < 0 || evictionCount < 0 || size < 0) {
            throw new IllegalArgumentException("Cache stats must be non-negative");
        }
    }
}
