package com.williamcallahan.notesrender.domain.api;

import java.util.Objects;

/**
 * Represents the result of clearing the render cache.
 */
public record CacheClearOutcome(String status, String message) implements CacheClearResponse {
    public CacheClearOutcome {
        Objects.requireNonNull(status, "Cache clear status cannot be null");
        Objects.requireNonNull(message, "Cache clear message cannot be null");
    }
}
