package com.williamcallahan.notesrender.domain.api;

import com.williamcallahan.notesrender.domain.render.Block;

import java.util.List;
import java.util.Objects;

/**
 * Describes a rendered document.
 */
public record BlockRenderOutcome(List<Block> blocks, long processingTimeMs) implements BlockRenderResponse {
    public BlockRenderOutcome {
        Objects.requireNonNull(blocks, "Blocks cannot be null");
        if (processingTimeMs < 0) {
            throw new IllegalArgumentException("Processing time must be non-negative");
        }
    }
}
