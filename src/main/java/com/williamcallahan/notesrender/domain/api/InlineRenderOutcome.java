package com.williamcallahan.notesrender.domain.api;

import com.williamcallahan.notesrender.domain.render.InlineRun;

import java.util.List;
import java.util.Objects;

/**
 * Describes a rendered inline fragment.
 */
public record InlineRenderOutcome(List<InlineRun> runs) implements InlineRenderResponse {
    public InlineRenderOutcome {
        Objects.requireNonNull(runs, "Runs cannot be null");
    }
}
