package com.williamcallahan.notesrender.domain.render;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Leaf node of the render tree: either styled prose or a rendered math span.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StyledRun.class, name = "styled"),
    @JsonSubTypes.Type(value = MathRun.class, name = "math")
})
public sealed interface InlineRun permits StyledRun, MathRun {

    /**
     * Returns the display text of this run.
     */
    String text();
}
