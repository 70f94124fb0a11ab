package com.williamcallahan.notesrender.domain.render;

/**
 * Inline emphasis styles, each with the markdown marker that wraps it.
 */
public enum RunStyle {
    PLAIN(""),
    BOLD("**"),
    ITALIC("*"),
    BOLD_ITALIC("***"),
    CODE("`"),
    STRIKETHROUGH("~~");

    private final String marker;

    RunStyle(String marker) {
        this.marker = marker;
    }

    /**
     * Returns the delimiter written on both sides of a run in this style.
     */
    public String marker() {
        return marker;
    }
}
