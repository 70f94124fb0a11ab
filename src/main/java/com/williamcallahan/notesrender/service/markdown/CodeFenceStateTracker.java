package com.williamcallahan.notesrender.service.markdown;

import com.williamcallahan.notesrender.domain.render.Block;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracks whether the block parser is inside a fenced code block and buffers its lines.
 *
 * <p>This is a mutable, single-use state machine with two states: outside a fence and inside
 * one. A line whose trimmed form starts with {@value #FENCE} toggles the state. Create one
 * instance per document.</p>
 */
final class CodeFenceStateTracker {

    /** Fence marker that opens and closes a code block. */
    static final String FENCE = "```";

    private boolean inFence;
    private String language = "";
    private final List<String> bufferedLines = new ArrayList<>();

    /**
     * Returns whether a trimmed line opens or closes a fence.
     */
    static boolean isFenceLine(String trimmedLine) {
        return trimmedLine.startsWith(FENCE);
    }

    /**
     * Returns whether the parser is inside a fenced code block.
     */
    boolean isInsideFence() {
        return inFence;
    }

    /**
     * Processes a fence line. Opening records the language tag that follows the marker; closing
     * returns the finished code block.
     *
     * @param trimmedLine a line for which {@link #isFenceLine(String)} holds
     * @return the completed code block when the fence closes, null when it opens
     */
    Block.CodeBlock toggle(String trimmedLine) {
        if (!inFence) {
            inFence = true;
            language = trimmedLine.substring(FENCE.length()).trim();
            return null;
        }
        return close();
    }

    /**
     * Buffers a line of code verbatim.
     */
    void append(String line) {
        bufferedLines.add(line);
    }

    /**
     * Closes a fence left open at end of input.
     *
     * @return the buffered code block, or null when no fence is open
     */
    Block.CodeBlock flush() {
        return inFence ? close() : null;
    }

    /**
     * Returns the language tag of the open fence, or an empty string outside a fence.
     */
    String getLanguage() {
        return language;
    }

    private Block.CodeBlock close() {
        Block.CodeBlock codeBlock = new Block.CodeBlock(language, bufferedLines);
        inFence = false;
        language = "";
        bufferedLines.clear();
        return codeBlock;
    }
}
