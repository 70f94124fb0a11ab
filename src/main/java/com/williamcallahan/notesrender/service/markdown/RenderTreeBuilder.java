package com.williamcallahan.notesrender.service.markdown;

import com.williamcallahan.notesrender.domain.render.InlineRun;
import com.williamcallahan.notesrender.domain.render.MathRun;
import com.williamcallahan.notesrender.domain.render.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles inline render-tree children from text: math spans become {@link MathRun}s and
 * the prose between them is split into styled runs.
 */
public final class RenderTreeBuilder {

    private final InlineTokenizer tokenizer;
    private final EmphasisParser emphasisParser;

    public RenderTreeBuilder(InlineTokenizer tokenizer, EmphasisParser emphasisParser) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "Tokenizer cannot be null");
        this.emphasisParser = Objects.requireNonNull(emphasisParser, "Emphasis parser cannot be null");
    }

    /**
     * Builds the inline children for a fragment of text.
     *
     * @param text inline text; may be null
     * @return ordered runs, empty for null or empty input
     */
    public List<InlineRun> buildInline(String text) {
        List<InlineRun> runs = new ArrayList<>();
        for (Token token : tokenizer.tokenize(text)) {
            if (token.isMath()) {
                runs.add(MathRun.from(token));
            } else {
                runs.addAll(emphasisParser.parseEmphasis(token.rawContent()));
            }
        }
        return List.copyOf(runs);
    }
}
