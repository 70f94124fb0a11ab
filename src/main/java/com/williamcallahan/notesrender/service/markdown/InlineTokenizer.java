package com.williamcallahan.notesrender.service.markdown;

import com.williamcallahan.notesrender.domain.render.Token;
import com.williamcallahan.notesrender.service.math.MathProcessor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits inline text into prose and math tokens.
 *
 * <p>Math spans are recognized in priority order {@code $$...$$}, {@code \[...\]},
 * {@code $...$} and {@code \(...\)}, left to right and without overlap. Everything between
 * matches is kept verbatim as text, so the token sources always cover the input exactly.</p>
 */
public final class InlineTokenizer {

    private static final Logger logger = LoggerFactory.getLogger(InlineTokenizer.class);

    private static final Counter FALLBACK_COUNTER =
        Metrics.counter("notesrender.render.fallbacks", "stage", "tokenize");

    private final MathProcessor mathProcessor;

    public InlineTokenizer(MathProcessor mathProcessor) {
        this.mathProcessor = Objects.requireNonNull(mathProcessor, "Math processor cannot be null");
    }

    /**
     * Tokenizes a fragment of inline text. Never throws.
     *
     * @param text inline text; may be null
     * @return ordered tokens covering the input, empty for null or empty input
     */
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        try {
            return scan(text);
        } catch (RuntimeException | StackOverflowError e) {
            logger.error("Inline tokenization failed for input of length {}, keeping it as text", text.length(), e);
            FALLBACK_COUNTER.increment();
            return List.of(Token.text(text));
        }
    }

    private List<Token> scan(String text) {
        List<Token> tokens = new ArrayList<>();
        int lastEnd = 0;
        MathSpanScanner.Span span = MathSpanScanner.find(text, 0);
        while (span != null) {
            if (span.start() > lastEnd) {
                tokens.add(Token.text(text.substring(lastEnd, span.start())));
            }
            String source = text.substring(span.start(), span.end());
            String latex = span.delimiter().unwrap(source).trim();
            tokens.add(Token.math(span.delimiter(), source, mathProcessor.processMath(latex)));
            lastEnd = span.end();
            span = MathSpanScanner.find(text, lastEnd);
        }
        if (lastEnd < text.length()) {
            tokens.add(Token.text(text.substring(lastEnd)));
        }
        logger.debug("Tokenized {} chars into {} tokens", text.length(), tokens.size());
        return tokens;
    }
}
