package com.williamcallahan.notesrender.service.markdown;

import com.williamcallahan.notesrender.domain.render.RunStyle;
import com.williamcallahan.notesrender.domain.render.StyledRun;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits prose into runs of markdown inline emphasis.
 *
 * <p>Recognizes {@code ***bold italic***}, {@code **bold**}, {@code *italic*},
 * {@code `code`} and {@code ~~strikethrough~~}. Alternatives are tried longest marker first;
 * matches do not nest or overlap. Markers are removed from the run text and unmatched text
 * becomes {@link RunStyle#PLAIN} runs.</p>
 */
public final class EmphasisParser {

    private static final Logger logger = LoggerFactory.getLogger(EmphasisParser.class);

    // group order must line up with STYLE_BY_GROUP
    private static final Pattern EMPHASIS = Pattern.compile(
        "\\*\\*\\*([^*]+)\\*\\*\\*"
            + "|\\*\\*([^*]+)\\*\\*"
            + "|\\*([^*]+)\\*"
            + "|`([^`]+)`"
            + "|~~([^~]+)~~");

    private static final RunStyle[] STYLE_BY_GROUP = {
        null, RunStyle.BOLD_ITALIC, RunStyle.BOLD, RunStyle.ITALIC, RunStyle.CODE, RunStyle.STRIKETHROUGH
    };

    private static final Counter FALLBACK_COUNTER =
        Metrics.counter("notesrender.render.fallbacks", "stage", "emphasis");

    /**
     * Parses emphasis in a prose fragment. Never throws.
     *
     * @param text prose from a text token; may be null
     * @return ordered runs, empty for null or empty input
     */
    public List<StyledRun> parseEmphasis(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        try {
            return scan(text);
        } catch (RuntimeException e) {
            logger.error("Emphasis parsing failed for input of length {}, keeping it plain", text.length(), e);
            FALLBACK_COUNTER.increment();
            return List.of(StyledRun.plain(text));
        }
    }

    private static List<StyledRun> scan(String text) {
        Matcher matcher = EMPHASIS.matcher(text);
        List<StyledRun> runs = new ArrayList<>();
        int lastEnd = 0;
        while (matcher.find()) {
            if (matcher.start() > lastEnd) {
                runs.add(StyledRun.plain(text.substring(lastEnd, matcher.start())));
            }
            runs.add(styledRunFor(matcher));
            lastEnd = matcher.end();
        }
        if (lastEnd < text.length()) {
            runs.add(StyledRun.plain(text.substring(lastEnd)));
        }
        return runs;
    }

    private static StyledRun styledRunFor(Matcher matcher) {
        for (int group = 1; group < STYLE_BY_GROUP.length; group++) {
            String content = matcher.group(group);
            if (content != null) {
                return new StyledRun(content, STYLE_BY_GROUP[group]);
            }
        }
        throw new IllegalStateException("Emphasis match without a content group: " + matcher.group());
    }
}
