package com.williamcallahan.notesrender.service.markdown;

import com.williamcallahan.notesrender.domain.render.MathDelimiter;

/**
 * Finds delimited math spans in inline text without regex backtracking, so span length
 * is bounded only by the input.
 *
 * <p>At each position the delimiters are tried in declaration order of {@link MathDelimiter}:
 * {@code $$...$$}, {@code \[...\]}, {@code $...$}, {@code \(...\)}. Display spans close at the
 * first closing delimiter after at least one character of content. Inline spans skip escaped
 * characters; an escape before a line break or at end of input ends the attempt.</p>
 */
final class MathSpanScanner {

    private static final char DOLLAR = '$';
    private static final char ESCAPE = '\\';

    private MathSpanScanner() {}

    /**
     * A matched span.
     *
     * @param start index of the opening delimiter
     * @param end index just past the closing delimiter
     * @param delimiter the delimiter pair
     */
    record Span(int start, int end, MathDelimiter delimiter) {}

    /**
     * Returns the first span starting at or after {@code from}, or null when none remains.
     */
    static Span find(String text, int from) {
        for (int cursor = from; cursor < text.length(); cursor++) {
            char current = text.charAt(cursor);
            if (current != DOLLAR && current != ESCAPE) {
                continue;
            }
            for (MathDelimiter delimiter : MathDelimiter.values()) {
                if (!text.startsWith(delimiter.open(), cursor)) {
                    continue;
                }
                int end = spanEnd(text, cursor, delimiter);
                if (end >= 0) {
                    return new Span(cursor, end, delimiter);
                }
            }
        }
        return null;
    }

    private static int spanEnd(String text, int start, MathDelimiter delimiter) {
        int contentStart = start + delimiter.open().length();
        return switch (delimiter) {
            case DOUBLE_DOLLAR, BRACKET -> {
                int closing = text.indexOf(delimiter.close(), contentStart + 1);
                yield closing < 0 ? -1 : closing + delimiter.close().length();
            }
            case DOLLAR -> contentStart < text.length() && text.charAt(contentStart) != DOLLAR
                ? inlineEnd(text, contentStart, delimiter.close())
                : -1;
            case PARENTHESIS -> inlineEnd(text, contentStart, delimiter.close());
        };
    }

    private static int inlineEnd(String text, int contentStart, String close) {
        int cursor = contentStart;
        while (cursor < text.length()) {
            if (text.startsWith(close, cursor)) {
                return cursor + close.length();
            }
            if (text.charAt(cursor) == ESCAPE) {
                if (cursor + 1 >= text.length() || isLineTerminator(text.charAt(cursor + 1))) {
                    return -1;
                }
                cursor += 2;
            } else {
                cursor++;
            }
        }
        return -1;
    }

    private static boolean isLineTerminator(char character) {
        return character == '\n' || character == '\r' || character == '\u0085'
            || character == '\u2028' || character == '\u2029';
    }
}
