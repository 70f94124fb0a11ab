package com.williamcallahan.notesrender.service.math;

/**
 * Extracts brace-delimited LaTeX arguments with depth counting.
 *
 * <p>Escaped braces ({@code \{}, {@code \}}) do not change the depth. An argument whose
 * closing brace never arrives yields empty content and ends at the end of the input.</p>
 */
final class BraceScanner {

    private static final char OPEN = '{';
    private static final char CLOSE = '}';
    private static final char ESCAPE = '\\';

    private BraceScanner() {}

    /**
     * A scanned argument.
     *
     * @param content text between the outer braces, or the single character of an unbraced argument
     * @param end index just past the argument
     * @param closed false when the input ended before the closing brace
     */
    record Group(String content, int end, boolean closed) {}

    /**
     * Reads the braced group that opens at {@code openIndex}.
     *
     * @param text source text
     * @param openIndex index of the opening brace
     * @return the group, or null when {@code openIndex} does not hold an opening brace
     */
    static Group braced(String text, int openIndex) {
        if (openIndex < 0 || openIndex >= text.length() || text.charAt(openIndex) != OPEN) {
            return null;
        }
        int depth = 1;
        int cursor = openIndex + 1;
        while (cursor < text.length()) {
            char current = text.charAt(cursor);
            if (current == ESCAPE && cursor + 1 < text.length()) {
                cursor += 2;
                continue;
            }
            if (current == OPEN) {
                depth++;
            } else if (current == CLOSE) {
                depth--;
                if (depth == 0) {
                    return new Group(text.substring(openIndex + 1, cursor), cursor + 1, true);
                }
            }
            cursor++;
        }
        return new Group("", text.length(), false);
    }

    /**
     * Reads a command argument: a braced group, or else a single non-blank character as TeX allows
     * for {@code \frac12}.
     *
     * @param text source text
     * @param index position right after the command name
     * @return the argument; empty content at end of input
     */
    static Group argument(String text, int index) {
        int cursor = skipWhitespace(text, index);
        if (cursor >= text.length()) {
            return new Group("", text.length(), false);
        }
        if (text.charAt(cursor) == OPEN) {
            return braced(text, cursor);
        }
        if (text.charAt(cursor) == ESCAPE) {
            int commandEnd = commandEnd(text, cursor);
            return new Group(text.substring(cursor, commandEnd), commandEnd, true);
        }
        int width = Character.charCount(text.codePointAt(cursor));
        return new Group(text.substring(cursor, cursor + width), cursor + width, true);
    }

    // a control word (\alpha) or a control symbol (\,)
    private static int commandEnd(String text, int escapeIndex) {
        int cursor = escapeIndex + 1;
        if (cursor >= text.length()) {
            return cursor;
        }
        if (!isAsciiLetter(text.charAt(cursor))) {
            return cursor + 1;
        }
        while (cursor < text.length() && isAsciiLetter(text.charAt(cursor))) {
            cursor++;
        }
        return cursor;
    }

    static boolean isAsciiLetter(char character) {
        return (character >= 'a' && character <= 'z') || (character >= 'A' && character <= 'Z');
    }

    static int skipWhitespace(String text, int index) {
        int cursor = index;
        while (cursor < text.length() && Character.isWhitespace(text.charAt(cursor))) {
            cursor++;
        }
        return cursor;
    }
}
