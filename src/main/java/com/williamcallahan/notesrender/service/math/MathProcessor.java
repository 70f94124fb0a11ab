package com.williamcallahan.notesrender.service.math;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts LaTeX math fragments into a plain Unicode approximation.
 *
 * <p>The conversion runs a fixed sequence of rewrite passes; later passes rely on the output
 * of earlier ones:</p>
 * <ol>
 *   <li>fractions: {@code \frac{a}{b}} becomes {@code (a)/(b)}</li>
 *   <li>roots: {@code \sqrt[n]{x}} becomes {@code ⁿ√(x)}, {@code \sqrt{x}} becomes {@code √(x)}</li>
 *   <li>braced scripts: {@code ^{...}} and {@code _{...}}</li>
 *   <li>single-character scripts: {@code ^2}, {@code _n}</li>
 *   <li>Greek letters</li>
 *   <li>remaining symbols, longest command first</li>
 *   <li>residual {@code \command{content}} collapses to {@code content}</li>
 *   <li>cleanup of leftover commands, backslashes and whitespace</li>
 * </ol>
 *
 * <p>Fractions, roots and braced scripts recurse into their arguments. Recursion stops at the
 * configured depth; deeper fragments are flattened to their literal text. Instances are immutable
 * and safe to share between threads.</p>
 */
public final class MathProcessor {

    private static final Logger logger = LoggerFactory.getLogger(MathProcessor.class);

    /** Default recursion bound for nested fractions, roots and scripts. */
    public static final int DEFAULT_MAX_DEPTH = 16;

    private static final char SUPERSCRIPT_MARKER = '^';
    private static final char SUBSCRIPT_MARKER = '_';
    private static final char ESCAPE = '\\';

    private static final Pattern FRACTION = Pattern.compile("\\\\[dt]?frac(?![a-zA-Z])");
    private static final Pattern ROOT = Pattern.compile("\\\\sqrt(?![a-zA-Z])");
    private static final Pattern CONTROL_WORD =
        Pattern.compile("(\\\\[a-zA-Z]+)(?![a-zA-Z])(\\s+(?=[\\p{L}\\p{N}]))?");
    private static final Pattern RESIDUAL_COMMAND = Pattern.compile("\\\\[a-zA-Z]+(?=\\{)");
    private static final Pattern BARE_COMMAND = Pattern.compile("\\\\[a-zA-Z]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern UNESCAPED_BRACE = Pattern.compile("(?<!\\\\)[{}]");
    private static final Pattern SCRIPT_MARKER = Pattern.compile("(?<!\\\\)[\\^_]");

    private static final List<SymbolRule> SYMBOL_RULES = SymbolTables.SYMBOL_COMMANDS_LONGEST_FIRST.stream()
        .map(command -> SymbolRule.of(command, SymbolTables.SYMBOLS.get(command)))
        .toList();

    private static final Counter FALLBACK_COUNTER =
        Metrics.counter("notesrender.render.fallbacks", "stage", "math");

    private final int maxDepth;

    /**
     * Creates a processor with the {@link #DEFAULT_MAX_DEPTH default} recursion bound.
     */
    public MathProcessor() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * Creates a processor with an explicit recursion bound.
     *
     * @param maxDepth maximum nesting of fractions, roots and braced scripts that is expanded
     */
    public MathProcessor(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Math recursion depth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Converts a LaTeX fragment to Unicode text. Never throws.
     *
     * <p>The result contains no backslashes, and processing it again returns it unchanged.</p>
     *
     * @param latex raw LaTeX without math delimiters; may be null
     * @return Unicode approximation, or an empty string for null or empty input
     */
    public String processMath(String latex) {
        if (latex == null || latex.isEmpty()) {
            return "";
        }
        try {
            Pass pass = new Pass();
            String result = transform(latex, 0, pass);
            // every pass that changes the text consumes markup, so the length bounds the passes
            for (int attempt = 0; attempt <= result.length(); attempt++) {
                String next = transform(result, 0, pass);
                if (next.equals(result)) {
                    break;
                }
                result = next;
            }
            if (pass.depthExceeded) {
                logger.warn("Math nested deeper than {} levels was flattened (input length {})",
                    maxDepth, latex.length());
            }
            return result;
        } catch (RuntimeException | StackOverflowError e) {
            logger.error("Math processing failed, falling back to stripped LaTeX", e);
            FALLBACK_COUNTER.increment();
            return cleanup(latex);
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private String transform(String latex, int depth, Pass pass) {
        if (latex.isEmpty()) {
            return latex;
        }
        if (depth >= maxDepth) {
            pass.depthExceeded = true;
            return flatten(latex);
        }
        String result = replaceFractions(latex, depth, pass);
        result = replaceRoots(result, depth, pass);
        result = replaceBracedScripts(result, depth, pass);
        result = replaceSingleScripts(result);
        result = replaceGreek(result);
        result = replaceSymbols(result);
        result = collapseResidualCommands(result, depth, pass);
        return cleanup(result);
    }

    private String replaceFractions(String latex, int depth, Pass pass) {
        Matcher matcher = FRACTION.matcher(latex);
        StringBuilder rewritten = new StringBuilder(latex.length());
        int cursor = 0;
        while (matcher.find(cursor)) {
            BraceScanner.Group numerator = BraceScanner.argument(latex, matcher.end());
            BraceScanner.Group denominator = BraceScanner.argument(latex, numerator.end());
            rewritten.append(latex, cursor, matcher.start())
                .append('(').append(transform(numerator.content(), depth + 1, pass))
                .append(")/(").append(transform(denominator.content(), depth + 1, pass))
                .append(')');
            cursor = denominator.end();
        }
        return rewritten.append(latex, cursor, latex.length()).toString();
    }

    private String replaceRoots(String latex, int depth, Pass pass) {
        Matcher matcher = ROOT.matcher(latex);
        StringBuilder rewritten = new StringBuilder(latex.length());
        int cursor = 0;
        while (matcher.find(cursor)) {
            int argumentStart = BraceScanner.skipWhitespace(latex, matcher.end());
            String index = null;
            if (argumentStart < latex.length() && latex.charAt(argumentStart) == '[') {
                int closing = latex.indexOf(']', argumentStart + 1);
                if (closing > argumentStart + 1) {
                    index = latex.substring(argumentStart + 1, closing).trim();
                    argumentStart = BraceScanner.skipWhitespace(latex, closing + 1);
                }
            }
            BraceScanner.Group radicand = BraceScanner.braced(latex, argumentStart);
            if (radicand == null) {
                // bare \sqrt is left for the symbol pass
                rewritten.append(latex, cursor, matcher.end());
                cursor = matcher.end();
                continue;
            }
            rewritten.append(latex, cursor, matcher.start());
            if (index != null) {
                rewritten.append(SymbolTables.toSuperscript(index));
            }
            rewritten.append("√(").append(transform(radicand.content(), depth + 1, pass)).append(')');
            cursor = radicand.end();
        }
        return rewritten.append(latex, cursor, latex.length()).toString();
    }

    /**
     * Rewrites {@code ^{...}} and {@code _{...}} in one left-to-right scan. A marker is matched
     * against the text already emitted, so a group that renders to a bare marker binds to the
     * group that follows it.
     */
    private String replaceBracedScripts(String latex, int depth, Pass pass) {
        if (latex.indexOf('{') < 0) {
            return latex;
        }
        StringBuilder rewritten = new StringBuilder(latex.length());
        int cursor = 0;
        while (cursor < latex.length()) {
            char current = latex.charAt(cursor);
            char marker = trailingMarker(rewritten);
            if (current != '{' || marker == 0) {
                rewritten.append(current);
                cursor++;
                continue;
            }
            rewritten.setLength(rewritten.length() - 1);
            BraceScanner.Group group = BraceScanner.braced(latex, cursor);
            String inner = transform(group.content(), depth + 1, pass);
            rewritten.append(marker == SUPERSCRIPT_MARKER
                ? SymbolTables.toSuperscript(inner)
                : SymbolTables.toSubscript(inner));
            cursor = group.end();
        }
        return rewritten.toString();
    }

    /**
     * Rewrites {@code ^x} and {@code _x} for a single ASCII letter or digit. A character without
     * a script form stays a letter, so it keeps binding to any markers stacked before it.
     */
    private static String replaceSingleScripts(String latex) {
        if (latex.indexOf(SUPERSCRIPT_MARKER) < 0 && latex.indexOf(SUBSCRIPT_MARKER) < 0) {
            return latex;
        }
        StringBuilder rewritten = new StringBuilder(latex.length());
        for (int cursor = 0; cursor < latex.length(); cursor++) {
            char current = latex.charAt(cursor);
            if (!isAsciiAlphanumeric(current)) {
                rewritten.append(current);
                continue;
            }
            String piece = String.valueOf(current);
            char marker = trailingMarker(rewritten);
            while (marker != 0 && piece.length() == 1 && isAsciiAlphanumeric(piece.charAt(0))) {
                rewritten.setLength(rewritten.length() - 1);
                piece = marker == SUPERSCRIPT_MARKER
                    ? SymbolTables.toSuperscript(piece)
                    : SymbolTables.toSubscript(piece);
                marker = trailingMarker(rewritten);
            }
            rewritten.append(piece);
        }
        return rewritten.toString();
    }

    /**
     * Returns the unescaped script marker that ends {@code text}, or 0 when there is none.
     */
    private static char trailingMarker(CharSequence text) {
        int last = text.length() - 1;
        if (last < 0) {
            return 0;
        }
        char candidate = text.charAt(last);
        if (candidate != SUPERSCRIPT_MARKER && candidate != SUBSCRIPT_MARKER) {
            return 0;
        }
        return last > 0 && text.charAt(last - 1) == ESCAPE ? 0 : candidate;
    }

    private static boolean isAsciiAlphanumeric(char character) {
        return BraceScanner.isAsciiLetter(character) || (character >= '0' && character <= '9');
    }

    /**
     * Replaces whole Greek control words. Whitespace between a Greek letter and a following
     * letter or digit is dropped, as TeX does after control words.
     */
    private static String replaceGreek(String latex) {
        if (latex.indexOf('\\') < 0) {
            return latex;
        }
        return CONTROL_WORD.matcher(latex).replaceAll(match -> {
            String symbol = SymbolTables.GREEK.get(match.group(1));
            return Matcher.quoteReplacement(symbol != null ? symbol : match.group());
        });
    }

    private static String replaceSymbols(String latex) {
        String result = latex;
        for (SymbolRule rule : SYMBOL_RULES) {
            if (result.indexOf('\\') < 0) {
                break;
            }
            if (result.contains(rule.command())) {
                result = rule.pattern().matcher(result).replaceAll(rule.replacement());
            }
        }
        return result;
    }

    /**
     * Collapses {@code \command{content}} to its content in a single scan, recursing into the
     * content up to the depth bound. A command whose group never closes is kept for cleanup.
     */
    private String collapseResidualCommands(String latex, int depth, Pass pass) {
        Matcher matcher = RESIDUAL_COMMAND.matcher(latex);
        if (!matcher.find()) {
            return latex;
        }
        StringBuilder rewritten = new StringBuilder(latex.length());
        int cursor = 0;
        do {
            BraceScanner.Group group = BraceScanner.braced(latex, matcher.end());
            if (!group.closed()) {
                rewritten.append(latex, cursor, matcher.end());
                cursor = matcher.end();
                continue;
            }
            rewritten.append(latex, cursor, matcher.start());
            if (depth + 1 < maxDepth) {
                rewritten.append(collapseResidualCommands(group.content(), depth + 1, pass));
            } else {
                pass.depthExceeded = true;
                rewritten.append(group.content());
            }
            cursor = group.end();
        } while (matcher.find(cursor));
        return rewritten.append(latex, cursor, latex.length()).toString();
    }

    private static String cleanup(String latex) {
        String result = BARE_COMMAND.matcher(latex).replaceAll("");
        result = result.replace("\\", "");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.strip();
    }

    private static String flatten(String latex) {
        String result = replaceGreek(latex);
        result = replaceSymbols(result);
        result = BARE_COMMAND.matcher(result).replaceAll("");
        result = UNESCAPED_BRACE.matcher(result).replaceAll("");
        result = SCRIPT_MARKER.matcher(result).replaceAll("");
        return cleanup(result);
    }

    /**
     * Per-call state shared by the recursive passes.
     */
    private static final class Pass {
        private boolean depthExceeded;
    }

    private record SymbolRule(String command, Pattern pattern, String replacement) {
        static SymbolRule of(String command, String symbol) {
            // a control word must not match the start of a longer word: \in inside \inner
            String lookahead = BraceScanner.isAsciiLetter(command.charAt(command.length() - 1)) ? "(?![a-zA-Z])" : "";
            return new SymbolRule(command, Pattern.compile(Pattern.quote(command) + lookahead),
                Matcher.quoteReplacement(symbol));
        }
    }
}
