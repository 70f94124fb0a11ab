package com.williamcallahan.notesrender.service.math;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable LaTeX-to-Unicode lookup tables.
 *
 * <p>All maps are created once at class initialization and are read-only, so they can be
 * shared across threads without synchronization.</p>
 */
public final class SymbolTables {

    /** Greek letter commands, keyed by the command including its backslash. */
    public static final Map<String, String> GREEK = Map.ofEntries(
        Map.entry("\\alpha", "α"), Map.entry("\\beta", "β"), Map.entry("\\gamma", "γ"),
        Map.entry("\\delta", "δ"), Map.entry("\\epsilon", "ε"), Map.entry("\\zeta", "ζ"),
        Map.entry("\\eta", "η"), Map.entry("\\theta", "θ"), Map.entry("\\iota", "ι"),
        Map.entry("\\kappa", "κ"), Map.entry("\\lambda", "λ"), Map.entry("\\mu", "μ"),
        Map.entry("\\nu", "ν"), Map.entry("\\xi", "ξ"), Map.entry("\\omicron", "ο"),
        Map.entry("\\pi", "π"), Map.entry("\\rho", "ρ"), Map.entry("\\sigma", "σ"),
        Map.entry("\\tau", "τ"), Map.entry("\\upsilon", "υ"), Map.entry("\\phi", "φ"),
        Map.entry("\\chi", "χ"), Map.entry("\\psi", "ψ"), Map.entry("\\omega", "ω"),
        Map.entry("\\varepsilon", "ε"), Map.entry("\\vartheta", "ϑ"), Map.entry("\\varpi", "ϖ"),
        Map.entry("\\varrho", "ϱ"), Map.entry("\\varsigma", "ς"), Map.entry("\\varphi", "ϕ"),
        Map.entry("\\Gamma", "Γ"), Map.entry("\\Delta", "Δ"), Map.entry("\\Theta", "Θ"),
        Map.entry("\\Lambda", "Λ"), Map.entry("\\Xi", "Ξ"), Map.entry("\\Pi", "Π"),
        Map.entry("\\Sigma", "Σ"), Map.entry("\\Upsilon", "Υ"), Map.entry("\\Phi", "Φ"),
        Map.entry("\\Psi", "Ψ"), Map.entry("\\Omega", "Ω")
    );

    /** Operators, relations, arrows, named functions and other math symbols. */
    public static final Map<String, String> SYMBOLS = Map.ofEntries(
        // operators
        Map.entry("\\cdot", "·"), Map.entry("\\times", "×"), Map.entry("\\div", "÷"),
        Map.entry("\\pm", "±"), Map.entry("\\mp", "∓"), Map.entry("\\ast", "∗"),
        Map.entry("\\star", "⋆"), Map.entry("\\circ", "∘"), Map.entry("\\bullet", "•"),
        // relations
        Map.entry("\\leq", "≤"), Map.entry("\\le", "≤"), Map.entry("\\geq", "≥"), Map.entry("\\ge", "≥"),
        Map.entry("\\neq", "≠"), Map.entry("\\ne", "≠"), Map.entry("\\approx", "≈"),
        Map.entry("\\equiv", "≡"), Map.entry("\\sim", "∼"), Map.entry("\\simeq", "≃"),
        Map.entry("\\cong", "≅"), Map.entry("\\propto", "∝"), Map.entry("\\ll", "≪"),
        Map.entry("\\gg", "≫"), Map.entry("\\prec", "≺"), Map.entry("\\succ", "≻"),
        Map.entry("\\preceq", "⪯"), Map.entry("\\succeq", "⪰"),
        // sets
        Map.entry("\\in", "∈"), Map.entry("\\notin", "∉"), Map.entry("\\ni", "∋"),
        Map.entry("\\subset", "⊂"), Map.entry("\\supset", "⊃"), Map.entry("\\subseteq", "⊆"),
        Map.entry("\\supseteq", "⊇"), Map.entry("\\cup", "∪"), Map.entry("\\cap", "∩"),
        Map.entry("\\setminus", "∖"), Map.entry("\\emptyset", "∅"), Map.entry("\\varnothing", "∅"),
        // arrows
        Map.entry("\\to", "→"), Map.entry("\\rightarrow", "→"), Map.entry("\\leftarrow", "←"),
        Map.entry("\\leftrightarrow", "↔"), Map.entry("\\Rightarrow", "⇒"), Map.entry("\\Leftarrow", "⇐"),
        Map.entry("\\Leftrightarrow", "⇔"), Map.entry("\\implies", "⇒"), Map.entry("\\iff", "⇔"),
        Map.entry("\\mapsto", "↦"), Map.entry("\\uparrow", "↑"), Map.entry("\\downarrow", "↓"),
        Map.entry("\\nearrow", "↗"), Map.entry("\\searrow", "↘"), Map.entry("\\nwarrow", "↖"),
        Map.entry("\\swarrow", "↙"),
        // calculus
        Map.entry("\\int", "∫"), Map.entry("\\iint", "∬"), Map.entry("\\iiint", "∭"),
        Map.entry("\\oint", "∮"), Map.entry("\\sum", "∑"), Map.entry("\\prod", "∏"),
        Map.entry("\\coprod", "∐"), Map.entry("\\partial", "∂"), Map.entry("\\nabla", "∇"),
        Map.entry("\\infty", "∞"), Map.entry("\\lim", "lim"), Map.entry("\\limsup", "lim sup"),
        Map.entry("\\liminf", "lim inf"),
        // logic
        Map.entry("\\forall", "∀"), Map.entry("\\exists", "∃"), Map.entry("\\nexists", "∄"),
        Map.entry("\\land", "∧"), Map.entry("\\lor", "∨"), Map.entry("\\lnot", "¬"),
        Map.entry("\\neg", "¬"), Map.entry("\\wedge", "∧"), Map.entry("\\vee", "∨"),
        Map.entry("\\top", "⊤"), Map.entry("\\bot", "⊥"),
        // misc
        Map.entry("\\sqrt", "√"), Map.entry("\\angle", "∠"), Map.entry("\\perp", "⊥"),
        Map.entry("\\parallel", "∥"), Map.entry("\\triangle", "△"), Map.entry("\\square", "□"),
        Map.entry("\\diamond", "◇"), Map.entry("\\prime", "′"), Map.entry("\\dprime", "″"),
        Map.entry("\\hbar", "ℏ"), Map.entry("\\ell", "ℓ"), Map.entry("\\Re", "ℜ"),
        Map.entry("\\Im", "ℑ"), Map.entry("\\aleph", "ℵ"),
        // dots
        Map.entry("\\ldots", "…"), Map.entry("\\cdots", "⋯"), Map.entry("\\vdots", "⋮"),
        Map.entry("\\ddots", "⋱"), Map.entry("\\dots", "…"),
        // spacing
        Map.entry("\\,", "\u2009"), Map.entry("\\:", "\u2005"), Map.entry("\\;", "\u2004"),
        Map.entry("\\quad", "\u2003"), Map.entry("\\qquad", "\u2003\u2003"), Map.entry("\\!", ""),
        // brackets
        Map.entry("\\langle", "⟨"), Map.entry("\\rangle", "⟩"), Map.entry("\\lfloor", "⌊"),
        Map.entry("\\rfloor", "⌋"), Map.entry("\\lceil", "⌈"), Map.entry("\\rceil", "⌉"),
        Map.entry("\\{", "{"), Map.entry("\\}", "}"), Map.entry("\\|", "‖"),
        // named functions
        Map.entry("\\sin", "sin"), Map.entry("\\cos", "cos"), Map.entry("\\tan", "tan"),
        Map.entry("\\sec", "sec"), Map.entry("\\csc", "csc"), Map.entry("\\cot", "cot"),
        Map.entry("\\arcsin", "arcsin"), Map.entry("\\arccos", "arccos"), Map.entry("\\arctan", "arctan"),
        Map.entry("\\sinh", "sinh"), Map.entry("\\cosh", "cosh"), Map.entry("\\tanh", "tanh"),
        Map.entry("\\log", "log"), Map.entry("\\ln", "ln"), Map.entry("\\exp", "exp"),
        Map.entry("\\min", "min"), Map.entry("\\max", "max"), Map.entry("\\arg", "arg"),
        Map.entry("\\det", "det"), Map.entry("\\dim", "dim"), Map.entry("\\ker", "ker"),
        Map.entry("\\gcd", "gcd"), Map.entry("\\lcm", "lcm"), Map.entry("\\mod", "mod"),
        // sizing, dropped
        Map.entry("\\left", ""), Map.entry("\\right", ""), Map.entry("\\big", ""),
        Map.entry("\\Big", ""), Map.entry("\\bigg", ""), Map.entry("\\Bigg", "")
    );

    /** Unicode superscript forms for digits, signs, parentheses and most Latin letters. */
    public static final Map<String, String> SUPERSCRIPTS = Map.ofEntries(
        Map.entry("0", "⁰"), Map.entry("1", "¹"), Map.entry("2", "²"), Map.entry("3", "³"),
        Map.entry("4", "⁴"), Map.entry("5", "⁵"), Map.entry("6", "⁶"), Map.entry("7", "⁷"),
        Map.entry("8", "⁸"), Map.entry("9", "⁹"),
        Map.entry("+", "⁺"), Map.entry("-", "⁻"), Map.entry("=", "⁼"), Map.entry("(", "⁽"), Map.entry(")", "⁾"),
        Map.entry("a", "ᵃ"), Map.entry("b", "ᵇ"), Map.entry("c", "ᶜ"), Map.entry("d", "ᵈ"),
        Map.entry("e", "ᵉ"), Map.entry("f", "ᶠ"), Map.entry("g", "ᵍ"), Map.entry("h", "ʰ"),
        Map.entry("i", "ⁱ"), Map.entry("j", "ʲ"), Map.entry("k", "ᵏ"), Map.entry("l", "ˡ"),
        Map.entry("m", "ᵐ"), Map.entry("n", "ⁿ"), Map.entry("o", "ᵒ"), Map.entry("p", "ᵖ"),
        Map.entry("r", "ʳ"), Map.entry("s", "ˢ"), Map.entry("t", "ᵗ"), Map.entry("u", "ᵘ"),
        Map.entry("v", "ᵛ"), Map.entry("w", "ʷ"), Map.entry("x", "ˣ"), Map.entry("y", "ʸ"),
        Map.entry("z", "ᶻ")
    );

    /** Unicode subscript forms; Latin coverage is limited to the letters Unicode provides. */
    public static final Map<String, String> SUBSCRIPTS = Map.ofEntries(
        Map.entry("0", "₀"), Map.entry("1", "₁"), Map.entry("2", "₂"), Map.entry("3", "₃"),
        Map.entry("4", "₄"), Map.entry("5", "₅"), Map.entry("6", "₆"), Map.entry("7", "₇"),
        Map.entry("8", "₈"), Map.entry("9", "₉"),
        Map.entry("+", "₊"), Map.entry("-", "₋"), Map.entry("=", "₌"), Map.entry("(", "₍"), Map.entry(")", "₎"),
        Map.entry("a", "ₐ"), Map.entry("e", "ₑ"), Map.entry("h", "ₕ"), Map.entry("i", "ᵢ"),
        Map.entry("j", "ⱼ"), Map.entry("k", "ₖ"), Map.entry("l", "ₗ"), Map.entry("m", "ₘ"),
        Map.entry("n", "ₙ"), Map.entry("o", "ₒ"), Map.entry("p", "ₚ"), Map.entry("r", "ᵣ"),
        Map.entry("s", "ₛ"), Map.entry("t", "ₜ"), Map.entry("u", "ᵤ"), Map.entry("v", "ᵥ"),
        Map.entry("x", "ₓ")
    );

    /** Symbol commands ordered longest first, ties broken alphabetically for a stable order. */
    public static final List<String> SYMBOL_COMMANDS_LONGEST_FIRST = SYMBOLS.keySet().stream()
        .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
        .collect(Collectors.toUnmodifiableList());

    private SymbolTables() {}

    /**
     * Maps each character to its superscript form, keeping characters that have none.
     */
    public static String toSuperscript(String text) {
        return mapCharacters(text, SUPERSCRIPTS);
    }

    /**
     * Maps each character to its subscript form, keeping characters that have none.
     */
    public static String toSubscript(String text) {
        return mapCharacters(text, SUBSCRIPTS);
    }

    private static String mapCharacters(String text, Map<String, String> table) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder mapped = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> {
            String character = new String(Character.toChars(codePoint));
            mapped.append(table.getOrDefault(character, character));
        });
        return mapped.toString();
    }
}
