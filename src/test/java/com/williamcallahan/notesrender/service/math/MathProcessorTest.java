package com.williamcallahan.notesrender.service.math;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MathProcessorTest {

    private MathProcessor mathProcessor;

    @BeforeEach
    void setUp() {
        mathProcessor = new MathProcessor();
    }

    @Test
    @DisplayName("Should render a fraction as parenthesized numerator over denominator")
    void processMath_simpleFraction_rendersSlashForm() {
        assertEquals("(1)/(2)", mathProcessor.processMath("\\frac{1}{2}"));
    }

    @Test
    @DisplayName("Should render braced superscripts and subscripts")
    void processMath_bracedScripts_rendersUnicodeScripts() {
        assertEquals("x²+yₙ", mathProcessor.processMath("x^{2}+y_{n}"));
        assertEquals("2ⁿ⁺¹", mathProcessor.processMath("2^{n+1}"));
    }

    @Test
    void processMath_greekFollowedBySpaceAndLetter_dropsTheSpace() {
        assertEquals("πr²", mathProcessor.processMath("\\pi r^2"));
    }

    @Test
    void processMath_greekAroundOperator_keepsSpacing() {
        assertEquals("α + β", mathProcessor.processMath("\\alpha + \\beta"));
    }

    @Test
    @DisplayName("Should keep a fraction with an unterminated denominator from crashing")
    void processMath_unterminatedBrace_returnsBestEffort() {
        assertEquals("(1)/()", mathProcessor.processMath("\\frac{1}{"));
    }

    @Test
    void processMath_nestedFractions_recurseIntoArguments() {
        assertEquals("((1)/(2))/(3)", mathProcessor.processMath("\\frac{\\frac{1}{2}}{3}"));
    }

    @Test
    void processMath_unbracedFractionArguments_takeSingleTokens() {
        assertEquals("(1)/(2)", mathProcessor.processMath("\\frac12"));
        assertEquals("(α)/(β)", mathProcessor.processMath("\\dfrac\\alpha\\beta"));
    }

    @Test
    void processMath_squareAndNthRoots_renderRadicalSign() {
        assertEquals("√(x)", mathProcessor.processMath("\\sqrt{x}"));
        assertEquals("³√(8)", mathProcessor.processMath("\\sqrt[3]{8}"));
        assertEquals("√(x²+y²)", mathProcessor.processMath("\\sqrt{x^2+y^2}"));
    }

    @Test
    @DisplayName("Should prefer the longest symbol command over its prefixes")
    void processMath_commandSharingPrefix_usesLongestMatch() {
        assertEquals("∞", mathProcessor.processMath("\\infty"));
        assertEquals("x ∈ A", mathProcessor.processMath("x \\in A"));
        assertEquals("a ≤ b ≤ c", mathProcessor.processMath("a \\leq b \\le c"));
        assertEquals("⇔", mathProcessor.processMath("\\Leftrightarrow"));
        assertEquals("⊤", mathProcessor.processMath("\\top"));
        assertEquals("→", mathProcessor.processMath("\\to"));
    }

    @Test
    void processMath_greekCommand_matchesWholeWordOnly() {
        assertEquals("α", mathProcessor.processMath("\\alpha"));
        assertEquals("Ω", mathProcessor.processMath("\\Omega"));
    }

    @Test
    void processMath_sumWithLimits_rendersScripts() {
        assertEquals("∑ᵢ₌₁ⁿ i", mathProcessor.processMath("\\sum_{i=1}^{n} i"));
    }

    @Test
    void processMath_textCommand_collapsesToContent() {
        assertEquals("if x", mathProcessor.processMath("\\text{if } x"));
        assertEquals("R", mathProcessor.processMath("\\mathbb{R}"));
    }

    @Test
    void processMath_unknownCommand_isStripped() {
        assertEquals("+ 1", mathProcessor.processMath("\\foo + 1"));
        assertEquals("", mathProcessor.processMath("\\alphaX"));
    }

    @Test
    void processMath_namedFunction_keepsArgumentSpacing() {
        assertEquals("sin x", mathProcessor.processMath("\\sin x"));
    }

    @Test
    void processMath_nullOrEmpty_returnsEmpty() {
        assertEquals("", mathProcessor.processMath(null));
        assertEquals("", mathProcessor.processMath(""));
    }

    @Test
    @DisplayName("Should flatten fragments nested deeper than the configured depth")
    void processMath_nestingBeyondMaxDepth_flattensInnermostFragment() {
        MathProcessor shallow = new MathProcessor(2);

        String result = shallow.processMath("\\frac{\\frac{\\frac{a}{b}}{c}}{d}");

        assertEquals("((ab)/(c))/(d)", result);
    }

    @Test
    void processMath_pathologicalNesting_doesNotThrow() {
        String deep = "\\frac{".repeat(5_000) + "x" + "}{y}".repeat(5_000);

        String result = mathProcessor.processMath(deep);

        assertFalse(result.contains("\\"), "Output must not contain backslashes");
    }

    @Test
    @DisplayName("Should return output that is unchanged by a second pass")
    void processMath_processedOutput_isIdempotent() {
        List<String> samples = List.of(
            "\\frac{1}{2}", "x^{2}+y_{n}", "\\pi r^2", "\\sqrt[3]{8}", "\\sum_{i=1}^{n} i",
            "\\{x\\}", "a_b c", "x^", "\\frac{1}{", "\\text{speed} = \\frac{d}{t}", "\\left( x \\right)",
            "^{^}" + "{^}".repeat(11) + "{2}", "^^q", "x_{_}{_}{_}{n}");
        for (String sample : samples) {
            String once = mathProcessor.processMath(sample);
            assertEquals(once, mathProcessor.processMath(once), "Second pass changed output for " + sample);
            assertFalse(once.contains("\\"), "Output must not contain backslashes for " + sample);
        }
    }

    @Test
    void processMath_groupRenderingToMarker_bindsFollowingGroup() {
        assertEquals("²", mathProcessor.processMath("^{^}" + "{^}".repeat(11) + "{2}"));
    }

    @Test
    @DisplayName("Should collapse a closed command inside one whose group never closes")
    void processMath_residualCommandInsideUnclosedGroup_stillCollapses() {
        assertEquals("{x y", mathProcessor.processMath("\\mathbf{x \\text{y}"));
    }

    @Test
    void processMath_deeplyNestedTextCommands_finishQuickly() {
        String deep = "\\mathbf{".repeat(5_000) + "x" + "}".repeat(5_000);

        String result = assertTimeout(Duration.ofSeconds(10), () -> mathProcessor.processMath(deep));

        assertFalse(result.contains("\\"), "Output must not contain backslashes");
        assertTrue(result.contains("x"));
        assertEquals(result, mathProcessor.processMath(result));
    }

    @Test
    void constructor_nonPositiveDepth_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MathProcessor(0));
    }
}
