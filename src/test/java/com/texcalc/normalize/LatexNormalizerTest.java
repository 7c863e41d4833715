package com.texcalc.normalize;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class LatexNormalizerTest {

    private final LatexNormalizer normalizer = new LatexNormalizer();

    // ============================================================
    // Wrappers and presentation
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {
            "\\frac{1}{2}",
            "$\\frac{1}{2}$",
            "$$\\frac{1}{2}$$",
            "\\[\\frac{1}{2}\\]",
            "$\\displaystyle\\frac{1}{2}$",
            "\\textstyle \\frac{1}{2}",
            "  \\frac{1}{2}  "
    })
    public void testWrappersAreStripped(String input) {
        assertEquals("frac{1}{2}", normalizer.normalize(input));
    }

    @Test
    public void testNullBecomesEmpty() {
        assertEquals("", normalizer.normalize(null));
    }

    @Test
    public void testSizingAndSpacingCommandsAreDropped() {
        assertEquals("abs( -3 )", normalizer.normalize("\\left| -3 \\right|"));
        assertEquals("2 * 3", normalizer.normalize("2\\,\\times\\;3"));
        assertEquals("5", normalizer.normalize("5\\text{ cm}"));
    }

    @Test
    public void testUnicodeGlyphs() {
        assertEquals("pi /2", normalizer.normalize("π/2"));
        assertEquals("2* 3", normalizer.normalize("2×3"));
        assertEquals("6/ 2", normalizer.normalize("6÷2"));
        assertEquals("-1", normalizer.normalize("−1"));
        assertEquals("1 + 2", normalizer.normalize("1\u00A0+\u00A02"));
    }

    // ============================================================
    // Fractions
    // ============================================================

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "\\frac{1}{2}           | frac{1}{2}",
            "\\dfrac{3}{4}          | frac{3}{4}",
            "\\tfrac{2}{5}          | frac{2}{5}",
            "\\cfrac{1}{3}          | frac{1}{3}",
            "\\frac12               | frac{1}{2}",
            "\\frac \\pi 2          | frac{pi}{2}",
            "\\frac{1}{2}+\\frac{1}{3} | frac{1}{2}+frac{1}{3}"
    })
    public void testFractionVariants(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @Test
    public void testNestedFractions() {
        assertEquals("frac{frac{1}{2}}{frac{1}{4}}",
                normalizer.normalize("\\frac{\\frac{1}{2}}{\\frac{1}{4}}"));
        assertEquals("frac{1}{1+frac{1}{2}}", normalizer.normalize("\\frac{1}{1+\\frac{1}{2}}"));
    }

    @Test
    public void testFractionWithSpacesBetweenArguments() {
        assertEquals("frac{ 1 }{ 2 }", normalizer.normalize("\\frac { 1 } { 2 }"));
    }

    @Test
    public void testUnbalancedFractionIsLeftForTheParser() {
        assertEquals("frac{1}{2", normalizer.normalize("\\frac{1}{2"));
    }

    // ============================================================
    // Roots
    // ============================================================

    @Test
    public void testSquareRoot() {
        assertEquals("sqrt{4}", normalizer.normalize("\\sqrt{4}"));
        assertEquals("sqrt{2}", normalizer.normalize("\\sqrt2"));
    }

    @Test
    public void testNthRoot() {
        assertEquals("nthroot[3]{8}", normalizer.normalize("\\sqrt[3]{8}"));
    }

    @Test
    public void testRootsInsideFractions() {
        assertEquals("frac{sqrt{3}}{2}", normalizer.normalize("\\frac{\\sqrt{3}}{2}"));
        assertEquals("sqrt{frac{1}{4}}", normalizer.normalize("\\sqrt{\\frac{1}{4}}"));
        assertEquals("sqrt{2+sqrt{3}}", normalizer.normalize("\\sqrt{2+\\sqrt{3}}"));
    }

    // ============================================================
    // Glyphs, constants and functions
    // ============================================================

    @Test
    public void testOperatorGlyphs() {
        assertEquals("4 * 5", normalizer.normalize("4 \\times 5"));
        assertEquals("2 * 3", normalizer.normalize("2 \\cdot 3"));
        assertEquals("20 / 4", normalizer.normalize("20 \\div 4"));
    }

    @Test
    public void testConstantsDoNotFuse() {
        assertEquals("2pi", normalizer.normalize("2\\pi"));
        assertEquals("pi pi", normalizer.normalize("\\pi\\pi"));
        assertEquals("ln{e}", normalizer.normalize("\\ln{e}"));
    }

    @Test
    public void testFunctionNamesLoseTheirBackslash() {
        assertEquals("sin{frac{pi}{6}}", normalizer.normalize("\\sin{\\frac{\\pi}{6}}"));
        assertEquals("cos{pi}", normalizer.normalize("\\cos{\\pi}"));
        assertEquals("sin pi", normalizer.normalize("\\sin\\pi"));
        assertEquals("arctan {1}", normalizer.normalize("\\operatorname{arctan}{1}"));
    }

    @Test
    public void testLogarithmBase() {
        assertEquals("log_{2}{8}", normalizer.normalize("\\log_{2}{8}"));
        assertEquals("log_{2} 8", normalizer.normalize("\\log_2 8"));
        assertEquals("log_{10} 100", normalizer.normalize("\\log_10 100"));
        assertEquals("log_{2.5} 6.25", normalizer.normalize("\\log_2.5 6.25"));
        assertEquals("log_{b} x", normalizer.normalize("\\log_b x"));
    }

    @Test
    public void testUnknownCommandsPassThrough() {
        assertEquals("\\int_0^1 x dx", normalizer.normalize("\\int_0^1 x dx"));
        assertEquals("\\foo{2}", normalizer.normalize("\\foo{2}"));
    }

    // ============================================================
    // Absolute value
    // ============================================================

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "|-5|                ; abs(-5)",
            "|{-5}|              ; abs({-5})",
            "|-\\frac{1}{2}|     ; abs(-frac{1}{2})",
            "||-2|-3|            ; abs(abs(-2)-3)",
            "|2|\\cdot|3|        ; abs(2)*abs(3)",
            "2|3|                ; 2abs(3)",
            "\\lvert -1 \\rvert  ; abs( -1 )"
    })
    public void testAbsoluteValueBars(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @Test
    public void testUnmatchedBarIsLeftInPlace() {
        assertEquals("|2", normalizer.normalize("|2"));
        assertEquals("(|2)|", normalizer.normalize("(|2)|"));
    }

    // ============================================================
    // Exponent placement
    // ============================================================

    @Test
    public void testExponentBeforeArgumentMovesBehindIt() {
        assertEquals("sin{frac{pi}{6}}^{2}", normalizer.normalize("\\sin^{2}{\\frac{\\pi}{6}}"));
        assertEquals("sin{frac{pi}{6}}^{2}", normalizer.normalize("\\sin{\\frac{\\pi}{6}}^{2}"));
        assertEquals("cos(1)^{2}", normalizer.normalize("\\cos^2(1)"));
    }

    @Test
    public void testExponentOnLogarithmWithBase() {
        assertEquals("log_{2}{8}^{2}", normalizer.normalize("\\log_{2}^{2}{8}"));
    }

    @Test
    public void testNestedExponentPlacement() {
        assertEquals("sin{cos{1}^{2}}^{3}", normalizer.normalize("\\sin^{3}{\\cos^{2}{1}}"));
    }

    @Test
    public void testInverseNotationIsNotRewritten() {
        assertEquals("sin^{-1}{1}", normalizer.normalize("\\sin^{-1}{1}"));
    }

    @Test
    public void testPlainPowersAreUntouched() {
        assertEquals("2^{10}", normalizer.normalize("2^{10}"));
        assertEquals("sqrt{3}^{2}", normalizer.normalize("\\sqrt{3}^{2}"));
        assertEquals("e^{2}", normalizer.normalize("e^{2}"));
    }
}
