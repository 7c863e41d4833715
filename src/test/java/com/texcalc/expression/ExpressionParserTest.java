package com.texcalc.expression;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionParserTest {

    private final ExpressionParser parser = new ExpressionParser();

    // ============================================================
    // Tree shape
    // ============================================================

    @Test
    public void testPrecedence() {
        ExpressionNode expected = new ExpressionNode.BinaryOp(BinaryOperator.ADD, num(1),
                new ExpressionNode.BinaryOp(BinaryOperator.MULTIPLY, num(2), num(3)));
        assertEquals(expected, parser.parse("1+2*3"));
    }

    @Test
    public void testLeftAssociativeSubtraction() {
        ExpressionNode expected = new ExpressionNode.BinaryOp(BinaryOperator.SUBTRACT,
                new ExpressionNode.BinaryOp(BinaryOperator.SUBTRACT, num(8), num(3)), num(2));
        assertEquals(expected, parser.parse("8-3-2"));
    }

    @Test
    public void testPowerIsRightAssociative() {
        ExpressionNode expected = new ExpressionNode.Power(num(2), new ExpressionNode.Power(num(3), num(2)));
        assertEquals(expected, parser.parse("2^3^2"));
    }

    @Test
    public void testUnaryMinusBindsLooserThanPower() {
        assertEquals(new ExpressionNode.UnaryMinus(new ExpressionNode.Power(num(2), num(2))), parser.parse("-2^2"));
        assertEquals(new ExpressionNode.Power(num(2), new ExpressionNode.UnaryMinus(num(1))), parser.parse("2^-1"));
    }

    @Test
    public void testImplicitMultiplication() {
        assertEquals(new ExpressionNode.BinaryOp(BinaryOperator.MULTIPLY, num(2), pi()), parser.parse("2pi"));
        assertEquals(new ExpressionNode.BinaryOp(BinaryOperator.MULTIPLY, num(1), num(2)), parser.parse("(1)(2)"));
        assertEquals(new ExpressionNode.BinaryOp(BinaryOperator.MULTIPLY, num(3),
                        new ExpressionNode.Fraction(num(1), num(2))),
                parser.parse("3 frac{1}{2}"));
    }

    @Test
    public void testGroupsAreTransparent() {
        assertEquals(num(4), parser.parse("{(4)}"));
        assertEquals(num(4), parser.parse("[4]"));
    }

    @Test
    public void testFractionAndRoots() {
        assertEquals(new ExpressionNode.Fraction(num(1), num(2)), parser.parse("frac{1}{2}"));
        assertEquals(ExpressionNode.FunctionCall.of(MathFunction.NTHROOT, num(3), num(8)), parser.parse("nthroot[3]{8}"));
        assertEquals(ExpressionNode.FunctionCall.of(MathFunction.SQRT, num(2)), parser.parse("sqrt{2}"));
    }

    @Test
    public void testAbsoluteValue() {
        assertEquals(new ExpressionNode.Abs(new ExpressionNode.UnaryMinus(num(3))), parser.parse("abs(-3)"));
    }

    @Test
    public void testFunctions() {
        assertEquals(ExpressionNode.FunctionCall.of(MathFunction.SIN, pi()), parser.parse("sin{pi}"));
        assertEquals(ExpressionNode.FunctionCall.of(MathFunction.SIN, pi()), parser.parse("sin pi"));
        assertEquals(new ExpressionNode.Power(ExpressionNode.FunctionCall.of(MathFunction.SIN, pi()), num(2)),
                parser.parse("sin{pi}^{2}"));
        assertEquals(ExpressionNode.FunctionCall.of(MathFunction.LOG, num(100)), parser.parse("log{100}"));
    }

    @Test
    public void testUndelimitedArgumentTakesAPower() {
        ExpressionNode expected = ExpressionNode.FunctionCall.of(MathFunction.SIN,
                new ExpressionNode.Power(pi(), num(2)));
        assertEquals(expected, parser.parse("sin pi^2"));
    }

    @Test
    public void testLogarithmWithBase() {
        assertEquals(ExpressionNode.FunctionCall.of(MathFunction.LOG_BASE, num(2), num(8)), parser.parse("log_{2}{8}"));
        assertEquals(ExpressionNode.FunctionCall.of(MathFunction.LOG_BASE, num(2), num(8)), parser.parse("log_2 8"));
        assertEquals(ExpressionNode.FunctionCall.of(MathFunction.LOG_BASE,
                        new ExpressionNode.Constant(MathConstant.E), num(5)),
                parser.parse("log_e{5}"));
    }

    @Test
    public void testPostfixFactorial() {
        assertEquals(new ExpressionNode.Factorial(num(5)), parser.parse("5!"));
        assertEquals(new ExpressionNode.Factorial(new ExpressionNode.Factorial(num(3))), parser.parse("3!!"));
        assertEquals(new ExpressionNode.UnaryMinus(new ExpressionNode.Factorial(num(3))), parser.parse("-3!"));
        assertEquals(new ExpressionNode.Power(new ExpressionNode.Factorial(num(3)), num(2)), parser.parse("3!^2"));
        assertEquals(new ExpressionNode.Power(num(2), new ExpressionNode.Factorial(num(3))), parser.parse("2^3!"));
        assertEquals(new ExpressionNode.BinaryOp(BinaryOperator.MULTIPLY, num(2), new ExpressionNode.Factorial(num(3))),
                parser.parse("2*3!"));
    }

    // ============================================================
    // Syntax errors
    // ============================================================

    @Test
    public void testEmpty() {
        assertSyntaxError("   ", "Empty expression");
    }

    @Test
    public void testMissingOperand() {
        assertSyntaxError("2+", "Missing operand after '+' at position 2");
        assertSyntaxError("*3", "Missing operand before '*' at position 0");
        assertSyntaxError("!5", "Missing operand before '!' at position 0");
        assertSyntaxError("frac{}{2}", "Missing operand before '}'");
    }

    @Test
    public void testAdjacentNumbersAreNotMultiplied() {
        assertSyntaxError("2 3", "Unexpected trailing input '3' at position 2");
    }

    @Test
    public void testUnbalancedGrouping() {
        assertSyntaxError("(1+2", "'(' opened at position 0 is never closed");
        assertSyntaxError("1+2)", "Unbalanced grouping: unexpected ')' at position 3");
        assertSyntaxError("(1+2}", "'(' opened at position 0 is closed by '}'");
        assertSyntaxError("frac{1}{2", "is never closed");
    }

    @Test
    public void testUnmatchedBar() {
        assertSyntaxError("|2", "Unmatched absolute value bar");
    }

    @Test
    public void testUnknownNames() {
        assertSyntaxError("foo(2)", "Unknown function 'foo'");
        assertSyntaxError("2x", "Unknown identifier 'x'");
        assertSyntaxError("\\foo{2}", "Unknown command '\\foo'");
    }

    @Test
    public void testMissingArguments() {
        assertSyntaxError("sin", "Missing argument for 'sin'");
        assertSyntaxError("nthroot[2]", "Missing argument for 'nthroot'");
        assertSyntaxError("log_", "Missing logarithm base");
        assertSyntaxError("frac 1 2", "Fraction expects {numerator}{denominator}");
        assertSyntaxError("abs 3", "abs expects a parenthesized argument");
    }

    @Test
    public void testNestingLimit() {
        String deep = "(".repeat(ExpressionParser.MAX_DEPTH + 10) + "1" + ")".repeat(ExpressionParser.MAX_DEPTH + 10);
        assertSyntaxError(deep, "nested too deeply");

        String shallow = "(".repeat(100) + "1" + ")".repeat(100);
        assertEquals(num(1), parser.parse(shallow));
    }

    // ============================================================
    // Unsupported constructs
    // ============================================================

    @ParameterizedTest
    @ValueSource(strings = {"\\int_0^1 x dx", "\\sum_{i=1}^{10} i", "\\infty", "\\lim x", "2\\pm 1", "\\partial"})
    public void testSymbolicCommands(String input) {
        ExpressionException e = assertThrows(ExpressionException.class, () -> parser.parse(input));
        assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, e.kind());
    }

    @Test
    public void testExponentOnFunctionName() {
        ExpressionException e = assertThrows(ExpressionException.class, () -> parser.parse("sin^{-1}{1}"));
        assertEquals(ErrorKind.UNSUPPORTED_CONSTRUCT, e.kind());
        assertEquals(3, e.position());
        assertTrue(e.getMessage().contains("sin{x}^{k}"));
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static ExpressionNode num(double value) {
        return new ExpressionNode.Literal(value);
    }

    private static ExpressionNode pi() {
        return new ExpressionNode.Constant(MathConstant.PI);
    }

    private void assertSyntaxError(String input, String expectedMessage) {
        ExpressionException e = assertThrows(ExpressionException.class, () -> parser.parse(input));
        assertEquals(ErrorKind.SYNTAX_ERROR, e.kind(), e.getMessage());
        assertTrue(e.getMessage().contains(expectedMessage),
                "Expected message containing '" + expectedMessage + "' but was '" + e.getMessage() + "'");
    }
}
