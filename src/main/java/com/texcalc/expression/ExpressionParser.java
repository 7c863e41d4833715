package com.texcalc.expression;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Recursive-descent parser over the normalizer's canonical form.
 *
 * <pre>
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/') unary | power)*
 * unary          := ('-' | '+') unary | power
 * power          := primary '!'* ('^' unary)?
 * primary        := number | constant | group | frac | sqrt | nthroot | abs | log_ | function
 * </pre>
 *
 * The bare {@code power} alternative in {@code multiplicative} is implicit multiplication.
 * Instances hold no state between calls.
 */
public class ExpressionParser {
    static final int MAX_DEPTH = 256;

    private static final ImmutableSet<String> SYMBOLIC_COMMANDS = Sets.immutable.of(
            "\\int", "\\iint", "\\iiint", "\\oint", "\\sum", "\\prod", "\\lim",
            "\\infty", "\\partial", "\\nabla", "\\pm", "\\mp");

    private final ExpressionTokenizer tokenizer = new ExpressionTokenizer();

    public ExpressionNode parse(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            throw new ExpressionException(ErrorKind.SYNTAX_ERROR, "Empty expression", 0);
        }

        Cursor cursor = new Cursor(tokenizer.tokenize(normalized));
        ExpressionNode root = cursor.additive();

        Token rest = cursor.peek();
        if (!rest.is(TokenType.EOF)) {
            if (isClosing(rest.type())) {
                throw ExpressionException.syntax("Unbalanced grouping: unexpected " + rest.describe(), rest);
            }
            throw ExpressionException.syntax("Unexpected trailing input " + rest.describe(), rest);
        }
        return root;
    }

    private static boolean isClosing(TokenType type) {
        return type == TokenType.RIGHT_PAREN || type == TokenType.RIGHT_BRACE || type == TokenType.RIGHT_BRACKET;
    }

    /** Position in one token list; created per parse call. */
    private static final class Cursor {
        private final ImmutableList<Token> tokens;
        private int index;
        private int depth;

        Cursor(ImmutableList<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(index);
        }

        Token previous() {
            return index == 0 ? null : tokens.get(index - 1);
        }

        Token advance() {
            Token token = tokens.get(index);
            if (!token.is(TokenType.EOF)) {
                index++;
            }
            return token;
        }

        boolean match(TokenType type) {
            if (peek().is(type)) {
                index++;
                return true;
            }
            return false;
        }

        ExpressionNode additive() {
            ExpressionNode left = multiplicative();
            while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
                BinaryOperator operator = advance().is(TokenType.PLUS) ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
                left = new ExpressionNode.BinaryOp(operator, left, multiplicative());
            }
            return left;
        }

        ExpressionNode multiplicative() {
            ExpressionNode left = unary();
            while (true) {
                if (peek().is(TokenType.STAR) || peek().is(TokenType.SLASH)) {
                    BinaryOperator operator = advance().is(TokenType.STAR) ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
                    left = new ExpressionNode.BinaryOp(operator, left, unary());
                } else if (startsImplicitOperand()) {
                    left = new ExpressionNode.BinaryOp(BinaryOperator.MULTIPLY, left, power());
                } else {
                    return left;
                }
            }
        }

        private boolean startsImplicitOperand() {
            Token next = peek();
            return switch (next.type()) {
                case IDENTIFIER, COMMAND, BAR, LEFT_PAREN, LEFT_BRACE, LEFT_BRACKET -> true;
                // "2 3" is not 6
                case NUMBER -> !previous().is(TokenType.NUMBER);
                default -> false;
            };
        }

        ExpressionNode unary() {
            if (++depth > MAX_DEPTH) {
                throw ExpressionException.syntax("Expression nested too deeply", peek());
            }
            try {
                if (match(TokenType.MINUS)) {
                    return new ExpressionNode.UnaryMinus(unary());
                }
                if (match(TokenType.PLUS)) {
                    return unary();
                }
                return power();
            } finally {
                depth--;
            }
        }

        ExpressionNode power() {
            ExpressionNode base = primary();
            while (match(TokenType.BANG)) {
                base = new ExpressionNode.Factorial(base);
            }
            if (match(TokenType.CARET)) {
                return new ExpressionNode.Power(base, unary());
            }
            return base;
        }

        ExpressionNode primary() {
            Token token = peek();
            switch (token.type()) {
                case NUMBER -> {
                    advance();
                    return ExpressionNode.number(Double.parseDouble(token.text()));
                }
                case IDENTIFIER -> {
                    advance();
                    return identifier(token);
                }
                case LEFT_PAREN, LEFT_BRACE, LEFT_BRACKET -> {
                    return group();
                }
                case COMMAND -> {
                    if (SYMBOLIC_COMMANDS.contains(token.text())) {
                        throw new ExpressionException(ErrorKind.UNSUPPORTED_CONSTRUCT,
                                "Unsupported construct '" + token.text() + "' requires symbolic computation",
                                token.position());
                    }
                    throw ExpressionException.syntax("Unknown command '" + token.text() + "'", token);
                }
                case BAR -> throw ExpressionException.syntax("Unmatched absolute value bar", token);
                case EOF -> {
                    Token last = previous();
                    if (last == null) {
                        throw ExpressionException.syntax("Missing operand", token);
                    }
                    throw ExpressionException.syntax("Missing operand after " + last.describe(), token);
                }
                default -> throw ExpressionException.syntax("Missing operand before " + token.describe(), token);
            }
        }

        private ExpressionNode identifier(Token name) {
            MathConstant constant = MathConstant.fromSymbol(name.text());
            if (constant != null) {
                return new ExpressionNode.Constant(constant);
            }

            switch (name.text()) {
                case "frac" -> {
                    ExpressionNode numerator = braceGroup("Fraction expects {numerator}{denominator}");
                    ExpressionNode denominator = braceGroup("Fraction expects {numerator}{denominator}");
                    return new ExpressionNode.Fraction(numerator, denominator);
                }
                case "nthroot" -> {
                    if (!peek().is(TokenType.LEFT_BRACKET)) {
                        throw ExpressionException.syntax("Root expects [degree]{radicand}", peek());
                    }
                    ExpressionNode degree = group();
                    return ExpressionNode.FunctionCall.of(MathFunction.NTHROOT, degree, argument(name));
                }
                case "abs" -> {
                    if (!peek().type().isOpening()) {
                        throw ExpressionException.syntax("abs expects a parenthesized argument", peek());
                    }
                    return new ExpressionNode.Abs(group());
                }
                case "log" -> {
                    if (match(TokenType.UNDERSCORE)) {
                        ExpressionNode base = logBase();
                        rejectExponentOnName(name);
                        return ExpressionNode.FunctionCall.of(MathFunction.LOG_BASE, base, argument(name));
                    }
                    return function(name, MathFunction.LOG);
                }
                default -> {
                    MathFunction function = MathFunction.byName(name.text());
                    if (function != null) {
                        return function(name, function);
                    }
                    if (peek().type().isOpening()) {
                        throw ExpressionException.syntax("Unknown function '" + name.text() + "'", name);
                    }
                    throw ExpressionException.syntax("Unknown identifier '" + name.text() + "'", name);
                }
            }
        }

        private ExpressionNode function(Token name, MathFunction function) {
            rejectExponentOnName(name);
            return ExpressionNode.FunctionCall.of(function, argument(name));
        }

        // The normalizer moves f^{k}{x} to f{x}^{k}; what is left is f^{-1} or an undelimited argument
        private void rejectExponentOnName(Token name) {
            Token caret = peek();
            if (caret.is(TokenType.CARET)) {
                throw new ExpressionException(ErrorKind.UNSUPPORTED_CONSTRUCT,
                        "Exponent on function name '" + name.text() + "' at position " + caret.position()
                                + " is not supported; write " + name.text() + "{x}^{k}",
                        caret.position());
            }
        }

        private ExpressionNode argument(Token name) {
            Token next = peek();
            if (next.type().isOpening()) {
                return group();
            }
            if (next.is(TokenType.EOF) || isClosing(next.type()) || next.is(TokenType.STAR)
                    || next.is(TokenType.SLASH) || next.is(TokenType.CARET) || next.is(TokenType.COMMA)) {
                throw ExpressionException.syntax("Missing argument for '" + name.text() + "'", next);
            }
            return unary();
        }

        private ExpressionNode logBase() {
            Token next = peek();
            if (next.type().isOpening()) {
                return group();
            }
            if (next.is(TokenType.NUMBER)) {
                advance();
                return ExpressionNode.number(Double.parseDouble(next.text()));
            }
            if (next.is(TokenType.IDENTIFIER) && MathConstant.fromSymbol(next.text()) != null) {
                advance();
                return new ExpressionNode.Constant(MathConstant.fromSymbol(next.text()));
            }
            throw ExpressionException.syntax("Missing logarithm base", next);
        }

        private ExpressionNode braceGroup(String message) {
            if (!peek().is(TokenType.LEFT_BRACE)) {
                throw ExpressionException.syntax(message, peek());
            }
            return group();
        }

        ExpressionNode group() {
            Token open = advance();
            ExpressionNode inner = additive();
            TokenType expected = open.type().closing();
            Token close = peek();
            if (close.is(expected)) {
                advance();
                return inner;
            }
            if (close.is(TokenType.EOF)) {
                throw ExpressionException.syntax("Unbalanced grouping: " + open.describe()
                        + " opened at position " + open.position() + " is never closed", close);
            }
            if (isClosing(close.type())) {
                throw ExpressionException.syntax("Unbalanced grouping: " + open.describe()
                        + " opened at position " + open.position() + " is closed by " + close.describe(), close);
            }
            throw ExpressionException.syntax("Expected '" + closingText(expected) + "' but found " + close.describe(), close);
        }

        private static String closingText(TokenType type) {
            return switch (type) {
                case RIGHT_PAREN -> ")";
                case RIGHT_BRACE -> "}";
                default -> "]";
            };
        }
    }
}
