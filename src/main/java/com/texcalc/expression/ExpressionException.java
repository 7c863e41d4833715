package com.texcalc.expression;

/**
 * Raised by the tokenizer, parser and evaluator at the point a problem is detected.
 * {@link com.texcalc.LatexCalculator} turns it into a failed result, so callers of the
 * facade never see it.
 */
public class ExpressionException extends RuntimeException {
    private final ErrorKind kind;
    private final int position;

    public ExpressionException(ErrorKind kind, String message) {
        this(kind, message, -1);
    }

    public ExpressionException(ErrorKind kind, String message, int position) {
        super(message);
        this.kind = kind;
        this.position = position;
    }

    public ErrorKind kind() {
        return kind;
    }

    /** Offset into the normalized expression, or -1 when the error has no single location. */
    public int position() {
        return position;
    }

    static ExpressionException syntax(String message, Token token) {
        return new ExpressionException(ErrorKind.SYNTAX_ERROR,
                message + " at position " + token.position(), token.position());
    }
}
