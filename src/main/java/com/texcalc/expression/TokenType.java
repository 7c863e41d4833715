package com.texcalc.expression;

public enum TokenType {
    NUMBER,
    IDENTIFIER,
    COMMAND,     // \name that survived normalization
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    UNDERSCORE,
    COMMA,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    BAR,         // absolute value bar the normalizer could not pair
    BANG,        // postfix factorial
    EOF;

    public boolean isOpening() {
        return this == LEFT_PAREN || this == LEFT_BRACE || this == LEFT_BRACKET;
    }

    public TokenType closing() {
        return switch (this) {
            case LEFT_PAREN -> RIGHT_PAREN;
            case LEFT_BRACE -> RIGHT_BRACE;
            case LEFT_BRACKET -> RIGHT_BRACKET;
            default -> throw new IllegalStateException(this + " does not open a group");
        };
    }
}
