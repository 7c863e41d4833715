package com.texcalc.expression;

public record Token(TokenType type, String text, int position) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public String describe() {
        return type == TokenType.EOF ? "end of input" : "'" + text + "'";
    }
}
