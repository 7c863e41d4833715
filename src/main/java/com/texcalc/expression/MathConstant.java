package com.texcalc.expression;

public enum MathConstant {
    PI("pi", Math.PI),
    E("e", Math.E);

    private final String symbol;
    private final double value;

    MathConstant(String symbol, double value) {
        this.symbol = symbol;
        this.value = value;
    }

    public String symbol() {
        return symbol;
    }

    public double value() {
        return value;
    }

    public static MathConstant fromSymbol(String symbol) {
        for (MathConstant constant : values()) {
            if (constant.symbol.equals(symbol)) {
                return constant;
            }
        }
        return null;
    }
}
