package com.texcalc.expression;

public enum ErrorKind {
    SYNTAX_ERROR,
    UNSUPPORTED_CONSTRUCT,
    DIVISION_BY_ZERO,
    NEGATIVE_RADICAND,
    NON_POSITIVE_LOG_ARGUMENT,
    OUT_OF_DOMAIN,
    INVALID_POWER,
    NUMERIC_OVERFLOW;

    /** The expression is well formed but has no real value at some node. */
    public boolean isDomainError() {
        return switch (this) {
            case DIVISION_BY_ZERO, NEGATIVE_RADICAND, NON_POSITIVE_LOG_ARGUMENT,
                 OUT_OF_DOMAIN, INVALID_POWER -> true;
            default -> false;
        };
    }
}
