package com.texcalc.eval;

import com.texcalc.expression.ErrorKind;

import java.util.Objects;

/**
 * Outcome of evaluating one expression. The expression is the normalized form, kept for
 * diagnostics; a failure detected before normalization has none.
 */
public sealed interface EvaluationResult {

    boolean isSuccess();

    String expression();

    record Success(double value, String expression) implements EvaluationResult {
        public Success {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(ErrorKind kind, String message, String expression) implements EvaluationResult {
        public Failure {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    static EvaluationResult success(double value, String expression) {
        return new Success(value, expression);
    }

    static EvaluationResult failure(ErrorKind kind, String message, String expression) {
        return new Failure(kind, message, expression);
    }
}
