package com.texcalc.grading;

/**
 * Verdict on one submitted answer. Values are present only when the answers were compared
 * numerically.
 */
public record VerificationResult(
        boolean correct,
        VerificationMethod method,
        String message,
        String userAnswer,
        String expectedAnswer,
        Double userValue,
        Double expectedValue) {

    static VerificationResult exact(boolean correct, String message, String userAnswer, String expectedAnswer) {
        return new VerificationResult(correct, VerificationMethod.EXACT, message, userAnswer, expectedAnswer, null, null);
    }

    static VerificationResult numeric(boolean correct, String userAnswer, String expectedAnswer,
                                      double userValue, double expectedValue) {
        return new VerificationResult(correct, VerificationMethod.NUMERIC, correct ? null : "incorrect",
                userAnswer, expectedAnswer, userValue, expectedValue);
    }
}
