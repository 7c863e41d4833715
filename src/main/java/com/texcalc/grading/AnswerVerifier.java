package com.texcalc.grading;

import com.texcalc.LatexCalculator;
import com.texcalc.eval.EvaluationResult;
import org.eclipse.collections.impl.block.factory.primitive.CharPredicates;
import org.eclipse.collections.impl.factory.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grades a submitted answer against the stored one. Free-text answers match if their text is
 * identical or if both evaluate to numbers within the tolerance; an answer that does not
 * evaluate is only ever compared as text.
 */
public class AnswerVerifier {
    private static final Logger log = LoggerFactory.getLogger(AnswerVerifier.class);

    public static final double DEFAULT_TOLERANCE = 1e-9;

    private final LatexCalculator calculator;
    private final double tolerance;

    public AnswerVerifier(LatexCalculator calculator) {
        this(calculator, DEFAULT_TOLERANCE);
    }

    public AnswerVerifier(LatexCalculator calculator, double tolerance) {
        if (!(tolerance > 0)) {
            throw new IllegalArgumentException("Tolerance must be positive, got " + tolerance);
        }
        this.calculator = calculator;
        this.tolerance = tolerance;
    }

    public VerificationResult verify(String userAnswer, String correctAnswer, QuestionType type) {
        String user = clean(userAnswer);
        String expected = clean(correctAnswer);

        if (user.isEmpty()) {
            return VerificationResult.exact(false, "empty_answer", user, expected);
        }

        return switch (type) {
            case CHOICE -> verifyChoice(user, expected);
            case BLANK, ANSWER -> verifyFreeText(user, expected);
        };
    }

    // "b, a" matches "AB"
    private VerificationResult verifyChoice(String user, String expected) {
        String userLetters = choiceLetters(user);
        String expectedLetters = choiceLetters(expected);
        boolean correct = userLetters.equals(expectedLetters);
        return VerificationResult.exact(correct, correct ? null : "incorrect", userLetters, expectedLetters);
    }

    private VerificationResult verifyFreeText(String user, String expected) {
        if (withoutWhitespace(user).equalsIgnoreCase(withoutWhitespace(expected))) {
            return VerificationResult.exact(true, null, user, expected);
        }

        EvaluationResult userResult = calculator.evaluate(user);
        EvaluationResult expectedResult = calculator.evaluate(expected);
        if (userResult instanceof EvaluationResult.Success userValue
                && expectedResult instanceof EvaluationResult.Success expectedValue) {
            boolean correct = withinTolerance(userValue.value(), expectedValue.value());
            return VerificationResult.numeric(correct, user, expected, userValue.value(), expectedValue.value());
        }

        log.debug("Falling back to text comparison for '{}' against '{}'", user, expected);
        return VerificationResult.exact(false, "incorrect", user, expected);
    }

    boolean withinTolerance(double actual, double expected) {
        double difference = Math.abs(actual - expected);
        return difference < tolerance || difference / Math.max(Math.abs(expected), 1) < tolerance;
    }

    private static String clean(String answer) {
        if (answer == null) {
            return "";
        }
        String trimmed = answer.trim();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == '$') {
            start++;
        }
        while (end > start && trimmed.charAt(end - 1) == '$') {
            end--;
        }
        return trimmed.substring(start, end).trim();
    }

    private static String choiceLetters(String answer) {
        return Strings.asChars(answer.toUpperCase())
                .select(CharPredicates.isUpperCase())
                .toSortedList()
                .makeString("");
    }

    private static String withoutWhitespace(String answer) {
        return Strings.asChars(answer)
                .reject(CharPredicates.isWhitespace())
                .makeString("");
    }
}
