package com.texcalc.output;

import com.texcalc.eval.EvaluationResult;
import com.texcalc.expression.ErrorKind;
import com.texcalc.grading.VerificationMethod;
import com.texcalc.grading.VerificationResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResultJsonWriterTest {

    private final ResultJsonWriter writer = new ResultJsonWriter(new NumberFormatter(), false);

    @Test
    public void testSuccess() {
        String json = writer.write(EvaluationResult.success(0.5, "frac{1}{2}"));

        assertEquals("{\"success\":true,\"value\":0.5,\"expression\":\"frac{1}{2}\",\"formatted\":\"0.5\"}", json);
    }

    @Test
    public void testFormattedUsesSignificantDigits() {
        String json = writer.write(EvaluationResult.success(1.0 / 3, "frac{1}{3}"));

        assertTrue(json.contains("\"formatted\":\"0.3333333333\""), json);
    }

    @Test
    public void testFailure() {
        String json = writer.write(EvaluationResult.failure(ErrorKind.DIVISION_BY_ZERO, "Division by zero", "1/0"));

        assertEquals("{\"success\":false,\"error\":\"Division by zero\",\"kind\":\"DIVISION_BY_ZERO\",\"expression\":\"1/0\"}", json);
    }

    @Test
    public void testFailureWithoutExpression() {
        String json = writer.write(EvaluationResult.failure(ErrorKind.SYNTAX_ERROR, "Empty expression", null));

        assertEquals("{\"success\":false,\"error\":\"Empty expression\",\"kind\":\"SYNTAX_ERROR\"}", json);
    }

    @Test
    public void testBackslashesAreEscaped() {
        String json = writer.write(EvaluationResult.failure(ErrorKind.SYNTAX_ERROR, "Unknown command '\\foo'", "\\foo"));

        assertTrue(json.contains("\"expression\":\"\\\\foo\""), json);
    }

    @Test
    public void testVerification() {
        VerificationResult verdict = new VerificationResult(true, VerificationMethod.NUMERIC, null,
                "0.5", "\\frac{1}{2}", 0.5, 0.5);

        String json = writer.write("0.5", verdict);

        assertEquals("{\"input\":\"0.5\",\"correct\":true,\"method\":\"numeric\",\"userAnswer\":\"0.5\","
                + "\"expectedAnswer\":\"\\\\frac{1}{2}\",\"userValue\":0.5,\"expectedValue\":0.5}", json);
    }

    @Test
    public void testExactVerificationHasNoValues() {
        VerificationResult verdict = new VerificationResult(false, VerificationMethod.EXACT, "incorrect",
                "x", "y", null, null);

        String json = writer.write("x", verdict);

        assertTrue(json.contains("\"method\":\"exact\""), json);
        assertTrue(json.contains("\"message\":\"incorrect\""), json);
        assertFalse(json.contains("Value"), json);
    }

    @Test
    public void testPrettyPrint() {
        ResultJsonWriter pretty = new ResultJsonWriter(new NumberFormatter(), true);

        String json = pretty.write(EvaluationResult.success(0.5, "frac{1}{2}"));

        assertTrue(json.contains("\n"), json);
        assertTrue(json.contains("\"success\" : true"), json);
    }
}
