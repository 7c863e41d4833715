package com.texcalc.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.texcalc.eval.EvaluationResult;
import com.texcalc.grading.VerificationResult;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Writes results in the shape callers consume:
 * {@code {"success":true,"value":0.5,"expression":"frac{1}{2}","formatted":"0.5"}} or
 * {@code {"success":false,"error":"Division by zero","kind":"DIVISION_BY_ZERO","expression":"1/0"}}.
 */
public class ResultJsonWriter {
    private final JsonFactory factory = new JsonFactory();
    private final NumberFormatter formatter;
    private final boolean prettyPrint;

    public ResultJsonWriter(NumberFormatter formatter, boolean prettyPrint) {
        this.formatter = formatter;
        this.prettyPrint = prettyPrint;
    }

    public String write(EvaluationResult result) {
        return render(generator -> writeResult(generator, result));
    }

    public String write(String input, VerificationResult verification) {
        return render(generator -> {
            generator.writeStartObject();
            generator.writeStringField("input", input);
            generator.writeBooleanField("correct", verification.correct());
            generator.writeStringField("method", verification.method().name().toLowerCase());
            if (verification.message() != null) {
                generator.writeStringField("message", verification.message());
            }
            generator.writeStringField("userAnswer", verification.userAnswer());
            generator.writeStringField("expectedAnswer", verification.expectedAnswer());
            if (verification.userValue() != null) {
                generator.writeNumberField("userValue", verification.userValue());
            }
            if (verification.expectedValue() != null) {
                generator.writeNumberField("expectedValue", verification.expectedValue());
            }
            generator.writeEndObject();
        });
    }

    private void writeResult(JsonGenerator generator, EvaluationResult result) throws IOException {
        generator.writeStartObject();
        generator.writeBooleanField("success", result.isSuccess());
        if (result instanceof EvaluationResult.Success success) {
            generator.writeNumberField("value", success.value());
            generator.writeStringField("expression", success.expression());
            generator.writeStringField("formatted", formatter.format(success.value()));
        } else if (result instanceof EvaluationResult.Failure failure) {
            generator.writeStringField("error", failure.message());
            generator.writeStringField("kind", failure.kind().name());
            if (failure.expression() != null) {
                generator.writeStringField("expression", failure.expression());
            }
        }
        generator.writeEndObject();
    }

    private String render(JsonBody body) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (prettyPrint) {
                generator.useDefaultPrettyPrinter();
            }
            body.write(generator);
        } catch (IOException e) {
            // StringWriter does not fail; only a generator misuse gets here
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    @FunctionalInterface
    private interface JsonBody {
        void write(JsonGenerator generator) throws IOException;
    }
}
