package com.texcalc;

import com.texcalc.eval.EvaluationResult;
import com.texcalc.eval.ExpressionEvaluator;
import com.texcalc.expression.ErrorKind;
import com.texcalc.expression.ExpressionException;
import com.texcalc.expression.ExpressionNode;
import com.texcalc.expression.ExpressionParser;
import com.texcalc.normalize.LatexNormalizer;
import com.texcalc.output.NumberFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes, parses and evaluates LaTeX math. Never throws: every problem comes back as an
 * {@link EvaluationResult.Failure}. Holds no per-call state, so one instance can be shared
 * between threads.
 */
public class LatexCalculator {
    private static final Logger log = LoggerFactory.getLogger(LatexCalculator.class);

    private final LatexNormalizer normalizer = new LatexNormalizer();
    private final ExpressionParser parser = new ExpressionParser();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private final NumberFormatter formatter;

    public LatexCalculator() {
        this(new NumberFormatter());
    }

    public LatexCalculator(NumberFormatter formatter) {
        this.formatter = formatter;
    }

    public EvaluationResult evaluate(String latex) {
        if (latex == null || latex.isBlank()) {
            return EvaluationResult.failure(ErrorKind.SYNTAX_ERROR, "Empty expression", null);
        }

        String normalized = normalizer.normalize(latex);
        try {
            ExpressionNode tree = parser.parse(normalized);
            double value = evaluator.evaluate(tree);
            log.debug("Evaluated '{}' as '{}' = {}", latex, normalized, value);
            return EvaluationResult.success(value, normalized);
        } catch (ExpressionException e) {
            log.debug("Could not evaluate '{}' ({}): {}", latex, e.kind(), e.getMessage());
            return EvaluationResult.failure(e.kind(), e.getMessage(), normalized);
        } catch (StackOverflowError e) {
            log.debug("Expression too deeply nested: '{}'", normalized);
            return EvaluationResult.failure(ErrorKind.SYNTAX_ERROR, "Expression nested too deeply", normalized);
        }
    }

    public boolean canEvaluate(String latex) {
        return evaluate(latex).isSuccess();
    }

    public String format(double value) {
        return formatter.format(value);
    }
}
