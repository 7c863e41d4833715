package com.texcalc.output;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Renders evaluation results for display. Never rewrites values symbolically: 0.5 stays
 * {@code 0.5}, not {@code 1/2}.
 */
public class NumberFormatter {
    public static final int DEFAULT_SIGNIFICANT_DIGITS = 10;

    private static final double INTEGER_TOLERANCE = 1e-10;
    private static final double PLAIN_UPPER_BOUND = 1e21;
    private static final double PLAIN_LOWER_BOUND = 1e-7;

    private final MathContext context;

    public NumberFormatter() {
        this(DEFAULT_SIGNIFICANT_DIGITS);
    }

    public NumberFormatter(int significantDigits) {
        if (significantDigits < 1 || significantDigits > 17) {
            throw new IllegalArgumentException("Significant digits must be between 1 and 17, got " + significantDigits);
        }
        this.context = new MathContext(significantDigits, RoundingMode.HALF_UP);
    }

    public String format(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }

        double abs = Math.abs(value);
        // Fast path for whole numbers, also absorbs float noise such as 2.0000000000000004
        double nearest = Math.rint(value);
        if (abs < PLAIN_UPPER_BOUND && Math.abs(value - nearest) < INTEGER_TOLERANCE) {
            return nearest == 0 ? "0" : new BigDecimal(nearest).toPlainString();
        }

        BigDecimal rounded = new BigDecimal(value).round(context).stripTrailingZeros();
        if (abs >= PLAIN_LOWER_BOUND && abs < PLAIN_UPPER_BOUND) {
            return rounded.toPlainString();
        }
        return scientific(rounded);
    }

    // 1.5E+25 -> 1.5e+25, 1E-8 -> 1e-8
    private static String scientific(BigDecimal rounded) {
        int exponent = rounded.precision() - rounded.scale() - 1;
        BigDecimal mantissa = rounded.movePointLeft(exponent).stripTrailingZeros();
        String sign = exponent < 0 ? "-" : "+";
        return mantissa.toPlainString() + "e" + sign + Math.abs(exponent);
    }
}
