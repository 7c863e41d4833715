package com.texcalc.eval;

import com.texcalc.expression.ErrorKind;
import com.texcalc.expression.ExpressionException;
import com.texcalc.expression.ExpressionNode;
import com.texcalc.expression.MathFunction;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.stack.MutableStack;
import org.eclipse.collections.impl.factory.Stacks;

/**
 * Post-order walk of an expression tree to a finite double. Each node checks its own domain
 * rule and every value produced, literals included, must be finite.
 */
public class ExpressionEvaluator {

    // 171! exceeds Double.MAX_VALUE
    private static final int MAX_FACTORIAL = 170;

    public double evaluate(ExpressionNode node) {
        return finite(compute(node), node);
    }

    private double compute(ExpressionNode node) {
        if (node instanceof ExpressionNode.Literal literal) {
            return literal.value();
        }
        if (node instanceof ExpressionNode.Constant constant) {
            return constant.constant().value();
        }
        if (node instanceof ExpressionNode.UnaryMinus minus) {
            return -evaluate(minus.operand());
        }
        if (node instanceof ExpressionNode.Abs abs) {
            return Math.abs(evaluate(abs.operand()));
        }
        if (node instanceof ExpressionNode.BinaryOp op) {
            return chain(op);
        }
        if (node instanceof ExpressionNode.Factorial factorial) {
            return factorial(evaluate(factorial.operand()));
        }
        if (node instanceof ExpressionNode.Fraction fraction) {
            return divide(evaluate(fraction.numerator()), evaluate(fraction.denominator()));
        }
        if (node instanceof ExpressionNode.Power power) {
            return power(evaluate(power.base()), evaluate(power.exponent()));
        }
        if (node instanceof ExpressionNode.FunctionCall call) {
            return call(call.function(), call.arguments());
        }
        throw new IllegalStateException("Unknown node: " + node);
    }

    // a+b+c... parses left-deep; the left spine is folded iteratively, left to right.
    private double chain(ExpressionNode.BinaryOp top) {
        MutableStack<ExpressionNode.BinaryOp> spine = Stacks.mutable.empty();
        ExpressionNode current = top;
        while (current instanceof ExpressionNode.BinaryOp op) {
            spine.push(op);
            current = op.left();
        }
        double value = evaluate(current);
        while (spine.notEmpty()) {
            ExpressionNode.BinaryOp op = spine.pop();
            double right = evaluate(op.right());
            value = switch (op.operator()) {
                case ADD -> value + right;
                case SUBTRACT -> value - right;
                case MULTIPLY -> value * right;
                case DIVIDE -> divide(value, right);
            };
            if (op != top) {
                value = finite(value, op);
            }
        }
        return value;
    }

    private double factorial(double n) {
        if (n < 0 || !isInteger(n) || n > MAX_FACTORIAL) {
            throw new ExpressionException(ErrorKind.OUT_OF_DOMAIN,
                    "Factorial is defined for integers 0 to " + MAX_FACTORIAL + ", got " + n);
        }
        double product = 1;
        for (int i = 2; i <= (int) n; i++) {
            product *= i;
        }
        return product;
    }

    private double call(MathFunction function, ImmutableList<ExpressionNode> arguments) {
        double x = evaluate(arguments.getLast());
        return switch (function) {
            case SIN -> Math.sin(x);
            case COS -> Math.cos(x);
            case TAN -> Math.tan(x);
            case COT -> reciprocal(Math.tan(x), "cot");
            case SEC -> reciprocal(Math.cos(x), "sec");
            case CSC -> reciprocal(Math.sin(x), "csc");
            case ARCSIN -> Math.asin(unitInterval(x, "arcsin"));
            case ARCCOS -> Math.acos(unitInterval(x, "arccos"));
            case ARCTAN -> Math.atan(x);
            case ARCCOT -> Math.PI / 2 - Math.atan(x);
            case SINH -> Math.sinh(x);
            case COSH -> Math.cosh(x);
            case TANH -> Math.tanh(x);
            case LN -> Math.log(logArgument(x));
            case LOG -> Math.log10(logArgument(x));
            case EXP -> Math.exp(x);
            case SQRT -> {
                if (x < 0) {
                    throw new ExpressionException(ErrorKind.NEGATIVE_RADICAND, "Square root of negative number " + x);
                }
                yield Math.sqrt(x);
            }
            case NTHROOT -> nthRoot(evaluate(arguments.getFirst()), x);
            case LOG_BASE -> logBase(evaluate(arguments.getFirst()), x);
        };
    }

    private static double divide(double numerator, double denominator) {
        if (denominator == 0) {
            throw new ExpressionException(ErrorKind.DIVISION_BY_ZERO, "Division by zero");
        }
        return numerator / denominator;
    }

    private static double power(double base, double exponent) {
        if (base < 0 && !isInteger(exponent)) {
            throw new ExpressionException(ErrorKind.INVALID_POWER,
                    "Negative base " + base + " raised to non-integer exponent " + exponent);
        }
        if (base == 0 && exponent < 0) {
            throw new ExpressionException(ErrorKind.DIVISION_BY_ZERO, "Zero raised to negative exponent " + exponent);
        }
        return Math.pow(base, exponent);
    }

    private static double nthRoot(double degree, double radicand) {
        if (degree == 0) {
            throw new ExpressionException(ErrorKind.DIVISION_BY_ZERO, "Root of degree zero");
        }
        boolean oddInteger = isInteger(degree) && Math.abs(degree % 2) == 1;
        if (radicand < 0 && !oddInteger) {
            throw new ExpressionException(ErrorKind.NEGATIVE_RADICAND,
                    "Root of degree " + degree + " of negative number " + radicand);
        }
        if (degree == 3) {
            return Math.cbrt(radicand);
        }
        double magnitude = Math.pow(Math.abs(radicand), 1 / degree);
        // Snap to an exact integer root when there is one, e.g. 32^(1/5) to 2
        double rounded = Math.rint(magnitude);
        if (rounded != magnitude && isInteger(degree) && Math.pow(rounded, degree) == Math.abs(radicand)) {
            magnitude = rounded;
        }
        return radicand < 0 ? -magnitude : magnitude;
    }

    private static double logBase(double base, double x) {
        if (base <= 0) {
            throw new ExpressionException(ErrorKind.NON_POSITIVE_LOG_ARGUMENT, "Logarithm base must be positive, got " + base);
        }
        if (base == 1) {
            throw new ExpressionException(ErrorKind.OUT_OF_DOMAIN, "Logarithm base must not be 1");
        }
        double argument = logArgument(x);
        if (base == 10) {
            return Math.log10(argument);
        }
        return Math.log(argument) / Math.log(base);
    }

    private static double logArgument(double x) {
        if (x <= 0) {
            throw new ExpressionException(ErrorKind.NON_POSITIVE_LOG_ARGUMENT, "Logarithm of non-positive number " + x);
        }
        return x;
    }

    private static double unitInterval(double x, String name) {
        if (Math.abs(x) > 1) {
            throw new ExpressionException(ErrorKind.OUT_OF_DOMAIN, name + " is undefined for " + x);
        }
        return x;
    }

    private static double reciprocal(double denominator, String name) {
        if (denominator == 0) {
            throw new ExpressionException(ErrorKind.DIVISION_BY_ZERO, name + " is undefined here");
        }
        return 1 / denominator;
    }

    private static boolean isInteger(double value) {
        return value == Math.rint(value) && !Double.isInfinite(value);
    }

    private static double finite(double value, ExpressionNode node) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ExpressionException(ErrorKind.NUMERIC_OVERFLOW,
                    "Result is not a finite number at " + node.getClass().getSimpleName());
        }
        return value;
    }
}
