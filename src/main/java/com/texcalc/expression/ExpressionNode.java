package com.texcalc.expression;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

public sealed interface ExpressionNode {
    record Literal(double value) implements ExpressionNode {}

    record Constant(MathConstant constant) implements ExpressionNode {
        public Constant {
            Objects.requireNonNull(constant, "constant");
        }
    }

    record UnaryMinus(ExpressionNode operand) implements ExpressionNode {
        public UnaryMinus {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record Abs(ExpressionNode operand) implements ExpressionNode {
        public Abs {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record BinaryOp(BinaryOperator operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    // Postfix n!, binds tighter than ^
    record Factorial(ExpressionNode operand) implements ExpressionNode {
        public Factorial {
            Objects.requireNonNull(operand, "operand");
        }
    }

    // Right-associative: a^b^c is Power(a, Power(b, c))
    record Power(ExpressionNode base, ExpressionNode exponent) implements ExpressionNode {
        public Power {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(exponent, "exponent");
        }
    }

    // From frac{..}{..}; reduces exactly like BinaryOp(DIVIDE, ..)
    record Fraction(ExpressionNode numerator, ExpressionNode denominator) implements ExpressionNode {
        public Fraction {
            Objects.requireNonNull(numerator, "numerator");
            Objects.requireNonNull(denominator, "denominator");
        }
    }

    record FunctionCall(MathFunction function, ImmutableList<ExpressionNode> arguments) implements ExpressionNode {
        public FunctionCall {
            Objects.requireNonNull(function, "function");
            if (arguments == null || arguments.size() != function.arity()) {
                throw new IllegalArgumentException(function + " takes " + function.arity() + " argument(s)");
            }
        }

        public static FunctionCall of(MathFunction function, ExpressionNode argument) {
            return new FunctionCall(function, Lists.immutable.of(argument));
        }

        public static FunctionCall of(MathFunction function, ExpressionNode first, ExpressionNode second) {
            return new FunctionCall(function, Lists.immutable.of(first, second));
        }
    }

    static Literal number(double value) {
        return new Literal(value);
    }
}
