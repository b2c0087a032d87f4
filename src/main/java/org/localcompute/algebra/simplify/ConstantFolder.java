package org.localcompute.algebra.simplify;

import org.localcompute.algebra.frontend.lexer.Operator;

import java.util.OptionalDouble;

/**
 * Folds operators applied to numeric literals. Anything whose value is undefined
 * (division by zero, negative roots, {@code 0^0}, non-finite results) is not folded.
 */
public final class ConstantFolder {

    private ConstantFolder() {
    }

    public static OptionalDouble foldUnary(Operator op, double operand) {
        double result;
        switch (op) {
            case SUBTRACT -> result = -operand;
            case ADD -> result = operand;
            case SQRT -> {
                if (operand < 0) return OptionalDouble.empty();
                result = Math.sqrt(operand);
            }
            case SQUARE -> result = operand * operand;
            case CUBE -> result = operand * operand * operand;
            default -> {
                return OptionalDouble.empty();
            }
        }
        return finite(result);
    }

    public static OptionalDouble foldBinary(Operator op, double left, double right) {
        double result;
        switch (op) {
            case ADD -> result = left + right;
            case SUBTRACT -> result = left - right;
            case MULTIPLY -> result = left * right;
            case DIVIDE -> {
                if (right == 0) return OptionalDouble.empty();
                result = left / right;
            }
            case MODULO -> {
                if (right == 0) return OptionalDouble.empty();
                result = left % right;
            }
            case POWER -> {
                if (left == 0 && right == 0) return OptionalDouble.empty();
                result = Math.pow(left, right);
            }
            default -> {
                return OptionalDouble.empty();
            }
        }
        return finite(result);
    }

    private static OptionalDouble finite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(value);
    }
}
