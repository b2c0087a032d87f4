package org.localcompute.algebra.eval;

import org.localcompute.algebra.api.AlgebraErrorCode;
import org.localcompute.algebra.diagnostics.Diagnostic;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.Map;

/**
 * A tree-walking evaluator over real numbers. It never returns an undefined value:
 * division or modulo by zero, roots of negative numbers, unbound variables and
 * NaN or infinite intermediate results are all reported as errors.
 */
public class Evaluator {

    /**
     * Evaluates a tree.
     * @param expr The tree.
     * @param bindings The variable values.
     * @return The value or the error.
     */
    public EvalResult evaluate(Expr expr, Map<String, Double> bindings) {
        try {
            return EvalResult.success(eval(expr, bindings));
        } catch (EvaluationFailure e) {
            return EvalResult.failure(e.diagnostic);
        }
    }

    private double eval(Expr expr, Map<String, Double> bindings) {
        if (expr instanceof Expr.Num n) {
            return finite(n.value());
        }
        if (expr instanceof Expr.Var v) {
            Double value = bindings.get(v.name());
            if (value == null) {
                throw new EvaluationFailure(AlgebraErrorCode.UNBOUND_VARIABLE, "Unbound variable: " + v.name());
            }
            return finite(value);
        }
        if (expr instanceof Expr.Unary u) {
            double operand = eval(u.operand(), bindings);
            return finite(switch (u.op()) {
                case SUBTRACT -> -operand;
                case ADD -> operand;
                case SQRT -> {
                    if (operand < 0) {
                        throw new EvaluationFailure(AlgebraErrorCode.NEGATIVE_ROOT,
                                "Square root of negative number: " + ExpressionFormatter.formatNumber(operand));
                    }
                    yield Math.sqrt(operand);
                }
                case SQUARE -> operand * operand;
                case CUBE -> operand * operand * operand;
                default -> throw new IllegalStateException("Not a unary operator: " + u.op());
            });
        }
        Expr.Binary b = (Expr.Binary) expr;
        double left = eval(b.left(), bindings);
        double right = eval(b.right(), bindings);
        return finite(switch (b.op()) {
            case ADD -> left + right;
            case SUBTRACT -> left - right;
            case MULTIPLY -> left * right;
            case DIVIDE -> {
                if (right == 0) {
                    throw new EvaluationFailure(AlgebraErrorCode.DIVISION_BY_ZERO, "Division by zero");
                }
                yield left / right;
            }
            case MODULO -> {
                if (right == 0) {
                    throw new EvaluationFailure(AlgebraErrorCode.MODULO_BY_ZERO, "Modulo by zero");
                }
                yield left % right;
            }
            case POWER -> Math.pow(left, right);
            default -> throw new IllegalStateException("Not a binary operator: " + b.op());
        });
    }

    private static double finite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new EvaluationFailure(AlgebraErrorCode.UNDEFINED_RESULT, "Undefined or non-finite result");
        }
        return value;
    }

    private static final class EvaluationFailure extends RuntimeException {
        private final transient Diagnostic diagnostic;

        EvaluationFailure(AlgebraErrorCode code, String message) {
            super(message, null, false, false);
            this.diagnostic = Diagnostic.error(code, message, -1);
        }
    }
}
