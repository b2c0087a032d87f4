package org.localcompute.algebra.derivation.mistakes.checks;

import org.localcompute.algebra.derivation.mistakes.IMistakeCheck;
import org.localcompute.algebra.derivation.mistakes.MistakeRecord;
import org.localcompute.algebra.derivation.mistakes.MistakeType;
import org.localcompute.algebra.derivation.mistakes.StepContext;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.Optional;

/**
 * Detects misapplied exponent laws: {@code x^a * x^b} with the exponents multiplied,
 * {@code (x^a)^b} with the exponents added, and {@code x^a / x^b} with the exponents divided.
 */
public class ExponentErrorCheck implements IMistakeCheck {

    /**
     * A term read as {@code base^exponent}; a plain term has exponent 1.
     */
    private record PowerParts(Expr base, double exponent, boolean explicit) {
    }

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        if (!step.bothSidesParsed()) {
            return Optional.empty();
        }
        PowerParts result = parts(step.rhsTree());
        Expr lhs = step.lhsTree();

        if (lhs instanceof Expr.Binary b && (b.op() == Operator.MULTIPLY || b.op() == Operator.DIVIDE)) {
            PowerParts left = parts(b.left());
            PowerParts right = parts(b.right());
            if (!left.base().equals(right.base()) || !left.base().equals(result.base())
                    || !(left.explicit() || right.explicit())) {
                return Optional.empty();
            }
            return b.op() == Operator.MULTIPLY
                    ? checkProduct(step, left, right, result)
                    : checkQuotient(step, left, right, result);
        }

        PowerParts outer = parts(lhs);
        if (outer.explicit()) {
            PowerParts inner = parts(outer.base());
            if (inner.explicit() && inner.base().equals(result.base())) {
                return checkPowerOfPower(step, inner, outer.exponent(), result);
            }
        }
        return Optional.empty();
    }

    private Optional<MistakeRecord> checkProduct(StepContext step, PowerParts left, PowerParts right, PowerParts result) {
        double a = left.exponent();
        double b = right.exponent();
        double r = result.exponent();
        if (r == a + b) {
            return Optional.empty();
        }
        String base = baseText(step, left.base());
        String expected = power(step, left.base(), a + b);
        if (r == a * b) {
            return Optional.of(step.mistake(MistakeType.EXPONENT_ERROR, expected, 0.9,
                    "Exponent error. When multiplying powers with the same base, ADD the exponents.",
                    base + "^" + num(a) + " × " + base + "^" + num(b) + " = " + base + "^(" + num(a) + "+" + num(b)
                            + ") = " + expected + ", not " + power(step, left.base(), a * b) + "."));
        }
        return Optional.of(step.mistake(MistakeType.EXPONENT_ERROR, expected, 0.75,
                "Exponent error. Powers with the same base multiply by adding their exponents: x^a · x^b = x^(a+b).",
                "Add the exponents " + num(a) + " and " + num(b) + ": " + expected + "."));
    }

    private Optional<MistakeRecord> checkPowerOfPower(StepContext step, PowerParts inner, double outer, PowerParts result) {
        double a = inner.exponent();
        double r = result.exponent();
        if (r == a * outer) {
            return Optional.empty();
        }
        String base = baseText(step, inner.base());
        String expected = power(step, inner.base(), a * outer);
        if (r == a + outer) {
            return Optional.of(step.mistake(MistakeType.EXPONENT_ERROR, expected, 0.9,
                    "Exponent error. When raising a power to a power, MULTIPLY the exponents.",
                    "(" + base + "^" + num(a) + ")^" + num(outer) + " = " + base + "^(" + num(a) + "·" + num(outer)
                            + ") = " + expected + ", not " + power(step, inner.base(), a + outer) + "."));
        }
        return Optional.of(step.mistake(MistakeType.EXPONENT_ERROR, expected, 0.75,
                "Exponent error. A power of a power multiplies the exponents: (x^a)^b = x^(a·b).",
                "Multiply the exponents " + num(a) + " and " + num(outer) + ": " + expected + "."));
    }

    private Optional<MistakeRecord> checkQuotient(StepContext step, PowerParts left, PowerParts right, PowerParts result) {
        double a = left.exponent();
        double b = right.exponent();
        double r = result.exponent();
        if (r == a - b) {
            return Optional.empty();
        }
        String expected = power(step, left.base(), a - b);
        if (b != 0 && r == a / b) {
            return Optional.of(step.mistake(MistakeType.EXPONENT_ERROR, expected, 0.85,
                    "Exponent error. When dividing powers with the same base, SUBTRACT the exponents.",
                    "x^a / x^b = x^(a-b). Here: " + num(a) + " - " + num(b) + " = " + num(a - b) + ", so " + expected + "."));
        }
        return Optional.of(step.mistake(MistakeType.EXPONENT_ERROR, expected, 0.7,
                "Exponent error. Powers with the same base divide by subtracting their exponents: x^a / x^b = x^(a-b).",
                "Subtract the exponents: " + expected + "."));
    }

    private static PowerParts parts(Expr expr) {
        if (expr instanceof Expr.Binary b && b.op() == Operator.POWER && b.right() instanceof Expr.Num n) {
            return new PowerParts(b.left(), n.value(), true);
        }
        if (expr instanceof Expr.Unary u && u.op() == Operator.SQUARE) {
            return new PowerParts(u.operand(), 2, true);
        }
        if (expr instanceof Expr.Unary u && u.op() == Operator.CUBE) {
            return new PowerParts(u.operand(), 3, true);
        }
        return new PowerParts(expr, 1, false);
    }

    private static String power(StepContext step, Expr base, double exponent) {
        return step.format(step.simplify(Expr.power(base, Expr.num(exponent))));
    }

    private static String baseText(StepContext step, Expr base) {
        String text = step.format(base);
        return base instanceof Expr.Var || base instanceof Expr.Num ? text : "(" + text + ")";
    }

    private static String num(double value) {
        return ExpressionFormatter.formatNumber(value);
    }
}
