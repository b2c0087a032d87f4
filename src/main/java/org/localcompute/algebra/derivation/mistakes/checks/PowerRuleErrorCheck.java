package org.localcompute.algebra.derivation.mistakes.checks;

import org.localcompute.algebra.derivation.calculus.DerivativeProblem;
import org.localcompute.algebra.derivation.mistakes.IMistakeCheck;
import org.localcompute.algebra.derivation.mistakes.MistakeRecord;
import org.localcompute.algebra.derivation.mistakes.MistakeType;
import org.localcompute.algebra.derivation.mistakes.StepContext;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Terms;
import org.localcompute.algebra.simplify.Terms.Monomial;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Detects wrong derivatives of {@code a·x^n}: the exponent left unreduced, the coefficient
 * {@code n} forgotten, or both wrong.
 */
public class PowerRuleErrorCheck implements IMistakeCheck {

    private final ExpressionFormatter formatter = new ExpressionFormatter();

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        Optional<DerivativeProblem> problem = step.derivativeProblem();
        if (problem.isEmpty() || !problem.get().hasExpected()) {
            return Optional.empty();
        }
        DerivativeProblem p = problem.get();
        Monomial body = Terms.monomial(p.body());
        OptionalDouble n = exponentOf(body.base(), p.variable());
        if (n.isEmpty() || n.getAsDouble() == 0 || n.getAsDouble() == 1
                || step.equivalent(p.claimed(), p.expected())) {
            return Optional.empty();
        }
        double a = body.coefficient();
        double exponent = n.getAsDouble();
        Expr x = Expr.var(p.variable());
        String expected = MonomialText.of(a * exponent, reducedPower(x, exponent - 1), formatter);
        String original = MonomialText.of(a, Expr.power(x, Expr.num(exponent)), formatter);

        Monomial claimed = Terms.monomial(p.claimed());
        OptionalDouble k = exponentOf(claimed.base(), p.variable());
        double c = claimed.coefficient();
        String claimedText = step.rhs().trim();
        if (k.isPresent() && c == a * exponent && k.getAsDouble() == exponent) {
            return Optional.of(step.mistake(MistakeType.POWER_RULE_ERROR, expected, 0.95,
                    "Power rule error. When differentiating x^n, the exponent decreases by 1.",
                    "d/d" + p.variable() + " of " + original + " = " + num(a * exponent) + "·" + p.variable()
                            + "^(" + num(exponent) + "-1) = " + expected + ", not " + claimedText + "."));
        }
        if (k.isPresent() && c == a && k.getAsDouble() == exponent - 1) {
            double confidence = exponent == 2 && a == 1 ? 0.8 : 0.85;
            return Optional.of(step.mistake(MistakeType.POWER_RULE_ERROR, expected, confidence,
                    "Power rule error. Don't forget to multiply by the original exponent.",
                    "d/d" + p.variable() + " of " + original + " = " + expected + ". You got the exponent right but forgot the factor "
                            + num(exponent) + "."));
        }
        return Optional.of(step.mistake(MistakeType.POWER_RULE_ERROR, expected, 0.7,
                "Power rule error. The derivative of a·x^n is a·n·x^(n-1).",
                "Multiply by the exponent, then lower the exponent by one: " + expected + "."));
    }

    /**
     * @return The exponent of {@code variable} in {@code base}, or empty if the base is no power of it.
     */
    private static OptionalDouble exponentOf(Expr base, String variable) {
        if (base == null) {
            return OptionalDouble.of(0);
        }
        if (base instanceof Expr.Var v) {
            return v.name().equals(variable) ? OptionalDouble.of(1) : OptionalDouble.empty();
        }
        if (base instanceof Expr.Binary b && b.op() == Operator.POWER
                && b.left() instanceof Expr.Var v && v.name().equals(variable) && b.right() instanceof Expr.Num e) {
            return OptionalDouble.of(e.value());
        }
        if (base instanceof Expr.Unary u && u.operand() instanceof Expr.Var v && v.name().equals(variable)) {
            if (u.op() == Operator.SQUARE) {
                return OptionalDouble.of(2);
            }
            if (u.op() == Operator.CUBE) {
                return OptionalDouble.of(3);
            }
        }
        return OptionalDouble.empty();
    }

    private static Expr reducedPower(Expr x, double exponent) {
        if (exponent == 0) {
            return null;
        }
        return exponent == 1 ? x : Expr.power(x, Expr.num(exponent));
    }

    private static String num(double value) {
        return ExpressionFormatter.formatNumber(value);
    }
}
