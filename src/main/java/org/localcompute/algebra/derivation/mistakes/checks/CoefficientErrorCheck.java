package org.localcompute.algebra.derivation.mistakes.checks;

import org.localcompute.algebra.derivation.mistakes.IMistakeCheck;
import org.localcompute.algebra.derivation.mistakes.MistakeRecord;
import org.localcompute.algebra.derivation.mistakes.MistakeType;
import org.localcompute.algebra.derivation.mistakes.StepContext;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Terms;
import org.localcompute.algebra.simplify.Terms.Monomial;
import org.localcompute.algebra.simplify.Terms.SignedTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Detects like terms combined with the wrong coefficient, e.g. {@code 2x + 3x = 6x}.
 * <p>
 * Confidence depends on what the wrong coefficient looks like: the product of the coefficients
 * is the classic slip, a repeated original coefficient is next, and a near miss is last.
 */
public class CoefficientErrorCheck implements IMistakeCheck {

    private final ExpressionFormatter formatter = new ExpressionFormatter();

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        if (!step.bothSidesParsed()) {
            return Optional.empty();
        }
        List<SignedTerm> lhsTerms = Terms.flatten(step.lhsTree());
        List<SignedTerm> rhsTerms = Terms.flatten(step.rhsTree());
        if (lhsTerms.size() < 2 || rhsTerms.size() != 1) {
            return Optional.empty();
        }
        Monomial result = Terms.monomial(rhsTerms.get(0));
        Expr base = result.base();
        if (base == null) {
            return Optional.empty();
        }
        List<Double> coefficients = new ArrayList<>();
        for (SignedTerm term : lhsTerms) {
            Monomial m = Terms.monomial(term);
            if (!base.equals(m.base())) {
                return Optional.empty();
            }
            coefficients.add(m.coefficient());
        }

        double sum = 0;
        double product = 1;
        double largest = 0;
        for (double c : coefficients) {
            sum += c;
            product *= Math.abs(c);
            largest = Math.max(largest, Math.abs(c));
        }
        double found = result.coefficient();
        if (found == sum) {
            return Optional.empty();
        }
        String expected = MonomialText.of(sum, base, formatter);
        String foundText = MonomialText.of(found, base, formatter);

        if (found == product) {
            String factors = coefficients.stream()
                    .map(c -> ExpressionFormatter.formatNumber(Math.abs(c)))
                    .collect(Collectors.joining(" × "));
            return Optional.of(step.mistake(MistakeType.COEFFICIENT_ERROR, expected, 0.85,
                    "Coefficient error. When combining like terms, ADD the coefficients, don't multiply them.",
                    factors + " = " + ExpressionFormatter.formatNumber(product) + ", but you should ADD: "
                            + signedSum(coefficients) + " = " + ExpressionFormatter.formatNumber(sum)
                            + ". So the answer should be " + expected + "."));
        }
        if (coefficients.stream().anyMatch(c -> Math.abs(c) == Math.abs(found))) {
            return Optional.of(step.mistake(MistakeType.COEFFICIENT_ERROR, expected, 0.8,
                    "Coefficient error. The result " + foundText + " is one of the original coefficients, not the combined result.",
                    "When combining like terms: " + step.displayLhs() + " = " + expected + ", not " + foundText + "."));
        }
        if (Math.abs(found - sum) <= largest) {
            return Optional.of(step.mistake(MistakeType.COEFFICIENT_ERROR, expected, 0.75,
                    "Coefficient error when combining like terms.",
                    step.displayLhs() + " = " + expected + "."));
        }
        return Optional.empty();
    }

    private static String signedSum(List<Double> coefficients) {
        StringBuilder out = new StringBuilder(ExpressionFormatter.formatNumber(coefficients.get(0)));
        for (int i = 1; i < coefficients.size(); i++) {
            double c = coefficients.get(i);
            out.append(c >= 0 ? " + " : " - ").append(ExpressionFormatter.formatNumber(Math.abs(c)));
        }
        return out.toString();
    }
}
