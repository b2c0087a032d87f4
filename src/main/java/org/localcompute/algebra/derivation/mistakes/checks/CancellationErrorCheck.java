package org.localcompute.algebra.derivation.mistakes.checks;

import org.localcompute.algebra.derivation.mistakes.IMistakeCheck;
import org.localcompute.algebra.derivation.mistakes.MistakeRecord;
import org.localcompute.algebra.derivation.mistakes.MistakeType;
import org.localcompute.algebra.derivation.mistakes.StepContext;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Terms;
import org.localcompute.algebra.simplify.Terms.SignedTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects terms of a sum cancelled against the denominator: {@code (a + b)/a = b}, or
 * {@code (2x + 1)/2 = x + 1} where only one term was divided.
 */
public class CancellationErrorCheck implements IMistakeCheck {

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        if (!step.bothSidesParsed()
                || !(step.lhsTree() instanceof Expr.Binary fraction && fraction.op() == Operator.DIVIDE)
                || !Terms.isSum(fraction.left())) {
            return Optional.empty();
        }
        Expr denominator = fraction.right();
        List<SignedTerm> terms = Terms.flatten(fraction.left());
        Expr rhs = step.rhsTree();
        String expected = step.format(step.simplify(Terms.sum(quotients(step, terms, denominator))));
        String denominatorText = step.format(denominator);

        for (int i = 0; i < terms.size(); i++) {
            Optional<Expr> cofactor = cofactor(terms.get(i).term(), denominator);
            if (cofactor.isEmpty()) {
                continue;
            }
            List<SignedTerm> partial = new ArrayList<>(terms);
            partial.set(i, new SignedTerm(cofactor.get(), terms.get(i).positive()));
            if (step.equivalent(rhs, Terms.sum(partial))) {
                return Optional.of(step.mistake(MistakeType.CANCELLATION_ERROR, expected, 0.85,
                        "Invalid cancellation. Only one term of the numerator was divided by '" + denominatorText
                                + "'; every term must be divided.",
                        "Split the fraction first: (a + b)/c = a/c + b/c. Here that gives " + expected + "."));
            }
        }

        boolean matchesPart = rhs.equals(denominator) || step.equivalent(rhs, denominator);
        for (SignedTerm term : terms) {
            matchesPart = matchesPart || rhs.equals(term.term()) || step.equivalent(rhs, term.term());
        }
        if (matchesPart) {
            return Optional.of(step.mistake(MistakeType.CANCELLATION_ERROR, expected, 0.8,
                    "Invalid cancellation. You cannot cancel terms that are being added or subtracted in the numerator with the denominator.",
                    "Remember: (a + b)/c ≠ b. You can only cancel common FACTORS, not terms. Try: (a + b)/c = a/c + b/c."));
        }
        return Optional.empty();
    }

    private static List<SignedTerm> quotients(StepContext step, List<SignedTerm> terms, Expr denominator) {
        List<SignedTerm> quotients = new ArrayList<>();
        for (SignedTerm term : terms) {
            Expr quotient = cofactor(term.term(), denominator)
                    .orElseGet(() -> step.simplify(Expr.divide(term.term(), denominator)));
            quotients.add(new SignedTerm(quotient, term.positive()));
        }
        return quotients;
    }

    /**
     * {@code d} gives {@code 1}, {@code d*k} and {@code k*d} give {@code k}.
     */
    private static Optional<Expr> cofactor(Expr term, Expr denominator) {
        if (term.equals(denominator)) {
            return Optional.of(Expr.num(1));
        }
        if (term instanceof Expr.Binary b && b.op() == Operator.MULTIPLY) {
            if (b.left().equals(denominator)) {
                return Optional.of(b.right());
            }
            if (b.right().equals(denominator)) {
                return Optional.of(b.left());
            }
        }
        return Optional.empty();
    }
}
