package org.localcompute.algebra.derivation.mistakes.checks;

import org.localcompute.algebra.derivation.mistakes.IMistakeCheck;
import org.localcompute.algebra.derivation.mistakes.MistakeRecord;
import org.localcompute.algebra.derivation.mistakes.MistakeType;
import org.localcompute.algebra.derivation.mistakes.StepContext;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Terms;
import org.localcompute.algebra.simplify.Terms.SignedTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects incomplete or wrong expansions: {@code a(b + c)} with the factor applied to only some terms,
 * and binomial products {@code (a + b)(c + d)} or {@code (a + b)^2} missing or miscomputing cross terms.
 */
public class DistributionErrorCheck implements IMistakeCheck {

    private final ExpressionFormatter formatter = new ExpressionFormatter();

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        if (!step.bothSidesParsed() || !Terms.isSum(step.rhsTree())) {
            return Optional.empty();
        }
        Optional<List<List<SignedTerm>>> binomials = binomialFactors(step.lhsTree());
        if (binomials.isPresent()) {
            return checkFoil(step, binomials.get().get(0), binomials.get().get(1));
        }
        if (step.lhsTree() instanceof Expr.Binary b && b.op() == Operator.MULTIPLY) {
            if (Terms.isSum(b.right()) && !Terms.isSum(b.left())) {
                return checkSingleFactor(step, b.left(), Terms.flatten(b.right()));
            }
            if (Terms.isSum(b.left()) && !Terms.isSum(b.right())) {
                return checkSingleFactor(step, b.right(), Terms.flatten(b.left()));
            }
        }
        return Optional.empty();
    }

    private Optional<MistakeRecord> checkSingleFactor(StepContext step, Expr factor, List<SignedTerm> group) {
        List<SignedTerm> distributed = new ArrayList<>();
        for (SignedTerm term : group) {
            distributed.add(new SignedTerm(step.simplify(Expr.multiply(factor, term.term())), term.positive()));
        }
        String expected = MonomialText.sum(distributed, formatter);
        List<SignedTerm> found = Terms.flatten(step.rhsTree());
        String factorText = step.format(factor);

        if (found.size() == group.size()) {
            for (int i = 0; i < group.size(); i++) {
                if (found.get(i).term().equals(group.get(i).term())) {
                    return Optional.of(step.mistake(MistakeType.DISTRIBUTION_ERROR, expected, 0.85,
                            "Incomplete distribution. When distributing, multiply ALL terms inside the parentheses.",
                            "Remember: a(b + c) = ab + ac, not ab + c. Distribute '" + factorText + "' to every term."));
                }
            }
        }
        return Optional.of(step.mistake(MistakeType.DISTRIBUTION_ERROR, expected, 0.7,
                "Distribution error. Each term inside the parentheses must be multiplied by '" + factorText + "'.",
                "Multiply '" + factorText + "' by each term separately, then simplify: " + expected + "."));
    }

    private Optional<MistakeRecord> checkFoil(StepContext step, List<SignedTerm> first, List<SignedTerm> second) {
        SignedTerm firsts = product(step, first.get(0), second.get(0));
        SignedTerm outers = product(step, first.get(0), second.get(1));
        SignedTerm inners = product(step, first.get(1), second.get(0));
        SignedTerm lasts = product(step, first.get(1), second.get(1));

        List<SignedTerm> expansion = Terms.combineLikeTerms(List.of(firsts, outers, inners, lasts));
        String expected = MonomialText.sum(expansion, formatter);

        if (step.equivalent(step.rhsTree(), Terms.sum(List.of(firsts, lasts)))) {
            return Optional.of(step.mistake(MistakeType.DISTRIBUTION_ERROR, expected, 0.9,
                    "Distribution error. The cross terms of the product are missing: (a + b)(c + d) = ac + ad + bc + bd.",
                    "Use FOIL: First, Outer, Inner, Last. Remember (a + b)^2 = a^2 + 2ab + b^2, not a^2 + b^2."));
        }
        return Optional.of(step.mistake(MistakeType.DISTRIBUTION_ERROR, expected, 0.75,
                "Distribution error. Multiplying two binomials gives four products (FOIL) before combining like terms.",
                "Multiply each term of the first factor by each term of the second, then combine like terms: "
                        + expected + "."));
    }

    private static SignedTerm product(StepContext step, SignedTerm a, SignedTerm b) {
        Expr left = a.term();
        Expr right = b.term();
        Expr term;
        if (left.equals(right)) {
            term = Expr.power(left, Expr.num(2));
        } else if (right instanceof Expr.Num && !(left instanceof Expr.Num)) {
            term = Expr.multiply(right, left);
        } else if (!(left instanceof Expr.Num) && step.format(left).compareTo(step.format(right)) > 0) {
            // b*a and a*b must meet as like terms
            term = Expr.multiply(right, left);
        } else {
            term = Expr.multiply(left, right);
        }
        return new SignedTerm(step.simplify(term), a.positive() == b.positive());
    }

    private static Optional<List<List<SignedTerm>>> binomialFactors(Expr lhs) {
        if (lhs instanceof Expr.Binary b && b.op() == Operator.MULTIPLY && isBinomial(b.left()) && isBinomial(b.right())) {
            return Optional.of(List.of(Terms.flatten(b.left()), Terms.flatten(b.right())));
        }
        if (lhs instanceof Expr.Binary b && b.op() == Operator.POWER && isBinomial(b.left())
                && b.right() instanceof Expr.Num n && n.is(2)) {
            return Optional.of(List.of(Terms.flatten(b.left()), Terms.flatten(b.left())));
        }
        if (lhs instanceof Expr.Unary u && u.op() == Operator.SQUARE && isBinomial(u.operand())) {
            return Optional.of(List.of(Terms.flatten(u.operand()), Terms.flatten(u.operand())));
        }
        return Optional.empty();
    }

    private static boolean isBinomial(Expr expr) {
        return Terms.isSum(expr) && Terms.flatten(expr).size() == 2;
    }
}
