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
 * Detects a subtracted group, e.g. {@code a - (b + c)} or {@code a - (b - (c + d))}, whose inner
 * terms kept the wrong sign after the parentheses were dropped.
 */
public class SubtractionDistributionErrorCheck implements IMistakeCheck {

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        if (!step.bothSidesParsed() || !hasSubtractedGroup(step.lhsTree())) {
            return Optional.empty();
        }
        List<SignedTerm> expected = Terms.flatten(step.lhsTree());
        List<SignedTerm> found = Terms.flatten(step.rhsTree());
        if (expected.size() != found.size()) {
            return Optional.empty();
        }

        boolean[] used = new boolean[found.size()];
        boolean inOrder = true;
        List<String> wrongSigns = new ArrayList<>();
        for (int i = 0; i < expected.size(); i++) {
            SignedTerm term = expected.get(i);
            int match = indexOf(found, used, term.term());
            if (match < 0) {
                return Optional.empty();
            }
            used[match] = true;
            inOrder &= match == i;
            if (found.get(match).positive() != term.positive()) {
                wrongSigns.add((term.positive() ? "+" : "-") + step.format(term.term()));
            }
        }
        if (wrongSigns.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(step.mistake(MistakeType.SUBTRACTION_DISTRIBUTION_ERROR,
                step.format(Terms.sum(expected)),
                inOrder ? 0.95 : 0.9,
                "Subtraction distribution error. When subtracting a group, distribute the negative to ALL terms inside.",
                "Sign error: expected " + String.join(", ", wrongSigns)
                        + ". Remember: -(a + b) = -a - b and -(-a) = +a."));
    }

    private static boolean hasSubtractedGroup(Expr expr) {
        if (expr instanceof Expr.Binary b && b.op().isAdditive()) {
            return (b.op() == Operator.SUBTRACT && Terms.isSum(b.right()))
                    || hasSubtractedGroup(b.left())
                    || hasSubtractedGroup(b.right());
        }
        return expr instanceof Expr.Unary u && u.isNegation()
                && (Terms.isSum(u.operand()) || hasSubtractedGroup(u.operand()));
    }

    private static int indexOf(List<SignedTerm> terms, boolean[] used, Expr term) {
        for (int i = 0; i < terms.size(); i++) {
            if (!used[i] && terms.get(i).term().equals(term)) {
                return i;
            }
        }
        return -1;
    }
}
