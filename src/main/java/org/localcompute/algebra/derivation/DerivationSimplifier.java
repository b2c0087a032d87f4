package org.localcompute.algebra.derivation;

import org.localcompute.algebra.equivalence.EquivalenceChecker;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Simplifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Simplifies both sides of every derivation step and drops steps that make no progress.
 */
public class DerivationSimplifier {

    private final ExpressionReader reader;
    private final Simplifier simplifier;
    private final ExpressionFormatter formatter;
    private final EquivalenceChecker equivalence;

    public DerivationSimplifier(ExpressionReader reader, Simplifier simplifier,
                                ExpressionFormatter formatter, EquivalenceChecker equivalence) {
        this.reader = reader;
        this.simplifier = simplifier;
        this.formatter = formatter;
        this.equivalence = equivalence;
    }

    /**
     * @param steps The derivation steps.
     * @return The simplified and cleaned derivation.
     */
    public SimplifyDerivationResult simplify(List<DerivationStep> steps) {
        if (steps.isEmpty()) {
            return new SimplifyDerivationResult(List.of(), List.of(), List.of(), 0, List.of("No steps to simplify"));
        }

        List<SimplifiedStep> simplified = new ArrayList<>();
        List<String> summary = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            DerivationStep step = steps.get(i);
            Side lhs = simplifySide(step.lhs());
            Side rhs = simplifySide(step.rhs());
            String prefix = "Step " + (i + 1) + ": ";

            String suggestion = null;
            if (lhs.changed() && rhs.changed()) {
                suggestion = prefix + "Both sides simplify (" + step.lhs() + " → " + lhs.text() + ", "
                        + step.rhs() + " → " + rhs.text() + ")";
            } else if (lhs.changed()) {
                suggestion = prefix + "LHS simplifies: " + step.lhs() + " → " + lhs.text();
            } else if (rhs.changed()) {
                suggestion = prefix + "RHS simplifies: " + step.rhs() + " → " + rhs.text();
            }
            if (lhs.text().equals(rhs.text())) {
                String identity = "(" + lhs.text() + " = " + rhs.text() + ")";
                suggestion = suggestion == null
                        ? prefix + "Identity step " + identity
                        : suggestion + "; this is an identity step " + identity;
            }

            simplified.add(new SimplifiedStep(step.lhs(), step.rhs(), lhs.text(), rhs.text(),
                    lhs.changed() || rhs.changed(), suggestion));
            if (suggestion != null) {
                summary.add(suggestion);
            }
        }

        List<DerivationStep> cleaned = new ArrayList<>();
        String lastRhs = null;
        for (int i = 0; i < simplified.size(); i++) {
            SimplifiedStep step = simplified.get(i);
            if (i > 0) {
                // No progress: both sides still equal the last result.
                if (equivalence.areEquivalent(lastRhs, step.simplifiedLhs())
                        && equivalence.areEquivalent(lastRhs, step.simplifiedRhs())) {
                    summary.add("Step " + (i + 1) + ": Removed as redundant (no progress from " + lastRhs + ")");
                    continue;
                }
            }
            cleaned.add(new DerivationStep(step.simplifiedLhs(), step.simplifiedRhs()));
            lastRhs = step.simplifiedRhs();
        }

        int removed = steps.size() - cleaned.size();
        if (removed > 0) {
            summary.add("Removed " + removed + " redundant step" + (removed > 1 ? "s" : ""));
        }
        if (summary.isEmpty()) {
            summary.add("Derivation is already in simplified form");
        }
        return new SimplifyDerivationResult(steps, simplified, cleaned, removed, summary);
    }

    private Side simplifySide(String text) {
        ParseResult parsed = reader.read(text);
        if (!parsed.success()) {
            return new Side(text.trim(), false);
        }
        Expr tree = parsed.expression();
        Expr result = simplifier.simplify(tree);
        return new Side(formatter.format(result), !result.equals(tree));
    }

    private record Side(String text, boolean changed) {
    }
}
