package org.localcompute.algebra.derivation;

import org.localcompute.algebra.equivalence.EquivalenceReport;
import org.localcompute.algebra.frontend.parser.ast.Expr;

/**
 * The verification detail of one derivation step.
 *
 * @param step The 1-based step index.
 * @param lhs The left-hand side text.
 * @param rhs The right-hand side text.
 * @param valid Whether the step holds and continues from its predecessor.
 * @param lhsTree The parsed left-hand side, or {@code null} if it did not parse.
 * @param rhsTree The parsed right-hand side, or {@code null} if it did not parse.
 * @param equivalence The equivalence check of the two sides.
 * @param error The failure description, or {@code null} for a valid step.
 */
public record StepVerification(
        int step,
        String lhs,
        String rhs,
        boolean valid,
        Expr lhsTree,
        Expr rhsTree,
        EquivalenceReport equivalence,
        String error
) {
}
