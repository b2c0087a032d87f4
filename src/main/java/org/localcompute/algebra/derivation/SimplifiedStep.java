package org.localcompute.algebra.derivation;

/**
 * A derivation step next to its simplified form.
 *
 * @param originalLhs The original left-hand side.
 * @param originalRhs The original right-hand side.
 * @param simplifiedLhs The simplified left-hand side.
 * @param simplifiedRhs The simplified right-hand side.
 * @param wasSimplified Whether either side changed.
 * @param suggestion A note on what simplified, or {@code null}.
 */
public record SimplifiedStep(
        String originalLhs,
        String originalRhs,
        String simplifiedLhs,
        String simplifiedRhs,
        boolean wasSimplified,
        String suggestion
) {
}
