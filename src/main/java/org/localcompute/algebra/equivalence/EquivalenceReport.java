package org.localcompute.algebra.equivalence;

/**
 * The detail of a single equivalence check.
 *
 * @param equivalent Whether the two expressions were judged equivalent.
 * @param trialsEvaluated The number of sample points where both sides evaluated.
 * @param trialsSkipped The number of sample points skipped because a side failed to evaluate.
 * @param reason A short description of how the verdict was reached.
 */
public record EquivalenceReport(boolean equivalent, int trialsEvaluated, int trialsSkipped, String reason) {

    static EquivalenceReport of(boolean equivalent, String reason) {
        return new EquivalenceReport(equivalent, 0, 0, reason);
    }
}
