package org.localcompute.algebra.derivation.suggest;

/**
 * One applied transformation of a simplification path.
 *
 * @param ordinal The 1-based position in the path.
 * @param before The expression before the step.
 * @param after The expression after the step.
 * @param transform The tag of the applied transformation.
 * @param description Its description.
 */
public record SimplificationStep(int ordinal, String before, String after, String transform, String description) {
}
