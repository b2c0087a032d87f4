package org.localcompute.algebra.derivation.mistakes;

/**
 * A detected mistake in one derivation step.
 *
 * @param type The mistake category.
 * @param stepNumber The 1-based step index.
 * @param expected What the right-hand side should have been.
 * @param found The right-hand side as written.
 * @param confidence How certain the detection is, between 0 and 1.
 * @param explanation What went wrong.
 * @param suggestion How to avoid it.
 * @param suggestedFix The corrected step: the normalized left-hand side, {@code " = "}, and the expected value.
 */
public record MistakeRecord(
        MistakeType type,
        int stepNumber,
        String expected,
        String found,
        double confidence,
        String explanation,
        String suggestion,
        String suggestedFix
) {
}
