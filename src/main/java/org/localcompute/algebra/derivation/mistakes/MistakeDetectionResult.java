package org.localcompute.algebra.derivation.mistakes;

import java.util.List;

/**
 * The mistakes found in a derivation, at most one per step.
 *
 * @param hasMistakes Whether any mistake was found.
 * @param mistakes The mistakes in step order.
 * @param firstMistakeStep The 1-based index of the first offending step, or {@code null}.
 * @param summary A one-line summary.
 */
public record MistakeDetectionResult(
        boolean hasMistakes,
        List<MistakeRecord> mistakes,
        Integer firstMistakeStep,
        String summary
) {
    public MistakeDetectionResult {
        mistakes = List.copyOf(mistakes);
    }
}
