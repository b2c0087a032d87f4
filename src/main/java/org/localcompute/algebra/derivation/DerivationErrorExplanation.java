package org.localcompute.algebra.derivation;

import java.util.List;

/**
 * A human-readable account of why a derivation failed.
 *
 * @param summary A one-line summary.
 * @param explanation The explanation.
 * @param stepNumber The failing step, 0 when no step could be identified.
 * @param expected What the step should have been, or {@code null}.
 * @param found What the step was, or {@code null}.
 * @param fixSuggestions Suggestions for repairing the derivation.
 */
public record DerivationErrorExplanation(
        String summary,
        String explanation,
        int stepNumber,
        String expected,
        String found,
        List<String> fixSuggestions
) {
    public DerivationErrorExplanation {
        fixSuggestions = List.copyOf(fixSuggestions);
    }
}
