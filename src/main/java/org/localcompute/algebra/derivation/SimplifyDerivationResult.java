package org.localcompute.algebra.derivation;

import java.util.List;

/**
 * The outcome of simplifying a derivation.
 *
 * @param original The steps as given.
 * @param simplified Every step with both sides simplified.
 * @param cleaned The simplified steps without redundant ones.
 * @param stepsRemoved The number of removed steps.
 * @param summary Notes on what changed.
 */
public record SimplifyDerivationResult(
        List<DerivationStep> original,
        List<SimplifiedStep> simplified,
        List<DerivationStep> cleaned,
        int stepsRemoved,
        List<String> summary
) {
    public SimplifyDerivationResult {
        original = List.copyOf(original);
        simplified = List.copyOf(simplified);
        cleaned = List.copyOf(cleaned);
        summary = List.copyOf(summary);
    }
}
