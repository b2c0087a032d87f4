package org.localcompute.algebra.derivation;

import org.localcompute.algebra.api.AlgebraErrorCode;
import org.localcompute.algebra.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of verifying a derivation. Verification stops at the first failing step,
 * so {@link #steps()} holds the detail up to and including that step.
 *
 * @param valid Whether every step holds and the chain is continuous.
 * @param steps The per-step detail.
 * @param invalidStep The 1-based index of the failing step, or {@code null}.
 * @param error The failure, or {@code null} for a valid derivation.
 */
public record DerivationResult(boolean valid, List<StepVerification> steps, Integer invalidStep, Diagnostic error) {

    public DerivationResult {
        steps = List.copyOf(steps);
    }

    static DerivationResult valid(List<StepVerification> steps) {
        return new DerivationResult(true, steps, null, null);
    }

    static DerivationResult invalid(List<StepVerification> steps, Integer invalidStep, AlgebraErrorCode code, String message) {
        return new DerivationResult(false, steps, invalidStep, Diagnostic.error(code, message, -1));
    }

    /**
     * @return The error code of the failure, or {@code null} for a valid derivation.
     */
    public AlgebraErrorCode errorCode() {
        return error == null ? null : error.code();
    }

    /**
     * @return The failure message, or {@code null} for a valid derivation.
     */
    public String errorMessage() {
        return error == null ? null : error.message();
    }
}
