package org.localcompute.algebra.eval;

import org.localcompute.algebra.diagnostics.Diagnostic;

/**
 * The outcome of evaluating an expression: a finite value or the error that prevented one.
 *
 * @param value The value, or {@code null} on failure.
 * @param error The error, or {@code null} on success.
 */
public record EvalResult(Double value, Diagnostic error) {

    public static EvalResult success(double value) {
        return new EvalResult(value, null);
    }

    public static EvalResult failure(Diagnostic error) {
        return new EvalResult(null, error);
    }

    public boolean success() {
        return error == null;
    }
}
