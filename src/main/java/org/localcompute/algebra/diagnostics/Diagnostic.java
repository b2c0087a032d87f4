package org.localcompute.algebra.diagnostics;

import org.localcompute.algebra.api.AlgebraErrorCode;

/**
 * Represents a single diagnostic message (error or warning)
 * produced while tokenizing, parsing, evaluating or verifying an expression.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param code The machine-readable error code.
 * @param message The diagnostic message.
 * @param position The 0-based source offset, or -1 when no position applies.
 */
public record Diagnostic(
        Type type,
        AlgebraErrorCode code,
        String message,
        int position
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents the operation from producing a result. */
        ERROR,
        /** A warning that does not prevent the operation. */
        WARNING
    }

    /**
     * Creates an error diagnostic.
     *
     * @param code The error code.
     * @param message The message.
     * @param position The source offset, or -1.
     * @return The diagnostic.
     */
    public static Diagnostic error(AlgebraErrorCode code, String message, int position) {
        return new Diagnostic(Type.ERROR, code, message, position);
    }

    @Override
    public String toString() {
        if (position < 0) {
            return String.format("[%s] %s: %s", type, code, message);
        }
        return String.format("[%s] %s@%d: %s", type, code, position, message);
    }
}
