package org.localcompute.algebra.api;

import org.localcompute.algebra.diagnostics.Diagnostic;

/**
 * An exception that is thrown by the throwing convenience entry points of the engine
 * when an expression cannot be read or evaluated.
 * <p>
 * It is part of the public API and carries the structured diagnostic of the failure.
 */
public class AlgebraException extends Exception {

    private final transient Diagnostic diagnostic;

    /**
     * Constructs a new exception from a diagnostic.
     * @param diagnostic The diagnostic describing the failure.
     */
    public AlgebraException(Diagnostic diagnostic) {
        super(diagnostic.toString(), null);
        this.diagnostic = diagnostic;
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public AlgebraException(String message, Throwable cause) {
        super(message, cause);
        this.diagnostic = null;
    }

    /**
     * @return The diagnostic of the failure, or {@code null} when the failure has no source diagnostic.
     */
    public Diagnostic getDiagnostic() {
        return diagnostic;
    }

    /**
     * @return The error code of the failure, or {@code null} when unknown.
     */
    public AlgebraErrorCode getErrorCode() {
        return diagnostic == null ? null : diagnostic.code();
    }
}
