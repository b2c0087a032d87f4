package org.localcompute.algebra.diagnostics;

import org.localcompute.algebra.api.AlgebraErrorCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings)
 * that occur while an expression is being read.
 * <p>
 * This decouples error reporting from the tokenizer and parser logic.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param code     The error code.
     * @param message  The error message.
     * @param position The source offset of the error.
     */
    public void reportError(AlgebraErrorCode code, String message, int position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, code, message, position));
    }

    /**
     * Reports a warning.
     *
     * @param code     The warning code.
     * @param message  The warning message.
     * @param position The source offset of the warning.
     */
    public void reportWarning(AlgebraErrorCode code, String message, int position) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, code, message, position));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the first reported error, if any.
     *
     * @return The first error diagnostic.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).findFirst();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
