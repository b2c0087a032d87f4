package org.localcompute.algebra.frontend.lexer;

import org.localcompute.algebra.diagnostics.Diagnostic;

import java.util.List;

/**
 * The output of the {@link Lexer}: every recognized token plus all diagnostics.
 * Tokens are kept even when errors were reported, so callers can inspect partial input.
 *
 * @param tokens The tokens in source order, without an end-of-input marker.
 * @param errors The collected tokenizer diagnostics.
 */
public record TokenizeResult(List<Token> tokens, List<Diagnostic> errors) {

    public TokenizeResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    /**
     * @return Whether tokenization completed without errors.
     */
    public boolean success() {
        return errors.isEmpty();
    }
}
