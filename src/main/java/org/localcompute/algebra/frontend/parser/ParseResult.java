package org.localcompute.algebra.frontend.parser;

import org.localcompute.algebra.diagnostics.Diagnostic;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.List;

/**
 * The outcome of parsing: either an expression tree or the diagnostics explaining why none was built.
 *
 * @param expression The parsed tree, or {@code null} on failure.
 * @param errors The diagnostics, empty on success.
 */
public record ParseResult(Expr expression, List<Diagnostic> errors) {

    public ParseResult {
        errors = List.copyOf(errors);
    }

    public static ParseResult success(Expr expression) {
        return new ParseResult(expression, List.of());
    }

    public static ParseResult failure(List<Diagnostic> errors) {
        return new ParseResult(null, errors);
    }

    public boolean success() {
        return expression != null && errors.isEmpty();
    }

    /**
     * @return The first diagnostic, or {@code null} on success.
     */
    public Diagnostic error() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
