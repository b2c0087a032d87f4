package org.localcompute.algebra.derivation.calculus;

import org.localcompute.algebra.frontend.parser.ast.Expr;

/**
 * A derivative step read into trees: what is differentiated, what was claimed, and what is correct.
 * Function applications appear as placeholder variables of {@link #atoms()}.
 *
 * @param variable The variable of differentiation.
 * @param body The differentiated expression.
 * @param claimed The claimed derivative.
 * @param expected The correct derivative, or {@code null} when it is outside what the calculator supports.
 * @param atoms The placeholder table shared by the three trees.
 */
public record DerivativeProblem(String variable, Expr body, Expr claimed, Expr expected, FunctionAtoms atoms) {

    public boolean hasExpected() {
        return expected != null;
    }
}
