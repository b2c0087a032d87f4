package org.localcompute.algebra.derivation.mistakes.checks;

import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Terms;
import org.localcompute.algebra.simplify.Terms.Monomial;
import org.localcompute.algebra.simplify.Terms.SignedTerm;

import java.util.List;

/**
 * Renders {@code coefficient * base} the way people write it: {@code 5x}, {@code -x}, {@code 3x^2}.
 * Sums are written term by term, so {@code 2 * x + 6} reads {@code 2x + 6}.
 */
final class MonomialText {

    private MonomialText() {
    }

    static String of(double coefficient, Expr base, ExpressionFormatter formatter) {
        if (base == null || coefficient == 0) {
            return ExpressionFormatter.formatNumber(base == null ? coefficient : 0);
        }
        if (!juxtaposable(base)) {
            return formatter.format(Terms.term(coefficient, base));
        }
        String prefix;
        if (coefficient == 1) {
            prefix = "";
        } else if (coefficient == -1) {
            prefix = "-";
        } else {
            prefix = ExpressionFormatter.formatNumber(coefficient);
        }
        return prefix + formatter.format(base);
    }

    static String sum(Expr expr, ExpressionFormatter formatter) {
        return sum(Terms.flatten(expr), formatter);
    }

    static String sum(List<SignedTerm> terms, ExpressionFormatter formatter) {
        StringBuilder out = new StringBuilder();
        for (SignedTerm term : terms) {
            Monomial m = Terms.monomial(term);
            if (out.length() == 0) {
                out.append(of(m.coefficient(), m.base(), formatter));
            } else if (m.coefficient() < 0) {
                out.append(" - ").append(of(-m.coefficient(), m.base(), formatter));
            } else {
                out.append(" + ").append(of(m.coefficient(), m.base(), formatter));
            }
        }
        return out.toString();
    }

    private static boolean juxtaposable(Expr base) {
        if (base instanceof Expr.Var) {
            return true;
        }
        if (base instanceof Expr.Binary b && b.op() == Operator.POWER) {
            return b.left() instanceof Expr.Var;
        }
        return base instanceof Expr.Unary u && u.op().isPostfix() && u.operand() instanceof Expr.Var;
    }
}
