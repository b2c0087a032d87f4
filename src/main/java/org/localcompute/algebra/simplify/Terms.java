package org.localcompute.algebra.simplify;

import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for looking at an expression as a signed sum of terms, and at a term as
 * a numeric coefficient times a symbolic base.
 */
public final class Terms {

    private Terms() {
    }

    /**
     * A term of a sum together with its sign.
     *
     * @param term The term, never itself a sum, difference or negation.
     * @param positive Whether the term is added.
     */
    public record SignedTerm(Expr term, boolean positive) {
        public SignedTerm negated() {
            return new SignedTerm(term, !positive);
        }
    }

    /**
     * A term split into coefficient and base; {@code -3x} is {@code (-3, x)}, {@code 7} is {@code (7, null)}.
     *
     * @param coefficient The numeric coefficient.
     * @param base The symbolic remainder, or {@code null} for a pure number.
     */
    public record Monomial(double coefficient, Expr base) {
    }

    /**
     * Flattens nested additions, subtractions and negations, distributing signs inward.
     * {@code a - (b - c)} yields {@code +a, -b, +c}.
     *
     * @param expr The expression.
     * @return The signed terms in source order.
     */
    public static List<SignedTerm> flatten(Expr expr) {
        List<SignedTerm> terms = new ArrayList<>();
        flatten(expr, true, terms);
        return terms;
    }

    private static void flatten(Expr expr, boolean positive, List<SignedTerm> out) {
        if (expr instanceof Expr.Binary b && b.op().isAdditive()) {
            flatten(b.left(), positive, out);
            flatten(b.right(), b.op() == Operator.ADD == positive, out);
        } else if (expr instanceof Expr.Unary u && u.op().isAdditive()) {
            flatten(u.operand(), u.op() == Operator.ADD == positive, out);
        } else {
            out.add(new SignedTerm(expr, positive));
        }
    }

    /**
     * @param expr An expression.
     * @return Whether the top-level operator is {@code +} or {@code -}.
     */
    public static boolean isSum(Expr expr) {
        return expr instanceof Expr.Binary b && b.op().isAdditive();
    }

    /**
     * Splits a term into coefficient and base. Numeric factors of a product chain form the
     * coefficient; the remaining factors, in order, form the base.
     *
     * @param term The term.
     * @return The monomial.
     */
    public static Monomial monomial(Expr term) {
        if (term instanceof Expr.Num n) {
            return new Monomial(n.value(), null);
        }
        if (term instanceof Expr.Unary u && u.op().isAdditive()) {
            Monomial inner = monomial(u.operand());
            return u.op() == Operator.SUBTRACT ? new Monomial(-inner.coefficient(), inner.base()) : inner;
        }
        if (!(term instanceof Expr.Binary b && b.op() == Operator.MULTIPLY)) {
            return new Monomial(1, term);
        }
        double coefficient = 1;
        Expr base = null;
        for (Expr factor : factors(term)) {
            if (factor instanceof Expr.Num n) {
                coefficient *= n.value();
            } else {
                base = base == null ? factor : Expr.multiply(base, factor);
            }
        }
        return new Monomial(coefficient, base);
    }

    /**
     * Flattens a chain of multiplications into its factors, in order.
     * @param expr The expression.
     * @return The factors; a single element if {@code expr} is no product.
     */
    public static List<Expr> factors(Expr expr) {
        List<Expr> factors = new ArrayList<>();
        collectFactors(expr, factors);
        return factors;
    }

    private static void collectFactors(Expr expr, List<Expr> out) {
        if (expr instanceof Expr.Binary b && b.op() == Operator.MULTIPLY) {
            collectFactors(b.left(), out);
            collectFactors(b.right(), out);
        } else {
            out.add(expr);
        }
    }

    /**
     * @param term A signed term.
     * @return The monomial of the term with its sign folded into the coefficient.
     */
    public static Monomial monomial(SignedTerm term) {
        Monomial m = monomial(term.term());
        return term.positive() ? m : new Monomial(-m.coefficient(), m.base());
    }

    /**
     * Builds {@code coefficient * base}, dropping unit coefficients.
     * @param coefficient The coefficient.
     * @param base The base, or {@code null} for a pure number.
     * @return The term.
     */
    public static Expr term(double coefficient, Expr base) {
        if (base == null || coefficient == 0) {
            return Expr.num(base == null ? coefficient : 0);
        }
        if (coefficient == 1) {
            return base;
        }
        if (coefficient == -1) {
            return Expr.negate(base);
        }
        Expr result = Expr.num(coefficient);
        for (Expr factor : factors(base)) {
            result = Expr.multiply(result, factor);
        }
        return result;
    }

    /**
     * Joins signed terms into a left-nested sum.
     * @param terms The terms, at least one.
     * @return The sum.
     */
    public static Expr sum(List<SignedTerm> terms) {
        SignedTerm first = terms.get(0);
        Expr result = first.positive() ? first.term() : Expr.negate(first.term());
        for (int i = 1; i < terms.size(); i++) {
            SignedTerm t = terms.get(i);
            result = t.positive() ? Expr.add(result, t.term()) : Expr.subtract(result, t.term());
        }
        return result;
    }

    /**
     * Combines terms with structurally equal bases by adding their coefficients. The first
     * occurrence of a base keeps its position; terms that cancel are dropped.
     *
     * @param terms The terms.
     * @return The combined terms, never empty.
     */
    public static List<SignedTerm> combineLikeTerms(List<SignedTerm> terms) {
        List<Monomial> combined = new ArrayList<>();
        for (SignedTerm t : terms) {
            Monomial m = monomial(t);
            Optional<Integer> index = indexOfBase(combined, m.base());
            if (index.isPresent()) {
                Monomial existing = combined.get(index.get());
                combined.set(index.get(), new Monomial(existing.coefficient() + m.coefficient(), m.base()));
            } else {
                combined.add(m);
            }
        }
        List<SignedTerm> result = new ArrayList<>();
        for (Monomial m : combined) {
            if (m.coefficient() == 0) {
                continue;
            }
            result.add(new SignedTerm(term(Math.abs(m.coefficient()), m.base()), m.coefficient() > 0));
        }
        if (result.isEmpty()) {
            result.add(new SignedTerm(Expr.num(0), true));
        }
        return result;
    }

    private static Optional<Integer> indexOfBase(List<Monomial> monomials, Expr base) {
        for (int i = 0; i < monomials.size(); i++) {
            Expr other = monomials.get(i).base();
            if (other == null ? base == null : other.equals(base)) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }
}
