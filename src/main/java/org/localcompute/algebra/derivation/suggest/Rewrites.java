package org.localcompute.algebra.derivation.suggest;

import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.ConstantFolder;
import org.localcompute.algebra.simplify.Simplifier;
import org.localcompute.algebra.simplify.Terms;
import org.localcompute.algebra.simplify.Terms.SignedTerm;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Node rewriters of the transform catalogue. Each looks at one node only and returns empty
 * when its identity does not apply there.
 */
final class Rewrites {

    private static final double MAX_EXACT_INTEGER = 9.007199254740992E15;

    private Rewrites() {
    }

    static Optional<Expr> constantFold(Expr node) {
        if (node instanceof Expr.Binary b) {
            OptionalDouble left = literal(b.left());
            OptionalDouble right = literal(b.right());
            if (left.isEmpty() || right.isEmpty() || Simplifier.isZeroPowerZero(b)) {
                return Optional.empty();
            }
            double l = left.getAsDouble();
            double r = right.getAsDouble();
            // 4/6 belongs to simplify_fraction
            if (b.op() == Operator.DIVIDE && isInteger(l) && isInteger(r) && r != 0 && !isInteger(l / r)) {
                return Optional.empty();
            }
            return num(ConstantFolder.foldBinary(b.op(), l, r));
        }
        if (node instanceof Expr.Unary u && !u.op().isAdditive() && u.operand() instanceof Expr.Num n) {
            return num(ConstantFolder.foldUnary(u.op(), n.value()));
        }
        return Optional.empty();
    }

    static Optional<Expr> addZero(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.ADD) {
            if (isZero(b.right())) {
                return Optional.of(b.left());
            }
            if (isZero(b.left())) {
                return Optional.of(b.right());
            }
        }
        return Optional.empty();
    }

    static Optional<Expr> subtractZero(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.SUBTRACT && isZero(b.right())) {
            return Optional.of(b.left());
        }
        return Optional.empty();
    }

    static Optional<Expr> multiplyOne(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.MULTIPLY) {
            if (isOne(b.right())) {
                return Optional.of(b.left());
            }
            if (isOne(b.left())) {
                return Optional.of(b.right());
            }
        }
        return Optional.empty();
    }

    static Optional<Expr> divideOne(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.DIVIDE && isOne(b.right())) {
            return Optional.of(b.left());
        }
        return Optional.empty();
    }

    static Optional<Expr> multiplyZero(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.MULTIPLY && (isZero(b.left()) || isZero(b.right()))) {
            return Optional.of(Expr.num(0));
        }
        return Optional.empty();
    }

    static Optional<Expr> zeroDividend(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.DIVIDE && isZero(b.left()) && !isZero(b.right())) {
            return Optional.of(Expr.num(0));
        }
        return Optional.empty();
    }

    static Optional<Expr> powerOne(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.POWER && isOne(b.right())) {
            return Optional.of(b.left());
        }
        return Optional.empty();
    }

    static Optional<Expr> powerZero(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.POWER && isZero(b.right()) && !isZero(b.left())) {
            return Optional.of(Expr.num(1));
        }
        return Optional.empty();
    }

    static Optional<Expr> baseOne(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.POWER) {
            boolean nestedOne = b.left() instanceof Expr.Binary inner && inner.op() == Operator.POWER && isOne(inner.left());
            if (isOne(b.left()) || nestedOne) {
                return Optional.of(Expr.num(1));
            }
        }
        return Optional.empty();
    }

    static Optional<Expr> subtractSelf(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.SUBTRACT && b.left().equals(b.right())) {
            return Optional.of(Expr.num(0));
        }
        return Optional.empty();
    }

    static Optional<Expr> divideSelf(Expr node) {
        if (node instanceof Expr.Binary b && b.op() == Operator.DIVIDE && b.left().equals(b.right()) && !isZero(b.left())) {
            return Optional.of(Expr.num(1));
        }
        return Optional.empty();
    }

    static Optional<Expr> doubleNegation(Expr node) {
        if (node instanceof Expr.Unary outer && outer.isNegation()
                && outer.operand() instanceof Expr.Unary inner && inner.isNegation()) {
            return Optional.of(inner.operand());
        }
        return Optional.empty();
    }

    /**
     * Merges terms of a sum whose bases are equal. Only numeric coefficients are added, so the
     * result never contains a new sum for {@code distribute} to expand again.
     */
    static Optional<Expr> combineLikeTerms(Expr node) {
        if (!Terms.isSum(node)) {
            return Optional.empty();
        }
        List<SignedTerm> terms = Terms.flatten(node);
        List<SignedTerm> combined = Terms.combineLikeTerms(terms);
        if (combined.size() >= terms.size()) {
            return Optional.empty();
        }
        return Optional.of(Terms.sum(combined));
    }

    static Optional<Expr> distribute(Expr node) {
        if (!(node instanceof Expr.Binary b && b.op() == Operator.MULTIPLY)) {
            return Optional.empty();
        }
        boolean rightSum = Terms.isSum(b.right());
        if (!rightSum && !Terms.isSum(b.left())) {
            return Optional.empty();
        }
        List<SignedTerm> distributed = new ArrayList<>();
        for (SignedTerm term : Terms.flatten(rightSum ? b.right() : b.left())) {
            Expr product = rightSum ? Expr.multiply(b.left(), term.term()) : Expr.multiply(term.term(), b.right());
            distributed.add(new SignedTerm(product, term.positive()));
        }
        return Optional.of(Terms.sum(distributed));
    }

    static boolean hasCommonFactor(Expr node) {
        if (!Terms.isSum(node)) {
            return false;
        }
        Expr.Binary sum = (Expr.Binary) node;
        if (!(sum.left() instanceof Expr.Binary l && l.op() == Operator.MULTIPLY)
                || !(sum.right() instanceof Expr.Binary r && r.op() == Operator.MULTIPLY)) {
            return false;
        }
        Set<Expr> leftFactors = new HashSet<>(List.of(l.left(), l.right()));
        return leftFactors.contains(r.left()) || leftFactors.contains(r.right());
    }

    static Optional<Expr> simplifyFraction(Expr node) {
        if (!(node instanceof Expr.Binary b && b.op() == Operator.DIVIDE)) {
            return Optional.empty();
        }
        OptionalDouble left = literal(b.left());
        OptionalDouble right = literal(b.right());
        if (left.isEmpty() || right.isEmpty() || !isExactInteger(left.getAsDouble())
                || !isExactInteger(right.getAsDouble())) {
            return Optional.empty();
        }
        long numerator = (long) left.getAsDouble();
        long denominator = (long) right.getAsDouble();
        long g = gcd(Math.abs(numerator), Math.abs(denominator));
        if (denominator == 0 || g <= 1) {
            return Optional.empty();
        }
        numerator /= g;
        denominator /= g;
        if (denominator < 0) {
            numerator = -numerator;
            denominator = -denominator;
        }
        if (denominator == 1) {
            return Optional.of(Expr.num(numerator));
        }
        return Optional.of(Expr.divide(Expr.num(numerator), Expr.num(denominator)));
    }

    /**
     * Only integer literal exponents are merged; {@code (x^2)^(1/2)} is {@code |x|}, not {@code x}.
     */
    static Optional<Expr> powerOfPower(Expr node) {
        if (node instanceof Expr.Binary outer && outer.op() == Operator.POWER
                && outer.left() instanceof Expr.Binary inner && inner.op() == Operator.POWER
                && integerLiteral(inner.right()) && integerLiteral(outer.right())) {
            double exponent = ((Expr.Num) inner.right()).value() * ((Expr.Num) outer.right()).value();
            return Optional.of(Expr.power(inner.left(), Expr.num(exponent)));
        }
        return Optional.empty();
    }

    static Optional<Expr> multiplyPowers(Expr node) {
        if (!(node instanceof Expr.Binary b && b.op() == Operator.MULTIPLY)) {
            return Optional.empty();
        }
        boolean leftPower = b.left() instanceof Expr.Binary l && l.op() == Operator.POWER;
        boolean rightPower = b.right() instanceof Expr.Binary r && r.op() == Operator.POWER;
        if (!leftPower && !rightPower) {
            return Optional.empty();
        }
        Expr leftBase = leftPower ? ((Expr.Binary) b.left()).left() : b.left();
        Expr rightBase = rightPower ? ((Expr.Binary) b.right()).left() : b.right();
        if (!leftBase.equals(rightBase)) {
            return Optional.empty();
        }
        Expr leftExponent = leftPower ? ((Expr.Binary) b.left()).right() : Expr.num(1);
        Expr rightExponent = rightPower ? ((Expr.Binary) b.right()).right() : Expr.num(1);
        Expr exponent = leftExponent instanceof Expr.Num a && rightExponent instanceof Expr.Num c
                ? Expr.num(a.value() + c.value())
                : Expr.add(leftExponent, rightExponent);
        return Optional.of(Expr.power(leftBase, exponent));
    }

    /**
     * @return The value of a number or a negated number.
     */
    private static OptionalDouble literal(Expr expr) {
        if (expr instanceof Expr.Num n) {
            return OptionalDouble.of(n.value());
        }
        if (expr instanceof Expr.Unary u && u.isNegation() && u.operand() instanceof Expr.Num n) {
            return OptionalDouble.of(-n.value());
        }
        return OptionalDouble.empty();
    }

    private static Optional<Expr> num(OptionalDouble value) {
        return value.isPresent() ? Optional.of(Expr.num(value.getAsDouble())) : Optional.empty();
    }

    private static boolean integerLiteral(Expr expr) {
        return expr instanceof Expr.Num n && n.isInteger();
    }

    private static boolean isInteger(double value) {
        return value == Math.rint(value) && !Double.isInfinite(value);
    }

    /**
     * Integers beyond 2^53 are not exact in a double and would saturate the {@code long} cast.
     */
    private static boolean isExactInteger(double value) {
        return isInteger(value) && Math.abs(value) <= MAX_EXACT_INTEGER;
    }

    private static boolean isZero(Expr expr) {
        return expr instanceof Expr.Num n && n.value() == 0;
    }

    private static boolean isOne(Expr expr) {
        return expr instanceof Expr.Num n && n.value() == 1;
    }

    private static long gcd(long a, long b) {
        return b == 0 ? a : gcd(b, a % b);
    }
}
