package org.localcompute.algebra.simplify;

import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.frontend.parser.ast.ExprWalker;

import java.util.OptionalDouble;

/**
 * Applies algebraic identities and constant folding bottom-up until the tree stops changing.
 * <p>
 * Every rule shrinks the tree, so the iteration always reaches a fixed point, and the result
 * is idempotent. {@code 0^0} is never rewritten; see {@link #hasIndeterminateForm(Expr)}.
 */
public class Simplifier {

    private static final Expr.Num ZERO = Expr.num(0);
    private static final Expr.Num ONE = Expr.num(1);

    private final ExprWalker walker = new ExprWalker();

    /**
     * Simplifies a tree to its fixed point.
     * @param expr The tree.
     * @return The simplified tree.
     */
    public Expr simplify(Expr expr) {
        Expr current = expr;
        while (true) {
            Expr next = walker.transformBottomUp(current, Simplifier::rewrite);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    /**
     * Checks for a literal {@code 0^0} anywhere in the tree.
     * @param expr The tree.
     * @return Whether the tree contains an indeterminate power.
     */
    public boolean hasIndeterminateForm(Expr expr) {
        return walker.anyMatch(expr, Simplifier::isZeroPowerZero);
    }

    /**
     * @param node A node.
     * @return Whether the node is literally {@code 0^0}.
     */
    public static boolean isZeroPowerZero(Expr node) {
        return node instanceof Expr.Binary b && b.op() == Operator.POWER && isZero(b.left()) && isZero(b.right());
    }

    private static Expr rewrite(Expr node) {
        if (node instanceof Expr.Unary u) {
            return rewriteUnary(u);
        }
        if (node instanceof Expr.Binary b) {
            return rewriteBinary(b);
        }
        return node;
    }

    private static Expr rewriteUnary(Expr.Unary u) {
        Expr operand = u.operand();
        if (u.op() == Operator.ADD) {
            return operand;
        }
        if (u.op() == Operator.SUBTRACT && operand instanceof Expr.Unary inner && inner.isNegation()) {
            return inner.operand();
        }
        if (operand instanceof Expr.Num n) {
            OptionalDouble folded = ConstantFolder.foldUnary(u.op(), n.value());
            if (folded.isPresent()) {
                return Expr.num(folded.getAsDouble());
            }
        }
        return u;
    }

    private static Expr rewriteBinary(Expr.Binary b) {
        if (isZeroPowerZero(b)) {
            return b;
        }
        Expr left = b.left();
        Expr right = b.right();
        if (left instanceof Expr.Num l && right instanceof Expr.Num r) {
            OptionalDouble folded = ConstantFolder.foldBinary(b.op(), l.value(), r.value());
            if (folded.isPresent()) {
                return Expr.num(folded.getAsDouble());
            }
        }
        switch (b.op()) {
            case ADD:
                if (isZero(right)) return left;
                if (isZero(left)) return right;
                break;
            case SUBTRACT:
                if (isZero(right)) return left;
                if (left.equals(right)) return ZERO;
                break;
            case MULTIPLY:
                if (isZero(left) || isZero(right)) return ZERO;
                if (isOne(right)) return left;
                if (isOne(left)) return right;
                break;
            case DIVIDE:
                if (isZero(right)) break;
                if (isOne(right)) return left;
                if (isZero(left)) return ZERO;
                if (left.equals(right)) return ONE;
                break;
            case POWER:
                if (isZero(right)) return ONE;
                if (isOne(right)) return left;
                if (isOne(left)) return ONE;
                break;
            default:
                break;
        }
        return b;
    }

    private static boolean isZero(Expr expr) {
        return expr instanceof Expr.Num n && n.value() == 0;
    }

    private static boolean isOne(Expr expr) {
        return expr instanceof Expr.Num n && n.value() == 1;
    }
}
