package org.localcompute.algebra.derivation.mistakes.checks;

import org.localcompute.algebra.derivation.mistakes.IMistakeCheck;
import org.localcompute.algebra.derivation.mistakes.MistakeRecord;
import org.localcompute.algebra.derivation.mistakes.MistakeType;
import org.localcompute.algebra.derivation.mistakes.StepContext;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.Optional;

/**
 * Detects swapped subtraction operands ({@code a - b = b - a}) and results with the opposite sign.
 */
public class SignErrorCheck implements IMistakeCheck {

    private final ExpressionFormatter formatter = new ExpressionFormatter();

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        if (!step.bothSidesParsed()) {
            return Optional.empty();
        }
        Expr lhs = step.lhsTree();
        Expr rhs = step.rhsTree();

        if (lhs instanceof Expr.Binary l && l.op() == Operator.SUBTRACT
                && rhs instanceof Expr.Binary r && r.op() == Operator.SUBTRACT
                && step.equivalent(l.left(), r.right()) && step.equivalent(l.right(), r.left())) {
            return Optional.of(step.mistake(MistakeType.SIGN_ERROR,
                    MonomialText.sum(Expr.subtract(r.right(), r.left()), formatter),
                    0.95,
                    "Operands appear to be swapped in subtraction. Note that a - b ≠ b - a.",
                    "Subtraction is not commutative. Check the order of your operands."));
        }

        if (step.equivalent(lhs, Expr.negate(rhs))) {
            return Optional.of(step.mistake(MistakeType.SIGN_ERROR,
                    MonomialText.sum(negated(rhs, step), formatter),
                    0.9,
                    "Sign error detected. The expression '" + step.rhs().trim() + "' has the opposite sign of what was expected.",
                    "Check your negative signs. Remember that -(a + b) = -a - b, not -a + b."));
        }
        return Optional.empty();
    }

    private static Expr negated(Expr expr, StepContext step) {
        if (expr instanceof Expr.Binary b && b.op() == Operator.SUBTRACT) {
            return Expr.subtract(b.right(), b.left());
        }
        if (expr instanceof Expr.Unary u && u.isNegation()) {
            return u.operand();
        }
        return step.simplify(Expr.negate(expr));
    }
}
