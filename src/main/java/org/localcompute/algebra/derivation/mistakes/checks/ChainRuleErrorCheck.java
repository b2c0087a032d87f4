package org.localcompute.algebra.derivation.mistakes.checks;

import org.localcompute.algebra.derivation.calculus.DerivativeCalculator;
import org.localcompute.algebra.derivation.calculus.DerivativeProblem;
import org.localcompute.algebra.derivation.calculus.FunctionAtoms;
import org.localcompute.algebra.derivation.mistakes.IMistakeCheck;
import org.localcompute.algebra.derivation.mistakes.MistakeRecord;
import org.localcompute.algebra.derivation.mistakes.MistakeType;
import org.localcompute.algebra.derivation.mistakes.StepContext;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.Optional;

/**
 * Detects derivatives of composites {@code f(g(x))} that stop at {@code f'(g(x))} and
 * drop the inner derivative {@code g'(x)}.
 */
public class ChainRuleErrorCheck implements IMistakeCheck {

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        Optional<DerivativeProblem> problem = step.derivativeProblem();
        if (problem.isEmpty() || !problem.get().hasExpected()) {
            return Optional.empty();
        }
        DerivativeProblem p = problem.get();
        DerivativeCalculator calculator = step.calculator();
        FunctionAtoms atoms = p.atoms();
        Optional<Expr> inner = innerOf(p.body(), atoms);
        if (inner.isEmpty() || inner.get().equals(Expr.var(p.variable()))
                || !calculator.dependsOn(inner.get(), p.variable(), atoms)) {
            return Optional.empty();
        }
        Optional<Expr> outer = calculator.outerDerivative(p.body(), p.variable(), atoms);
        if (outer.isEmpty() || !step.equivalent(p.claimed(), outer.get())
                || step.equivalent(p.claimed(), p.expected())) {
            return Optional.empty();
        }
        String expected = atoms.render(p.expected());
        String innerText = atoms.render(inner.get());
        String innerDerivative = calculator.differentiate(inner.get(), p.variable(), atoms)
                .map(atoms::render)
                .orElse("d/d" + p.variable() + " (" + innerText + ")");
        return Optional.of(step.mistake(MistakeType.CHAIN_RULE_ERROR, expected, 0.9,
                "Chain rule error. The derivative of f(g(x)) is f'(g(x))·g'(x); the factor g'(x) is missing.",
                "Multiply by the derivative of the inner expression " + innerText + ", which is " + innerDerivative
                        + ": " + expected + "."));
    }

    /**
     * @return The inner expression of a composite: a function argument, a power base, a root operand.
     */
    private static Optional<Expr> innerOf(Expr body, FunctionAtoms atoms) {
        if (body instanceof Expr.Var v) {
            return atoms.lookup(v.name()).map(FunctionAtoms.Atom::argument);
        }
        if (body instanceof Expr.Binary b && b.op() == Operator.POWER && b.right().isConstant()) {
            return Optional.of(b.left());
        }
        if (body instanceof Expr.Unary u
                && (u.op() == Operator.SQUARE || u.op() == Operator.CUBE || u.op() == Operator.SQRT)) {
            return Optional.of(u.operand());
        }
        return Optional.empty();
    }
}
