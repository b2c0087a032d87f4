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
 * Detects derivatives of products {@code f·g} computed as {@code f'·g'}, or with one of the
 * two product-rule terms missing.
 */
public class ProductRuleErrorCheck implements IMistakeCheck {

    @Override
    public Optional<MistakeRecord> check(StepContext step) {
        Optional<DerivativeProblem> problem = step.derivativeProblem();
        if (problem.isEmpty() || !problem.get().hasExpected()
                || !(problem.get().body() instanceof Expr.Binary product && product.op() == Operator.MULTIPLY)) {
            return Optional.empty();
        }
        DerivativeProblem p = problem.get();
        DerivativeCalculator calculator = step.calculator();
        FunctionAtoms atoms = p.atoms();
        Expr f = product.left();
        Expr g = product.right();
        if (!calculator.dependsOn(f, p.variable(), atoms) || !calculator.dependsOn(g, p.variable(), atoms)
                || step.equivalent(p.claimed(), p.expected())) {
            return Optional.empty();
        }
        Optional<Expr> df = calculator.differentiate(f, p.variable(), atoms);
        Optional<Expr> dg = calculator.differentiate(g, p.variable(), atoms);
        if (df.isEmpty() || dg.isEmpty()) {
            return Optional.empty();
        }
        String expected = atoms.render(p.expected());
        String fText = atoms.render(f);
        String gText = atoms.render(g);
        String dfText = atoms.render(df.get());
        String dgText = atoms.render(dg.get());
        String rule = "d/d" + p.variable() + " (" + fText + " · " + gText + ") = (" + dfText + ")·(" + gText + ") + ("
                + fText + ")·(" + dgText + ") = " + expected;

        if (step.equivalent(p.claimed(), Expr.multiply(df.get(), dg.get()))) {
            return Optional.of(step.mistake(MistakeType.PRODUCT_RULE_ERROR, expected, 0.9,
                    "Product rule error. You cannot differentiate each factor separately and multiply. "
                            + "Use the product rule: (fg)' = f'g + fg'.",
                    rule + ". You computed (" + dfText + ")·(" + dgText + ") instead."));
        }
        if (step.equivalent(p.claimed(), Expr.multiply(df.get(), g))
                || step.equivalent(p.claimed(), Expr.multiply(f, dg.get()))) {
            return Optional.of(step.mistake(MistakeType.PRODUCT_RULE_ERROR, expected, 0.85,
                    "Product rule error. The product rule has two terms, f'g + fg'; one of them is missing.",
                    rule + "."));
        }
        return Optional.empty();
    }
}
