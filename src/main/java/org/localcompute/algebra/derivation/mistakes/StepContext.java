package org.localcompute.algebra.derivation.mistakes;

import org.localcompute.algebra.derivation.calculus.DerivativeCalculator;
import org.localcompute.algebra.derivation.calculus.DerivativeProblem;
import org.localcompute.algebra.derivation.calculus.DerivativeStatement;
import org.localcompute.algebra.equivalence.EquivalenceChecker;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Simplifier;

import java.util.Optional;

/**
 * Everything a mistake check may look at for one step, plus the services it needs.
 * Derived views such as the derivative problem are computed on first use.
 */
public final class StepContext {

    private final int stepNumber;
    private final String lhs;
    private final String rhs;
    private final String displayLhs;
    private final Expr lhsTree;
    private final Expr rhsTree;
    private final EquivalenceChecker equivalence;
    private final Simplifier simplifier;
    private final ExpressionFormatter formatter;
    private final DerivativeCalculator calculator;
    private Optional<DerivativeProblem> derivativeProblem;

    StepContext(int stepNumber, String lhs, String rhs, String displayLhs, Expr lhsTree, Expr rhsTree,
                EquivalenceChecker equivalence, Simplifier simplifier, ExpressionFormatter formatter,
                DerivativeCalculator calculator) {
        this.stepNumber = stepNumber;
        this.lhs = lhs;
        this.rhs = rhs;
        this.displayLhs = displayLhs;
        this.lhsTree = lhsTree;
        this.rhsTree = rhsTree;
        this.equivalence = equivalence;
        this.simplifier = simplifier;
        this.formatter = formatter;
        this.calculator = calculator;
    }

    public int stepNumber() {
        return stepNumber;
    }

    /** @return The left-hand side as written. */
    public String lhs() {
        return lhs;
    }

    /** @return The right-hand side as written. */
    public String rhs() {
        return rhs;
    }

    /** @return The left-hand side re-rendered from its tokens with canonical spacing. */
    public String displayLhs() {
        return displayLhs;
    }

    /** @return The parsed left-hand side, or {@code null} if it does not parse. */
    public Expr lhsTree() {
        return lhsTree;
    }

    /** @return The parsed right-hand side, or {@code null} if it does not parse. */
    public Expr rhsTree() {
        return rhsTree;
    }

    public boolean bothSidesParsed() {
        return lhsTree != null && rhsTree != null;
    }

    public boolean isDerivative() {
        return DerivativeStatement.isDerivative(lhs);
    }

    /**
     * @return The derivative step read into trees, or empty for ordinary steps.
     */
    public Optional<DerivativeProblem> derivativeProblem() {
        if (derivativeProblem == null) {
            derivativeProblem = calculator.read(lhs, rhs);
        }
        return derivativeProblem;
    }

    public DerivativeCalculator calculator() {
        return calculator;
    }

    /**
     * @param a A tree.
     * @param b Another tree.
     * @return Whether the trees are equivalent.
     */
    public boolean equivalent(Expr a, Expr b) {
        return equivalence.check(a, b).equivalent();
    }

    public Expr simplify(Expr expr) {
        return simplifier.simplify(expr);
    }

    public String format(Expr expr) {
        return formatter.format(expr);
    }

    /**
     * Builds a mistake record for this step; {@code found} is the right-hand side as written and
     * {@code suggestedFix} joins the normalized left-hand side with the expected value.
     *
     * @param type The mistake type.
     * @param expected The expected right-hand side.
     * @param confidence The confidence.
     * @param explanation The explanation.
     * @param suggestion The suggestion.
     * @return The record.
     */
    public MistakeRecord mistake(MistakeType type, String expected, double confidence,
                                 String explanation, String suggestion) {
        return new MistakeRecord(type, stepNumber, expected, rhs.trim(), confidence, explanation, suggestion,
                displayLhs + " = " + expected);
    }
}
