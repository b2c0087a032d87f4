package org.localcompute.algebra.derivation;

import org.localcompute.algebra.api.AlgebraErrorCode;
import org.localcompute.algebra.equivalence.EquivalenceChecker;
import org.localcompute.algebra.equivalence.EquivalenceReport;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Verifies a chain of equalities. Each step must be an equivalence on its own, and each step
 * after the first must start from an expression equivalent to the previous right-hand side.
 */
public class DerivationVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(DerivationVerifier.class);

    private final EquivalenceChecker equivalence;
    private final ExpressionReader reader;

    public DerivationVerifier(EquivalenceChecker equivalence, ExpressionReader reader) {
        this.equivalence = equivalence;
        this.reader = reader;
    }

    /**
     * Verifies the steps in order and stops at the first failure.
     * @param steps The derivation steps.
     * @return The result with per-step detail.
     */
    public DerivationResult verify(List<DerivationStep> steps) {
        if (steps.isEmpty()) {
            return DerivationResult.invalid(List.of(), null, AlgebraErrorCode.NO_STEPS, "No derivation steps found");
        }

        List<StepVerification> verified = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            DerivationStep step = steps.get(i);
            int stepNum = i + 1;
            Expr lhsTree = tree(step.lhs());
            Expr rhsTree = tree(step.rhs());

            EquivalenceReport report = equivalence.check(step.lhs(), step.rhs());
            if (!report.equivalent()) {
                verified.add(new StepVerification(stepNum, step.lhs(), step.rhs(), false, lhsTree, rhsTree, report,
                        "Step " + stepNum + ": \"" + step.lhs() + "\" is not equivalent to \"" + step.rhs() + "\""));
                LOG.debug("Derivation step {} is invalid: {}", stepNum, report.reason());
                return DerivationResult.invalid(verified, stepNum, AlgebraErrorCode.INVALID_STEP,
                        "Invalid step " + stepNum + ": " + step.lhs() + " ≠ " + step.rhs());
            }

            if (i > 0) {
                DerivationStep previous = steps.get(i - 1);
                if (!equivalence.areEquivalent(previous.rhs(), step.lhs())) {
                    verified.add(new StepVerification(stepNum, step.lhs(), step.rhs(), false, lhsTree, rhsTree, report,
                            "Step " + stepNum + " doesn't follow from step " + (stepNum - 1)
                                    + ": \"" + previous.rhs() + "\" → \"" + step.lhs() + "\""));
                    LOG.debug("Derivation breaks between step {} and {}", stepNum - 1, stepNum);
                    return DerivationResult.invalid(verified, stepNum, AlgebraErrorCode.DISCONTINUITY,
                            "Discontinuity at step " + stepNum + ": previous RHS \"" + previous.rhs()
                                    + "\" ≠ current LHS \"" + step.lhs() + "\"");
                }
            }

            verified.add(new StepVerification(stepNum, step.lhs(), step.rhs(), true, lhsTree, rhsTree, report, null));
        }
        return DerivationResult.valid(verified);
    }

    private Expr tree(String text) {
        ParseResult parsed = reader.read(text);
        return parsed.success() ? parsed.expression() : null;
    }
}
