package org.localcompute.algebra.derivation;

import org.localcompute.algebra.api.AlgebraErrorCode;

import java.util.List;
import java.util.Optional;

/**
 * Turns a failed {@link DerivationResult} into a {@link DerivationErrorExplanation}.
 */
public class DerivationExplainer {

    /**
     * @param result A verification result.
     * @return The explanation, or empty for a valid derivation.
     */
    public Optional<DerivationErrorExplanation> explain(DerivationResult result) {
        if (result.valid()) {
            return Optional.empty();
        }
        Optional<StepVerification> failing = result.steps().stream().filter(s -> !s.valid()).findFirst();
        if (failing.isEmpty()) {
            String message = result.errorMessage() != null ? result.errorMessage() : "Derivation verification failed";
            return Optional.of(new DerivationErrorExplanation(
                    message,
                    message,
                    0,
                    null,
                    null,
                    List.of(
                            "Check that the derivation contains valid mathematical expressions",
                            "Ensure each line follows the format 'expression = expression'",
                            "Verify that equals signs (=) are used correctly")));
        }

        StepVerification step = failing.get();
        int n = step.step();
        if (result.errorCode() == AlgebraErrorCode.DISCONTINUITY) {
            return Optional.of(new DerivationErrorExplanation(
                    "Derivation breaks at step " + n,
                    "Step " + n + " doesn't follow from the previous step. The left side of step " + n
                            + " ('" + step.lhs() + "') should equal the right side of step " + (n - 1)
                            + ". Each step must connect to the previous step to form a valid chain.",
                    n,
                    "Continue from previous result",
                    step.lhs(),
                    List.of(
                            "Ensure step " + n + " starts with the result from step " + (n - 1),
                            "Check for typos or missing intermediate steps",
                            "If changing variables, show the substitution explicitly")));
        }

        return Optional.of(new DerivationErrorExplanation(
                "Invalid algebraic transformation at step " + n,
                "The expression '" + step.lhs() + "' is not algebraically equivalent to '" + step.rhs()
                        + "'. The two expressions evaluate to different values.",
                n,
                step.lhs(),
                step.rhs(),
                List.of(
                        "Verify the algebraic manipulation from '" + step.lhs() + "' to '" + step.rhs() + "'",
                        "Check for sign errors or incorrect coefficient handling",
                        "Consider adding intermediate steps to make the transformation clearer",
                        "If this is a substitution, ensure the substituted value is correct")));
    }
}
