package org.localcompute.algebra.derivation;

import org.localcompute.algebra.api.AlgebraErrorCode;
import org.localcompute.algebra.config.EngineConfig;
import org.localcompute.algebra.equivalence.EquivalenceChecker;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DerivationVerifier} together with the {@link DerivationExplainer}
 * that turns its results into explanations.
 */
@ExtendWith(LogWatchExtension.class)
public class DerivationVerifierTest {

    private DerivationVerifier verifier;
    private DerivationExplainer explainer;

    @BeforeEach
    void setUp() {
        verifier = new DerivationVerifier(new EquivalenceChecker(EngineConfig.defaults()), new ExpressionReader());
        explainer = new DerivationExplainer();
    }

    @Test
    @Tag("unit")
    void testValidDerivation() {
        // Act
        DerivationResult result = verifier.verify(List.of(
                DerivationStep.of("a*(b+c)", "a*b+a*c"),
                DerivationStep.of("a*b+a*c", "a*c+a*b")));

        // Assert
        assertThat(result.valid()).isTrue();
        assertThat(result.invalidStep()).isNull();
        assertThat(result.errorCode()).isNull();
        assertThat(result.steps()).extracting(StepVerification::valid).containsExactly(true, true);
        assertThat(result.steps().get(0).lhsTree()).isNotNull();
        assertThat(explainer.explain(result)).isEmpty();
    }

    /**
     * Verifies that a step whose sides differ stops verification and is reported as invalid.
     */
    @Test
    @Tag("unit")
    void testInvalidStep() {
        // Act
        DerivationResult result = verifier.verify(List.of(
                DerivationStep.of("x+x", "2*x"),
                DerivationStep.of("2*x", "3*x")));

        // Assert
        assertThat(result.valid()).isFalse();
        assertThat(result.invalidStep()).isEqualTo(2);
        assertThat(result.errorCode()).isEqualTo(AlgebraErrorCode.INVALID_STEP);
        assertThat(result.steps()).hasSize(2);
        assertThat(result.steps().get(1).valid()).isFalse();

        DerivationErrorExplanation explanation = explainer.explain(result).orElseThrow();
        assertThat(explanation.summary()).isEqualTo("Invalid algebraic transformation at step 2");
        assertThat(explanation.stepNumber()).isEqualTo(2);
        assertThat(explanation.expected()).isEqualTo("2*x");
        assertThat(explanation.found()).isEqualTo("3*x");
        assertThat(explanation.fixSuggestions()).hasSize(4);
    }

    @Test
    @Tag("unit")
    void testDiscontinuity() {
        // Act
        DerivationResult result = verifier.verify(List.of(
                DerivationStep.of("x+x", "2*x"),
                DerivationStep.of("y+y", "2*y")));

        // Assert
        assertThat(result.valid()).isFalse();
        assertThat(result.invalidStep()).isEqualTo(2);
        assertThat(result.errorCode()).isEqualTo(AlgebraErrorCode.DISCONTINUITY);
        assertThat(result.errorMessage()).startsWith("Discontinuity at step 2");

        DerivationErrorExplanation explanation = explainer.explain(result).orElseThrow();
        assertThat(explanation.summary()).isEqualTo("Derivation breaks at step 2");
        assertThat(explanation.found()).isEqualTo("y+y");
    }

    @Test
    @Tag("unit")
    void testNoSteps() {
        // Act
        DerivationResult result = verifier.verify(List.of());

        // Assert
        assertThat(result.valid()).isFalse();
        assertThat(result.invalidStep()).isNull();
        assertThat(result.errorCode()).isEqualTo(AlgebraErrorCode.NO_STEPS);
        DerivationErrorExplanation explanation = explainer.explain(result).orElseThrow();
        assertThat(explanation.stepNumber()).isZero();
        assertThat(explanation.summary()).isEqualTo("No derivation steps found");
    }

    @Test
    @Tag("unit")
    void testUndefinedIdentityIsInvalid() {
        // Act
        DerivationResult result = verifier.verify(List.of(DerivationStep.of("1/0", "1/0")));

        // Assert
        assertThat(result.valid()).isFalse();
        assertThat(result.errorCode()).isEqualTo(AlgebraErrorCode.INVALID_STEP);
    }

    @Test
    @Tag("unit")
    void testUnparsableSideIsInvalid() {
        // Act
        DerivationResult result = verifier.verify(List.of(DerivationStep.of("x +", "x")));

        // Assert
        assertThat(result.invalidStep()).isEqualTo(1);
        assertThat(result.steps().get(0).lhsTree()).isNull();
        assertThat(result.steps().get(0).equivalence().reason()).startsWith("Cannot parse");
    }
}
