package org.localcompute.algebra.derivation;

import org.localcompute.algebra.config.EngineConfig;
import org.localcompute.algebra.equivalence.EquivalenceChecker;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.simplify.Simplifier;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class DerivationSimplifierTest {

    private final DerivationSimplifier simplifier = new DerivationSimplifier(new ExpressionReader(), new Simplifier(),
            new ExpressionFormatter(), new EquivalenceChecker(EngineConfig.defaults()));

    /**
     * Verifies that both sides are simplified, identity steps are noted and a step that makes
     * no progress is removed.
     */
    @Test
    @Tag("unit")
    void testSimplifiesAndRemovesRedundantSteps() {
        // Act
        SimplifyDerivationResult result = simplifier.simplify(List.of(
                DerivationStep.of("x + 0", "x*1"),
                DerivationStep.of("x", "x")));

        // Assert
        assertThat(result.simplified().get(0)).extracting(SimplifiedStep::simplifiedLhs, SimplifiedStep::simplifiedRhs,
                SimplifiedStep::wasSimplified).containsExactly("x", "x", true);
        assertThat(result.simplified().get(0).suggestion())
                .isEqualTo("Step 1: Both sides simplify (x + 0 → x, x*1 → x); this is an identity step (x = x)");
        assertThat(result.cleaned()).containsExactly(DerivationStep.of("x", "x"));
        assertThat(result.stepsRemoved()).isEqualTo(1);
        assertThat(result.summary()).contains("Removed 1 redundant step");
    }

    @Test
    @Tag("unit")
    void testOneSidedSimplification() {
        // Act
        SimplifyDerivationResult result = simplifier.simplify(List.of(DerivationStep.of("a*(b+c)", "a*b + a*c*1")));

        // Assert
        assertThat(result.simplified().get(0).suggestion()).isEqualTo("Step 1: RHS simplifies: a*b + a*c*1 → a * b + a * c");
        assertThat(result.stepsRemoved()).isZero();
    }

    @Test
    @Tag("unit")
    void testAlreadySimplified() {
        // Act
        SimplifyDerivationResult result = simplifier.simplify(List.of(DerivationStep.of("2 * x", "x + x")));

        // Assert
        assertThat(result.simplified().get(0).wasSimplified()).isFalse();
        assertThat(result.summary()).containsExactly("Derivation is already in simplified form");
    }

    @Test
    @Tag("unit")
    void testNoSteps() {
        assertThat(simplifier.simplify(List.of()).summary()).containsExactly("No steps to simplify");
    }
}
