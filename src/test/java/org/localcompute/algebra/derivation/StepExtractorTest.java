package org.localcompute.algebra.derivation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link StepExtractor}.
 */
public class StepExtractorTest {

    @Test
    @Tag("unit")
    void testChainYieldsOneStepPerPair() {
        // Act
        List<DerivationStep> steps = StepExtractor.extract("x + x = 2x = 2*x");

        // Assert
        assertThat(steps).containsExactly(DerivationStep.of("x + x", "2x"), DerivationStep.of("2x", "2*x"));
    }

    @Test
    @Tag("unit")
    void testSegmentSeparators() {
        // Act
        List<DerivationStep> steps = StepExtractor.extract("a = b\nb = c; c = d, d = e then e = f so f = g");

        // Assert
        assertThat(steps).extracting(DerivationStep::lhs).containsExactly("a", "b", "c", "d", "e", "f");
    }

    /**
     * Verifies that lead-in phrases and sentence punctuation are not mistaken for expression text.
     */
    @Test
    @Tag("unit")
    void testLeadInAndPunctuationAreRemoved() {
        // Act
        List<DerivationStep> steps = StepExtractor.extract("Prove: a(b+c) = ab + ac.");

        // Assert
        assertThat(steps).containsExactly(DerivationStep.of("a(b+c)", "ab + ac"));
        assertThat(StepExtractor.clean("  show that x^2!")).isEqualTo("x^2");
    }

    @Test
    @Tag("unit")
    void testTextWithoutEqualityHasNoSteps() {
        assertThat(StepExtractor.extract("nothing to see here")).isEmpty();
        assertThat(StepExtractor.extract("= 5")).isEmpty();
        assertThat(StepExtractor.extract(null)).isEmpty();
    }
}
