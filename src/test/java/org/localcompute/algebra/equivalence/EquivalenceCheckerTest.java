package org.localcompute.algebra.equivalence;

import org.localcompute.algebra.config.EngineConfig;
import org.localcompute.algebra.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link EquivalenceChecker}, which decides equivalence by
 * simplification first and by sampling random points second.
 */
@ExtendWith(LogWatchExtension.class)
public class EquivalenceCheckerTest {

    private final EquivalenceChecker checker = new EquivalenceChecker(EngineConfig.defaults());

    @ParameterizedTest(name = "{0} == {1}")
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
        "a*(b+c)        | a*b+a*c",
        "(x+1)^2        | x^2+2x+1",
        "x+x            | 2*x",
        "2+2            | 4",
        "x/x            | 1",
        "(a-b)(a+b)     | a²-b²",
        "√x * √x        | x"
    })
    void testEquivalentPairs(String a, String b) {
        assertThat(checker.areEquivalent(a, b)).isTrue();
    }

    @ParameterizedTest(name = "{0} != {1}")
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
        "x+1            | x",
        "2*x            | 3*x",
        "(a+b)^2        | a^2+b^2",
        "2+2            | 5",
        "x+y            | x+z"
    })
    void testDifferentPairs(String a, String b) {
        assertThat(checker.areEquivalent(a, b)).isFalse();
    }

    @Test
    @Tag("unit")
    @DisplayName("Structurally equal sides are decided without sampling")
    void structuralShortcut() {
        // Act
        EquivalenceReport report = checker.check("x*1 + 0", "x");

        // Assert
        assertThat(report.equivalent()).isTrue();
        assertThat(report.trialsEvaluated()).isZero();
        assertThat(report.reason()).contains("Structurally identical");
    }

    @Test
    @Tag("unit")
    @DisplayName("Sampling evaluates the configured number of trials")
    void samplingUsesConfiguredTrials() {
        // Arrange
        EquivalenceChecker moreTrials = new EquivalenceChecker(EngineConfig.defaults().withEquivalenceTrials(20));

        // Act
        EquivalenceReport report = moreTrials.check("(x+1)^2", "x^2+2x+1");

        // Assert
        assertThat(report.equivalent()).isTrue();
        assertThat(report.trialsEvaluated()).isEqualTo(20);
    }

    /**
     * Verifies that the check is reproducible for a fixed seed.
     */
    @Test
    @Tag("unit")
    void testDeterministicForFixedSeed() {
        // Arrange
        EquivalenceChecker other = new EquivalenceChecker(EngineConfig.defaults());

        // Act
        EquivalenceReport first = checker.check("x^2 + y", "x*x + y + 0.000001*x*y");
        EquivalenceReport second = other.check("x^2 + y", "x*x + y + 0.000001*x*y");

        // Assert
        assertThat(first).isEqualTo(second);
        assertThat(first.equivalent()).isFalse();
    }

    @Test
    @Tag("unit")
    void testUnparsableSideIsNotEquivalent() {
        // Act
        EquivalenceReport report = checker.check("x+", "x");

        // Assert
        assertThat(report.equivalent()).isFalse();
        assertThat(report.reason()).startsWith("Cannot parse 'x+'");
    }

    /**
     * Verifies that expressions without a common domain are not declared equivalent just because
     * no sample separated them.
     */
    @Test
    @Tag("unit")
    void testTooFewSamplePoints() {
        // Act
        EquivalenceReport report = checker.check("√(-x*x - 1)", "√(-x*x - 1) + 1");

        // Assert
        assertThat(report.equivalent()).isFalse();
        assertThat(report.trialsEvaluated()).isZero();
        assertThat(report.reason()).startsWith("Too few sample points");
    }

    @Test
    @Tag("unit")
    void testUndefinedConstants() {
        assertThat(checker.check("1/0", "2/0").equivalent()).isFalse();
        assertThat(checker.check("1/0", "2/0").reason()).isEqualTo("Constant expression is undefined");
    }

    /**
     * Verifies that identical text is not enough: an expression without a value is not equivalent
     * to anything, itself included.
     */
    @ParameterizedTest(name = "{0} != {1}")
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
        "0/0            | 0/0",
        "1/0            | 1/0",
        "1/(x-x)        | 1/(y-y)",
        "x/0            | x/0",
        "√(-x*x - 1)    | √(-x*x - 1)"
    })
    void testIdenticalUndefinedExpressions(String a, String b) {
        // Act
        EquivalenceReport report = checker.check(a, b);

        // Assert
        assertThat(report.equivalent()).isFalse();
        assertThat(report.reason()).doesNotContain("Structurally identical");
    }

    @Test
    @Tag("unit")
    void testIdenticalConstantsAreCompared() {
        // Act
        EquivalenceReport report = checker.check("2 + 2", "4");

        // Assert
        assertThat(report.equivalent()).isTrue();
        assertThat(report.reason()).isEqualTo("Constant values agree");
    }
}
