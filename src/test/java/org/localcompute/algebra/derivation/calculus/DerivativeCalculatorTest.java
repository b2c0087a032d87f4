package org.localcompute.algebra.derivation.calculus;

import org.localcompute.algebra.config.EngineConfig;
import org.localcompute.algebra.equivalence.EquivalenceChecker;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.junit.extensions.logging.LogWatchExtension;
import org.localcompute.algebra.simplify.Simplifier;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link DerivativeCalculator} and the textual derivative
 * requests it reads.
 */
@ExtendWith(LogWatchExtension.class)
public class DerivativeCalculatorTest {

    private final ExpressionReader reader = new ExpressionReader();
    private final ExpressionFormatter formatter = new ExpressionFormatter();
    private final DerivativeCalculator calculator = new DerivativeCalculator(reader, new Simplifier(), formatter);
    private final EquivalenceChecker equivalence = new EquivalenceChecker(EngineConfig.defaults());

    /**
     * Verifies that the computed derivative is equivalent to a correct claimed derivative,
     * including through function applications.
     */
    @ParameterizedTest(name = "{0} = {1}")
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
        "d/dx x^3            | 3x^2",
        "d/dx 5x^2 + 3x - 7  | 10x + 3",
        "derivative of x*x   | 2x",
        "d/dx sin(x^2)       | 2x*cos(x^2)",
        "d/dx cos(x)         | -sin(x)",
        "d/dx e^(2x)         | 2e^(2x)",
        "d/dx ln(x)          | 1/x",
        "d/dx 1/x            | -1/x^2",
        "d/dx √x             | 1/(2√x)",
        "d/dt t²             | 2t",
        "differentiate x*sin(x) | sin(x) + x*cos(x)"
    })
    void testDerivativeMatchesCorrectAnswer(String lhs, String rhs) {
        // Act
        DerivativeProblem problem = calculator.read(lhs, rhs).orElseThrow();

        // Assert
        assertThat(problem.hasExpected()).isTrue();
        assertThat(equivalence.check(problem.expected(), problem.claimed()).equivalent()).isTrue();
    }

    @Test
    @Tag("unit")
    void testWrongDerivativeIsNotEquivalent() {
        // Act
        DerivativeProblem problem = calculator.read("d/dx x^3", "3x^3").orElseThrow();

        // Assert
        assertThat(equivalence.check(problem.expected(), problem.claimed()).equivalent()).isFalse();
    }

    @Test
    @Tag("unit")
    void testRenderRestoresFunctionNames() {
        // Act
        DerivativeProblem problem = calculator.read("d/dx sin(x)", "cos(x)").orElseThrow();

        // Assert
        assertThat(problem.atoms().render(problem.expected())).isEqualTo("cos(x)");
        assertThat(problem.atoms().render(problem.body())).isEqualTo("sin(x)");
    }

    /**
     * Verifies that a variable in both base and exponent has no supported derivative, while the
     * request itself is still read.
     */
    @Test
    @Tag("unit")
    void testUnsupportedDerivative() {
        // Act
        DerivativeProblem problem = calculator.read("d/dx x^x", "x^x").orElseThrow();

        // Assert
        assertThat(problem.hasExpected()).isFalse();
    }

    @Test
    @Tag("unit")
    void testStatementParsing() {
        assertThat(DerivativeStatement.parse("d/dt t^2")).contains(new DerivativeStatement("t", "t^2"));
        assertThat(DerivativeStatement.parse("Derivative of x^2 + 1")).contains(new DerivativeStatement("x", "x^2 + 1"));
        assertThat(DerivativeStatement.isDerivative("x + 1")).isFalse();
        assertThat(calculator.read("x^2", "2x")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testDependsOnLooksThroughFunctions() {
        // Arrange
        FunctionAtoms atoms = new FunctionAtoms(reader, formatter);
        String atomized = atoms.atomize("sin(x) + y").orElseThrow();

        // Act & Assert
        assertThat(calculator.dependsOn(reader.read(atomized).expression(), "x", atoms)).isTrue();
        assertThat(calculator.dependsOn(reader.read("y^2").expression(), "x", atoms)).isFalse();
    }
}
