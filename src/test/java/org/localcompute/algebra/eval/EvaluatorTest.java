package org.localcompute.algebra.eval;

import org.localcompute.algebra.api.AlgebraErrorCode;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Contains unit tests for the {@link Evaluator}.
 */
@ExtendWith(LogWatchExtension.class)
public class EvaluatorTest {

    private final ExpressionReader reader = new ExpressionReader();
    private final Evaluator evaluator = new Evaluator();

    private EvalResult evaluate(String text, Map<String, Double> bindings) {
        return evaluator.evaluate(reader.read(text).expression(), bindings);
    }

    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
        "2+3*4        | 14",
        "2^3^2        | 512",
        "(2+3)*4      | 20",
        "10/4         | 2.5",
        "7 % 3        | 1",
        "3²+2³        | 17",
        "√16          | 4",
        "-2^2         | 4",
        "-2²          | -4",
        "2(3+1)       | 8"
    })
    void testConstantExpressions(String text, double expected) {
        // Act
        EvalResult result = evaluate(text, Map.of());

        // Assert
        assertThat(result.success()).isTrue();
        assertThat(result.value()).isCloseTo(expected, within(1e-12));
    }

    @Test
    @Tag("unit")
    void testVariablesAreBound() {
        // Act
        EvalResult result = evaluate("2x + y^2", Map.of("x", 1.5, "y", 3.0));

        // Assert
        assertThat(result.value()).isCloseTo(12.0, within(1e-12));
    }

    /**
     * Verifies that every undefined operation is reported with its own code instead of
     * producing NaN or an infinite value.
     */
    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
        "10/0         | DIVISION_BY_ZERO",
        "5 % 0        | MODULO_BY_ZERO",
        "√-4          | NEGATIVE_ROOT",
        "x + 1        | UNBOUND_VARIABLE",
        "0^-1         | UNDEFINED_RESULT",
        "(-8)^(1/3)   | UNDEFINED_RESULT"
    })
    void testEvaluationErrors(String text, AlgebraErrorCode expected) {
        // Act
        EvalResult result = evaluate(text, Map.of());

        // Assert
        assertThat(result.success()).isFalse();
        assertThat(result.value()).isNull();
        assertThat(result.error().code()).isEqualTo(expected);
    }

    @Test
    @Tag("unit")
    void testErrorMessages() {
        assertThat(evaluate("10/0", Map.of()).error().message()).isEqualTo("Division by zero");
        assertThat(evaluate("√-4", Map.of()).error().message()).contains("negative");
        assertThat(evaluate("a*b", Map.of("a", 1.0)).error().message()).isEqualTo("Unbound variable: b");
    }
}
