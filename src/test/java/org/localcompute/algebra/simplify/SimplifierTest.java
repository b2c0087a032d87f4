package org.localcompute.algebra.simplify;

import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Simplifier}.
 * These tests verify the identity rules, constant folding, the special treatment of {@code 0^0}
 * and that simplification reaches a fixed point.
 */
@ExtendWith(LogWatchExtension.class)
public class SimplifierTest {

    private final ExpressionReader reader = new ExpressionReader();
    private final ExpressionFormatter formatter = new ExpressionFormatter();
    private final Simplifier simplifier = new Simplifier();

    private Expr tree(String text) {
        return reader.read(text).expression();
    }

    private String simplify(String text) {
        return formatter.format(simplifier.simplify(tree(text)));
    }

    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
        "x+0            | x",
        "0+x            | x",
        "x-0            | x",
        "x*1            | x",
        "1*x            | x",
        "x*0            | 0",
        "x/1            | x",
        "0/x            | 0",
        "x^1            | x",
        "x^0            | 1",
        "1^x            | 1",
        "x-x            | 0",
        "x/x            | 1",
        "--x            | x",
        "+x             | x",
        "2+3*4          | 14",
        "(x+0)*1        | x",
        "(x*1)^(2-1)    | x",
        "3²             | 9"
    })
    void testIdentitiesAndFolding(String input, String expected) {
        assertThat(simplify(input)).isEqualTo(expected);
    }

    /**
     * Verifies that undefined constant subexpressions are left as written.
     */
    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {"x/0", "1/0", "0^0", "0^0 * y"})
    void testUndefinedFormsAreKept(String input) {
        assertThat(simplifier.simplify(tree(input))).isEqualTo(tree(input));
    }

    @Test
    @Tag("unit")
    void testZeroPowerZeroIsIndeterminate() {
        // Arrange
        Expr zeroPowerZero = tree("0^0");

        // Act
        Expr result = simplifier.simplify(tree("0^0 + x*0"));

        // Assert
        assertThat(Simplifier.isZeroPowerZero(zeroPowerZero)).isTrue();
        assertThat(simplifier.hasIndeterminateForm(result)).isTrue();
        assertThat(formatter.format(result)).isEqualTo("0^0");
        assertThat(simplifier.hasIndeterminateForm(tree("x^0"))).isFalse();
    }

    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {"(x+0)*1", "2*(a+b)-0", "x^0^y", "((a/a)*b)^1", "0^0*1", "√(x*1)+--y"})
    void testSimplificationIsIdempotent(String input) {
        // Act
        Expr once = simplifier.simplify(tree(input));
        Expr twice = simplifier.simplify(once);

        // Assert
        assertThat(twice).isEqualTo(once);
    }
}
