package org.localcompute.algebra.derivation.suggest;

import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the node rewriters behind the structural transformations.
 */
public class RewritesTest {

    private final ExpressionReader reader = new ExpressionReader();
    private final ExpressionFormatter formatter = new ExpressionFormatter();

    private Optional<String> apply(Function<Expr, Optional<Expr>> rewrite, String text) {
        return rewrite.apply(reader.read(text).expression()).map(formatter::format);
    }

    @ParameterizedTest
    @Tag("unit")
    @CsvSource(delimiter = '|', value = {
            "2 + 3   | 5",
            "6 / 3   | 2",
            "2 ^ 10  | 1024",
            "7 % 4   | 3",
            "√9      | 3"
    })
    void testConstantFold(String input, String expected) {
        assertThat(apply(Rewrites::constantFold, input)).contains(expected);
    }

    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {"4 / 6", "0 ^ 0", "1 / 0", "x + 1"})
    void testConstantFoldLeavesNode(String input) {
        assertThat(apply(Rewrites::constantFold, input)).isEmpty();
    }

    @Test
    @Tag("unit")
    void testSimplifyFraction() {
        assertThat(apply(Rewrites::simplifyFraction, "4 / 6")).contains("2 / 3");
        assertThat(apply(Rewrites::simplifyFraction, "6 / 3")).contains("2");
        assertThat(apply(Rewrites::simplifyFraction, "3 / 7")).isEmpty();
        assertThat(apply(Rewrites::simplifyFraction, "4 / 0")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testHugeFractionIsLeftAlone() {
        assertThat(apply(Rewrites::simplifyFraction, "2e19 / 6e19")).isEmpty();
        assertThat(apply(Rewrites::simplifyFraction, "9007199254740992 / 2")).contains("4503599627370496");
    }

    @Test
    @Tag("unit")
    void testPowers() {
        assertThat(apply(Rewrites::powerOfPower, "(x^2)^3")).contains("x^6");
        assertThat(apply(Rewrites::powerOfPower, "(x^2)^(1/2)")).isEmpty();
        assertThat(apply(Rewrites::multiplyPowers, "x^2 * x^3")).contains("x^5");
        assertThat(apply(Rewrites::multiplyPowers, "x * x^2")).contains("x^3");
        assertThat(apply(Rewrites::multiplyPowers, "x^2 * y^3")).isEmpty();
        assertThat(apply(Rewrites::powerZero, "0^0")).isEmpty();
        assertThat(apply(Rewrites::baseOne, "(1^a)^b")).contains("1");
    }

    @Test
    @Tag("unit")
    void testDistribute() {
        assertThat(apply(Rewrites::distribute, "a * (b + c)")).contains("a * b + a * c");
        assertThat(apply(Rewrites::distribute, "(a - b) * c")).contains("a * c - b * c");
        assertThat(apply(Rewrites::distribute, "a * b")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testCombineLikeTermsOnlyWhenTermsMerge() {
        assertThat(apply(Rewrites::combineLikeTerms, "x + x")).contains("2 * x");
        assertThat(apply(Rewrites::combineLikeTerms, "x + y")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testFactorCommonIsDetectedOnly() {
        assertThat(Rewrites.hasCommonFactor(reader.read("a*b + a*c").expression())).isTrue();
        assertThat(Rewrites.hasCommonFactor(reader.read("a*b + c*d").expression())).isFalse();
    }

    @Test
    @Tag("unit")
    void testSelfCancellation() {
        assertThat(apply(Rewrites::subtractSelf, "(x + 1) - (x + 1)")).contains("0");
        assertThat(apply(Rewrites::divideSelf, "y / y")).contains("1");
        assertThat(apply(Rewrites::divideSelf, "0 / 0")).isEmpty();
        assertThat(apply(Rewrites::doubleNegation, "--x")).contains("x");
    }
}
