package org.localcompute.algebra.simplify;

import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class TermsTest {

    private final ExpressionReader reader = new ExpressionReader();
    private final ExpressionFormatter formatter = new ExpressionFormatter();

    private Expr tree(String text) {
        return reader.read(text).expression();
    }

    @Test
    @Tag("unit")
    void testFlattenDistributesSigns() {
        // Act
        List<Terms.SignedTerm> terms = Terms.flatten(tree("a - (b - c) + -d"));

        // Assert
        assertThat(terms).extracting(Terms.SignedTerm::positive).containsExactly(true, false, true, false);
        assertThat(terms).extracting(t -> formatter.format(t.term())).containsExactly("a", "b", "c", "d");
    }

    /**
     * Verifies that numeric factors anywhere in a product chain end up in the coefficient.
     */
    @Test
    @Tag("unit")
    void testMonomialOfProductChain() {
        // Act
        Terms.Monomial m = Terms.monomial(tree("2a*3b"));

        // Assert
        assertThat(m.coefficient()).isEqualTo(6.0);
        assertThat(formatter.format(m.base())).isEqualTo("a * b");
        assertThat(Terms.monomial(tree("-x")).coefficient()).isEqualTo(-1.0);
        assertThat(Terms.monomial(tree("7")).base()).isNull();
    }

    @Test
    @Tag("unit")
    void testCombineLikeTerms() {
        // Act
        List<Terms.SignedTerm> combined = Terms.combineLikeTerms(Terms.flatten(tree("2x + 3y - x + x - 3y")));

        // Assert
        assertThat(formatter.format(Terms.sum(combined))).isEqualTo("2 * x");
    }

    @Test
    @Tag("unit")
    void testCancellingTermsLeaveZero() {
        List<Terms.SignedTerm> combined = Terms.combineLikeTerms(Terms.flatten(tree("x - x")));

        assertThat(combined).hasSize(1);
        assertThat(combined.get(0).term()).isEqualTo(Expr.num(0));
    }
}
