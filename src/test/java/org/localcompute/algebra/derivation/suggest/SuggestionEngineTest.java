package org.localcompute.algebra.derivation.suggest;

import org.localcompute.algebra.derivation.DerivationStep;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link SuggestionEngine} and the standard {@link TransformCatalog}.
 */
@ExtendWith(LogWatchExtension.class)
public class SuggestionEngineTest {

    private SuggestionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SuggestionEngine(TransformCatalog.initialize(), new ExpressionReader(), new ExpressionFormatter(), 50);
    }

    @Test
    @Tag("unit")
    void testCatalogIsOrderedByPriority() {
        // Act
        List<ITransformRule> rules = TransformCatalog.initialize().rules();

        // Assert
        assertThat(rules.get(0).tag()).isEqualTo("constant_fold");
        assertThat(rules.get(1).tag()).isEqualTo("indeterminate_zero_power_zero");
        assertThat(rules.get(1).isSuggestOnly()).isTrue();
        assertThat(rules).extracting(ITransformRule::priority).isSortedAccordingTo((a, b) -> Integer.compare(b, a));
    }

    @Nested
    @DisplayName("Next step")
    class NextStep {

        @Test
        @Tag("unit")
        void testSuggestsHighestPriorityTransform() {
            // Act
            NextStepSuggestion suggestion = engine.suggestNextStep(List.of(DerivationStep.of("y", "a*(b+c)")));

            // Assert
            assertThat(suggestion.hasSuggestion()).isTrue();
            assertThat(suggestion.transform()).isEqualTo("distribute");
            assertThat(suggestion.currentExpression()).isEqualTo("a*(b+c)");
            assertThat(suggestion.applicable()).extracting(NextStepSuggestion.ApplicableTransform::tag)
                    .containsExactly("distribute");
        }

        @Test
        @Tag("unit")
        void testLooksAtLastRightHandSide() {
            // Act
            NextStepSuggestion suggestion = engine.suggestNextStepFromText("a*(b+c) = a*b + a*c + 0");

            // Assert
            assertThat(suggestion.currentExpression()).isEqualTo("a*b + a*c + 0");
            assertThat(suggestion.transform()).isEqualTo("add_zero");
        }

        @Test
        @Tag("unit")
        void testNoSuggestion() {
            assertThat(engine.suggestNextStep(List.of()).hasSuggestion()).isFalse();
            assertThat(engine.suggestNextStep(List.of()).currentExpression()).isNull();
            assertThat(engine.suggestNextStep(List.of(DerivationStep.of("x", "x"))).hasSuggestion()).isFalse();
            assertThat(engine.suggestNextStep(List.of(DerivationStep.of("x", "x +"))).hasSuggestion()).isFalse();
        }
    }

    @Nested
    @DisplayName("Simplification path")
    class Path {

        @Test
        @Tag("unit")
        void testIdentityRemovalPath() {
            // Act
            SimplificationPath path = engine.simplificationPath("(x + 0) * 1");

            // Assert
            assertThat(path.success()).isTrue();
            assertThat(path.original()).isEqualTo("(x + 0) * 1");
            assertThat(path.simplified()).isEqualTo("x");
            assertThat(path.steps()).extracting(SimplificationStep::transform).containsExactly("add_zero", "multiply_one");
            assertThat(path.steps().get(0).before()).isEqualTo("(x + 0) * 1");
            assertThat(path.steps().get(0).after()).isEqualTo("x * 1");
            assertThat(path.steps().get(1).ordinal()).isEqualTo(2);
            assertThat(path.transformationCount()).isEqualTo(2);
            assertThat(path.isFullySimplified()).isTrue();
        }

        @Test
        @Tag("unit")
        void testZeroPowerZeroIsNeverRewritten() {
            // Act
            SimplificationPath path = engine.simplificationPath("0^0");

            // Assert
            assertThat(path.success()).isTrue();
            assertThat(path.simplified()).isEqualTo("0^0");
            assertThat(path.steps()).isEmpty();
            assertThat(path.isFullySimplified()).isFalse();
        }

        @Test
        @Tag("unit")
        void testStepBudget() {
            // Act
            SimplificationPath path = engine.simplificationPath("(x + 0) * 1", 1);

            // Assert
            assertThat(path.steps()).hasSize(1);
            assertThat(path.simplified()).isEqualTo("x * 1");
            assertThat(path.isFullySimplified()).isFalse();
            assertThat(engine.simplificationPath("(x + 0) * 1", 0).steps()).isEmpty();
        }

        @Test
        @Tag("unit")
        void testUnparsableInput() {
            // Act
            SimplificationPath path = engine.simplificationPath("(x +");

            // Assert
            assertThat(path.success()).isFalse();
            assertThat(path.simplified()).isEqualTo("(x +");
            assertThat(path.steps()).isEmpty();
        }

        @Test
        @Tag("unit")
        void testNegativeBudgetIsRejected() {
            assertThatThrownBy(() -> engine.simplificationPath("x", -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
