package org.localcompute.algebra.derivation.suggest;

import java.util.List;

/**
 * The recommended next transformation for the current expression of a derivation.
 *
 * @param hasSuggestion Whether any transformation applies.
 * @param transform The tag of the highest-priority applicable transformation, or {@code null}.
 * @param description Its description, or {@code null}.
 * @param currentExpression The expression looked at (the right-hand side of the last step), or {@code null} without steps.
 * @param applicable Every applicable transformation, highest priority first.
 */
public record NextStepSuggestion(boolean hasSuggestion, String transform, String description,
                                 String currentExpression, List<ApplicableTransform> applicable) {

    /**
     * @param tag The transformation tag.
     * @param description The description.
     */
    public record ApplicableTransform(String tag, String description) {
    }

    static NextStepSuggestion none(String currentExpression) {
        return new NextStepSuggestion(false, null, null, currentExpression, List.of());
    }
}
