package org.localcompute.algebra.derivation.suggest;

import java.util.List;

/**
 * The transformations that take an expression to its simplest form, one at a time.
 *
 * @param success Whether the expression could be parsed.
 * @param original The expression as given.
 * @param simplified The final expression.
 * @param steps The applied steps in order.
 * @param isFullySimplified Whether no applicable transformation and no indeterminate form remains.
 * @param transformationCount The number of steps.
 */
public record SimplificationPath(boolean success, String original, String simplified, List<SimplificationStep> steps,
                                 boolean isFullySimplified, int transformationCount) {

    static SimplificationPath unparsable(String original) {
        return new SimplificationPath(false, original, original, List.of(), false, 0);
    }
}
