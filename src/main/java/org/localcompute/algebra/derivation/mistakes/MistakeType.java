package org.localcompute.algebra.derivation.mistakes;

import java.util.Locale;

/**
 * The catalogue of recognized algebra and calculus mistakes.
 */
public enum MistakeType {
    /** An operand order swap in a subtraction, or a result with the opposite sign. */
    SIGN_ERROR,
    /** Like terms combined with the wrong coefficient. */
    COEFFICIENT_ERROR,
    /** Exponents multiplied where they must be added, or added where they must be multiplied. */
    EXPONENT_ERROR,
    /** A product over a sum expanded incompletely or incorrectly. */
    DISTRIBUTION_ERROR,
    /** A subtracted group whose inner signs were not all flipped. */
    SUBTRACTION_DISTRIBUTION_ERROR,
    /** A term of a sum cancelled against a denominator. */
    CANCELLATION_ERROR,
    /** The power rule applied with a wrong coefficient or exponent. */
    POWER_RULE_ERROR,
    /** The derivative of a composite missing the inner derivative. */
    CHAIN_RULE_ERROR,
    /** The derivative of a product not in the form f'g + fg'. */
    PRODUCT_RULE_ERROR,
    /** Fractions added without a common denominator. */
    FRACTION_ERROR;

    /**
     * @return The snake_case tag, e.g. {@code coefficient_error}.
     */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return The tag as words, e.g. {@code coefficient error}.
     */
    public String words() {
        return tag().replace('_', ' ');
    }
}
