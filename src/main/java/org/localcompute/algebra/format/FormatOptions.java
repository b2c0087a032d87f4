package org.localcompute.algebra.format;

/**
 * Controls how {@link ExpressionFormatter} renders a tree.
 *
 * @param unicode Render {@code ×}, {@code ÷} and {@code −} instead of their ASCII forms.
 * @param spaces Put spaces around {@code + - * / %}; {@code ^} is always rendered tight.
 * @param minimalParens Only emit the parentheses precedence and associativity require.
 */
public record FormatOptions(boolean unicode, boolean spaces, boolean minimalParens) {

    /** ASCII operators, spaced, minimal parentheses. */
    public static final FormatOptions DEFAULT = new FormatOptions(false, true, true);

    /** Unicode operators, spaced, minimal parentheses. */
    public static final FormatOptions UNICODE = new FormatOptions(true, true, true);

    /** ASCII operators without spaces. */
    public static final FormatOptions COMPACT = new FormatOptions(false, false, true);
}
