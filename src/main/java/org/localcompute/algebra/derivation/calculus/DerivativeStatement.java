package org.localcompute.algebra.derivation.calculus;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A textual derivative request such as {@code d/dx x^3}, {@code derivative of sin(2x)} or
 * {@code differentiate x*e^x}.
 *
 * @param variable The variable of differentiation, {@code x} unless written as {@code d/dt}.
 * @param body The text of the differentiated expression.
 */
public record DerivativeStatement(String variable, String body) {

    private static final Pattern STATEMENT = Pattern.compile(
            "^\\s*(?:d\\s*/\\s*d([A-Za-z])|derivative\\s+of|differentiate(?:\\s+of)?|diff(?:\\s+of)?)\\s*(.+?)\\s*$",
            Pattern.CASE_INSENSITIVE);

    /**
     * @param text The left-hand side of a step.
     * @return Whether the text asks for a derivative.
     */
    public static boolean isDerivative(String text) {
        return text != null && STATEMENT.matcher(text).matches();
    }

    /**
     * @param text The left-hand side of a step.
     * @return The statement, or empty if the text is not a derivative request.
     */
    public static Optional<DerivativeStatement> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = STATEMENT.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String variable = matcher.group(1) == null ? "x" : matcher.group(1);
        return Optional.of(new DerivativeStatement(variable, matcher.group(2)));
    }
}
