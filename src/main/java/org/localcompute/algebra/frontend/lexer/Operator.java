package org.localcompute.algebra.frontend.lexer;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The static operator descriptor table. Every operator character the tokenizer accepts,
 * including its Unicode aliases, resolves to exactly one constant.
 */
public enum Operator {
    /** Addition, or unary plus in prefix position. */
    ADD("+", "+", 1, Fixity.INFIX, false, true, '+'),
    /** Subtraction, or negation in prefix position. */
    SUBTRACT("-", "−", 1, Fixity.INFIX, false, true, '-', '−'),
    /** Multiplication. */
    MULTIPLY("*", "×", 2, Fixity.INFIX, false, false, '*', '×', '·'),
    /** Division. */
    DIVIDE("/", "÷", 2, Fixity.INFIX, false, false, '/', '÷'),
    /** IEEE remainder. */
    MODULO("%", "%", 2, Fixity.INFIX, false, false, '%'),
    /** Exponentiation. */
    POWER("^", "^", 3, Fixity.INFIX, true, false, '^'),
    /** Square root. */
    SQRT("√", "√", 4, Fixity.PREFIX, false, true, '√'),
    /** Postfix square. */
    SQUARE("²", "²", 3, Fixity.POSTFIX, false, false, '²'),
    /** Postfix cube. */
    CUBE("³", "³", 3, Fixity.POSTFIX, false, false, '³');

    /**
     * Where an operator stands relative to its operand(s).
     */
    public enum Fixity {
        INFIX,
        PREFIX,
        POSTFIX
    }

    private static final Map<Character, Operator> BY_CHAR = new HashMap<>();

    static {
        for (Operator op : values()) {
            for (char alias : op.aliases) {
                BY_CHAR.put(alias, op);
            }
        }
    }

    private final String symbol;
    private final String unicodeSymbol;
    private final int tier;
    private final Fixity fixity;
    private final boolean rightAssociative;
    private final boolean prefixCapable;
    private final char[] aliases;

    Operator(String symbol, String unicodeSymbol, int tier, Fixity fixity,
             boolean rightAssociative, boolean prefixCapable, char... aliases) {
        this.symbol = symbol;
        this.unicodeSymbol = unicodeSymbol;
        this.tier = tier;
        this.fixity = fixity;
        this.rightAssociative = rightAssociative;
        this.prefixCapable = prefixCapable;
        this.aliases = aliases;
    }

    /**
     * Resolves an operator character, including Unicode aliases.
     *
     * @param c The character.
     * @return The operator, or empty if {@code c} is not an operator character.
     */
    public static Optional<Operator> fromChar(char c) {
        return Optional.ofNullable(BY_CHAR.get(c));
    }

    /**
     * @return The canonical ASCII symbol.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return The Unicode display glyph.
     */
    public String unicodeSymbol() {
        return unicodeSymbol;
    }

    /**
     * @return The precedence tier: 1 add/sub, 2 mul/div/mod, 3 exponent and postfix powers, 4 prefix root.
     */
    public int tier() {
        return tier;
    }

    public Fixity fixity() {
        return fixity;
    }

    public boolean isRightAssociative() {
        return rightAssociative;
    }

    /**
     * @return Whether the operator may act as a prefix operator (always for {@link #SQRT},
     *         contextually for {@link #ADD} and {@link #SUBTRACT}).
     */
    public boolean isPrefixCapable() {
        return prefixCapable;
    }

    public boolean isPostfix() {
        return fixity == Fixity.POSTFIX;
    }

    /**
     * @return Whether the operator is {@link #ADD} or {@link #SUBTRACT}.
     */
    public boolean isAdditive() {
        return this == ADD || this == SUBTRACT;
    }
}
