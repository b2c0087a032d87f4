package org.localcompute.algebra.frontend.lexer;

/**
 * Represents a single token extracted from expression text by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source, empty for inserted tokens.
 * @param position The 0-based offset where the token begins.
 * @param operator The operator descriptor, or {@code null} for non-operator tokens.
 * @param unary Whether an operator token acts on a single operand in this context.
 * @param implicit Whether the token was inserted for implicit multiplication.
 */
public record Token(
        TokenType type,
        String text,
        int position,
        Operator operator,
        boolean unary,
        boolean implicit
) {

    static Token of(TokenType type, String text, int position) {
        return new Token(type, text, position, null, false, false);
    }

    static Token operator(Operator operator, String text, int position, boolean unary) {
        return new Token(TokenType.OPERATOR, text, position, operator, unary, false);
    }

    static Token implicitMultiply(int position) {
        return new Token(TokenType.OPERATOR, "", position, Operator.MULTIPLY, false, true);
    }

    /**
     * @return The number of operands of an operator token, 0 for other tokens.
     */
    public int arity() {
        if (operator == null) {
            return 0;
        }
        return unary ? 1 : 2;
    }

    /**
     * @return The precedence tier of an operator token, 0 for other tokens.
     */
    public int precedence() {
        return operator == null ? 0 : operator.tier();
    }

    public boolean isRightAssociative() {
        return operator != null && operator.isRightAssociative();
    }

    public boolean isOpeningParen() {
        return type == TokenType.PAREN && (text.equals("(") || text.equals("[") || text.equals("{"));
    }

    public boolean isClosingParen() {
        return type == TokenType.PAREN && !isOpeningParen();
    }

    public boolean isOperator(Operator op) {
        return type == TokenType.OPERATOR && operator == op;
    }

    /**
     * Returns the closing bracket matching an opening bracket token.
     *
     * @return The matching closing bracket text.
     */
    public String closingText() {
        return switch (text) {
            case "[" -> "]";
            case "{" -> "}";
            default -> ")";
        };
    }
}
