package org.localcompute.algebra.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A numeric literal, e.g., {@code 42}, {@code .5} or {@code 1.5e3}. */
    NUMBER,
    /** A variable name, e.g., {@code x} or {@code rate_2}. */
    VARIABLE,
    /** An operator, including Unicode aliases. */
    OPERATOR,
    /** An opening or closing bracket: {@code ( ) [ ] { }}. */
    PAREN,
    /** A character or character run the tokenizer does not understand. */
    UNKNOWN
}
