package org.localcompute.algebra.api;

/**
 * Defines unique, testable error codes for all errors the engine can report.
 * This decouples the test logic from the human-readable error messages.
 */
public enum AlgebraErrorCode {
    // region Tokenizer Errors
    /** A character that is not part of the expression alphabet. */
    UNKNOWN_CHARACTER(Category.TOKENIZE),
    /** A digit run with more than one decimal point. */
    INVALID_NUMBER(Category.TOKENIZE),
    // endregion

    // region Parser Errors
    /** The input contained no tokens. */
    EMPTY_EXPRESSION(Category.PARSE),
    /** A binary operator appeared where an operand was expected. */
    UNEXPECTED_OPERATOR(Category.PARSE),
    /** The expression ends with a binary or prefix operator. */
    TRAILING_OPERATOR(Category.PARSE),
    /** An opening parenthesis was never closed, or a closing one has no partner. */
    UNMATCHED_PARENTHESIS(Category.PARSE),
    /** A bracket was closed with a different bracket kind. */
    MISMATCHED_PARENTHESIS(Category.PARSE),
    /** A pair of parentheses without content. */
    EMPTY_PARENTHESES(Category.PARSE),
    /** A postfix operator such as ² without a preceding operand. */
    POSTFIX_WITHOUT_OPERAND(Category.PARSE),
    /** Any other token that does not fit the grammar. */
    UNEXPECTED_TOKEN(Category.PARSE),
    /** The expression is nested deeper than the configured maximum. */
    NESTING_TOO_DEEP(Category.PARSE),
    // endregion

    // region Evaluation Errors
    /** A variable without a binding. */
    UNBOUND_VARIABLE(Category.EVAL),
    /** Division by exactly zero. */
    DIVISION_BY_ZERO(Category.EVAL),
    /** Modulo by exactly zero. */
    MODULO_BY_ZERO(Category.EVAL),
    /** Square root of a negative operand. */
    NEGATIVE_ROOT(Category.EVAL),
    /** A NaN or infinite intermediate result. */
    UNDEFINED_RESULT(Category.EVAL),
    // endregion

    // region Derivation Errors
    /** The derivation contained no steps. */
    NO_STEPS(Category.DERIVATION),
    /** A step whose two sides are not equivalent. */
    INVALID_STEP(Category.DERIVATION),
    /** A valid step that does not continue from the previous right-hand side. */
    DISCONTINUITY(Category.DERIVATION);
    // endregion

    /**
     * The stage of processing an error code belongs to.
     */
    public enum Category {
        TOKENIZE,
        PARSE,
        EVAL,
        DERIVATION
    }

    private final Category category;

    AlgebraErrorCode(Category category) {
        this.category = category;
    }

    /**
     * @return The stage this error code belongs to.
     */
    public Category category() {
        return category;
    }
}
