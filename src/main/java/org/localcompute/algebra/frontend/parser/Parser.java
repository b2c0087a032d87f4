package org.localcompute.algebra.frontend.parser;

import org.localcompute.algebra.api.AlgebraErrorCode;
import org.localcompute.algebra.diagnostics.Diagnostic;
import org.localcompute.algebra.diagnostics.DiagnosticsEngine;
import org.localcompute.algebra.frontend.lexer.Operator;
import org.localcompute.algebra.frontend.lexer.Token;
import org.localcompute.algebra.frontend.lexer.TokenType;
import org.localcompute.algebra.frontend.parser.ast.Expr;

import java.util.List;

/**
 * A precedence-climbing parser. It consumes the tokens produced by the
 * {@link org.localcompute.algebra.frontend.lexer.Lexer} and builds an expression tree.
 * <p>
 * Prefix operators ({@code -}, {@code +}, {@code √}) and postfix operators ({@code ²}, {@code ³})
 * bind tighter than exponentiation, so {@code -x^2} parses as {@code (-x)^2} while
 * {@code -2²} parses as {@code -(2²)}. Exponentiation is right-associative; every other binary
 * operator is left-associative.
 */
public class Parser {

    /** The default maximum tree height. */
    public static final int DEFAULT_MAX_DEPTH = 200;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final int maxDepth;
    private int current = 0;

    /**
     * Constructs a new Parser with the default nesting limit.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, DEFAULT_MAX_DEPTH);
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors.
     * @param maxDepth The maximum height of the resulting tree.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, int maxDepth) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses the whole token list into a single expression.
     * @return The tree, or the diagnostics of the first error.
     */
    public ParseResult parse() {
        try {
            if (tokens.isEmpty()) {
                throw error(AlgebraErrorCode.EMPTY_EXPRESSION, "Empty expression", 0);
            }
            for (Token token : tokens) {
                if (token.type() == TokenType.UNKNOWN) {
                    throw error(AlgebraErrorCode.UNEXPECTED_TOKEN,
                            "Unexpected token '" + token.text() + "'", token.position());
                }
            }
            Parsed parsed = expression(1, 0);
            if (!isAtEnd()) {
                Token extra = peek();
                if (extra.isClosingParen()) {
                    throw error(AlgebraErrorCode.UNMATCHED_PARENTHESIS,
                            "Unmatched closing parenthesis '" + extra.text() + "'", extra.position());
                }
                throw error(AlgebraErrorCode.UNEXPECTED_TOKEN,
                        "Unexpected token '" + extra.text() + "'", extra.position());
            }
            return ParseResult.success(parsed.expr());
        } catch (ParseFailure e) {
            return ParseResult.failure(List.of(e.diagnostic));
        }
    }

    private Parsed expression(int minTier, int depth) {
        checkDepth(depth, peekPosition());
        Parsed left = unary(depth);
        while (!isAtEnd() && isBinaryOperator(peek()) && peek().precedence() >= minTier) {
            Token operator = advance();
            if (isAtEnd()) {
                throw error(AlgebraErrorCode.TRAILING_OPERATOR,
                        "Expression ends with operator '" + operator.text() + "'", operator.position());
            }
            int nextMin = operator.isRightAssociative() ? operator.precedence() : operator.precedence() + 1;
            Parsed right = expression(nextMin, depth + 1);
            left = node(Expr.binary(operator.operator(), left.expr(), right.expr()),
                    Math.max(left.height(), right.height()) + 1, operator.position());
        }
        return left;
    }

    private Parsed unary(int depth) {
        checkDepth(depth, peekPosition());
        Token token = peek();
        if (token.type() == TokenType.OPERATOR) {
            Operator op = token.operator();
            if (op.isPostfix()) {
                throw error(AlgebraErrorCode.POSTFIX_WITHOUT_OPERAND,
                        "Postfix operator '" + token.text() + "' without operand", token.position());
            }
            if (!token.unary()) {
                throw error(AlgebraErrorCode.UNEXPECTED_OPERATOR,
                        "Unexpected operator '" + token.text() + "'", token.position());
            }
            advance();
            if (isAtEnd()) {
                throw error(AlgebraErrorCode.TRAILING_OPERATOR,
                        "Expression ends with operator '" + token.text() + "'", token.position());
            }
            Parsed operand = unary(depth + 1);
            return node(Expr.unary(op, operand.expr()), operand.height() + 1, token.position());
        }
        return postfix(primary(depth));
    }

    private Parsed postfix(Parsed operand) {
        Parsed result = operand;
        while (!isAtEnd() && peek().type() == TokenType.OPERATOR && peek().operator().isPostfix()) {
            Token token = advance();
            result = node(Expr.unary(token.operator(), result.expr()), result.height() + 1, token.position());
        }
        return result;
    }

    private Parsed primary(int depth) {
        Token token = advance();
        switch (token.type()) {
            case NUMBER:
                return new Parsed(Expr.num(Double.parseDouble(token.text())), 1);
            case VARIABLE:
                return new Parsed(Expr.var(token.text()), 1);
            case PAREN:
                if (token.isOpeningParen()) {
                    return group(token, depth);
                }
                if (current >= 2 && tokens.get(current - 2).type() == TokenType.OPERATOR) {
                    Token operator = tokens.get(current - 2);
                    throw error(AlgebraErrorCode.TRAILING_OPERATOR,
                            "Missing operand after operator '" + operator.text() + "'", operator.position());
                }
                throw error(AlgebraErrorCode.UNMATCHED_PARENTHESIS,
                        "Unmatched closing parenthesis '" + token.text() + "'", token.position());
            default:
                throw error(AlgebraErrorCode.UNEXPECTED_TOKEN,
                        "Unexpected token '" + token.text() + "'", token.position());
        }
    }

    private Parsed group(Token opening, int depth) {
        if (!isAtEnd() && peek().isClosingParen()) {
            throw error(AlgebraErrorCode.EMPTY_PARENTHESES, "Empty parentheses", opening.position());
        }
        if (isAtEnd()) {
            throw error(AlgebraErrorCode.UNMATCHED_PARENTHESIS, "Unclosed parenthesis", opening.position());
        }
        Parsed inner = expression(1, depth + 1);
        if (isAtEnd()) {
            throw error(AlgebraErrorCode.UNMATCHED_PARENTHESIS, "Unclosed parenthesis", opening.position());
        }
        Token closing = advance();
        if (!closing.isClosingParen()) {
            throw error(AlgebraErrorCode.UNEXPECTED_TOKEN,
                    "Expected '" + opening.closingText() + "' but found '" + closing.text() + "'", closing.position());
        }
        if (!closing.text().equals(opening.closingText())) {
            throw error(AlgebraErrorCode.MISMATCHED_PARENTHESIS,
                    "Mismatched parenthesis: '" + opening.text() + "' closed by '" + closing.text() + "'",
                    closing.position());
        }
        return inner;
    }

    private Parsed node(Expr expr, int height, int position) {
        if (height > maxDepth) {
            throw error(AlgebraErrorCode.NESTING_TOO_DEEP,
                    "Expression is nested deeper than " + maxDepth + " levels", position);
        }
        return new Parsed(expr, height);
    }

    private void checkDepth(int depth, int position) {
        if (depth > maxDepth) {
            throw error(AlgebraErrorCode.NESTING_TOO_DEEP,
                    "Expression is nested deeper than " + maxDepth + " levels", position);
        }
    }

    private static boolean isBinaryOperator(Token token) {
        return token.type() == TokenType.OPERATOR && !token.unary();
    }

    private ParseFailure error(AlgebraErrorCode code, String message, int position) {
        diagnostics.reportError(code, message, position);
        return new ParseFailure(Diagnostic.error(code, message, position));
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private int peekPosition() {
        return isAtEnd() ? (tokens.isEmpty() ? 0 : previous().position()) : peek().position();
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private record Parsed(Expr expr, int height) {
    }

    private static final class ParseFailure extends RuntimeException {
        private final transient Diagnostic diagnostic;

        ParseFailure(Diagnostic diagnostic) {
            super(diagnostic.message(), null, false, false);
            this.diagnostic = diagnostic;
        }
    }
}
