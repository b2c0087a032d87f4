package org.localcompute.algebra.frontend.lexer;

import org.localcompute.algebra.api.AlgebraErrorCode;
import org.localcompute.algebra.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * expression text into a sequence of tokens.
 * <p>
 * Besides scanning, it decides from context whether {@code +} and {@code -} act as
 * prefix operators and inserts implicit multiplication tokens, e.g. in {@code 2x} or {@code (a)(b)}.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The expression text.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this.source = source == null ? "" : source;
        this.diagnostics = diagnostics;
    }

    /**
     * Convenience entry point that tokenizes text with a fresh diagnostics engine.
     *
     * @param text The expression text.
     * @return The tokens and diagnostics.
     */
    public static TokenizeResult tokenize(String text) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(text, diagnostics).scanTokens();
        return new TokenizeResult(tokens, diagnostics.getDiagnostics());
    }

    /**
     * Performs the tokenization of the entire text.
     * @return A list of the recognized tokens, with implicit multiplications inserted.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return insertImplicitMultiplication(tokens);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(', '[', '{', ')', ']', '}' -> tokens.add(Token.of(TokenType.PAREN, String.valueOf(c), start));
            default -> {
                if (Character.isWhitespace(c)) {
                    return;
                }
                if (isDigit(c) || c == '.') {
                    number();
                    return;
                }
                if (isAlpha(c)) {
                    variable();
                    return;
                }
                Optional<Operator> operator = Operator.fromChar(c);
                if (operator.isPresent()) {
                    operatorToken(operator.get(), c);
                } else {
                    tokens.add(Token.of(TokenType.UNKNOWN, String.valueOf(c), start));
                    diagnostics.reportError(AlgebraErrorCode.UNKNOWN_CHARACTER,
                            "Unknown character '" + c + "' at position " + start, start);
                }
            }
        }
    }

    private void operatorToken(Operator operator, char c) {
        boolean unary = switch (operator.fixity()) {
            case PREFIX, POSTFIX -> true;
            case INFIX -> operator.isPrefixCapable() && expectsOperand();
        };
        tokens.add(Token.operator(operator, String.valueOf(c), start, unary));
    }

    /**
     * An operand is expected at the start, after an opening bracket and after any
     * operator that is not a postfix operator.
     */
    private boolean expectsOperand() {
        if (tokens.isEmpty()) {
            return true;
        }
        Token last = tokens.get(tokens.size() - 1);
        if (last.type() == TokenType.OPERATOR) {
            return !last.operator().isPostfix();
        }
        return last.isOpeningParen();
    }

    private void number() {
        int dots = previous() == '.' ? 1 : 0;
        while (isDigit(peek()) || peek() == '.') {
            if (advance() == '.') {
                dots++;
            }
        }
        // An exponent needs a digit, optionally after a sign; otherwise 'e' starts a variable.
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(current + 2))))) {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            while (isDigit(peek())) advance();
        }

        String text = source.substring(start, current);
        if (dots > 1 || text.equals(".")) {
            tokens.add(Token.of(TokenType.UNKNOWN, text, start));
            diagnostics.reportError(AlgebraErrorCode.INVALID_NUMBER,
                    "Invalid number '" + text + "' at position " + start, start);
            return;
        }
        tokens.add(Token.of(TokenType.NUMBER, text, start));
    }

    private void variable() {
        while (isAlphaNumeric(peek())) advance();
        tokens.add(Token.of(TokenType.VARIABLE, source.substring(start, current), start));
    }

    private static List<Token> insertImplicitMultiplication(List<Token> scanned) {
        List<Token> result = new ArrayList<>(scanned.size());
        for (int i = 0; i < scanned.size(); i++) {
            Token token = scanned.get(i);
            if (i > 0 && endsOperand(scanned.get(i - 1)) && startsOperand(token)) {
                result.add(Token.implicitMultiply(token.position()));
            }
            result.add(token);
        }
        return result;
    }

    private static boolean endsOperand(Token token) {
        return switch (token.type()) {
            case NUMBER, VARIABLE -> true;
            case PAREN -> token.isClosingParen();
            case OPERATOR -> token.operator().isPostfix();
            case UNKNOWN -> false;
        };
    }

    private static boolean startsOperand(Token token) {
        return switch (token.type()) {
            case NUMBER, VARIABLE -> true;
            case PAREN -> token.isOpeningParen();
            case OPERATOR -> token.operator() == Operator.SQRT;
            case UNKNOWN -> false;
        };
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        current++;
        return source.charAt(current - 1);
    }

    private char peek() {
        return peekAt(current);
    }

    private char peekNext() {
        return peekAt(current + 1);
    }

    private char peekAt(int index) {
        if (index >= source.length()) return '\0';
        return source.charAt(index);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
