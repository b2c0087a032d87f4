package org.localcompute.algebra.frontend;

import org.localcompute.algebra.diagnostics.DiagnosticsEngine;
import org.localcompute.algebra.frontend.lexer.Lexer;
import org.localcompute.algebra.frontend.lexer.Token;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reads expression text into a tree by running the lexer and the parser back to back.
 * Tokenizer errors take precedence over parser errors.
 */
public class ExpressionReader {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionReader.class);

    private final int maxDepth;

    public ExpressionReader() {
        this(Parser.DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth The maximum tree height the parser accepts.
     */
    public ExpressionReader(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Tokenizes and parses expression text.
     * @param text The expression text.
     * @return The parse result.
     */
    public ParseResult read(String text) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(text, diagnostics).scanTokens();
        if (diagnostics.hasErrors()) {
            LOG.debug("Tokenizing '{}' failed: {}", text, diagnostics.summary());
            return ParseResult.failure(diagnostics.getDiagnostics());
        }
        ParseResult result = parse(tokens, diagnostics);
        if (!result.success()) {
            LOG.debug("Parsing '{}' failed: {}", text, result.error());
        }
        return result;
    }

    /**
     * Parses an already tokenized expression.
     * @param tokens The tokens.
     * @return The parse result.
     */
    public ParseResult parse(List<Token> tokens) {
        return parse(tokens, new DiagnosticsEngine());
    }

    private ParseResult parse(List<Token> tokens, DiagnosticsEngine diagnostics) {
        return new Parser(tokens, diagnostics, maxDepth).parse();
    }
}
