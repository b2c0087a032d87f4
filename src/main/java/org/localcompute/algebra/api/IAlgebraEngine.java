package org.localcompute.algebra.api;

import org.localcompute.algebra.derivation.DerivationErrorExplanation;
import org.localcompute.algebra.derivation.DerivationResult;
import org.localcompute.algebra.derivation.DerivationStep;
import org.localcompute.algebra.derivation.SimplifyDerivationResult;
import org.localcompute.algebra.derivation.mistakes.MistakeDetectionResult;
import org.localcompute.algebra.derivation.suggest.NextStepSuggestion;
import org.localcompute.algebra.derivation.suggest.SimplificationPath;
import org.localcompute.algebra.equivalence.EquivalenceReport;
import org.localcompute.algebra.eval.EvalResult;
import org.localcompute.algebra.format.FormatOptions;
import org.localcompute.algebra.frontend.lexer.Token;
import org.localcompute.algebra.frontend.lexer.TokenizeResult;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.latex.LatexOptions;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Defines the public interface of the algebra engine.
 * <p>
 * Except for {@link #parseOrThrow(String)}, no operation throws on malformed input; failures are
 * reported as {@link org.localcompute.algebra.diagnostics.Diagnostic}s inside the returned results.
 * Implementations hold no mutable state and may be shared across threads.
 */
public interface IAlgebraEngine {

    /**
     * Splits expression text into tokens.
     * @param text The expression text.
     * @return The tokens and any tokenizer diagnostics.
     */
    TokenizeResult tokenize(String text);

    /**
     * Builds a tree from tokens.
     * @param tokens The tokens.
     * @return The parse result.
     */
    ParseResult parse(List<Token> tokens);

    /**
     * Tokenizes and parses expression text.
     * @param text The expression text.
     * @return The parse result.
     */
    ParseResult parse(String text);

    /**
     * Parses expression text, throwing on failure.
     * @param text The expression text.
     * @return The tree.
     * @throws AlgebraException carrying the first diagnostic if the text does not parse.
     */
    Expr parseOrThrow(String text) throws AlgebraException;

    /**
     * Evaluates a tree.
     * @param tree The tree.
     * @param bindings The variable values.
     * @return The value or the evaluation error.
     */
    EvalResult evaluate(Expr tree, Map<String, Double> bindings);

    /**
     * Parses and evaluates expression text.
     * @param text The expression text.
     * @param bindings The variable values.
     * @return The value, or the parse or evaluation error.
     */
    EvalResult evaluate(String text, Map<String, Double> bindings);

    Expr simplify(Expr tree);

    String format(Expr tree, FormatOptions options);

    /**
     * @param a The first expression text.
     * @param b The second expression text.
     * @return Whether the expressions are equivalent.
     */
    boolean compareExpressions(String a, String b);

    /**
     * Like {@link #compareExpressions(String, String)} but with sampling detail.
     * @param a The first expression text.
     * @param b The second expression text.
     * @return The report.
     */
    EquivalenceReport checkEquivalence(String a, String b);

    DerivationResult verifyDerivationSteps(List<DerivationStep> steps);

    DerivationResult verifyDerivationText(String text);

    Optional<DerivationErrorExplanation> explainDerivationError(DerivationResult result);

    SimplifyDerivationResult simplifyDerivation(List<DerivationStep> steps);

    MistakeDetectionResult detectCommonMistakes(List<DerivationStep> steps);

    MistakeDetectionResult detectCommonMistakesFromText(String text);

    NextStepSuggestion suggestNextStep(List<DerivationStep> steps);

    NextStepSuggestion suggestNextStepFromText(String text);

    /**
     * Computes a simplification path with the configured step budget.
     * @param text The expression text.
     * @return The path.
     */
    SimplificationPath suggestSimplificationPath(String text);

    /**
     * Computes a simplification path.
     * @param text The expression text.
     * @param maxSteps The step budget.
     * @return The path.
     */
    SimplificationPath suggestSimplificationPath(String text, int maxSteps);

    String derivationToLatex(List<DerivationStep> steps, LatexOptions options);

    String derivationTextToLatex(String text, LatexOptions options);
}
