package org.localcompute.algebra.api;

import org.localcompute.algebra.config.EngineConfig;
import org.localcompute.algebra.derivation.DerivationErrorExplanation;
import org.localcompute.algebra.derivation.DerivationExplainer;
import org.localcompute.algebra.derivation.DerivationResult;
import org.localcompute.algebra.derivation.DerivationSimplifier;
import org.localcompute.algebra.derivation.DerivationStep;
import org.localcompute.algebra.derivation.DerivationVerifier;
import org.localcompute.algebra.derivation.SimplifyDerivationResult;
import org.localcompute.algebra.derivation.StepExtractor;
import org.localcompute.algebra.derivation.mistakes.MistakeCheckRegistry;
import org.localcompute.algebra.derivation.mistakes.MistakeDetectionResult;
import org.localcompute.algebra.derivation.mistakes.MistakeDetector;
import org.localcompute.algebra.derivation.suggest.NextStepSuggestion;
import org.localcompute.algebra.derivation.suggest.SimplificationPath;
import org.localcompute.algebra.derivation.suggest.SuggestionEngine;
import org.localcompute.algebra.derivation.suggest.TransformCatalog;
import org.localcompute.algebra.equivalence.EquivalenceChecker;
import org.localcompute.algebra.equivalence.EquivalenceReport;
import org.localcompute.algebra.eval.EvalResult;
import org.localcompute.algebra.eval.Evaluator;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.format.FormatOptions;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.lexer.Lexer;
import org.localcompute.algebra.frontend.lexer.Token;
import org.localcompute.algebra.frontend.lexer.TokenizeResult;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.latex.LatexOptions;
import org.localcompute.algebra.latex.LatexRenderer;
import org.localcompute.algebra.simplify.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The default {@link IAlgebraEngine}. It wires every component from one {@link EngineConfig};
 * all collaborators are stateless, so an instance may be shared.
 */
public class AlgebraEngine implements IAlgebraEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AlgebraEngine.class);

    private final EngineConfig config;
    private final ExpressionReader reader;
    private final Evaluator evaluator;
    private final Simplifier simplifier;
    private final ExpressionFormatter formatter;
    private final EquivalenceChecker equivalence;
    private final DerivationVerifier verifier;
    private final DerivationExplainer explainer;
    private final DerivationSimplifier derivationSimplifier;
    private final MistakeDetector mistakeDetector;
    private final SuggestionEngine suggestionEngine;
    private final LatexRenderer latexRenderer;

    /**
     * Creates an engine with the defaults from {@code reference.conf}.
     */
    public AlgebraEngine() {
        this(EngineConfig.defaults());
    }

    /**
     * @param config The engine settings.
     */
    public AlgebraEngine(EngineConfig config) {
        this.config = config;
        this.reader = new ExpressionReader(config.maxNestingDepth());
        this.evaluator = new Evaluator();
        this.simplifier = new Simplifier();
        this.formatter = new ExpressionFormatter();
        this.equivalence = new EquivalenceChecker(config, reader, evaluator, simplifier);
        this.verifier = new DerivationVerifier(equivalence, reader);
        this.explainer = new DerivationExplainer();
        this.derivationSimplifier = new DerivationSimplifier(reader, simplifier, formatter, equivalence);
        this.mistakeDetector = new MistakeDetector(MistakeCheckRegistry.initialize(), reader, equivalence,
                simplifier, formatter);
        this.suggestionEngine = new SuggestionEngine(TransformCatalog.initialize(), reader, formatter,
                config.maxSimplificationSteps());
        this.latexRenderer = new LatexRenderer();
        LOG.debug("Algebra engine created with {}", config);
    }

    public EngineConfig getConfig() {
        return config;
    }

    @Override
    public TokenizeResult tokenize(String text) {
        return Lexer.tokenize(text);
    }

    @Override
    public ParseResult parse(List<Token> tokens) {
        return reader.parse(tokens);
    }

    @Override
    public ParseResult parse(String text) {
        return reader.read(text);
    }

    @Override
    public Expr parseOrThrow(String text) throws AlgebraException {
        ParseResult result = reader.read(text);
        if (!result.success()) {
            throw new AlgebraException(result.error());
        }
        return result.expression();
    }

    @Override
    public EvalResult evaluate(Expr tree, Map<String, Double> bindings) {
        return evaluator.evaluate(tree, bindings);
    }

    @Override
    public EvalResult evaluate(String text, Map<String, Double> bindings) {
        ParseResult parsed = reader.read(text);
        if (!parsed.success()) {
            return EvalResult.failure(parsed.error());
        }
        return evaluator.evaluate(parsed.expression(), bindings);
    }

    @Override
    public Expr simplify(Expr tree) {
        return simplifier.simplify(tree);
    }

    @Override
    public String format(Expr tree, FormatOptions options) {
        return formatter.format(tree, options);
    }

    @Override
    public boolean compareExpressions(String a, String b) {
        return equivalence.areEquivalent(a, b);
    }

    @Override
    public EquivalenceReport checkEquivalence(String a, String b) {
        return equivalence.check(a, b);
    }

    @Override
    public DerivationResult verifyDerivationSteps(List<DerivationStep> steps) {
        DerivationResult result = verifier.verify(steps);
        if (!result.valid()) {
            LOG.debug("Derivation rejected: {}", result.error());
        }
        return result;
    }

    @Override
    public DerivationResult verifyDerivationText(String text) {
        return verifyDerivationSteps(StepExtractor.extract(text));
    }

    @Override
    public Optional<DerivationErrorExplanation> explainDerivationError(DerivationResult result) {
        return explainer.explain(result);
    }

    @Override
    public SimplifyDerivationResult simplifyDerivation(List<DerivationStep> steps) {
        return derivationSimplifier.simplify(steps);
    }

    @Override
    public MistakeDetectionResult detectCommonMistakes(List<DerivationStep> steps) {
        return mistakeDetector.detect(steps);
    }

    @Override
    public MistakeDetectionResult detectCommonMistakesFromText(String text) {
        return mistakeDetector.detectFromText(text);
    }

    @Override
    public NextStepSuggestion suggestNextStep(List<DerivationStep> steps) {
        return suggestionEngine.suggestNextStep(steps);
    }

    @Override
    public NextStepSuggestion suggestNextStepFromText(String text) {
        return suggestionEngine.suggestNextStepFromText(text);
    }

    @Override
    public SimplificationPath suggestSimplificationPath(String text) {
        return suggestionEngine.simplificationPath(text);
    }

    @Override
    public SimplificationPath suggestSimplificationPath(String text, int maxSteps) {
        return suggestionEngine.simplificationPath(text, maxSteps);
    }

    @Override
    public String derivationToLatex(List<DerivationStep> steps, LatexOptions options) {
        return latexRenderer.render(steps, options);
    }

    @Override
    public String derivationTextToLatex(String text, LatexOptions options) {
        return latexRenderer.renderText(text, options);
    }
}
