package org.localcompute.algebra.derivation.suggest;

import org.localcompute.algebra.derivation.DerivationStep;
import org.localcompute.algebra.derivation.StepExtractor;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.frontend.parser.ast.ExprWalker;
import org.localcompute.algebra.simplify.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Suggests transformations from a {@link TransformCatalog} and walks an expression to its simplest
 * form by applying the highest-priority applicable rule, one node at a time.
 */
public class SuggestionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SuggestionEngine.class);

    private final TransformCatalog catalog;
    private final ExpressionReader reader;
    private final ExpressionFormatter formatter;
    private final int defaultMaxSteps;
    private final ExprWalker walker = new ExprWalker();

    /**
     * @param catalog The transformation catalogue.
     * @param reader The expression reader.
     * @param formatter The formatter for step texts.
     * @param defaultMaxSteps The step budget of {@link #simplificationPath(String)}.
     */
    public SuggestionEngine(TransformCatalog catalog, ExpressionReader reader, ExpressionFormatter formatter,
                            int defaultMaxSteps) {
        this.catalog = catalog;
        this.reader = reader;
        this.formatter = formatter;
        this.defaultMaxSteps = defaultMaxSteps;
    }

    /**
     * Suggests the next transformation for the right-hand side of the last step.
     * @param steps The derivation so far.
     * @return The suggestion; without steps, or for an unparsable expression, there is none.
     */
    public NextStepSuggestion suggestNextStep(List<DerivationStep> steps) {
        if (steps.isEmpty()) {
            return NextStepSuggestion.none(null);
        }
        String current = steps.get(steps.size() - 1).rhs();
        ParseResult parsed = reader.read(current);
        if (!parsed.success()) {
            return NextStepSuggestion.none(current);
        }
        List<NextStepSuggestion.ApplicableTransform> applicable = new ArrayList<>();
        for (ITransformRule rule : applicableRules(parsed.expression())) {
            applicable.add(new NextStepSuggestion.ApplicableTransform(rule.tag(), rule.description()));
        }
        if (applicable.isEmpty()) {
            return NextStepSuggestion.none(current);
        }
        NextStepSuggestion.ApplicableTransform best = applicable.get(0);
        return new NextStepSuggestion(true, best.tag(), best.description(), current, List.copyOf(applicable));
    }

    /**
     * Extracts the steps from text and runs {@link #suggestNextStep(List)}.
     * @param text The derivation text.
     * @return The suggestion.
     */
    public NextStepSuggestion suggestNextStepFromText(String text) {
        return suggestNextStep(StepExtractor.extract(text));
    }

    /**
     * Computes a simplification path with the configured step budget.
     * @param expression The expression text.
     * @return The path.
     */
    public SimplificationPath simplificationPath(String expression) {
        return simplificationPath(expression, defaultMaxSteps);
    }

    /**
     * Computes a simplification path.
     * @param expression The expression text.
     * @param maxSteps The maximum number of steps.
     * @return The path; {@code success} is false if the expression does not parse.
     * @throws IllegalArgumentException if {@code maxSteps} is negative.
     */
    public SimplificationPath simplificationPath(String expression, int maxSteps) {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must not be negative: " + maxSteps);
        }
        ParseResult parsed = reader.read(expression);
        if (!parsed.success()) {
            return SimplificationPath.unparsable(expression);
        }
        Expr current = parsed.expression();
        String currentText = formatter.format(current);
        List<SimplificationStep> steps = new ArrayList<>();
        while (steps.size() < maxSteps) {
            Optional<Applied> next = applyFirst(current);
            if (next.isEmpty()) {
                break;
            }
            String after = formatter.format(next.get().result());
            ITransformRule rule = next.get().rule();
            steps.add(new SimplificationStep(steps.size() + 1, currentText, after, rule.tag(), rule.description()));
            current = next.get().result();
            currentText = after;
        }
        boolean fullySimplified = applyFirst(current).isEmpty() && !walker.anyMatch(current, Simplifier::isZeroPowerZero);
        LOG.debug("Simplification path for '{}' ended after {} step(s), fully simplified: {}",
                expression, steps.size(), fullySimplified);
        return new SimplificationPath(true, expression, currentText, List.copyOf(steps), fullySimplified, steps.size());
    }

    /**
     * @param tree A tree.
     * @return The rules that apply somewhere in the tree, highest priority first.
     */
    public List<ITransformRule> applicableRules(Expr tree) {
        List<ITransformRule> applicable = new ArrayList<>();
        for (ITransformRule rule : catalog.rules()) {
            if (walker.anyMatch(tree, rule::matches)) {
                applicable.add(rule);
            }
        }
        return applicable;
    }

    private Optional<Applied> applyFirst(Expr tree) {
        for (ITransformRule rule : catalog.rules()) {
            if (rule.isSuggestOnly()) {
                continue;
            }
            Optional<Expr> rewritten = walker.rewriteFirst(tree, rule::rewrite);
            if (rewritten.isPresent()) {
                return Optional.of(new Applied(rule, rewritten.get()));
            }
        }
        return Optional.empty();
    }

    private record Applied(ITransformRule rule, Expr result) {
    }
}
