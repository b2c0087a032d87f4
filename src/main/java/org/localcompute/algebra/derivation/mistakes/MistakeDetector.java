package org.localcompute.algebra.derivation.mistakes;

import org.localcompute.algebra.derivation.DerivationStep;
import org.localcompute.algebra.derivation.StepExtractor;
import org.localcompute.algebra.derivation.calculus.DerivativeCalculator;
import org.localcompute.algebra.derivation.calculus.DerivativeStatement;
import org.localcompute.algebra.equivalence.EquivalenceChecker;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.lexer.Lexer;
import org.localcompute.algebra.frontend.lexer.TokenizeResult;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the mistake catalogue over every step of a derivation. Steps whose sides are equivalent
 * are skipped; for every other step the first matching check wins.
 */
public class MistakeDetector {

    private static final Logger LOG = LoggerFactory.getLogger(MistakeDetector.class);

    private final MistakeCheckRegistry registry;
    private final ExpressionReader reader;
    private final EquivalenceChecker equivalence;
    private final Simplifier simplifier;
    private final ExpressionFormatter formatter;
    private final DerivativeCalculator calculator;

    public MistakeDetector(MistakeCheckRegistry registry, ExpressionReader reader, EquivalenceChecker equivalence,
                           Simplifier simplifier, ExpressionFormatter formatter) {
        this.registry = registry;
        this.reader = reader;
        this.equivalence = equivalence;
        this.simplifier = simplifier;
        this.formatter = formatter;
        this.calculator = new DerivativeCalculator(reader, simplifier, formatter);
    }

    /**
     * @param steps The derivation steps.
     * @return The mistakes found, at most one per step.
     */
    public MistakeDetectionResult detect(List<DerivationStep> steps) {
        List<MistakeRecord> mistakes = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            DerivationStep step = steps.get(i);
            if (equivalence.areEquivalent(step.lhs(), step.rhs())) {
                continue;
            }
            StepContext context = context(i + 1, step);
            for (IMistakeCheck check : registry.checksFor(context.isDerivative())) {
                Optional<MistakeRecord> mistake = check.check(context);
                if (mistake.isPresent()) {
                    LOG.debug("Step {}: {} ({})", i + 1, mistake.get().type().tag(), check.getClass().getSimpleName());
                    mistakes.add(mistake.get());
                    break;
                }
            }
        }
        Integer first = mistakes.isEmpty() ? null : mistakes.get(0).stepNumber();
        return new MistakeDetectionResult(!mistakes.isEmpty(), mistakes, first, summary(mistakes));
    }

    /**
     * Extracts the steps from text and runs {@link #detect(List)}.
     * @param text The derivation text.
     * @return The mistakes found.
     */
    public MistakeDetectionResult detectFromText(String text) {
        return detect(StepExtractor.extract(text));
    }

    private StepContext context(int stepNumber, DerivationStep step) {
        TokenizeResult tokens = Lexer.tokenize(step.lhs());
        String displayLhs = tokens.success() && !DerivativeStatement.isDerivative(step.lhs())
                ? formatter.formatTokens(tokens.tokens())
                : step.lhs().trim().replaceAll("\\s+", " ");
        return new StepContext(stepNumber, step.lhs(), step.rhs(), displayLhs,
                tree(step.lhs()), tree(step.rhs()), equivalence, simplifier, formatter, calculator);
    }

    private Expr tree(String text) {
        ParseResult parsed = reader.read(text);
        return parsed.success() ? parsed.expression() : null;
    }

    private static String summary(List<MistakeRecord> mistakes) {
        if (mistakes.isEmpty()) {
            return "No common mistakes detected.";
        }
        if (mistakes.size() == 1) {
            MistakeRecord m = mistakes.get(0);
            return "Found 1 potential mistake at step " + m.stepNumber() + ": " + m.type().words();
        }
        Set<String> types = new LinkedHashSet<>();
        mistakes.forEach(m -> types.add(m.type().words()));
        return "Found " + mistakes.size() + " potential mistakes: " + String.join(", ", types);
    }
}
