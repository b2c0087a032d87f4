package org.localcompute.algebra.equivalence;

import org.localcompute.algebra.config.EngineConfig;
import org.localcompute.algebra.eval.EvalResult;
import org.localcompute.algebra.eval.Evaluator;
import org.localcompute.algebra.format.ExpressionFormatter;
import org.localcompute.algebra.frontend.ExpressionReader;
import org.localcompute.algebra.frontend.parser.ParseResult;
import org.localcompute.algebra.frontend.parser.ast.Expr;
import org.localcompute.algebra.simplify.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.TreeSet;

/**
 * Decides whether two expressions are equivalent by simplification followed by numeric sampling.
 * <p>
 * The check is probabilistic: two expressions that agree on every sampled point are reported as
 * equivalent. Sample values are non-integers of both signs, so coincidences at small integers
 * (where e.g. {@code x^2} and {@code 2x} agree) are avoided. The random generator is seeded from the
 * configuration, which makes every verdict reproducible.
 */
public class EquivalenceChecker {

    private static final Logger LOG = LoggerFactory.getLogger(EquivalenceChecker.class);
    private static final double MIN_DISTANCE_FROM_INTEGER = 0.05;

    private final EngineConfig config;
    private final ExpressionReader reader;
    private final Evaluator evaluator;
    private final Simplifier simplifier;

    public EquivalenceChecker(EngineConfig config) {
        this(config, new ExpressionReader(config.maxNestingDepth()), new Evaluator(), new Simplifier());
    }

    public EquivalenceChecker(EngineConfig config, ExpressionReader reader, Evaluator evaluator, Simplifier simplifier) {
        this.config = config;
        this.reader = reader;
        this.evaluator = evaluator;
        this.simplifier = simplifier;
    }

    /**
     * @param a The first expression text.
     * @param b The second expression text.
     * @return Whether the expressions are equivalent.
     */
    public boolean areEquivalent(String a, String b) {
        return check(a, b).equivalent();
    }

    /**
     * Compares two expression texts. A side that fails to parse makes them non-equivalent.
     * @param a The first expression text.
     * @param b The second expression text.
     * @return The verdict with its detail.
     */
    public EquivalenceReport check(String a, String b) {
        ParseResult left = reader.read(a);
        if (!left.success()) {
            return EquivalenceReport.of(false, "Cannot parse '" + a + "': " + left.error().message());
        }
        ParseResult right = reader.read(b);
        if (!right.success()) {
            return EquivalenceReport.of(false, "Cannot parse '" + b + "': " + right.error().message());
        }
        return check(left.expression(), right.expression());
    }

    /**
     * Compares two trees.
     * @param a The first tree.
     * @param b The second tree.
     * @return The verdict with its detail.
     */
    public EquivalenceReport check(Expr a, Expr b) {
        Expr left = simplifier.simplify(a);
        Expr right = simplifier.simplify(b);
        Set<String> variables = new TreeSet<>(left.freeVariables());
        variables.addAll(right.freeVariables());
        if (variables.isEmpty()) {
            return compareConstants(left, right);
        }
        // equal trees only count when they denote a value somewhere, x/0 never does
        if (left.equals(right) && isDefinedSomewhere(left, variables)) {
            return EquivalenceReport.of(true, "Structurally identical after simplification");
        }
        return sample(left, right, variables);
    }

    private boolean isDefinedSomewhere(Expr tree, Set<String> variables) {
        SplittableRandom random = new SplittableRandom(config.equivalenceSeed());
        int maxAttempts = config.equivalenceTrials() * config.attemptsFactor();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Map<String, Double> bindings = new HashMap<>();
            for (String variable : variables) {
                bindings.put(variable, nextSample(random));
            }
            if (evaluator.evaluate(tree, bindings).success()) {
                return true;
            }
        }
        return false;
    }

    private EquivalenceReport compareConstants(Expr left, Expr right) {
        EvalResult l = evaluator.evaluate(left, Map.of());
        EvalResult r = evaluator.evaluate(right, Map.of());
        if (!l.success() || !r.success()) {
            return new EquivalenceReport(false, 0, 1, "Constant expression is undefined");
        }
        boolean equal = close(l.value(), r.value());
        return new EquivalenceReport(equal, 1, 0, equal
                ? "Constant values agree"
                : "Constant values differ: " + ExpressionFormatter.formatNumber(l.value())
                + " vs " + ExpressionFormatter.formatNumber(r.value()));
    }

    private EquivalenceReport sample(Expr left, Expr right, Set<String> variables) {
        SplittableRandom random = new SplittableRandom(config.equivalenceSeed());
        int wanted = config.equivalenceTrials();
        int maxAttempts = wanted * config.attemptsFactor();
        int evaluated = 0;
        int skipped = 0;

        for (int attempt = 0; attempt < maxAttempts && evaluated < wanted; attempt++) {
            Map<String, Double> bindings = new HashMap<>();
            for (String variable : variables) {
                bindings.put(variable, nextSample(random));
            }
            EvalResult l = evaluator.evaluate(left, bindings);
            EvalResult r = evaluator.evaluate(right, bindings);
            if (!l.success() || !r.success()) {
                skipped++;
                continue;
            }
            evaluated++;
            if (!close(l.value(), r.value())) {
                LOG.trace("Sample {} separates the expressions: {} vs {}", bindings, l.value(), r.value());
                return new EquivalenceReport(false, evaluated, skipped, "Values differ at " + bindings);
            }
        }

        int required = Math.max(1, (wanted + 1) / 2);
        if (evaluated < required) {
            LOG.debug("Only {} of {} sample points could be evaluated", evaluated, wanted);
            return new EquivalenceReport(false, evaluated, skipped,
                    "Too few sample points in the common domain (" + evaluated + " of " + wanted + ")");
        }
        return new EquivalenceReport(true, evaluated, skipped, "All " + evaluated + " sampled points agree");
    }

    private double nextSample(SplittableRandom random) {
        double magnitude;
        do {
            magnitude = config.sampleMin() + random.nextDouble() * (config.sampleMax() - config.sampleMin());
        } while (Math.abs(magnitude - Math.rint(magnitude)) < MIN_DISTANCE_FROM_INTEGER);
        return random.nextInt(3) == 0 ? -magnitude : magnitude;
    }

    private boolean close(double a, double b) {
        double scale = Math.max(1.0, Math.max(Math.abs(a), Math.abs(b)));
        return Math.abs(a - b) <= config.equivalenceTolerance() * scale;
    }
}
