package org.localcompute.algebra.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Immutable engine settings, read from the {@code algebra} block of the configuration.
 *
 * <pre>
 * algebra {
 *   parser.max-nesting-depth = 200
 *   equivalence {
 *     trials = 10
 *     tolerance = 1e-9
 *     seed = 738201
 *     attempts-factor = 4
 *     sample-min = 0.3
 *     sample-max = 2.7
 *   }
 *   suggestion.max-steps = 50
 * }
 * </pre>
 *
 * @param maxNestingDepth The maximum expression tree height. A flat chain such as {@code 1+1+1} is as tall as its term count.
 * @param equivalenceTrials The number of sampling trials an equivalence check evaluates.
 * @param equivalenceTolerance The relative tolerance for comparing sampled values.
 * @param equivalenceSeed The seed of the sampling random generator.
 * @param attemptsFactor How many attempts per wanted trial the checker may spend on skipped points.
 * @param sampleMin The smallest sampled magnitude.
 * @param sampleMax The largest sampled magnitude.
 * @param maxSimplificationSteps The default step budget of a simplification path.
 */
public record EngineConfig(
        int maxNestingDepth,
        int equivalenceTrials,
        double equivalenceTolerance,
        long equivalenceSeed,
        int attemptsFactor,
        double sampleMin,
        double sampleMax,
        int maxSimplificationSteps
) {

    /** The smallest number of sampling trials that gives a meaningful equivalence check. */
    public static final int MIN_TRIALS = 5;

    public EngineConfig {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("max-nesting-depth must be positive, got " + maxNestingDepth);
        }
        if (equivalenceTrials < MIN_TRIALS) {
            throw new IllegalArgumentException("equivalence trials must be at least " + MIN_TRIALS + ", got " + equivalenceTrials);
        }
        if (!(equivalenceTolerance > 0)) {
            throw new IllegalArgumentException("equivalence tolerance must be positive, got " + equivalenceTolerance);
        }
        if (attemptsFactor < 1) {
            throw new IllegalArgumentException("attempts-factor must be at least 1, got " + attemptsFactor);
        }
        if (!(sampleMin > 0) || !(sampleMax > sampleMin)) {
            throw new IllegalArgumentException("sample range must satisfy 0 < sample-min < sample-max, got ["
                    + sampleMin + ", " + sampleMax + "]");
        }
        if (maxSimplificationSteps < 1) {
            throw new IllegalArgumentException("max-steps must be positive, got " + maxSimplificationSteps);
        }
    }

    /**
     * Reads the settings from the {@code algebra} block.
     * @param config A resolved configuration that includes the reference defaults.
     * @return The settings.
     */
    public static EngineConfig fromConfig(Config config) {
        Config algebra = config.getConfig("algebra");
        return new EngineConfig(
                algebra.getInt("parser.max-nesting-depth"),
                algebra.getInt("equivalence.trials"),
                algebra.getDouble("equivalence.tolerance"),
                algebra.getLong("equivalence.seed"),
                algebra.getInt("equivalence.attempts-factor"),
                algebra.getDouble("equivalence.sample-min"),
                algebra.getDouble("equivalence.sample-max"),
                algebra.getInt("suggestion.max-steps"));
    }

    /**
     * @return The settings from {@code reference.conf} alone.
     */
    public static EngineConfig defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * @param trials The number of sampling trials.
     * @return A copy with a different trial count.
     */
    public EngineConfig withEquivalenceTrials(int trials) {
        return new EngineConfig(maxNestingDepth, trials, equivalenceTolerance, equivalenceSeed,
                attemptsFactor, sampleMin, sampleMax, maxSimplificationSteps);
    }

    /**
     * @param seed The sampling seed.
     * @return A copy with a different seed.
     */
    public EngineConfig withEquivalenceSeed(long seed) {
        return new EngineConfig(maxNestingDepth, equivalenceTrials, equivalenceTolerance, seed,
                attemptsFactor, sampleMin, sampleMax, maxSimplificationSteps);
    }
}
