package org.localcompute.algebra.derivation.mistakes;

import org.localcompute.algebra.derivation.mistakes.checks.CancellationErrorCheck;
import org.localcompute.algebra.derivation.mistakes.checks.ChainRuleErrorCheck;
import org.localcompute.algebra.derivation.mistakes.checks.CoefficientErrorCheck;
import org.localcompute.algebra.derivation.mistakes.checks.DistributionErrorCheck;
import org.localcompute.algebra.derivation.mistakes.checks.ExponentErrorCheck;
import org.localcompute.algebra.derivation.mistakes.checks.FractionErrorCheck;
import org.localcompute.algebra.derivation.mistakes.checks.PowerRuleErrorCheck;
import org.localcompute.algebra.derivation.mistakes.checks.ProductRuleErrorCheck;
import org.localcompute.algebra.derivation.mistakes.checks.SignErrorCheck;
import org.localcompute.algebra.derivation.mistakes.checks.SubtractionDistributionErrorCheck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A registry of mistake checks in the order they are tried. Algebraic checks run on ordinary
 * steps, calculus checks on steps whose left side asks for a derivative.
 */
public class MistakeCheckRegistry {

    private final List<IMistakeCheck> algebraicChecks = new ArrayList<>();
    private final List<IMistakeCheck> calculusChecks = new ArrayList<>();

    /**
     * Registers a check for ordinary steps. Checks are tried in registration order.
     * @param check The check.
     */
    public void registerAlgebraic(IMistakeCheck check) {
        algebraicChecks.add(check);
    }

    /**
     * Registers a check for derivative steps. Checks are tried in registration order.
     * @param check The check.
     */
    public void registerCalculus(IMistakeCheck check) {
        calculusChecks.add(check);
    }

    /**
     * @param derivativeStep Whether the step asks for a derivative.
     * @return The checks that apply, in order.
     */
    public List<IMistakeCheck> checksFor(boolean derivativeStep) {
        return Collections.unmodifiableList(derivativeStep ? calculusChecks : algebraicChecks);
    }

    /**
     * Initializes a registry with the full mistake catalogue.
     * @return The initialized registry.
     */
    public static MistakeCheckRegistry initialize() {
        MistakeCheckRegistry registry = new MistakeCheckRegistry();
        registry.registerAlgebraic(new SignErrorCheck());
        registry.registerAlgebraic(new SubtractionDistributionErrorCheck());
        registry.registerAlgebraic(new DistributionErrorCheck());
        registry.registerAlgebraic(new CancellationErrorCheck());
        registry.registerAlgebraic(new CoefficientErrorCheck());
        registry.registerAlgebraic(new ExponentErrorCheck());
        registry.registerAlgebraic(new FractionErrorCheck());
        registry.registerCalculus(new PowerRuleErrorCheck());
        registry.registerCalculus(new ChainRuleErrorCheck());
        registry.registerCalculus(new ProductRuleErrorCheck());
        return registry;
    }
}
