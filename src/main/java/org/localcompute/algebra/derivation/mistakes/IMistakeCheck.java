package org.localcompute.algebra.derivation.mistakes;

import java.util.Optional;

/**
 * Interface for a single entry of the mistake catalogue.
 */
@FunctionalInterface
public interface IMistakeCheck {

    /**
     * Examines a step whose two sides are known not to be equivalent.
     *
     * @param step The step under examination.
     * @return The mistake, or empty if the step does not show this kind of mistake.
     */
    Optional<MistakeRecord> check(StepContext step);
}
