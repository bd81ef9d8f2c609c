package com.specforge.core.pipeline;

/**
 * Strategy for determining if a phase should run for a given specification and skip flags.
 *
 * <p>This interface supports composition via {@link #and(PhaseApplicabilityStrategy)}
 * and {@link #or(PhaseApplicabilityStrategy)} for building complex applicability rules.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * PhaseApplicabilityStrategy strategy =
 *     PhaseApplicabilityStrategies.notSkipped(SkipFlag.REVIEW)
 *         .and(PhaseApplicabilityStrategies.easyBelowMaturity(3).negate());
 * }</pre>
 *
 * @see PhaseApplicabilityStrategies
 * @since 1.0.0
 */
@FunctionalInterface
public interface PhaseApplicabilityStrategy {

    /**
     * Check if the phase should run in the given context.
     *
     * @param context specification complexity, maturity and skip flags
     * @return {@code true} if the phase should run, {@code false} otherwise
     */
    boolean test(ApplicabilityContext context);

    /**
     * Combine this strategy with another using AND logic.
     *
     * @param other the other strategy to combine with
     * @return a new strategy that is the logical AND of this and the other strategy
     */
    default PhaseApplicabilityStrategy and(PhaseApplicabilityStrategy other) {
        return context -> this.test(context) && other.test(context);
    }

    /**
     * Combine this strategy with another using OR logic.
     *
     * @param other the other strategy to combine with
     * @return a new strategy that is the logical OR of this and the other strategy
     */
    default PhaseApplicabilityStrategy or(PhaseApplicabilityStrategy other) {
        return context -> this.test(context) || other.test(context);
    }

    /**
     * Negate this strategy.
     *
     * @return a new strategy that is the logical negation of this strategy
     */
    default PhaseApplicabilityStrategy negate() {
        return context -> !this.test(context);
    }
}
