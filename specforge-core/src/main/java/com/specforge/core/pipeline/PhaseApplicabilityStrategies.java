package com.specforge.core.pipeline;

import com.specforge.core.model.Complexity;

/**
 * Factory for common phase applicability strategies.
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * // AI implementation only when not skipped
 * PhaseApplicabilityStrategy strategy = PhaseApplicabilityStrategies.notSkipped(SkipFlag.IMPLEMENTATION);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class PhaseApplicabilityStrategies {

    private PhaseApplicabilityStrategies() {
        // Utility class - prevent instantiation
    }

    /**
     * Strategy that always applies.
     *
     * @return strategy returning {@code true}
     */
    public static PhaseApplicabilityStrategy always() {
        return context -> true;
    }

    /**
     * Applies unless the caller set the given skip flag.
     *
     * @param flag skip flag
     * @return strategy
     */
    public static PhaseApplicabilityStrategy notSkipped(SkipFlag flag) {
        return context -> !context.isSkipped(flag);
    }

    /**
     * Applies when the declared complexity is the given one.
     *
     * @param complexity complexity to match
     * @return strategy
     */
    public static PhaseApplicabilityStrategy complexityIs(Complexity complexity) {
        return context -> context.complexity() == complexity;
    }

    /**
     * Applies when the declared maturity is at least the given level.
     *
     * @param level minimum maturity
     * @return strategy
     */
    public static PhaseApplicabilityStrategy maturityAtLeast(int level) {
        return context -> context.maturity() >= level;
    }

    /**
     * Applies to EASY specifications whose maturity is below the given level.
     *
     * @param level maturity bound (exclusive)
     * @return strategy
     */
    public static PhaseApplicabilityStrategy easyBelowMaturity(int level) {
        return complexityIs(Complexity.EASY).and(maturityAtLeast(level).negate());
    }
}
