package com.specforge.core.pipeline;

import com.specforge.core.model.Complexity;
import com.specforge.core.model.Specification;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Inputs to phase applicability decisions.
 *
 * @param complexity declared complexity, or {@code null} when absent or invalid
 * @param maturity declared maturity, 0 when absent or invalid
 * @param skipFlags caller-supplied skip flags
 */
public record ApplicabilityContext(
    Complexity complexity,
    int maturity,
    Set<SkipFlag> skipFlags
) {
    /**
     * Compact constructor with validation.
     */
    public ApplicabilityContext {
        skipFlags = skipFlags == null || skipFlags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(skipFlags));
    }

    /**
     * Builds a context from a parsed specification.
     *
     * @param spec parsed specification
     * @param skipFlags skip flags in effect
     * @return applicability context
     */
    public static ApplicabilityContext of(Specification spec, Set<SkipFlag> skipFlags) {
        Objects.requireNonNull(spec, "spec must not be null");
        return new ApplicabilityContext(spec.complexity().orElse(null), spec.maturity().orElse(0), skipFlags);
    }

    public boolean isSkipped(SkipFlag flag) {
        return skipFlags.contains(flag);
    }
}
