package com.specforge.core.scope;

import java.util.List;
import java.util.Objects;

/**
 * Advisory result of scope analysis. Never blocks pipeline progression.
 *
 * @param shouldSplit whether splitting the specification is recommended
 * @param score total weighted score
 * @param factors every evaluated indicator, contributing or not
 * @param confidence confidence in the recommendation
 * @param recommendations human-readable advice
 */
public record ScopeAssessment(
    boolean shouldSplit,
    double score,
    List<ScopeFactor> factors,
    SplitConfidence confidence,
    List<Recommendation> recommendations
) {
    /**
     * Compact constructor with validation.
     */
    public ScopeAssessment {
        Objects.requireNonNull(confidence, "confidence must not be null");
        factors = factors == null ? List.of() : List.copyOf(factors);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    /**
     * Returns only the factors with a non-zero contribution.
     *
     * @return contributing factors
     */
    public List<ScopeFactor> contributingFactors() {
        return factors.stream().filter(ScopeFactor::contributes).toList();
    }

    /**
     * Finds a factor by name.
     *
     * @param name factor name
     * @return factor, or null when not evaluated
     */
    public ScopeFactor factor(String name) {
        return factors.stream().filter(f -> f.name().equals(name)).findFirst().orElse(null);
    }
}
