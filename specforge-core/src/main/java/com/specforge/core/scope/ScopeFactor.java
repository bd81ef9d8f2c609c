package com.specforge.core.scope;

import java.util.Objects;

/**
 * One weighted indicator contributing to a scope assessment.
 *
 * @param name indicator name (e.g. {@code manyRequirements})
 * @param description human-readable description
 * @param count observed count
 * @param threshold count at which the indicator starts contributing
 * @param weight indicator weight
 * @param value contribution to the total score; 0 when below threshold
 */
public record ScopeFactor(
    String name,
    String description,
    int count,
    double threshold,
    double weight,
    double value
) {
    /**
     * Compact constructor with validation.
     */
    public ScopeFactor {
        Objects.requireNonNull(name, "name must not be null");
        if (description == null) {
            description = "";
        }
    }

    public boolean contributes() {
        return value > 0;
    }
}
