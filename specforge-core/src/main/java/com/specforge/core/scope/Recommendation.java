package com.specforge.core.scope;

import java.util.Objects;

/**
 * Advice attached to a scope assessment.
 *
 * @param type recommendation type (e.g. {@code persona-split})
 * @param priority {@code high}, {@code medium}, {@code low} or {@code info}
 * @param title short title
 * @param description explanation
 */
public record Recommendation(
    String type,
    String priority,
    String title,
    String description
) {
    /**
     * Compact constructor with validation.
     */
    public Recommendation {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(title, "title must not be null");
        if (description == null) {
            description = "";
        }
    }
}
