package com.specforge.core.model;

import java.util.Optional;

/**
 * Declared implementation complexity of a specification.
 *
 * <p>Drives which gates apply, which sections are required and how aggressively the scope
 * analyzer recommends splitting.
 *
 * @since 1.0.0
 */
public enum Complexity {
    /** Small, self-contained change. */
    EASY,
    /** Multi-component feature with security implications. */
    MODERATE,
    /** Cross-cutting feature; requires deterministic tests and a complete specification. */
    HIGH;

    /**
     * Parses a front-matter value. Only exact upper-case names are accepted.
     *
     * @param value raw front-matter value (may be null or a non-string)
     * @return the complexity, or empty if the value is not a valid name
     */
    public static Optional<Complexity> fromValue(Object value) {
        if (!(value instanceof String text)) {
            return Optional.empty();
        }
        for (Complexity complexity : values()) {
            if (complexity.name().equals(text)) {
                return Optional.of(complexity);
            }
        }
        return Optional.empty();
    }
}
