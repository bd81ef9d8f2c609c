package com.specforge.core.gate;

import java.util.Objects;

/**
 * A gate finding that blocks agent-ready status.
 *
 * <p>Violations are values, never exceptions.
 *
 * @param code machine-readable code (e.g. {@code G1_MISSING_SECTION})
 * @param message human-readable description
 * @param location section, field or identifier the violation refers to; may be null
 */
public record Violation(
    String code,
    String message,
    String location
) {
    /**
     * Compact constructor with validation.
     */
    public Violation {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
