package com.specforge.core.model;

import com.specforge.core.error.ErrorCode;

import java.util.Objects;

/**
 * A non-fatal structural fault recorded while parsing a specification.
 *
 * <p>The affected element is dropped from the parsed record; gates report it as a violation.
 *
 * @param code fault code
 * @param message human-readable description
 * @param location section or block the fault was found in
 */
public record ParseIssue(
    ErrorCode code,
    String message,
    String location
) {
    /**
     * Compact constructor with validation.
     */
    public ParseIssue {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
