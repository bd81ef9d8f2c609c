package com.specforge.core.error;

import java.util.Objects;

/**
 * Base class for all SpecForge failures.
 *
 * <p>Unchecked; carries an {@link ErrorCode} so every failure has a machine-readable code
 * and remediation guidance. Gate violations are never exceptions; see
 * {@link com.specforge.core.gate.Violation}.
 */
public class SpecForgeException extends RuntimeException {

    private final ErrorCode errorCode;

    public SpecForgeException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public SpecForgeException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getRemediation() {
        return errorCode.remediation();
    }
}
