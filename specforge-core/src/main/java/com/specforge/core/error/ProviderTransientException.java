package com.specforge.core.error;

/**
 * Network or timeout class failure from an AI provider.
 *
 * <p>Eligible for bounded retry with backoff and, once retries are exhausted, fallback to a
 * secondary provider.
 */
public class ProviderTransientException extends SpecForgeException {

    public ProviderTransientException(String message) {
        super(ErrorCode.PROVIDER_TRANSIENT, message);
    }

    public ProviderTransientException(String message, Throwable cause) {
        super(ErrorCode.PROVIDER_TRANSIENT, message, cause);
    }

    public ProviderTransientException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
