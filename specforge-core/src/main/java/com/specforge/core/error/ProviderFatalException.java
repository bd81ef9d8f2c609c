package com.specforge.core.error;

/**
 * Authentication or invalid-request class failure from an AI provider. Never retried.
 */
public class ProviderFatalException extends SpecForgeException {

    public ProviderFatalException(String message) {
        super(ErrorCode.PROVIDER_FATAL, message);
    }

    public ProviderFatalException(String message, Throwable cause) {
        super(ErrorCode.PROVIDER_FATAL, message, cause);
    }
}
