package com.specforge.core.ai;

import com.specforge.core.error.ProviderFatalException;
import com.specforge.core.error.ProviderTransientException;

/**
 * The one operation the pipeline needs from an AI backend.
 *
 * <p>Implementations signal failure categories through exceptions:
 * {@link ProviderTransientException} for network or timeout class failures that may succeed
 * on retry, {@link ProviderFatalException} for authentication or invalid-request failures
 * that will not.
 */
public interface AiProvider {

    /**
     * Provider name recorded on results and in logs (e.g. {@code "claude"}).
     *
     * @return provider name
     */
    String name();

    /**
     * Generates a completion.
     *
     * @param systemPrompt system instructions
     * @param userPrompt user message
     * @param options model and limits for this call
     * @return generated content and usage
     * @throws ProviderTransientException on retryable failure
     * @throws ProviderFatalException on non-retryable failure
     */
    GenerationResult generate(String systemPrompt, String userPrompt, GenerationOptions options);
}
