package com.specforge.core.ai;

import java.util.Objects;

/**
 * Content returned by an {@link AiProvider}.
 *
 * @param content generated text
 * @param tokens total tokens consumed, 0 when the provider does not report usage
 * @param provider name of the provider that produced the content
 * @param model model that produced the content
 */
public record GenerationResult(
    String content,
    long tokens,
    String provider,
    String model
) {
    /**
     * Compact constructor with validation.
     */
    public GenerationResult {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must not be negative");
        }
    }
}
