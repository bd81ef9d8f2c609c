package com.specforge.core.ai;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call generation parameters.
 *
 * @param model model identifier, or {@code null} for the provider default
 * @param maxTokens upper bound on generated tokens
 * @param temperature sampling temperature
 * @param timeout overall time allowed for one attempt
 */
public record GenerationOptions(
    String model,
    int maxTokens,
    double temperature,
    Duration timeout
) {
    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final double DEFAULT_TEMPERATURE = 0.2;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    /**
     * Compact constructor with validation.
     */
    public GenerationOptions {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(null, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE, DEFAULT_TIMEOUT);
    }

    public GenerationOptions withModel(String newModel) {
        return new GenerationOptions(newModel, maxTokens, temperature, timeout);
    }

    public GenerationOptions withTimeout(Duration newTimeout) {
        return new GenerationOptions(model, maxTokens, temperature, newTimeout);
    }
}
