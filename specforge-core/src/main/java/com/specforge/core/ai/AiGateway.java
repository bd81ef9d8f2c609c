package com.specforge.core.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * What pipeline phases call to generate content: a provider plus per-phase model routing.
 *
 * <p>The provider is normally a {@link ResilientAiProvider}, so phases see only successful
 * results or a final transient/fatal failure.
 *
 * @since 1.0.0
 */
public class AiGateway {

    private static final Logger log = LoggerFactory.getLogger(AiGateway.class);

    private final AiProvider provider;
    private final AiRouting routing;
    private final GenerationOptions defaults;

    public AiGateway(AiProvider provider, AiRouting routing, GenerationOptions defaults) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.routing = routing == null ? AiRouting.defaults() : routing;
        this.defaults = defaults == null ? GenerationOptions.defaults() : defaults;
    }

    /**
     * Gateway that fails every call; used when no provider is configured.
     *
     * @return unavailable gateway
     */
    public static AiGateway unavailable() {
        return new AiGateway(new UnavailableAiProvider(), AiRouting.defaults(), GenerationOptions.defaults());
    }

    public AiProvider provider() {
        return provider;
    }

    /**
     * Generates content on behalf of a phase, using that phase's routed model.
     *
     * @param phaseName calling phase
     * @param systemPrompt system instructions
     * @param userPrompt user message
     * @return generation result
     */
    public GenerationResult generate(String phaseName, String systemPrompt, String userPrompt) {
        GenerationOptions options = routing.optionsFor(phaseName, defaults);
        log.debug("Phase {} calling provider {} (model {})", phaseName, provider.name(), options.model());
        GenerationResult result = provider.generate(systemPrompt, userPrompt, options);
        log.info("Phase {} received {} tokens from {}", phaseName, result.tokens(), result.provider());
        return result;
    }
}
