package com.specforge.core.ai;

import com.specforge.core.error.ProviderFatalException;

/**
 * Provider used when no AI backend is configured. Every call fails fatally, so phases that
 * need generation fail with a clear message while the rest of the pipeline keeps working.
 */
public final class UnavailableAiProvider implements AiProvider {

    @Override
    public String name() {
        return "none";
    }

    @Override
    public GenerationResult generate(String systemPrompt, String userPrompt, GenerationOptions options) {
        throw new ProviderFatalException(
            "No AI provider is configured; skip AI phases or supply an AiProvider implementation");
    }
}
