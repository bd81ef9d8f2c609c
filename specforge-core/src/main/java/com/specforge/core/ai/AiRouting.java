package com.specforge.core.ai;

import java.util.Map;

/**
 * Per-phase model selection.
 *
 * <p>A phase listed in {@code phaseModels} uses its own model; every other phase uses
 * {@code defaultModel}. A {@code null} default leaves the choice to the provider.
 *
 * @param defaultModel model for phases without an override
 * @param phaseModels phase name to model overrides
 */
public record AiRouting(String defaultModel, Map<String, String> phaseModels) {

    /**
     * Compact constructor with validation.
     */
    public AiRouting {
        phaseModels = phaseModels == null ? Map.of() : Map.copyOf(phaseModels);
    }

    public static AiRouting defaults() {
        return new AiRouting(null, Map.of());
    }

    /**
     * Resolves the model for a phase.
     *
     * @param phaseName phase name
     * @return model identifier, possibly {@code null}
     */
    public String modelFor(String phaseName) {
        return phaseModels.getOrDefault(phaseName, defaultModel);
    }

    /**
     * Applies this routing to base options for a phase.
     *
     * @param phaseName phase name
     * @param base options to start from
     * @return options carrying the resolved model
     */
    public GenerationOptions optionsFor(String phaseName, GenerationOptions base) {
        String model = modelFor(phaseName);
        return model == null ? base : base.withModel(model);
    }
}
