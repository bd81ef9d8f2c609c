package com.specforge.core.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result returned by a phase.
 *
 * @param success whether the phase succeeded
 * @param outputs named outputs recorded in {@code run.json} on success
 * @param message failure reason, or a short summary on success
 */
public record PhaseResult(
    boolean success,
    Map<String, String> outputs,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public PhaseResult {
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
    }

    public static PhaseResult success(Map<String, String> outputs) {
        return new PhaseResult(true, outputs, null);
    }

    public static PhaseResult success(Map<String, String> outputs, String message) {
        return new PhaseResult(true, outputs, message);
    }

    public static PhaseResult failure(String message) {
        return new PhaseResult(false, Map.of(), message);
    }
}
