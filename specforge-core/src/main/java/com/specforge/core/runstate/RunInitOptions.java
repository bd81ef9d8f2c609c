package com.specforge.core.runstate;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Options for starting a new run.
 *
 * @param baseDir directory holding run directories
 * @param runId explicit run id, or null to generate one
 * @param steps step names in execution order
 * @param config invocation options to record
 */
public record RunInitOptions(
    Path baseDir,
    String runId,
    List<String> steps,
    RunConfig config
) {
    /**
     * Compact constructor with validation.
     */
    public RunInitOptions {
        Objects.requireNonNull(baseDir, "baseDir must not be null");
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (config == null) {
            config = RunConfig.empty();
        }
    }
}
