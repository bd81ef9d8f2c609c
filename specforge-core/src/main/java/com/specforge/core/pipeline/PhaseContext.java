package com.specforge.core.pipeline;

import com.specforge.core.model.Specification;
import com.specforge.core.runstate.RunStateStore;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Context provided to phases during execution.
 *
 * @param spec parsed specification
 * @param specPath absolute specification path
 * @param runId run identifier
 * @param runDir run directory
 * @param priorOutputs outputs of phases completed so far, keyed by phase name
 * @param options invocation options
 */
public record PhaseContext(
    Specification spec,
    Path specPath,
    String runId,
    Path runDir,
    Map<String, Map<String, String>> priorOutputs,
    PipelineOptions options
) {
    /**
     * Compact constructor with validation.
     */
    public PhaseContext {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(specPath, "specPath must not be null");
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(runDir, "runDir must not be null");
        Objects.requireNonNull(options, "options must not be null");
        priorOutputs = priorOutputs == null ? Map.of() : Map.copyOf(priorOutputs);
    }

    /**
     * Returns the run's artifacts directory.
     *
     * @return {@code <runDir>/artifacts}
     */
    public Path artifactsDir() {
        return runDir.resolve(RunStateStore.ARTIFACTS_DIR);
    }

    /**
     * Resolves a file name inside the artifacts directory.
     *
     * @param fileName artifact file name
     * @return artifact path
     */
    public Path artifact(String fileName) {
        return artifactsDir().resolve(fileName);
    }

    /**
     * Looks up an output recorded by an earlier phase.
     *
     * @param phase phase name
     * @param key output name
     * @return output value, or empty if the phase did not complete or did not record it
     */
    public Optional<String> output(String phase, String key) {
        return Optional.ofNullable(priorOutputs.getOrDefault(phase, Map.of()).get(key));
    }
}
