package com.specforge.core.runstate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The {@code run.json} document: progress of one pipeline run.
 *
 * <p>Immutable. Every change produces a new document that the store writes back
 * wholesale, so a reader never observes a partially updated run.
 *
 * @param version schema version
 * @param runId unique run identifier
 * @param specPath absolute path of the specification
 * @param specHash SHA-256 of the specification content at run start
 * @param status overall run status
 * @param steps step states in execution order
 * @param config invocation options
 * @param createdAt ISO-8601 creation time
 * @param updatedAt ISO-8601 time of the last write
 * @param completedAt ISO-8601 completion time, when completed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"version", "run_id", "spec_path", "spec_hash", "status", "steps", "config",
    "created_at", "updated_at", "completed_at"})
public record RunState(
    @JsonProperty("version") int version,
    @JsonProperty("run_id") String runId,
    @JsonProperty("spec_path") String specPath,
    @JsonProperty("spec_hash") String specHash,
    @JsonProperty("status") RunStatus status,
    @JsonProperty("steps") Map<String, StepState> steps,
    @JsonProperty("config") RunConfig config,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt,
    @JsonProperty("completed_at") String completedAt
) {
    public static final int SCHEMA_VERSION = 1;

    /**
     * Compact constructor with validation.
     */
    public RunState {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(specPath, "specPath must not be null");
        Objects.requireNonNull(specHash, "specHash must not be null");
        Objects.requireNonNull(status, "status must not be null");
        steps = steps == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        if (config == null) {
            config = RunConfig.empty();
        }
    }

    /**
     * Creates the initial document with every step pending.
     *
     * @param runId run identifier
     * @param specPath absolute specification path
     * @param specHash specification content hash
     * @param stepNames steps in execution order
     * @param config invocation options
     * @param now ISO-8601 creation time
     * @return initialized run state
     */
    public static RunState initial(String runId, String specPath, String specHash, List<String> stepNames,
                                   RunConfig config, String now) {
        Map<String, StepState> steps = new LinkedHashMap<>();
        stepNames.forEach(name -> steps.put(name, StepState.pending()));
        return new RunState(SCHEMA_VERSION, runId, specPath, specHash, RunStatus.INITIALIZED,
            steps, config, now, now, null);
    }

    /**
     * Returns the state of a step.
     *
     * @param name step name
     * @return step state, or a pending state for steps not yet recorded
     */
    public StepState step(String name) {
        return steps.getOrDefault(name, StepState.pending());
    }

    public RunState withStep(String name, StepState state, String now) {
        Map<String, StepState> updated = new LinkedHashMap<>(steps);
        updated.put(name, state);
        return new RunState(version, runId, specPath, specHash, status, updated, config, createdAt, now, completedAt);
    }

    public RunState withStatus(RunStatus newStatus, String now) {
        String completed = newStatus == RunStatus.COMPLETED ? now : completedAt;
        return new RunState(version, runId, specPath, specHash, newStatus, steps, config, createdAt, now, completed);
    }

    public RunState withConfig(RunConfig newConfig, String now) {
        return new RunState(version, runId, specPath, specHash, status, steps, newConfig, createdAt, now, completedAt);
    }

    /**
     * Returns the names of steps in the given status, in execution order.
     *
     * @param wanted status to filter on
     * @return step names
     */
    public List<String> stepsIn(StepStatus wanted) {
        return steps.entrySet().stream()
            .filter(entry -> entry.getValue().status() == wanted)
            .map(Map.Entry::getKey)
            .toList();
    }

    /**
     * Returns the first step that is not terminal.
     *
     * @return step name, or null when every step is terminal
     */
    @JsonIgnore
    public String firstNonTerminalStep() {
        return steps.entrySet().stream()
            .filter(entry -> !entry.getValue().status().isTerminal())
            .map(Map.Entry::getKey)
            .findFirst()
            .orElse(null);
    }
}
