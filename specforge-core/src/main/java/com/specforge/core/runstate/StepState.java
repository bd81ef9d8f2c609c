package com.specforge.core.runstate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.specforge.core.error.ErrorCode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state of one step inside {@code run.json}.
 *
 * <p>Transitions return new instances and reject moves out of a terminal state, so a
 * step can never go back from {@code completed}, {@code failed} or {@code skipped}
 * within one run.
 *
 * @param status current status
 * @param startedAt ISO-8601 start time, when the step has started
 * @param finishedAt ISO-8601 end time, when the step is terminal
 * @param error failure message, when failed
 * @param errorCode failure code, when failed
 * @param skipReason reason, when skipped
 * @param outputs step outputs, when completed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StepState(
    StepStatus status,
    String startedAt,
    String finishedAt,
    String error,
    String errorCode,
    String skipReason,
    Map<String, String> outputs
) {
    /**
     * Compact constructor with validation.
     */
    public StepState {
        Objects.requireNonNull(status, "status must not be null");
        if (outputs != null) {
            outputs = Map.copyOf(outputs);
        }
    }

    public static StepState pending() {
        return new StepState(StepStatus.PENDING, null, null, null, null, null, null);
    }

    public StepState start(String now) {
        requireStatus(StepStatus.PENDING, "start");
        return new StepState(StepStatus.RUNNING, now, null, null, null, null, null);
    }

    public StepState complete(String now, Map<String, String> stepOutputs) {
        requireStatus(StepStatus.RUNNING, "complete");
        return new StepState(StepStatus.COMPLETED, startedAt, now, null, null, null,
            stepOutputs == null ? Map.of() : new LinkedHashMap<>(stepOutputs));
    }

    public StepState fail(String now, ErrorCode code, String message) {
        requireNotTerminal("fail");
        return new StepState(StepStatus.FAILED, startedAt, now, message, code == null ? null : code.code(), null, null);
    }

    public StepState skip(String now, String reason) {
        requireStatus(StepStatus.PENDING, "skip");
        return new StepState(StepStatus.SKIPPED, null, now, null, null, reason, null);
    }

    /**
     * Returns a pending copy of a failed or interrupted step.
     *
     * <p>Only used when a later invocation resumes the run; this is what makes failed
     * runs resumable after remediation.
     *
     * @return pending state
     */
    public StepState resetForResume() {
        if (status != StepStatus.FAILED && status != StepStatus.RUNNING) {
            throw new IllegalStateException("Only failed or running steps can be reset, was " + status.value());
        }
        return pending();
    }

    private void requireStatus(StepStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException("Cannot " + action + " a step in state " + status.value());
        }
    }

    private void requireNotTerminal(String action) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot " + action + " a step in terminal state " + status.value());
        }
    }
}
