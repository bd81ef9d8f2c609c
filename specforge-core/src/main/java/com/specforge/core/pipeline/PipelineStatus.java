package com.specforge.core.pipeline;

import com.specforge.core.runstate.RunRecord;
import com.specforge.core.runstate.RunState;
import com.specforge.core.runstate.RunStatus;
import com.specforge.core.runstate.StepStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Progress summary of a run.
 *
 * @param runId run identifier
 * @param runDir run directory
 * @param status overall run status
 * @param currentPhase first phase that is not terminal, or {@code null}
 * @param completed completed phases
 * @param pending pending or running phases
 * @param failed failed phases
 * @param skipped skipped phases
 */
public record PipelineStatus(
    String runId,
    Path runDir,
    RunStatus status,
    String currentPhase,
    List<String> completed,
    List<String> pending,
    List<String> failed,
    List<String> skipped
) {
    /**
     * Compact constructor with validation.
     */
    public PipelineStatus {
        completed = completed == null ? List.of() : List.copyOf(completed);
        pending = pending == null ? List.of() : List.copyOf(pending);
        failed = failed == null ? List.of() : List.copyOf(failed);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    /**
     * Summarizes a persisted run.
     *
     * @param run run directory and state
     * @return status summary
     */
    public static PipelineStatus of(RunRecord run) {
        RunState state = run.state();
        List<String> waiting = state.steps().entrySet().stream()
            .filter(entry -> !entry.getValue().status().isTerminal())
            .map(Map.Entry::getKey)
            .toList();
        return new PipelineStatus(
            state.runId(),
            run.runDir(),
            state.status(),
            state.firstNonTerminalStep(),
            state.stepsIn(StepStatus.COMPLETED),
            waiting,
            state.stepsIn(StepStatus.FAILED),
            state.stepsIn(StepStatus.SKIPPED));
    }
}
