package com.specforge.core.pipeline;

import com.specforge.core.runstate.RunRecord;
import com.specforge.core.runstate.RunStatus;
import com.specforge.core.runstate.StepStatus;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one orchestrator invocation.
 *
 * @param run final run directory and state
 * @param executed phases whose {@code run} was invoked by this invocation, in order
 * @param resumed whether an earlier unfinished run was continued
 */
public record PipelineResult(
    RunRecord run,
    List<String> executed,
    boolean resumed
) {
    /**
     * Compact constructor with validation.
     */
    public PipelineResult {
        Objects.requireNonNull(run, "run must not be null");
        executed = executed == null ? List.of() : List.copyOf(executed);
    }

    public String runId() {
        return run.state().runId();
    }

    public Path runDir() {
        return run.runDir();
    }

    public RunStatus status() {
        return run.state().status();
    }

    public List<String> failedPhases() {
        return run.state().stepsIn(StepStatus.FAILED);
    }

    public boolean isSuccessful() {
        return status() == RunStatus.COMPLETED || status() == RunStatus.STOPPED;
    }
}
