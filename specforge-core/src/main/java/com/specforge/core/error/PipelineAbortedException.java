package com.specforge.core.error;

/**
 * A run was cancelled between phases.
 *
 * <p>Raised by {@code CancellationToken#throwIfAborted(String)} and caught by the orchestrator,
 * which records the run as {@code aborted} and leaves it resumable.
 */
public class PipelineAbortedException extends SpecForgeException {

    private final String nextPhase;

    public PipelineAbortedException(String nextPhase) {
        super(ErrorCode.PIPELINE_ABORTED, "Pipeline aborted before phase '" + nextPhase + "'");
        this.nextPhase = nextPhase;
    }

    public String getNextPhase() {
        return nextPhase;
    }
}
