package com.specforge.core.pipeline;

import com.specforge.core.error.PipelineAbortedException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Abort signal for a running pipeline, checked immediately before each phase starts.
 *
 * <p>Safe to trigger from another thread, such as a shutdown hook. A phase already
 * running is not interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean aborted = new AtomicBoolean();

    public void abort() {
        aborted.set(true);
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Throws if the run has been aborted.
     *
     * @param nextPhase phase that was about to start
     * @throws PipelineAbortedException if {@link #abort()} was called
     */
    public void throwIfAborted(String nextPhase) {
        if (aborted.get()) {
            throw new PipelineAbortedException(nextPhase);
        }
    }
}
