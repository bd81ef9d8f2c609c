package com.specforge.core.runstate;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A run document together with the directory it lives in.
 *
 * @param runDir run directory
 * @param state run document
 */
public record RunRecord(Path runDir, RunState state) {

    /**
     * Compact constructor with validation.
     */
    public RunRecord {
        Objects.requireNonNull(runDir, "runDir must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }

    public RunRecord withState(RunState newState) {
        return new RunRecord(runDir, newState);
    }
}
