package com.specforge.core.runstate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall status of a run.
 */
public enum RunStatus {
    INITIALIZED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    STOPPED,
    ABORTED;

    /**
     * A finished run is not picked up for resumption.
     *
     * @return true for completed runs
     */
    public boolean isFinished() {
        return this == COMPLETED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RunStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
