package com.specforge.core.runstate;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of one pipeline step: {@code pending -> running -> completed | failed | skipped}.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    /**
     * Terminal states never transition again within the same run.
     *
     * @return true for completed, failed and skipped
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
