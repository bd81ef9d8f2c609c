package com.specforge.core.testrun;

import java.util.Objects;

/**
 * One failing test reported by a test run.
 *
 * @param name test name as printed by the runner
 * @param detail first lines of the failure message, possibly empty
 */
public record TestFailure(String name, String detail) {

    /**
     * Compact constructor with validation.
     */
    public TestFailure {
        Objects.requireNonNull(name, "name must not be null");
        detail = detail == null ? "" : detail;
    }
}
