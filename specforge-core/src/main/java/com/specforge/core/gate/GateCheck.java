package com.specforge.core.gate;

import java.util.Objects;

/**
 * One named check performed by a gate.
 *
 * @param name check name
 * @param passed whether the check passed
 * @param message outcome description
 */
public record GateCheck(
    String name,
    boolean passed,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public GateCheck {
        Objects.requireNonNull(name, "name must not be null");
        if (message == null) {
            message = "";
        }
    }
}
