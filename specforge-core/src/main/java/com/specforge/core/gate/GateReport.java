package com.specforge.core.gate;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates checks and violations during one gate evaluation.
 *
 * <p>Created per call, so gates themselves stay stateless.
 */
final class GateReport {

    private final GateId gate;
    private final List<GateCheck> checks = new ArrayList<>();
    private final List<Violation> violations = new ArrayList<>();

    GateReport(GateId gate) {
        this.gate = gate;
    }

    /**
     * Records a check; a failed check also records one violation.
     */
    boolean check(String name, boolean passed, String passMessage, String code, String failMessage, String location) {
        checks.add(new GateCheck(name, passed, passed ? passMessage : failMessage));
        if (!passed) {
            violations.add(new Violation(code, failMessage, location));
        }
        return passed;
    }

    /**
     * Records a check whose violations are reported separately via {@link #violation}.
     */
    void summary(String name, boolean passed, String message) {
        checks.add(new GateCheck(name, passed, message));
    }

    void violation(String code, String message, String location) {
        violations.add(new Violation(code, message, location));
    }

    GateResult result() {
        return GateResult.of(gate, checks, violations);
    }
}
