package com.specforge.core.gate;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one gate over one specification.
 *
 * <p>{@code passed} is true exactly when there are no violations. {@code score} is the
 * percentage of passing checks (0-100), used for the readiness score.
 *
 * @param gate gate identifier
 * @param name gate display name
 * @param passed whether the gate passed
 * @param checks individual checks, in evaluation order
 * @param violations blocking findings
 * @param score percentage of passing checks
 */
public record GateResult(
    GateId gate,
    String name,
    boolean passed,
    List<GateCheck> checks,
    List<Violation> violations,
    int score
) {
    /**
     * Compact constructor with validation.
     */
    public GateResult {
        Objects.requireNonNull(gate, "gate must not be null");
        if (name == null) {
            name = gate.displayName();
        }
        checks = checks == null ? List.of() : List.copyOf(checks);
        violations = violations == null ? List.of() : List.copyOf(violations);
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be between 0 and 100");
        }
    }

    /**
     * Builds a result whose pass flag and score are derived from its checks and violations.
     *
     * @param gate gate identifier
     * @param checks checks performed
     * @param violations violations found
     * @return gate result
     */
    public static GateResult of(GateId gate, List<GateCheck> checks, List<Violation> violations) {
        long passing = checks.stream().filter(GateCheck::passed).count();
        int score = checks.isEmpty()
            ? (violations.isEmpty() ? 100 : 0)
            : (int) Math.round(passing * 100.0 / checks.size());
        return new GateResult(gate, gate.displayName(), violations.isEmpty(), checks, violations, score);
    }
}
