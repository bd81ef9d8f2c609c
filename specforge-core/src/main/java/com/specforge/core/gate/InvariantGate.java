package com.specforge.core.gate;

import com.specforge.core.error.ErrorCode;
import com.specforge.core.model.Complexity;
import com.specforge.core.model.DeterministicTest;
import com.specforge.core.model.ParseIssue;
import com.specforge.core.model.Specification;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * G4: invariants for HIGH complexity. Deterministic tests with concrete expected output,
 * documented edge cases and a migration or rollback strategy.
 *
 * <p>Other complexities pass with an informational check.
 */
public final class InvariantGate implements Gate {

    public static final String NO_DETERMINISTIC_TEST = "G4_NO_DETERMINISTIC_TEST";
    public static final String MALFORMED_TEST = "G4_MALFORMED_DETERMINISTIC_TEST";
    public static final String NO_EDGE_CASES = "G4_NO_EDGE_CASES";
    public static final String NO_MIGRATION_STRATEGY = "G4_NO_MIGRATION_STRATEGY";

    private static final List<String> EDGE_CASE_MARKERS = List.of("edge case", "edge-case", "corner case");
    private static final List<String> MIGRATION_MARKERS = List.of("migration", "rollback", "roll back", "deployment strategy");

    @Override
    public GateId id() {
        return GateId.G4;
    }

    @Override
    public GateResult evaluate(Specification spec) {
        GateReport report = new GateReport(GateId.G4);
        Optional<Complexity> complexity = spec.complexity();

        if (complexity.isEmpty() || complexity.get() != Complexity.HIGH) {
            report.summary("G4 not required for this complexity", true,
                "G4 applies to HIGH complexity only (current: "
                    + complexity.map(Enum::name).orElse("undeclared") + ")");
            return report.result();
        }

        List<DeterministicTest> concrete = spec.deterministicTests().stream()
            .filter(DeterministicTest::hasConcreteExpected)
            .toList();
        report.check("Deterministic tests with concrete expected output", !concrete.isEmpty(),
            concrete.size() + " deterministic test(s) with concrete expected output",
            NO_DETERMINISTIC_TEST,
            "HIGH complexity requires at least one deterministic test with a concrete, non-empty expected output",
            "deterministic_tests");

        List<ParseIssue> malformed = spec.parseIssues().stream()
            .filter(issue -> issue.code() == ErrorCode.PARSE_BLOCK)
            .toList();
        malformed.forEach(issue -> report.violation(MALFORMED_TEST, issue.message(), issue.location()));
        report.summary("Deterministic test blocks decode", malformed.isEmpty(),
            malformed.isEmpty() ? "All deterministic test blocks decode" : malformed.size() + " block(s) failed to decode");

        String text = spec.raw().toLowerCase(Locale.ROOT);
        report.check("Edge cases documented", EDGE_CASE_MARKERS.stream().anyMatch(text::contains),
            "Edge cases documented", NO_EDGE_CASES,
            "No edge cases documented (required for HIGH complexity)", null);
        report.check("Migration or rollback strategy defined", MIGRATION_MARKERS.stream().anyMatch(text::contains),
            "Migration or rollback strategy documented", NO_MIGRATION_STRATEGY,
            "No migration, rollback or deployment strategy found (required for HIGH complexity)", null);

        return report.result();
    }
}
