package com.specforge.core.gate;

import com.specforge.core.SpecFixtures;
import com.specforge.core.parser.SpecParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link InvariantGate}.
 */
class InvariantGateTest {

    private static final String HIGH_SPEC = """
        ---
        name: Ledger Posting
        complexity: HIGH
        maturity: 5
        ---

        ## Deterministic Tests

        ```json
        {"id": "DT-1", "input": {"debit": 10, "credit": 10}, "expected": {"balanced": true}}
        ```

        ## Risks and Open Questions

        Edge case: a posting with a zero amount is rejected.
        Rollback: postings are reversed with compensating entries.
        """;

    private final SpecParser parser = new SpecParser();
    private final InvariantGate gate = new InvariantGate();

    @Test
    void evaluate_nonHighComplexity_passesWithInformationalCheck() {
        GateResult result = gate.evaluate(parser.parse(SpecFixtures.AGENT_READY_MODERATE));

        assertThat(result.passed()).isTrue();
        assertThat(result.checks()).singleElement()
            .satisfies(check -> assertThat(check.message()).contains("MODERATE"));
    }

    @Test
    void evaluate_highWithConcreteTestEdgeCasesAndRollback_passes() {
        GateResult result = gate.evaluate(parser.parse(HIGH_SPEC));

        assertThat(result.violations()).isEmpty();
    }

    @Test
    void evaluate_highWithEmptyExpected_fails() {
        GateResult result = gate.evaluate(parser.parse(HIGH_SPEC.replace("{\"balanced\": true}", "{}")));

        assertThat(result.violations())
            .extracting(Violation::code)
            .containsExactly(InvariantGate.NO_DETERMINISTIC_TEST);
    }

    @Test
    void evaluate_highWithUndecodableBlock_reportsMalformedTest() {
        String text = HIGH_SPEC.replace("## Risks", "```json\n{not json\n```\n\n## Risks");

        GateResult result = gate.evaluate(parser.parse(text));

        assertThat(result.violations())
            .extracting(Violation::code)
            .containsExactly(InvariantGate.MALFORMED_TEST);
    }

    @Test
    void evaluate_highWithoutEdgeCasesOrRollback_reportsBoth() {
        String text = HIGH_SPEC
            .replace("Edge case: a posting with a zero amount is rejected.\n", "")
            .replace("Rollback: postings are reversed with compensating entries.\n", "");

        GateResult result = gate.evaluate(parser.parse(text));

        assertThat(result.violations())
            .extracting(Violation::code)
            .containsExactly(InvariantGate.NO_EDGE_CASES, InvariantGate.NO_MIGRATION_STRATEGY);
    }
}
