package com.specforge.core.gate;

import com.specforge.core.SpecFixtures;
import com.specforge.core.model.Complexity;
import com.specforge.core.model.Specification;
import com.specforge.core.parser.SpecParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GateValidator}.
 */
class GateValidatorTest {

    private final SpecParser parser = new SpecParser();
    private final GateValidator validator = new GateValidator();

    @Test
    void runAllGates_returnsResultForEveryGate() {
        Map<GateId, GateResult> results = validator.runAllGates(parser.parse(SpecFixtures.AGENT_READY_MODERATE));

        assertThat(results).containsOnlyKeys(GateId.G1, GateId.G2, GateId.G3, GateId.G4);
        assertThat(results.values()).allSatisfy(result -> {
            assertThat(result.checks()).isNotEmpty();
            assertThat(result.passed()).isEqualTo(result.violations().isEmpty());
        });
    }

    @Test
    void runAllGates_agentReadySpec_passesAndScoresFull() {
        Specification spec = parser.parse(SpecFixtures.AGENT_READY_MODERATE);

        Map<GateId, GateResult> results = validator.runAllGates(spec);

        assertThat(results.values()).allSatisfy(result -> assertThat(result.violations()).isEmpty());
        assertThat(validator.isAgentReady(spec, results)).isTrue();
        assertThat(GateValidator.readinessScore(results)).isEqualTo(100);
        assertThat(validator.blockingViolations(spec, results)).isEmpty();
    }

    @Test
    void runAllGates_sameSpecTwice_returnsEqualResults() {
        Specification spec = parser.parse(SpecFixtures.HIGH_AT_MATURITY_THREE);

        assertThat(validator.runAllGates(spec)).isEqualTo(validator.runAllGates(spec));
    }

    @Test
    void isAgentReady_highBelowMinimumMaturity_isFalse() {
        Specification spec = parser.parse(SpecFixtures.HIGH_AT_MATURITY_THREE);

        Map<GateId, GateResult> results = validator.runAllGates(spec);

        assertThat(results.get(GateId.G1).passed()).isFalse();
        assertThat(validator.isAgentReady(spec, results)).isFalse();
        assertThat(validator.blockingViolations(spec, results))
            .extracting(Violation::code)
            .contains(StructureGate.MATURITY_BELOW_MINIMUM);
    }

    @Test
    void isAgentReady_missingDeclarations_isFalse() {
        Specification spec = parser.parse("""
            # Overview

            A document without front matter.
            """);

        assertThat(validator.isAgentReady(spec, validator.runAllGates(spec))).isFalse();
    }

    @Test
    void applicableGates_followsMaturityAndComplexity() {
        assertThat(GateValidator.applicableGates(Complexity.EASY, 1)).containsExactly(GateId.G1);
        assertThat(GateValidator.applicableGates(Complexity.MODERATE, 2)).containsExactly(GateId.G1, GateId.G2);
        assertThat(GateValidator.applicableGates(Complexity.MODERATE, 5))
            .containsExactly(GateId.G1, GateId.G2, GateId.G3);
        assertThat(GateValidator.applicableGates(Complexity.HIGH, 5))
            .containsExactly(GateId.G1, GateId.G2, GateId.G3, GateId.G4);
    }

    @Test
    void isAgentReady_failedGateNotApplicable_isIgnored() {
        Map<GateId, GateResult> results = Map.of(
            GateId.G1, GateResult.of(GateId.G1, List.of(new GateCheck("ok", true, "ok")), List.of()),
            GateId.G3, GateResult.of(GateId.G3, List.of(), List.of(
                new Violation("G3_UNTRACED_REQUIREMENT", "FR-1 has no linked acceptance criterion", "FR-1"))));

        assertThat(GateValidator.isAgentReady(results, Complexity.EASY, 1)).isTrue();
        assertThat(GateValidator.isAgentReady(results, Complexity.EASY, 3)).isFalse();
    }

    @Test
    void readinessScore_noResults_isZero() {
        assertThat(GateValidator.readinessScore(Map.of())).isZero();
    }
}
