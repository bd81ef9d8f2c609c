package com.specforge.core.gate;

import com.specforge.core.model.Complexity;
import com.specforge.core.model.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Runs the validation gates and decides agent readiness.
 *
 * <p>Gates are independent and stateless, so results do not depend on evaluation order
 * and a validator may be shared and re-run freely.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GateValidator validator = new GateValidator();
 * Map<GateId, GateResult> results = validator.runAllGates(spec);
 * if (!validator.isAgentReady(spec, results)) {
 *     results.values().forEach(r -> r.violations().forEach(System.out::println));
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class GateValidator {

    private static final Logger log = LoggerFactory.getLogger(GateValidator.class);

    private final List<Gate> gates;

    /**
     * Creates a validator with the four built-in gates.
     */
    public GateValidator() {
        this(List.of(new StructureGate(), new SemanticGate(), new TraceabilityGate(), new InvariantGate()));
    }

    public GateValidator(List<Gate> gates) {
        Objects.requireNonNull(gates, "gates must not be null");
        this.gates = List.copyOf(gates);
    }

    /**
     * Evaluates every gate against the specification.
     *
     * @param spec parsed specification
     * @return unmodifiable map of gate id to result
     */
    public Map<GateId, GateResult> runAllGates(Specification spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        Map<GateId, GateResult> results = new EnumMap<>(GateId.class);
        for (Gate gate : gates) {
            GateResult result = gate.evaluate(spec);
            log.debug("{} {}: {} violation(s), score {}", gate.id(), result.passed() ? "passed" : "failed",
                result.violations().size(), result.score());
            results.put(gate.id(), result);
        }
        return Collections.unmodifiableMap(results);
    }

    /**
     * Returns the gates that must pass for a (complexity, maturity) pair.
     *
     * <p>G1 always; G2 from maturity 2; G3 from maturity 3; G4 for HIGH complexity at
     * maturity 5.
     *
     * @param complexity declared complexity, may be null when undeclared
     * @param maturity declared maturity
     * @return applicable gates
     */
    public static Set<GateId> applicableGates(Complexity complexity, int maturity) {
        Set<GateId> applicable = EnumSet.of(GateId.G1);
        if (maturity >= 2) {
            applicable.add(GateId.G2);
        }
        if (maturity >= 3) {
            applicable.add(GateId.G3);
        }
        if (complexity == Complexity.HIGH && maturity >= 5) {
            applicable.add(GateId.G4);
        }
        return Collections.unmodifiableSet(applicable);
    }

    /**
     * Checks whether every applicable gate passed.
     *
     * @param results gate results
     * @param complexity declared complexity
     * @param maturity declared maturity
     * @return true when all applicable gates are present and passed
     */
    public static boolean isAgentReady(Map<GateId, GateResult> results, Complexity complexity, int maturity) {
        return applicableGates(complexity, maturity).stream()
            .allMatch(gate -> results.containsKey(gate) && results.get(gate).passed());
    }

    /**
     * Checks agent readiness using the specification's own declarations.
     *
     * <p>A specification without a valid complexity and maturity is never agent-ready.
     *
     * @param spec parsed specification
     * @param results gate results for that specification
     * @return true if agent-ready
     */
    public boolean isAgentReady(Specification spec, Map<GateId, GateResult> results) {
        OptionalInt maturity = spec.maturity();
        if (spec.complexity().isEmpty() || maturity.isEmpty()) {
            return false;
        }
        return isAgentReady(results, spec.complexity().get(), maturity.getAsInt());
    }

    /**
     * Returns the mean gate score, rounded.
     *
     * @param results gate results
     * @return readiness score 0-100, 0 when there are no results
     */
    public static int readinessScore(Map<GateId, GateResult> results) {
        if (results.isEmpty()) {
            return 0;
        }
        double mean = results.values().stream().mapToInt(GateResult::score).average().orElse(0);
        return (int) Math.round(mean);
    }

    /**
     * Collects the violations of the applicable gates that failed.
     *
     * @param spec parsed specification
     * @param results gate results
     * @return blocking violations, in gate order
     */
    public List<Violation> blockingViolations(Specification spec, Map<GateId, GateResult> results) {
        int maturity = spec.maturity().orElse(RequiredSections.MAX_MATURITY);
        Set<GateId> applicable = applicableGates(spec.complexity().orElse(null), maturity);
        List<Violation> violations = new ArrayList<>();
        results.forEach((gate, result) -> {
            if (applicable.contains(gate)) {
                violations.addAll(result.violations());
            }
        });
        return violations;
    }
}
