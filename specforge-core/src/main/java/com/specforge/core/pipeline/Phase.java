package com.specforge.core.pipeline;

import java.io.IOException;
import java.util.List;

/**
 * One named unit of pipeline execution.
 *
 * <p>Phases are registered in a {@link PhaseRegistry}, which checks the contract eagerly:
 * a non-blank kebab-case {@link #name()}, a non-null {@link #outputs()} list and
 * dependencies that are already registered. The registry order is the execution order.
 *
 * <p>Phases read earlier phases' outputs through {@link PhaseContext#output(String, String)}
 * and must not keep mutable state between runs.
 *
 * @see PhaseRegistry
 * @see PipelineOrchestrator
 */
public interface Phase {

    /**
     * Returns the unique phase name, used as the step key in {@code run.json}.
     *
     * <p>Should be kebab-case (e.g., "validate", "generate-tests").
     *
     * @return phase name
     */
    String name();

    /**
     * Returns the names of the outputs this phase records on completion.
     *
     * @return output names, possibly empty
     */
    List<String> outputs();

    /**
     * Returns the phases whose failure prevents this phase from running.
     *
     * @return names of registered phases
     */
    default List<String> dependsOn() {
        return List.of();
    }

    /**
     * Get the applicability strategy for this phase.
     *
     * <p>Phases that do not apply are recorded as skipped with reason
     * {@code not-applicable}.
     *
     * @return the applicability strategy
     */
    default PhaseApplicabilityStrategy applicability() {
        return PhaseApplicabilityStrategies.always();
    }

    /**
     * Executes the phase.
     *
     * <p>Return {@link PhaseResult#failure(String)} or throw a
     * {@link com.specforge.core.error.SpecForgeException} to fail with a specific code;
     * any other exception is recorded as a generic phase failure.
     *
     * @param context specification, run location and prior outputs
     * @return phase result
     * @throws IOException if reading or writing artifacts fails
     */
    PhaseResult run(PhaseContext context) throws IOException;
}
