package com.specforge.core.pipeline;

import com.specforge.core.error.InvalidPhaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordered set of pipeline phases.
 *
 * <p>Registration order is execution order. Each phase is checked when it is registered,
 * not when it runs: the name must be non-blank kebab-case and unique, {@code outputs()} and
 * {@code dependsOn()} must be non-null lists without null entries, and every dependency must
 * already be registered. The last rule keeps the dependency graph acyclic and consistent
 * with execution order.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PhaseRegistry registry = new PhaseRegistry()
 *     .register(new ValidatePhase())
 *     .register(new AnalyzePhase());
 * }</pre>
 *
 * @since 1.0.0
 */
public class PhaseRegistry {

    private static final Logger log = LoggerFactory.getLogger(PhaseRegistry.class);
    private static final Pattern PHASE_NAME = Pattern.compile("[a-z][a-z0-9]*(?:-[a-z0-9]+)*");

    private final Map<String, Phase> phases = new LinkedHashMap<>();

    /**
     * Registers a phase after validating its contract.
     *
     * @param phase phase to add
     * @return this registry
     * @throws InvalidPhaseException if the phase does not satisfy the contract
     */
    public PhaseRegistry register(Phase phase) {
        if (phase == null) {
            throw new InvalidPhaseException("Phase must not be null");
        }
        String name = phase.name();
        if (name == null || name.isBlank()) {
            throw new InvalidPhaseException("Phase " + phase.getClass().getName() + " has no name");
        }
        if (!PHASE_NAME.matcher(name).matches()) {
            throw new InvalidPhaseException("Phase name must be kebab-case: '" + name + "'");
        }
        if (phases.containsKey(name)) {
            throw new InvalidPhaseException("Duplicate phase name: " + name);
        }
        requireList(name, "outputs", phase.outputs());
        List<String> dependencies = requireList(name, "dependsOn", phase.dependsOn());
        for (String dependency : dependencies) {
            if (!phases.containsKey(dependency)) {
                throw new InvalidPhaseException(
                    "Phase '" + name + "' depends on '" + dependency + "', which is not registered before it");
            }
        }
        if (phase.applicability() == null) {
            throw new InvalidPhaseException("Phase '" + name + "' has no applicability strategy");
        }

        phases.put(name, phase);
        log.debug("Registered phase {} (depends on {})", name, dependencies);
        return this;
    }

    private static List<String> requireList(String name, String property, List<String> values) {
        if (values == null) {
            throw new InvalidPhaseException("Phase '" + name + "' must declare " + property + " as a list");
        }
        if (values.stream().anyMatch(value -> value == null || value.isBlank())) {
            throw new InvalidPhaseException("Phase '" + name + "' has a blank entry in " + property);
        }
        return values;
    }

    /**
     * Returns registered phases in execution order.
     *
     * @return phases
     */
    public List<Phase> phases() {
        return List.copyOf(phases.values());
    }

    public List<String> names() {
        return List.copyOf(phases.keySet());
    }

    public Optional<Phase> get(String name) {
        return Optional.ofNullable(phases.get(name));
    }

    public boolean contains(String name) {
        return phases.containsKey(name);
    }

    /**
     * Returns the position of a phase in execution order.
     *
     * @param name phase name
     * @return zero-based index
     * @throws InvalidPhaseException if no phase has that name
     */
    public int indexOf(String name) {
        List<String> names = new ArrayList<>(phases.keySet());
        int index = names.indexOf(name);
        if (index < 0) {
            throw new InvalidPhaseException("Unknown phase: " + name + " (known: " + String.join(", ", names) + ")");
        }
        return index;
    }
}
