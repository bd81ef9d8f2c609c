package com.specforge.core.gate;

import com.specforge.core.model.Specification;

/**
 * A pure, read-only validation pass over a specification.
 *
 * <p>Implementations must not hold mutable state: evaluating the same specification twice
 * yields equal results, and one instance may be shared across threads.
 */
public interface Gate {

    /**
     * Returns the gate identifier.
     *
     * @return gate id
     */
    GateId id();

    /**
     * Evaluates the specification.
     *
     * @param spec parsed specification, never mutated
     * @return gate result
     */
    GateResult evaluate(Specification spec);
}
