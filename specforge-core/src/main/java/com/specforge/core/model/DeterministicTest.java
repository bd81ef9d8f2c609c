package com.specforge.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A specification-declared input/expected pair pinning exact behavior.
 *
 * <p>Decoded from a fenced {@code json} block. {@code output} is accepted as an alias for
 * {@code expected} at parse time.
 *
 * @param id test identifier (e.g. {@code DT-1})
 * @param input decoded input value, may be null
 * @param expected decoded expected value, may be null
 */
public record DeterministicTest(
    String id,
    JsonNode input,
    JsonNode expected
) {
    /**
     * Compact constructor with validation.
     */
    public DeterministicTest {
        Objects.requireNonNull(id, "id must not be null");
    }

    /**
     * Checks whether the expected value is concrete: present, not JSON null, and not an
     * empty string, array or object.
     *
     * @return true if the expected output is concrete
     */
    public boolean hasConcreteExpected() {
        if (expected == null || expected.isNull() || expected.isMissingNode()) {
            return false;
        }
        if (expected.isTextual()) {
            return !expected.asText().isBlank();
        }
        if (expected.isContainerNode()) {
            return expected.size() > 0;
        }
        return true;
    }
}
