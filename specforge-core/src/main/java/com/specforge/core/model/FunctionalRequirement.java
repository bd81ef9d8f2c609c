package com.specforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A functional requirement declared in a specification.
 *
 * @param id canonical identifier (e.g. {@code FR-1})
 * @param description requirement text
 * @param validationCriteria criteria that verify the requirement; may be empty
 */
public record FunctionalRequirement(
    String id,
    String description,
    List<String> validationCriteria
) {
    /**
     * Compact constructor with validation.
     */
    public FunctionalRequirement {
        Objects.requireNonNull(id, "id must not be null");
        if (description == null) {
            description = "";
        }
        validationCriteria = validationCriteria == null ? List.of() : List.copyOf(validationCriteria);
    }

    /**
     * Returns the numeric suffix of the identifier without leading zeros, used for
     * traceability correlation. Compared as text, so ids of any length are accepted.
     *
     * @return digits of the id ({@code "7"} for {@code FR-007}), or an empty string if it has none
     */
    public String numberKey() {
        return numberKey(id.replaceAll("\\D+", ""));
    }

    /**
     * Normalizes a digit string for correlation: leading zeros are dropped, {@code "000"} becomes {@code "0"}.
     *
     * @param digits decimal digits, possibly empty
     * @return normalized digits
     */
    public static String numberKey(String digits) {
        if (digits.isEmpty()) {
            return digits;
        }
        String stripped = digits.replaceFirst("^0+", "");
        return stripped.isEmpty() ? "0" : stripped;
    }
}
