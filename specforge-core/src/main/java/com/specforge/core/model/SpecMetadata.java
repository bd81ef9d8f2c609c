package com.specforge.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Normalized front-matter of a specification.
 *
 * <p>Holds the decoded key/value document after legacy field names have been mapped to
 * canonical ones. Values keep their decoded types so the structure gate can tell a
 * well-typed {@code maturity: 3} from a quoted {@code maturity: "3"}.
 *
 * <p><b>Canonical fields:</b> {@code specmas} (format version), {@code kind}, {@code id},
 * {@code name}, {@code complexity}, {@code maturity}, {@code owners}, {@code tags},
 * {@code created}, {@code updated}.
 *
 * @param fields normalized front-matter fields, in document order
 */
public record SpecMetadata(Map<String, Object> fields) {

    public static final String FORMAT_VERSION = "specmas";
    public static final String KIND = "kind";
    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String COMPLEXITY = "complexity";
    public static final String MATURITY = "maturity";
    public static final String OWNERS = "owners";
    public static final String TAGS = "tags";

    /**
     * Compact constructor with validation.
     */
    public SpecMetadata {
        Objects.requireNonNull(fields, "fields must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Returns the raw value of a field.
     *
     * @param field field name
     * @return value or null when absent
     */
    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Checks whether a field is present with a non-null value.
     *
     * @param field field name
     * @return true if present
     */
    public boolean has(String field) {
        return fields.get(field) != null;
    }

    public String formatVersion() {
        return text(FORMAT_VERSION);
    }

    public String kind() {
        return text(KIND);
    }

    public String id() {
        return text(ID);
    }

    public String name() {
        return text(NAME);
    }

    /**
     * Returns the declared complexity if it is one of the enumerated values.
     *
     * @return complexity or empty
     */
    public Optional<Complexity> complexity() {
        return Complexity.fromValue(fields.get(COMPLEXITY));
    }

    /**
     * Returns the declared maturity if it is an integer.
     *
     * <p>Range is not checked here; see the structure gate.
     *
     * @return maturity or empty
     */
    public OptionalInt maturity() {
        Object value = fields.get(MATURITY);
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return OptionalInt.of(((Number) value).intValue());
        }
        return OptionalInt.empty();
    }

    /**
     * Returns owner names; accepts a list of strings or a list of {@code {name: ...}} maps.
     *
     * @return owner names, possibly empty
     */
    public List<String> owners() {
        Object value = fields.get(OWNERS);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
            .map(entry -> entry instanceof Map<?, ?> map ? map.get("name") : entry)
            .filter(Objects::nonNull)
            .map(Object::toString)
            .toList();
    }

    /**
     * Returns tag values, if declared as a list.
     *
     * @return tags, possibly empty
     */
    public List<String> tags() {
        Object value = fields.get(TAGS);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().filter(Objects::nonNull).map(Object::toString).toList();
    }

    private String text(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }
}
