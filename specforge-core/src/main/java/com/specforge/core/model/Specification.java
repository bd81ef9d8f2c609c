package com.specforge.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Parsed representation of one specification document.
 *
 * <p>Immutable: every collection is an unmodifiable copy, so gates and analyzers share
 * one instance.
 *
 * <p><b>Section values</b> are either a {@code String} or, for a heading with nested
 * sub-headings, a {@code Map<String, String>} in which the heading's own text is stored
 * under {@link #MAIN_KEY}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Specification spec = new SpecParser().parse(Path.of("specs/login.md"));
 * String overview = spec.sectionText("overview");
 * }</pre>
 *
 * @param metadata normalized front matter, or null when the document has none
 * @param sections section map keyed by normalized heading
 * @param rawSections unsplit body text of each top-level section, keyed like {@code sections}
 * @param functionalRequirements functional requirements in document order
 * @param userStories "As a ..., I want ..." lines in document order
 * @param acceptanceCriteria acceptance-criteria entries in document order
 * @param deterministicTests successfully decoded deterministic tests
 * @param parseIssues non-fatal faults recorded while parsing
 * @param raw original document text
 * @param sourcePath absolute source path, or null when parsed from a string
 * @since 1.0.0
 */
public record Specification(
    SpecMetadata metadata,
    Map<String, Object> sections,
    Map<String, String> rawSections,
    List<FunctionalRequirement> functionalRequirements,
    List<String> userStories,
    List<String> acceptanceCriteria,
    List<DeterministicTest> deterministicTests,
    List<ParseIssue> parseIssues,
    String raw,
    Path sourcePath
) {
    /** Key under which a nested section stores its own body text. */
    public static final String MAIN_KEY = "_main";

    /**
     * Compact constructor with validation.
     */
    public Specification {
        Objects.requireNonNull(raw, "raw must not be null");
        sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
        rawSections = rawSections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawSections));
        functionalRequirements = functionalRequirements == null ? List.of() : List.copyOf(functionalRequirements);
        userStories = userStories == null ? List.of() : List.copyOf(userStories);
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
        deterministicTests = deterministicTests == null ? List.of() : List.copyOf(deterministicTests);
        parseIssues = parseIssues == null ? List.of() : List.copyOf(parseIssues);
    }

    /**
     * Returns the specification id, or {@code "spec"} when front matter has none.
     *
     * @return identifier usable in file names
     */
    public String specId() {
        String id = metadata == null ? null : metadata.id();
        return id == null || id.isBlank() ? "spec" : id;
    }

    /**
     * Returns the declared complexity, if front matter declares a valid one.
     *
     * @return complexity or empty
     */
    public Optional<Complexity> complexity() {
        return metadata == null ? Optional.empty() : metadata.complexity();
    }

    /**
     * Returns the declared maturity, if front matter declares an integer one.
     *
     * @return maturity or empty
     */
    public OptionalInt maturity() {
        return metadata == null ? OptionalInt.empty() : metadata.maturity();
    }

    /**
     * Checks whether a top-level section exists.
     *
     * @param key normalized section key
     * @return true if present
     */
    public boolean hasSection(String key) {
        return sections.containsKey(key);
    }

    /**
     * Returns the full text of a top-level section, including nested sub-sections.
     *
     * @param key normalized section key
     * @return section text, or empty string when absent
     */
    public String sectionText(String key) {
        String text = rawSections.get(key);
        if (text != null) {
            return text;
        }
        return flatten(sections.get(key));
    }

    /**
     * Returns a nested sub-section of a top-level section.
     *
     * @param key normalized section key
     * @param subKey normalized sub-section key
     * @return sub-section text, or empty when either level is absent
     */
    public Optional<String> subSection(String key, String subKey) {
        if (sections.get(key) instanceof Map<?, ?> nested && nested.get(subKey) instanceof String text) {
            return Optional.of(text);
        }
        return Optional.empty();
    }

    /**
     * Checks whether the document uses the maturity-level layout ({@code ## Level 1: ...}).
     *
     * @return true when any top-level section is a {@code level_<n>} section
     */
    public boolean isMaturityLevelFormat() {
        return sections.keySet().stream().anyMatch(key -> key.matches("level_\\d+.*"));
    }

    private static String flatten(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map<?, ?> nested) {
            StringBuilder text = new StringBuilder();
            nested.values().forEach(part -> text.append(part).append('\n'));
            return text.toString().trim();
        }
        return value.toString();
    }
}
