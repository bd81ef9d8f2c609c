package com.specforge.core.parser;

import java.util.Map;
import java.util.Set;

/**
 * Maps the sub-sections of a maturity-level document ("Level 1: Foundation" ...
 * "Level 5: Complete Specification") onto canonical section names.
 *
 * <p>Only fills canonical sections the document does not already declare.
 */
public final class MaturityLevelMapper {

    private MaturityLevelMapper() {
        // Utility class
    }

    /**
     * Checks whether the section map uses the maturity-level layout.
     *
     * @param sections parsed sections
     * @return true when any top-level key is a {@code level_<n>} key
     */
    public static boolean isMaturityLevelFormat(Set<String> sections) {
        return sections.stream().anyMatch(SectionKeys::isLevelKey);
    }

    /**
     * Adds canonical sections derived from level sub-sections, in place.
     *
     * @param sections section map to enrich
     * @param rawSections raw text map to enrich alongside
     */
    public static void apply(Map<String, Object> sections, Map<String, String> rawSections) {
        if (!isMaturityLevelFormat(sections.keySet())) {
            return;
        }

        Map<String, String> level1 = level(sections, 1);
        if (!level1.isEmpty()) {
            fill(sections, rawSections, SectionKeys.OVERVIEW, String.join("\n", level1.values()));
            fill(sections, rawSections, SectionKeys.ACCEPTANCE_CRITERIA, level1.get(SectionKeys.ACCEPTANCE_CRITERIA));
            fill(sections, rawSections, SectionKeys.USER_STORIES, level1.get(SectionKeys.USER_STORIES));
        }

        Map<String, String> level2 = level(sections, 2);
        fill(sections, rawSections, SectionKeys.DATA_MODEL, level2.get("data_models"));
        fill(sections, rawSections, SectionKeys.INTERFACES, level2.get("integration_points"));
        fill(sections, rawSections, SectionKeys.NON_FUNCTIONAL_REQUIREMENTS, level2.get("technical_constraints"));

        Map<String, String> level3 = level(sections, 3);
        fill(sections, rawSections, SectionKeys.SECURITY, level3.get(SectionKeys.SECURITY));
        String performance = level3.get("performance_requirements");
        if (performance != null && !performance.isBlank()) {
            Object existing = sections.get(SectionKeys.NON_FUNCTIONAL_REQUIREMENTS);
            String combined = existing instanceof String text && !text.isBlank() && !text.equals(performance)
                ? text + "\n\n" + performance
                : performance;
            sections.put(SectionKeys.NON_FUNCTIONAL_REQUIREMENTS, combined);
            rawSections.put(SectionKeys.NON_FUNCTIONAL_REQUIREMENTS, combined);
        }

        Map<String, String> level4 = level(sections, 4);
        fill(sections, rawSections, SectionKeys.INTERFACES, level4.get("architectural_patterns"));

        Map<String, String> level5 = level(sections, 5);
        fill(sections, rawSections, SectionKeys.ACCEPTANCE_TESTS, level5.get("concrete_examples"));

        // Canonical headings nested under any level ("### Functional Requirements")
        for (int n = 1; n <= 5; n++) {
            level(sections, n).forEach((subKey, text) -> {
                if (SectionKeys.isCanonical(subKey)) {
                    fill(sections, rawSections, subKey, text);
                }
            });
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, String> level(Map<String, Object> sections, int level) {
        String key = SectionKeys.findLevelKey(sections.keySet(), level);
        if (key != null && sections.get(key) instanceof Map<?, ?> nested) {
            return (Map<String, String>) nested;
        }
        return Map.of();
    }

    private static void fill(Map<String, Object> sections, Map<String, String> rawSections, String key, String text) {
        if (text == null || text.isBlank() || sections.containsKey(key)) {
            return;
        }
        sections.put(key, text);
        rawSections.put(key, text);
    }
}
