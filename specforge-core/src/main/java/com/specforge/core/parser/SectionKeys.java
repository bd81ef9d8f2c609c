package com.specforge.core.parser;

import com.specforge.core.util.Slugs;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Canonical section names and heading normalization.
 */
public final class SectionKeys {

    public static final String OVERVIEW = "overview";
    public static final String FUNCTIONAL_REQUIREMENTS = "functional_requirements";
    public static final String NON_FUNCTIONAL_REQUIREMENTS = "non_functional_requirements";
    public static final String SECURITY = "security";
    public static final String DATA_INVENTORY = "data_inventory";
    public static final String DATA_MODEL = "data_model";
    public static final String INTERFACES = "interfaces_and_contracts";
    public static final String DETERMINISTIC_TESTS = "deterministic_tests";
    public static final String ACCEPTANCE_TESTS = "acceptance_tests";
    public static final String ACCEPTANCE_CRITERIA = "acceptance_criteria";
    public static final String USER_STORIES = "user_stories";
    public static final String TRACEABILITY = "traceability";
    public static final String GLOSSARY = "glossary_and_definitions";
    public static final String RISKS = "risks_and_open_questions";

    private static final Map<String, String> CANONICAL = Map.ofEntries(
        Map.entry("overview", OVERVIEW),
        Map.entry("functional_requirements", FUNCTIONAL_REQUIREMENTS),
        Map.entry("functionalrequirements", FUNCTIONAL_REQUIREMENTS),
        Map.entry("non_functional_requirements", NON_FUNCTIONAL_REQUIREMENTS),
        Map.entry("nonfunctional_requirements", NON_FUNCTIONAL_REQUIREMENTS),
        Map.entry("security", SECURITY),
        Map.entry("security_considerations", SECURITY),
        Map.entry("data_inventory", DATA_INVENTORY),
        Map.entry("data_model", DATA_MODEL),
        Map.entry("datamodel", DATA_MODEL),
        Map.entry("interfaces_and_contracts", INTERFACES),
        Map.entry("interfaces_contracts", INTERFACES),
        Map.entry("deterministic_tests", DETERMINISTIC_TESTS),
        Map.entry("deterministictests", DETERMINISTIC_TESTS),
        Map.entry("acceptance_tests", ACCEPTANCE_TESTS),
        Map.entry("acceptancetests", ACCEPTANCE_TESTS),
        Map.entry("testing_strategy", ACCEPTANCE_TESTS),
        Map.entry("testingstrategy", ACCEPTANCE_TESTS),
        Map.entry("acceptance_criteria", ACCEPTANCE_CRITERIA),
        Map.entry("acceptancecriteria", ACCEPTANCE_CRITERIA),
        Map.entry("user_stories", USER_STORIES),
        Map.entry("userstories", USER_STORIES),
        Map.entry("traceability", TRACEABILITY),
        Map.entry("glossary_and_definitions", GLOSSARY),
        Map.entry("glossary_definitions", GLOSSARY),
        Map.entry("risks_and_open_questions", RISKS),
        Map.entry("risks_open_questions", RISKS)
    );

    private static final Set<String> CANONICAL_NAMES = Set.copyOf(CANONICAL.values());

    private static final Pattern LEVEL_KEY = Pattern.compile("^level_(\\d+)");

    private SectionKeys() {
        // Utility class
    }

    /**
     * Normalizes heading text and maps it to its canonical name when one exists.
     *
     * @param heading heading text without the leading {@code #} markers
     * @return normalized key
     */
    public static String normalize(String heading) {
        String key = Slugs.sectionKey(heading);
        return CANONICAL.getOrDefault(key, key);
    }

    /**
     * Checks whether a normalized key is one of the canonical section names.
     *
     * @param key normalized key
     * @return true if canonical
     */
    public static boolean isCanonical(String key) {
        return CANONICAL_NAMES.contains(key);
    }

    /**
     * Checks whether a normalized key is a maturity-level heading ({@code level_3_robustness}).
     *
     * @param key normalized key
     * @return true for {@code level_<n>...} keys
     */
    public static boolean isLevelKey(String key) {
        return LEVEL_KEY.matcher(key).find();
    }

    /**
     * Finds the first key of the given maturity level among a set of section keys.
     *
     * @param keys section keys
     * @param level maturity level (1-5)
     * @return matching key, or null
     */
    public static String findLevelKey(Collection<String> keys, int level) {
        String exact = "level_" + level;
        for (String key : keys) {
            if (key.equals(exact) || key.startsWith(exact + "_")) {
                return key;
            }
        }
        return null;
    }
}
