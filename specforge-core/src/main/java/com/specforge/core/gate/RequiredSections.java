package com.specforge.core.gate;

import com.specforge.core.model.Complexity;
import com.specforge.core.parser.SectionKeys;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fixed lookup table of required sections per (complexity, maturity).
 *
 * <p>Sections accumulate with maturity. HIGH complexity has a minimum maturity of 5, so a
 * HIGH specification is always held to the full table regardless of what it declares.
 */
public final class RequiredSections {

    /** Sections added at each maturity level of the formal template. */
    private static final Map<Integer, List<String>> FORMAL = Map.of(
        1, List.of(SectionKeys.OVERVIEW),
        2, List.of(SectionKeys.FUNCTIONAL_REQUIREMENTS),
        3, List.of(SectionKeys.NON_FUNCTIONAL_REQUIREMENTS, SectionKeys.SECURITY),
        4, List.of(SectionKeys.DATA_MODEL, SectionKeys.INTERFACES),
        5, List.of(SectionKeys.DETERMINISTIC_TESTS, SectionKeys.ACCEPTANCE_TESTS)
    );

    /** Level headings of the maturity-level layout. */
    private static final Map<Integer, String> LEVELS = Map.of(
        1, "level_1_foundation",
        2, "level_2_technical_context",
        3, "level_3_robustness",
        4, "level_4_architecture_and_governance",
        5, "level_5_complete_specification"
    );

    public static final int MIN_MATURITY = 1;
    public static final int MAX_MATURITY = 5;

    private RequiredSections() {
        // Utility class
    }

    /**
     * Returns the lowest maturity acceptable for a complexity.
     *
     * @param complexity declared complexity
     * @return minimum maturity
     */
    public static int minimumMaturity(Complexity complexity) {
        return complexity == Complexity.HIGH ? MAX_MATURITY : MIN_MATURITY;
    }

    /**
     * Returns the maturity the section table is evaluated at: the declared maturity, raised
     * to the complexity's minimum.
     *
     * @param complexity declared complexity
     * @param maturity declared maturity
     * @return effective maturity, clamped to 1..5
     */
    public static int effectiveMaturity(Complexity complexity, int maturity) {
        int effective = Math.max(maturity, minimumMaturity(complexity));
        return Math.min(MAX_MATURITY, Math.max(MIN_MATURITY, effective));
    }

    /**
     * Returns required formal-template sections.
     *
     * @param complexity declared complexity
     * @param maturity declared maturity
     * @return required section keys, lowest level first
     */
    public static List<String> formal(Complexity complexity, int maturity) {
        int effective = effectiveMaturity(complexity, maturity);
        List<String> required = new ArrayList<>();
        for (int level = MIN_MATURITY; level <= effective; level++) {
            required.addAll(FORMAL.get(level));
        }
        return List.copyOf(required);
    }

    /**
     * Returns the sections introduced only at a given maturity level.
     *
     * @param maturity maturity level
     * @return section keys of that level
     */
    public static List<String> introducedAt(int maturity) {
        return FORMAL.getOrDefault(maturity, List.of());
    }

    /**
     * Returns the level headings required for the maturity-level layout.
     *
     * @param complexity declared complexity
     * @param maturity declared maturity
     * @return level keys, lowest first
     */
    public static List<String> levels(Complexity complexity, int maturity) {
        int effective = effectiveMaturity(complexity, maturity);
        List<String> required = new ArrayList<>();
        for (int level = MIN_MATURITY; level <= effective; level++) {
            required.add(LEVELS.get(level));
        }
        return List.copyOf(required);
    }
}
