package com.specforge.core.gate;

import com.specforge.core.model.Complexity;
import com.specforge.core.model.SpecMetadata;
import com.specforge.core.model.Specification;
import com.specforge.core.parser.SectionKeys;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * G1: front-matter fields, enumerated values and required sections.
 */
public final class StructureGate implements Gate {

    public static final String MISSING_FRONT_MATTER = "G1_MISSING_FRONT_MATTER";
    public static final String MISSING_FIELD = "G1_MISSING_FIELD";
    public static final String INVALID_FIELD_TYPE = "G1_INVALID_FIELD_TYPE";
    public static final String INVALID_COMPLEXITY = "G1_INVALID_COMPLEXITY";
    public static final String INVALID_MATURITY = "G1_INVALID_MATURITY";
    public static final String MATURITY_BELOW_MINIMUM = "G1_MATURITY_BELOW_MINIMUM";
    public static final String MISSING_SECTION = "G1_MISSING_SECTION";
    public static final String INSUFFICIENT_CONTENT = "G1_INSUFFICIENT_CONTENT";

    private static final List<String> REQUIRED_FIELDS = List.of(
        SpecMetadata.FORMAT_VERSION, SpecMetadata.KIND, SpecMetadata.ID,
        SpecMetadata.NAME, SpecMetadata.COMPLEXITY, SpecMetadata.MATURITY);

    private static final List<String> TEXT_FIELDS = List.of(
        SpecMetadata.FORMAT_VERSION, SpecMetadata.KIND, SpecMetadata.ID, SpecMetadata.NAME);

    private static final int MIN_CONTENT_CHARS = 100;

    @Override
    public GateId id() {
        return GateId.G1;
    }

    @Override
    public GateResult evaluate(Specification spec) {
        GateReport report = new GateReport(GateId.G1);
        SpecMetadata metadata = spec.metadata();

        if (report.check("Front matter present", metadata != null, "Front matter found",
                MISSING_FRONT_MATTER, "Missing YAML front matter", "front_matter")) {
            checkFields(metadata, report);
        }

        Optional<Complexity> complexity = spec.complexity();
        OptionalInt maturity = spec.maturity();
        if (complexity.isPresent() && maturity.isPresent() && inRange(maturity.getAsInt())) {
            checkSections(spec, complexity.get(), maturity.getAsInt(), report);
        }

        int contentChars = spec.raw().replaceAll("\\s+", "").length();
        report.check("Specification has content", contentChars > MIN_CONTENT_CHARS,
            "Specification has content", INSUFFICIENT_CONTENT,
            "Specification is empty or too short (" + contentChars + " non-blank characters)", null);

        return report.result();
    }

    private static void checkFields(SpecMetadata metadata, GateReport report) {
        for (String field : REQUIRED_FIELDS) {
            Object value = metadata.get(field);
            boolean present = value != null && !value.toString().isBlank();
            report.check("Front matter has field: " + field, present, field + " present",
                MISSING_FIELD, "Missing required front-matter field: " + field, "front_matter." + field);
        }

        for (String field : TEXT_FIELDS) {
            Object value = metadata.get(field);
            if (value != null && (value instanceof Map || value instanceof List)) {
                report.check("Field is a scalar: " + field, false, "",
                    INVALID_FIELD_TYPE, "Front-matter field '" + field + "' must be a single value", "front_matter." + field);
            }
        }

        if (metadata.has(SpecMetadata.COMPLEXITY)) {
            report.check("Complexity is valid", metadata.complexity().isPresent(),
                "Complexity: " + metadata.get(SpecMetadata.COMPLEXITY), INVALID_COMPLEXITY,
                "Invalid complexity '" + metadata.get(SpecMetadata.COMPLEXITY) + "'. Must be EASY, MODERATE or HIGH",
                "front_matter.complexity");
        }

        if (metadata.has(SpecMetadata.MATURITY)) {
            OptionalInt maturity = metadata.maturity();
            report.check("Maturity is valid", maturity.isPresent() && inRange(maturity.getAsInt()),
                "Maturity: " + metadata.get(SpecMetadata.MATURITY), INVALID_MATURITY,
                "Invalid maturity '" + metadata.get(SpecMetadata.MATURITY) + "'. Must be an integer from 1 to 5",
                "front_matter.maturity");
        }
    }

    private static void checkSections(Specification spec, Complexity complexity, int maturity, GateReport report) {
        int minimum = RequiredSections.minimumMaturity(complexity);
        if (maturity < minimum) {
            List<String> fullOnly = new ArrayList<>(RequiredSections.introducedAt(RequiredSections.MAX_MATURITY));
            List<String> missing = fullOnly.stream().filter(section -> !hasSection(spec, section)).toList();
            List<String> named = missing.isEmpty() ? fullOnly : missing;
            report.check("Maturity meets complexity minimum", false, "",
                MATURITY_BELOW_MINIMUM,
                complexity + " complexity requires maturity " + minimum + " (declared " + maturity
                    + "); maturity-" + minimum + " sections required: " + String.join(", ", named),
                "front_matter.maturity");
        }

        List<String> required = spec.isMaturityLevelFormat()
            ? RequiredSections.levels(complexity, maturity)
            : RequiredSections.formal(complexity, maturity);

        for (String section : required) {
            boolean present = spec.isMaturityLevelFormat() ? hasLevel(spec, section) : hasSection(spec, section);
            report.check("Required section present: " + section, present, "Section '" + section + "' found",
                MISSING_SECTION, "Missing required section: " + section, section);
        }
    }

    /**
     * Finds a section at top level or inside a maturity-level section; it must be non-empty.
     */
    static boolean hasSection(Specification spec, String section) {
        if (nonEmpty(spec.sections().get(section))) {
            return true;
        }
        if (SectionKeys.ACCEPTANCE_TESTS.equals(section) && nonEmpty(spec.sections().get(SectionKeys.ACCEPTANCE_CRITERIA))) {
            return true;
        }
        for (Map.Entry<String, Object> entry : spec.sections().entrySet()) {
            if (SectionKeys.isLevelKey(entry.getKey())
                    && entry.getValue() instanceof Map<?, ?> nested
                    && nonEmpty(nested.get(section))) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasLevel(Specification spec, String levelKey) {
        int level = Character.getNumericValue(levelKey.charAt("level_".length()));
        String key = SectionKeys.findLevelKey(spec.sections().keySet(), level);
        return key != null && nonEmpty(spec.sections().get(key));
    }

    private static boolean nonEmpty(Object value) {
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof Map<?, ?> nested) {
            return nested.values().stream().anyMatch(StructureGate::nonEmpty);
        }
        return false;
    }

    private static boolean inRange(int maturity) {
        return maturity >= RequiredSections.MIN_MATURITY && maturity <= RequiredSections.MAX_MATURITY;
    }
}
