package com.specforge.core.gate;

import com.specforge.core.model.FunctionalRequirement;
import com.specforge.core.model.Specification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * G3: links functional requirements to acceptance criteria by identifier correlation.
 *
 * <p>An acceptance criterion links to {@code FR-n} when it mentions {@code FR-n}, or when
 * it mentions no requirement at all and its own numeric suffix is {@code n}. Criteria
 * without an explicit {@code AC-n}, {@code AT-n} or {@code TC-n} token are numbered by
 * position ({@code AC-1} is the first criterion).
 */
public final class TraceabilityGate implements Gate {

    public static final String NO_ACCEPTANCE_CRITERIA = "G3_NO_ACCEPTANCE_CRITERIA";
    public static final String UNTRACED_REQUIREMENT = "G3_UNTRACED_REQUIREMENT";
    public static final String STORY_COVERAGE = "G3_INSUFFICIENT_STORY_COVERAGE";

    private static final Pattern CRITERION_ID = Pattern.compile("\\b(AC|AT|TC)[-_]?(\\d+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern REQUIREMENT_REF = Pattern.compile("\\bFR[-_ ]?(\\d+)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public GateId id() {
        return GateId.G3;
    }

    @Override
    public GateResult evaluate(Specification spec) {
        GateReport report = new GateReport(GateId.G3);
        List<FunctionalRequirement> requirements = spec.functionalRequirements();
        List<String> criteria = spec.acceptanceCriteria();

        boolean hasCriteria = requirements.isEmpty() || !criteria.isEmpty();
        report.check("Acceptance criteria exist for requirements", hasCriteria,
            criteria.size() + " acceptance criteria for " + requirements.size() + " requirements",
            NO_ACCEPTANCE_CRITERIA,
            requirements.size() + " functional requirement(s) declared but no acceptance criteria found",
            "acceptance_criteria");

        if (hasCriteria) {
            Map<String, List<String>> matrix = traceabilityMatrix(spec);
            List<String> untraced = matrix.entrySet().stream()
                .filter(entry -> entry.getValue().isEmpty())
                .map(Map.Entry::getKey)
                .toList();
            untraced.forEach(id -> report.violation(UNTRACED_REQUIREMENT,
                id + " has no linked acceptance criterion", id));
            report.summary("Functional requirements traceable to acceptance criteria", untraced.isEmpty(),
                untraced.isEmpty()
                    ? "All " + requirements.size() + " requirements are traced"
                    : "Untraced requirements: " + String.join(", ", untraced));
        }

        int stories = spec.userStories().size();
        report.check("Acceptance criteria cover user stories", criteria.size() >= stories,
            criteria.size() + " acceptance criteria for " + stories + " user stories",
            STORY_COVERAGE,
            "Insufficient acceptance criteria (" + criteria.size() + ") for user stories (" + stories + ")",
            "user_stories");

        return report.result();
    }

    /**
     * Infers which acceptance criteria verify each functional requirement.
     *
     * @param spec parsed specification
     * @return requirement id to linked criterion ids, in requirement order
     */
    public static Map<String, List<String>> traceabilityMatrix(Specification spec) {
        Map<String, List<String>> matrix = new LinkedHashMap<>();
        Map<String, String> byNumber = new LinkedHashMap<>();
        for (FunctionalRequirement requirement : spec.functionalRequirements()) {
            matrix.put(requirement.id(), new ArrayList<>());
            byNumber.putIfAbsent(requirement.numberKey(), requirement.id());
        }

        List<String> criteria = spec.acceptanceCriteria();
        for (int i = 0; i < criteria.size(); i++) {
            String criterion = criteria.get(i);
            String criterionId = criterionId(criterion, i);

            Set<String> referenced = new LinkedHashSet<>();
            Matcher reference = REQUIREMENT_REF.matcher(criterion);
            while (reference.find()) {
                referenced.add(FunctionalRequirement.numberKey(reference.group(1)));
            }
            if (referenced.isEmpty()) {
                referenced.add(number(criterionId));
            }

            for (String number : referenced) {
                String requirementId = byNumber.get(number);
                if (requirementId != null && !matrix.get(requirementId).contains(criterionId)) {
                    matrix.get(requirementId).add(criterionId);
                }
            }
        }

        Map<String, List<String>> result = new LinkedHashMap<>();
        matrix.forEach((id, links) -> result.put(id, List.copyOf(links)));
        return result;
    }

    /**
     * Returns the identifier of an acceptance criterion.
     *
     * @param criterion criterion text
     * @param index zero-based position in the criteria list
     * @return explicit id (upper-cased, hyphenated) or {@code AC-<index+1>}
     */
    static String criterionId(String criterion, int index) {
        Matcher explicit = CRITERION_ID.matcher(criterion);
        if (explicit.find()) {
            return explicit.group(1).toUpperCase(Locale.ROOT) + "-" + explicit.group(2);
        }
        return "AC-" + (index + 1);
    }

    private static String number(String id) {
        return FunctionalRequirement.numberKey(id.substring(id.indexOf('-') + 1));
    }
}
