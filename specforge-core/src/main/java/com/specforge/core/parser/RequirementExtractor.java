package com.specforge.core.parser;

import com.specforge.core.model.FunctionalRequirement;
import com.specforge.core.model.Specification;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts functional requirements, user stories and acceptance criteria from parsed
 * section text.
 *
 * <p>Extraction is lenient: anything it does not recognize is skipped rather than
 * reported, since format checks belong to the gates.
 */
public final class RequirementExtractor {

    private static final String SEPARATOR = "(?:\\*\\*)?\\s*[:.\\-–)]\\s*(?:\\*\\*)?";

    private static final Pattern FR_HEADING = Pattern.compile(
        "^#{1,6}\\s*(?:\\*\\*)?FR[-_ ]?(\\d+)(?:\\*\\*)?(?:" + SEPARATOR + ")?\\s*(.*)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern FR_ITEM = Pattern.compile(
        "^\\s*(?:[-*+]\\s+)?(?:\\*\\*)?FR[-_ ]?(\\d+)(?:\\*\\*)?\\s*(?:\\*\\*)?\\s*:\\s*(?:\\*\\*)?\\s*(.*)$",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:[-*+]|\\d+[.)])\\s+(?:\\[[ xX]]\\s*)?(.+)$");

    private static final Pattern USER_STORY = Pattern.compile(
        "\\bas\\s+an?\\s+.+?,?\\s+i\\s+want\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern STORY_LABEL = Pattern.compile("^\\*\\*Story\\s+\\d+:\\*\\*\\s*(.*)$", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONTINUATION = Pattern.compile("^\\s*(?:and|when|then|but)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern GIVEN = Pattern.compile("\\bgiven\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Extracts functional requirements from the functional-requirements section.
     *
     * <p>A requirement starts at a heading or list entry carrying an {@code FR-<n>} token.
     * If a "Validation Criteria" marker follows, only the list entries after it become
     * criteria; otherwise every list entry of the requirement does.
     *
     * @param text raw functional-requirements text (may be empty)
     * @return requirements in document order
     */
    public List<FunctionalRequirement> functionalRequirements(String text) {
        List<FunctionalRequirement> requirements = new ArrayList<>();
        RequirementDraft draft = null;

        for (String line : lines(text)) {
            Matcher match = matchRequirement(line);
            if (match != null) {
                if (draft != null) {
                    requirements.add(draft.build());
                }
                draft = new RequirementDraft("FR-" + match.group(1), stripEmphasis(match.group(2)));
                continue;
            }
            if (draft != null) {
                draft.accept(line);
            }
        }
        if (draft != null) {
            requirements.add(draft.build());
        }
        return requirements;
    }

    /**
     * Extracts user stories ("As a ..., I want ...") and labelled stories ({@code **Story 1:**}).
     *
     * @param text combined text of the sections that may hold stories
     * @return distinct stories in document order
     */
    public List<String> userStories(String text) {
        Set<String> stories = new LinkedHashSet<>();
        for (String line : lines(text)) {
            String trimmed = stripListMarker(line);
            Matcher label = STORY_LABEL.matcher(trimmed);
            if (label.matches()) {
                stories.add(label.group(1).trim());
            } else if (USER_STORY.matcher(trimmed).find()) {
                stories.add(trimmed);
            }
        }
        return List.copyOf(stories);
    }

    /**
     * Extracts acceptance-criteria entries.
     *
     * <p>Every list entry is an entry; indented lines and lines starting with
     * {@code When}/{@code Then}/{@code And} continue the previous entry; a free-standing
     * line containing {@code Given} starts one. Headings and blank lines end an entry.
     *
     * @param text combined acceptance-criteria text
     * @return distinct entries in document order
     */
    public List<String> acceptanceCriteria(String text) {
        Set<String> criteria = new LinkedHashSet<>();
        StringBuilder entry = null;

        for (String line : lines(text)) {
            Matcher item = LIST_ITEM.matcher(line);
            boolean blankOrHeading = line.isBlank() || line.trim().startsWith("#") || line.trim().startsWith("|");

            if (item.matches()) {
                flush(criteria, entry);
                entry = new StringBuilder(item.group(1).trim());
            } else if (blankOrHeading) {
                flush(criteria, entry);
                entry = null;
            } else if (entry != null && (Character.isWhitespace(line.charAt(0)) || CONTINUATION.matcher(line).find())) {
                entry.append(' ').append(line.trim());
            } else if (GIVEN.matcher(line).find()) {
                flush(criteria, entry);
                entry = new StringBuilder(line.trim());
            }
        }
        flush(criteria, entry);
        return List.copyOf(criteria);
    }

    /**
     * Collects the acceptance-criteria text of a section map.
     *
     * <p>Sources: a top-level {@code acceptance_criteria} section, the
     * {@code acceptance_criteria} sub-section of {@code acceptance_tests} or of Level 1.
     * When none exists, the body of {@code acceptance_tests} itself is used.
     *
     * @param sections parsed section map
     * @param sectionText accessor for the full text of a top-level section
     * @return combined text
     */
    public static String acceptanceCriteriaText(Map<String, Object> sections, Function<String, String> sectionText) {
        StringBuilder text = new StringBuilder();
        append(text, sectionText.apply(SectionKeys.ACCEPTANCE_CRITERIA));
        append(text, subSection(sections, SectionKeys.ACCEPTANCE_TESTS, SectionKeys.ACCEPTANCE_CRITERIA));
        String level1 = SectionKeys.findLevelKey(sections.keySet(), 1);
        if (level1 != null && !sections.containsKey(SectionKeys.ACCEPTANCE_CRITERIA)) {
            append(text, subSection(sections, level1, SectionKeys.ACCEPTANCE_CRITERIA));
        }

        if (text.isEmpty()) {
            Object tests = sections.get(SectionKeys.ACCEPTANCE_TESTS);
            if (tests instanceof String s) {
                append(text, s);
            } else if (tests instanceof Map<?, ?> nested && nested.get(Specification.MAIN_KEY) instanceof String s) {
                append(text, s);
            }
        }
        return text.toString();
    }

    private static String subSection(Map<String, Object> sections, String key, String subKey) {
        if (sections.get(key) instanceof Map<?, ?> nested && nested.get(subKey) instanceof String s) {
            return s;
        }
        return null;
    }

    private static void append(StringBuilder text, String part) {
        if (part != null && !part.isBlank()) {
            text.append(part).append('\n');
        }
    }

    private static void flush(Set<String> criteria, StringBuilder entry) {
        if (entry != null && !entry.toString().isBlank()) {
            criteria.add(entry.toString().trim());
        }
    }

    private static Matcher matchRequirement(String line) {
        Matcher heading = FR_HEADING.matcher(line);
        if (heading.matches()) {
            return heading;
        }
        Matcher item = FR_ITEM.matcher(line);
        return item.matches() ? item : null;
    }

    private static String[] lines(String text) {
        return text == null || text.isEmpty() ? new String[0] : text.split("\n");
    }

    private static String stripListMarker(String line) {
        return line.replaceFirst("^\\s*(?:[-*+]|\\d+[.)])\\s+", "").trim();
    }

    private static String stripEmphasis(String text) {
        return text.replace("**", "").trim();
    }

    private static final class RequirementDraft {
        private final String id;
        private String description;
        private final List<String> bullets = new ArrayList<>();
        private final List<String> criteria = new ArrayList<>();
        private boolean markerSeen;

        private RequirementDraft(String id, String description) {
            this.id = id;
            this.description = description;
        }

        void accept(String line) {
            if (line.toLowerCase(Locale.ROOT).contains("validation criteria")) {
                markerSeen = true;
                return;
            }
            Matcher item = LIST_ITEM.matcher(line);
            if (item.matches()) {
                (markerSeen ? criteria : bullets).add(stripEmphasis(item.group(1)));
            } else if (description.isEmpty() && !line.isBlank() && !line.trim().startsWith("#")) {
                description = stripEmphasis(line);
            }
        }

        FunctionalRequirement build() {
            return new FunctionalRequirement(id, description, markerSeen ? criteria : bullets);
        }
    }
}
