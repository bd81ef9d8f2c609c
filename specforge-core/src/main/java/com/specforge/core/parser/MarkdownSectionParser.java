package com.specforge.core.parser;

import com.specforge.core.model.Specification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a markdown body into a section map keyed by normalized heading.
 *
 * <p><b>Heading model:</b>
 * <ul>
 *   <li>{@code #} always opens a top-level section</li>
 *   <li>{@code ##} opens a top-level section when it is a canonical section name, a
 *       {@code Level N} heading, or no section is open yet; otherwise it nests</li>
 *   <li>{@code ###} nests under the open top-level section</li>
 * </ul>
 *
 * <p>Headings inside fenced code blocks are content. Deeper headings are content.
 * Besides the section map, the parser keeps the unsplit text of every top-level section
 * so extractors can scan it without re-joining sub-sections.
 */
public final class MarkdownSectionParser {

    private static final Pattern HEADING = Pattern.compile("^(#{1,3})\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern FENCE = Pattern.compile("^\\s*(```|~~~)");
    private static final Pattern LEVEL_HEADING = Pattern.compile("^Level\\s+\\d+", Pattern.CASE_INSENSITIVE);

    /**
     * Parsed section maps.
     *
     * @param sections section map; values are {@code String} or {@code Map<String, String>}
     * @param rawSections unsplit text of each top-level section
     */
    public record ParsedSections(Map<String, Object> sections, Map<String, String> rawSections) {
    }

    /**
     * Parses a markdown body.
     *
     * @param body markdown with {@code \n} line endings
     * @return parsed sections
     */
    public ParsedSections parse(String body) {
        Map<String, Object> sections = new LinkedHashMap<>();
        Map<String, String> rawSections = new LinkedHashMap<>();

        SectionBuilder current = null;
        boolean inFence = false;

        for (String line : body.split("\n", -1)) {
            if (FENCE.matcher(line).find()) {
                inFence = !inFence;
            }
            Matcher heading = inFence ? null : HEADING.matcher(line);
            if (heading == null || !heading.matches()) {
                if (current != null) {
                    current.content(line);
                }
                continue;
            }

            int depth = heading.group(1).length();
            String title = heading.group(2).trim();
            String key = SectionKeys.normalize(title);

            boolean topLevel = switch (depth) {
                case 1 -> true;
                case 2 -> current == null || SectionKeys.isCanonical(key) || LEVEL_HEADING.matcher(title).find();
                default -> false;
            };

            if (topLevel) {
                if (current != null) {
                    current.store(sections, rawSections);
                }
                current = new SectionBuilder(key);
            } else if (current != null) {
                current.openSubSection(key, line);
            }
        }

        if (current != null) {
            current.store(sections, rawSections);
        }
        return new ParsedSections(sections, rawSections);
    }

    private static final class SectionBuilder {
        private final String key;
        private final List<String> raw = new ArrayList<>();
        private final List<String> main = new ArrayList<>();
        private final Map<String, List<String>> subSections = new LinkedHashMap<>();
        private List<String> target = main;

        private SectionBuilder(String key) {
            this.key = key;
        }

        void content(String line) {
            raw.add(line);
            target.add(line);
        }

        void openSubSection(String subKey, String headingLine) {
            raw.add(headingLine);
            target = subSections.computeIfAbsent(subKey, k -> new ArrayList<>());
        }

        void store(Map<String, Object> sections, Map<String, String> rawSections) {
            String mainText = String.join("\n", main).trim();
            if (subSections.isEmpty()) {
                sections.put(key, mainText);
            } else {
                Map<String, String> nested = new LinkedHashMap<>();
                if (!mainText.isEmpty()) {
                    nested.put(Specification.MAIN_KEY, mainText);
                }
                subSections.forEach((subKey, lines) -> nested.put(subKey, String.join("\n", lines).trim()));
                sections.put(key, nested);
            }

            String rawText = String.join("\n", raw).trim();
            rawSections.merge(key, rawText, (previous, next) -> previous + "\n\n" + next);
        }
    }
}
