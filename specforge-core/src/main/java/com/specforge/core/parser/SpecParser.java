package com.specforge.core.parser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.core.error.ParseFault;
import com.specforge.core.model.DeterministicTest;
import com.specforge.core.model.FunctionalRequirement;
import com.specforge.core.model.ParseIssue;
import com.specforge.core.model.SpecMetadata;
import com.specforge.core.model.Specification;
import com.specforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns specification text into a {@link Specification}.
 *
 * <p>Only malformed front-matter syntax is fatal ({@link ParseFault}). Every other
 * irregularity degrades to absent or empty fields, or to a recorded {@link ParseIssue},
 * so the gates can report it as a violation.
 *
 * <p>Thread-safe; instances hold no per-parse state.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SpecParser parser = new SpecParser();
 * Specification spec = parser.parse(Path.of("specs/checkout.md"));
 * spec.functionalRequirements().forEach(fr -> System.out.println(fr.id()));
 * }</pre>
 *
 * @since 1.0.0
 */
public class SpecParser {

    private static final Logger log = LoggerFactory.getLogger(SpecParser.class);

    private final FrontMatterExtractor frontMatterExtractor = new FrontMatterExtractor();
    private final MarkdownSectionParser sectionParser = new MarkdownSectionParser();
    private final RequirementExtractor requirementExtractor = new RequirementExtractor();
    private final DeterministicTestExtractor testExtractor;

    public SpecParser() {
        this(new ObjectMapper());
    }

    public SpecParser(ObjectMapper objectMapper) {
        this.testExtractor = new DeterministicTestExtractor(objectMapper);
    }

    /**
     * Reads and parses a UTF-8 specification file.
     *
     * @param path specification file
     * @return parsed specification, with its absolute source path recorded
     * @throws IOException if the file cannot be read
     * @throws ParseFault if the front matter is malformed
     */
    public Specification parse(Path path) throws IOException {
        Path absolute = path.toAbsolutePath().normalize();
        log.debug("Parsing specification {}", absolute);
        return parse(FileUtils.readString(absolute), absolute);
    }

    /**
     * Parses specification text.
     *
     * @param text document text
     * @return parsed specification
     * @throws ParseFault if the front matter is malformed
     */
    public Specification parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses specification text, recording where it came from.
     *
     * @param text document text
     * @param sourcePath source path, may be null
     * @return parsed specification
     * @throws ParseFault if the front matter is malformed
     */
    public Specification parse(String text, Path sourcePath) {
        Objects.requireNonNull(text, "text must not be null");
        String normalized = text.replace("\r\n", "\n");
        if (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }

        FrontMatterExtractor.Extracted extracted = frontMatterExtractor.extract(normalized);
        SpecMetadata metadata = extracted.fields() == null ? null : FieldAliases.normalize(extracted.fields());
        if (metadata == null) {
            log.debug("No front matter found{}", sourcePath == null ? "" : " in " + sourcePath);
        }

        MarkdownSectionParser.ParsedSections parsed = sectionParser.parse(extracted.body());
        Map<String, Object> sections = new LinkedHashMap<>(parsed.sections());
        Map<String, String> rawSections = new LinkedHashMap<>(parsed.rawSections());
        MaturityLevelMapper.apply(sections, rawSections);

        List<FunctionalRequirement> requirements = requirementExtractor.functionalRequirements(
            rawSections.getOrDefault(SectionKeys.FUNCTIONAL_REQUIREMENTS, ""));

        String storyText = text(rawSections, SectionKeys.USER_STORIES)
            + "\n" + text(rawSections, SectionKeys.ACCEPTANCE_TESTS)
            + "\n" + levelText(rawSections, 1);
        List<String> userStories = requirementExtractor.userStories(storyText);

        List<String> acceptanceCriteria = requirementExtractor.acceptanceCriteria(
            RequirementExtractor.acceptanceCriteriaText(sections, key -> text(rawSections, key)));

        String testText = text(rawSections, SectionKeys.DETERMINISTIC_TESTS) + "\n" + levelText(rawSections, 5);
        DeterministicTestExtractor.Extraction extraction = testExtractor.extract(testText);
        List<DeterministicTest> tests = extraction.tests();
        List<ParseIssue> issues = new ArrayList<>(extraction.issues());
        issues.forEach(issue -> log.warn("Dropped {}: {}", issue.location(), issue.message()));

        log.debug("Parsed {} sections, {} functional requirements, {} acceptance criteria, {} deterministic tests",
            sections.size(), requirements.size(), acceptanceCriteria.size(), tests.size());

        return new Specification(metadata, sections, rawSections, requirements, userStories,
            acceptanceCriteria, tests, issues, normalized, sourcePath);
    }

    private static String text(Map<String, String> rawSections, String key) {
        return rawSections.getOrDefault(key, "");
    }

    private static String levelText(Map<String, String> rawSections, int level) {
        String key = SectionKeys.findLevelKey(rawSections.keySet(), level);
        return key == null ? "" : rawSections.get(key);
    }
}
