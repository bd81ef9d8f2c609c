package com.specforge.core.parser;

import com.specforge.core.SpecFixtures;
import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.ParseFault;
import com.specforge.core.model.Complexity;
import com.specforge.core.model.DeterministicTest;
import com.specforge.core.model.FunctionalRequirement;
import com.specforge.core.model.Specification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SpecParser}.
 */
class SpecParserTest {

    @TempDir
    Path tempDir;

    private final SpecParser parser = new SpecParser();

    @Test
    void parse_completeDocument_extractsMetadataAndSections() {
        Specification spec = parser.parse(SpecFixtures.AGENT_READY_MODERATE);

        assertThat(spec.metadata()).isNotNull();
        assertThat(spec.metadata().id()).isEqualTo("feat-order-export");
        assertThat(spec.complexity()).contains(Complexity.MODERATE);
        assertThat(spec.maturity()).hasValue(3);
        assertThat(spec.sections()).containsKeys(
            SectionKeys.OVERVIEW,
            SectionKeys.FUNCTIONAL_REQUIREMENTS,
            SectionKeys.NON_FUNCTIONAL_REQUIREMENTS,
            SectionKeys.SECURITY,
            SectionKeys.USER_STORIES,
            SectionKeys.ACCEPTANCE_CRITERIA);
        assertThat(spec.sourcePath()).isNull();
    }

    @Test
    void parse_functionalRequirements_collectsValidationCriteria() {
        Specification spec = parser.parse(SpecFixtures.AGENT_READY_MODERATE);

        assertThat(spec.functionalRequirements())
            .extracting(FunctionalRequirement::id)
            .containsExactly("FR-1", "FR-2");
        FunctionalRequirement first = spec.functionalRequirements().get(0);
        assertThat(first.description()).isEqualTo("Export orders");
        assertThat(first.validationCriteria()).containsExactly(
            "The CSV has one row per completed order",
            "Columns appear in the documented order");
    }

    @Test
    void parse_storiesAndCriteria_extractsBoth() {
        Specification spec = parser.parse(SpecFixtures.AGENT_READY_MODERATE);

        assertThat(spec.userStories()).hasSize(1);
        assertThat(spec.userStories().get(0)).startsWith("As an administrator, I want to export orders");
        assertThat(spec.acceptanceCriteria()).hasSize(2);
        assertThat(spec.acceptanceCriteria().get(0)).startsWith("AC-1: Given completed orders exist");
    }

    @Test
    void parse_noFrontMatter_returnsNullMetadata() {
        Specification spec = parser.parse("""
            # Overview

            Plain markdown without front matter.
            """);

        assertThat(spec.metadata()).isNull();
        assertThat(spec.complexity()).isEmpty();
        assertThat(spec.specId()).isEqualTo("spec");
        assertThat(spec.sections()).containsKey(SectionKeys.OVERVIEW);
    }

    @Test
    void parse_malformedFrontMatter_throwsParseFault() {
        String text = """
            ---
            name: [unclosed
            ---

            # Overview
            """;

        assertThatThrownBy(() -> parser.parse(text))
            .isInstanceOf(ParseFault.class)
            .satisfies(e -> assertThat(((ParseFault) e).getErrorCode()).isEqualTo(ErrorCode.PARSE_FRONT_MATTER));
    }

    @Test
    void parse_legacyFields_normalizesAliasesAndDerivesId() {
        Specification spec = parser.parse("""
            ---
            title: Example Name
            maturity_level: 2
            complexity: EASY
            ---

            # Overview
            """);

        assertThat(spec.metadata().name()).isEqualTo("Example Name");
        assertThat(spec.metadata().id()).isEqualTo("feat-example-name");
        assertThat(spec.metadata().kind()).isEqualTo(FieldAliases.DEFAULT_KIND);
        assertThat(spec.metadata().formatVersion()).isEqualTo(FieldAliases.DEFAULT_FORMAT_VERSION);
        assertThat(spec.maturity()).hasValue(2);
    }

    @Test
    void parse_frontMatterAfterTitle_isRecognized() {
        Specification spec = parser.parse("""
            # Order Export

            ---
            name: Order Export
            complexity: EASY
            maturity: 1
            ---

            ## Overview

            Short description.
            """);

        assertThat(spec.metadata()).isNotNull();
        assertThat(spec.metadata().id()).isEqualTo("feat-order-export");
    }

    @Test
    void parse_headingInsideCodeFence_isContent() {
        Specification spec = parser.parse("""
            # Overview

            ```markdown
            # Not a heading
            ```
            """);

        assertThat(spec.sections()).containsOnlyKeys(SectionKeys.OVERVIEW);
        assertThat(spec.sectionText(SectionKeys.OVERVIEW)).contains("# Not a heading");
    }

    @Test
    void parse_crlfLineEndings_parsesLikeLf() {
        Specification lf = parser.parse(SpecFixtures.AGENT_READY_MODERATE);
        Specification crlf = parser.parse(SpecFixtures.AGENT_READY_MODERATE.replace("\n", "\r\n"));

        assertThat(crlf.functionalRequirements()).isEqualTo(lf.functionalRequirements());
        assertThat(crlf.acceptanceCriteria()).isEqualTo(lf.acceptanceCriteria());
    }

    @Test
    void parse_deterministicTests_dropsInvalidBlockAndKeepsOthers() {
        Specification spec = parser.parse("""
            ---
            name: Totals
            complexity: HIGH
            maturity: 5
            ---

            ## Deterministic Tests

            DT-7: order total
            ```json
            {"input": {"items": [2, 3]}, "expected": {"total": 5}}
            ```

            ```json
            {"input": broken
            ```

            ```json
            [{"id": "DT-9", "input": 1, "expected": 2}]
            ```
            """);

        assertThat(spec.deterministicTests())
            .extracting(DeterministicTest::id)
            .containsExactly("DT-7", "DT-9");
        assertThat(spec.deterministicTests().get(0).hasConcreteExpected()).isTrue();
        assertThat(spec.parseIssues()).hasSize(1);
        assertThat(spec.parseIssues().get(0).code()).isEqualTo(ErrorCode.PARSE_BLOCK);
        assertThat(spec.parseIssues().get(0).location()).isEqualTo("deterministic_tests block 2");
    }

    @Test
    void parse_maturityLevelLayout_mapsNestedSections() {
        Specification spec = parser.parse("""
            ---
            name: Layered
            complexity: EASY
            maturity: 2
            ---

            ## Level 1: Foundation

            ### Overview
            Short feature.

            ### Acceptance Criteria
            - Given a user, when they sign in, then they see the dashboard

            ## Level 2: Technical Context

            ### Functional Requirements
            - FR-1: Sign-in form
            """);

        assertThat(spec.isMaturityLevelFormat()).isTrue();
        assertThat(spec.acceptanceCriteria()).containsExactly("Given a user, when they sign in, then they see the dashboard");
        assertThat(spec.functionalRequirements()).extracting(FunctionalRequirement::id).containsExactly("FR-1");
    }

    @Test
    void parse_file_recordsAbsoluteSourcePath() throws IOException {
        Path file = SpecFixtures.write(tempDir, "specs/export.md", SpecFixtures.AGENT_READY_MODERATE);

        Specification spec = parser.parse(file);

        assertThat(spec.sourcePath()).isEqualTo(file.toAbsolutePath().normalize());
        assertThat(spec.raw()).isEqualTo(SpecFixtures.AGENT_READY_MODERATE);
    }

    @Test
    void parse_sameText_isDeterministic() {
        Specification first = parser.parse(SpecFixtures.AGENT_READY_MODERATE);
        Specification second = parser.parse(SpecFixtures.AGENT_READY_MODERATE);

        assertThat(second).isEqualTo(first);
    }
}
