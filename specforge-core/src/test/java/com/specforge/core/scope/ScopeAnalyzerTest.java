package com.specforge.core.scope;

import com.specforge.core.SpecFixtures;
import com.specforge.core.model.Specification;
import com.specforge.core.parser.SpecParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ScopeAnalyzer}.
 */
class ScopeAnalyzerTest {

    private final SpecParser parser = new SpecParser();
    private final ScopeAnalyzer analyzer = new ScopeAnalyzer();

    @Test
    void analyzeSpec_smallSpec_doesNotSplit() {
        ScopeAssessment assessment = analyzer.analyzeSpec(parser.parse(SpecFixtures.AGENT_READY_MODERATE));

        assertThat(assessment.shouldSplit()).isFalse();
        assertThat(assessment.score()).isLessThan(ScopeAnalyzer.SPLIT_THRESHOLD);
        assertThat(assessment.confidence()).isEqualTo(SplitConfidence.VERY_LOW);
        assertThat(assessment.factor(ScopeAnalyzer.MANY_REQUIREMENTS).count()).isEqualTo(2);
        assertThat(assessment.recommendations())
            .extracting(Recommendation::type)
            .containsExactly("no-split");
    }

    @Test
    void analyzeSpec_manyRequirementsPersonasAndIntegrations_splits() {
        ScopeAssessment assessment = analyzer.analyzeSpec(parser.parse(largeSpec("MODERATE")));

        assertThat(assessment.shouldSplit()).isTrue();
        assertThat(assessment.score()).isGreaterThanOrEqualTo(ScopeAnalyzer.SPLIT_THRESHOLD);
        assertThat(assessment.factor(ScopeAnalyzer.MANY_REQUIREMENTS).count()).isEqualTo(15);
        assertThat(assessment.factor(ScopeAnalyzer.MULTIPLE_PERSONAS).count()).isEqualTo(4);
        assertThat(assessment.factor(ScopeAnalyzer.MANY_INTEGRATIONS).count()).isEqualTo(3);
        assertThat(assessment.contributingFactors())
            .extracting(ScopeFactor::name)
            .contains(ScopeAnalyzer.MANY_REQUIREMENTS, ScopeAnalyzer.MULTIPLE_PERSONAS, ScopeAnalyzer.MANY_INTEGRATIONS);
        assertThat(assessment.recommendations())
            .extracting(Recommendation::type)
            .contains("persona-split", "functional-split", "integration-split", "guidance");
    }

    @Test
    void analyzeSpec_highComplexity_usesLowerThreshold() {
        // 12 requirements (2.0), 3 integrations (3.0) and 4 workflow words (2.0)
        String text = """
            ---
            name: Payouts
            complexity: %s
            maturity: 5
            ---

            ## Functional Requirements
            """ + requirements(12) + """

            ### Integration: Stripe
            ### Integration: Adyen
            ### Integration: Plaid

            We run one workflow, one pipeline, one process and one flow.
            """;

        ScopeAssessment moderate = analyzer.analyzeSpec(parser.parse(text.formatted("MODERATE")));
        ScopeAssessment high = analyzer.analyzeSpec(parser.parse(text.formatted("HIGH")));

        assertThat(moderate.score()).isEqualTo(high.score());
        assertThat(high.score())
            .isGreaterThanOrEqualTo(ScopeAnalyzer.HIGH_COMPLEXITY_SPLIT_THRESHOLD)
            .isLessThan(ScopeAnalyzer.SPLIT_THRESHOLD);
        assertThat(moderate.shouldSplit()).isFalse();
        assertThat(high.shouldSplit()).isTrue();
    }

    @Test
    void analyzeSpec_sameSpec_isDeterministic() {
        Specification spec = parser.parse(largeSpec("HIGH"));

        assertThat(analyzer.analyzeSpec(spec)).isEqualTo(analyzer.analyzeSpec(spec));
    }

    private static String largeSpec(String complexity) {
        return """
            ---
            name: Marketplace
            complexity: %s
            maturity: 3
            ---

            ## User Stories

            - As a buyer, I want to compare offers
            - As a seller, I want to publish offers
            - As an auditor, I want to review payouts
            - As a courier, I want to see pickups

            ## Functional Requirements
            """.formatted(complexity) + requirements(15) + """

            ## Interfaces and Contracts

            ### Integration: Stripe
            ### Integration: Mailgun
            ### Integration: Twilio
            """;
    }

    private static String requirements(int count) {
        StringBuilder text = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            text.append("### FR-").append(i).append(": Capability ").append(i).append('\n');
        }
        return text.toString();
    }
}
