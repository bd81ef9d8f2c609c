package com.specforge.core.scope;

import com.specforge.core.model.Complexity;
import com.specforge.core.model.Specification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic scorer recommending whether a specification should be split.
 *
 * <p>Three groups of indicators are scored over the raw text:
 * <ul>
 *   <li><b>Complexity:</b> requirement headings, distinct personas, integrations,
 *       workflow vocabulary, entities, endpoints, views and roles. Each contributes
 *       {@code weight * min(2, count / threshold)} once its count reaches the threshold.</li>
 *   <li><b>Cohesion:</b> distinct business-domain, data-lifecycle and integration-style
 *       keywords, capped at twice the weight.</li>
 *   <li><b>Size:</b> line and word counts.</li>
 * </ul>
 *
 * <p>The result is advisory only.
 *
 * @since 1.0.0
 */
public class ScopeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ScopeAnalyzer.class);

    public static final double SPLIT_THRESHOLD = 8.0;
    public static final double HIGH_COMPLEXITY_SPLIT_THRESHOLD = 6.0;

    public static final String MANY_REQUIREMENTS = "manyRequirements";
    public static final String MULTIPLE_PERSONAS = "multiplePersonas";
    public static final String MANY_INTEGRATIONS = "manyIntegrations";
    public static final String MULTIPLE_WORKFLOWS = "multipleWorkflows";
    public static final String MULTIPLE_DOMAINS = "multipleDomains";
    public static final String SIZE = "size";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    private static final List<PatternIndicator> COMPLEXITY_INDICATORS = List.of(
        new PatternIndicator(MANY_REQUIREMENTS, "Large number of functional requirements", 2, 12,
            Pattern.compile("^#{2,4}\\s*(?:\\*\\*)?FR[-_ ]?(\\d+)", FLAGS), false),
        new PatternIndicator(MULTIPLE_PERSONAS, "Multiple distinct user personas", 3, 3,
            Pattern.compile("\\bas\\s+an?\\s+([^,\\n]+?)\\s*,\\s*I\\s+want\\b", FLAGS), true),
        new PatternIndicator(MANY_INTEGRATIONS, "Multiple external integrations", 3, 3,
            Pattern.compile("^#{2,4}\\s*(?:Integration|External\\s+System|External\\s+Service)s?\\s*:\\s*\\[?([^\\]\\n]+)", FLAGS), true),
        new PatternIndicator(MULTIPLE_WORKFLOWS, "Multiple workflows or processes", 2, 4,
            Pattern.compile("\\b(?:workflow|pipeline|process|flow)(?:s|es|ing)?\\b", FLAGS), false),
        new PatternIndicator("manyEntities", "Many data entities", 2, 8,
            Pattern.compile("^#{2,4}\\s*Entity\\s*:\\s*\\[?(\\w+)", FLAGS), true),
        new PatternIndicator("manyEndpoints", "Many API endpoints", 1.5, 10,
            Pattern.compile("^#{2,4}\\s*Endpoint\\s*:\\s*\\[?((?:GET|POST|PUT|PATCH|DELETE)\\s+\\S+)", FLAGS), true),
        new PatternIndicator("manyViews", "Many UI views or screens", 1.5, 5,
            Pattern.compile("^#{2,4}\\s*(.+?)\\s*(?:View|Screen|Page|Modal|Form)\\s*$", FLAGS), true),
        new PatternIndicator("complexSecurity", "Complex security with many roles", 2, 5,
            Pattern.compile("\\*\\*Role:\\*\\*\\s*([^|\\n]+)", FLAGS), true)
    );

    private static final List<KeywordIndicator> COHESION_INDICATORS = List.of(
        new KeywordIndicator(MULTIPLE_DOMAINS, "Multiple business domains", 3, 3, List.of(
            "user management", "authentication", "authorization", "billing", "payment", "reporting",
            "analytics", "notification", "messaging", "search", "inventory", "order", "shipping",
            "customer", "product", "catalog")),
        new KeywordIndicator("multipleLifecycleOperations", "Multiple data lifecycle operations", 2, 6, List.of(
            "create", "read", "update", "delete", "import", "export", "sync", "migrate")),
        new KeywordIndicator("multipleIntegrationTypes", "Multiple integration patterns", 2, 4, List.of(
            "webhook", "api", "queue", "stream", "batch", "real-time", "sync", "async"))
    );

    /**
     * Scores a specification.
     *
     * @param spec parsed specification
     * @return scope assessment with every evaluated factor
     */
    public ScopeAssessment analyzeSpec(Specification spec) {
        String content = spec.raw();
        List<ScopeFactor> factors = new ArrayList<>();

        for (PatternIndicator indicator : COMPLEXITY_INDICATORS) {
            int count = indicator.count(content);
            double value = count >= indicator.threshold()
                ? indicator.weight() * Math.min(2.0, (double) count / indicator.threshold())
                : 0.0;
            factors.add(new ScopeFactor(indicator.name(), indicator.description(), count,
                indicator.threshold(), indicator.weight(), round(value)));
        }

        String lower = content.toLowerCase(Locale.ROOT);
        for (KeywordIndicator indicator : COHESION_INDICATORS) {
            int count = indicator.count(lower);
            double value = count >= indicator.threshold()
                ? indicator.weight() * Math.min(2.0, (double) count / indicator.threshold())
                : 0.0;
            factors.add(new ScopeFactor(indicator.name(), indicator.description(), count,
                indicator.threshold(), indicator.weight(), round(value)));
        }

        factors.add(sizeFactor(content));

        double score = round(factors.stream().mapToDouble(ScopeFactor::value).sum());
        boolean high = spec.complexity().orElse(Complexity.MODERATE) == Complexity.HIGH;
        boolean shouldSplit = score >= SPLIT_THRESHOLD || (high && score >= HIGH_COMPLEXITY_SPLIT_THRESHOLD);

        log.debug("Scope score {} (split: {})", score, shouldSplit);
        return new ScopeAssessment(shouldSplit, score, factors, SplitConfidence.fromScore(score),
            recommendations(factors, shouldSplit));
    }

    private static ScopeFactor sizeFactor(String content) {
        int lines = content.split("\n", -1).length;
        String trimmed = content.trim();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;

        double value = 0;
        if (lines > 1000) {
            value += 2;
        } else if (lines > 700) {
            value += 1;
        }
        if (words > 5000) {
            value += 1.5;
        }
        return new ScopeFactor(SIZE, "Specification length (" + lines + " lines, " + words + " words)",
            lines, 700, 1, value);
    }

    private static List<Recommendation> recommendations(List<ScopeFactor> factors, boolean shouldSplit) {
        if (!shouldSplit) {
            return List.of(new Recommendation("no-split", "info", "Specification size is manageable",
                "The specification is well scoped and can be implemented as a single feature."));
        }

        List<Recommendation> recommendations = new ArrayList<>();
        for (ScopeFactor factor : factors) {
            if (!factor.contributes()) {
                continue;
            }
            switch (factor.name()) {
                case MULTIPLE_DOMAINS -> recommendations.add(new Recommendation("domain-split", "high",
                    "Split by business domain", "Covers " + factor.count() + " distinct business domains."));
                case MULTIPLE_PERSONAS -> recommendations.add(new Recommendation("persona-split", "high",
                    "Split by user persona", "Addresses " + factor.count() + " distinct user personas."));
                case MANY_REQUIREMENTS -> recommendations.add(new Recommendation("functional-split", "medium",
                    "Split into smaller feature sets", "Groups " + factor.count()
                        + " functional requirements; split related requirements into separate specifications."));
                case MANY_INTEGRATIONS -> recommendations.add(new Recommendation("integration-split", "medium",
                    "Separate integration concerns", "Includes " + factor.count() + " external integrations."));
                case SIZE -> recommendations.add(new Recommendation("size-split", "low",
                    "Split for maintainability", factor.description()));
                default -> {
                    // Reported through the factor list only
                }
            }
        }
        recommendations.add(new Recommendation("guidance", "info", "Splitting guidance",
            "Give each resulting specification a single purpose, its own acceptance criteria and explicit references to related specifications."));
        return recommendations;
    }

    private static double round(double value) {
        return Math.round(value * 10) / 10.0;
    }

    private record PatternIndicator(String name, String description, double weight, int threshold,
                                    Pattern pattern, boolean distinct) {
        int count(String content) {
            Matcher matcher = pattern.matcher(content);
            if (!distinct) {
                int count = 0;
                while (matcher.find()) {
                    count++;
                }
                return count;
            }
            Set<String> seen = new HashSet<>();
            while (matcher.find()) {
                seen.add(matcher.group(1).trim().toLowerCase(Locale.ROOT));
            }
            return seen.size();
        }
    }

    private record KeywordIndicator(String name, String description, double weight, int threshold,
                                    List<String> keywords) {
        int count(String lowerContent) {
            return (int) keywords.stream()
                .filter(keyword -> Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b").matcher(lowerContent).find())
                .count();
        }
    }
}
