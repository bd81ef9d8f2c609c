package com.specforge.cli;

import com.specforge.core.error.SpecForgeException;
import com.specforge.core.model.Specification;
import com.specforge.core.parser.SpecParser;
import com.specforge.core.scope.Recommendation;
import com.specforge.core.scope.ScopeAnalyzer;
import com.specforge.core.scope.ScopeAssessment;
import com.specforge.core.scope.ScopeFactor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to assess whether a specification is too large and should be split.
 *
 * <p>Advisory: exits 0 whatever the recommendation, 2 when the specification cannot be read.
 */
@Command(
    name = "analyze",
    description = "Assess specification scope and recommend splitting",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(index = "0", description = "Specification file")
    private Path specFile;

    @Override
    public Integer call() {
        Specification spec;
        try {
            log.info("Analyzing specification: {}", specFile);
            spec = new SpecParser().parse(specFile);
        } catch (IOException e) {
            System.err.println("✗ Cannot read " + specFile + ": " + e.getMessage());
            return 2;
        } catch (SpecForgeException e) {
            System.err.println("✗ " + e.getMessage());
            System.err.println("  " + e.getRemediation());
            return 2;
        }

        ScopeAssessment assessment = new ScopeAnalyzer().analyzeSpec(spec);
        System.out.println("Specification: " + spec.specId());
        System.out.printf("Score: %.1f  Confidence: %s%n", assessment.score(), assessment.confidence());
        System.out.println(assessment.shouldSplit() ? "→ Consider splitting this specification" : "✓ Scope looks cohesive");

        if (!assessment.contributingFactors().isEmpty()) {
            System.out.println();
            System.out.println("Contributing factors:");
            for (ScopeFactor factor : assessment.contributingFactors()) {
                System.out.printf("  %-30s count=%d value=%.1f  %s%n",
                    factor.name(), factor.count(), factor.value(), factor.description());
            }
        }
        if (!assessment.recommendations().isEmpty()) {
            System.out.println();
            System.out.println("Recommendations:");
            for (Recommendation recommendation : assessment.recommendations()) {
                System.out.println("  [" + recommendation.priority() + "] " + recommendation.title()
                    + " - " + recommendation.description());
            }
        }
        return 0;
    }
}
