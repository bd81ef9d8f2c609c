package com.specforge.cli;

import com.specforge.core.error.SpecForgeException;
import com.specforge.core.gate.GateCheck;
import com.specforge.core.gate.GateId;
import com.specforge.core.gate.GateResult;
import com.specforge.core.gate.GateValidator;
import com.specforge.core.gate.Violation;
import com.specforge.core.model.ParseIssue;
import com.specforge.core.model.Specification;
import com.specforge.core.parser.SpecParser;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to run the quality gates against a specification.
 *
 * <p>Exit codes: 0 agent-ready, 1 not agent-ready, 2 unreadable or unparseable specification.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * specforge validate specs/feature.md
 * specforge validate specs/feature.md --checks
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Run the quality gates (G1-G4) against a specification",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Specification file")
    private Path specFile;

    @Option(names = {"--checks"}, description = "Print every individual check, not only violations")
    private boolean showChecks;

    @Override
    public Integer call() {
        Specification spec;
        try {
            log.info("Validating specification: {}", specFile);
            spec = new SpecParser().parse(specFile);
        } catch (IOException e) {
            System.err.println("✗ Cannot read " + specFile + ": " + e.getMessage());
            return 2;
        } catch (SpecForgeException e) {
            System.err.println("✗ " + e.getMessage());
            System.err.println("  " + e.getRemediation());
            return 2;
        }

        GateValidator validator = new GateValidator();
        Map<GateId, GateResult> results = validator.runAllGates(spec);

        System.out.println("Specification: " + spec.specId());
        for (ParseIssue issue : spec.parseIssues()) {
            System.out.println("  ! " + issue.location() + ": " + issue.message());
        }
        System.out.println();
        for (GateResult result : results.values()) {
            System.out.printf("%s %s %s (%d%%)%n", result.passed() ? "✓" : "✗",
                result.gate(), result.name(), result.score());
            if (showChecks) {
                for (GateCheck check : result.checks()) {
                    System.out.println("    " + (check.passed() ? "✓ " : "✗ ") + check.name() + ": " + check.message());
                }
            }
            for (Violation violation : result.violations()) {
                System.out.println("    [" + violation.code() + "] " + violation.message()
                    + (violation.location() == null ? "" : " (" + violation.location() + ")"));
            }
        }

        boolean agentReady = validator.isAgentReady(spec, results);
        System.out.println();
        System.out.println("Readiness score: " + GateValidator.readinessScore(results) + "%");
        System.out.println(agentReady ? "✓ Agent-ready" : "✗ Not agent-ready");
        return agentReady ? 0 : 1;
    }
}
