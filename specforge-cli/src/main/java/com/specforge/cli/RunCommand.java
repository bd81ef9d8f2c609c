package com.specforge.cli;

import com.specforge.core.ai.AiGateway;
import com.specforge.core.ai.ResilientAiProvider;
import com.specforge.core.ai.UnavailableAiProvider;
import com.specforge.core.config.ConfigLoader;
import com.specforge.core.config.SpecForgeConfig;
import com.specforge.core.error.SpecForgeException;
import com.specforge.core.pipeline.PipelineOptions;
import com.specforge.core.pipeline.PipelineOrchestrator;
import com.specforge.core.pipeline.PipelineResult;
import com.specforge.core.pipeline.PipelineStatus;
import com.specforge.core.pipeline.SkipFlag;
import com.specforge.core.pipeline.phase.DefaultPhases;
import com.specforge.core.pipeline.phase.RunTestsPhase;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to run, or resume, the pipeline for a specification.
 *
 * <p>No AI backend ships with the command surface; AI phases fail with a clear message
 * unless skipped. Library consumers pass their own provider to {@link AiGateway}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Validate and analyze only
 * specforge run specs/feature.md --skip-review --skip-tests --skip-implementation
 *
 * # Plan without executing
 * specforge run specs/feature.md --dry-run
 *
 * # Start over from a phase
 * specforge run specs/feature.md --from-step analyze
 *
 * # Run the project's tests after patching, with up to two fix attempts
 * specforge run specs/feature.md --test-command "mvn -B -q test" --max-fix-iterations 2
 * }</pre>
 */
@Command(
    name = "run",
    description = "Run or resume the pipeline for a specification",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(index = "0", description = "Specification file")
    private Path specFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: specforge.yaml)")
    private Path configPath = Paths.get(SpecForgeConfig.DEFAULT_FILE);

    @Option(names = {"--runs-dir"}, description = "Directory holding runs (overrides config)")
    private Path runsDir;

    @Option(names = {"--work-dir"}, description = "Project directory that tests and patches are written to (default: .)")
    private Path workDir = Paths.get(".");

    @Option(names = {"--from-step"}, description = "Start a fresh run at this phase")
    private String fromStep;

    @Option(names = {"--stop-after"}, description = "Stop the run after this phase")
    private String stopAfter;

    @Option(names = {"--dry-run"}, description = "Record the plan without running any phase")
    private boolean dryRun;

    @Option(names = {"--no-resume"}, description = "Always start a fresh run")
    private boolean noResume;

    @Option(names = {"--run-id"}, description = "Explicit id for a new run")
    private String runId;

    @Option(names = {"--skip-review"}, description = "Skip the AI review phase")
    private boolean skipReview;

    @Option(names = {"--skip-tests"}, description = "Skip AI test generation and the project test run")
    private boolean skipTests;

    @Option(names = {"--skip-implementation"}, description = "Skip AI implementation and patching")
    private boolean skipImplementation;

    @Option(names = {"--test-command"}, description = "Test command run after patching (overrides tests.command)")
    private String testCommand;

    @Option(names = {"--max-fix-iterations"}, description = "AI fix attempts after failing tests (overrides tests.maxFixIterations)")
    private Integer maxFixIterations;

    @Override
    public Integer call() {
        SpecForgeConfig config = ConfigLoader.load(configPath);
        PipelineOptions options = buildOptions(config);

        AiGateway ai = new AiGateway(
            new ResilientAiProvider(new UnavailableAiProvider(), null, config.ai().retryPolicy()),
            config.ai().aiRouting(),
            config.ai().generationOptions());
        RunTestsPhase.Settings tests;
        try {
            tests = testSettings(config);
        } catch (IllegalArgumentException e) {
            System.err.println("✗ " + e.getMessage());
            return 2;
        }
        PipelineOrchestrator orchestrator =
            new PipelineOrchestrator(DefaultPhases.create(ai, config.patch().crossFileAtomic(), tests));

        try {
            log.info("Running pipeline for: {}", specFile.toAbsolutePath());
            PipelineResult result = orchestrator.run(specFile, options);
            StatusCommand.print(PipelineStatus.of(result.run()));
            if (!result.executed().isEmpty()) {
                System.out.println("Executed this time: " + String.join(", ", result.executed()));
            }
            return result.isSuccessful() ? 0 : 1;
        } catch (IOException e) {
            System.err.println("✗ Cannot read " + specFile + ": " + e.getMessage());
            return 2;
        } catch (SpecForgeException e) {
            log.error("Pipeline failed", e);
            System.err.println("✗ Pipeline failed [" + e.getErrorCode().code() + "]: " + e.getMessage());
            System.err.println("  " + e.getRemediation());
            return 2;
        }
    }

    private RunTestsPhase.Settings testSettings(SpecForgeConfig config) {
        RunTestsPhase.Settings configured = config.testSettings();
        if (maxFixIterations != null && maxFixIterations < 0) {
            throw new IllegalArgumentException("--max-fix-iterations must not be negative");
        }
        return new RunTestsPhase.Settings(
            testCommand != null ? testCommand : configured.command(),
            configured.timeout(),
            maxFixIterations != null ? maxFixIterations : configured.maxFixIterations(),
            configured.crossFileAtomic());
    }

    private PipelineOptions buildOptions(SpecForgeConfig config) {
        PipelineOptions.Builder builder = PipelineOptions.builder(runsDir != null ? runsDir : config.runs().baseDirPath())
            .workDir(workDir.toAbsolutePath().normalize())
            .skip(config.pipeline().skipFlags())
            .fromStep(fromStep)
            .stopAfter(stopAfter)
            .dryRun(dryRun)
            .resume(!noResume)
            .runId(runId);
        if (skipReview) {
            builder.skip(SkipFlag.REVIEW);
        }
        if (skipTests) {
            builder.skip(SkipFlag.TESTS);
        }
        if (skipImplementation) {
            builder.skip(SkipFlag.IMPLEMENTATION);
        }
        return builder.build();
    }
}
