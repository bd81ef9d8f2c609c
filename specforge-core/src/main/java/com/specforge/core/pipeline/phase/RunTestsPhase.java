package com.specforge.core.pipeline.phase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.specforge.core.ai.AiGateway;
import com.specforge.core.ai.GenerationResult;
import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.PhaseFailureException;
import com.specforge.core.patch.PatchApplier;
import com.specforge.core.patch.PatchOptions;
import com.specforge.core.patch.PatchResult;
import com.specforge.core.pipeline.Phase;
import com.specforge.core.pipeline.PhaseApplicabilityStrategies;
import com.specforge.core.pipeline.PhaseApplicabilityStrategy;
import com.specforge.core.pipeline.PhaseContext;
import com.specforge.core.pipeline.PhaseResult;
import com.specforge.core.pipeline.SkipFlag;
import com.specforge.core.testrun.TestCommand;
import com.specforge.core.testrun.TestCommandRunner;
import com.specforge.core.testrun.TestFailure;
import com.specforge.core.testrun.TestRunOutcome;
import com.specforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the project's test command and, if configured, tries to fix failing tests.
 *
 * <p>The fix loop is bounded by {@link Settings#maxFixIterations()}. Each iteration asks the
 * AI provider for a unified diff, records it in {@code artifacts/fix-attempt-NNN/patch-plan.json},
 * applies it to the work directory and re-runs the tests. The phase fails when the tests still
 * fail after the last iteration, or at once when the loop is disabled. Without a configured
 * command the phase completes without running anything.
 */
public class RunTestsPhase implements Phase {

    private static final Logger log = LoggerFactory.getLogger(RunTestsPhase.class);

    public static final String NAME = "run-tests";
    public static final String OUTPUT_FILE = "test-output.txt";
    public static final String PATCH_PLAN_FILE = "patch-plan.json";

    static final int MAX_OUTPUT_CHARS = 8_000;

    static final String FIX_SYSTEM_PROMPT = """
        You fix failing tests by changing the implementation. Reply with a single unified diff \
        relative to the project root, using '--- a/<path>' and '+++ b/<path>' headers and exact \
        context lines. Do not weaken or delete tests. Do not include explanations.""";

    private final AiGateway ai;
    private final TestCommandRunner runner;
    private final Settings settings;
    private final ObjectMapper objectMapper;

    public RunTestsPhase(AiGateway ai, Settings settings) {
        this(ai, new TestCommandRunner(), settings, new ObjectMapper());
    }

    public RunTestsPhase(AiGateway ai, TestCommandRunner runner, Settings settings, ObjectMapper objectMapper) {
        this.ai = Objects.requireNonNull(ai, "ai must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> outputs() {
        return List.of("test_output", "failures", "fix_iterations");
    }

    @Override
    public List<String> dependsOn() {
        return List.of(PatchPhase.NAME);
    }

    @Override
    public PhaseApplicabilityStrategy applicability() {
        return PhaseApplicabilityStrategies.notSkipped(SkipFlag.TESTS);
    }

    @Override
    public PhaseResult run(PhaseContext context) throws IOException {
        if (!settings.isConfigured()) {
            log.info("No test command configured; nothing to run");
            return PhaseResult.success(Map.of("fix_iterations", "0"), "No test command configured");
        }
        Path workDir = context.options().workDir();
        TestCommand command = TestCommand.parse(settings.command(), workDir, settings.timeout());
        Path outputFile = context.artifact(OUTPUT_FILE);

        TestRunOutcome outcome = runner.run(command, outputFile);
        int iteration = 0;
        while (!outcome.passed() && iteration < settings.maxFixIterations()) {
            context.options().cancellation().throwIfAborted(NAME);
            iteration++;
            log.info("Fix attempt {}/{}: {}", iteration, settings.maxFixIterations(), outcome.summary());
            attemptFix(context, iteration, outcome, workDir);
            outcome = runner.run(command, outputFile);
        }

        if (!outcome.passed()) {
            String message = settings.maxFixIterations() == 0
                ? "Tests failed (" + outcome.summary() + "); set tests.maxFixIterations to attempt fixes"
                : "Tests still failing after " + iteration + " fix attempt(s) (" + outcome.summary() + ")";
            throw new PhaseFailureException(ErrorCode.PHASE_FAILED, NAME, message);
        }
        return PhaseResult.success(Map.of(
            "test_output", outputFile.toString(),
            "failures", "0",
            "fix_iterations", String.valueOf(iteration)));
    }

    private void attemptFix(PhaseContext context, int iteration, TestRunOutcome outcome, Path workDir)
            throws IOException {
        GenerationResult response = ai.generate(NAME, FIX_SYSTEM_PROMPT, fixPrompt(context, outcome));
        String diff = ImplementPhase.extractDiff(response.content());

        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("iteration", iteration);
        plan.put("failures", outcome.failures());
        plan.put("patches", diff == null ? List.of() : List.of(Map.of("diff", diff)));
        Path attemptDir = context.artifact(attemptDirName(iteration));
        FileUtils.writeAtomically(attemptDir.resolve(PATCH_PLAN_FILE), objectMapper.writeValueAsBytes(plan));

        if (diff == null) {
            throw new PhaseFailureException(ErrorCode.PHASE_FAILED, NAME,
                "Fix attempt " + iteration + ": provider response contains no unified diff");
        }
        PatchResult applied = PatchApplier.applyPatch(diff, new PatchOptions(workDir, settings.crossFileAtomic()));
        log.info("Fix attempt {} changed {} file(s)", iteration, applied.filesChanged().size());
    }

    static String attemptDirName(int iteration) {
        return String.format(Locale.ROOT, "fix-attempt-%03d", iteration);
    }

    static String fixPrompt(PhaseContext context, TestRunOutcome outcome) {
        StringBuilder prompt = new StringBuilder("The tests fail for this specification:\n\n")
            .append(context.spec().raw())
            .append("\n\n## Failing tests\n");
        if (outcome.failures().isEmpty()) {
            prompt.append("- (none recognized; see output)\n");
        }
        for (TestFailure failure : outcome.failures()) {
            prompt.append("- ").append(failure.name()).append('\n');
            if (!failure.detail().isEmpty()) {
                prompt.append("  ").append(failure.detail().replace("\n", "\n  ")).append('\n');
            }
        }
        String output = outcome.output();
        if (output.length() > MAX_OUTPUT_CHARS) {
            output = output.substring(output.length() - MAX_OUTPUT_CHARS);
        }
        prompt.append("\n## Test output (tail)\n").append(output);
        return prompt.toString();
    }

    /**
     * Test command and fix-loop settings.
     *
     * @param command command line, split on whitespace; blank when no tests should run
     * @param timeout time allowed for one test run
     * @param maxFixIterations fix attempts after a failing run; 0 disables the loop
     * @param crossFileAtomic apply fix diffs all-or-nothing across files
     */
    public record Settings(String command, Duration timeout, int maxFixIterations, boolean crossFileAtomic) {

        public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(10);

        /**
         * Compact constructor with validation.
         */
        public Settings {
            if (timeout == null) {
                timeout = DEFAULT_TIMEOUT;
            }
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            if (maxFixIterations < 0) {
                throw new IllegalArgumentException("maxFixIterations must not be negative");
            }
        }

        public static Settings disabled() {
            return new Settings(null, DEFAULT_TIMEOUT, 0, true);
        }

        public boolean isConfigured() {
            return command != null && !command.isBlank();
        }
    }
}
