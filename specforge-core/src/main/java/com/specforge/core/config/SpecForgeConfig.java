package com.specforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.specforge.core.ai.AiRouting;
import com.specforge.core.ai.GenerationOptions;
import com.specforge.core.ai.RetryPolicy;
import com.specforge.core.pipeline.SkipFlag;
import com.specforge.core.pipeline.phase.RunTestsPhase;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration for SpecForge.
 *
 * <p>Loaded from {@code specforge.yaml} in the working directory by {@link ConfigLoader}. Every
 * section is optional; missing or out-of-range values fall back to the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * runs:
 *   baseDir: "./runs"
 *
 * ai:
 *   model: "sonnet"
 *   maxRetries: 2
 *   baseDelayMs: 200
 *   phaseTimeoutMs: 120000
 *   routing:
 *     implement: "opus"
 *
 * patch:
 *   crossFileAtomic: true
 *
 * pipeline:
 *   skip:
 *     - review
 *
 * tests:
 *   command: "mvn -B -q test"
 *   timeoutMs: 600000
 *   maxFixIterations: 2
 * }</pre>
 *
 * @param runs run directory settings
 * @param ai AI gateway settings
 * @param patch patch application settings
 * @param pipeline pipeline settings
 * @param tests project test command and fix-loop settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpecForgeConfig(
    @JsonProperty("runs") RunsConfig runs,
    @JsonProperty("ai") AiConfig ai,
    @JsonProperty("patch") PatchConfig patch,
    @JsonProperty("pipeline") PipelineConfig pipeline,
    @JsonProperty("tests") TestsConfig tests
) {
    public static final String DEFAULT_FILE = "specforge.yaml";

    /**
     * Compact constructor with validation.
     */
    public SpecForgeConfig {
        if (runs == null) {
            runs = new RunsConfig(null);
        }
        if (ai == null) {
            ai = new AiConfig(null, null, null, null, null, null, null);
        }
        if (patch == null) {
            patch = new PatchConfig(null);
        }
        if (pipeline == null) {
            pipeline = new PipelineConfig(null);
        }
        if (tests == null) {
            tests = new TestsConfig(null, null, null);
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static SpecForgeConfig defaults() {
        return new SpecForgeConfig(null, null, null, null, null);
    }

    /**
     * Settings for the run-tests phase, combining the test section with the patch mode.
     *
     * @return run-tests settings
     */
    public RunTestsPhase.Settings testSettings() {
        return new RunTestsPhase.Settings(tests.command(), Duration.ofMillis(tests.timeoutMs()),
            tests.maxFixIterations(), patch.crossFileAtomic());
    }

    /**
     * Run directory settings.
     *
     * @param baseDir directory holding run directories
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RunsConfig(@JsonProperty("baseDir") String baseDir) {

        public static final String DEFAULT_BASE_DIR = "runs";

        public RunsConfig {
            if (baseDir == null || baseDir.isBlank()) {
                baseDir = DEFAULT_BASE_DIR;
            }
        }

        public Path baseDirPath() {
            return Path.of(baseDir);
        }
    }

    /**
     * AI gateway settings.
     *
     * @param model default model, or null for the provider default
     * @param maxTokens generation token limit
     * @param temperature sampling temperature
     * @param maxRetries retries after a transient failure
     * @param baseDelayMs first backoff delay in milliseconds
     * @param phaseTimeoutMs time allowed for one provider call in milliseconds
     * @param routing phase name to model overrides
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AiConfig(
        @JsonProperty("model") String model,
        @JsonProperty("maxTokens") Integer maxTokens,
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("maxRetries") Integer maxRetries,
        @JsonProperty("baseDelayMs") Long baseDelayMs,
        @JsonProperty("phaseTimeoutMs") Long phaseTimeoutMs,
        @JsonProperty("routing") Map<String, String> routing
    ) {
        public AiConfig {
            if (maxTokens == null || maxTokens <= 0) {
                maxTokens = GenerationOptions.DEFAULT_MAX_TOKENS;
            }
            if (temperature == null) {
                temperature = GenerationOptions.DEFAULT_TEMPERATURE;
            }
            if (maxRetries == null || maxRetries < 0) {
                maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
            }
            if (baseDelayMs == null || baseDelayMs < 0) {
                baseDelayMs = RetryPolicy.DEFAULT_BASE_DELAY.toMillis();
            }
            if (phaseTimeoutMs == null || phaseTimeoutMs <= 0) {
                phaseTimeoutMs = GenerationOptions.DEFAULT_TIMEOUT.toMillis();
            }
            routing = routing == null ? Map.of() : Map.copyOf(routing);
        }

        public RetryPolicy retryPolicy() {
            return new RetryPolicy(maxRetries, Duration.ofMillis(baseDelayMs));
        }

        public GenerationOptions generationOptions() {
            return new GenerationOptions(model, maxTokens, temperature, Duration.ofMillis(phaseTimeoutMs));
        }

        public AiRouting aiRouting() {
            return new AiRouting(model, routing);
        }
    }

    /**
     * Patch application settings.
     *
     * @param crossFileAtomic apply multi-file diffs all-or-nothing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PatchConfig(@JsonProperty("crossFileAtomic") Boolean crossFileAtomic) {

        public PatchConfig {
            if (crossFileAtomic == null) {
                crossFileAtomic = Boolean.TRUE;
            }
        }
    }

    /**
     * Pipeline settings.
     *
     * @param skip phase groups to skip: {@code review}, {@code tests}, {@code implementation}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PipelineConfig(@JsonProperty("skip") List<String> skip) {

        public PipelineConfig {
            skip = skip == null ? List.of() : List.copyOf(skip);
        }

        /**
         * Converts the configured names to skip flags, ignoring unknown names.
         *
         * @return skip flags
         */
        public Set<SkipFlag> skipFlags() {
            Set<SkipFlag> flags = EnumSet.noneOf(SkipFlag.class);
            for (String name : skip) {
                toFlag(name).ifPresent(flags::add);
            }
            return flags;
        }

        /**
         * Returns the configured names that match no skip flag.
         *
         * @return unknown names, in configured order
         */
        public List<String> unknownSkipNames() {
            return skip.stream().filter(name -> toFlag(name).isEmpty()).toList();
        }

        private static Optional<SkipFlag> toFlag(String name) {
            if (name == null) {
                return Optional.empty();
            }
            for (SkipFlag flag : SkipFlag.values()) {
                if (flag.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                    return Optional.of(flag);
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Project test command and fix-loop settings.
     *
     * @param command test command line, split on whitespace; none by default
     * @param timeoutMs time allowed for one test run in milliseconds
     * @param maxFixIterations AI fix attempts after a failing run; 0 disables the loop
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TestsConfig(
        @JsonProperty("command") String command,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("maxFixIterations") Integer maxFixIterations
    ) {
        public TestsConfig {
            if (command != null && command.isBlank()) {
                command = null;
            }
            if (timeoutMs == null || timeoutMs <= 0) {
                timeoutMs = RunTestsPhase.Settings.DEFAULT_TIMEOUT.toMillis();
            }
            if (maxFixIterations == null || maxFixIterations < 0) {
                maxFixIterations = 0;
            }
        }
    }
}
