package com.specforge.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.specforge.core.pipeline.phase.DefaultPhases;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads {@code specforge.yaml}, applies environment overrides and reports suspicious values.
 *
 * <p>Precedence, lowest first: built-in defaults, the YAML file, environment variables. A
 * missing, unreadable or unparseable file contributes nothing; the environment still applies.
 * Recognized variables:
 * <ul>
 *   <li>{@code SPECFORGE_RUNS_DIR} sets {@code runs.baseDir}</li>
 *   <li>{@code SPECFORGE_MODEL}, or {@code ANTHROPIC_MODEL}, sets {@code ai.model}</li>
 *   <li>{@code SPECFORGE_TEST_COMMAND} sets {@code tests.command}</li>
 *   <li>{@code SPECFORGE_MAX_FIX_ITERATIONS} sets {@code tests.maxFixIterations}</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SpecForgeConfig config = ConfigLoader.load(Paths.get("specforge.yaml"));
 * Path runs = config.runs().baseDirPath();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String ENV_RUNS_DIR = "SPECFORGE_RUNS_DIR";
    static final String ENV_MODEL = "SPECFORGE_MODEL";
    static final String ENV_ANTHROPIC_MODEL = "ANTHROPIC_MODEL";
    static final String ENV_TEST_COMMAND = "SPECFORGE_TEST_COMMAND";
    static final String ENV_MAX_FIX_ITERATIONS = "SPECFORGE_MAX_FIX_ITERATIONS";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, String> environment;

    /**
     * Creates a loader reading overrides from the given environment.
     *
     * @param environment variable name to value
     */
    public ConfigLoader(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment must not be null"));
    }

    /**
     * Loads configuration with overrides from the process environment.
     *
     * @param configPath path to {@code specforge.yaml}
     * @return effective configuration; never null
     */
    public static SpecForgeConfig load(Path configPath) {
        return new ConfigLoader(System.getenv()).read(configPath);
    }

    /**
     * Loads configuration from a file and this loader's environment.
     *
     * @param configPath path to {@code specforge.yaml}
     * @return effective configuration; never null
     */
    public SpecForgeConfig read(Path configPath) {
        ObjectNode tree = readTree(configPath);
        applyEnvironment(tree);

        SpecForgeConfig config;
        try {
            config = yamlMapper.treeToValue(tree, SpecForgeConfig.class);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Configuration {} has values of the wrong type ({}); using defaults", configPath, e.getMessage());
            config = SpecForgeConfig.defaults();
        }
        validate(config).forEach(problem -> log.warn("Configuration {}: {}", configPath, problem));
        return config;
    }

    /**
     * Lists values that load but are probably mistakes.
     *
     * @param config effective configuration
     * @return human-readable problems; empty when the configuration looks consistent
     */
    public static List<String> validate(SpecForgeConfig config) {
        List<String> problems = new ArrayList<>();
        for (String name : config.pipeline().unknownSkipNames()) {
            problems.add("pipeline.skip entry '" + name + "' is not one of review, tests, implementation; ignored");
        }
        for (String phase : config.ai().routing().keySet()) {
            if (!DefaultPhases.NAMES.contains(phase)) {
                problems.add("ai.routing key '" + phase + "' names no built-in phase");
            }
        }
        if (config.tests().maxFixIterations() > 0 && config.tests().command() == null) {
            problems.add("tests.maxFixIterations is " + config.tests().maxFixIterations()
                + " but tests.command is not set; no tests will run");
        }
        return problems;
    }

    private ObjectNode readTree(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("No configuration at {}; using defaults", configPath);
            return yamlMapper.createObjectNode();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration {} is not a readable file; using defaults", configPath);
            return yamlMapper.createObjectNode();
        }
        try {
            JsonNode root = yamlMapper.readTree(configPath.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                log.warn("Configuration {} is empty; using defaults", configPath);
                return yamlMapper.createObjectNode();
            }
            if (!(root instanceof ObjectNode object)) {
                log.warn("Configuration {} is not a YAML mapping; using defaults", configPath);
                return yamlMapper.createObjectNode();
            }
            log.info("Loaded configuration from {}", configPath);
            return object;
        } catch (IOException e) {
            log.error("Cannot parse configuration {}: {}; using defaults", configPath, e.getMessage());
            return yamlMapper.createObjectNode();
        }
    }

    private void applyEnvironment(ObjectNode tree) {
        env(ENV_RUNS_DIR).ifPresent(value -> section(tree, "runs").put("baseDir", value));
        env(ENV_MODEL).or(() -> env(ENV_ANTHROPIC_MODEL))
            .ifPresent(value -> section(tree, "ai").put("model", value));
        env(ENV_TEST_COMMAND).ifPresent(value -> section(tree, "tests").put("command", value));
        env(ENV_MAX_FIX_ITERATIONS).ifPresent(value -> {
            try {
                section(tree, "tests").put("maxFixIterations", Integer.parseInt(value.trim()));
            } catch (NumberFormatException e) {
                log.warn("Ignoring {}={}: not an integer", ENV_MAX_FIX_ITERATIONS, value);
            }
        });
    }

    private Optional<String> env(String name) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }

    private static ObjectNode section(ObjectNode tree, String name) {
        JsonNode existing = tree.get(name);
        if (existing instanceof ObjectNode object) {
            return object;
        }
        return tree.putObject(name);
    }
}
