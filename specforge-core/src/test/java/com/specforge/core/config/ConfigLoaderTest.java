package com.specforge.core.config;

import com.specforge.core.pipeline.SkipFlag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigLoader loader = new ConfigLoader(Map.of());

    @Test
    void read_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("specforge.yaml");
        Files.writeString(configFile, """
            runs:
              baseDir: "./build/runs"

            ai:
              model: "sonnet"
              maxRetries: 4
              baseDelayMs: 50
              phaseTimeoutMs: 30000
              routing:
                implement: "opus"

            patch:
              crossFileAtomic: false

            pipeline:
              skip:
                - review
                - Tests
                - nonsense

            tests:
              command: "mvn -B -q test"
              timeoutMs: 90000
              maxFixIterations: 3
            """);

        SpecForgeConfig config = loader.read(configFile);

        assertThat(config.runs().baseDirPath()).isEqualTo(Path.of("./build/runs"));
        assertThat(config.ai().retryPolicy().maxRetries()).isEqualTo(4);
        assertThat(config.ai().retryPolicy().baseDelay()).isEqualTo(Duration.ofMillis(50));
        assertThat(config.ai().generationOptions().timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.ai().aiRouting().modelFor("implement")).isEqualTo("opus");
        assertThat(config.ai().aiRouting().modelFor("review")).isEqualTo("sonnet");
        assertThat(config.patch().crossFileAtomic()).isFalse();
        assertThat(config.pipeline().skipFlags()).containsExactlyInAnyOrder(SkipFlag.REVIEW, SkipFlag.TESTS);
        assertThat(config.testSettings().command()).isEqualTo("mvn -B -q test");
        assertThat(config.testSettings().timeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(config.testSettings().maxFixIterations()).isEqualTo(3);
        assertThat(config.testSettings().crossFileAtomic()).isFalse();
    }

    @Test
    void read_partialYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("specforge.yaml");
        Files.writeString(configFile, """
            ai:
              model: "haiku"
            """);

        SpecForgeConfig config = loader.read(configFile);

        assertThat(config.runs().baseDir()).isEqualTo("runs");
        assertThat(config.ai().maxRetries()).isEqualTo(2);
        assertThat(config.patch().crossFileAtomic()).isTrue();
        assertThat(config.pipeline().skip()).isEmpty();
        assertThat(config.tests().command()).isNull();
        assertThat(config.tests().maxFixIterations()).isZero();
        assertThat(config.testSettings().isConfigured()).isFalse();
    }

    @Test
    void read_nonExistentFile_returnsDefaults() {
        SpecForgeConfig config = loader.read(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(SpecForgeConfig.defaults());
    }

    @Test
    void read_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("specforge.yaml");
        Files.writeString(configFile, """
            runs:
              baseDir: "unterminated
            ai: [
            """);

        assertThat(loader.read(configFile)).isEqualTo(SpecForgeConfig.defaults());
    }

    @Test
    void read_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("specforge.yaml");
        Files.writeString(configFile, "");

        assertThat(loader.read(configFile)).isEqualTo(SpecForgeConfig.defaults());
    }

    @Test
    void read_directory_returnsDefaults() {
        assertThat(loader.read(tempDir)).isEqualTo(SpecForgeConfig.defaults());
    }

    @Test
    void read_environment_overridesFileValues() throws IOException {
        Path configFile = tempDir.resolve("specforge.yaml");
        Files.writeString(configFile, """
            runs:
              baseDir: "from-file"
            ai:
              model: "haiku"
            tests:
              maxFixIterations: 1
            """);
        ConfigLoader withEnv = new ConfigLoader(Map.of(
            ConfigLoader.ENV_RUNS_DIR, "/tmp/runs",
            ConfigLoader.ENV_ANTHROPIC_MODEL, "opus",
            ConfigLoader.ENV_TEST_COMMAND, "./gradlew test",
            ConfigLoader.ENV_MAX_FIX_ITERATIONS, "4"));

        SpecForgeConfig config = withEnv.read(configFile);

        assertThat(config.runs().baseDir()).isEqualTo("/tmp/runs");
        assertThat(config.ai().model()).isEqualTo("opus");
        assertThat(config.tests().command()).isEqualTo("./gradlew test");
        assertThat(config.tests().maxFixIterations()).isEqualTo(4);
    }

    @Test
    void read_specforgeModelTakesPrecedenceOverAnthropicModel() {
        ConfigLoader withEnv = new ConfigLoader(Map.of(
            ConfigLoader.ENV_MODEL, "sonnet",
            ConfigLoader.ENV_ANTHROPIC_MODEL, "opus"));

        assertThat(withEnv.read(tempDir.resolve("missing.yaml")).ai().model()).isEqualTo("sonnet");
    }

    @Test
    void read_nonNumericFixIterations_isIgnored() {
        ConfigLoader withEnv = new ConfigLoader(Map.of(ConfigLoader.ENV_MAX_FIX_ITERATIONS, "many"));

        assertThat(withEnv.read(tempDir.resolve("missing.yaml"))).isEqualTo(SpecForgeConfig.defaults());
    }

    @Test
    void read_wrongValueType_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("specforge.yaml");
        Files.writeString(configFile, """
            ai:
              maxRetries: "several"
            """);

        assertThat(loader.read(configFile)).isEqualTo(SpecForgeConfig.defaults());
    }

    @Test
    void read_topLevelList_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("specforge.yaml");
        Files.writeString(configFile, "- runs\n- ai\n");

        assertThat(loader.read(configFile)).isEqualTo(SpecForgeConfig.defaults());
    }

    @Test
    void validate_reportsUnknownSkipNamesRoutingKeysAndFixLoopWithoutCommand() {
        SpecForgeConfig config = new SpecForgeConfig(null,
            new SpecForgeConfig.AiConfig(null, null, null, null, null, null, Map.of("implemnt", "opus", "review", "haiku")),
            null,
            new SpecForgeConfig.PipelineConfig(List.of("review", "docs")),
            new SpecForgeConfig.TestsConfig(null, null, 2));

        assertThat(ConfigLoader.validate(config)).containsExactly(
            "pipeline.skip entry 'docs' is not one of review, tests, implementation; ignored",
            "ai.routing key 'implemnt' names no built-in phase",
            "tests.maxFixIterations is 2 but tests.command is not set; no tests will run");
    }

    @Test
    void validate_defaults_hasNoProblems() {
        assertThat(ConfigLoader.validate(SpecForgeConfig.defaults())).isEmpty();
    }
}
