package com.specforge.core.testrun;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assumptions.assumeThat;

/**
 * Tests for {@link TestCommandRunner}, using {@code sh} as the test command.
 */
class TestCommandRunnerTest {

    @TempDir
    Path tempDir;

    private final TestCommandRunner runner = new TestCommandRunner();

    @BeforeEach
    void requirePosixShell() {
        assumeThat(System.getProperty("os.name").toLowerCase(Locale.ROOT)).doesNotStartWith("windows");
    }

    @Test
    void run_successfulCommand_capturesOutput() throws IOException {
        Path output = tempDir.resolve("artifacts/test-output.txt");

        TestRunOutcome outcome = runner.run(shell("echo all green; echo warning >&2", Duration.ofSeconds(30)), output);

        assertThat(outcome.passed()).isTrue();
        assertThat(outcome.exitCode()).isZero();
        assertThat(outcome.output()).contains("all green").contains("warning");
        assertThat(Files.readString(output)).isEqualTo(outcome.output());
    }

    @Test
    void run_failingCommand_reportsExitCodeAndFailures() throws IOException {
        TestRunOutcome outcome = runner.run(shell(
            "echo 'FooTest > bar() FAILED'; echo '    boom'; exit 3", Duration.ofSeconds(30)),
            tempDir.resolve("out.txt"));

        assertThat(outcome.passed()).isFalse();
        assertThat(outcome.exitCode()).isEqualTo(3);
        assertThat(outcome.failures()).extracting(TestFailure::name).containsExactly("FooTest > bar()");
    }

    @Test
    void run_commandRunsInWorkingDirectory() throws IOException {
        Files.writeString(tempDir.resolve("marker.txt"), "here");

        TestRunOutcome outcome = runner.run(shell("cat marker.txt", Duration.ofSeconds(30)), tempDir.resolve("out.txt"));

        assertThat(outcome.output()).isEqualTo("here");
    }

    @Test
    void run_slowCommand_isKilledAtTimeout() throws IOException {
        TestRunOutcome outcome = runner.run(shell("sleep 30", Duration.ofMillis(200)), tempDir.resolve("out.txt"));

        assertThat(outcome.timedOut()).isTrue();
        assertThat(outcome.passed()).isFalse();
        assertThat(outcome.exitCode()).isEqualTo(-1);
        assertThat(outcome.elapsed()).isLessThan(Duration.ofSeconds(20));
    }

    @Test
    void run_missingProgram_throwsIOException() {
        TestCommand command = new TestCommand(List.of("specforge-no-such-program"), tempDir, Duration.ofSeconds(5));

        assertThatThrownBy(() -> runner.run(command, tempDir.resolve("out.txt")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void parse_splitsOnWhitespace() {
        TestCommand command = TestCommand.parse("  mvn  -B -q\ttest ", tempDir, Duration.ofMinutes(1));

        assertThat(command.arguments()).containsExactly("mvn", "-B", "-q", "test");
        assertThat(command).hasToString("mvn -B -q test");
    }

    private TestCommand shell(String script, Duration timeout) {
        return new TestCommand(List.of("sh", "-c", script), tempDir, timeout);
    }
}
