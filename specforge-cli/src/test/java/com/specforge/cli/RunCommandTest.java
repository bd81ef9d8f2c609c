package com.specforge.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RunCommand}, {@link StatusCommand} and {@link RunsCommand}.
 */
class RunCommandTest extends CommandTestSupport {

    @TempDir
    Path tempDir;

    @Test
    void run_withoutAiPhases_completesAndIsReported() throws IOException {
        Path spec = copyFixture("order-export.md", tempDir);
        Path runs = tempDir.resolve("runs");

        int exitCode = execute("run", spec.toString(), "--runs-dir", runs.toString(),
            "--work-dir", tempDir.toString(), "--skip-review", "--skip-tests", "--skip-implementation");

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("(completed)")
            .contains("✓ validate")
            .contains("- review (skipped)")
            .contains("Executed this time: validate, analyze, finalize");

        assertThat(execute("status", spec.toString(), "--runs-dir", runs.toString())).isZero();
        assertThat(execute("runs", "--runs-dir", runs.toString())).isZero();
    }

    @Test
    void run_withoutProvider_failsAiPhases() throws IOException {
        Path spec = copyFixture("order-export.md", tempDir);

        int exitCode = execute("run", spec.toString(), "--runs-dir", tempDir.resolve("runs").toString(),
            "--work-dir", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("(failed)").contains("✗ review");
    }

    @Test
    void run_unknownFromStep_exitsTwo() throws IOException {
        Path spec = copyFixture("order-export.md", tempDir);

        int exitCode = execute("run", spec.toString(), "--runs-dir", tempDir.resolve("runs").toString(),
            "--from-step", "deploy");

        assertThat(exitCode).isEqualTo(2);
        assertThat(stderr()).contains("phase.invalid");
    }

    @Test
    void run_negativeFixIterations_exitsTwo() throws IOException {
        Path spec = copyFixture("order-export.md", tempDir);

        int exitCode = execute("run", spec.toString(), "--runs-dir", tempDir.resolve("runs").toString(),
            "--max-fix-iterations", "-1");

        assertThat(exitCode).isEqualTo(2);
        assertThat(stderr()).contains("--max-fix-iterations must not be negative");
    }

    @Test
    void status_noRuns_exitsOne() throws IOException {
        Path spec = copyFixture("order-export.md", tempDir);

        int exitCode = execute("status", spec.toString(), "--runs-dir", tempDir.resolve("runs").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout()).contains("No runs found");
    }
}
