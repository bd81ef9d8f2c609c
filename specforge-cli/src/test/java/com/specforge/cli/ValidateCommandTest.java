package com.specforge.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CommandTestSupport {

    @TempDir
    Path tempDir;

    @Test
    void validate_agentReadySpec_exitsZero() throws IOException {
        Path spec = copyFixture("order-export.md", tempDir);

        int exitCode = execute("validate", spec.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout())
            .contains("Specification: feat-order-export")
            .contains("✓ Agent-ready");
    }

    @Test
    void validate_incompleteSpec_exitsOneAndListsViolations() throws IOException {
        Path spec = copyFixture("vague-draft.md", tempDir);

        int exitCode = execute("validate", spec.toString(), "--checks");

        assertThat(exitCode).isEqualTo(1);
        assertThat(stdout())
            .contains("✗ Not agent-ready")
            .contains("[");
    }

    @Test
    void validate_missingFile_exitsTwo() {
        int exitCode = execute("validate", tempDir.resolve("absent.md").toString());

        assertThat(exitCode).isEqualTo(2);
        assertThat(stderr()).contains("Cannot read");
    }
}
