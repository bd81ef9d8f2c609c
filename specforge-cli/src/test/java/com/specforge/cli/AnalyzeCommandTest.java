package com.specforge.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnalyzeCommand}.
 */
class AnalyzeCommandTest extends CommandTestSupport {

    @TempDir
    Path tempDir;

    @Test
    void analyze_smallSpec_reportsCohesiveScope() throws IOException {
        Path spec = copyFixture("order-export.md", tempDir);

        int exitCode = execute("analyze", spec.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("✓ Scope looks cohesive");
    }
}
