package com.specforge.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ApplyPatchCommand}.
 */
class ApplyPatchCommandTest extends CommandTestSupport {

    private static final String DIFF = """
        --- a/greeting.txt
        +++ b/greeting.txt
        @@ -1,2 +1,2 @@
         hello
        -world
        +there
        """;

    @TempDir
    Path tempDir;

    @Test
    void applyPatch_matchingContext_modifiesFile() throws IOException {
        Files.writeString(tempDir.resolve("greeting.txt"), "hello\nworld\n");
        Path diff = Files.writeString(tempDir.resolve("change.patch"), DIFF);

        int exitCode = execute("apply-patch", diff.toString(), "--root", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(tempDir.resolve("greeting.txt"))).isEqualTo("hello\nthere\n");
        assertThat(stdout()).contains("✓ Changed 1 file(s)");
    }

    @Test
    void applyPatch_checkOnly_leavesFileUntouched() throws IOException {
        Files.writeString(tempDir.resolve("greeting.txt"), "hello\nworld\n");
        Path diff = Files.writeString(tempDir.resolve("change.patch"), DIFF);

        int exitCode = execute("apply-patch", diff.toString(), "--root", tempDir.toString(), "--check");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(tempDir.resolve("greeting.txt"))).isEqualTo("hello\nworld\n");
        assertThat(stdout()).contains("Would change 1 file(s)");
    }

    @Test
    void applyPatch_contextMismatch_exitsOneWithRemediation() throws IOException {
        Files.writeString(tempDir.resolve("greeting.txt"), "hello\nplanet\n");
        Path diff = Files.writeString(tempDir.resolve("change.patch"), DIFF);

        int exitCode = execute("apply-patch", diff.toString(), "--root", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(Files.readString(tempDir.resolve("greeting.txt"))).isEqualTo("hello\nplanet\n");
        assertThat(stderr()).contains("patch.context-mismatch").contains("Regenerate the diff");
    }
}
