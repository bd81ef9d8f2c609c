package com.specforge.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assumptions.assumeThat;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void writeAtomically_createsParentsAndLeavesNoTempFile() throws IOException {
        Path target = tempDir.resolve("a/b/out.txt");

        FileUtils.writeAtomically(target, "first");
        FileUtils.writeAtomically(target, "second");

        assertThat(FileUtils.readString(target)).isEqualTo("second");
        try (Stream<Path> siblings = Files.list(target.getParent())) {
            assertThat(siblings).containsExactly(target);
        }
    }

    @Test
    void isWithin_detectsEscapes() {
        assertThat(FileUtils.isWithin(tempDir, Path.of("src/Main.java"))).isTrue();
        assertThat(FileUtils.isWithin(tempDir, Path.of("src/../README.md"))).isTrue();
        assertThat(FileUtils.isWithin(tempDir, Path.of("../outside.txt"))).isFalse();
        assertThat(FileUtils.isWithin(tempDir, Path.of("/etc/passwd"))).isFalse();
    }

    @Test
    void writeAtomically_existingExecutable_keepsPermissions() throws IOException {
        Path script = tempDir.resolve("gradlew");
        Files.writeString(script, "#!/bin/sh\n");
        assumeThat(Files.getFileAttributeView(script, PosixFileAttributeView.class)).isNotNull();
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));

        FileUtils.writeAtomically(script, "#!/bin/sh\nexec true\n");

        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(script))).isEqualTo("rwxr-xr-x");
        assertThat(FileUtils.readString(script)).isEqualTo("#!/bin/sh\nexec true\n");
    }
}
