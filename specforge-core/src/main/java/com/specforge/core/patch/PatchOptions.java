package com.specforge.core.patch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Patch application options.
 *
 * @param rootDir directory diff paths resolve against; nothing outside it is touched
 * @param crossFileAtomic when true, every file is verified before any is written and an
 *                        I/O failure restores files already written; when false, files are
 *                        applied one at a time and the first rejection stops the rest
 */
public record PatchOptions(Path rootDir, boolean crossFileAtomic) {

    /**
     * Compact constructor with validation.
     */
    public PatchOptions {
        Objects.requireNonNull(rootDir, "rootDir must not be null");
        rootDir = rootDir.toAbsolutePath().normalize();
    }

    /**
     * Options with cross-file atomicity enabled.
     *
     * @param rootDir patch root
     * @return options
     */
    public static PatchOptions atomic(Path rootDir) {
        return new PatchOptions(rootDir, true);
    }
}
