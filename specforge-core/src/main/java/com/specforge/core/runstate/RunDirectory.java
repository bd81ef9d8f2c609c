package com.specforge.core.runstate;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A created run directory.
 *
 * @param runId run identifier, also the directory name
 * @param path absolute directory path
 */
public record RunDirectory(String runId, Path path) {

    /**
     * Compact constructor with validation.
     */
    public RunDirectory {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
