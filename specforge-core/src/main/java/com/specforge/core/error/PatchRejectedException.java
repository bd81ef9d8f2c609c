package com.specforge.core.error;

import java.nio.file.Path;
import java.util.List;

/**
 * A unified diff could not be verified or written.
 *
 * <p>The rejected file is always left byte-for-byte unchanged. {@link #getAppliedFiles()}
 * lists files that were already written by an earlier part of the same diff when
 * cross-file atomicity is disabled; it is empty in atomic mode.
 */
public class PatchRejectedException extends SpecForgeException {

    private final Path file;
    private final List<Path> appliedFiles;

    public PatchRejectedException(ErrorCode errorCode, Path file, String message) {
        this(errorCode, file, message, List.of(), null);
    }

    public PatchRejectedException(ErrorCode errorCode, Path file, String message, List<Path> appliedFiles, Throwable cause) {
        super(errorCode, message, cause);
        this.file = file;
        this.appliedFiles = appliedFiles == null ? List.of() : List.copyOf(appliedFiles);
    }

    /**
     * Returns the file whose hunks could not be applied, or {@code null} for diff-level errors.
     *
     * @return rejected file path
     */
    public Path getFile() {
        return file;
    }

    public List<Path> getAppliedFiles() {
        return appliedFiles;
    }

    /**
     * Returns a copy of this rejection that also records files already applied.
     *
     * @param applied files written before the rejection
     * @return new exception instance
     */
    public PatchRejectedException withAppliedFiles(List<Path> applied) {
        PatchRejectedException copy = new PatchRejectedException(getErrorCode(), file, getMessage(), applied, getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
