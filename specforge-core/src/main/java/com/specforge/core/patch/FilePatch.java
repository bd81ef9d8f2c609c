package com.specforge.core.patch;

import java.util.List;
import java.util.Objects;

/**
 * All hunks of a diff that target one file.
 *
 * @param oldPath path from the {@code ---} header, prefixes stripped; {@link #DEV_NULL} for new files
 * @param newPath path from the {@code +++} header, prefixes stripped; {@link #DEV_NULL} for deletions
 * @param hunks hunks in file order
 */
public record FilePatch(
    String oldPath,
    String newPath,
    List<Hunk> hunks
) {
    public static final String DEV_NULL = "/dev/null";

    /**
     * Compact constructor with validation.
     */
    public FilePatch {
        Objects.requireNonNull(oldPath, "oldPath must not be null");
        Objects.requireNonNull(newPath, "newPath must not be null");
        hunks = hunks == null ? List.of() : List.copyOf(hunks);
    }

    public boolean isNewFile() {
        return DEV_NULL.equals(oldPath);
    }

    public boolean isDeletion() {
        return DEV_NULL.equals(newPath);
    }

    /**
     * Returns the path of the file this patch reads and writes.
     *
     * @return relative target path
     */
    public String targetPath() {
        return isDeletion() ? oldPath : newPath;
    }
}
