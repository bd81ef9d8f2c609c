package com.specforge.core.patch;

import java.util.List;

/**
 * A parsed unified diff.
 *
 * @param files file-level changes in diff order
 */
public record PatchOperation(List<FilePatch> files) {

    /**
     * Compact constructor with validation.
     */
    public PatchOperation {
        files = files == null ? List.of() : List.copyOf(files);
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
