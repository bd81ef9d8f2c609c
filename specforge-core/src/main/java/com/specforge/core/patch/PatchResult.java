package com.specforge.core.patch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Files written by a successful patch application.
 *
 * @param modified existing files rewritten
 * @param created new files
 * @param deleted removed files
 */
public record PatchResult(
    List<Path> modified,
    List<Path> created,
    List<Path> deleted
) {
    /**
     * Compact constructor with validation.
     */
    public PatchResult {
        modified = modified == null ? List.of() : List.copyOf(modified);
        created = created == null ? List.of() : List.copyOf(created);
        deleted = deleted == null ? List.of() : List.copyOf(deleted);
    }

    public static PatchResult empty() {
        return new PatchResult(List.of(), List.of(), List.of());
    }

    /**
     * Returns every touched file.
     *
     * @return modified, created and deleted files
     */
    public List<Path> filesChanged() {
        List<Path> all = new ArrayList<>(modified);
        all.addAll(created);
        all.addAll(deleted);
        return List.copyOf(all);
    }
}
