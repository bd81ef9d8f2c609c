package com.specforge.core.patch;

import java.util.List;

/**
 * A contiguous change block: {@code @@ -oldStart,oldLines +newStart,newLines @@} plus its lines.
 *
 * @param oldStart 1-based start line in the original file (0 for an insertion at the top)
 * @param oldLines line count in the original file
 * @param newStart 1-based start line in the new file
 * @param newLines line count in the new file
 * @param lines context, added and removed lines in order
 */
public record Hunk(
    int oldStart,
    int oldLines,
    int newStart,
    int newLines,
    List<HunkLine> lines
) {
    /**
     * Compact constructor with validation.
     */
    public Hunk {
        if (oldStart < 0 || newStart < 0 || oldLines < 0 || newLines < 0) {
            throw new IllegalArgumentException("hunk ranges must not be negative");
        }
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    /**
     * Returns the zero-based index of the first original line this hunk touches.
     *
     * <p>A pure insertion ({@code oldLines == 0}) inserts after line {@code oldStart}.
     *
     * @return start index
     */
    public int startIndex() {
        return oldLines == 0 ? oldStart : Math.max(0, oldStart - 1);
    }
}
