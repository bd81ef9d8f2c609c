package com.specforge.core.patch;

import java.util.Objects;

/**
 * One line of a hunk body.
 *
 * @param kind context, added or removed
 * @param text line text without the leading marker
 */
public record HunkLine(Kind kind, String text) {

    /**
     * Line kinds, keyed by their unified-diff marker.
     */
    public enum Kind {
        CONTEXT(' '),
        ADD('+'),
        REMOVE('-');

        private final char marker;

        Kind(char marker) {
            this.marker = marker;
        }

        public char marker() {
            return marker;
        }
    }

    /**
     * Compact constructor with validation.
     */
    public HunkLine {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Whether this line must match the target file.
     *
     * @return true for context and removed lines
     */
    public boolean consumesOld() {
        return kind != Kind.ADD;
    }
}
