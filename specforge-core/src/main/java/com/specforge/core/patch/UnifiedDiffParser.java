package com.specforge.core.patch;

import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.PatchRejectedException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses unified diff text into a {@link PatchOperation}.
 *
 * <p>Hunk bodies are read by their header counts. Generated diffs often carry counts that are
 * too large, so a hunk also ends early at the next hunk header, {@code diff --git} line or
 * {@code ---}/{@code +++} header pair, and at end of input. Counts that are too small are
 * rejected: a context, removal or addition line directly after an exhausted hunk would
 * otherwise be dropped silently.
 *
 * <p>Also accepted: a diff whose newlines arrived escaped as literal {@code \n}; a missing
 * {@code +++} header directly followed by {@code @@} (the {@code ---} path is reused);
 * {@code \ No newline at end of file} markers, which are ignored.
 */
public final class UnifiedDiffParser {

    private static final Pattern HUNK_HEADER = Pattern.compile(
        "^@@\\s*-(\\d+)(?:,(\\d+))?\\s+\\+(\\d+)(?:,(\\d+))?\\s*@@.*$");

    private static final String NO_NEWLINE_MARKER = "\\ No newline";

    // git format-patch trailer
    private static final String SIGNATURE_SEPARATOR = "-- ";

    /**
     * Parses diff text.
     *
     * @param diffText unified diff
     * @return parsed operation; empty for blank input
     * @throws PatchRejectedException with {@link ErrorCode#PATCH_MALFORMED} for unparseable input
     */
    public PatchOperation parse(String diffText) {
        if (diffText == null || diffText.isBlank()) {
            return new PatchOperation(List.of());
        }
        String[] lines = normalize(diffText).split("\n", -1);
        List<FilePatch> files = new ArrayList<>();

        int i = 0;
        while (i < lines.length) {
            if (!isOldHeader(lines[i])) {
                i++;
                continue;
            }
            String oldPath = headerPath(lines[i]);
            i++;
            while (i < lines.length && lines[i].isEmpty()) {
                i++;
            }

            String newPath;
            if (i < lines.length && lines[i].startsWith("+++ ")) {
                newPath = headerPath(lines[i]);
                i++;
            } else if (i < lines.length && lines[i].startsWith("@@")) {
                newPath = oldPath;
            } else {
                throw malformed("Missing +++ header after --- " + oldPath);
            }

            List<Hunk> hunks = new ArrayList<>();
            while (i < lines.length && lines[i].startsWith("@@")) {
                HunkBuilder hunk = HunkBuilder.fromHeader(lines[i]);
                i++;
                i = hunk.readBody(lines, i);
                hunks.add(hunk.build());
            }
            if (hunks.isEmpty()) {
                throw malformed("No hunks for " + newPath);
            }
            files.add(new FilePatch(oldPath, newPath, hunks));
        }

        if (files.isEmpty()) {
            throw malformed("No file headers found; expected '--- a/<path>' and '+++ b/<path>'");
        }
        return new PatchOperation(files);
    }

    private static String normalize(String diffText) {
        String text = diffText;
        if (!text.contains("\n") && text.contains("\\n")) {
            text = text.replace("\\n", "\n");
        }
        return text.replace("\r\n", "\n");
    }

    private static boolean isOldHeader(String line) {
        return line.startsWith("--- ");
    }

    private static boolean isBoundary(String[] lines, int index) {
        String line = lines[index];
        if (line.startsWith("@@") || line.startsWith("diff --git ")) {
            return true;
        }
        return isOldHeader(line) && index + 1 < lines.length && lines[index + 1].startsWith("+++ ");
    }

    private static String headerPath(String headerLine) {
        String path = headerLine.substring(4);
        int tab = path.indexOf('\t');
        if (tab >= 0) {
            path = path.substring(0, tab);
        }
        path = path.trim();
        if (path.startsWith("a/") || path.startsWith("b/")) {
            path = path.substring(2);
        }
        return path;
    }

    private static PatchRejectedException malformed(String message) {
        return new PatchRejectedException(ErrorCode.PATCH_MALFORMED, null, message);
    }

    private static final class HunkBuilder {
        private final int oldStart;
        private final int oldLines;
        private final int newStart;
        private final int newLines;
        private final List<HunkLine> body = new ArrayList<>();

        private HunkBuilder(int oldStart, int oldLines, int newStart, int newLines) {
            this.oldStart = oldStart;
            this.oldLines = oldLines;
            this.newStart = newStart;
            this.newLines = newLines;
        }

        static HunkBuilder fromHeader(String header) {
            Matcher matcher = HUNK_HEADER.matcher(header);
            if (!matcher.matches()) {
                throw malformed("Invalid hunk header: " + header);
            }
            try {
                return new HunkBuilder(
                    Integer.parseInt(matcher.group(1)),
                    matcher.group(2) == null ? 1 : Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    matcher.group(4) == null ? 1 : Integer.parseInt(matcher.group(4)));
            } catch (NumberFormatException e) {
                throw malformed("Hunk header range out of bounds: " + header);
            }
        }

        int readBody(String[] lines, int start) {
            int oldRemaining = oldLines;
            int newRemaining = newLines;
            int i = start;
            while (i < lines.length && (oldRemaining > 0 || newRemaining > 0)) {
                String line = lines[i];
                if (line.startsWith(NO_NEWLINE_MARKER)) {
                    i++;
                    continue;
                }
                if (isBoundary(lines, i)) {
                    break;
                }
                if (line.isEmpty()) {
                    if (i == lines.length - 1) {
                        break;
                    }
                    body.add(new HunkLine(HunkLine.Kind.CONTEXT, ""));
                    oldRemaining--;
                    newRemaining--;
                } else {
                    switch (line.charAt(0)) {
                        case ' ' -> {
                            body.add(new HunkLine(HunkLine.Kind.CONTEXT, line.substring(1)));
                            oldRemaining--;
                            newRemaining--;
                        }
                        case '-' -> {
                            body.add(new HunkLine(HunkLine.Kind.REMOVE, line.substring(1)));
                            oldRemaining--;
                        }
                        case '+' -> {
                            body.add(new HunkLine(HunkLine.Kind.ADD, line.substring(1)));
                            newRemaining--;
                        }
                        default -> throw malformed("Unexpected line in hunk: " + line);
                    }
                }
                i++;
            }
            while (i < lines.length && lines[i].startsWith(NO_NEWLINE_MARKER)) {
                i++;
            }
            if (oldRemaining <= 0 && newRemaining <= 0 && i < lines.length && isStrayHunkLine(lines, i)) {
                throw malformed("Hunk " + header() + " has more lines than its header declares; "
                    + "unexpected line: " + lines[i]);
            }
            return i;
        }

        private static boolean isStrayHunkLine(String[] lines, int index) {
            String line = lines[index];
            if (line.isEmpty() || isBoundary(lines, index) || SIGNATURE_SEPARATOR.equals(line)) {
                return false;
            }
            if (isOldHeader(line) && index + 1 < lines.length && lines[index + 1].startsWith("@@")) {
                return false;
            }
            char first = line.charAt(0);
            return first == ' ' || first == '+' || first == '-';
        }

        private String header() {
            return "@@ -" + oldStart + "," + oldLines + " +" + newStart + "," + newLines + " @@";
        }

        Hunk build() {
            return new Hunk(oldStart, oldLines, newStart, newLines, body);
        }
    }
}
