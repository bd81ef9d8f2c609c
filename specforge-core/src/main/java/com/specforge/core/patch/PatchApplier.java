package com.specforge.core.patch;

import com.specforge.core.error.ErrorCode;
import com.specforge.core.error.PatchRejectedException;
import com.specforge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Verifies and applies unified diffs to files under a root directory.
 *
 * <p>Every context and removed line must match the target file exactly; there is no fuzzy
 * or offset matching. A file whose hunks do not verify is left byte-for-byte unchanged and
 * the application fails with {@link PatchRejectedException}. Verified files are written
 * atomically (temporary file, then move), preserving their line endings and trailing newline.
 *
 * <p>Several sections of one diff may target the same file; each applies to the result of
 * the previous one and the file is written once. Targets must be valid UTF-8; anything else
 * is rejected with {@link ErrorCode#PATCH_ENCODING} rather than rewritten lossily.
 *
 * <p>Cross-file behavior is set by {@link PatchOptions#crossFileAtomic()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PatchApplier applier = new PatchApplier(PatchOptions.atomic(workDir));
 * PatchResult result = applier.applyPatch(diffText);
 * }</pre>
 *
 * @since 1.0.0
 */
public class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    private final PatchOptions options;
    private final UnifiedDiffParser parser = new UnifiedDiffParser();

    public PatchApplier(PatchOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Parses and applies a diff with the given options.
     *
     * @param diffText unified diff
     * @param options patch options
     * @return files written
     * @throws PatchRejectedException if the diff is malformed or any hunk does not verify
     */
    public static PatchResult applyPatch(String diffText, PatchOptions options) {
        return new PatchApplier(options).applyPatch(diffText);
    }

    /**
     * Parses and applies a diff.
     *
     * @param diffText unified diff
     * @return files written
     * @throws PatchRejectedException if the diff is malformed or any hunk does not verify
     */
    public PatchResult applyPatch(String diffText) {
        return apply(parser.parse(diffText));
    }

    /**
     * Verifies a diff against the current files without writing anything.
     *
     * @param diffText unified diff
     * @return the files that would be written
     * @throws PatchRejectedException if the diff would be rejected
     */
    public PatchResult check(String diffText) {
        Map<Path, PlannedChange> planned = new LinkedHashMap<>();
        for (FilePatch file : parser.parse(diffText).files()) {
            PlannedChange change = plan(file, planned);
            planned.put(change.target(), change);
        }
        return summarize(planned.values());
    }

    /**
     * Applies a parsed diff.
     *
     * @param operation parsed diff
     * @return files written
     * @throws PatchRejectedException if any file is rejected
     */
    public PatchResult apply(PatchOperation operation) {
        if (operation.isEmpty()) {
            return PatchResult.empty();
        }
        PatchResult result = options.crossFileAtomic() ? applyAtomically(operation) : applyIndependently(operation);
        log.info("Applied patch to {} file(s) under {}", result.filesChanged().size(), options.rootDir());
        return result;
    }

    private PatchResult applyAtomically(PatchOperation operation) {
        Map<Path, PlannedChange> planned = new LinkedHashMap<>();
        for (FilePatch file : operation.files()) {
            PlannedChange change = plan(file, planned);
            planned.put(change.target(), change);
        }

        List<PlannedChange> written = new ArrayList<>();
        for (PlannedChange change : planned.values()) {
            try {
                write(change);
                written.add(change);
            } catch (IOException e) {
                restore(written);
                throw new PatchRejectedException(ErrorCode.PATCH_IO, change.target(),
                    "Cannot write " + change.target() + "; restored " + written.size() + " file(s)", List.of(), e);
            }
        }
        return summarize(written);
    }

    private PatchResult applyIndependently(PatchOperation operation) {
        Map<Path, PlannedChange> written = new LinkedHashMap<>();
        for (FilePatch file : operation.files()) {
            try {
                PlannedChange change = plan(file, written);
                write(change);
                written.put(change.target(), change);
            } catch (PatchRejectedException e) {
                throw e.withAppliedFiles(List.copyOf(written.keySet()));
            } catch (IOException e) {
                Path target = resolve(file.targetPath());
                throw new PatchRejectedException(ErrorCode.PATCH_IO, target, "Cannot write " + target,
                    List.copyOf(written.keySet()), e);
            }
        }
        return summarize(written.values());
    }

    /**
     * Plans one file section against the current content of its target.
     *
     * <p>If an earlier section already planned a change for the same target, that planned
     * content is the starting point and the first section's original is kept for restore.
     */
    private PlannedChange plan(FilePatch file, Map<Path, PlannedChange> planned) {
        if (!file.isNewFile() && !file.isDeletion() && !file.oldPath().equals(file.newPath())) {
            throw new PatchRejectedException(ErrorCode.PATCH_TARGET, resolve(file.newPath()),
                "Renames are not supported: " + file.oldPath() + " -> " + file.newPath());
        }
        Path target = resolve(file.targetPath());

        PlannedChange earlier = planned.get(target);
        byte[] original;
        byte[] current;
        if (earlier != null) {
            original = earlier.original();
            current = earlier.content();
        } else {
            original = Files.exists(target) ? read(target) : null;
            current = original;
        }

        if (current != null && file.isNewFile()) {
            throw new PatchRejectedException(ErrorCode.PATCH_TARGET, target, "File to create already exists: " + target);
        }
        if (current == null && !file.isNewFile()) {
            throw new PatchRejectedException(ErrorCode.PATCH_TARGET, target, "Target file does not exist: " + target);
        }

        FileText text = FileText.decode(target, current);
        List<String> patched = applyHunks(target, text.lines(), file.hunks());

        if (file.isDeletion()) {
            if (!patched.isEmpty()) {
                throw new PatchRejectedException(ErrorCode.PATCH_CONTEXT_MISMATCH, target,
                    "Deletion patch does not remove every line of " + target);
            }
            return new PlannedChange(target, original, null);
        }
        boolean trailingNewline = current == null || text.trailingNewline();
        return new PlannedChange(target, original, text.encode(patched, trailingNewline));
    }

    private static byte[] read(Path target) {
        try {
            return Files.readAllBytes(target);
        } catch (IOException e) {
            throw new PatchRejectedException(ErrorCode.PATCH_IO, target, "Cannot read " + target, List.of(), e);
        }
    }

    static List<String> applyHunks(Path target, List<String> lines, List<Hunk> hunks) {
        List<String> output = new ArrayList<>();
        int cursor = 0;

        for (Hunk hunk : hunks) {
            int start = hunk.startIndex();
            if (start < cursor) {
                throw new PatchRejectedException(ErrorCode.PATCH_MALFORMED, target,
                    "Hunks overlap or are out of order at line " + hunk.oldStart() + " of " + target);
            }
            if (start > lines.size()) {
                throw mismatch(target, start + 1, "<beyond end of file>", "");
            }
            output.addAll(lines.subList(cursor, start));

            int index = start;
            for (HunkLine line : hunk.lines()) {
                if (line.consumesOld()) {
                    String actual = index < lines.size() ? lines.get(index) : null;
                    if (!line.text().equals(actual)) {
                        throw mismatch(target, index + 1, actual == null ? "<end of file>" : actual, line.text());
                    }
                    index++;
                }
                if (line.kind() != HunkLine.Kind.REMOVE) {
                    output.add(line.text());
                }
            }
            cursor = index;
        }
        output.addAll(lines.subList(cursor, lines.size()));
        return output;
    }

    private static PatchRejectedException mismatch(Path target, int lineNumber, String actual, String expected) {
        return new PatchRejectedException(ErrorCode.PATCH_CONTEXT_MISMATCH, target,
            "Hunk does not match " + target + " at line " + lineNumber
                + ": expected '" + expected + "' but found '" + actual + "'");
    }

    private Path resolve(String relative) {
        Path root = options.rootDir();
        if (!FileUtils.isWithin(root, Path.of(relative))) {
            throw new PatchRejectedException(ErrorCode.PATCH_TARGET, null, "Path escapes patch root: " + relative);
        }
        return root.resolve(relative).normalize();
    }

    private static void write(PlannedChange change) throws IOException {
        if (change.content() == null) {
            Files.delete(change.target());
            log.debug("Deleted {}", change.target());
        } else {
            FileUtils.writeAtomically(change.target(), change.content());
            log.debug("Wrote {}", change.target());
        }
    }

    private static void restore(List<PlannedChange> written) {
        for (PlannedChange change : written) {
            try {
                if (change.original() == null) {
                    Files.deleteIfExists(change.target());
                } else {
                    FileUtils.writeAtomically(change.target(), change.original());
                }
            } catch (IOException e) {
                log.error("Failed to restore {} after aborted patch", change.target(), e);
            }
        }
    }

    private static PatchResult summarize(Collection<PlannedChange> changes) {
        List<Path> modified = new ArrayList<>();
        List<Path> created = new ArrayList<>();
        List<Path> deleted = new ArrayList<>();
        for (PlannedChange change : changes) {
            if (change.content() == null) {
                deleted.add(change.target());
            } else if (change.original() == null) {
                created.add(change.target());
            } else {
                modified.add(change.target());
            }
        }
        return new PatchResult(modified, created, deleted);
    }

    private record PlannedChange(Path target, byte[] original, byte[] content) {
    }

    /**
     * File content split into lines, remembering line endings and the trailing newline.
     */
    private record FileText(List<String> lines, String lineEnding, boolean trailingNewline) {

        static FileText decode(Path target, byte[] bytes) {
            if (bytes == null || bytes.length == 0) {
                return new FileText(List.of(), "\n", false);
            }
            String content;
            try {
                content = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            } catch (CharacterCodingException e) {
                throw new PatchRejectedException(ErrorCode.PATCH_ENCODING, target,
                    target + " is not valid UTF-8 text", List.of(), e);
            }
            String ending = content.contains("\r\n") ? "\r\n" : "\n";
            boolean trailing = content.endsWith("\n");
            String body = trailing ? content.substring(0, content.length() - (content.endsWith("\r\n") ? 2 : 1)) : content;
            List<String> lines = Arrays.asList(body.split("\r?\n", -1));
            return new FileText(lines, ending, trailing);
        }

        byte[] encode(List<String> newLines, boolean withTrailingNewline) {
            if (newLines.isEmpty()) {
                return new byte[0];
            }
            String joined = String.join(lineEnding, newLines) + (withTrailingNewline ? lineEnding : "");
            return joined.getBytes(StandardCharsets.UTF_8);
        }
    }
}
