package com.specforge.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Reads a file as a UTF-8 string.
     *
     * @param path path to file
     * @return file content as string
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Writes content atomically: to a temporary sibling first, then moved over the target.
     *
     * <p>A reader never observes a partially written target. An existing target keeps its
     * POSIX permissions. Falls back to a plain replace when the file system does not support
     * atomic moves.
     *
     * @param target file to replace or create
     * @param content bytes to write
     * @throws IOException if writing or moving fails; the target is unchanged in that case
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        try {
            Files.write(temp, content);
            copyPermissions(target, temp);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void copyPermissions(Path source, Path destination) throws IOException {
        if (!Files.exists(source)
                || Files.getFileAttributeView(source, PosixFileAttributeView.class) == null) {
            return;
        }
        Files.setPosixFilePermissions(destination, Files.getPosixFilePermissions(source));
    }

    /**
     * Writes a UTF-8 string atomically.
     *
     * @param target file to replace or create
     * @param content text to write
     * @throws IOException if writing fails
     */
    public static void writeAtomically(Path target, String content) throws IOException {
        writeAtomically(target, content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Checks whether a path, once normalized, stays inside a root directory.
     *
     * @param root root directory
     * @param candidate path to check (relative paths resolve against root)
     * @return true if candidate is root or a descendant of it
     */
    public static boolean isWithin(Path root, Path candidate) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path resolved = normalizedRoot.resolve(candidate).normalize();
        return resolved.startsWith(normalizedRoot);
    }
}
