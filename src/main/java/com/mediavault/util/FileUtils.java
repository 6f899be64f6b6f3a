package com.mediavault.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Utility class for file manipulation.
 */
public class FileUtils {

    /**
     * Extracts the file extension from a file name.
     *
     * @param fileName The file name (e.g., "image.jpg").
     * @return The extension (lowercase, without dot), or an empty string if none found.
     */
    public static String getExtension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int i = fileName.lastIndexOf('.');
        // ".gitignore" (i=0) has no extension, "image.jpg" (i=5) has "jpg"
        if (i > 0) {
            return fileName.substring(i + 1).toLowerCase();
        }
        return "";
    }

    /**
     * Extracts the extension of the given path's file name.
     */
    public static String getExtension(Path file) {
        Path name = file.getFileName();
        return name == null ? "" : getExtension(name.toString());
    }

    /**
     * Returns the file name without its extension.
     */
    public static String getBaseName(String fileName) {
        int i = fileName.lastIndexOf('.');
        return i > 0 ? fileName.substring(0, i) : fileName;
    }

    /**
     * Moves a file, atomically when source and target share a file store.
     * Falls back to copy + delete when the move crosses devices.
     *
     * @param source The file to move.
     * @param target The destination, replaced if it exists.
     */
    public static void moveFile(Path source, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            Files.delete(source);
        }
    }

    /**
     * Copies a file, creating the destination directories as needed.
     */
    public static void copyFile(Path source, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    }

    /**
     * Returns a path inside {@code directory} named like {@code fileName} that does not exist yet,
     * appending "_1", "_2", ... before the extension when needed.
     */
    public static Path uniqueTarget(Path directory, String fileName) {
        Path candidate = directory.resolve(fileName);
        if (!Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
            return candidate;
        }
        String base = getBaseName(fileName);
        int dot = fileName.lastIndexOf('.');
        String suffix = dot > 0 ? fileName.substring(dot) : "";
        int counter = 1;
        while (Files.exists(candidate, LinkOption.NOFOLLOW_LINKS)) {
            candidate = directory.resolve(base + "_" + counter + suffix);
            counter++;
        }
        return candidate;
    }

    /**
     * Converts a path under {@code root} into the library's relative form ("/" separated).
     */
    public static String toLibraryPath(Path root, Path file) {
        return root.toAbsolutePath().normalize()
                .relativize(file.toAbsolutePath().normalize())
                .toString()
                .replace('\\', '/');
    }
}
