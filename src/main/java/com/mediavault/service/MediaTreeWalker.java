package com.mediavault.service;

import com.mediavault.util.LibraryLogger;
import com.mediavault.util.MediaFormats;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Snapshot walk of a folder tree, returning media files in a fixed (sorted) order.
 * Hidden and reserved directories, hidden files, AppleDouble "._" files and symlinks are excluded.
 */
public class MediaTreeWalker {

    private final Path libraryRoot;
    private final Predicate<Path> fileFilter;
    private final List<Path> skippedSymlinks = new ArrayList<>();

    public MediaTreeWalker(Path libraryRoot) {
        this(libraryRoot, MediaFormats::isMedia);
    }

    public MediaTreeWalker(Path libraryRoot, Predicate<Path> fileFilter) {
        this.libraryRoot = libraryRoot;
        this.fileFilter = fileFilter;
    }

    /**
     * True for directories the walk never enters.
     */
    public static boolean isExcludedDirectory(Path dir) {
        Path name = dir.getFileName();
        if (name == null) {
            return false;
        }
        String dirName = name.toString();
        return dirName.startsWith(".") || LibraryContext.RESERVED_DIRECTORIES.contains(dirName);
    }

    public static boolean isHiddenFile(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    /**
     * Collects all candidate files under {@code start}. The result is a snapshot: files created
     * during processing are not picked up.
     */
    public List<Path> collect(Path start) throws IOException {
        List<Path> files = new ArrayList<>();
        skippedSymlinks.clear();

        Files.walkFileTree(start, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(start) && isExcludedDirectory(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isSymbolicLink()) {
                    skippedSymlinks.add(file);
                    return FileVisitResult.CONTINUE;
                }
                if (!attrs.isRegularFile() || isHiddenFile(file)) {
                    return FileVisitResult.CONTINUE;
                }
                if (fileFilter.test(file)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LibraryLogger.logError(libraryRoot, "MediaTreeWalker", "Failed to visit file: " + file, exc);
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(Comparator.comparing(Path::toString));
        return files;
    }

    public List<Path> getSkippedSymlinks() {
        return new ArrayList<>(skippedSymlinks);
    }
}
