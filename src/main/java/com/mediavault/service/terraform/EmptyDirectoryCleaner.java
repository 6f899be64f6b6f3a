package com.mediavault.service.terraform;

import com.mediavault.service.MediaTreeWalker;
import com.mediavault.util.LibraryLogger;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Removes directories left empty by a reorganization, bottom-up, repeating passes until
 * nothing more can be removed. Reserved and hidden directories are never touched.
 * Directories that only hold OS junk files count as empty.
 */
public class EmptyDirectoryCleaner {

    public static final Set<String> JUNK_FILES = Set.of(".DS_Store", "Thumbs.db", "desktop.ini");

    private final Path libraryRoot;

    public EmptyDirectoryCleaner(Path libraryRoot) {
        this.libraryRoot = libraryRoot;
    }

    /**
     * @return Number of directories removed.
     */
    public int clean(Path root, int maxPasses) throws IOException {
        int removed = 0;
        for (int pass = 1; pass <= maxPasses; pass++) {
            int removedThisPass = 0;
            for (Path dir : directoriesBottomUp(root)) {
                if (isEffectivelyEmpty(dir)) {
                    deleteWithJunk(dir);
                    removedThisPass++;
                }
            }
            removed += removedThisPass;
            if (removedThisPass == 0) {
                break;
            }
            if (pass == maxPasses) {
                LibraryLogger.logWarning(libraryRoot, "EmptyDirectoryCleaner",
                        "Stopped after " + maxPasses + " passes, empty directories may remain");
            }
        }
        return removed;
    }

    /**
     * Removes {@code dir} and then its ancestors while they are empty, stopping at the library root.
     *
     * @return Number of directories removed.
     */
    public int pruneUpward(Path dir) throws IOException {
        int removed = 0;
        Path current = dir;
        while (current != null && current.startsWith(libraryRoot) && !current.equals(libraryRoot)
                && !MediaTreeWalker.isExcludedDirectory(current) && isEffectivelyEmpty(current)) {
            deleteWithJunk(current);
            removed++;
            current = current.getParent();
        }
        return removed;
    }

    private List<Path> directoriesBottomUp(Path root) throws IOException {
        List<Path> dirs = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && MediaTreeWalker.isExcludedDirectory(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                if (!dir.equals(root)) {
                    dirs.add(dir);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                LibraryLogger.logError(libraryRoot, "EmptyDirectoryCleaner", "Failed to visit " + file, exc);
                return FileVisitResult.CONTINUE;
            }
        });
        return dirs;
    }

    boolean isEffectivelyEmpty(Path dir) throws IOException {
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.allMatch(entry -> Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)
                    && JUNK_FILES.contains(entry.getFileName().toString()));
        }
    }

    private void deleteWithJunk(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            for (Path junk : (Iterable<Path>) entries::iterator) {
                Files.delete(junk);
            }
        }
        Files.delete(dir);
    }
}
