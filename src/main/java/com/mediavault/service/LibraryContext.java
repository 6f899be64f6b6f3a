package com.mediavault.service;

import com.mediavault.repository.AssetStore;
import com.mediavault.repository.LibraryDatabaseManager;
import com.mediavault.util.FileUtils;
import com.mediavault.util.LibraryLogger;
import com.mediavault.util.LibrarySettings;

import java.nio.file.Path;
import java.util.Set;

/**
 * Everything an operation needs to know about one library: its root, its store,
 * its settings and its reorganization lock. Passed explicitly into every operation.
 */
public class LibraryContext {

    public static final String TRASH_DIR = ".trash";
    public static final String STAGING_DIR = ".import_temp";

    // Internal directories the walkers never descend into
    public static final Set<String> RESERVED_DIRECTORIES = Set.of(
            TRASH_DIR, STAGING_DIR, LibraryLogger.LOG_DIR, LibrarySettings.INTERNAL_DIR,
            ".thumbnails", ".db_backups"
    );

    private final Path root;
    private final AssetStore store;
    private final LibrarySettings settings;
    private final LibraryLock lock;

    public LibraryContext(Path root, AssetStore store, LibrarySettings settings) {
        this.root = root.toAbsolutePath().normalize();
        this.store = store;
        this.settings = settings;
        this.lock = new LibraryLock(this.root, getInternalDir());
    }

    /**
     * Opens the library rooted at {@code root}, creating its database and settings if needed.
     */
    public static LibraryContext open(Path root) {
        Path normalized = root.toAbsolutePath().normalize();
        return new LibraryContext(normalized, new LibraryDatabaseManager(normalized), new LibrarySettings(normalized));
    }

    public Path getRoot() { return root; }
    public AssetStore getStore() { return store; }
    public LibrarySettings getSettings() { return settings; }
    public LibraryLock getLock() { return lock; }

    public Path getTrashDir() {
        return root.resolve(TRASH_DIR);
    }

    public Path getStagingDir() {
        return root.resolve(STAGING_DIR);
    }

    public Path getLogsDir() {
        return root.resolve(LibraryLogger.LOG_DIR);
    }

    public Path getInternalDir() {
        return root.resolve(LibrarySettings.INTERNAL_DIR);
    }

    /**
     * Resolves a stored relative path ("/" separated) against the root.
     */
    public Path resolve(String libraryPath) {
        return root.resolve(libraryPath);
    }

    public String relativize(Path file) {
        return FileUtils.toLibraryPath(root, file);
    }

    public boolean isInside(Path file) {
        return file.toAbsolutePath().normalize().startsWith(root);
    }
}
