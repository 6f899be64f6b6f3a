package com.mediavault.service;

import com.mediavault.util.LibraryLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Lock file keyed by process liveness. The file holds the owner's PID; a lock whose owner
 * is no longer alive is stale and may be taken over.
 */
public class LibraryLock {

    public static final String LOCK_FILE_NAME = "reorganize.lock";

    private final Path libraryRoot;
    private final Path lockFile;

    public LibraryLock(Path libraryRoot, Path internalDir) {
        this.libraryRoot = libraryRoot;
        this.lockFile = internalDir.resolve(LOCK_FILE_NAME);
    }

    /**
     * Takes the lock for the current process.
     *
     * @return false when another live process holds it.
     */
    public synchronized boolean tryAcquire() throws IOException {
        Files.createDirectories(lockFile.getParent());
        for (int attempt = 0; attempt < 2; attempt++) {
            try {
                Files.writeString(lockFile, String.valueOf(ProcessHandle.current().pid()),
                        StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                return true;
            } catch (FileAlreadyExistsException e) {
                Optional<Long> owner = readOwner();
                if (owner.isPresent() && isAlive(owner.get())) {
                    return false;
                }
                LibraryLogger.logWarning(libraryRoot, "LibraryLock",
                        "Replacing stale lock of process " + owner.map(String::valueOf).orElse("?"));
                Files.deleteIfExists(lockFile);
            }
        }
        return false;
    }

    /**
     * Releases the lock if the current process owns it.
     */
    public synchronized void release() {
        Optional<Long> owner = readOwner();
        if (owner.isPresent() && owner.get() == ProcessHandle.current().pid()) {
            try {
                Files.deleteIfExists(lockFile);
            } catch (IOException e) {
                LibraryLogger.logError(libraryRoot, "LibraryLock", "Failed to release lock " + lockFile, e);
            }
        }
    }

    /**
     * True when a live process, this one included, holds the lock.
     */
    public boolean isHeld() {
        Optional<Long> owner = readOwner();
        return owner.isPresent() && isAlive(owner.get());
    }

    public Optional<Long> readOwner() {
        if (!Files.exists(lockFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(Files.readString(lockFile, StandardCharsets.UTF_8).trim()));
        } catch (IOException | NumberFormatException e) {
            // Unreadable lock content is treated as stale
            LibraryLogger.logWarning(libraryRoot, "LibraryLock", "Unreadable lock file: " + e.getMessage());
            return Optional.empty();
        }
    }

    public Path getLockFile() {
        return lockFile;
    }

    private static boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
