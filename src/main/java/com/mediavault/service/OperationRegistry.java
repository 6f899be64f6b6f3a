package com.mediavault.service;

import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks which libraries have an operation running in this process.
 * A library runs one operation at a time: the deterministic duplicate winner depends on it.
 */
public class OperationRegistry {
    private static OperationRegistry instance;
    private final Set<Path> runningLibraries = ConcurrentHashMap.newKeySet();

    private OperationRegistry() {
    }

    public static synchronized OperationRegistry getInstance() {
        if (instance == null) {
            instance = new OperationRegistry();
        }
        return instance;
    }

    /**
     * @return false when an operation is already running on this library.
     */
    public boolean tryRegister(Path libraryRoot) {
        return runningLibraries.add(libraryRoot.toAbsolutePath().normalize());
    }

    public void unregister(Path libraryRoot) {
        runningLibraries.remove(libraryRoot.toAbsolutePath().normalize());
    }

    public boolean isRunning(Path libraryRoot) {
        return runningLibraries.contains(libraryRoot.toAbsolutePath().normalize());
    }
}
