package com.mediavault.service.terraform;

import com.mediavault.service.LibraryContext;
import com.mediavault.service.normalize.MetadataWriter;
import com.mediavault.util.LibraryLogger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Checks everything a terraform run needs before anything is touched:
 * tools, free space, real write access and the reorganization lock.
 */
public class PreflightChecker {

    private static final String CONTEXT = "PreflightChecker";

    /**
     * Runs all checks and takes the library lock as the last step.
     * Only the lock remains when this returns; the caller releases it.
     *
     * @throws PreflightException on the first failed check, with nothing changed.
     */
    public void checkAndLock(LibraryContext context, List<MetadataWriter> writers) throws PreflightException {
        Path root = context.getRoot();

        if (!Files.isDirectory(root)) {
            throw new PreflightException("root", "Library root is not a directory: " + root);
        }

        for (MetadataWriter writer : writers) {
            if (!writer.isAvailable()) {
                throw new PreflightException("tools", "Required tool is not available: " + writer.getToolName());
            }
        }

        checkFreeSpace(root, context.getSettings().getMinFreeSpacePercent());
        probeWrite(root);

        try {
            if (!context.getLock().tryAcquire()) {
                String owner = context.getLock().readOwner().map(String::valueOf).orElse("?");
                throw new PreflightException("lock", "Another reorganization is running (process " + owner + ")");
            }
        } catch (IOException e) {
            throw new PreflightException("lock", "Cannot create lock file: " + e.getMessage(), e);
        }
        LibraryLogger.logInfo(root, CONTEXT, "Pre-flight passed for " + root);
    }

    void checkFreeSpace(Path root, int minPercent) throws PreflightException {
        try {
            FileStore store = Files.getFileStore(root);
            long total = store.getTotalSpace();
            long usable = store.getUsableSpace();
            if (total > 0 && usable * 100.0 / total < minPercent) {
                throw new PreflightException("space", String.format(
                        "Only %.1f%% free space on %s, %d%% required", usable * 100.0 / total, store.name(), minPercent));
            }
        } catch (IOException e) {
            throw new PreflightException("space", "Cannot determine free space: " + e.getMessage(), e);
        }
    }

    // Permission bits lie on network and FAT volumes: write for real
    void probeWrite(Path root) throws PreflightException {
        Path probe = root.resolve(".mediavault_probe_" + UUID.randomUUID());
        try {
            Files.writeString(probe, "probe", StandardCharsets.UTF_8);
            Files.delete(probe);
        } catch (IOException e) {
            throw new PreflightException("writable", "Library is not writable: " + e.getMessage(), e);
        }
    }
}
