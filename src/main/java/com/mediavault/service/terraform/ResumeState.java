package com.mediavault.service.terraform;

import com.mediavault.model.ManifestEvent;
import com.mediavault.model.ManifestRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What earlier terraform runs of a library already did, rebuilt from their manifests.
 *
 * <p>Only runs after the last completed one count. A complete record means every file that run
 * saw was settled, so later files at the same paths are left to the registration check.</p>
 */
public class ResumeState {

    private final Set<String> finishedOriginals = new HashSet<>();
    private final Set<String> successPaths = new HashSet<>();
    private final Map<String, List<ManifestRecord>> unfinished = new LinkedHashMap<>();
    private int manifestCount;

    /**
     * Reads all manifests in the logs folder, oldest first.
     */
    public static ResumeState load(Path logsDir, Path libraryRoot) throws IOException {
        ResumeState state = new ResumeState();
        for (Path manifest : ManifestLog.findManifests(logsDir)) {
            List<ManifestRecord> records = ManifestLog.read(manifest, libraryRoot);
            if (isCompleted(records)) {
                state.clear();
            } else {
                state.apply(records);
            }
            state.manifestCount++;
        }
        return state;
    }

    static boolean isCompleted(List<ManifestRecord> records) {
        return records.stream().anyMatch(r -> r.getEvent() == ManifestEvent.COMPLETE);
    }

    private void clear() {
        finishedOriginals.clear();
        successPaths.clear();
        unfinished.clear();
    }

    void apply(List<ManifestRecord> records) {
        for (ManifestRecord record : records) {
            String original = record.getOriginalPath();
            if (record.getEvent() == ManifestEvent.PROCESSING && original != null) {
                unfinished.computeIfAbsent(original, k -> new ArrayList<>()).add(record);
            } else if (record.getEvent() != null && record.getEvent().isOutcome() && original != null) {
                markFinished(original, record.getEvent() == ManifestEvent.SUCCESS ? record.getNewPath() : null);
            }
        }
    }

    /**
     * Records that a file got its outcome record.
     *
     * @param successPath Library path of the resulting asset, or null for failed or skipped files.
     */
    public void markFinished(String originalPath, String successPath) {
        finishedOriginals.add(originalPath);
        unfinished.remove(originalPath);
        if (successPath != null) {
            successPaths.add(successPath);
        }
    }

    /**
     * True if a file at this library path needs no processing in this run.
     */
    public boolean isDone(String libraryPath) {
        return successPaths.contains(libraryPath) || finishedOriginals.contains(libraryPath);
    }

    /**
     * Files with processing records but no outcome: the run stopped while handling them.
     * Records are in write order.
     */
    public Map<String, List<ManifestRecord>> getUnfinished() {
        return new LinkedHashMap<>(unfinished);
    }

    public int getManifestCount() {
        return manifestCount;
    }
}
