package com.mediavault.service.retag;

import com.mediavault.model.Disposition;
import com.mediavault.model.MediaAsset;
import com.mediavault.model.OperationSummary;
import com.mediavault.model.ProgressEvent;
import com.mediavault.model.Rejection;
import com.mediavault.model.TrashEntry;
import com.mediavault.repository.DatabaseException;
import com.mediavault.service.LibraryContext;
import com.mediavault.service.OperationControl;
import com.mediavault.service.ProgressSink;
import com.mediavault.service.ProgressThrottle;
import com.mediavault.service.ingest.IngestionEngine;
import com.mediavault.service.normalize.NormalizationException;
import com.mediavault.service.terraform.EmptyDirectoryCleaner;
import com.mediavault.util.FileUtils;
import com.mediavault.util.LibraryLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Gives existing assets a new capture date.
 *
 * <p>Assets are handled one by one in ascending id order. Each file is normalized on a staged copy,
 * rehashed and checked against the whole library, including assets already updated by this batch.
 * An asset whose new content equals another asset's is demoted to the duplicate trash. A failed
 * normalization leaves the asset and its file untouched. The batch never stops for one asset.</p>
 */
public class RetagBatchProcessor {

    private static final String CONTEXT = "RetagBatchProcessor";

    private final IngestionEngine engine;
    private final LibraryContext context;

    public RetagBatchProcessor(IngestionEngine engine) {
        this.engine = engine;
        this.context = engine.getContext();
    }

    public OperationSummary retag(RetagRequest request, ProgressSink sink, OperationControl control) {
        OperationSummary summary = new OperationSummary();
        // Ascending, without repeats: the first asset to reach a hash keeps it
        List<Long> ids = new ArrayList<>(new TreeSet<>(request.getAssetIds()));
        LibraryLogger.logInfo(context.getRoot(), CONTEXT,
                "Retagging " + ids.size() + " assets to " + request.getNewDate() + " (" + request.getMode() + ")");

        sink.emit(ProgressEvent.start(ids.size()));
        ProgressThrottle throttle = new ProgressThrottle(
                context.getSettings().getProgressEveryFiles(), context.getSettings().getProgressIntervalMillis());

        try {
            List<MediaAsset> assets = new ArrayList<>();
            for (Long id : ids) {
                MediaAsset asset = context.getStore().findById(id);
                if (asset != null) {
                    assets.add(asset);
                }
            }
            Map<Long, LocalDateTime> targetDates = computeTargetDates(assets, request);

            int current = 0;
            for (Long id : ids) {
                if (control.isCancelled()) {
                    summary.markCancelled();
                    break;
                }
                current++;

                // Re-read: an earlier asset of this batch may have changed the library
                MediaAsset asset = context.getStore().findById(id);
                if (asset == null) {
                    reject(summary, sink, new Rejection("#" + id, null, Disposition.CORRUPTED,
                            "Unknown asset id " + id, null));
                } else {
                    retagOne(asset, targetDates.get(id), summary, sink);
                }

                if (throttle.shouldEmit(current, ids.size())) {
                    String file = asset != null ? asset.getCurrentPath() : "#" + id;
                    sink.emit(ProgressEvent.progress(current, ids.size(), file, summary));
                }
            }
        } catch (DatabaseException e) {
            LibraryLogger.logError(context.getRoot(), CONTEXT, "Retag aborted, asset store failed", e);
            sink.emit(ProgressEvent.error("Asset store failure: " + e.getMessage()));
            return summary;
        } finally {
            LibraryLogger.flush(context.getRoot());
        }

        LibraryLogger.logInfo(context.getRoot(), CONTEXT, "Retag finished: " + summary);
        sink.emit(ProgressEvent.complete(summary));
        return summary;
    }

    /**
     * Computes the date each asset should end up with, truncated to seconds.
     */
    public static Map<Long, LocalDateTime> computeTargetDates(List<MediaAsset> assets, RetagRequest request) {
        Map<Long, LocalDateTime> dates = new HashMap<>();
        if (assets.isEmpty()) {
            return dates;
        }
        LocalDateTime newDate = request.getNewDate().truncatedTo(ChronoUnit.SECONDS);

        switch (request.getMode()) {
            case SAME:
                assets.forEach(asset -> dates.put(asset.getId(), newDate));
                break;
            case SHIFT: {
                MediaAsset reference = shiftReference(assets, request.getAssetIds());
                Duration offset = reference.getCapturedAt() != null
                        ? Duration.between(reference.getCapturedAt(), newDate)
                        : Duration.ZERO;
                for (MediaAsset asset : assets) {
                    LocalDateTime original = asset.getCapturedAt() != null ? asset.getCapturedAt() : newDate;
                    dates.put(asset.getId(), original.plus(offset).truncatedTo(ChronoUnit.SECONDS));
                }
                break;
            }
            case SEQUENCE: {
                List<MediaAsset> ordered = new ArrayList<>(assets);
                ordered.sort(Comparator.comparing(MediaAsset::getCapturedAt,
                                Comparator.nullsLast(Comparator.naturalOrder()))
                        .thenComparing(MediaAsset::getId));
                for (int i = 0; i < ordered.size(); i++) {
                    dates.put(ordered.get(i).getId(),
                            newDate.plus(request.getInterval().multipliedBy(i)).truncatedTo(ChronoUnit.SECONDS));
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unknown retag mode " + request.getMode());
        }
        return dates;
    }

    // The first selected asset that still exists anchors the offset
    private static MediaAsset shiftReference(List<MediaAsset> assets, List<Long> selection) {
        for (Long id : selection) {
            for (MediaAsset asset : assets) {
                if (id.equals(asset.getId())) {
                    return asset;
                }
            }
        }
        return assets.get(0);
    }

    private void retagOne(MediaAsset asset, LocalDateTime targetDate, OperationSummary summary, ProgressSink sink) {
        Path currentFile = context.resolve(asset.getCurrentPath());
        String fileName = currentFile.getFileName().toString();
        String extension = FileUtils.getExtension(fileName);

        if (!Files.isRegularFile(currentFile)) {
            reject(summary, sink, new Rejection(fileName, asset.getCurrentPath(), Disposition.CORRUPTED,
                    "File missing from library", null));
            return;
        }

        Path staged = null;
        try {
            staged = engine.newStagingFile(extension);
            FileUtils.copyFile(currentFile, staged);

            try {
                engine.getNormalizer().normalize(staged, targetDate);
            } catch (NormalizationException e) {
                reject(summary, sink, new Rejection(fileName, asset.getCurrentPath(), e.getCategory(),
                        e.getMessage(), null));
                return;
            }

            String newHash = engine.getHasher().hash(staged);
            MediaAsset winner = engine.findCollision(newHash, asset.getId());
            if (winner != null) {
                demote(asset, currentFile, winner, summary, sink);
                return;
            }

            String newPath = engine.allocatePath(
                    engine.getPathDeriver().derive(targetDate, newHash, extension), asset.getId());
            long byteSize = Files.size(staged);
            replaceFile(asset, currentFile, staged, newPath, newHash, targetDate, byteSize);
            staged = null;
            summary.recordProcessed();

        } catch (IOException e) {
            reject(summary, sink, new Rejection(fileName, asset.getCurrentPath(), IngestionEngine.classify(e),
                    "Cannot rewrite file: " + e.getMessage(), null));
        } finally {
            if (staged != null) {
                deleteStaged(staged);
            }
        }
    }

    // Old file parks in staging until the record points at the new one
    private void replaceFile(MediaAsset asset, Path currentFile, Path staged, String newPath, String newHash,
                             LocalDateTime targetDate, long byteSize) throws IOException {
        Path backup = engine.newStagingFile(FileUtils.getExtension(currentFile));
        Path newFile = context.resolve(newPath);

        FileUtils.moveFile(currentFile, backup);
        try {
            FileUtils.moveFile(staged, newFile);
        } catch (IOException e) {
            FileUtils.moveFile(backup, currentFile);
            throw e;
        }

        String oldPath = asset.getCurrentPath();
        LocalDateTime oldDate = asset.getCapturedAt();
        String oldHash = asset.getContentHash();
        long oldSize = asset.getByteSize();
        asset.setCurrentPath(newPath);
        asset.setContentHash(newHash);
        asset.setCapturedAt(targetDate);
        asset.setByteSize(byteSize);
        try {
            context.getStore().update(asset);
        } catch (DatabaseException e) {
            asset.setCurrentPath(oldPath);
            asset.setContentHash(oldHash);
            asset.setCapturedAt(oldDate);
            asset.setByteSize(oldSize);
            try {
                Files.deleteIfExists(newFile);
                FileUtils.moveFile(backup, currentFile);
            } catch (IOException restoreError) {
                LibraryLogger.logError(context.getRoot(), CONTEXT,
                        "Could not restore " + oldPath + " from " + backup, restoreError);
            }
            throw e;
        }

        Files.deleteIfExists(backup);
        pruneEmptyFolders(currentFile.getParent());
    }

    // Date and year folders the asset left behind
    private void pruneEmptyFolders(Path folder) {
        try {
            new EmptyDirectoryCleaner(context.getRoot()).pruneUpward(folder);
        } catch (IOException e) {
            LibraryLogger.logWarning(context.getRoot(), CONTEXT,
                    "Could not remove empty folder " + folder + ": " + e.getMessage());
        }
    }

    private void demote(MediaAsset asset, Path currentFile, MediaAsset winner, OperationSummary summary,
                        ProgressSink sink) throws IOException {
        String fileName = currentFile.getFileName().toString();
        String message = "Identical to " + winner.getCurrentPath() + " after retag";

        Path target = engine.getTrashManager().targetFor(Disposition.DUPLICATE, fileName);
        TrashEntry entry = engine.getTrashManager().move(currentFile, target, Disposition.DUPLICATE,
                asset.getCurrentPath(), message);
        context.getStore().delete(asset.getId());
        pruneEmptyFolders(currentFile.getParent());

        LibraryLogger.logInfo(context.getRoot(), CONTEXT, "Demoted asset " + asset.getId() + ": " + message);
        reject(summary, sink, new Rejection(fileName, asset.getCurrentPath(), Disposition.DUPLICATE, message,
                entry.getTrashPath()));
    }

    private void deleteStaged(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            LibraryLogger.logError(context.getRoot(), CONTEXT, "Could not remove staged copy " + staged, e);
        }
    }

    private void reject(OperationSummary summary, ProgressSink sink, Rejection rejection) {
        summary.recordRejection(rejection);
        sink.emit(ProgressEvent.rejected(rejection));
    }
}
