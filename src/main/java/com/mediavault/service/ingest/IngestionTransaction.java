package com.mediavault.service.ingest;

import com.mediavault.model.Disposition;
import com.mediavault.model.MediaAsset;
import com.mediavault.model.MediaType;
import com.mediavault.model.TrashEntry;
import com.mediavault.repository.DatabaseException;
import com.mediavault.repository.DuplicateHashException;
import com.mediavault.service.LibraryContext;
import com.mediavault.service.normalize.NormalizationException;
import com.mediavault.util.FileUtils;
import com.mediavault.util.LibraryLogger;
import com.mediavault.util.MediaFormats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Brings one source file into the library: stage, normalize, rehash, dedupe, then commit or roll back.
 *
 * <p>States: {@code NEW -> STAGED -> NORMALIZED -> REHASHED -> COMMITTED | DUPLICATE_DETECTED | ROLLED_BACK}.
 * Every rejected file ends up in {@code .trash/<category>/} with a trash entry, except a source that
 * no longer exists. The first file to reach a hash keeps it, so transactions of one library must run
 * one after another.</p>
 */
public class IngestionTransaction {

    private static final String CONTEXT = "IngestionTransaction";

    private final IngestionEngine engine;
    private final LibraryContext context;
    private final Path source;
    private final StagingMode mode;
    private final TransactionListener listener;
    private final String originalPath;
    private final String fileName;

    private TransactionState state = TransactionState.NEW;
    private Path staged;

    IngestionTransaction(IngestionEngine engine, Path source, StagingMode mode, TransactionListener listener) {
        this.engine = engine;
        this.context = engine.getContext();
        this.source = source;
        this.mode = mode;
        this.listener = listener;
        this.originalPath = context.isInside(source) ? context.relativize(source) : source.toAbsolutePath().toString();
        this.fileName = source.getFileName().toString();
    }

    public TransactionState getState() {
        return state;
    }

    /**
     * Runs the transaction to a final state.
     *
     * @return The outcome; per-file failures are always expressed as a category, never thrown.
     * @throws DatabaseException if the asset store itself fails. The placed file has been removed
     *                           (copy) or restored to its source (move) by then.
     */
    public IngestionOutcome execute() {
        if (state != TransactionState.NEW) {
            throw new IllegalStateException("Transaction already executed for " + source);
        }
        String extension = FileUtils.getExtension(fileName);

        if (!Files.isRegularFile(source, LinkOption.NOFOLLOW_LINKS)) {
            state = TransactionState.ROLLED_BACK;
            return IngestionOutcome.rejected(state, Disposition.CORRUPTED, "File not found: " + source, null);
        }

        if (context.getSettings().isSkipRawFiles() && MediaFormats.isRaw(source)) {
            return rejectSource(TransactionState.ROLLED_BACK, Disposition.RAW_SKIPPED,
                    "RAW format ." + extension + " is not normalized");
        }

        MediaType type;
        try {
            type = engine.getNormalizer().checkSupported(source);
        } catch (NormalizationException e) {
            return rejectSource(TransactionState.ROLLED_BACK, e.getCategory(), e.getMessage());
        }

        // 1. Pre-hash and dedupe against the library as it is
        LocalDateTime capturedAt;
        try {
            String preHash = engine.getHasher().hash(source);
            MediaAsset existing = engine.findCollision(preHash, null);
            if (existing != null) {
                return rejectSource(TransactionState.DUPLICATE_DETECTED, Disposition.DUPLICATE,
                        "Same content as " + existing.getCurrentPath());
            }
            capturedAt = engine.getDateExtractor().extractCaptureDate(source);
        } catch (IOException e) {
            return rejectSource(TransactionState.ROLLED_BACK, IngestionEngine.classify(e),
                    "Cannot read file: " + e.getMessage());
        }

        // 2. Stage
        try {
            staged = engine.newStagingFile(extension);
            listener.beforeMutation("stage", source, staged);
            if (mode == StagingMode.COPY) {
                FileUtils.copyFile(source, staged);
            } else {
                FileUtils.moveFile(source, staged);
            }
            state = TransactionState.STAGED;
        } catch (IOException e) {
            discardIncompleteStaging();
            return rejectSource(TransactionState.ROLLED_BACK, IngestionEngine.classify(e),
                    "Cannot stage file: " + e.getMessage());
        }

        // 3. Normalize
        try {
            listener.beforeMutation("normalize", staged, staged);
            engine.getNormalizer().normalize(staged, capturedAt);
            state = TransactionState.NORMALIZED;
        } catch (NormalizationException e) {
            return rejectStaged(TransactionState.ROLLED_BACK, e.getCategory(), e.getMessage());
        }

        // 4. Rehash
        String finalHash;
        long byteSize;
        try {
            finalHash = engine.getHasher().hash(staged);
            byteSize = Files.size(staged);
            state = TransactionState.REHASHED;
        } catch (IOException e) {
            return rejectStaged(TransactionState.ROLLED_BACK, IngestionEngine.classify(e),
                    "Cannot read normalized file: " + e.getMessage());
        }

        // 5. Dedupe again: normalization can make distinct files identical
        MediaAsset collision = engine.findCollision(finalHash, null);
        if (collision != null) {
            return rejectStaged(TransactionState.DUPLICATE_DETECTED, Disposition.DUPLICATE,
                    "Identical to " + collision.getCurrentPath() + " after normalization");
        }

        // 6. Place, then record
        String relativePath = engine.allocatePath(
                engine.getPathDeriver().derive(capturedAt, finalHash, extension), null);
        Path target = context.resolve(relativePath);
        try {
            listener.beforeMutation("place", staged, target);
            FileUtils.moveFile(staged, target);
            staged = target;
        } catch (IOException e) {
            return rejectStaged(TransactionState.ROLLED_BACK, IngestionEngine.classify(e),
                    "Cannot place file: " + e.getMessage());
        }

        MediaAsset asset = new MediaAsset(finalHash, relativePath, fileName, capturedAt, type, byteSize);
        Integer[] dimensions = engine.getDimensionReader().read(target, type);
        asset.setDimensions(dimensions[0], dimensions[1]);

        try {
            context.getStore().insert(asset);
        } catch (DuplicateHashException e) {
            return rejectStaged(TransactionState.DUPLICATE_DETECTED, Disposition.DUPLICATE, e.getMessage());
        } catch (DatabaseException e) {
            undoPlacement(target);
            state = TransactionState.ROLLED_BACK;
            throw e;
        }

        state = TransactionState.COMMITTED;
        return IngestionOutcome.committed(asset);
    }

    // Source is still where it was: copy it (import) or move it (terraform) into the trash
    private IngestionOutcome rejectSource(TransactionState finalState, Disposition category, String message) {
        String trashPath = null;
        String reported = message;
        try {
            Path target = engine.getTrashManager().targetFor(category, fileName);
            listener.beforeMutation("trash", source, target);
            TrashEntry entry = mode == StagingMode.COPY
                    ? engine.getTrashManager().copy(source, target, category, originalPath, message)
                    : engine.getTrashManager().move(source, target, category, originalPath, message);
            trashPath = entry.getTrashPath();
        } catch (IOException e) {
            LibraryLogger.logError(context.getRoot(), CONTEXT, "Could not move " + source + " to trash", e);
            reported = message + " (not moved to trash: " + e.getMessage() + ")";
        }
        return finish(finalState, category, reported, trashPath);
    }

    // The staged (or placed) file carries the bytes to keep: move it into the trash
    private IngestionOutcome rejectStaged(TransactionState finalState, Disposition category, String message) {
        String trashPath = null;
        String reported = message;
        try {
            Path target = engine.getTrashManager().targetFor(category, fileName);
            listener.beforeMutation("trash", staged, target);
            trashPath = engine.getTrashManager().move(staged, target, category, originalPath, message).getTrashPath();
        } catch (IOException e) {
            LibraryLogger.logError(context.getRoot(), CONTEXT, "Could not move " + staged + " to trash", e);
            reported = message + " (left at " + staged + ": " + e.getMessage() + ")";
        }
        return finish(finalState, category, reported, trashPath);
    }

    private IngestionOutcome finish(TransactionState finalState, Disposition category, String message, String trashPath) {
        state = finalState;
        LibraryLogger.logInfo(context.getRoot(), CONTEXT,
                "Rejected " + originalPath + " as " + category.wireName() + ": " + message);
        return IngestionOutcome.rejected(finalState, category, message, trashPath);
    }

    private void discardIncompleteStaging() {
        // A copy that failed half-way, or a cross-device move that copied but could not delete
        if (staged != null && Files.exists(staged) && Files.exists(source)) {
            try {
                Files.delete(staged);
            } catch (IOException e) {
                LibraryLogger.logError(context.getRoot(), CONTEXT, "Could not remove partial staging file " + staged, e);
            }
        }
    }

    private void undoPlacement(Path target) {
        try {
            if (mode == StagingMode.COPY) {
                Files.deleteIfExists(target);
            } else {
                listener.beforeMutation("restore", target, source);
                FileUtils.moveFile(target, source);
            }
        } catch (IOException e) {
            LibraryLogger.logError(context.getRoot(), CONTEXT, "Could not undo placement of " + target, e);
        }
    }
}
