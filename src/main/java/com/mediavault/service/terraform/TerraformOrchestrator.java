package com.mediavault.service.terraform;

import com.mediavault.model.Disposition;
import com.mediavault.model.ManifestRecord;
import com.mediavault.model.MediaAsset;
import com.mediavault.model.OperationSummary;
import com.mediavault.model.ProgressEvent;
import com.mediavault.model.Rejection;
import com.mediavault.repository.DatabaseException;
import com.mediavault.service.LibraryContext;
import com.mediavault.service.MediaTreeWalker;
import com.mediavault.service.OperationControl;
import com.mediavault.service.ProgressSink;
import com.mediavault.service.ProgressThrottle;
import com.mediavault.service.ingest.IngestionEngine;
import com.mediavault.service.ingest.IngestionOutcome;
import com.mediavault.service.ingest.StagingMode;
import com.mediavault.service.ingest.TransactionListener;
import com.mediavault.util.FileUtils;
import com.mediavault.util.LibraryLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns an existing folder tree into a managed library, in place.
 *
 * <p>A run passes pre-flight, recovers files left half-way by an interrupted run, then moves every
 * media file through an ingestion transaction. Each mutation is announced in the manifest before it
 * happens, and each file gets a success, failed or skipped record afterwards. Emptied directories
 * are removed at the end. A cancelled run writes no complete record, so the next run resumes it.</p>
 */
public class TerraformOrchestrator {

    private static final String CONTEXT = "TerraformOrchestrator";

    private final IngestionEngine engine;
    private final LibraryContext context;
    private final PreflightChecker preflightChecker;

    public TerraformOrchestrator(IngestionEngine engine) {
        this(engine, new PreflightChecker());
    }

    public TerraformOrchestrator(IngestionEngine engine, PreflightChecker preflightChecker) {
        this.engine = engine;
        this.context = engine.getContext();
        this.preflightChecker = preflightChecker;
    }

    public OperationSummary terraform(Path rootPath, ProgressSink sink, OperationControl control) {
        OperationSummary summary = new OperationSummary();
        Path root = context.getRoot();

        if (!rootPath.toAbsolutePath().normalize().equals(root)) {
            sink.emit(ProgressEvent.error("Terraform root " + rootPath + " is not the library root " + root));
            return summary;
        }

        try {
            preflightChecker.checkAndLock(context, engine.getNormalizer().getWriters());
        } catch (PreflightException e) {
            LibraryLogger.logErrorIfLogExists(root, CONTEXT, "Pre-flight failed (" + e.getCheck() + ")", e);
            sink.emit(ProgressEvent.error("Pre-flight failed: " + e.getMessage()));
            return summary;
        }

        try {
            ResumeState resume = ResumeState.load(context.getLogsDir(), root);
            ManifestLog manifest = ManifestLog.create(context.getLogsDir(), LocalDateTime.now());
            manifest.append(ManifestRecord.start(root.toString()));
            LibraryLogger.logInfo(root, CONTEXT, "Terraform started, manifest " + manifest.getFile().getFileName()
                    + (resume.getManifestCount() > 0 ? ", resuming after " + resume.getManifestCount() + " earlier runs" : ""));

            recoverUnfinished(resume, manifest);

            List<Path> files = collectPending(resume);
            int total = files.size();
            sink.emit(ProgressEvent.start(total));

            ProgressThrottle throttle = new ProgressThrottle(
                    context.getSettings().getProgressEveryFiles(), context.getSettings().getProgressIntervalMillis());

            int current = 0;
            for (Path file : files) {
                if (control.isCancelled()) {
                    summary.markCancelled();
                    break;
                }
                processFile(file, manifest, summary, sink);
                current++;
                if (throttle.shouldEmit(current, total)) {
                    sink.emit(ProgressEvent.progress(current, total, file.getFileName().toString(), summary));
                }
            }

            if (summary.isCancelled()) {
                LibraryLogger.logInfo(root, CONTEXT, "Terraform cancelled after " + current + " of " + total + " files");
            } else {
                int removed = new EmptyDirectoryCleaner(root).clean(root, context.getSettings().getCleanupMaxPasses());
                LibraryLogger.logInfo(root, CONTEXT, "Removed " + removed + " empty directories");
                ManifestRecord complete = ManifestRecord.complete(summary);
                complete.setTotal(total);
                manifest.append(complete);
                LibraryLogger.logInfo(root, CONTEXT, "Terraform finished: " + summary);
            }
            sink.emit(ProgressEvent.complete(summary));

        } catch (IOException | UncheckedIOException | DatabaseException e) {
            LibraryLogger.logError(root, CONTEXT, "Terraform aborted", e);
            sink.emit(ProgressEvent.error("Terraform aborted: " + e.getMessage()));
        } finally {
            context.getLock().release();
            LibraryLogger.flush(root);
        }
        return summary;
    }

    private List<Path> collectPending(ResumeState resume) throws IOException {
        MediaTreeWalker walker = new MediaTreeWalker(context.getRoot());
        List<Path> pending = new ArrayList<>();
        for (Path file : walker.collect(context.getRoot())) {
            String relative = context.relativize(file);
            if (resume.isDone(relative) || context.getStore().findByPath(relative) != null) {
                continue;
            }
            pending.add(file);
        }
        for (Path link : walker.getSkippedSymlinks()) {
            LibraryLogger.logInfo(context.getRoot(), CONTEXT, "Skipping symlink " + context.relativize(link));
        }
        return pending;
    }

    private void processFile(Path file, ManifestLog manifest, OperationSummary summary, ProgressSink sink) {
        String relative = context.relativize(file);
        // Keyed by the original path so an interrupted file can be traced through all its phases
        TransactionListener listener = (phase, from, to) ->
                manifest.append(ManifestRecord.processing(phase, relative, displayPath(to)));

        IngestionOutcome outcome = engine.begin(file, StagingMode.MOVE, listener).execute();

        if (outcome.isCommitted()) {
            MediaAsset asset = outcome.getAsset();
            manifest.append(ManifestRecord.success(relative, asset.getCurrentPath(), asset.getContentHash()));
            summary.recordProcessed();
            return;
        }

        if (outcome.getCategory() == Disposition.RAW_SKIPPED) {
            manifest.append(ManifestRecord.skipped(relative, outcome.getTrashPath(), outcome.getMessage()));
        } else {
            manifest.append(ManifestRecord.failed(relative, outcome.getTrashPath(), outcome.getCategory(),
                    outcome.getMessage()));
        }
        Rejection rejection = outcome.toRejection(file.getFileName().toString(), relative);
        summary.recordRejection(rejection);
        sink.emit(ProgressEvent.rejected(rejection));
    }

    /**
     * Settles files whose last run stopped between their first processing record and their outcome.
     * Registered files get their missing success record, trashed files their failed record, and files
     * caught in staging or placement go back to their original path to be processed again.
     */
    void recoverUnfinished(ResumeState resume, ManifestLog manifest) throws IOException {
        for (Map.Entry<String, List<ManifestRecord>> entry : resume.getUnfinished().entrySet()) {
            String original = entry.getKey();
            List<ManifestRecord> records = entry.getValue();

            ManifestRecord placed = lastWithPhase(records, "place");
            if (placed != null && placed.getNewPath() != null) {
                MediaAsset asset = context.getStore().findByPath(placed.getNewPath());
                if (asset != null) {
                    manifest.append(ManifestRecord.success(original, asset.getCurrentPath(), asset.getContentHash()));
                    resume.markFinished(original, asset.getCurrentPath());
                    LibraryLogger.logInfo(context.getRoot(), CONTEXT, "Recovered committed file " + original);
                    continue;
                }
            }

            ManifestRecord trashed = lastWithPhase(records, "trash");
            if (trashed != null && trashed.getNewPath() != null
                    && Files.exists(context.resolve(trashed.getNewPath()), LinkOption.NOFOLLOW_LINKS)) {
                manifest.append(ManifestRecord.failed(original, trashed.getNewPath(),
                        categoryOfTrashPath(trashed.getNewPath()), "Recovered after interrupted run"));
                resume.markFinished(original, null);
                LibraryLogger.logInfo(context.getRoot(), CONTEXT, "Recovered trashed file " + original);
                continue;
            }

            restoreToOriginal(original, records);
        }
    }

    private void restoreToOriginal(String original, List<ManifestRecord> records) throws IOException {
        Path originalFile = context.resolve(original);
        if (Files.exists(originalFile, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        for (int i = records.size() - 1; i >= 0; i--) {
            String candidatePath = records.get(i).getNewPath();
            if (candidatePath == null || context.getStore().findByPath(candidatePath) != null) {
                continue;
            }
            Path candidate = context.resolve(candidatePath);
            if (Files.isRegularFile(candidate, LinkOption.NOFOLLOW_LINKS)) {
                FileUtils.moveFile(candidate, originalFile);
                LibraryLogger.logInfo(context.getRoot(), CONTEXT,
                        "Moved interrupted file back from " + candidatePath + " to " + original);
                return;
            }
        }
        LibraryLogger.logWarning(context.getRoot(), CONTEXT, "Could not locate interrupted file " + original);
    }

    private static ManifestRecord lastWithPhase(List<ManifestRecord> records, String phase) {
        for (int i = records.size() - 1; i >= 0; i--) {
            if (phase.equals(records.get(i).getPhase())) {
                return records.get(i);
            }
        }
        return null;
    }

    // .trash/<category>/<file>
    private static Disposition categoryOfTrashPath(String trashPath) {
        String[] parts = trashPath.split("/");
        if (parts.length >= 3) {
            try {
                return Disposition.fromWireName(parts[1]);
            } catch (IllegalArgumentException e) {
                return Disposition.CORRUPTED;
            }
        }
        return Disposition.CORRUPTED;
    }

    private String displayPath(Path path) {
        return context.isInside(path) ? context.relativize(path) : path.toAbsolutePath().toString();
    }
}
