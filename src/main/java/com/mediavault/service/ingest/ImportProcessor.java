package com.mediavault.service.ingest;

import com.mediavault.model.Disposition;
import com.mediavault.model.OperationSummary;
import com.mediavault.model.ProgressEvent;
import com.mediavault.model.Rejection;
import com.mediavault.repository.DatabaseException;
import com.mediavault.service.LibraryContext;
import com.mediavault.service.MediaTreeWalker;
import com.mediavault.service.OperationControl;
import com.mediavault.service.ProgressSink;
import com.mediavault.service.ProgressThrottle;
import com.mediavault.util.LibraryLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Imports user-selected files and folders into the library. Sources are copied, never modified.
 * Folders are expanded recursively; files are processed one at a time in the given order.
 */
public class ImportProcessor {

    private static final String CONTEXT = "ImportProcessor";

    private final IngestionEngine engine;
    private final LibraryContext context;

    public ImportProcessor(IngestionEngine engine) {
        this.engine = engine;
        this.context = engine.getContext();
    }

    /**
     * Imports the given paths, emitting start, progress, rejected and complete events.
     * A store failure ends the run with an error event instead.
     */
    public OperationSummary importFiles(List<Path> paths, ProgressSink sink, OperationControl control) {
        OperationSummary summary = new OperationSummary();
        LibraryLogger.logInfo(context.getRoot(), CONTEXT, "Starting import of " + paths.size() + " selected paths");

        List<Path> files = new ArrayList<>();
        List<Path> missing = new ArrayList<>();
        expand(paths, files, missing);

        int total = files.size() + missing.size();
        sink.emit(ProgressEvent.start(total));

        // Missing paths cannot be trashed; they are only reported
        for (Path path : missing) {
            reject(summary, sink, new Rejection(String.valueOf(path.getFileName()), path.toString(),
                    Disposition.CORRUPTED, "File not found", null));
        }

        ProgressThrottle throttle = new ProgressThrottle(
                context.getSettings().getProgressEveryFiles(), context.getSettings().getProgressIntervalMillis());

        int current = missing.size();
        try {
            for (Path file : files) {
                if (control.isCancelled()) {
                    summary.markCancelled();
                    LibraryLogger.logInfo(context.getRoot(), CONTEXT, "Import cancelled after " + current + " files");
                    break;
                }

                IngestionOutcome outcome = engine.begin(file, StagingMode.COPY, TransactionListener.NONE).execute();
                if (outcome.isCommitted()) {
                    summary.recordProcessed();
                } else {
                    reject(summary, sink, outcome.toRejection(file.getFileName().toString(), file.toString()));
                }

                current++;
                if (throttle.shouldEmit(current, total)) {
                    sink.emit(ProgressEvent.progress(current, total, file.getFileName().toString(), summary));
                }
            }
        } catch (DatabaseException e) {
            LibraryLogger.logError(context.getRoot(), CONTEXT, "Import aborted, asset store failed", e);
            sink.emit(ProgressEvent.error("Asset store failure: " + e.getMessage()));
            return summary;
        } finally {
            LibraryLogger.flush(context.getRoot());
        }

        LibraryLogger.logInfo(context.getRoot(), CONTEXT, "Import finished: " + summary);
        sink.emit(ProgressEvent.complete(summary));
        return summary;
    }

    private void expand(List<Path> paths, List<Path> files, List<Path> missing) {
        MediaTreeWalker walker = new MediaTreeWalker(context.getRoot());
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                try {
                    files.addAll(walker.collect(path));
                } catch (IOException e) {
                    LibraryLogger.logError(context.getRoot(), CONTEXT, "Failed to scan folder " + path, e);
                    missing.add(path);
                }
            } else if (Files.exists(path)) {
                files.add(path);
            } else {
                missing.add(path);
            }
        }
    }

    private void reject(OperationSummary summary, ProgressSink sink, Rejection rejection) {
        summary.recordRejection(rejection);
        sink.emit(ProgressEvent.rejected(rejection));
    }
}
