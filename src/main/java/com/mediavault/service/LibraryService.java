package com.mediavault.service;

import com.mediavault.model.OperationSummary;
import com.mediavault.model.ProgressEvent;
import com.mediavault.model.RetagMode;
import com.mediavault.service.ingest.ImportProcessor;
import com.mediavault.service.ingest.IngestionEngine;
import com.mediavault.service.normalize.MetadataNormalizer;
import com.mediavault.service.retag.RetagBatchProcessor;
import com.mediavault.service.retag.RetagRequest;
import com.mediavault.service.terraform.TerraformOrchestrator;
import com.mediavault.util.LibraryLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point of one library. Each operation runs on the library's single worker thread and
 * reports through the returned {@link ProgressStream}, which always ends with a complete or
 * error event.
 */
public class LibraryService implements AutoCloseable {

    private static final String CONTEXT = "LibraryService";

    private final LibraryContext context;
    private final IngestionEngine engine;
    private final ExecutorService worker;

    public LibraryService(LibraryContext context, IngestionEngine engine) {
        this.context = context;
        this.engine = engine;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mediavault-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Opens the library at {@code root} with the external tools named in its settings.
     */
    public static LibraryService open(Path root) {
        LibraryContext context = LibraryContext.open(root);
        IngestionEngine engine = new IngestionEngine(context,
                new CaptureDateExtractor(context.getRoot()),
                MetadataNormalizer.withExternalTools(context.getRoot(), context.getSettings()));
        return new LibraryService(context, engine);
    }

    public ProgressStream importFiles(List<Path> paths) {
        return submit("import", (sink, control) -> new ImportProcessor(engine).importFiles(paths, sink, control));
    }

    public ProgressStream retagAssets(List<Long> assetIds, LocalDateTime newDate, RetagMode mode) {
        return retagAssets(new RetagRequest(assetIds, newDate, mode));
    }

    public ProgressStream retagAssets(List<Long> assetIds, LocalDateTime newDate, RetagMode mode, Duration interval) {
        return retagAssets(new RetagRequest(assetIds, newDate, mode, interval));
    }

    public ProgressStream retagAssets(RetagRequest request) {
        return submit("retag", (sink, control) -> new RetagBatchProcessor(engine).retag(request, sink, control));
    }

    public ProgressStream terraform(Path rootPath) {
        return submit("terraform", (sink, control) ->
                new TerraformOrchestrator(engine).terraform(rootPath, sink, control));
    }

    /**
     * Copies the rejected files of a finished run into {@code destination} with a report.
     */
    public Path exportRejections(OperationSummary summary, Path destination) throws IOException {
        return new RejectionReportWriter(context).export(summary, destination);
    }

    public LibraryContext getContext() {
        return context;
    }

    public IngestionEngine getEngine() {
        return engine;
    }

    private ProgressStream submit(String operation, Operation body) {
        OperationControl control = new OperationControl();
        ProgressStream stream = new ProgressStream(control);

        if (!OperationRegistry.getInstance().tryRegister(context.getRoot())) {
            stream.sink().emit(ProgressEvent.error("Another operation is already running on " + context.getRoot()));
            return stream;
        }

        // Released before the terminal event reaches the caller, so the next operation can start at once
        AtomicBoolean registered = new AtomicBoolean(true);
        Runnable release = () -> {
            if (registered.compareAndSet(true, false)) {
                OperationRegistry.getInstance().unregister(context.getRoot());
            }
        };
        ProgressSink sink = event -> {
            if (event.getType().isTerminal()) {
                release.run();
            }
            stream.sink().emit(event);
        };

        worker.submit(() -> {
            try {
                body.run(sink, control);
            } catch (RuntimeException e) {
                LibraryLogger.logError(context.getRoot(), CONTEXT, "Unexpected failure during " + operation, e);
                sink.emit(ProgressEvent.error("Unexpected failure during " + operation + ": " + e.getMessage()));
            } finally {
                release.run();
            }
        });
        return stream;
    }

    @FunctionalInterface
    private interface Operation {
        OperationSummary run(ProgressSink sink, OperationControl control);
    }

    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LibraryLogger.flush(context.getRoot());
    }
}
