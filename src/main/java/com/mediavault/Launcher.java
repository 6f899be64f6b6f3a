package com.mediavault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediavault.model.OperationSummary;
import com.mediavault.model.ProgressEvent;
import com.mediavault.model.ProgressEventType;
import com.mediavault.model.RetagMode;
import com.mediavault.service.LibraryService;
import com.mediavault.service.ProgressStream;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line front end. Every subcommand prints the events of its operation as JSON lines and
 * exits with 0 on complete, 1 on error.
 */
@Command(
        name = "mediavault",
        mixinStandardHelpOptions = true,
        version = "mediavault 1.0",
        description = "Imports, retags and reorganizes a date-structured media library.",
        subcommands = {
                Launcher.ImportCommand.class,
                Launcher.RetagCommand.class,
                Launcher.TerraformCommand.class
        })
public class Launcher implements Callable<Integer> {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Spec
    CommandSpec spec;

    @Option(
            names = {"-l", "--library"},
            required = true,
            description = "Library root directory.")
    Path library;

    @Option(
            names = {"--export-rejections"},
            description = "Copy rejected files and a report into this directory when the run ends.")
    Path exportDirectory;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Launcher()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Prints each event of the stream as one JSON line and exports rejections if asked to.
     */
    int printEvents(LibraryService service, ProgressStream stream, PrintWriter out) {
        ProgressEvent last = null;
        while (stream.hasNext()) {
            last = stream.next();
            try {
                out.println(MAPPER.writeValueAsString(last));
            } catch (JsonProcessingException e) {
                out.println("{\"type\":\"error\",\"message\":\"Cannot serialize event: " + e.getOriginalMessage() + "\"}");
            }
            out.flush();
        }
        if (last == null || last.getType() != ProgressEventType.COMPLETE) {
            return 1;
        }
        OperationSummary summary = last.getSummary();
        if (exportDirectory != null && summary != null && !summary.getRejections().isEmpty()) {
            try {
                Path folder = service.exportRejections(summary, exportDirectory);
                spec.commandLine().getErr().println("Rejected files exported to " + folder);
            } catch (IOException e) {
                spec.commandLine().getErr().println("Could not export rejected files: " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    @Command(name = "import", description = "Copy files or folders into the library.")
    static class ImportCommand implements Callable<Integer> {

        @ParentCommand
        Launcher parent;

        @Parameters(arity = "1..*", paramLabel = "PATH", description = "Files or folders to import.")
        List<Path> paths;

        @Override
        public Integer call() {
            try (LibraryService service = LibraryService.open(parent.library)) {
                return parent.printEvents(service, service.importFiles(paths), parent.spec.commandLine().getOut());
            }
        }
    }

    @Command(name = "retag", description = "Give library assets a new capture date.")
    static class RetagCommand implements Callable<Integer> {

        @ParentCommand
        Launcher parent;

        @Option(names = {"-d", "--date"}, required = true,
                description = "New capture date, e.g. 2021-06-01T10:00:00.")
        LocalDateTime date;

        @Option(names = {"-m", "--mode"}, defaultValue = "SAME",
                description = "SAME, SHIFT or SEQUENCE. Default: ${DEFAULT-VALUE}.")
        RetagMode mode;

        @Option(names = {"-i", "--interval"}, defaultValue = "300",
                description = "Seconds between assets in SEQUENCE mode. Default: ${DEFAULT-VALUE}.")
        long intervalSeconds;

        @Parameters(arity = "1..*", paramLabel = "ID", description = "Asset ids.")
        List<Long> ids;

        @Override
        public Integer call() {
            try (LibraryService service = LibraryService.open(parent.library)) {
                ProgressStream stream = service.retagAssets(ids, date, mode, Duration.ofSeconds(intervalSeconds));
                return parent.printEvents(service, stream, parent.spec.commandLine().getOut());
            }
        }
    }

    @Command(name = "terraform", description = "Reorganize the whole library folder in place.")
    static class TerraformCommand implements Callable<Integer> {

        private static final long CANCEL_GRACE_SECONDS = 150;

        @ParentCommand
        Launcher parent;

        @Override
        public Integer call() {
            try (LibraryService service = LibraryService.open(parent.library)) {
                // Ctrl-C lets the current file finish; the manifest allows a later resume
                ProgressStream stream = service.terraform(parent.library);
                CountDownLatch done = new CountDownLatch(1);
                Thread hook = new Thread(() -> {
                    stream.cancel();
                    awaitQuietly(done);
                }, "mediavault-cancel");
                Runtime.getRuntime().addShutdownHook(hook);
                try {
                    return parent.printEvents(service, stream, parent.spec.commandLine().getOut());
                } finally {
                    done.countDown();
                    removeHook(hook);
                }
            }
        }

        private static void awaitQuietly(CountDownLatch done) {
            try {
                if (!done.await(CANCEL_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    System.err.println("Terraform did not stop within " + CANCEL_GRACE_SECONDS + " s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private static void removeHook(Thread hook) {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // JVM already shutting down; the hook has run
                System.err.println("Shutdown in progress: " + e.getMessage());
            }
        }
    }
}
