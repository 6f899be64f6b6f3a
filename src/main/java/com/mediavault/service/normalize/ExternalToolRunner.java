package com.mediavault.service.normalize;

import com.mediavault.model.Disposition;
import com.mediavault.util.LibraryLogger;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external tool with a hard timeout.
 * Output goes to temporary files so a chatty tool can never block on a full pipe.
 */
public class ExternalToolRunner {

    private final Path libraryRoot;

    public ExternalToolRunner(Path libraryRoot) {
        this.libraryRoot = libraryRoot;
    }

    /**
     * Runs the command and waits for it to finish.
     *
     * @param command Executable followed by its arguments.
     * @param timeout Upper bound for the call; the process is killed when it is exceeded.
     * @return The result of a process that finished in time, whatever its exit code.
     * @throws NormalizationException with {@code missing_tool} if the process cannot be started,
     *                                or {@code timeout} if it did not finish in time.
     */
    public ToolResult run(List<String> command, Duration timeout) throws NormalizationException {
        String toolName = command.get(0);
        File stdoutFile = null;
        File stderrFile = null;
        Process process = null;
        try {
            stdoutFile = File.createTempFile("mediavault_out_", ".txt");
            stderrFile = File.createTempFile("mediavault_err_", ".txt");

            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectOutput(stdoutFile);
            pb.redirectError(stderrFile);

            try {
                process = pb.start();
            } catch (IOException e) {
                throw new NormalizationException(Disposition.MISSING_TOOL,
                        toolName + " could not be started: " + e.getMessage(), e);
            }

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                throw new NormalizationException(Disposition.TIMEOUT,
                        toolName + " timed out after " + timeout.toSeconds() + "s");
            }

            return new ToolResult(process.exitValue(),
                    Files.readString(stdoutFile.toPath(), StandardCharsets.UTF_8),
                    Files.readString(stderrFile.toPath(), StandardCharsets.UTF_8));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new NormalizationException(Disposition.TIMEOUT, toolName + " was interrupted", e);
        } catch (IOException e) {
            throw new NormalizationException(Disposition.PERMISSION_DENIED,
                    "Could not capture output of " + toolName + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    /**
     * Checks that a tool can be started and exits cleanly, e.g. with its version flag.
     */
    public boolean isInvocable(List<String> command, Duration timeout) {
        try {
            return run(command, timeout).isSuccess();
        } catch (NormalizationException e) {
            LibraryLogger.logWarning(libraryRoot, "ExternalToolRunner",
                    "Tool check failed for " + command.get(0) + ": " + e.getMessage());
            return false;
        }
    }

    private void deleteQuietly(File file) {
        if (file != null && file.exists() && !file.delete()) {
            file.deleteOnExit();
        }
    }
}
