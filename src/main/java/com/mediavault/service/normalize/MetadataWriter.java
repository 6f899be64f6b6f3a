package com.mediavault.service.normalize;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * An external utility able to write and read back the embedded capture timestamp of a file.
 */
public interface MetadataWriter {

    String getToolName();

    /**
     * True when the underlying tool is installed and invocable.
     */
    boolean isAvailable();

    /**
     * Writes {@code input} with its capture timestamp set to {@code capturedAt} into {@code output}.
     * The input file is never modified.
     */
    void writeCaptureDate(Path input, Path output, LocalDateTime capturedAt, Duration timeout)
            throws NormalizationException;

    /**
     * Reads back the embedded capture timestamp, or null when the file carries none.
     */
    LocalDateTime readCaptureDate(Path file, Duration timeout) throws NormalizationException;
}
