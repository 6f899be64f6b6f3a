package com.mediavault.service.normalize;

import com.mediavault.model.Disposition;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes photo capture dates with exiftool (DateTimeOriginal, CreateDate and ModifyDate).
 */
public class ExifToolWriter implements MetadataWriter {

    private static final DateTimeFormatter EXIF_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");
    private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(10);

    private final String executable;
    private final ExternalToolRunner runner;

    public ExifToolWriter(String executable, ExternalToolRunner runner) {
        this.executable = executable;
        this.runner = runner;
    }

    @Override
    public String getToolName() {
        return "exiftool";
    }

    @Override
    public boolean isAvailable() {
        return runner.isInvocable(List.of(executable, "-ver"), VERSION_CHECK_TIMEOUT);
    }

    @Override
    public void writeCaptureDate(Path input, Path output, LocalDateTime capturedAt, Duration timeout)
            throws NormalizationException {
        String value = capturedAt.format(EXIF_FORMAT);

        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("-P"); // keep file modification date
        command.add("-DateTimeOriginal=" + value);
        command.add("-CreateDate=" + value);
        command.add("-ModifyDate=" + value);
        command.add("-o");
        command.add(output.toAbsolutePath().toString());
        command.add(input.toAbsolutePath().toString());

        ToolResult result = runner.run(command, timeout);
        // exiftool reports "0 image files created" with exit code 0 for some refusals
        if (!result.isSuccess() || result.getStdout().contains("0 image files created")) {
            throw new NormalizationException(FailureClassifier.classify(result.diagnostic()),
                    "exiftool failed: " + result.diagnostic());
        }
    }

    @Override
    public LocalDateTime readCaptureDate(Path file, Duration timeout) throws NormalizationException {
        ToolResult result = runner.run(
                List.of(executable, "-DateTimeOriginal", "-s3", file.toAbsolutePath().toString()), timeout);
        if (!result.isSuccess()) {
            throw new NormalizationException(FailureClassifier.classify(result.diagnostic()),
                    "exiftool read-back failed: " + result.diagnostic());
        }
        String text = result.getStdout().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            // Sub-seconds or a zone suffix may follow the first 19 characters
            return LocalDateTime.parse(text.substring(0, Math.min(19, text.length())), EXIF_FORMAT);
        } catch (DateTimeParseException e) {
            throw new NormalizationException(Disposition.CORRUPTED, "Unparseable DateTimeOriginal: " + text, e);
        }
    }
}
