package com.mediavault.service.normalize;

import com.mediavault.model.Disposition;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Writes video creation times by remuxing with ffmpeg (stream copy, no re-encoding)
 * and reads them back with ffprobe.
 */
public class FfmpegRemuxWriter implements MetadataWriter {

    private static final DateTimeFormatter CREATION_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'");
    private static final Duration VERSION_CHECK_TIMEOUT = Duration.ofSeconds(10);

    private final String ffmpegExecutable;
    private final String ffprobeExecutable;
    private final ExternalToolRunner runner;

    public FfmpegRemuxWriter(String ffmpegExecutable, String ffprobeExecutable, ExternalToolRunner runner) {
        this.ffmpegExecutable = ffmpegExecutable;
        this.ffprobeExecutable = ffprobeExecutable;
        this.runner = runner;
    }

    @Override
    public String getToolName() {
        return "ffmpeg";
    }

    @Override
    public boolean isAvailable() {
        return runner.isInvocable(List.of(ffmpegExecutable, "-version"), VERSION_CHECK_TIMEOUT)
                && runner.isInvocable(List.of(ffprobeExecutable, "-version"), VERSION_CHECK_TIMEOUT);
    }

    @Override
    public void writeCaptureDate(Path input, Path output, LocalDateTime capturedAt, Duration timeout)
            throws NormalizationException {
        List<String> command = List.of(ffmpegExecutable,
                "-hide_banner",
                "-loglevel", "error",
                "-y",
                "-i", input.toAbsolutePath().toString(),
                "-map_metadata", "0",
                "-metadata", "creation_time=" + capturedAt.format(CREATION_TIME_FORMAT),
                "-codec", "copy",
                output.toAbsolutePath().toString());

        ToolResult result = runner.run(command, timeout);
        if (!result.isSuccess()) {
            throw new NormalizationException(FailureClassifier.classify(result.diagnostic()),
                    "ffmpeg failed: " + result.diagnostic());
        }
    }

    @Override
    public LocalDateTime readCaptureDate(Path file, Duration timeout) throws NormalizationException {
        List<String> command = List.of(ffprobeExecutable,
                "-v", "error",
                "-show_entries", "format_tags=creation_time",
                "-of", "default=noprint_wrappers=1:nokey=1",
                file.toAbsolutePath().toString());

        ToolResult result = runner.run(command, timeout);
        if (!result.isSuccess()) {
            throw new NormalizationException(FailureClassifier.classify(result.diagnostic()),
                    "ffprobe failed: " + result.diagnostic());
        }
        String text = result.getStdout().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            // e.g. 2020-05-01T10:00:00.000000Z
            return LocalDateTime.parse(text.substring(0, Math.min(19, text.length())));
        } catch (DateTimeParseException e) {
            throw new NormalizationException(Disposition.CORRUPTED, "Unparseable creation_time: " + text, e);
        }
    }
}
