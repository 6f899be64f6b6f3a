package com.mediavault.service.normalize;

import com.mediavault.model.Disposition;
import com.mediavault.model.MediaType;
import com.mediavault.util.FileUtils;
import com.mediavault.util.LibraryLogger;
import com.mediavault.util.LibrarySettings;
import com.mediavault.util.MediaFormats;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Rewrites the embedded capture timestamp of a file in place.
 *
 * <p>The tool writes into a hidden temporary sibling, the result is read back and compared,
 * and only a verified result replaces the original. On any failure the original file
 * is left byte-for-byte unchanged and the temporary file is removed.</p>
 */
public class MetadataNormalizer {

    private final Path libraryRoot;
    private final MetadataWriter imageWriter;
    private final MetadataWriter videoWriter;
    private final Duration imageTimeout;
    private final Duration videoTimeout;
    private final Duration readbackTimeout;

    public MetadataNormalizer(Path libraryRoot, MetadataWriter imageWriter, MetadataWriter videoWriter,
                              Duration imageTimeout, Duration videoTimeout, Duration readbackTimeout) {
        this.libraryRoot = libraryRoot;
        this.imageWriter = imageWriter;
        this.videoWriter = videoWriter;
        this.imageTimeout = imageTimeout;
        this.videoTimeout = videoTimeout;
        this.readbackTimeout = readbackTimeout;
    }

    public MetadataNormalizer(Path libraryRoot, MetadataWriter imageWriter, MetadataWriter videoWriter,
                              LibrarySettings settings) {
        this(libraryRoot, imageWriter, videoWriter,
                settings.getImageTimeout(), settings.getVideoTimeout(), settings.getReadbackTimeout());
    }

    /**
     * Builds a normalizer backed by exiftool and ffmpeg as configured in the settings.
     */
    public static MetadataNormalizer withExternalTools(Path libraryRoot, LibrarySettings settings) {
        ExternalToolRunner runner = new ExternalToolRunner(libraryRoot);
        return new MetadataNormalizer(libraryRoot,
                new ExifToolWriter(settings.getExiftoolPath(), runner),
                new FfmpegRemuxWriter(settings.getFfmpegPath(), settings.getFfprobePath(), runner),
                settings);
    }

    public List<MetadataWriter> getWriters() {
        return List.of(imageWriter, videoWriter);
    }

    /**
     * Rejects formats that are never rewritten, before any tool is called.
     *
     * @return The media type of a supported file.
     */
    public MediaType checkSupported(Path file) throws NormalizationException {
        String extension = FileUtils.getExtension(file);
        if (MediaFormats.RAW_EXTENSIONS.contains(extension)) {
            throw new NormalizationException(Disposition.UNSUPPORTED_FORMAT,
                    "RAW format ." + extension + " is not rewritten");
        }
        if (MediaFormats.UNSUPPORTED_VIDEO_EXTENSIONS.contains(extension)) {
            throw new NormalizationException(Disposition.UNSUPPORTED_FORMAT,
                    "Video container ." + extension + " cannot be remuxed safely");
        }
        MediaType type = MediaFormats.typeOf(extension);
        if (type == null) {
            throw new NormalizationException(Disposition.UNSUPPORTED_FORMAT,
                    "Not a media file: " + file.getFileName());
        }
        return type;
    }

    /**
     * Sets the embedded capture timestamp of {@code file} to {@code timestamp} (second precision).
     *
     * @throws NormalizationException carrying the failure category; the file is unchanged in that case.
     */
    public void normalize(Path file, LocalDateTime timestamp) throws NormalizationException {
        MediaType type = checkSupported(file);

        if (!Files.exists(file)) {
            throw new NormalizationException(Disposition.CORRUPTED, "File not found: " + file);
        }
        Path parent = file.toAbsolutePath().getParent();
        if (!Files.isReadable(file) || !Files.isWritable(file) || !Files.isWritable(parent)) {
            throw new NormalizationException(Disposition.PERMISSION_DENIED, "File is not writable: " + file);
        }

        MetadataWriter writer = type == MediaType.VIDEO ? videoWriter : imageWriter;
        Duration timeout = type == MediaType.VIDEO ? videoTimeout : imageTimeout;
        LocalDateTime target = timestamp.truncatedTo(ChronoUnit.SECONDS);

        String fileName = file.getFileName().toString();
        Path temp = parent.resolve("." + FileUtils.getBaseName(fileName) + ".normalizing."
                + FileUtils.getExtension(fileName));

        try {
            Files.deleteIfExists(temp);
            writer.writeCaptureDate(file, temp, target, timeout);

            if (!Files.exists(temp) || Files.size(temp) == 0) {
                throw new NormalizationException(Disposition.CORRUPTED,
                        writer.getToolName() + " produced no output for " + fileName);
            }

            LocalDateTime written = writer.readCaptureDate(temp, readbackTimeout);
            if (written == null || !target.equals(written.truncatedTo(ChronoUnit.SECONDS))) {
                throw new NormalizationException(Disposition.CORRUPTED,
                        "Verification failed for " + fileName + ": expected " + target + ", read back " + written);
            }

            replace(temp, file);
        } catch (AccessDeniedException e) {
            throw new NormalizationException(Disposition.PERMISSION_DENIED, "Access denied: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new NormalizationException(Disposition.CORRUPTED, "I/O error while normalizing "
                    + fileName + ": " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LibraryLogger.logError(libraryRoot, "MetadataNormalizer", "Failed to remove temporary file " + temp, e);
            }
        }
    }

    private void replace(Path temp, Path file) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
