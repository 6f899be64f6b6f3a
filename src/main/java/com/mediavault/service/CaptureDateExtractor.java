package com.mediavault.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.mov.QuickTimeDirectory;
import com.drew.metadata.mp4.Mp4Directory;
import com.mediavault.util.LibraryLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * Determines the capture date of a media file.
 * Embedded metadata wins; the file's last-modified time is the fallback.
 */
public class CaptureDateExtractor {

    // Container creation times at or before this are "unset" (QuickTime epoch is 1904)
    private static final LocalDateTime UNSET_BEFORE = LocalDateTime.of(1970, 1, 2, 0, 0);

    private final Path libraryRoot;

    public CaptureDateExtractor(Path libraryRoot) {
        this.libraryRoot = libraryRoot;
    }

    /**
     * Extracts the best available capture date for the given file, truncated to seconds.
     *
     * @param file The file to analyze.
     * @return The embedded capture date, or the file modification time when none is embedded.
     * @throws IOException if the file does not exist or its attributes cannot be read.
     */
    public LocalDateTime extractCaptureDate(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }

        LocalDateTime embedded = readEmbeddedDate(file);
        if (embedded != null) {
            return embedded.truncatedTo(ChronoUnit.SECONDS);
        }

        FileTime modified = Files.getLastModifiedTime(file);
        return LocalDateTime.ofInstant(modified.toInstant(), ZoneId.systemDefault()).truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Reads the embedded capture timestamp without any fallback.
     * Embedded values are wall-clock times, so they are read as UTC to keep the written text unchanged.
     *
     * @return The embedded date, or null when the file carries none or cannot be parsed.
     */
    public LocalDateTime readEmbeddedDate(Path file) {
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());

            Date date = firstDate(metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class),
                    ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
            if (date == null) {
                date = firstDate(metadata.getFirstDirectoryOfType(ExifIFD0Directory.class),
                        ExifIFD0Directory.TAG_DATETIME);
            }
            if (date == null) {
                date = firstDate(metadata.getFirstDirectoryOfType(QuickTimeDirectory.class),
                        QuickTimeDirectory.TAG_CREATION_TIME);
            }
            if (date == null) {
                date = firstDate(metadata.getFirstDirectoryOfType(Mp4Directory.class),
                        Mp4Directory.TAG_CREATION_TIME);
            }
            if (date == null) {
                return null;
            }

            LocalDateTime result = LocalDateTime.ofInstant(date.toInstant(), ZoneOffset.UTC);
            return result.isBefore(UNSET_BEFORE) ? null : result;
        } catch (Exception e) {
            // Missing or broken metadata is common, aggregate instead of flooding the log
            LibraryLogger.logRecurringError(libraryRoot, "CaptureDateExtractor",
                    "Failed to read embedded date", e);
            return null;
        }
    }

    private Date firstDate(Directory directory, int tagType) {
        if (directory == null) {
            return null;
        }
        return directory.getDate(tagType);
    }
}
