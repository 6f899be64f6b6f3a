package com.mediavault.util;

import com.mediavault.model.MediaType;

import java.nio.file.Path;
import java.util.Set;

/**
 * Known media extensions and the policy attached to each group.
 * All extensions are lowercase, without the leading dot.
 */
public class MediaFormats {

    public static final Set<String> IMAGE_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "gif", "bmp", "tiff", "tif", "webp",
            "heic", "heif", "avif", "jp2"
    );

    // Proprietary camera formats: never rewritten, routed to raw_skipped
    public static final Set<String> RAW_EXTENSIONS = Set.of(
            "raw", "cr2", "cr3", "nef", "arw", "dng", "orf", "rw2", "raf"
    );

    public static final Set<String> VIDEO_EXTENSIONS = Set.of(
            "mov", "mp4", "m4v", "mkv", "webm", "flv", "3gp",
            "wmv", "mpg", "mpeg", "vob", "ts", "mts", "avi"
    );

    // Containers where a stream-copy remux risks corruption or needs re-encoding
    public static final Set<String> UNSUPPORTED_VIDEO_EXTENSIONS = Set.of(
            "mpg", "mpeg", "vob", "ts", "mts", "avi", "wmv"
    );

    private MediaFormats() {
    }

    public static boolean isMedia(String extension) {
        return IMAGE_EXTENSIONS.contains(extension)
                || RAW_EXTENSIONS.contains(extension)
                || VIDEO_EXTENSIONS.contains(extension);
    }

    public static boolean isMedia(Path file) {
        return isMedia(FileUtils.getExtension(file));
    }

    public static boolean isRaw(Path file) {
        return RAW_EXTENSIONS.contains(FileUtils.getExtension(file));
    }

    public static boolean isUnsupportedVideo(Path file) {
        return UNSUPPORTED_VIDEO_EXTENSIONS.contains(FileUtils.getExtension(file));
    }

    /**
     * Returns the media type for an extension, or null when it is not a media file.
     * RAW formats count as images.
     */
    public static MediaType typeOf(String extension) {
        if (VIDEO_EXTENSIONS.contains(extension)) {
            return MediaType.VIDEO;
        }
        if (IMAGE_EXTENSIONS.contains(extension) || RAW_EXTENSIONS.contains(extension)) {
            return MediaType.IMAGE;
        }
        return null;
    }

    public static MediaType typeOf(Path file) {
        return typeOf(FileUtils.getExtension(file));
    }
}
