package com.mediavault.service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Computes the canonical location of an asset: {@code YYYY/YYYY-MM-DD/img_YYYYMMDD_<shortHash>.<ext>}.
 * Derivation is pure; only {@link #resolveAvailable} looks at what is already taken.
 */
public class PathDeriver {

    private static final DateTimeFormatter YEAR_FORMAT = DateTimeFormatter.ofPattern("yyyy");
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter COMPACT_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final String PREFIX = "img_";

    private final int shortHashLength;

    public PathDeriver() {
        this(8);
    }

    public PathDeriver(int shortHashLength) {
        if (shortHashLength < 1) {
            throw new IllegalArgumentException("Short hash length must be positive: " + shortHashLength);
        }
        this.shortHashLength = shortHashLength;
    }

    /**
     * Derives folder and file name from the capture date and content hash.
     *
     * @param extension With or without the leading dot, any case.
     */
    public DerivedPath derive(LocalDateTime capturedAt, String contentHash, String extension) {
        String folder = capturedAt.format(YEAR_FORMAT) + "/" + capturedAt.format(DAY_FORMAT);
        String baseName = PREFIX + capturedAt.format(COMPACT_FORMAT) + "_"
                + ContentHasher.shortHash(contentHash, shortHashLength);
        return new DerivedPath(folder, baseName, normalizeExtension(extension));
    }

    /**
     * Returns the derived relative path, or the first "_1", "_2", ... variant that is not occupied.
     *
     * @param occupied Tells whether a relative path is already taken by another file.
     */
    public String resolveAvailable(DerivedPath derived, Predicate<String> occupied) {
        String candidate = derived.relativePath();
        int counter = 1;
        while (occupied.test(candidate)) {
            candidate = derived.withCounter(counter).relativePath();
            counter++;
        }
        return candidate;
    }

    /**
     * Checks that a stored path is the derived path or one of its collision variants.
     */
    public boolean isCanonical(String currentPath, LocalDateTime capturedAt, String contentHash, String extension) {
        DerivedPath derived = derive(capturedAt, contentHash, extension);
        if (derived.relativePath().equals(currentPath)) {
            return true;
        }
        String pattern = Pattern.quote(derived.getFolder() + "/" + derived.getBaseName()) + "_\\d+"
                + Pattern.quote(derived.getExtensionSuffix());
        return currentPath.matches(pattern);
    }

    private static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        return ext.toLowerCase();
    }

    /**
     * Folder and file name of a derived location, both relative to the library root.
     */
    public static final class DerivedPath {
        private final String folder;
        private final String baseName;
        private final String extension;

        DerivedPath(String folder, String baseName, String extension) {
            this.folder = folder;
            this.baseName = baseName;
            this.extension = extension;
        }

        public String getFolder() {
            return folder;
        }

        public String getBaseName() {
            return baseName;
        }

        public String getFilename() {
            return baseName + getExtensionSuffix();
        }

        String getExtensionSuffix() {
            return extension.isEmpty() ? "" : "." + extension;
        }

        public String relativePath() {
            return folder + "/" + getFilename();
        }

        DerivedPath withCounter(int counter) {
            return new DerivedPath(folder, baseName + "_" + counter, extension);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DerivedPath)) return false;
            DerivedPath that = (DerivedPath) o;
            return folder.equals(that.folder) && baseName.equals(that.baseName) && extension.equals(that.extension);
        }

        @Override
        public int hashCode() {
            return relativePath().hashCode();
        }

        @Override
        public String toString() {
            return relativePath();
        }
    }
}
