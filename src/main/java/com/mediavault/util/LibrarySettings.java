package com.mediavault.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Per-library settings stored in {@code <root>/.mediavault/settings.json}.
 * Every key has a default, so a missing or partial file is valid.
 * Uses Jackson for JSON serialization/deserialization.
 */
public class LibrarySettings {

    public static final String INTERNAL_DIR = ".mediavault";
    private static final String SETTINGS_FILE = "settings.json";

    private final Path libraryRoot;
    private final File settingsFile;
    private final ObjectMapper mapper;
    private ObjectNode rootNode;

    public LibrarySettings(Path libraryRoot) {
        this.libraryRoot = libraryRoot;
        this.settingsFile = libraryRoot.resolve(INTERNAL_DIR).resolve(SETTINGS_FILE).toFile();
        this.mapper = new ObjectMapper();
        loadSettings();
    }

    private void loadSettings() {
        if (settingsFile.exists()) {
            try {
                JsonNode node = mapper.readTree(settingsFile);
                if (node instanceof ObjectNode) {
                    rootNode = (ObjectNode) node;
                    return;
                }
                LibraryLogger.logWarning(libraryRoot, "LibrarySettings", "Settings file is not a JSON object, using defaults");
            } catch (IOException e) {
                LibraryLogger.logError(libraryRoot, "LibrarySettings", "Failed to read settings, using defaults", e);
            }
        }
        rootNode = mapper.createObjectNode();
    }

    // --- External tools ---

    public String getExiftoolPath() {
        return getText("exiftool_path", "exiftool");
    }

    public void setExiftoolPath(String path) {
        rootNode.put("exiftool_path", path);
        save();
    }

    public String getFfmpegPath() {
        return getText("ffmpeg_path", "ffmpeg");
    }

    public void setFfmpegPath(String path) {
        rootNode.put("ffmpeg_path", path);
        save();
    }

    public String getFfprobePath() {
        return getText("ffprobe_path", "ffprobe");
    }

    public void setFfprobePath(String path) {
        rootNode.put("ffprobe_path", path);
        save();
    }

    // --- Timeouts ---

    public Duration getImageTimeout() {
        return Duration.ofSeconds(getInt("image_timeout_seconds", 30));
    }

    public Duration getVideoTimeout() {
        return Duration.ofSeconds(getInt("video_timeout_seconds", 120));
    }

    public Duration getReadbackTimeout() {
        return Duration.ofSeconds(getInt("readback_timeout_seconds", 10));
    }

    public void setTimeouts(int imageSeconds, int videoSeconds, int readbackSeconds) {
        rootNode.put("image_timeout_seconds", imageSeconds);
        rootNode.put("video_timeout_seconds", videoSeconds);
        rootNode.put("readback_timeout_seconds", readbackSeconds);
        save();
    }

    // --- Pre-flight ---

    public int getMinFreeSpacePercent() {
        return getInt("min_free_space_percent", 10);
    }

    public void setMinFreeSpacePercent(int percent) {
        rootNode.put("min_free_space_percent", percent);
        save();
    }

    // --- Progress throttle ---

    public int getProgressEveryFiles() {
        return getInt("progress_every_files", 25);
    }

    public long getProgressIntervalMillis() {
        return getInt("progress_interval_millis", 500);
    }

    public void setProgressThrottle(int everyFiles, int intervalMillis) {
        rootNode.put("progress_every_files", everyFiles);
        rootNode.put("progress_interval_millis", intervalMillis);
        save();
    }

    // --- Library layout ---

    public int getCleanupMaxPasses() {
        return getInt("cleanup_max_passes", 25);
    }

    public int getShortHashLength() {
        return getInt("short_hash_length", 8);
    }

    public boolean isSkipRawFiles() {
        if (rootNode.has("skip_raw_files")) {
            return rootNode.get("skip_raw_files").asBoolean();
        }
        return true;
    }

    public void setSkipRawFiles(boolean skip) {
        rootNode.put("skip_raw_files", skip);
        save();
    }

    public Duration getSequenceInterval() {
        return Duration.ofSeconds(getInt("sequence_interval_seconds", 300));
    }

    private String getText(String key, String defaultValue) {
        if (rootNode.has(key) && !rootNode.get(key).asText().isBlank()) {
            return rootNode.get(key).asText();
        }
        return defaultValue;
    }

    private int getInt(String key, int defaultValue) {
        if (rootNode.has(key) && rootNode.get(key).canConvertToInt()) {
            return rootNode.get(key).asInt();
        }
        return defaultValue;
    }

    /**
     * Writes the current settings back to disk, pretty-printed.
     */
    public void save() {
        try {
            File parent = settingsFile.getParentFile();
            if (!parent.exists() && !parent.mkdirs()) {
                throw new IOException("Could not create settings directory: " + parent.getAbsolutePath());
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(settingsFile, rootNode);
        } catch (IOException e) {
            LibraryLogger.logError(libraryRoot, "LibrarySettings", "Failed to save settings", e);
        }
    }
}
