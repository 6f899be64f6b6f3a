package com.mediavault.service.terraform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediavault.model.ManifestRecord;
import com.mediavault.util.FileUtils;
import com.mediavault.util.LibraryLogger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only, newline-delimited JSON log of one terraform run, named after its start time.
 * Each record is synced to disk before the mutation it announces is attempted.
 */
public class ManifestLog {

    public static final String FILE_PREFIX = "terraform_";
    public static final String FILE_SUFFIX = ".jsonl";
    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private int recordCount;

    private ManifestLog(Path file) {
        this.file = file;
    }

    /**
     * Creates the manifest file for a run starting at {@code startedAt}.
     */
    public static ManifestLog create(Path logsDir, LocalDateTime startedAt) throws IOException {
        Files.createDirectories(logsDir);
        Path file = FileUtils.uniqueTarget(logsDir, FILE_PREFIX + startedAt.format(NAME_FORMAT) + FILE_SUFFIX);
        Files.createFile(file);
        return new ManifestLog(file);
    }

    /**
     * Appends one record and syncs it.
     *
     * @throws UncheckedIOException if the record cannot be written; the run must not go on without it.
     */
    public synchronized void append(ManifestRecord record) {
        try {
            String line = MAPPER.writeValueAsString(record) + "\n";
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.APPEND, StandardOpenOption.WRITE, StandardOpenOption.DSYNC);
            recordCount++;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write manifest " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    public int getRecordCount() {
        return recordCount;
    }

    /**
     * All manifests in the logs folder, oldest first.
     */
    public static List<Path> findManifests(Path logsDir) throws IOException {
        if (!Files.isDirectory(logsDir)) {
            return new ArrayList<>();
        }
        try (Stream<Path> files = Files.list(logsDir)) {
            return files
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(FILE_PREFIX) && name.endsWith(FILE_SUFFIX);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Reads every record of a manifest. A line cut short by a crash is skipped.
     */
    public static List<ManifestRecord> read(Path file, Path libraryRoot) throws IOException {
        List<ManifestRecord> records = new ArrayList<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(MAPPER.readValue(line, ManifestRecord.class));
            } catch (JsonProcessingException e) {
                LibraryLogger.logWarning(libraryRoot, "ManifestLog",
                        "Skipping unreadable line in " + file.getFileName() + ": " + e.getOriginalMessage());
            }
        }
        return records;
    }
}
