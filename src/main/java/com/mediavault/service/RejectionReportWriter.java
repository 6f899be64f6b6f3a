package com.mediavault.service;

import com.mediavault.model.Disposition;
import com.mediavault.model.OperationSummary;
import com.mediavault.model.Rejection;
import com.mediavault.util.FileUtils;
import com.mediavault.util.LibraryLogger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Exports the rejected files of a run so the user can look at them outside the library.
 * Each export is a fresh {@code rejected_<timestamp>} folder holding copies plus a {@code _REPORT.txt}.
 */
public class RejectionReportWriter {

    private static final String CONTEXT = "RejectionReportWriter";
    public static final String REPORT_FILE = "_REPORT.txt";
    private static final DateTimeFormatter FOLDER_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final LibraryContext context;

    public RejectionReportWriter(LibraryContext context) {
        this.context = context;
    }

    /**
     * @return The export folder that was created.
     */
    public Path export(OperationSummary summary, Path destination) throws IOException {
        Path folder = FileUtils.uniqueTarget(destination,
                "rejected_" + LocalDateTime.now().format(FOLDER_FORMAT));
        Files.createDirectories(folder);

        Map<Disposition, List<String>> lines = new EnumMap<>(Disposition.class);
        int copied = 0;
        for (Rejection rejection : summary.getRejections()) {
            Path copy = null;
            Path source = locate(rejection);
            if (source != null) {
                copy = FileUtils.uniqueTarget(folder, rejection.getFile());
                try {
                    FileUtils.copyFile(source, copy);
                    copied++;
                } catch (IOException e) {
                    LibraryLogger.logError(context.getRoot(), CONTEXT, "Could not copy " + source, e);
                    copy = null;
                }
            }
            String line = rejection.getFile()
                    + (copy != null && !copy.getFileName().toString().equals(rejection.getFile())
                        ? " (saved as " + copy.getFileName() + ")" : "")
                    + (copy == null ? " (not copied)" : "")
                    + System.lineSeparator() + "    Reason: " + rejection.getMessage()
                    + System.lineSeparator() + "    Source: " + rejection.getSourcePath();
            lines.computeIfAbsent(rejection.getCategory(), k -> new ArrayList<>()).add(line);
        }

        try (BufferedWriter writer = Files.newBufferedWriter(folder.resolve(REPORT_FILE), StandardCharsets.UTF_8)) {
            writer.write("Rejected files: " + summary.getRejections().size());
            writer.newLine();
            writer.write("Generated: " + LocalDateTime.now().withNano(0));
            writer.newLine();
            for (Map.Entry<Disposition, List<String>> group : lines.entrySet()) {
                writer.newLine();
                writer.write("== " + group.getKey().wireName() + " (" + group.getValue().size() + ") ==");
                writer.newLine();
                for (String line : group.getValue()) {
                    writer.write(line);
                    writer.newLine();
                }
            }
        }

        LibraryLogger.logInfo(context.getRoot(), CONTEXT,
                "Exported " + copied + " of " + summary.getRejections().size() + " rejected files to " + folder);
        return folder;
    }

    // The trashed copy first, the source otherwise
    private Path locate(Rejection rejection) {
        if (rejection.getTrashPath() != null) {
            Path trashed = context.resolve(rejection.getTrashPath());
            if (Files.isRegularFile(trashed)) {
                return trashed;
            }
        }
        if (rejection.getSourcePath() != null) {
            Path source = Path.of(rejection.getSourcePath());
            if (!source.isAbsolute()) {
                source = context.resolve(rejection.getSourcePath());
            }
            if (Files.isRegularFile(source)) {
                return source;
            }
        }
        return null;
    }
}
