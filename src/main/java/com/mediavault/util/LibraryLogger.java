package com.mediavault.util;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Static logger writing {@code [time] [LEVEL] [Context] message} lines to
 * {@code <library>/.logs/application.log}.
 *
 * <p>All writes of the process go through one monitor, so lines from the operation worker and
 * from the caller never mix. The file is rolled over to {@code application.log.old} past 5 MB.
 * Errors logged through {@link #logRecurringError} are written once and counted until
 * {@link #flush(Path)}.</p>
 */
public class LibraryLogger {

    public static final String LOG_DIR = ".logs";

    private static final Object WRITE_MONITOR = new Object();
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String CURRENT_LOG = "application.log";
    private static final String ROLLED_LOG = "application.log.old";
    private static final long ROLLOVER_BYTES = 5L * 1024 * 1024;

    // library root -> error key -> occurrences since the last flush
    private static final Map<Path, Map<String, AtomicInteger>> PENDING_REPEATS = new ConcurrentHashMap<>();

    private LibraryLogger() {
    }

    /**
     * @param libraryRoot Root of the library whose log receives the line; null disables logging.
     * @param context     Name of the component writing, e.g. "TerraformOrchestrator".
     * @param error       Optional cause, written with its stack trace.
     */
    public static void logError(Path libraryRoot, String context, String message, Throwable error) {
        append(libraryRoot, "ERROR", context, message, error, true);
    }

    /**
     * Same as {@link #logError}, but only into a log folder that already exists. Otherwise the line
     * goes to stderr, so a library that was never touched stays untouched.
     */
    public static void logErrorIfLogExists(Path libraryRoot, String context, String message, Throwable error) {
        append(libraryRoot, "ERROR", context, message, error, false);
    }

    public static void logWarning(Path libraryRoot, String context, String message) {
        append(libraryRoot, "WARN", context, message, null, true);
    }

    public static void logInfo(Path libraryRoot, String context, String message) {
        append(libraryRoot, "INFO", context, message, null, true);
    }

    /**
     * For errors that may hit every file of a batch: only the first occurrence of a given
     * context, message and exception is written, the rest are counted for {@link #flush(Path)}.
     */
    public static void logRecurringError(Path libraryRoot, String context, String message, Throwable error) {
        if (libraryRoot == null) {
            return;
        }
        AtomicInteger seen = PENDING_REPEATS
                .computeIfAbsent(libraryRoot, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(errorKey(context, message, error), k -> new AtomicInteger());
        if (seen.getAndIncrement() == 0) {
            append(libraryRoot, "ERROR", context, message, error, true);
        }
    }

    /**
     * Writes one line per recurring error that was suppressed since the last call, then forgets them.
     */
    public static void flush(Path libraryRoot) {
        if (libraryRoot == null) {
            return;
        }
        Map<String, AtomicInteger> repeats = PENDING_REPEATS.remove(libraryRoot);
        if (repeats == null) {
            return;
        }
        repeats.forEach((key, seen) -> {
            int suppressed = seen.get() - 1;
            if (suppressed > 0) {
                append(libraryRoot, "REPEAT", "LibraryLogger",
                        key + " (repeated " + suppressed + " more times)", null, true);
            }
        });
    }

    private static String errorKey(String context, String message, Throwable error) {
        String key = "[" + context + "] " + message;
        if (error == null) {
            return key;
        }
        key += " | " + error.getClass().getName();
        return error.getMessage() == null ? key : key + ": " + error.getMessage();
    }

    static String formatLine(String level, String context, String message, Throwable error) {
        StringBuilder line = new StringBuilder()
                .append('[').append(LocalDateTime.now().format(TIMESTAMP)).append("] ")
                .append('[').append(level).append("] ")
                .append('[').append(context).append("] ")
                .append(message)
                .append(System.lineSeparator());
        if (error != null) {
            StringWriter trace = new StringWriter();
            error.printStackTrace(new PrintWriter(trace));
            line.append(trace);
        }
        return line.toString();
    }

    private static void append(Path libraryRoot, String level, String context, String message, Throwable error,
                               boolean createLogDir) {
        if (libraryRoot == null) {
            return;
        }
        String line = formatLine(level, context, message, error);
        Path logDir = libraryRoot.resolve(LOG_DIR);

        synchronized (WRITE_MONITOR) {
            if (!createLogDir && !Files.isDirectory(logDir)) {
                System.err.print(line);
                return;
            }
            try {
                Files.createDirectories(logDir);
                Path current = logDir.resolve(CURRENT_LOG);
                if (Files.exists(current) && Files.size(current) > ROLLOVER_BYTES) {
                    Files.move(current, logDir.resolve(ROLLED_LOG), StandardCopyOption.REPLACE_EXISTING);
                }
                Files.writeString(current, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                // Unwritable library: stderr is all that is left
                System.err.print(line);
                e.printStackTrace();
            }
        }
    }
}
