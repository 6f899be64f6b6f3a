package com.mediavault.service;

import com.mediavault.model.Disposition;
import com.mediavault.model.TrashEntry;
import com.mediavault.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Moves rejected files into {@code .trash/<category>/} and records a {@link TrashEntry} for each.
 * Names are kept; collisions get a "_1", "_2", ... suffix.
 */
public class TrashManager {

    private final LibraryContext context;

    public TrashManager(LibraryContext context) {
        this.context = context;
    }

    /**
     * Picks a free destination for a file in the category folder. Nothing is written; the folder
     * is created by {@link #move} or {@link #copy}.
     */
    public Path targetFor(Disposition category, String fileName) {
        return FileUtils.uniqueTarget(context.getTrashDir().resolve(category.wireName()), fileName);
    }

    /**
     * Moves the file to {@code target} (from {@link #targetFor}) and records the entry.
     *
     * @param originalPath Where the file came from, as shown to the user.
     */
    public TrashEntry move(Path file, Path target, Disposition category, String originalPath, String message)
            throws IOException {
        FileUtils.moveFile(file, target);
        return record(target, category, originalPath, message);
    }

    /**
     * Copies the file to {@code target}, leaving the source in place, and records the entry.
     */
    public TrashEntry copy(Path file, Path target, Disposition category, String originalPath, String message)
            throws IOException {
        FileUtils.copyFile(file, target);
        return record(target, category, originalPath, message);
    }

    private TrashEntry record(Path target, Disposition category, String originalPath, String message) {
        return context.getStore().recordTrashEntry(
                new TrashEntry(originalPath, context.relativize(target), category, message));
    }
}
