package com.mediavault.model;

import java.time.LocalDateTime;

/**
 * Record of a file moved to the trash instead of being discarded. Never mutated.
 */
public class TrashEntry {
    private final Long id;
    private final String originalPath;
    private final String trashPath;
    private final Disposition category;
    private final String message;
    private final LocalDateTime timestamp;

    public TrashEntry(Long id, String originalPath, String trashPath, Disposition category,
                      String message, LocalDateTime timestamp) {
        this.id = id;
        this.originalPath = originalPath;
        this.trashPath = trashPath;
        this.category = category;
        this.message = message;
        this.timestamp = timestamp;
    }

    public TrashEntry(String originalPath, String trashPath, Disposition category, String message) {
        this(null, originalPath, trashPath, category, message, LocalDateTime.now());
    }

    public Long getId() { return id; }
    public String getOriginalPath() { return originalPath; }
    public String getTrashPath() { return trashPath; }
    public Disposition getCategory() { return category; }
    public String getMessage() { return message; }
    public LocalDateTime getTimestamp() { return timestamp; }
}
