package com.mediavault.repository;

/**
 * Raised when a write would give two active assets the same content hash.
 */
public class DuplicateHashException extends DatabaseException {

    private final String contentHash;

    public DuplicateHashException(String contentHash, Throwable cause) {
        super("An active asset already has hash " + contentHash, cause);
        this.contentHash = contentHash;
    }

    public String getContentHash() {
        return contentHash;
    }
}
