package com.mediavault.service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes the SHA-256 content hash that identifies a file in the library.
 * Files are streamed, so memory use does not depend on file size.
 */
public class ContentHasher {

    private static final int HASH_BUFFER_SIZE = 1024 * 1024; // 1 MiB

    /**
     * Hashes the full byte content of the file.
     *
     * @param file The file to hash.
     * @return 64 lowercase hex characters.
     * @throws IOException if the file cannot be read.
     */
    public String hash(Path file) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[HASH_BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return toHex(digest.digest());
    }

    /**
     * Returns the prefix used in file names.
     */
    public static String shortHash(String contentHash, int length) {
        return contentHash.length() <= length ? contentHash : contentHash.substring(0, length);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
