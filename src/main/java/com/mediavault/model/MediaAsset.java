package com.mediavault.model;

import java.time.LocalDateTime;

/**
 * An active asset of the library: one file, one distinct content hash.
 * This is a lightweight POJO used to transfer data between layers.
 */
public class MediaAsset {
    private Long id;
    private String contentHash; // Full SHA-256, lowercase hex
    private String currentPath; // Relative to the library root, "/" separated
    private String originalFilename;
    private LocalDateTime capturedAt;
    private MediaType fileType;
    private Integer width;
    private Integer height;
    private long byteSize;

    public MediaAsset(String contentHash, String currentPath, String originalFilename,
                      LocalDateTime capturedAt, MediaType fileType, long byteSize) {
        this.contentHash = contentHash;
        this.currentPath = currentPath;
        this.originalFilename = originalFilename;
        this.capturedAt = capturedAt;
        this.fileType = fileType;
        this.byteSize = byteSize;
    }

    public Long getId() { return id; }
    public String getContentHash() { return contentHash; }
    public String getCurrentPath() { return currentPath; }
    public String getOriginalFilename() { return originalFilename; }
    public LocalDateTime getCapturedAt() { return capturedAt; }
    public MediaType getFileType() { return fileType; }
    public Integer getWidth() { return width; }
    public Integer getHeight() { return height; }
    public long getByteSize() { return byteSize; }

    public void setId(Long id) {
        this.id = id;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public void setCurrentPath(String currentPath) {
        this.currentPath = currentPath;
    }

    public void setCapturedAt(LocalDateTime capturedAt) {
        this.capturedAt = capturedAt;
    }

    public void setDimensions(Integer width, Integer height) {
        this.width = width;
        this.height = height;
    }

    public void setByteSize(long byteSize) {
        this.byteSize = byteSize;
    }

    @Override
    public String toString() {
        return "MediaAsset{id=" + id + ", path='" + currentPath + "', hash='" + contentHash + "'}";
    }
}
