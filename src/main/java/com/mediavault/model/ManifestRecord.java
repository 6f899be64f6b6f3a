package com.mediavault.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * One line of a terraform manifest (newline-delimited JSON, append-only).
 * Null fields are omitted so each line only carries what its event needs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ManifestRecord {

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("event")
    private ManifestEvent event;

    @JsonProperty("original_path")
    private String originalPath;

    @JsonProperty("new_path")
    private String newPath;

    @JsonProperty("hash")
    private String hash;

    @JsonProperty("phase")
    private String phase;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("category")
    private Disposition category;

    @JsonProperty("total")
    private Integer total;

    @JsonProperty("processed")
    private Integer processed;

    @JsonProperty("duplicates")
    private Integer duplicates;

    @JsonProperty("errors")
    private Integer errors;

    @JsonProperty("skipped")
    private Integer skipped;

    // For Jackson
    public ManifestRecord() {
    }

    public ManifestRecord(ManifestEvent event) {
        this.event = event;
        this.timestamp = LocalDateTime.now().toString();
    }

    public static ManifestRecord start(String root) {
        ManifestRecord record = new ManifestRecord(ManifestEvent.START);
        record.originalPath = root;
        return record;
    }

    public static ManifestRecord processing(String phase, String originalPath, String newPath) {
        ManifestRecord record = new ManifestRecord(ManifestEvent.PROCESSING);
        record.phase = phase;
        record.originalPath = originalPath;
        record.newPath = newPath;
        return record;
    }

    public static ManifestRecord success(String originalPath, String newPath, String hash) {
        ManifestRecord record = new ManifestRecord(ManifestEvent.SUCCESS);
        record.originalPath = originalPath;
        record.newPath = newPath;
        record.hash = hash;
        return record;
    }

    public static ManifestRecord failed(String originalPath, String newPath, Disposition category, String reason) {
        ManifestRecord record = new ManifestRecord(ManifestEvent.FAILED);
        record.originalPath = originalPath;
        record.newPath = newPath;
        record.category = category;
        record.reason = reason;
        return record;
    }

    public static ManifestRecord skipped(String originalPath, String newPath, String reason) {
        ManifestRecord record = new ManifestRecord(ManifestEvent.SKIPPED);
        record.originalPath = originalPath;
        record.newPath = newPath;
        record.category = Disposition.RAW_SKIPPED;
        record.reason = reason;
        return record;
    }

    public static ManifestRecord complete(OperationSummary summary) {
        ManifestRecord record = new ManifestRecord(ManifestEvent.COMPLETE);
        record.processed = summary.getProcessed();
        record.duplicates = summary.getDuplicates();
        record.errors = summary.getErrors();
        record.skipped = summary.getSkipped();
        return record;
    }

    public String getTimestamp() { return timestamp; }
    public ManifestEvent getEvent() { return event; }
    public String getOriginalPath() { return originalPath; }
    public String getNewPath() { return newPath; }
    public String getHash() { return hash; }
    public String getPhase() { return phase; }
    public String getReason() { return reason; }
    public Disposition getCategory() { return category; }
    public Integer getTotal() { return total; }
    public Integer getProcessed() { return processed; }
    public Integer getDuplicates() { return duplicates; }
    public Integer getErrors() { return errors; }
    public Integer getSkipped() { return skipped; }

    public void setTotal(Integer total) {
        this.total = total;
    }
}
