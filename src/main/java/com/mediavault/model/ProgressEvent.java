package com.mediavault.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One typed event of the progress protocol: start, progress, rejected, complete or error.
 * Fields that do not apply to the event type are null and left out of the JSON form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressEvent {
    private final ProgressEventType type;
    private Integer total;
    private Integer current;
    private Integer processed;
    private Integer duplicates;
    private Integer errors;
    private String file;
    private String sourcePath;
    private String reason;
    private Disposition category;
    private OperationSummary summary;
    private String message;

    private ProgressEvent(ProgressEventType type) {
        this.type = type;
    }

    public static ProgressEvent start(int total) {
        ProgressEvent event = new ProgressEvent(ProgressEventType.START);
        event.total = total;
        return event;
    }

    public static ProgressEvent progress(int current, int total, String file, OperationSummary summary) {
        ProgressEvent event = new ProgressEvent(ProgressEventType.PROGRESS);
        event.current = current;
        event.total = total;
        event.file = file;
        event.processed = summary.getProcessed();
        event.duplicates = summary.getDuplicates();
        event.errors = summary.getErrors();
        return event;
    }

    public static ProgressEvent rejected(Rejection rejection) {
        ProgressEvent event = new ProgressEvent(ProgressEventType.REJECTED);
        event.file = rejection.getFile();
        event.sourcePath = rejection.getSourcePath();
        event.reason = rejection.getMessage();
        event.category = rejection.getCategory();
        return event;
    }

    public static ProgressEvent complete(OperationSummary summary) {
        ProgressEvent event = new ProgressEvent(ProgressEventType.COMPLETE);
        event.summary = summary;
        event.processed = summary.getProcessed();
        event.duplicates = summary.getDuplicates();
        event.errors = summary.getErrors();
        return event;
    }

    public static ProgressEvent error(String message) {
        ProgressEvent event = new ProgressEvent(ProgressEventType.ERROR);
        event.message = message;
        return event;
    }

    @JsonProperty("type")
    public ProgressEventType getType() { return type; }

    @JsonProperty("total")
    public Integer getTotal() { return total; }

    @JsonProperty("current")
    public Integer getCurrent() { return current; }

    @JsonProperty("processed")
    public Integer getProcessed() { return processed; }

    @JsonProperty("duplicates")
    public Integer getDuplicates() { return duplicates; }

    @JsonProperty("errors")
    public Integer getErrors() { return errors; }

    @JsonProperty("file")
    public String getFile() { return file; }

    @JsonProperty("source_path")
    public String getSourcePath() { return sourcePath; }

    @JsonProperty("reason")
    public String getReason() { return reason; }

    @JsonProperty("category")
    public Disposition getCategory() { return category; }

    @JsonProperty("summary")
    public OperationSummary getSummary() { return summary; }

    @JsonProperty("message")
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "ProgressEvent{" + type.wireName()
                + (file != null ? ", file=" + file : "")
                + (category != null ? ", category=" + category.wireName() : "")
                + (message != null ? ", message=" + message : "")
                + "}";
    }
}
