package com.mediavault.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One file that did not make it into the library, as reported to the caller.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Rejection {
    private final String file;
    private final String sourcePath;
    private final Disposition category;
    private final String message;
    private final String trashPath;

    public Rejection(String file, String sourcePath, Disposition category, String message, String trashPath) {
        this.file = file;
        this.sourcePath = sourcePath;
        this.category = category;
        this.message = message;
        this.trashPath = trashPath;
    }

    @JsonProperty("file")
    public String getFile() { return file; }

    @JsonProperty("source_path")
    public String getSourcePath() { return sourcePath; }

    @JsonProperty("category")
    public Disposition getCategory() { return category; }

    @JsonProperty("message")
    public String getMessage() { return message; }

    @JsonProperty("trash_path")
    public String getTrashPath() { return trashPath; }
}
