package com.mediavault.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ManifestEvent {
    START, PROCESSING, SUCCESS, FAILED, SKIPPED, COMPLETE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** True for the records that close a file's entry in the log. */
    public boolean isOutcome() {
        return this == SUCCESS || this == FAILED || this == SKIPPED;
    }
}
