package com.mediavault.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressEventType {
    START, PROGRESS, REJECTED, COMPLETE, ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** Complete and error end a stream. */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }
}
