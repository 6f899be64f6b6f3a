package com.mediavault.service.ingest;

/**
 * How a source file enters the staging area.
 */
public enum StagingMode {
    /** The source stays untouched (import). */
    COPY,
    /** The source is moved (terraform reorganizes in place). */
    MOVE
}
